package com.venue.linkage.geo;

import com.venue.linkage.core.model.Coordinates;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SearchWindowTest {

    @ParameterizedTest
    @DisplayName("Window never excludes a point within the radius")
    @ValueSource(doubles = {0.0, 51.5, -33.9, 70.0, 85.0, 89.99})
    void testPruningSoundness(double latitude) {
        Random random = new Random(7L + (long) (latitude * 100));
        double radius = 500.0;

        for (int i = 0; i < 20_000; i++) {
            double lng = random.nextDouble() * 360.0 - 180.0;
            Coordinates center = Coordinates.of(latitude, lng);
            SearchWindow window = SearchWindow.around(center, radius);

            Coordinates point = destination(center, random.nextDouble() * 360.0, random.nextDouble() * radius);
            if (Haversine.distanceMeters(center, point) <= radius) {
                assertTrue(window.contains(point), "window " + window + " excluded " + point);
            }
        }
    }

    @Test
    @DisplayName("Window is sound for points exactly on the radius")
    void testBoundaryPoints() {
        Random random = new Random(11);
        for (int i = 0; i < 5_000; i++) {
            Coordinates center = Coordinates.of(random.nextDouble() * 170.0 - 85.0, random.nextDouble() * 360.0 - 180.0);
            double radius = 10.0 + random.nextDouble() * 5_000.0;
            SearchWindow window = SearchWindow.around(center, radius);

            Coordinates point = destination(center, random.nextDouble() * 360.0, radius * 0.999999);
            assertTrue(window.contains(point), "window " + window + " excluded " + point);
        }
    }

    @Test
    @DisplayName("Window excludes points far outside the radius")
    void testExcludesFarPoints() {
        Coordinates center = Coordinates.of(51.5007, -0.1246);
        SearchWindow window = SearchWindow.around(center, 500.0);

        assertFalse(window.contains(Coordinates.of(51.5277, -0.1246)));
        assertFalse(window.contains(Coordinates.of(51.5007, -0.0800)));
        assertFalse(window.contains(null));
    }

    @Test
    @DisplayName("Longitude band widens with latitude")
    void testLongitudeForeshortening() {
        SearchWindow equator = SearchWindow.around(Coordinates.of(0.0, 0.0), 1_000.0);
        SearchWindow london = SearchWindow.around(Coordinates.of(51.5, 0.0), 1_000.0);

        assertEquals(equator.latitudeDelta(), london.latitudeDelta(), 1e-12);
        assertTrue(london.longitudeDelta() > equator.longitudeDelta() * 1.5);
    }

    @Test
    @DisplayName("Near the poles every longitude is inside the window")
    void testPolarWindow() {
        SearchWindow window = SearchWindow.around(Coordinates.of(89.999, 10.0), 500.0);
        assertEquals(180.0, window.longitudeDelta(), 0.0);
        assertTrue(window.contains(Coordinates.of(89.999, -170.0)));
    }

    @Test
    @DisplayName("Window wraps across the antimeridian")
    void testAntimeridianWrap() {
        SearchWindow window = SearchWindow.around(Coordinates.of(0.0, 179.999), 500.0);
        assertTrue(window.contains(Coordinates.of(0.0, -179.999)));
        assertEquals(0.002, SearchWindow.longitudeDifference(179.999, -179.999), 1e-9);
    }

    @Test
    @DisplayName("Union keeps the larger extent in each direction")
    void testUnion() {
        Coordinates center = Coordinates.of(51.5, -0.12);
        SearchWindow union = new SearchWindow(center, 0.01, 0.001).union(new SearchWindow(center, 0.002, 0.02));

        assertEquals(0.01, union.latitudeDelta(), 0.0);
        assertEquals(0.02, union.longitudeDelta(), 0.0);
    }

    @Test
    @DisplayName("Should reject invalid parameters")
    void testValidation() {
        Coordinates center = Coordinates.of(0, 0);
        assertThrows(IllegalArgumentException.class, () -> SearchWindow.around(center, -1.0));
        assertThrows(IllegalArgumentException.class, () -> SearchWindow.around(center, 100.0, 0.5));
        assertThrows(IllegalArgumentException.class, () -> new SearchWindow(center, -0.1, 0.1));
    }

    /**
     * Point reached by travelling {@code meters} from {@code start} on the given bearing.
     */
    static Coordinates destination(Coordinates start, double bearingDegrees, double meters) {
        double delta = meters / Haversine.EARTH_RADIUS_METERS;
        double theta = Math.toRadians(bearingDegrees);
        double phi1 = Math.toRadians(start.latitude());
        double lambda1 = Math.toRadians(start.longitude());

        double sinPhi2 = Math.sin(phi1) * Math.cos(delta) + Math.cos(phi1) * Math.sin(delta) * Math.cos(theta);
        double phi2 = Math.asin(Math.max(-1.0, Math.min(1.0, sinPhi2)));
        double lambda2 = lambda1 + Math.atan2(Math.sin(theta) * Math.sin(delta) * Math.cos(phi1),
                Math.cos(delta) - Math.sin(phi1) * sinPhi2);

        double lng = Math.toDegrees(lambda2);
        lng = ((lng + 540.0) % 360.0) - 180.0;
        return Coordinates.of(Math.toDegrees(phi2), lng);
    }
}
