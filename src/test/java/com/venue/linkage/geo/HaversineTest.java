package com.venue.linkage.geo;

import com.venue.linkage.core.model.Coordinates;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HaversineTest {

    @Test
    @DisplayName("Distance from a point to itself is zero")
    void testZeroDistance() {
        Coordinates point = Coordinates.of(51.5007, -0.1246);
        assertEquals(0.0, Haversine.distanceMeters(point, point), 0.0);
    }

    @Test
    @DisplayName("Distance is symmetric")
    void testSymmetry() {
        Random random = new Random(42);
        for (int i = 0; i < 1_000; i++) {
            Coordinates a = randomPoint(random);
            Coordinates b = randomPoint(random);
            assertEquals(Haversine.distanceMeters(a, b), Haversine.distanceMeters(b, a), 1e-6);
        }
    }

    @Test
    @DisplayName("Should agree with known distances")
    void testKnownDistances() {
        // One degree of latitude on a 6,371 km sphere
        assertEquals(111_194.93, Haversine.distanceMeters(0, 0, 1, 0), 0.01);
        // Half the circumference between antipodes
        assertEquals(Math.PI * Haversine.EARTH_RADIUS_METERS, Haversine.distanceMeters(0, 0, 0, 180), 1e-3);
        // Two London points roughly 13 m apart
        double nearby = Haversine.distanceMeters(51.5007, -0.1246, 51.5008, -0.1247);
        assertTrue(nearby > 12.0 && nearby < 14.0, "got " + nearby);
    }

    @Test
    @DisplayName("Should measure across the antimeridian the short way")
    void testAntimeridian() {
        double distance = Haversine.distanceMeters(0, 179.999, 0, -179.999);
        assertEquals(222.39, distance, 0.01);
    }

    @Test
    @DisplayName("Missing coordinates give no distance")
    void testDistanceOrNull() {
        Coordinates point = Coordinates.of(51.5, -0.12);
        assertNull(Haversine.distanceOrNull(null, point));
        assertNull(Haversine.distanceOrNull(point, null));
        assertEquals(0.0, Haversine.distanceOrNull(point, point), 0.0);
    }

    private static Coordinates randomPoint(Random random) {
        return Coordinates.of(random.nextDouble() * 180.0 - 90.0, random.nextDouble() * 360.0 - 180.0);
    }
}
