package com.venue.linkage.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A venue from the commercial places directory: display name, formatted address,
 * position and the customer rating fields carried through to the joined output.
 */
public record PlaceListing(
        String id,
        String name,
        String address,
        Coordinates coordinates,
        Double rating,
        Integer reviewCount,
        String foodTypes,
        String priceLevel,
        String openingHours
) implements VenueRecord {

    public PlaceListing {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name : "";
        address = address != null ? address : "";
        foodTypes = foodTypes != null ? foodTypes : "";
        priceLevel = priceLevel != null ? priceLevel : "";
        openingHours = openingHours != null ? openingHours : "";
    }

    @Override
    public String addressOrPostcode() {
        return address;
    }

    @Override
    public LocatorKind locatorKind() {
        return LocatorKind.ADDRESS;
    }

    @Override
    public Map<String, String> attributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("place_id", id);
        attributes.put("name", name);
        attributes.put("address", address);
        attributes.put("latitude", coordinates != null ? coordinates.latitudeText() : "");
        attributes.put("longitude", coordinates != null ? coordinates.longitudeText() : "");
        attributes.put("rating", rating != null ? rating.toString() : "");
        attributes.put("num_reviews", reviewCount != null ? reviewCount.toString() : "");
        attributes.put("food_types", foodTypes);
        attributes.put("price_level", priceLevel);
        attributes.put("hours", openingHours);
        return Collections.unmodifiableMap(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String address;
        private Coordinates coordinates;
        private Double rating;
        private Integer reviewCount;
        private String foodTypes;
        private String priceLevel;
        private String openingHours;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder address(String address) {
            this.address = address;
            return this;
        }

        public Builder coordinates(Coordinates coordinates) {
            this.coordinates = coordinates;
            return this;
        }

        public Builder coordinates(double latitude, double longitude) {
            this.coordinates = new Coordinates(latitude, longitude);
            return this;
        }

        public Builder rating(Double rating) {
            this.rating = rating;
            return this;
        }

        public Builder reviewCount(Integer reviewCount) {
            this.reviewCount = reviewCount;
            return this;
        }

        public Builder foodTypes(String foodTypes) {
            this.foodTypes = foodTypes;
            return this;
        }

        public Builder priceLevel(String priceLevel) {
            this.priceLevel = priceLevel;
            return this;
        }

        public Builder openingHours(String openingHours) {
            this.openingHours = openingHours;
            return this;
        }

        public PlaceListing build() {
            return new PlaceListing(id, name, address, coordinates, rating, reviewCount,
                    foodTypes, priceLevel, openingHours);
        }
    }
}
