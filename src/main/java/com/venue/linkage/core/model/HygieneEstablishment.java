package com.venue.linkage.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A food business from the hygiene-inspection registry.
 * The rating value is kept as text because the registry mixes numeric ratings
 * with statuses such as {@code Exempt} or {@code AwaitingInspection}.
 *
 * @param addressLines the registry's {@code address1..address4} in position, blank where the source was blank
 */
public record HygieneEstablishment(
        String id,
        String name,
        String businessType,
        List<String> addressLines,
        String postcode,
        Coordinates coordinates,
        String ratingValue,
        String ratingDate,
        String localAuthority,
        Integer hygieneScore,
        Integer structuralScore,
        Integer confidenceInManagementScore
) implements VenueRecord {

    /** The registry export always carries {@code address1} to {@code address4}. */
    static final int ADDRESS_COLUMNS = 4;

    public HygieneEstablishment {
        Objects.requireNonNull(id, "id is required");
        name = name != null ? name : "";
        businessType = businessType != null ? businessType : "";
        addressLines = addressLines != null ? List.copyOf(addressLines) : List.of();
        postcode = postcode != null ? postcode : "";
        ratingValue = ratingValue != null ? ratingValue : "";
        ratingDate = ratingDate != null ? ratingDate : "";
        localAuthority = localAuthority != null ? localAuthority : "";
    }

    @Override
    public String addressOrPostcode() {
        return postcode;
    }

    @Override
    public LocatorKind locatorKind() {
        return LocatorKind.POSTCODE;
    }

    @Override
    public Map<String, String> attributes() {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("fhrs_id", id);
        attributes.put("business_name", name);
        attributes.put("business_type", businessType);
        for (int i = 0; i < Math.max(ADDRESS_COLUMNS, addressLines.size()); i++) {
            attributes.put("address" + (i + 1), i < addressLines.size() ? addressLines.get(i) : "");
        }
        attributes.put("postcode", postcode);
        attributes.put("rating_value", ratingValue);
        attributes.put("rating_date", ratingDate);
        attributes.put("local_authority_name", localAuthority);
        attributes.put("hygiene_score", hygieneScore != null ? hygieneScore.toString() : "");
        attributes.put("structural_score", structuralScore != null ? structuralScore.toString() : "");
        attributes.put("confidence_in_management_score",
                confidenceInManagementScore != null ? confidenceInManagementScore.toString() : "");
        attributes.put("latitude", coordinates != null ? coordinates.latitudeText() : "");
        attributes.put("longitude", coordinates != null ? coordinates.longitudeText() : "");
        return Collections.unmodifiableMap(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String businessType;
        private List<String> addressLines;
        private String postcode;
        private Coordinates coordinates;
        private String ratingValue;
        private String ratingDate;
        private String localAuthority;
        private Integer hygieneScore;
        private Integer structuralScore;
        private Integer confidenceInManagementScore;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder businessType(String businessType) {
            this.businessType = businessType;
            return this;
        }

        public Builder addressLines(List<String> addressLines) {
            this.addressLines = addressLines;
            return this;
        }

        public Builder postcode(String postcode) {
            this.postcode = postcode;
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

        public Builder ratingValue(String ratingValue) {
            this.ratingValue = ratingValue;
            return this;
        }

        public Builder ratingDate(String ratingDate) {
            this.ratingDate = ratingDate;
            return this;
        }

        public Builder localAuthority(String localAuthority) {
            this.localAuthority = localAuthority;
            return this;
        }

        public Builder hygieneScore(Integer hygieneScore) {
            this.hygieneScore = hygieneScore;
            return this;
        }

        public Builder structuralScore(Integer structuralScore) {
            this.structuralScore = structuralScore;
            return this;
        }

        public Builder confidenceInManagementScore(Integer confidenceInManagementScore) {
            this.confidenceInManagementScore = confidenceInManagementScore;
            return this;
        }

        public HygieneEstablishment build() {
            return new HygieneEstablishment(id, name, businessType, addressLines, postcode, coordinates,
                    ratingValue, ratingDate, localAuthority, hygieneScore, structuralScore,
                    confidenceInManagementScore);
        }
    }
}
