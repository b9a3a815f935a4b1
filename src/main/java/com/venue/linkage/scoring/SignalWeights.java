package com.venue.linkage.scoring;

/**
 * Weights for fusing the name, distance and postcode signals into a combined score.
 *
 * <p>Each signal lies in [0, 1], so the combined score lies in [0, {@link #total()}].
 * The total defines the scale the acceptance floor is calibrated against; it does not
 * have to be 1.0.</p>
 */
public record SignalWeights(
        double nameWeight,
        double distanceWeight,
        double postcodeWeight
) {
    public SignalWeights {
        checkWeight(nameWeight, "nameWeight");
        checkWeight(distanceWeight, "distanceWeight");
        checkWeight(postcodeWeight, "postcodeWeight");
        if (nameWeight + distanceWeight + postcodeWeight <= 0.0) {
            throw new IllegalArgumentException("At least one weight must be positive");
        }
    }

    /**
     * Unit scale: 0.7 name + 0.2 distance + 0.1 postcode.
     */
    public static SignalWeights defaultWeights() {
        return new SignalWeights(0.7, 0.2, 0.1);
    }

    /**
     * Additive two-signal scale: name similarity plus distance closeness, total 2.0.
     */
    public static SignalWeights nameAndProximity() {
        return new SignalWeights(1.0, 1.0, 0.0);
    }

    public double total() {
        return nameWeight + distanceWeight + postcodeWeight;
    }

    public double combine(double nameScore, double distanceScore, double postcodeScore) {
        return nameWeight * nameScore + distanceWeight * distanceScore + postcodeWeight * postcodeScore;
    }

    private static void checkWeight(double value, String name) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " must be finite and non-negative, got " + value);
        }
    }
}
