package com.confidence.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative bands for an overall score. Each band includes its lower bound.
 */
public enum ConfidenceLabel {
    VERY_HIGH("very high", 0.9),
    HIGH("high", 0.75),
    MODERATE("moderate", 0.5),
    LOW("low", 0.25),
    VERY_LOW("very low", Double.NEGATIVE_INFINITY);

    private final String label;
    private final double lowerBound;

    ConfidenceLabel(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    // Constants are declared in descending order of lower bound
    public static ConfidenceLabel of(double overall) {
        for (ConfidenceLabel band : values()) {
            if (overall >= band.lowerBound) {
                return band;
            }
        }
        return VERY_LOW;
    }

    public static String describe(double overall) {
        return of(overall).label;
    }
}
