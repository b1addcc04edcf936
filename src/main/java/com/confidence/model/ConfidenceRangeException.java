package com.confidence.model;

/**
 * Thrown when a confidence value (overall or a dimension) falls outside [0, 1].
 */
public class ConfidenceRangeException extends IllegalArgumentException {

    private final String field;

    public ConfidenceRangeException(String field, double value) {
        super(field + " must be between 0 and 1, got " + value);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
