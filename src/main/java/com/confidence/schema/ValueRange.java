package com.confidence.schema;

/**
 * Inclusive numeric bounds shared by all dimensions of a schema.
 */
public record ValueRange(double min, double max) {

    public static final ValueRange UNIT = new ValueRange(0.0, 1.0);

    public ValueRange {
        if (!(min < max)) {
            throw new InvalidSchemaException(
                "value_range min (" + min + ") must be less than max (" + max + ")");
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
