package com.confidence.schema;

/**
 * Thrown when a {@link DimensionSchema} definition is malformed.
 */
public class InvalidSchemaException extends IllegalArgumentException {

    public InvalidSchemaException(String message) {
        super(message);
    }
}
