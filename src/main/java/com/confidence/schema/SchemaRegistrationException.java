package com.confidence.schema;

/**
 * Thrown when the registry cannot register or resolve a schema, e.g. because the
 * schema or its declared parent is not registered.
 */
public class SchemaRegistrationException extends RuntimeException {

    public SchemaRegistrationException(String message) {
        super(message);
    }
}
