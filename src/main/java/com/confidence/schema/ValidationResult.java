package com.confidence.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of checking a dimension mapping against a schema.
 * {@code valid} is true iff {@code errors} is empty.
 */
public record ValidationResult(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("errors") List<String> errors
) {

    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true iff errors is empty");
        }
    }

    public static ValidationResult of(List<String> errors) {
        return new ValidationResult(errors == null || errors.isEmpty(), errors);
    }
}
