package com.confidence.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declares which dimension names are valid together, which of them are required,
 * and the numeric range their values must fall in.
 *
 * A schema may name a parent through {@code inherits}; the registry resolves the
 * parent lazily by name (see {@link DimensionRegistry#resolve(String)}).
 */
public record DimensionSchema(
    @JsonProperty("name") String name,
    @JsonProperty("dimensions") List<String> dimensions,
    @JsonProperty("required") List<String> required,
    @JsonProperty("value_range") ValueRange valueRange,
    @JsonProperty("inherits") String inherits
) {

    public DimensionSchema {
        if (name == null || name.isBlank()) {
            throw new InvalidSchemaException("Schema name must not be empty");
        }
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
        required = required == null ? List.of() : List.copyOf(required);
        valueRange = valueRange == null ? ValueRange.UNIT : valueRange;
        if (inherits != null && inherits.isBlank()) {
            inherits = null;
        }

        for (String dimension : dimensions) {
            if (dimension.isBlank()) {
                throw new InvalidSchemaException("Schema '" + name + "' declares an empty dimension name");
            }
        }
        for (String req : required) {
            if (!dimensions.contains(req)) {
                throw new InvalidSchemaException(
                    "Required dimension '" + req + "' not in dimensions of schema '" + name + "'");
            }
        }
    }

    public DimensionSchema(String name, List<String> dimensions) {
        this(name, dimensions, List.of(), ValueRange.UNIT, null);
    }

    public DimensionSchema(String name, List<String> dimensions, List<String> required) {
        this(name, dimensions, required, ValueRange.UNIT, null);
    }

    public DimensionSchema(String name, List<String> dimensions, List<String> required, String inherits) {
        this(name, dimensions, required, ValueRange.UNIT, inherits);
    }

    public boolean hasParent() {
        return inherits != null;
    }
}
