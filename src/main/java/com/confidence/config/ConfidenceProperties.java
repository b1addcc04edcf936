package com.confidence.config;

import com.confidence.schema.DimensionSchema;
import com.confidence.schema.ValueRange;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Settings under the {@code confidence} prefix.
 *
 * confidence:
 *   default-aggregation: arithmetic
 *   schemas:
 *     - name: claims.v1
 *       dimensions: [source_reliability, corroboration]
 *       required: [source_reliability]
 *     - name: claims.v2
 *       inherits: claims.v1
 *       dimensions: [novelty]
 *
 * Schemas are registered in the listed order, so parents must come first. They become
 * part of the global baseline and survive {@code GlobalRegistry.reset()}.
 */
@ConfigurationProperties(prefix = "confidence")
public record ConfidenceProperties(
    @DefaultValue("arithmetic") String defaultAggregation,
    List<SchemaDefinition> schemas
) {

    public ConfidenceProperties {
        schemas = schemas == null ? List.of() : List.copyOf(schemas);
    }

    public record SchemaDefinition(
        String name,
        List<String> dimensions,
        List<String> required,
        Double min,
        Double max,
        String inherits
    ) {

        public DimensionSchema toSchema() {
            ValueRange range = new ValueRange(
                min != null ? min : ValueRange.UNIT.min(),
                max != null ? max : ValueRange.UNIT.max());
            return new DimensionSchema(name, dimensions, required, range, inherits);
        }
    }
}
