package com.confidence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A confidence score with an overall value and optional named dimension scores.
 *
 * All values lie in [0, 1]. Dimensions are sparse: a missing dimension means
 * "unknown", not zero.
 *
 * Instances behave as values: {@link #withDimension}, {@link #decay} and
 * {@link #boostCorroboration} return new instances. {@link #recalculateOverall()}
 * and {@link #setDimension} are the only methods that change the receiver, and
 * callers sharing an instance across threads must synchronize those themselves.
 *
 * Serialized shape (see {@link #toDict()}):
 * {
 *   "overall": 0.7,
 *   "source_reliability": 0.9,
 *   "schema": "custom.v1"     // only when not the default schema
 * }
 */
public final class DimensionalConfidence {

    public static final String DEFAULT_SCHEMA = "v1.confidence.core";

    private static final String OVERALL_KEY = "overall";
    private static final String SCHEMA_KEY = "schema";

    private static final double NEUTRAL = 0.5;
    private static final Set<String> RESERVED_KEYS = Set.of(OVERALL_KEY, SCHEMA_KEY);

    private double overall;
    private final Map<String, Double> dimensions;
    private final String schema;

    public DimensionalConfidence(double overall) {
        this(overall, Map.of(), null);
    }

    public DimensionalConfidence(double overall, Map<String, Double> dimensions) {
        this(overall, dimensions, null);
    }

    public DimensionalConfidence(double overall, Map<String, Double> dimensions, String schema) {
        this.overall = checkRange(OVERALL_KEY, overall);
        this.dimensions = new LinkedHashMap<>();
        if (dimensions != null) {
            dimensions.forEach(this::putDimension);
        }
        this.schema = schema == null || schema.isBlank() ? DEFAULT_SCHEMA : schema;
    }

    public static Builder builder(double overall) {
        return new Builder(overall);
    }

    public static DimensionalConfidence simple(double overall) {
        return new DimensionalConfidence(overall);
    }

    /**
     * Creates a confidence with all six canonical dimensions; overall is their mean.
     */
    public static DimensionalConfidence full(double sourceReliability,
                                             double methodQuality,
                                             double internalConsistency,
                                             double temporalFreshness,
                                             double corroboration,
                                             double domainApplicability) {
        Map<String, Double> dims = new LinkedHashMap<>();
        dims.put(Dimension.SOURCE_RELIABILITY.getKey(), sourceReliability);
        dims.put(Dimension.METHOD_QUALITY.getKey(), methodQuality);
        dims.put(Dimension.INTERNAL_CONSISTENCY.getKey(), internalConsistency);
        dims.put(Dimension.TEMPORAL_FRESHNESS.getKey(), temporalFreshness);
        dims.put(Dimension.CORROBORATION.getKey(), corroboration);
        dims.put(Dimension.DOMAIN_APPLICABILITY.getKey(), domainApplicability);
        return fromDimensions(dims);
    }

    /**
     * Creates a confidence whose overall is the mean of the given dimensions,
     * or 0.5 when the map is empty.
     */
    public static DimensionalConfidence fromDimensions(Map<String, Double> dimensions) {
        Map<String, Double> dims = dimensions != null ? dimensions : Map.of();
        double overall = dims.isEmpty() ? NEUTRAL : mean(dims);
        return new DimensionalConfidence(overall, dims);
    }

    public double getOverall() {
        return overall;
    }

    /** Read-only view of the dimension scores, in insertion order. */
    public Map<String, Double> getDimensions() {
        return Collections.unmodifiableMap(dimensions);
    }

    public String getSchema() {
        return schema;
    }

    public Double getDimension(String name) {
        return dimensions.get(name);
    }

    public Double getDimension(Dimension dimension) {
        return dimensions.get(dimension.getKey());
    }

    public boolean hasDimension(String name) {
        return dimensions.containsKey(name);
    }

    /**
     * Sets a dimension on this instance, or removes it when {@code value} is null.
     */
    public void setDimension(String name, Double value) {
        if (value == null) {
            dimensions.remove(name);
            return;
        }
        putDimension(name, value);
    }

    public Double sourceReliability() {
        return getDimension(Dimension.SOURCE_RELIABILITY);
    }

    public Double methodQuality() {
        return getDimension(Dimension.METHOD_QUALITY);
    }

    public Double internalConsistency() {
        return getDimension(Dimension.INTERNAL_CONSISTENCY);
    }

    public Double temporalFreshness() {
        return getDimension(Dimension.TEMPORAL_FRESHNESS);
    }

    public Double corroboration() {
        return getDimension(Dimension.CORROBORATION);
    }

    public Double domainApplicability() {
        return getDimension(Dimension.DOMAIN_APPLICABILITY);
    }

    public DimensionalConfidence withDimension(String name, double value) {
        DimensionalConfidence copy = copy();
        copy.putDimension(name, value);
        return copy;
    }

    public DimensionalConfidence withDimension(Dimension dimension, double value) {
        return withDimension(dimension.getKey(), value);
    }

    /**
     * Ages this confidence by {@code factor}. When temporal freshness is tracked only
     * that dimension is scaled; otherwise the overall score is scaled instead.
     */
    public DimensionalConfidence decay(double factor) {
        Double freshness = temporalFreshness();
        if (freshness != null) {
            return withDimension(Dimension.TEMPORAL_FRESHNESS, freshness * factor);
        }
        return new DimensionalConfidence(overall * factor, dimensions, schema);
    }

    /**
     * Raises corroboration by {@code amount}, capped at 1.0. A missing corroboration
     * dimension counts as 0.0.
     */
    public DimensionalConfidence boostCorroboration(double amount) {
        Double current = corroboration();
        double boosted = Math.min(1.0, (current != null ? current : 0.0) + amount);
        return withDimension(Dimension.CORROBORATION, boosted);
    }

    /**
     * Recomputes overall in place as the mean of the present dimensions.
     * Leaves overall untouched when there are no dimensions.
     */
    public void recalculateOverall() {
        if (dimensions.isEmpty()) {
            return;
        }
        overall = checkRange(OVERALL_KEY, mean(dimensions));
    }

    @JsonValue
    public Map<String, Object> toDict() {
        Map<String, Object> dict = new LinkedHashMap<>();
        dict.put(OVERALL_KEY, overall);
        dict.putAll(dimensions);
        if (!DEFAULT_SCHEMA.equals(schema)) {
            dict.put(SCHEMA_KEY, schema);
        }
        return dict;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static DimensionalConfidence fromDict(Map<String, ?> data) {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (!(data.get(OVERALL_KEY) instanceof Number overall)) {
            throw new IllegalArgumentException("overall is required and must be a number");
        }

        String schema = null;
        Object rawSchema = data.get(SCHEMA_KEY);
        if (rawSchema != null) {
            if (!(rawSchema instanceof String text)) {
                throw new IllegalArgumentException("schema must be a string");
            }
            schema = text;
        }

        Map<String, Double> dims = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            if (RESERVED_KEYS.contains(entry.getKey())) {
                continue;
            }
            if (!(entry.getValue() instanceof Number value)) {
                throw new IllegalArgumentException(
                    "dimension '" + entry.getKey() + "' must be a number");
            }
            dims.put(entry.getKey(), value.doubleValue());
        }
        return new DimensionalConfidence(overall.doubleValue(), dims, schema);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DimensionalConfidence other)) {
            return false;
        }
        return overall == other.overall && dimensions.equals(other.dimensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(overall, dimensions);
    }

    @Override
    public String toString() {
        return "DimensionalConfidence{overall=" + overall
            + ", dimensions=" + dimensions
            + ", schema=" + schema + "}";
    }

    private static double mean(Map<String, Double> values) {
        double sum = 0.0;
        for (double v : values.values()) {
            sum += v;
        }
        return sum / values.size();
    }

    private DimensionalConfidence copy() {
        return new DimensionalConfidence(overall, dimensions, schema);
    }

    private void putDimension(String name, Double value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("dimension name must not be empty");
        }
        if (RESERVED_KEYS.contains(name)) {
            throw new IllegalArgumentException("'" + name + "' is reserved and cannot be a dimension name");
        }
        if (value == null) {
            throw new ConfidenceRangeException(name, Double.NaN);
        }
        dimensions.put(name, checkRange(name, value));
    }

    private static double checkRange(String field, double value) {
        // NaN fails both comparisons
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new ConfidenceRangeException(field, value);
        }
        // -0.0 + 0.0 is 0.0, so equals and hashCode agree on zero
        return value + 0.0;
    }

    /**
     * Collects constructor arguments. The dimensions map is applied first and the
     * individually named dimensions override it on conflict, whatever the call order.
     */
    public static final class Builder {

        private final double overall;
        private final Map<String, Double> mapped = new LinkedHashMap<>();
        private final Map<String, Double> named = new LinkedHashMap<>();
        private String schema;

        private Builder(double overall) {
            this.overall = overall;
        }

        public Builder dimensions(Map<String, Double> dimensions) {
            if (dimensions != null) {
                mapped.putAll(dimensions);
            }
            return this;
        }

        public Builder dimension(String name, double value) {
            named.put(name, value);
            return this;
        }

        public Builder dimension(Dimension dimension, double value) {
            return dimension(dimension.getKey(), value);
        }

        public Builder sourceReliability(double value) {
            return dimension(Dimension.SOURCE_RELIABILITY, value);
        }

        public Builder methodQuality(double value) {
            return dimension(Dimension.METHOD_QUALITY, value);
        }

        public Builder internalConsistency(double value) {
            return dimension(Dimension.INTERNAL_CONSISTENCY, value);
        }

        public Builder temporalFreshness(double value) {
            return dimension(Dimension.TEMPORAL_FRESHNESS, value);
        }

        public Builder corroboration(double value) {
            return dimension(Dimension.CORROBORATION, value);
        }

        public Builder domainApplicability(double value) {
            return dimension(Dimension.DOMAIN_APPLICABILITY, value);
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public DimensionalConfidence build() {
            Map<String, Double> merged = new LinkedHashMap<>(mapped);
            merged.putAll(named);
            return new DimensionalConfidence(overall, merged, schema);
        }
    }
}
