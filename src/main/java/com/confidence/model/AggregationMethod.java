package com.confidence.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Strategy used by {@link ConfidenceAggregator} to combine several values into one.
 */
public enum AggregationMethod {
    ARITHMETIC("arithmetic") {
        @Override
        public double combine(List<Double> values) {
            double sum = 0.0;
            for (double v : values) {
                sum += v;
            }
            return sum / values.size();
        }
    },
    GEOMETRIC("geometric") {
        @Override
        public double combine(List<Double> values) {
            // log space, a plain product underflows for long inputs
            double logSum = 0.0;
            for (double v : values) {
                if (v == 0.0) {
                    return 0.0;
                }
                logSum += Math.log(v);
            }
            return Math.exp(logSum / values.size());
        }
    },
    MINIMUM("minimum") {
        @Override
        public double combine(List<Double> values) {
            return values.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        }
    },
    MAXIMUM("maximum") {
        @Override
        public double combine(List<Double> values) {
            return values.stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        }
    };

    private final String value;

    AggregationMethod(String value) {
        this.value = value;
    }

    /**
     * Combines a non-empty list of values in [0, 1].
     */
    public abstract double combine(List<Double> values);

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AggregationMethod fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown aggregation method: " + raw));
    }
}
