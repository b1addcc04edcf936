package com.confidence.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines confidences from several evidence sources into one.
 *
 * The overall scores are combined across all inputs. Each dimension is combined only
 * across the inputs that carry it, so a source that says nothing about a dimension
 * does not drag it towards zero.
 */
public final class ConfidenceAggregator {

    private static final double NEUTRAL = 0.5;

    private ConfidenceAggregator() {
    }

    public static DimensionalConfidence aggregate(List<DimensionalConfidence> confidences) {
        return aggregate(confidences, AggregationMethod.ARITHMETIC);
    }

    public static DimensionalConfidence aggregate(List<DimensionalConfidence> confidences, String method) {
        return aggregate(confidences, AggregationMethod.fromValue(method));
    }

    /**
     * @return a neutral 0.5 confidence for empty input, the very same instance for a
     *         single input, otherwise a new instance under the default schema
     */
    public static DimensionalConfidence aggregate(List<DimensionalConfidence> confidences,
                                                  AggregationMethod method) {
        if (confidences == null || confidences.isEmpty()) {
            return DimensionalConfidence.simple(NEUTRAL);
        }
        if (confidences.size() == 1) {
            return confidences.get(0);
        }
        AggregationMethod strategy = method != null ? method : AggregationMethod.ARITHMETIC;

        List<Double> overalls = new ArrayList<>(confidences.size());
        Map<String, List<Double>> byDimension = new LinkedHashMap<>();
        for (DimensionalConfidence confidence : confidences) {
            overalls.add(confidence.getOverall());
            confidence.getDimensions().forEach((name, value) ->
                byDimension.computeIfAbsent(name, k -> new ArrayList<>()).add(value));
        }

        Map<String, Double> combined = new LinkedHashMap<>();
        byDimension.forEach((name, values) -> combined.put(name, strategy.combine(values)));

        return new DimensionalConfidence(strategy.combine(overalls), combined);
    }
}
