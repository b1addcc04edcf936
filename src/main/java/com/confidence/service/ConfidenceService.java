package com.confidence.service;

import com.confidence.config.ConfidenceProperties;
import com.confidence.model.AggregationMethod;
import com.confidence.model.ConfidenceAggregator;
import com.confidence.model.ConfidenceLabel;
import com.confidence.model.DimensionalConfidence;
import com.confidence.schema.DimensionRegistry;
import com.confidence.schema.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for callers that want schema checks and aggregation against the
 * application's registry and configured defaults.
 */
@Service
public class ConfidenceService {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceService.class);

    private final DimensionRegistry registry;
    private final AggregationMethod defaultMethod;

    public ConfidenceService(DimensionRegistry registry, ConfidenceProperties properties) {
        this.registry = registry;
        this.defaultMethod = AggregationMethod.fromValue(properties.defaultAggregation());
    }

    /**
     * Validates the confidence's dimensions against the schema it declares.
     */
    public ValidationResult validate(DimensionalConfidence confidence) {
        return validate(confidence.getSchema(), confidence.getDimensions());
    }

    public ValidationResult validate(String schemaName, Map<String, Double> values) {
        ValidationResult result = registry.validate(schemaName, values);
        if (!result.valid()) {
            log.warn("Validation against schema={} failed with {} error(s): {}",
                schemaName, result.errors().size(), result.errors());
        }
        return result;
    }

    /**
     * Combines the confidences using the configured default method.
     */
    public DimensionalConfidence combine(List<DimensionalConfidence> confidences) {
        return combine(confidences, defaultMethod);
    }

    public DimensionalConfidence combine(List<DimensionalConfidence> confidences, AggregationMethod method) {
        AggregationMethod strategy = method != null ? method : defaultMethod;
        DimensionalConfidence combined = ConfidenceAggregator.aggregate(confidences, strategy);
        log.debug("Combined {} confidences with method={} into overall={}",
            confidences != null ? confidences.size() : 0, strategy.getValue(), combined.getOverall());
        return combined;
    }

    public String label(DimensionalConfidence confidence) {
        return ConfidenceLabel.describe(confidence.getOverall());
    }

    public AggregationMethod getDefaultMethod() {
        return defaultMethod;
    }
}
