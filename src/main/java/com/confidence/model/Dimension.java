package com.confidence.model;

import java.util.Arrays;
import java.util.List;

/**
 * The six canonical confidence dimensions. Any other dimension name is allowed in a
 * {@link DimensionalConfidence}, but only these have typed accessors.
 */
public enum Dimension {
    SOURCE_RELIABILITY("source_reliability"),
    METHOD_QUALITY("method_quality"),
    INTERNAL_CONSISTENCY("internal_consistency"),
    TEMPORAL_FRESHNESS("temporal_freshness"),
    CORROBORATION("corroboration"),
    DOMAIN_APPLICABILITY("domain_applicability");

    private final String key;

    Dimension(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /** Keys of all canonical dimensions in declaration order. */
    public static List<String> keys() {
        return Arrays.stream(values()).map(Dimension::getKey).toList();
    }
}
