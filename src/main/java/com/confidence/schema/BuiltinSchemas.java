package com.confidence.schema;

import com.confidence.model.Dimension;
import com.confidence.model.DimensionalConfidence;

import java.util.List;

/**
 * Schemas every global registry starts with. Parents are listed before children.
 */
public final class BuiltinSchemas {

    public static final String CONFIDENCE_CORE = DimensionalConfidence.DEFAULT_SCHEMA;
    public static final String TRUST_CORE = "v1.trust.core";
    public static final String TRUST_EXTENDED = "v1.trust.extended";

    private BuiltinSchemas() {
    }

    public static List<DimensionSchema> all() {
        return List.of(
            new DimensionSchema(CONFIDENCE_CORE, Dimension.keys()),
            new DimensionSchema(TRUST_CORE,
                List.of("competence", "honesty", "reliability", "benevolence")),
            new DimensionSchema(TRUST_EXTENDED,
                List.of("honesty", "conclusions", "methodology", "transparency"),
                List.of(),
                TRUST_CORE)
        );
    }
}
