package com.confidence.schema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Process-wide {@link DimensionRegistry}, created on first access and pre-loaded
 * with {@link BuiltinSchemas}.
 *
 * {@link #reset()} restores the baseline on the same instance, so holders of the
 * registry (e.g. the Spring bean) keep seeing the live store. The baseline is the
 * built-in schemas followed by any schemas passed to {@link #setConfiguredSchemas}.
 */
public final class GlobalRegistry {

    private static final Logger log = LoggerFactory.getLogger(GlobalRegistry.class);

    private static volatile DimensionRegistry instance;
    private static volatile List<DimensionSchema> configured = List.of();

    private GlobalRegistry() {
    }

    public static DimensionRegistry get() {
        DimensionRegistry registry = instance;
        if (registry == null) {
            synchronized (GlobalRegistry.class) {
                registry = instance;
                if (registry == null) {
                    registry = new DimensionRegistry();
                    registry.reset(baseline());
                    log.info("Global dimension registry initialized with {} schemas", registry.listSchemas().size());
                    instance = registry;
                }
            }
        }
        return registry;
    }

    /**
     * Replaces the configured part of the baseline and applies it to the live registry
     * right away. Parents must precede their children.
     *
     * @throws SchemaRegistrationException if a schema's parent is missing; the registry
     *         and the previous baseline are left unchanged
     */
    public static synchronized void setConfiguredSchemas(List<DimensionSchema> schemas) {
        List<DimensionSchema> candidate = schemas == null ? List.of() : List.copyOf(schemas);
        List<DimensionSchema> baseline = new ArrayList<>(BuiltinSchemas.all());
        baseline.addAll(candidate);
        get().reset(baseline);
        configured = candidate;
        log.info("Global dimension registry baseline now includes {} configured schemas", candidate.size());
    }

    public static List<DimensionSchema> getConfiguredSchemas() {
        return configured;
    }

    /**
     * Discards all runtime registrations and restores the built-in and configured schemas.
     */
    public static void reset() {
        get().reset(baseline());
        log.info("Global dimension registry reset to {} built-in and {} configured schemas",
            BuiltinSchemas.all().size(), configured.size());
    }

    private static List<DimensionSchema> baseline() {
        List<DimensionSchema> baseline = new ArrayList<>(BuiltinSchemas.all());
        baseline.addAll(configured);
        return baseline;
    }
}
