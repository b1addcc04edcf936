package com.confidence.schema;

import com.confidence.model.DimensionalConfidence;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalRegistryTest {

    private List<DimensionSchema> savedConfigured;

    @BeforeEach
    void resetRegistry() {
        savedConfigured = GlobalRegistry.getConfiguredSchemas();
        GlobalRegistry.setConfiguredSchemas(List.of());
    }

    @AfterEach
    void restoreConfiguredSchemas() {
        GlobalRegistry.setConfiguredSchemas(savedConfigured);
    }

    @Test
    void get_returnsSameInstance() {
        assertSame(GlobalRegistry.get(), GlobalRegistry.get());
    }

    @Test
    void builtinSchemas_arePresent() {
        DimensionRegistry registry = GlobalRegistry.get();
        assertTrue(registry.get("v1.confidence.core").isPresent());
        assertTrue(registry.get("v1.trust.core").isPresent());
        assertTrue(registry.get("v1.trust.extended").isPresent());
    }

    @Test
    void coreSchema_hasSixCanonicalDimensions() {
        DimensionSchema core = GlobalRegistry.get().get("v1.confidence.core").orElseThrow();
        assertTrue(core.dimensions().contains("source_reliability"));
        assertTrue(core.dimensions().contains("corroboration"));
        assertEquals(6, core.dimensions().size());
    }

    @Test
    void extendedTrust_inheritsCoreTrust() {
        DimensionSchema resolved = GlobalRegistry.get().resolve("v1.trust.extended");
        assertTrue(resolved.dimensions().contains("conclusions"));
        assertTrue(resolved.dimensions().contains("honesty"));
        assertTrue(resolved.dimensions().contains("competence"));
        assertEquals(1, resolved.dimensions().stream().filter("honesty"::equals).count());
    }

    @Test
    void fullConfidence_validatesAgainstDefaultSchema() {
        DimensionalConfidence conf = DimensionalConfidence.full(0.8, 0.7, 0.9, 0.85, 0.6, 0.75);
        assertTrue(GlobalRegistry.get().validate(conf.getSchema(), conf.getDimensions()).valid());
    }

    @Test
    void reset_discardsCustomRegistrationsAndRestoresBuiltins() {
        DimensionRegistry registry = GlobalRegistry.get();
        registry.register(new DimensionSchema("custom.v1", List.of("x")));
        registry.unregister("v1.trust.extended");

        GlobalRegistry.reset();

        assertSame(registry, GlobalRegistry.get());
        assertTrue(registry.get("custom.v1").isEmpty());
        assertEquals(List.of("v1.confidence.core", "v1.trust.core", "v1.trust.extended"),
            registry.listSchemas().stream().map(DimensionSchema::name).toList());
    }

    @Test
    void reset_keepsConfiguredSchemas() {
        GlobalRegistry.setConfiguredSchemas(List.of(
            new DimensionSchema("configured.v1", List.of("a")),
            new DimensionSchema("configured.v2", List.of("b"), List.of(), "configured.v1")));
        GlobalRegistry.get().register(new DimensionSchema("runtime.v1", List.of("x")));

        GlobalRegistry.reset();

        DimensionRegistry registry = GlobalRegistry.get();
        assertTrue(registry.get("runtime.v1").isEmpty());
        assertEquals(List.of("a", "b"), registry.resolve("configured.v2").dimensions());
        assertTrue(registry.get("v1.trust.core").isPresent());
    }

    @Test
    void setConfiguredSchemas_withOrphanLeavesBaselineUnchanged() {
        GlobalRegistry.setConfiguredSchemas(List.of(new DimensionSchema("configured.v1", List.of("a"))));

        assertThrows(SchemaRegistrationException.class, () -> GlobalRegistry.setConfiguredSchemas(
            List.of(new DimensionSchema("orphan.v1", List.of("a"), List.of(), "missing"))));

        assertEquals(List.of("configured.v1"),
            GlobalRegistry.getConfiguredSchemas().stream().map(DimensionSchema::name).toList());
        assertTrue(GlobalRegistry.get().get("configured.v1").isPresent());
        assertTrue(GlobalRegistry.get().get("orphan.v1").isEmpty());
    }

    @Test
    void customSchema_canExtendBuiltin() {
        GlobalRegistry.get().register(new DimensionSchema("v2.trust.audited",
            List.of("audit_trail"), List.of("audit_trail"), "v1.trust.extended"));
        ValidationResult result = GlobalRegistry.get().validate("v2.trust.audited",
            Map.of("honesty", 0.9, "competence", 0.8));
        assertEquals(List.of("Missing required dimension: audit_trail"), result.errors());
    }
}
