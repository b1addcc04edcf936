package com.confidence.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceAggregatorTest {

    private static final double EPS = 1e-9;

    @Test
    void emptyInput_returnsNeutralConfidence() {
        DimensionalConfidence result = ConfidenceAggregator.aggregate(List.of());
        assertEquals(0.5, result.getOverall());
        assertTrue(result.getDimensions().isEmpty());
    }

    @Test
    void singleInput_returnsSameInstance() {
        DimensionalConfidence conf = DimensionalConfidence.simple(0.8);
        assertSame(conf, ConfidenceAggregator.aggregate(List.of(conf)));
        assertSame(conf, ConfidenceAggregator.aggregate(List.of(conf), "geometric"));
    }

    @Test
    void defaultMethod_isArithmeticMean() {
        DimensionalConfidence c1 = DimensionalConfidence.builder(0.8).sourceReliability(0.9).build();
        DimensionalConfidence c2 = DimensionalConfidence.builder(0.6).sourceReliability(0.7).build();
        DimensionalConfidence result = ConfidenceAggregator.aggregate(List.of(c1, c2));
        assertEquals(0.7, result.getOverall(), EPS);
        assertEquals(0.8, result.sourceReliability(), EPS);
    }

    @Test
    void geometric_staysWithinUnitRange() {
        DimensionalConfidence c1 = DimensionalConfidence.builder(0.8).sourceReliability(0.9).build();
        DimensionalConfidence c2 = DimensionalConfidence.builder(0.6).sourceReliability(0.7).build();
        DimensionalConfidence result = ConfidenceAggregator.aggregate(List.of(c1, c2), "geometric");
        assertEquals(Math.sqrt(0.48), result.getOverall(), EPS);
        assertNotNull(result.sourceReliability());
        assertEquals(Math.sqrt(0.63), result.sourceReliability(), EPS);
    }

    @Test
    void geometric_withZeroCollapsesToZero() {
        DimensionalConfidence c1 = DimensionalConfidence.simple(0.0);
        DimensionalConfidence c2 = DimensionalConfidence.simple(0.9);
        assertEquals(0.0, ConfidenceAggregator.aggregate(List.of(c1, c2), AggregationMethod.GEOMETRIC).getOverall());
    }

    @Test
    void geometric_manySmallInputsDoNotUnderflow() {
        List<DimensionalConfidence> inputs = Collections.nCopies(400,
            DimensionalConfidence.builder(0.1).corroboration(0.05).build());
        DimensionalConfidence result = ConfidenceAggregator.aggregate(inputs, AggregationMethod.GEOMETRIC);
        assertEquals(0.1, result.getOverall(), EPS);
        assertEquals(0.05, result.corroboration(), EPS);
    }

    @Test
    void minimum_takesElementwiseMinima() {
        DimensionalConfidence c1 = DimensionalConfidence.builder(0.8).sourceReliability(0.9).build();
        DimensionalConfidence c2 = DimensionalConfidence.builder(0.6).sourceReliability(0.7).build();
        DimensionalConfidence result = ConfidenceAggregator.aggregate(List.of(c1, c2), "minimum");
        assertEquals(0.6, result.getOverall());
        assertEquals(0.7, result.sourceReliability());
    }

    @Test
    void maximum_takesElementwiseMaxima() {
        DimensionalConfidence c1 = DimensionalConfidence.builder(0.8).sourceReliability(0.5).build();
        DimensionalConfidence c2 = DimensionalConfidence.builder(0.6).sourceReliability(0.9).build();
        DimensionalConfidence result = ConfidenceAggregator.aggregate(List.of(c1, c2), "maximum");
        assertEquals(0.8, result.getOverall());
        assertEquals(0.9, result.sourceReliability());
    }

    @Test
    @DisplayName("A dimension missing from some inputs is combined over the others only")
    void sparseDimensions_areNotPenalized() {
        DimensionalConfidence c1 = DimensionalConfidence.builder(0.8).corroboration(0.9).build();
        DimensionalConfidence c2 = DimensionalConfidence.builder(0.6).methodQuality(0.3).build();
        DimensionalConfidence c3 = DimensionalConfidence.builder(0.4).corroboration(0.5).build();
        DimensionalConfidence result = ConfidenceAggregator.aggregate(List.of(c1, c2, c3));
        assertEquals(0.6, result.getOverall(), EPS);
        assertEquals(0.7, result.corroboration(), EPS);
        assertEquals(0.3, result.methodQuality(), EPS);
        assertEquals(List.of("corroboration", "method_quality"), List.copyOf(result.getDimensions().keySet()));
    }

    @Test
    void result_usesDefaultSchema() {
        DimensionalConfidence c1 = DimensionalConfidence.builder(0.8).schema("custom.v1").build();
        DimensionalConfidence c2 = DimensionalConfidence.builder(0.6).schema("custom.v1").build();
        DimensionalConfidence result = ConfidenceAggregator.aggregate(List.of(c1, c2));
        assertEquals(DimensionalConfidence.DEFAULT_SCHEMA, result.getSchema());
    }

    @Test
    void methodNames_areCaseInsensitive() {
        assertEquals(AggregationMethod.GEOMETRIC, AggregationMethod.fromValue("Geometric"));
    }

    @Test
    void unknownMethod_throws() {
        DimensionalConfidence c1 = DimensionalConfidence.simple(0.8);
        DimensionalConfidence c2 = DimensionalConfidence.simple(0.6);
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> ConfidenceAggregator.aggregate(List.of(c1, c2), "median"));
        assertTrue(ex.getMessage().contains("median"));
    }
}
