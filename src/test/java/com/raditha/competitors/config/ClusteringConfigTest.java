package com.raditha.competitors.config;

import com.raditha.competitors.model.ThresholdMode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClusteringConfigTest {

    @Test
    void testDefaults() {
        ClusteringConfig config = ClusteringConfig.defaults();

        assertEquals(20, config.k());
        assertEquals(0.6, config.alpha());
        assertEquals(42L, config.seed());
        assertEquals(ThresholdMode.FIXED, config.threshold().mode());
        assertEquals(0.55, config.threshold().tau());
        assertEquals(0.8, config.weights().textWeight());
        assertEquals(0.2, config.weights().categoryWeight());
        assertEquals(IndexType.LSH, config.index().type());
        assertFalse(config.review().enabled());
    }

    @Test
    void testWithersReplaceOneField() {
        ClusteringConfig config = ClusteringConfig.defaults().withK(5).withTau(0.7).withSeed(9L);

        assertEquals(5, config.k());
        assertEquals(0.7, config.threshold().tau());
        assertEquals(ThresholdMode.FIXED, config.threshold().mode());
        assertEquals(9L, config.seed());
        assertEquals(0.6, config.alpha());
    }

    @Test
    void testInvalidValuesRejected() {
        ClusteringConfig defaults = ClusteringConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withK(0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withAlpha(1.2));
        assertThrows(IllegalArgumentException.class, () -> defaults.withResolution(0.0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withModelId(" "));
        assertThrows(IllegalArgumentException.class, () -> defaults.withTau(-0.1));
    }

    @Test
    void testWeightsMustSumToOne() {
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(0.7, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new SimilarityWeights(1.2, -0.2));
        assertEquals(0.8 * 0.5 + 0.2 * 1.0, SimilarityWeights.standard().combine(0.5, 1.0), 1e-12);
    }

    @Test
    void testOptionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new EmbeddingOptions(0, 1, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new EmbeddingOptions(1, 1, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new IndexOptions(IndexType.LSH, 300, 12, 10));
        assertThrows(IllegalArgumentException.class, () -> new ValidationOptions(1, 0, 100));
        assertThrows(IllegalArgumentException.class, () -> new ReviewOptions(true, 0, "m"));
    }

    @Test
    void testReviewModelDefaultsWhenBlank() {
        assertEquals("gemini-2.0-flash", new ReviewOptions(true, 3, "").model());
    }

    @Test
    void testEnumParsing() {
        assertEquals(IndexType.EXACT, IndexType.fromString("exact"));
        assertEquals(ThresholdMode.PERCENTILE, ThresholdMode.fromString("Percentile"));
        assertThrows(IllegalArgumentException.class, () -> IndexType.fromString("faiss"));
    }
}
