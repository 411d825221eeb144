package com.raditha.competitors.embedding;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VectorMathTest {

    @Test
    void testNormalizeProducesUnitVector() {
        float[] unit = VectorMath.normalize(new float[] { 3f, 4f });
        assertEquals(1.0, VectorMath.norm(unit), 1e-6);
        assertEquals(0.6, unit[0], 1e-6);
        assertEquals(0.8, unit[1], 1e-6);
    }

    @Test
    void testNormalizeZeroVectorReturnsNull() {
        assertNull(VectorMath.normalize(new float[] { 0f, 0f, 0f }));
    }

    @Test
    void testClampedCosine() {
        float[] a = { 1f, 0f };
        float[] b = { -1f, 0f };
        assertEquals(0.0, VectorMath.clampedCosine(a, b));
        assertEquals(1.0, VectorMath.clampedCosine(a, a), 1e-9);
    }

    @Test
    void testClampedCosineOfIdenticalUnitVectorsIsExactlyOne() {
        float[] raw = new HashingEmbeddingModel(384).embed(List.of("point of sale tablets")).get(0);
        float[] unit = VectorMath.normalize(raw);
        assertEquals(1.0, VectorMath.clampedCosine(unit, unit));

        float[] nearlyUnit = { 0.99999995f, 0f };
        assertEquals(1.0, VectorMath.clampedCosine(nearlyUnit, nearlyUnit));
        assertEquals(0.5, VectorMath.clampedCosine(new float[] { 1f, 0f }, new float[] { 0.5f, 0.8660254f }), 1e-6);
    }

    @Test
    void testEuclideanDistance() {
        assertEquals(Math.sqrt(2), VectorMath.euclideanDistance(new float[] { 1f, 0f }, new float[] { 0f, 1f }), 1e-9);
    }

    @Test
    void testDimensionMismatchRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> VectorMath.dot(new float[] { 1f }, new float[] { 1f, 2f }));
    }
}
