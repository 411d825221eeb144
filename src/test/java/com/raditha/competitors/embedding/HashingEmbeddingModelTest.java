package com.raditha.competitors.embedding;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashingEmbeddingModelTest {

    private final HashingEmbeddingModel model = new HashingEmbeddingModel(256);

    @Test
    void testModelIdAndDimension() {
        assertEquals("hashing-256", model.modelId());
        assertEquals(256, model.declaredDimension().getAsInt());
    }

    @Test
    void testIdenticalTextsGetIdenticalVectors() {
        List<float[]> vectors = model.embed(List.of("dental clinics", "dental clinics"));
        assertArrayEquals(vectors.get(0), vectors.get(1));
    }

    @Test
    void testDeterministicAcrossInstances() {
        float[] first = new HashingEmbeddingModel(256).embed(List.of("payroll software")).get(0);
        float[] second = new HashingEmbeddingModel(256).embed(List.of("payroll software")).get(0);
        assertArrayEquals(first, second);
    }

    @Test
    void testSharedWordsGiveHigherSimilarity() {
        List<float[]> vectors = model.embed(List.of(
                "cloud payroll software for small businesses",
                "payroll software for small businesses",
                "organic dog food"));
        float[] a = VectorMath.normalize(vectors.get(0));
        float[] b = VectorMath.normalize(vectors.get(1));
        float[] c = VectorMath.normalize(vectors.get(2));

        assertTrue(VectorMath.dot(a, b) > VectorMath.dot(a, c));
    }

    @Test
    void testOneVectorPerText() {
        List<float[]> vectors = model.embed(List.of("a", "b", "c"));
        assertEquals(3, vectors.size());
        vectors.forEach(v -> assertEquals(256, v.length));
    }

    @Test
    void testRejectsTinyDimension() {
        assertThrows(IllegalArgumentException.class, () -> new HashingEmbeddingModel(1));
    }
}
