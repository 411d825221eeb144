package com.raditha.competitors.embedding;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Offline embedding model based on signed feature hashing of word unigrams
 * and bigrams. Deterministic and dependency-free, so identical texts always get
 * identical vectors. Vectors are raw term counts and are not normalized.
 */
public class HashingEmbeddingModel implements EmbeddingModel {

    public static final String ID_PREFIX = "hashing-";

    private final int dimension;

    public HashingEmbeddingModel(int dimension) {
        if (dimension < 2) {
            throw new IllegalArgumentException("dimension must be >= 2");
        }
        this.dimension = dimension;
    }

    @Override
    public String modelId() {
        return ID_PREFIX + dimension;
    }

    @Override
    public OptionalInt declaredDimension() {
        return OptionalInt.of(dimension);
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embedOne(text));
        }
        return vectors;
    }

    float[] embedOne(String text) {
        float[] v = new float[dimension];
        String[] tokens = text.trim().split("\\s+");
        String previous = null;
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            addFeature(v, token, 1.0f);
            if (previous != null) {
                addFeature(v, previous + " " + token, 0.5f);
            }
            previous = token;
        }
        return v;
    }

    private void addFeature(float[] v, String feature, float weight) {
        long h = mix(feature.hashCode());
        int idx = (int) Math.floorMod(h, (long) dimension);
        float sign = ((h >>> 40) & 1L) == 0 ? 1.0f : -1.0f;
        v[idx] += sign * weight;
    }

    private static long mix(int value) {
        long h = value;
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
