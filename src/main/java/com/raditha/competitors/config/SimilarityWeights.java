package com.raditha.competitors.config;

/**
 * Weights for combining text and category similarity into one edge score.
 *
 * @param textWeight     Weight for embedding cosine similarity (0.0-1.0)
 * @param categoryWeight Weight for category-tag Jaccard similarity (0.0-1.0)
 */
public record SimilarityWeights(double textWeight, double categoryWeight) {

    /**
     * Validate weights sum to 1.0.
     */
    public SimilarityWeights {
        if (textWeight < 0.0 || categoryWeight < 0.0) {
            throw new IllegalArgumentException("Weights must not be negative");
        }
        double sum = textWeight + categoryWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException(
                    String.format("Weights must sum to 1.0, got %.3f", sum));
        }
    }

    /**
     * Default weights: text dominates, categories break ties.
     */
    public static SimilarityWeights standard() {
        return new SimilarityWeights(0.80, 0.20);
    }

    /**
     * Text-only weights: category tags are ignored.
     */
    public static SimilarityWeights textOnly() {
        return new SimilarityWeights(1.0, 0.0);
    }

    /**
     * Calculate combined score from individual metrics.
     */
    public double combine(double text, double category) {
        return (text * textWeight) + (category * categoryWeight);
    }
}
