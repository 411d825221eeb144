package com.raditha.competitors.config;

import com.raditha.competitors.model.ThresholdMode;

/**
 * Configuration for one clustering run.
 * Passed explicitly to every stage; nothing reads ambient state.
 *
 * @param modelId    Embedding model identifier, e.g. {@code hashing-384} or
 *                   {@code gemini:text-embedding-004}
 * @param k          Nearest neighbours queried per company
 * @param alpha      Weight of the product vector in fusion (0.0-1.0)
 * @param seed       Seed for index construction, community detection and sampling
 * @param threshold  Edge threshold settings
 * @param weights    Text/category weights for the combined score
 * @param embedding  Batching and retry settings
 * @param index      Nearest-neighbour index settings
 * @param resolution Modularity resolution for community detection
 * @param validation Validation and sampling settings
 * @param review     LLM review settings
 */
public record ClusteringConfig(
        String modelId,
        int k,
        double alpha,
        long seed,
        ThresholdOptions threshold,
        SimilarityWeights weights,
        EmbeddingOptions embedding,
        IndexOptions index,
        double resolution,
        ValidationOptions validation,
        ReviewOptions review) {

    /**
     * Validate configuration.
     */
    public ClusteringConfig {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId cannot be empty");
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        if (alpha < 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("alpha must be between 0.0 and 1.0");
        }
        if (threshold == null) {
            throw new IllegalArgumentException("threshold cannot be null");
        }
        if (weights == null) {
            throw new IllegalArgumentException("weights cannot be null");
        }
        if (embedding == null) {
            throw new IllegalArgumentException("embedding options cannot be null");
        }
        if (index == null) {
            throw new IllegalArgumentException("index options cannot be null");
        }
        if (resolution <= 0.0) {
            throw new IllegalArgumentException("resolution must be > 0");
        }
        if (validation == null) {
            validation = ValidationOptions.defaults();
        }
        if (review == null) {
            review = ReviewOptions.disabled();
        }
    }

    /**
     * Default settings of the production run (~100K companies).
     */
    public static ClusteringConfig defaults() {
        return new ClusteringConfig(
                "hashing-384", // modelId
                20, // k
                0.6, // alpha
                42L, // seed
                ThresholdOptions.fixed(0.55),
                SimilarityWeights.standard(),
                EmbeddingOptions.defaults(),
                IndexOptions.lsh(),
                1.0, // resolution
                ValidationOptions.defaults(),
                ReviewOptions.disabled());
    }

    public ClusteringConfig withModelId(String newModelId) {
        return new ClusteringConfig(newModelId, k, alpha, seed, threshold, weights, embedding, index,
                resolution, validation, review);
    }

    public ClusteringConfig withK(int newK) {
        return new ClusteringConfig(modelId, newK, alpha, seed, threshold, weights, embedding, index,
                resolution, validation, review);
    }

    public ClusteringConfig withAlpha(double newAlpha) {
        return new ClusteringConfig(modelId, k, newAlpha, seed, threshold, weights, embedding, index,
                resolution, validation, review);
    }

    public ClusteringConfig withSeed(long newSeed) {
        return new ClusteringConfig(modelId, k, alpha, newSeed, threshold, weights, embedding, index,
                resolution, validation, review);
    }

    public ClusteringConfig withThreshold(ThresholdOptions newThreshold) {
        return new ClusteringConfig(modelId, k, alpha, seed, newThreshold, weights, embedding, index,
                resolution, validation, review);
    }

    public ClusteringConfig withTau(double tau) {
        return withThreshold(new ThresholdOptions(ThresholdMode.FIXED, tau, threshold.percentile()));
    }

    public ClusteringConfig withWeights(SimilarityWeights newWeights) {
        return new ClusteringConfig(modelId, k, alpha, seed, threshold, newWeights, embedding, index,
                resolution, validation, review);
    }

    public ClusteringConfig withEmbedding(EmbeddingOptions newEmbedding) {
        return new ClusteringConfig(modelId, k, alpha, seed, threshold, weights, newEmbedding, index,
                resolution, validation, review);
    }

    public ClusteringConfig withIndex(IndexOptions newIndex) {
        return new ClusteringConfig(modelId, k, alpha, seed, threshold, weights, embedding, newIndex,
                resolution, validation, review);
    }

    public ClusteringConfig withResolution(double newResolution) {
        return new ClusteringConfig(modelId, k, alpha, seed, threshold, weights, embedding, index,
                newResolution, validation, review);
    }

    public ClusteringConfig withValidation(ValidationOptions newValidation) {
        return new ClusteringConfig(modelId, k, alpha, seed, threshold, weights, embedding, index,
                resolution, newValidation, review);
    }

    public ClusteringConfig withReview(ReviewOptions newReview) {
        return new ClusteringConfig(modelId, k, alpha, seed, threshold, weights, embedding, index,
                resolution, validation, newReview);
    }
}
