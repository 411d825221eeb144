package com.raditha.competitors.config;

/**
 * Batching, parallelism and retry settings for embedding generation.
 *
 * @param batchSize           Texts per model call
 * @param workers             Size of the worker pool calling the model
 * @param maxAttempts         Attempts per batch before the run aborts
 * @param initialBackoffMillis Delay before the first retry; doubles on each further retry
 */
public record EmbeddingOptions(int batchSize, int workers, int maxAttempts, long initialBackoffMillis) {

    public EmbeddingOptions {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoffMillis < 0) {
            throw new IllegalArgumentException("initialBackoffMillis must be >= 0");
        }
    }

    public static EmbeddingOptions defaults() {
        return new EmbeddingOptions(
                64, // batchSize
                4, // workers
                3, // maxAttempts
                500); // initialBackoffMillis
    }
}
