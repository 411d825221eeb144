package com.raditha.competitors.config;

/**
 * Validation and review-sample settings.
 *
 * @param sampleSize           Clusters drawn for manual review
 * @param membersPerSample     Members shown per sampled cluster
 * @param silhouetteSampleSize Points the silhouette is evaluated on for large spaces
 */
public record ValidationOptions(int sampleSize, int membersPerSample, int silhouetteSampleSize) {

    public ValidationOptions {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must be >= 0");
        }
        if (membersPerSample < 1) {
            throw new IllegalArgumentException("membersPerSample must be >= 1");
        }
        if (silhouetteSampleSize < 2) {
            throw new IllegalArgumentException("silhouetteSampleSize must be >= 2");
        }
    }

    public static ValidationOptions defaults() {
        return new ValidationOptions(10, 10, 10_000);
    }
}
