package com.raditha.competitors.model;

/**
 * Silhouette score of a partition, or the reason it is undefined.
 *
 * @param defined       false for degenerate partitions
 * @param value         Mean silhouette over the evaluated points, NaN when undefined
 * @param sampledPoints Number of points the mean was computed over
 * @param reason        Why the score is undefined, empty when defined
 */
public record SilhouetteResult(boolean defined, double value, int sampledPoints, String reason) {

    public static SilhouetteResult of(double value, int sampledPoints) {
        return new SilhouetteResult(true, value, sampledPoints, "");
    }

    public static SilhouetteResult undefined(String reason) {
        return new SilhouetteResult(false, Double.NaN, 0, reason);
    }

    /**
     * Value suitable for JSON output: {@code null} when undefined.
     */
    public Double valueOrNull() {
        return defined ? value : null;
    }
}
