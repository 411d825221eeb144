package com.raditha.competitors.model;

/**
 * The threshold actually applied to a graph.
 *
 * @param mode       Fixed or adaptive
 * @param value      Numeric tau used for edge retention
 * @param percentile Percentile used in adaptive mode, {@code null} when fixed
 */
public record ResolvedThreshold(ThresholdMode mode, double value, Double percentile) {

    public static ResolvedThreshold fixed(double value) {
        return new ResolvedThreshold(ThresholdMode.FIXED, value, null);
    }

    public static ResolvedThreshold percentile(double percentile, double value) {
        return new ResolvedThreshold(ThresholdMode.PERCENTILE, value, percentile);
    }
}
