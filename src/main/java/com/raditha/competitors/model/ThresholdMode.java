package com.raditha.competitors.model;

/**
 * How the edge threshold tau is determined.
 */
public enum ThresholdMode {
    /** tau is taken verbatim from configuration. */
    FIXED,
    /** tau is a percentile of the observed combined-score distribution. */
    PERCENTILE;

    public static ThresholdMode fromString(String value) {
        for (ThresholdMode mode : values()) {
            if (mode.name().equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown threshold mode: " + value);
    }
}
