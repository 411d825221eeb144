package com.raditha.competitors.config;

import com.raditha.competitors.model.ThresholdMode;

/**
 * Edge threshold settings.
 *
 * @param mode       FIXED uses {@code tau}; PERCENTILE derives tau from the score distribution
 * @param tau        Fixed threshold, non-negative; above 1.0 no pair qualifies
 * @param percentile Percentile used in adaptive mode (0-100)
 */
public record ThresholdOptions(ThresholdMode mode, double tau, double percentile) {

    public ThresholdOptions {
        if (mode == null) {
            throw new IllegalArgumentException("threshold mode cannot be null");
        }
        if (!Double.isFinite(tau) || tau < 0.0) {
            throw new IllegalArgumentException("tau must be a finite value >= 0.0");
        }
        if (percentile < 0.0 || percentile > 100.0) {
            throw new IllegalArgumentException("percentile must be between 0 and 100");
        }
    }

    public static ThresholdOptions fixed(double tau) {
        return new ThresholdOptions(ThresholdMode.FIXED, tau, 90.0);
    }

    public static ThresholdOptions percentile(double percentile) {
        return new ThresholdOptions(ThresholdMode.PERCENTILE, 0.55, percentile);
    }
}
