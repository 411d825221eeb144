package com.raditha.competitors.graph;

import com.raditha.competitors.config.ThresholdOptions;
import com.raditha.competitors.model.ResolvedThreshold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Turns threshold settings into the numeric tau applied to candidate pairs.
 */
public class ThresholdResolver {
    private static final Logger logger = LoggerFactory.getLogger(ThresholdResolver.class);

    private final ThresholdOptions options;

    public ThresholdResolver(ThresholdOptions options) {
        this.options = options;
    }

    /**
     * @param scores Combined scores of all deduplicated candidate pairs
     * @return Fixed tau, or the configured percentile of {@code scores}
     */
    public ResolvedThreshold resolve(double[] scores) {
        return switch (options.mode()) {
            case FIXED -> ResolvedThreshold.fixed(options.tau());
            case PERCENTILE -> {
                if (scores.length == 0) {
                    logger.warn("No candidate pairs to derive a percentile threshold from; using tau={}",
                            options.tau());
                    yield ResolvedThreshold.percentile(options.percentile(), options.tau());
                }
                double[] sorted = scores.clone();
                Arrays.sort(sorted);
                yield ResolvedThreshold.percentile(options.percentile(), percentile(sorted, options.percentile()));
            }
        };
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param sorted Non-empty values in ascending order
     * @param p      Percentile in [0, 100]
     */
    public static double percentile(double[] sorted, double p) {
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (rank - lo);
    }
}
