package com.raditha.competitors.export;

import com.raditha.competitors.model.ClusterSample;
import com.raditha.competitors.model.SizeDistribution;
import com.raditha.competitors.review.ReviewSummary;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything recorded in {@code metadata.json} for one run.
 *
 * @param timestamp         When the run finished
 * @param settings          Resolved configuration
 * @param metrics           Counts and validation metrics
 * @param validationSamples Clusters drawn for manual review
 * @param exclusions        Excluded company count per reason code
 * @param outputFiles       Names of the files written to the output directory
 * @param llmValidation     Review aggregate, {@code null} when no review ran
 */
public record RunMetadata(
        LocalDateTime timestamp,
        Settings settings,
        Metrics metrics,
        List<ClusterSample> validationSamples,
        Map<String, Long> exclusions,
        List<String> outputFiles,
        ReviewSummary llmValidation) {

    /**
     * Configuration the run actually used, with tau resolved.
     */
    public record Settings(
            String modelName,
            int embeddingDimension,
            int k,
            String thresholdMode,
            double tau,
            Double tauPercentile,
            double alpha,
            double textWeight,
            double categoryWeight,
            long seed,
            String indexType,
            double resolution) {
    }

    public record Metrics(
            int inputCompanies,
            int clusteredCompanies,
            int excludedCompanies,
            int candidatePairs,
            int edges,
            int clusters,
            double modularity,
            Double silhouetteScore,
            int silhouetteSampledPoints,
            String silhouetteNote,
            double graphDensity,
            double intraClusterDensity,
            SizeDistribution clusterSizes) {
    }
}
