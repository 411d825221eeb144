package com.raditha.competitors.model;

import java.util.List;

/**
 * Diagnostics for one clustering run.
 *
 * @param silhouette           Silhouette score over the embedding space
 * @param graphDensity         Edge count over possible edge count
 * @param intraClusterDensity  Internal edges over possible internal edges, all clusters pooled
 * @param clusterDensities     Per-cluster intra-density, ordered by cluster id
 * @param sizeDistribution     Cluster size summary
 * @param samples              Seeded sample of clusters for manual review
 */
public record ValidationReport(
        SilhouetteResult silhouette,
        double graphDensity,
        double intraClusterDensity,
        List<ClusterDensity> clusterDensities,
        SizeDistribution sizeDistribution,
        List<ClusterSample> samples) {

    public ValidationReport {
        clusterDensities = List.copyOf(clusterDensities);
        samples = List.copyOf(samples);
    }
}
