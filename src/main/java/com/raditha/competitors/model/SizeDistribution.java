package com.raditha.competitors.model;

import java.util.Map;

/**
 * Summary of cluster sizes.
 *
 * @param clusterCount   Number of clusters
 * @param companyCount   Number of clustered companies
 * @param min            Smallest cluster size
 * @param max            Largest cluster size
 * @param mean           Mean cluster size
 * @param median         Median cluster size
 * @param percentiles    Size at the 10/25/50/75/90/95/99th percentile, keyed by percentile
 * @param singletons     Clusters with one member
 * @param smallClusters  Clusters with at most 5 members
 * @param mediumClusters Clusters with 6 to 50 members
 * @param largeClusters  Clusters with more than 50 members
 */
public record SizeDistribution(
        int clusterCount,
        int companyCount,
        int min,
        int max,
        double mean,
        double median,
        Map<Integer, Double> percentiles,
        int singletons,
        int smallClusters,
        int mediumClusters,
        int largeClusters) {
}
