package com.raditha.competitors.validation;

import com.raditha.competitors.config.ClusteringConfig;
import com.raditha.competitors.graph.ThresholdResolver;
import com.raditha.competitors.model.Cluster;
import com.raditha.competitors.model.ClusterDensity;
import com.raditha.competitors.model.ClusterSample;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.Partition;
import com.raditha.competitors.model.SilhouetteResult;
import com.raditha.competitors.model.SimilarityEdge;
import com.raditha.competitors.model.SimilarityGraph;
import com.raditha.competitors.model.SizeDistribution;
import com.raditha.competitors.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes diagnostics for a partition: silhouette, graph and intra-cluster
 * densities, the cluster size distribution, and a seeded review sample.
 * Degenerate inputs yield undefined metrics rather than errors.
 */
public class ClusterValidator {
    private static final Logger logger = LoggerFactory.getLogger(ClusterValidator.class);

    static final int[] SIZE_PERCENTILES = { 10, 25, 50, 75, 90, 95, 99 };
    static final int SMALL_CLUSTER_MAX = 5;
    static final int MEDIUM_CLUSTER_MAX = 50;

    private final SilhouetteCalculator silhouetteCalculator;
    private final ClusterSampler sampler;

    public ClusterValidator(ClusteringConfig config) {
        this.silhouetteCalculator = new SilhouetteCalculator(
                config.validation().silhouetteSampleSize(), config.seed());
        this.sampler = new ClusterSampler(
                config.validation().sampleSize(), config.validation().membersPerSample(), config.seed());
    }

    /**
     * @param space     Embedding space the graph was built from
     * @param graph     Similarity graph, node {@code i} is row {@code i} of the space
     * @param partition Detected clusters
     */
    public ValidationReport validate(EmbeddingSpace space, SimilarityGraph graph, Partition partition) {
        int[] labels = partition.labels(graph.nodeIds());

        SilhouetteResult silhouette = silhouetteCalculator.compute(space, labels);
        if (silhouette.defined()) {
            logger.info("Silhouette score: {} over {} points",
                    String.format("%.4f", silhouette.value()), silhouette.sampledPoints());
        } else {
            logger.info("Silhouette score undefined: {}", silhouette.reason());
        }

        List<ClusterDensity> densities = clusterDensities(graph, partition, labels);
        double intraDensity = pooledDensity(densities);
        SizeDistribution sizes = sizeDistribution(partition);
        logger.info("Graph density {}, intra-cluster density {}, {} clusters (median size {})",
                String.format("%.6f", graph.density()), String.format("%.4f", intraDensity),
                sizes.clusterCount(), sizes.median());

        Map<String, Company> companies = new HashMap<>();
        for (Company company : space.companies()) {
            companies.put(company.id(), company);
        }
        List<ClusterSample> samples = sampler.sample(partition, companies);

        return new ValidationReport(silhouette, graph.density(), intraDensity, densities, sizes, samples);
    }

    static List<ClusterDensity> clusterDensities(SimilarityGraph graph, Partition partition, int[] labels) {
        long[] internal = new long[partition.clusterCount()];
        for (SimilarityEdge edge : graph.edges()) {
            int a = labels[edge.source()];
            if (a == labels[edge.target()]) {
                internal[a]++;
            }
        }
        List<ClusterDensity> densities = new ArrayList<>(partition.clusterCount());
        for (Cluster cluster : partition.clusters()) {
            long n = cluster.size();
            Double density = n < 2 ? null : internal[cluster.id()] / (n * (n - 1) / 2.0);
            densities.add(new ClusterDensity(cluster.id(), cluster.size(), internal[cluster.id()], density));
        }
        return densities;
    }

    /**
     * Internal edges over possible internal edges, summed across clusters.
     * Zero when no cluster has two or more members.
     */
    static double pooledDensity(List<ClusterDensity> densities) {
        long edges = 0;
        double possible = 0.0;
        for (ClusterDensity d : densities) {
            long n = d.size();
            edges += d.internalEdges();
            possible += n * (n - 1) / 2.0;
        }
        return possible > 0.0 ? edges / possible : 0.0;
    }

    static SizeDistribution sizeDistribution(Partition partition) {
        double[] sizes = partition.clusters().stream().mapToDouble(Cluster::size).sorted().toArray();
        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        if (sizes.length == 0) {
            for (int p : SIZE_PERCENTILES) {
                percentiles.put(p, 0.0);
            }
            return new SizeDistribution(0, 0, 0, 0, 0.0, 0.0, percentiles, 0, 0, 0, 0);
        }
        for (int p : SIZE_PERCENTILES) {
            percentiles.put(p, ThresholdResolver.percentile(sizes, p));
        }

        int singletons = 0;
        int small = 0;
        int medium = 0;
        int large = 0;
        for (double size : sizes) {
            if (size == 1) {
                singletons++;
            }
            if (size <= SMALL_CLUSTER_MAX) {
                small++;
            } else if (size <= MEDIUM_CLUSTER_MAX) {
                medium++;
            } else {
                large++;
            }
        }
        int companies = (int) Arrays.stream(sizes).sum();
        return new SizeDistribution(
                sizes.length,
                companies,
                (int) sizes[0],
                (int) sizes[sizes.length - 1],
                (double) companies / sizes.length,
                ThresholdResolver.percentile(sizes, 50),
                percentiles,
                singletons,
                small,
                medium,
                large);
    }
}
