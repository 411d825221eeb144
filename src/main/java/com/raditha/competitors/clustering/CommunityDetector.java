package com.raditha.competitors.clustering;

import com.raditha.competitors.config.ClusteringConfig;
import com.raditha.competitors.exception.CommunityDetectionException;
import com.raditha.competitors.model.Cluster;
import com.raditha.competitors.model.Partition;
import com.raditha.competitors.model.SimilarityEdge;
import com.raditha.competitors.model.SimilarityGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns the similarity graph into competitor clusters.
 * Runs the community detection algorithm, checks the raw membership and assigns
 * dense cluster ids: 0 is the largest cluster, equal sizes are ordered by their
 * smallest member identifier.
 */
public class CommunityDetector {
    private static final Logger logger = LoggerFactory.getLogger(CommunityDetector.class);

    private static final Comparator<List<String>> CLUSTER_ORDER = Comparator
            .<List<String>>comparingInt(List::size).reversed()
            .thenComparing(members -> members.get(0));

    private final CommunityDetectionAlgorithm algorithm;
    private final double resolution;

    public CommunityDetector(ClusteringConfig config) {
        this(new LouvainCommunityDetection(config.resolution(), config.seed()), config.resolution());
    }

    public CommunityDetector(CommunityDetectionAlgorithm algorithm, double resolution) {
        this.algorithm = algorithm;
        this.resolution = resolution;
    }

    /**
     * @param graph Similarity graph
     * @return Partition covering every node exactly once
     * @throws CommunityDetectionException if the algorithm fails or returns an invalid membership
     */
    public Partition detect(SimilarityGraph graph) {
        logger.info("Detecting communities on {} nodes / {} edges", graph.nodeCount(), graph.edgeCount());

        int[] membership;
        try {
            membership = algorithm.detect(graph);
        } catch (CommunityDetectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CommunityDetectionException("Community detection failed: " + e.getMessage(), e);
        }
        validate(membership, graph.nodeCount());

        Map<Integer, List<String>> groups = new TreeMap<>();
        for (int i = 0; i < membership.length; i++) {
            groups.computeIfAbsent(membership[i], c -> new ArrayList<>()).add(graph.nodeId(i));
        }
        List<List<String>> ordered = new ArrayList<>(groups.values());
        for (List<String> members : ordered) {
            members.sort(Comparator.naturalOrder());
        }
        ordered.sort(CLUSTER_ORDER);

        List<Cluster> clusters = new ArrayList<>(ordered.size());
        Map<String, Integer> assignment = new HashMap<>();
        int[] labels = new int[membership.length];
        Map<String, Integer> nodeIndex = new HashMap<>();
        for (int i = 0; i < graph.nodeCount(); i++) {
            nodeIndex.put(graph.nodeId(i), i);
        }
        for (int id = 0; id < ordered.size(); id++) {
            List<String> members = ordered.get(id);
            clusters.add(new Cluster(id, members));
            for (String member : members) {
                assignment.put(member, id);
                labels[nodeIndex.get(member)] = id;
            }
        }

        double modularity = modularity(graph, labels, resolution);
        long singletons = clusters.stream().filter(Cluster::isSingleton).count();
        logger.info("Found {} clusters ({} singletons, largest {}), modularity {}",
                clusters.size(), singletons, clusters.isEmpty() ? 0 : clusters.get(0).size(),
                String.format("%.4f", modularity));
        return new Partition(clusters, assignment, modularity);
    }

    private static void validate(int[] membership, int nodeCount) {
        if (membership == null) {
            throw new CommunityDetectionException("Community detection returned no membership");
        }
        if (membership.length != nodeCount) {
            throw new CommunityDetectionException(String.format(
                    "Membership covers %d nodes but the graph has %d", membership.length, nodeCount));
        }
        for (int i = 0; i < membership.length; i++) {
            if (membership[i] < 0) {
                throw new CommunityDetectionException(
                        String.format("Node %d has invalid community label %d", i, membership[i]));
            }
        }
    }

    /**
     * Newman modularity with resolution: sum over communities of
     * {@code in_c / m - resolution * (tot_c / 2m)^2}. Zero for a graph without edges.
     */
    public static double modularity(SimilarityGraph graph, int[] labels, double resolution) {
        double m = graph.totalWeight();
        if (m <= 0.0) {
            return 0.0;
        }
        Map<Integer, Double> internal = new HashMap<>();
        Map<Integer, Double> total = new HashMap<>();
        for (SimilarityEdge edge : graph.edges()) {
            int a = labels[edge.source()];
            int b = labels[edge.target()];
            if (a == b) {
                internal.merge(a, edge.score(), Double::sum);
            }
            total.merge(a, edge.score(), Double::sum);
            total.merge(b, edge.score(), Double::sum);
        }
        double q = 0.0;
        for (Map.Entry<Integer, Double> entry : total.entrySet()) {
            double in = internal.getOrDefault(entry.getKey(), 0.0);
            double tot = entry.getValue();
            q += in / m - resolution * (tot / (2.0 * m)) * (tot / (2.0 * m));
        }
        return q;
    }
}
