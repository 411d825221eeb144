package com.raditha.competitors.model;

import java.util.List;
import java.util.Map;

/**
 * Assignment of every graph node to exactly one cluster.
 *
 * @param clusters   Clusters ordered by id
 * @param assignment Company identifier to cluster id
 * @param modularity Modularity of the partition on the similarity graph
 */
public record Partition(List<Cluster> clusters, Map<String, Integer> assignment, double modularity) {

    public Partition {
        clusters = List.copyOf(clusters);
        assignment = Map.copyOf(assignment);
    }

    public int clusterCount() {
        return clusters.size();
    }

    public int clusterOf(String companyId) {
        Integer id = assignment.get(companyId);
        if (id == null) {
            throw new IllegalArgumentException("Company not in partition: " + companyId);
        }
        return id;
    }

    public Cluster cluster(int id) {
        return clusters.get(id);
    }

    /**
     * Cluster labels aligned with the given node order.
     */
    public int[] labels(List<String> nodeIds) {
        int[] labels = new int[nodeIds.size()];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = clusterOf(nodeIds.get(i));
        }
        return labels;
    }
}
