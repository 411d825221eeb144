package com.raditha.competitors.model;

/**
 * Edge density inside one cluster.
 *
 * @param clusterId     Cluster id
 * @param size          Member count
 * @param internalEdges Edges with both endpoints in the cluster
 * @param density       internalEdges / possible internal edges, {@code null} for singletons
 */
public record ClusterDensity(int clusterId, int size, long internalEdges, Double density) {
}
