package com.raditha.competitors.model;

import java.util.List;

/**
 * A cluster drawn for manual inspection.
 *
 * @param clusterId   Cluster id
 * @param clusterSize Total member count
 * @param members     Sampled members with full detail
 */
public record ClusterSample(int clusterId, int clusterSize, List<MemberDetail> members) {

    public ClusterSample {
        members = List.copyOf(members);
    }
}
