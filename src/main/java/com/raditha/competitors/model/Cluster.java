package com.raditha.competitors.model;

import java.util.List;

/**
 * A competitor cluster.
 *
 * @param id        Dense cluster id, 0 is the largest cluster
 * @param memberIds Company identifiers, sorted
 */
public record Cluster(int id, List<String> memberIds) {

    public Cluster {
        memberIds = List.copyOf(memberIds);
    }

    public int size() {
        return memberIds.size();
    }

    public boolean isSingleton() {
        return memberIds.size() == 1;
    }

    /**
     * Smallest member identifier, used to break ties between equal-size clusters.
     */
    public String smallestMember() {
        return memberIds.get(0);
    }
}
