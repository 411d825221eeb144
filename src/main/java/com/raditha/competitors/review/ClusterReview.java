package com.raditha.competitors.review;

import java.util.List;

/**
 * Review of a single cluster.
 *
 * @param clusterId       Cluster id
 * @param clusterSize     Total member count
 * @param summary         Segment summary written by the model
 * @param qualityScore    Cluster quality rating 1-10
 * @param qualityResponse Raw answer the quality rating was read from
 * @param memberFits      Fit rating per reviewed member
 */
public record ClusterReview(
        int clusterId,
        int clusterSize,
        String summary,
        double qualityScore,
        String qualityResponse,
        List<MemberFit> memberFits) {

    public ClusterReview {
        memberFits = List.copyOf(memberFits);
    }

    /**
     * Mean member fit, 0 when no member was rated.
     */
    public double averageFit() {
        return memberFits.stream().mapToDouble(MemberFit::score).average().orElse(0.0);
    }
}
