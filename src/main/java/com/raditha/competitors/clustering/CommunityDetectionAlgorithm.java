package com.raditha.competitors.clustering;

import com.raditha.competitors.model.SimilarityGraph;

/**
 * Partitions a weighted graph into communities.
 */
public interface CommunityDetectionAlgorithm {

    /**
     * @param graph Weighted undirected graph
     * @return Raw community label per node index; labels need not be dense
     */
    int[] detect(SimilarityGraph graph);
}
