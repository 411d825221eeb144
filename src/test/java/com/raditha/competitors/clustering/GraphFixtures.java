package com.raditha.competitors.clustering;

import com.raditha.competitors.model.ResolvedThreshold;
import com.raditha.competitors.model.SimilarityEdge;
import com.raditha.competitors.model.SimilarityGraph;

import java.util.ArrayList;
import java.util.List;

final class GraphFixtures {

    private GraphFixtures() {
    }

    static SimilarityGraph graph(int nodes, List<SimilarityEdge> edges) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < nodes; i++) {
            ids.add(String.format("n%02d", i));
        }
        return new SimilarityGraph(ids, edges, ResolvedThreshold.fixed(0.5), edges.size());
    }

    /**
     * Cliques of the given size with weight 0.9 inside, joined in a chain by 0.1 bridges.
     */
    static SimilarityGraph cliques(int count, int size) {
        List<SimilarityEdge> edges = new ArrayList<>();
        for (int c = 0; c < count; c++) {
            int base = c * size;
            for (int i = 0; i < size; i++) {
                for (int j = i + 1; j < size; j++) {
                    edges.add(new SimilarityEdge(base + i, base + j, 0.9));
                }
            }
            if (c > 0) {
                edges.add(new SimilarityEdge(base - 1, base, 0.1));
            }
        }
        return graph(count * size, edges);
    }
}
