package com.raditha.competitors.index;

import com.raditha.competitors.embedding.VectorMath;
import com.raditha.competitors.exception.IndexBuildException;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Brute-force index: every query scores every other vector.
 * Exact results; quadratic cost, so best suited to small inputs and tests.
 */
public class ExactNearestNeighborIndex implements NearestNeighborIndex {

    private List<float[]> vectors = List.of();

    @Override
    public void build(List<float[]> vectors) {
        VectorChecks.requireUniformWidth(vectors);
        this.vectors = List.copyOf(vectors);
    }

    @Override
    public List<Neighbor> query(int node, int k) {
        if (node < 0 || node >= vectors.size()) {
            throw new IndexBuildException("Query node out of range: " + node);
        }
        float[] q = vectors.get(node);
        // worst kept neighbour at the head
        PriorityQueue<Neighbor> top = new PriorityQueue<>(Neighbor.BY_SIMILARITY.reversed());
        for (int i = 0; i < vectors.size(); i++) {
            if (i == node) {
                continue;
            }
            top.add(new Neighbor(i, VectorMath.dot(q, vectors.get(i))));
            if (top.size() > k) {
                top.poll();
            }
        }
        List<Neighbor> result = new ArrayList<>(top);
        result.sort(Neighbor.BY_SIMILARITY);
        return result;
    }
}
