package com.raditha.competitors.model;

/**
 * Undirected weighted edge between two graph nodes.
 * Endpoints are stored in ascending order so that (a,b) and (b,a) are the same
 * value.
 *
 * @param source Lower node index
 * @param target Higher node index
 * @param score  Combined similarity in [0,1]
 */
public record SimilarityEdge(int source, int target, double score) {

    public SimilarityEdge {
        if (source == target) {
            throw new IllegalArgumentException("Self-loops are not allowed: " + source);
        }
        if (score < 0.0 || score > 1.0 || Double.isNaN(score)) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
        if (source > target) {
            int tmp = source;
            source = target;
            target = tmp;
        }
    }

    /**
     * The endpoint opposite to {@code node}.
     */
    public int other(int node) {
        return node == source ? target : source;
    }
}
