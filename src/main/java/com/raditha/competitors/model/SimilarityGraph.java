package com.raditha.competitors.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Sparse, symmetric, self-loop-free weighted graph over company identifiers.
 * Edges are kept once per unordered pair, sorted by (source, target). The
 * adjacency view lists each edge under both endpoints.
 */
public class SimilarityGraph {

    private static final Comparator<SimilarityEdge> EDGE_ORDER = Comparator
            .comparingInt(SimilarityEdge::source)
            .thenComparingInt(SimilarityEdge::target);

    private final List<String> nodeIds;
    private final List<SimilarityEdge> edges;
    private final ResolvedThreshold threshold;
    private final int candidatePairs;

    private final int[][] neighbors;
    private final double[][] weights;

    /**
     * @param nodeIds        Company identifier per node index
     * @param edges          Undirected edges, at most one per pair
     * @param threshold      Threshold the edges were filtered with
     * @param candidatePairs Number of distinct candidate pairs that were scored
     */
    public SimilarityGraph(List<String> nodeIds, List<SimilarityEdge> edges,
            ResolvedThreshold threshold, int candidatePairs) {
        this.nodeIds = List.copyOf(nodeIds);
        List<SimilarityEdge> sorted = new ArrayList<>(edges);
        sorted.sort(EDGE_ORDER);
        for (int i = 1; i < sorted.size(); i++) {
            SimilarityEdge prev = sorted.get(i - 1);
            SimilarityEdge cur = sorted.get(i);
            if (prev.source() == cur.source() && prev.target() == cur.target()) {
                throw new IllegalArgumentException(
                        String.format("Duplicate edge (%d, %d)", cur.source(), cur.target()));
            }
        }
        for (SimilarityEdge edge : sorted) {
            if (edge.target() >= this.nodeIds.size()) {
                throw new IllegalArgumentException("Edge endpoint out of range: " + edge.target());
            }
        }
        this.edges = List.copyOf(sorted);
        this.threshold = threshold;
        this.candidatePairs = candidatePairs;

        int n = this.nodeIds.size();
        int[] degree = new int[n];
        for (SimilarityEdge edge : this.edges) {
            degree[edge.source()]++;
            degree[edge.target()]++;
        }
        this.neighbors = new int[n][];
        this.weights = new double[n][];
        for (int i = 0; i < n; i++) {
            neighbors[i] = new int[degree[i]];
            weights[i] = new double[degree[i]];
        }
        int[] fill = new int[n];
        // lower neighbours first, then higher ones; both passes follow edge order so rows come out sorted
        for (SimilarityEdge edge : this.edges) {
            int s = edge.source();
            int t = edge.target();
            neighbors[t][fill[t]] = s;
            weights[t][fill[t]++] = edge.score();
        }
        for (SimilarityEdge edge : this.edges) {
            int s = edge.source();
            int t = edge.target();
            neighbors[s][fill[s]] = t;
            weights[s][fill[s]++] = edge.score();
        }
    }

    public List<String> nodeIds() {
        return nodeIds;
    }

    public String nodeId(int index) {
        return nodeIds.get(index);
    }

    public int nodeCount() {
        return nodeIds.size();
    }

    public List<SimilarityEdge> edges() {
        return edges;
    }

    public int edgeCount() {
        return edges.size();
    }

    public ResolvedThreshold threshold() {
        return threshold;
    }

    public int candidatePairs() {
        return candidatePairs;
    }

    /**
     * Neighbour indices of a node in ascending order. The returned array must
     * not be modified.
     */
    public int[] neighbors(int node) {
        return neighbors[node];
    }

    /**
     * Edge weights aligned with {@link #neighbors(int)}.
     */
    public double[] neighborWeights(int node) {
        return weights[node];
    }

    public int degree(int node) {
        return neighbors[node].length;
    }

    public boolean hasEdge(int a, int b) {
        return score(a, b).isPresent();
    }

    public OptionalDouble score(int a, int b) {
        int pos = Arrays.binarySearch(neighbors[a], b);
        return pos >= 0 ? OptionalDouble.of(weights[a][pos]) : OptionalDouble.empty();
    }

    /**
     * Total edge weight, each undirected edge counted once.
     */
    public double totalWeight() {
        double total = 0.0;
        for (SimilarityEdge edge : edges) {
            total += edge.score();
        }
        return total;
    }

    /**
     * Edge count divided by the number of possible edges among all nodes.
     * Zero for graphs with fewer than two nodes.
     */
    public double density() {
        long n = nodeIds.size();
        if (n < 2) {
            return 0.0;
        }
        return edges.size() / (n * (n - 1) / 2.0);
    }
}
