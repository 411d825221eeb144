package com.raditha.competitors.clustering;

import com.raditha.competitors.model.SimilarityGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Louvain modularity optimization with a resolution parameter.
 *
 * <p>
 * Each level runs a local-moving phase, where nodes visited in a seeded random
 * order join the neighbouring community with the largest modularity gain, followed
 * by an aggregation phase that collapses communities into single nodes. Levels
 * repeat until no node moves. A node only leaves its community for a strictly
 * better one, and neighbouring communities are tried in ascending node order, so
 * a fixed seed always yields the same labels.
 */
public class LouvainCommunityDetection implements CommunityDetectionAlgorithm {
    private static final Logger logger = LoggerFactory.getLogger(LouvainCommunityDetection.class);

    private static final double MIN_GAIN = 1e-12;
    private static final int MAX_PASSES = 100;

    private final double resolution;
    private final long seed;

    public LouvainCommunityDetection(double resolution, long seed) {
        if (resolution <= 0.0) {
            throw new IllegalArgumentException("resolution must be > 0");
        }
        this.resolution = resolution;
        this.seed = seed;
    }

    @Override
    public int[] detect(SimilarityGraph graph) {
        int n = graph.nodeCount();
        int[] membership = new int[n];
        for (int i = 0; i < n; i++) {
            membership[i] = i;
        }
        double m = graph.totalWeight();
        if (n == 0 || m <= 0.0) {
            return membership;
        }

        Random random = new Random(seed);
        Level level = Level.of(graph);
        int depth = 0;
        while (true) {
            int[] communities = moveNodes(level, m, random);
            int count = relabel(communities);
            depth++;
            if (count == level.size()) {
                break;
            }
            for (int i = 0; i < n; i++) {
                membership[i] = communities[membership[i]];
            }
            logger.debug("Louvain level {}: {} nodes -> {} communities", depth, level.size(), count);
            level = level.aggregate(communities, count);
        }
        return membership;
    }

    /**
     * Local-moving phase.
     *
     * @return Community per node of this level
     */
    private int[] moveNodes(Level level, double m, Random random) {
        int n = level.size();
        int[] community = new int[n];
        double[] total = new double[n];
        for (int i = 0; i < n; i++) {
            community[i] = i;
            total[i] = level.degree[i];
        }

        int[] order = shuffledOrder(n, random);
        double[] linkWeight = new double[n];
        int[] touched = new int[n];
        double twoM = 2.0 * m;

        boolean moved = true;
        int passes = 0;
        while (moved && passes < MAX_PASSES) {
            moved = false;
            passes++;
            for (int node : order) {
                int current = community[node];
                double k = level.degree[node];
                total[current] -= k;

                // weights to neighbouring communities, in first-seen order
                int touchedCount = 0;
                linkWeight[current] = 0.0;
                touched[touchedCount++] = current;
                int[] nbrs = level.neighbors[node];
                double[] ws = level.weights[node];
                for (int j = 0; j < nbrs.length; j++) {
                    int c = community[nbrs[j]];
                    if (linkWeight[c] == 0.0 && !contains(touched, touchedCount, c)) {
                        touched[touchedCount++] = c;
                    }
                    linkWeight[c] += ws[j];
                }

                int best = current;
                double bestGain = linkWeight[current] - resolution * total[current] * k / twoM;
                for (int t = 1; t < touchedCount; t++) {
                    int c = touched[t];
                    double gain = linkWeight[c] - resolution * total[c] * k / twoM;
                    if (gain > bestGain + MIN_GAIN) {
                        best = c;
                        bestGain = gain;
                    }
                }

                for (int t = 0; t < touchedCount; t++) {
                    linkWeight[touched[t]] = 0.0;
                }
                total[best] += k;
                if (best != current) {
                    community[node] = best;
                    moved = true;
                }
            }
        }
        return community;
    }

    private static boolean contains(int[] values, int count, int value) {
        for (int i = 0; i < count; i++) {
            if (values[i] == value) {
                return true;
            }
        }
        return false;
    }

    private static int[] shuffledOrder(int n, Random random) {
        int[] order = new int[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
        return order;
    }

    /**
     * Renumber communities densely in order of first appearance.
     *
     * @return Number of communities
     */
    private static int relabel(int[] communities) {
        int[] mapping = new int[communities.length];
        Arrays.fill(mapping, -1);
        int next = 0;
        for (int i = 0; i < communities.length; i++) {
            int c = communities[i];
            if (mapping[c] < 0) {
                mapping[c] = next++;
            }
            communities[i] = mapping[c];
        }
        return next;
    }

    /**
     * Graph of one Louvain level. Collapsed communities keep their internal weight
     * as a self loop, which counts twice towards the degree.
     */
    private static final class Level {
        final int[][] neighbors;
        final double[][] weights;
        final double[] selfLoops;
        final double[] degree;

        Level(int[][] neighbors, double[][] weights, double[] selfLoops) {
            this.neighbors = neighbors;
            this.weights = weights;
            this.selfLoops = selfLoops;
            this.degree = new double[neighbors.length];
            for (int i = 0; i < neighbors.length; i++) {
                double d = 2.0 * selfLoops[i];
                for (double w : weights[i]) {
                    d += w;
                }
                degree[i] = d;
            }
        }

        static Level of(SimilarityGraph graph) {
            int n = graph.nodeCount();
            int[][] neighbors = new int[n][];
            double[][] weights = new double[n][];
            for (int i = 0; i < n; i++) {
                neighbors[i] = graph.neighbors(i);
                weights[i] = graph.neighborWeights(i);
            }
            return new Level(neighbors, weights, new double[n]);
        }

        int size() {
            return neighbors.length;
        }

        Level aggregate(int[] communities, int count) {
            double[] selfLoops = new double[count];
            List<Map<Integer, Double>> links = new ArrayList<>(count);
            for (int c = 0; c < count; c++) {
                links.add(new HashMap<>());
            }
            for (int i = 0; i < size(); i++) {
                int ci = communities[i];
                selfLoops[ci] += this.selfLoops[i];
                for (int j = 0; j < neighbors[i].length; j++) {
                    int other = neighbors[i][j];
                    if (other <= i) {
                        continue;
                    }
                    int cj = communities[other];
                    double w = weights[i][j];
                    if (ci == cj) {
                        selfLoops[ci] += w;
                    } else {
                        links.get(ci).merge(cj, w, Double::sum);
                        links.get(cj).merge(ci, w, Double::sum);
                    }
                }
            }

            int[][] nbrs = new int[count][];
            double[][] ws = new double[count][];
            for (int c = 0; c < count; c++) {
                int[] keys = links.get(c).keySet().stream().mapToInt(Integer::intValue).sorted().toArray();
                nbrs[c] = keys;
                ws[c] = new double[keys.length];
                for (int j = 0; j < keys.length; j++) {
                    ws[c][j] = links.get(c).get(keys[j]);
                }
            }
            return new Level(nbrs, ws, selfLoops);
        }
    }
}
