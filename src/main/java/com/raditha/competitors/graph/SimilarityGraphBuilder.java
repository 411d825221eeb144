package com.raditha.competitors.graph;

import com.raditha.competitors.config.ClusteringConfig;
import com.raditha.competitors.config.SimilarityWeights;
import com.raditha.competitors.embedding.VectorMath;
import com.raditha.competitors.exception.IndexBuildException;
import com.raditha.competitors.index.NearestNeighborIndex;
import com.raditha.competitors.index.Neighbor;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.ResolvedThreshold;
import com.raditha.competitors.model.SimilarityEdge;
import com.raditha.competitors.model.SimilarityGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.IntStream;

/**
 * Builds the sparse competitor similarity graph.
 *
 * <p>
 * Every company is queried for its {@code k} nearest neighbours. Each distinct
 * candidate pair is scored once as
 * {@code w_text * clamp(cos) + w_category * jaccard(tags)}; pairs scoring at least
 * tau become undirected edges. A pair found from both endpoints is kept once.
 */
public class SimilarityGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SimilarityGraphBuilder.class);

    private final int k;
    private final SimilarityWeights weights;
    private final ThresholdResolver thresholdResolver;
    private final NearestNeighborIndex index;

    public SimilarityGraphBuilder(ClusteringConfig config) {
        this(config, NearestNeighborIndex.create(config.index(), config.seed()));
    }

    public SimilarityGraphBuilder(ClusteringConfig config, NearestNeighborIndex index) {
        this.k = config.k();
        this.weights = config.weights();
        this.thresholdResolver = new ThresholdResolver(config.threshold());
        this.index = index;
    }

    /**
     * @param space Fused embeddings
     * @return Graph whose node {@code i} is row {@code i} of the space
     * @throws IndexBuildException if the neighbour index cannot be built or queried
     */
    public SimilarityGraph build(EmbeddingSpace space) {
        int n = space.size();
        logger.info("Building similarity graph over {} companies (k={})", n, k);

        List<List<Neighbor>> neighbourLists = findNeighbours(space);

        // key = source << 32 | target with source < target; TreeMap keeps edge order
        Map<Long, Double> candidates = new TreeMap<>();
        for (int i = 0; i < n; i++) {
            for (Neighbor neighbor : neighbourLists.get(i)) {
                if (neighbor.index() == i) {
                    continue;
                }
                int a = Math.min(i, neighbor.index());
                int b = Math.max(i, neighbor.index());
                long key = ((long) a << 32) | b;
                if (!candidates.containsKey(key)) {
                    candidates.put(key, score(space, a, b));
                }
            }
        }

        double[] scores = candidates.values().stream().mapToDouble(Double::doubleValue).toArray();
        ResolvedThreshold threshold = thresholdResolver.resolve(scores);

        List<SimilarityEdge> edges = new ArrayList<>();
        for (Map.Entry<Long, Double> entry : candidates.entrySet()) {
            if (entry.getValue() >= threshold.value()) {
                long key = entry.getKey();
                edges.add(new SimilarityEdge((int) (key >>> 32), (int) key, entry.getValue()));
            }
        }

        logger.info("Scored {} candidate pairs; tau={} ({}) kept {} edges",
                candidates.size(), String.format("%.4f", threshold.value()), threshold.mode(), edges.size());
        return new SimilarityGraph(space.ids(), edges, threshold, candidates.size());
    }

    private List<List<Neighbor>> findNeighbours(EmbeddingSpace space) {
        try {
            index.build(space.vectors());
            return IntStream.range(0, space.size())
                    .parallel()
                    .mapToObj(i -> index.query(i, k))
                    .toList();
        } catch (IndexBuildException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IndexBuildException("Nearest-neighbour index failed: " + e.getMessage(), e);
        }
    }

    /**
     * Combined score of a pair, clamped to [0,1].
     */
    double score(EmbeddingSpace space, int a, int b) {
        double text = VectorMath.clampedCosine(space.vector(a), space.vector(b));
        Company ca = space.companies().get(a);
        Company cb = space.companies().get(b);
        double category = CategorySimilarity.jaccard(ca.categories(), cb.categories());
        double combined = weights.combine(text, category);
        return Math.max(0.0, Math.min(1.0, combined));
    }
}
