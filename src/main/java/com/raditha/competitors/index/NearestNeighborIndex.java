package com.raditha.competitors.index;

import com.raditha.competitors.config.IndexOptions;

import java.util.List;

/**
 * k-nearest-neighbour lookup by cosine similarity over unit vectors.
 * {@link #query} may be called from several threads once {@link #build} returns.
 */
public interface NearestNeighborIndex {

    /**
     * Index the given vectors. Row {@code i} becomes node {@code i}.
     *
     * @throws com.raditha.competitors.exception.IndexBuildException if the vectors
     *         cannot be indexed
     */
    void build(List<float[]> vectors);

    /**
     * Nearest neighbours of an indexed node, excluding the node itself.
     *
     * @param node Row of the query vector
     * @param k    Maximum number of neighbours
     * @return Up to {@code k} neighbours ordered by {@link Neighbor#BY_SIMILARITY}
     */
    List<Neighbor> query(int node, int k);

    /**
     * Create the index described by the options.
     */
    static NearestNeighborIndex create(IndexOptions options, long seed) {
        return switch (options.type()) {
            case EXACT -> new ExactNearestNeighborIndex();
            case LSH -> new HyperplaneLshIndex(options.numBands(), options.rowsPerBand(),
                    options.maxCandidates(), seed);
        };
    }
}
