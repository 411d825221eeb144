package com.raditha.competitors.index;

import java.util.Comparator;

/**
 * A nearest-neighbour hit.
 *
 * @param index      Row of the neighbour in the indexed vectors
 * @param similarity Cosine similarity to the query vector
 */
public record Neighbor(int index, double similarity) {

    /**
     * Most similar first; equal similarities by ascending row.
     */
    public static final Comparator<Neighbor> BY_SIMILARITY = Comparator
            .comparingDouble(Neighbor::similarity).reversed()
            .thenComparingInt(Neighbor::index);
}
