package com.raditha.competitors.graph;

import java.util.Set;

/**
 * Jaccard similarity of category tag sets.
 */
public final class CategorySimilarity {

    private CategorySimilarity() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * |A ∩ B| / |A ∪ B|, or 0.0 when both sets are empty.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int intersection = 0;
        for (String tag : smaller) {
            if (larger.contains(tag)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }
}
