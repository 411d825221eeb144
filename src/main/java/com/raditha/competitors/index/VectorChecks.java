package com.raditha.competitors.index;

import com.raditha.competitors.exception.IndexBuildException;

import java.util.List;

final class VectorChecks {

    private VectorChecks() {
    }

    /**
     * Every vector must be present, finite and of the same width.
     */
    static int requireUniformWidth(List<float[]> vectors) {
        if (vectors == null) {
            throw new IndexBuildException("No vectors to index");
        }
        int width = -1;
        for (int i = 0; i < vectors.size(); i++) {
            float[] v = vectors.get(i);
            if (v == null) {
                throw new IndexBuildException("Vector " + i + " is missing");
            }
            if (width < 0) {
                width = v.length;
            } else if (v.length != width) {
                throw new IndexBuildException(String.format(
                        "Vector %d has width %d, expected %d", i, v.length, width));
            }
            for (float x : v) {
                if (!Float.isFinite(x)) {
                    throw new IndexBuildException("Vector " + i + " contains a non-finite value");
                }
            }
        }
        return Math.max(width, 0);
    }
}
