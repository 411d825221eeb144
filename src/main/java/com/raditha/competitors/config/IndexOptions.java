package com.raditha.competitors.config;

/**
 * Nearest-neighbour index settings.
 *
 * @param type          Index implementation
 * @param numBands      LSH bands
 * @param rowsPerBand   Hyperplanes per band (bits per bucket key)
 * @param maxCandidates Upper bound on candidates re-ranked per LSH query
 */
public record IndexOptions(IndexType type, int numBands, int rowsPerBand, int maxCandidates) {

    public IndexOptions {
        if (type == null) {
            throw new IllegalArgumentException("index type cannot be null");
        }
        if (numBands < 1 || numBands > 255) {
            throw new IllegalArgumentException("numBands must be between 1 and 255");
        }
        if (rowsPerBand < 1 || rowsPerBand > 56) {
            throw new IllegalArgumentException("rowsPerBand must be between 1 and 56");
        }
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be >= 1");
        }
    }

    public static IndexOptions exact() {
        return new IndexOptions(IndexType.EXACT, 16, 12, 2000);
    }

    public static IndexOptions lsh() {
        return new IndexOptions(IndexType.LSH, 16, 12, 2000);
    }
}
