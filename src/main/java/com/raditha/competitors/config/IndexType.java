package com.raditha.competitors.config;

/**
 * Nearest-neighbour index implementations.
 */
public enum IndexType {
    /** Brute-force scan, exact results. */
    EXACT,
    /** Random-hyperplane locality sensitive hashing with exact re-ranking. */
    LSH;

    public static IndexType fromString(String value) {
        for (IndexType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown index type: " + value);
    }
}
