package com.raditha.competitors.model;

/**
 * Reason codes for companies left out of the embedding space.
 */
public enum ExclusionReason {
    /** Both customer and product descriptions normalize to empty text. */
    EMPTY_DESCRIPTIONS,
    /** The fused vector has zero length and cannot be normalized. */
    ZERO_NORM_EMBEDDING,
    /** The identifier was already used by an earlier record. */
    DUPLICATE_IDENTIFIER,
    /** The record has no identifier. */
    MISSING_IDENTIFIER
}
