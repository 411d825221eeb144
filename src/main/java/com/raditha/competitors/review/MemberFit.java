package com.raditha.competitors.review;

/**
 * How well one company fits its cluster.
 *
 * @param companyId Company identifier
 * @param name      Display name
 * @param score     Fit rating 1-10
 * @param response  Raw answer the rating was read from
 */
public record MemberFit(String companyId, String name, double score, String response) {
}
