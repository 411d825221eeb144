package com.raditha.competitors.review;

import java.util.List;

/**
 * Outcome of an LLM review run.
 *
 * @param model   Model that answered
 * @param reviews Completed cluster reviews, in review order
 * @param summary Aggregate quality figures
 */
public record ReviewResult(String model, List<ClusterReview> reviews, ReviewSummary summary) {

    public ReviewResult {
        reviews = List.copyOf(reviews);
    }
}
