package com.raditha.competitors.pipeline;

import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.Exclusion;
import com.raditha.competitors.model.Partition;
import com.raditha.competitors.model.SimilarityGraph;
import com.raditha.competitors.model.ValidationReport;
import com.raditha.competitors.review.ReviewResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Output of every stage of one run.
 *
 * @param inputCompanies Records handed to the pipeline, including rejected rows
 * @param exclusions     Every excluded company, input defects first
 * @param space          Fused embeddings of the surviving companies
 * @param graph          Similarity graph
 * @param partition      Detected clusters
 * @param validation     Diagnostics
 * @param review         LLM review, {@code null} when it did not run
 */
public record PipelineResult(
        int inputCompanies,
        List<Exclusion> exclusions,
        EmbeddingSpace space,
        SimilarityGraph graph,
        Partition partition,
        ValidationReport validation,
        ReviewResult review) {

    public PipelineResult {
        exclusions = List.copyOf(exclusions);
    }

    public Optional<ReviewResult> reviewResult() {
        return Optional.ofNullable(review);
    }

    /**
     * Excluded company count per reason code, ordered by code.
     */
    public Map<String, Long> exclusionCounts() {
        Map<String, Long> counts = new TreeMap<>();
        for (Exclusion exclusion : exclusions) {
            counts.merge(exclusion.reason().name(), 1L, Long::sum);
        }
        return counts;
    }
}
