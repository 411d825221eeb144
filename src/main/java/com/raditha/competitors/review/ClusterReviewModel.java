package com.raditha.competitors.review;

/**
 * Free-text question answering used to review clusters.
 */
public interface ClusterReviewModel {

    /**
     * @param prompt Complete prompt including instructions
     * @return The model's answer
     * @throws ReviewException if the model cannot answer
     */
    String ask(String prompt);
}
