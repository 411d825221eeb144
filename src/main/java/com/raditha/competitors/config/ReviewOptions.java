package com.raditha.competitors.config;

/**
 * LLM cluster review settings.
 *
 * @param enabled  Run the review after validation
 * @param clusters Maximum clusters to review
 * @param model    Generative model used for the review
 */
public record ReviewOptions(boolean enabled, int clusters, String model) {

    public ReviewOptions {
        if (clusters < 1) {
            throw new IllegalArgumentException("review clusters must be >= 1");
        }
        if (model == null || model.isBlank()) {
            model = "gemini-2.0-flash";
        }
    }

    public static ReviewOptions disabled() {
        return new ReviewOptions(false, 10, "gemini-2.0-flash");
    }
}
