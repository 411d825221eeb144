package com.raditha.competitors.embedding;

import com.raditha.competitors.ai.GeminiClient;

import java.io.IOException;
import java.util.Map;

/**
 * Resolves a configured model identifier to an {@link EmbeddingModel}.
 * <ul>
 * <li>{@code hashing-<dim>} offline feature hashing</li>
 * <li>{@code gemini:<model>} Gemini embedding API</li>
 * </ul>
 */
public final class EmbeddingModels {

    private EmbeddingModels() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @param modelId   Configured identifier
     * @param aiService The {@code ai_service} settings, used by remote models
     * @throws IOException if a remote model is requested without an API key
     */
    public static EmbeddingModel create(String modelId, Map<String, Object> aiService) throws IOException {
        if (modelId.startsWith(HashingEmbeddingModel.ID_PREFIX)) {
            String dim = modelId.substring(HashingEmbeddingModel.ID_PREFIX.length());
            try {
                return new HashingEmbeddingModel(Integer.parseInt(dim));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid hashing dimension in model id: " + modelId, e);
            }
        }
        if (modelId.startsWith(GeminiEmbeddingModel.ID_PREFIX)) {
            String model = modelId.substring(GeminiEmbeddingModel.ID_PREFIX.length());
            return new GeminiEmbeddingModel(new GeminiClient(aiService), model);
        }
        throw new IllegalArgumentException("Unknown embedding model: " + modelId
                + " (expected hashing-<dim> or gemini:<model>)");
    }
}
