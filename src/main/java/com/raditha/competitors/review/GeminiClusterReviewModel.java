package com.raditha.competitors.review;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.competitors.ai.GeminiClient;

import java.io.IOException;

/**
 * Review model backed by the Gemini {@code generateContent} endpoint.
 */
public class GeminiClusterReviewModel implements ClusterReviewModel {

    private static final ObjectMapper mapper = new ObjectMapper();

    private final GeminiClient client;
    private final String model;

    public GeminiClusterReviewModel(GeminiClient client, String model) {
        this.client = client;
        this.model = model;
    }

    @Override
    public String ask(String prompt) {
        try {
            String body = client.post(model, "generateContent", buildPayload(prompt));
            return extractText(body);
        } catch (IOException e) {
            throw new ReviewException("Review request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReviewException("Interrupted while waiting for review answer", e);
        }
    }

    /**
     * Build Gemini API payload for a single-turn prompt.
     */
    String buildPayload(String prompt) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode content = root.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject().put("text", prompt);
        ObjectNode generation = root.putObject("generationConfig");
        generation.put("temperature", 0.3);
        generation.put("maxOutputTokens", 400);
        return root.toString();
    }

    /**
     * Extract text response from Gemini API JSON response.
     */
    String extractText(String responseBody) throws IOException {
        JsonNode text = mapper.readTree(responseBody)
                .path("candidates").path(0)
                .path("content").path("parts").path(0)
                .path("text");
        if (!text.isTextual()) {
            throw new ReviewException("Response contained no text candidate");
        }
        return text.asText().trim();
    }
}
