package com.raditha.competitors.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.competitors.ai.GeminiClient;
import com.raditha.competitors.exception.EmbeddingException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Embedding model backed by the Gemini {@code batchEmbedContents} endpoint.
 * Any transport or response problem surfaces as {@link EmbeddingException} so
 * the fuser can retry the batch.
 */
public class GeminiEmbeddingModel implements EmbeddingModel {

    public static final String ID_PREFIX = "gemini:";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final GeminiClient client;
    private final String model;

    public GeminiEmbeddingModel(GeminiClient client, String model) {
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model cannot be empty");
        }
        this.client = client;
        this.model = model;
    }

    @Override
    public String modelId() {
        return ID_PREFIX + model;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        String body;
        try {
            body = client.post(model, "batchEmbedContents", buildPayload(texts));
        } catch (IOException e) {
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Interrupted while waiting for embeddings", e);
        }
        return parseResponse(body, texts.size());
    }

    String buildPayload(List<String> texts) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode requests = root.putArray("requests");
        for (String text : texts) {
            ObjectNode request = requests.addObject();
            request.put("model", "models/" + model);
            request.putObject("content").putArray("parts").addObject().put("text", text);
        }
        return root.toString();
    }

    List<float[]> parseResponse(String body, int expected) {
        JsonNode embeddings;
        try {
            embeddings = mapper.readTree(body).path("embeddings");
        } catch (IOException e) {
            throw new EmbeddingException("Malformed embedding response", e);
        }
        if (!embeddings.isArray() || embeddings.size() != expected) {
            throw new EmbeddingException(String.format(
                    "Expected %d embeddings but response contained %d", expected, embeddings.size()));
        }

        List<float[]> vectors = new ArrayList<>(expected);
        for (JsonNode embedding : embeddings) {
            JsonNode values = embedding.path("values");
            float[] v = new float[values.size()];
            for (int i = 0; i < v.length; i++) {
                v[i] = (float) values.get(i).asDouble();
            }
            vectors.add(v);
        }
        return vectors;
    }
}
