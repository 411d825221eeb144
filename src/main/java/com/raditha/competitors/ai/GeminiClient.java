package com.raditha.competitors.ai;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Minimal client for the Gemini REST API.
 * Shared by the embedding model ({@code batchEmbedContents}) and the cluster
 * review ({@code generateContent}). Thread-safe: the underlying
 * {@link HttpClient} is.
 */
public class GeminiClient {
    private static final Logger logger = LoggerFactory.getLogger(GeminiClient.class);

    static final String DEFAULT_ENDPOINT =
            "https://generativelanguage.googleapis.com/v1beta/models/{model}:{method}";

    private final HttpClient httpClient;
    private final Map<String, Object> config;
    private final String apiKey;
    private final int timeoutSeconds;

    /**
     * @param config The {@code ai_service} configuration section, may be empty
     * @throws IOException if no API key is configured
     */
    public GeminiClient(Map<String, Object> config) throws IOException {
        this.config = config == null ? Map.of() : config;

        // Validate API key is available - fail fast if not
        this.apiKey = getConfigString("api_key", null);
        if (apiKey == null || apiKey.trim().isEmpty()) {
            throw new IOException(
                    "AI service API key is required. Set GEMINI_API_KEY environment variable or configure ai_service.api_key in competitors.yml");
        }

        this.timeoutSeconds = getConfigInt("timeout_seconds", 60);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        logger.debug("Gemini client configured with {}s timeout", timeoutSeconds);
    }

    /**
     * Post a JSON payload to a model method.
     *
     * @param model   Model name without the {@code models/} prefix
     * @param method  API method, e.g. {@code generateContent}
     * @param payload JSON request body
     * @return Response body
     * @throws IOException on transport failure or a non-200 status
     */
    public String post(String model, String method, String payload) throws IOException, InterruptedException {
        String apiEndpoint = getConfigString("api_endpoint", DEFAULT_ENDPOINT);
        String url = apiEndpoint.replace("{model}", model).replace("{method}", method) + "?key=" + apiKey;

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        if (response.statusCode() != 200) {
            throw new IOException(
                    "API request failed with status: " + response.statusCode() + ", body: " + response.body());
        }

        return response.body();
    }

    /**
     * Gets a string configuration value with fallback to environment variables.
     */
    private String getConfigString(String key, String defaultValue) {
        Object value = config.get(key);
        if (value instanceof String str && !str.trim().isEmpty()) {
            return str;
        }
        return getEnvironmentFallback(key, defaultValue);
    }

    private String getEnvironmentFallback(String key, String defaultValue) {
        String envName = switch (key) {
            case "api_key" -> "GEMINI_API_KEY";
            case "api_endpoint" -> "AI_SERVICE_ENDPOINT";
            default -> null;
        };
        if (envName != null) {
            String envValue = System.getenv(envName);
            if (envValue != null && !envValue.trim().isEmpty()) {
                return envValue;
            }
        }
        return defaultValue;
    }

    private int getConfigInt(String key, int defaultValue) {
        Object value = config.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        } else if (value instanceof String str) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException e) {
                logger.warn("Ignoring non-numeric ai_service.{}: {}", key, str);
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
