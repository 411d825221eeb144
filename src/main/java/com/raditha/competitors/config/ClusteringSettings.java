package com.raditha.competitors.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.raditha.competitors.model.ThresholdMode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Loads clustering configuration from a YAML file (competitors.yml) with
 * command-line overrides.
 *
 * Configuration priority: CLI arguments > competitors.yml > defaults
 */
public class ClusteringSettings {

    public static final String CONFIG_KEY = "competitor_clustering";
    public static final String AI_SERVICE_KEY = "ai_service";
    public static final String DEFAULT_RESOURCE = "competitors.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private final Map<String, Object> root;

    public ClusteringSettings(Map<String, Object> root) {
        this.root = root == null ? Map.of() : root;
    }

    /**
     * Settings with no YAML content; everything falls back to defaults.
     */
    public static ClusteringSettings empty() {
        return new ClusteringSettings(Map.of());
    }

    /**
     * Load settings from a YAML file.
     */
    public static ClusteringSettings load(Path configFile) throws IOException {
        try (InputStream in = Files.newInputStream(configFile)) {
            return new ClusteringSettings(readYaml(in));
        }
    }

    /**
     * Load the bundled competitors.yml, or empty settings when it is absent.
     */
    public static ClusteringSettings loadDefault() throws IOException {
        try (InputStream in = ClusteringSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return empty();
            }
            return new ClusteringSettings(readYaml(in));
        }
    }

    private static Map<String, Object> readYaml(InputStream in) throws IOException {
        Map<String, Object> map = YAML.readValue(in, new TypeReference<Map<String, Object>>() {
        });
        return map == null ? Map.of() : map;
    }

    /**
     * Build the run configuration.
     *
     * @param overrides CLI values keyed like the YAML section ({@code k}, {@code tau},
     *                  {@code alpha}, ...); absent keys fall back to YAML, then defaults
     * @return Complete clustering configuration
     */
    public ClusteringConfig toConfig(Map<String, Object> overrides) {
        Map<String, Object> config = new HashMap<>(section(root, CONFIG_KEY));
        if (overrides != null) {
            config.putAll(overrides);
        }
        ClusteringConfig defaults = ClusteringConfig.defaults();

        String modelId = getString(config, "model_name", defaults.modelId());
        int k = getInt(config, "k", defaults.k());
        double alpha = getDouble(config, "alpha", defaults.alpha());
        long seed = getLong(config, "seed", defaults.seed());
        double resolution = getDouble(config, "resolution", defaults.resolution());

        return new ClusteringConfig(
                modelId,
                k,
                alpha,
                seed,
                buildThreshold(config),
                buildWeights(config),
                buildEmbedding(config),
                buildIndex(config),
                resolution,
                buildValidation(config),
                buildReview(config));
    }

    /**
     * Input CSV path: CLI value first, then YAML, then {@code null}.
     */
    public Path inputPath(Path cliValue) {
        if (cliValue != null) {
            return cliValue;
        }
        String value = getString(section(root, CONFIG_KEY), "input", null);
        return value == null ? null : Path.of(value);
    }

    /**
     * Output directory: CLI value first, then YAML, then the default location.
     */
    public Path outputDir(Path cliValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return Path.of(getString(section(root, CONFIG_KEY), "output_dir",
                "data/processed/competitor_clustering"));
    }

    public String categoryDelimiter() {
        return getString(section(root, CONFIG_KEY), "category_delimiter", ",");
    }

    /**
     * Raw {@code ai_service} section (api_key, api_endpoint, timeout_seconds).
     */
    public Map<String, Object> aiService() {
        return section(root, AI_SERVICE_KEY);
    }

    private static ThresholdOptions buildThreshold(Map<String, Object> config) {
        Map<String, Object> threshold = section(config, "threshold");
        String mode = getString(config, "threshold_mode", getString(threshold, "mode", "fixed"));
        double tau = getDouble(config, "tau", getDouble(threshold, "tau", 0.55));
        double percentile = getDouble(config, "tau_percentile", getDouble(threshold, "percentile", 90.0));
        return new ThresholdOptions(ThresholdMode.fromString(mode), tau, percentile);
    }

    private static SimilarityWeights buildWeights(Map<String, Object> config) {
        Map<String, Object> weights = section(config, "similarity_weights");
        if (weights.isEmpty()) {
            return SimilarityWeights.standard();
        }
        double text = getDouble(weights, "text", 0.8);
        double category = getDouble(weights, "category", 0.2);
        return new SimilarityWeights(text, category);
    }

    private static EmbeddingOptions buildEmbedding(Map<String, Object> config) {
        Map<String, Object> embedding = section(config, "embedding");
        EmbeddingOptions defaults = EmbeddingOptions.defaults();
        return new EmbeddingOptions(
                getInt(embedding, "batch_size", defaults.batchSize()),
                getInt(config, "workers", getInt(embedding, "workers", defaults.workers())),
                getInt(embedding, "max_attempts", defaults.maxAttempts()),
                getLong(embedding, "initial_backoff_ms", defaults.initialBackoffMillis()));
    }

    private static IndexOptions buildIndex(Map<String, Object> config) {
        Map<String, Object> index = section(config, "index");
        IndexOptions defaults = IndexOptions.lsh();
        String type = getString(config, "index_type", getString(index, "type", defaults.type().name()));
        return new IndexOptions(
                IndexType.fromString(type),
                getInt(index, "bands", defaults.numBands()),
                getInt(index, "rows_per_band", defaults.rowsPerBand()),
                getInt(index, "max_candidates", defaults.maxCandidates()));
    }

    private static ValidationOptions buildValidation(Map<String, Object> config) {
        Map<String, Object> validation = section(config, "validation");
        ValidationOptions defaults = ValidationOptions.defaults();
        return new ValidationOptions(
                getInt(config, "sample_size", getInt(validation, "sample_size", defaults.sampleSize())),
                getInt(validation, "members_per_sample", defaults.membersPerSample()),
                getInt(validation, "silhouette_sample_size", defaults.silhouetteSampleSize()));
    }

    private static ReviewOptions buildReview(Map<String, Object> config) {
        Map<String, Object> review = section(config, "review");
        ReviewOptions defaults = ReviewOptions.disabled();
        return new ReviewOptions(
                getBoolean(config, "review_enabled", getBoolean(review, "enabled", defaults.enabled())),
                getInt(config, "review_clusters", getInt(review, "clusters", defaults.clusters())),
                getString(review, "model", defaults.model()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Map.of();
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            return Integer.parseInt(str.trim());
        }
        return defaultValue;
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            return Long.parseLong(str.trim());
        }
        return defaultValue;
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String str && !str.isBlank()) {
            return Double.parseDouble(str.trim());
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String str && !str.isBlank()) {
            return Boolean.parseBoolean(str.trim());
        }
        return defaultValue;
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
