package com.raditha.competitors.config;

import com.raditha.competitors.model.ThresholdMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClusteringSettingsTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(String yaml) throws IOException {
        Path file = tempDir.resolve("competitors.yml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void testLoadDefaultResource() throws IOException {
        ClusteringConfig config = ClusteringSettings.loadDefault().toConfig(Map.of());

        assertEquals("hashing-384", config.modelId());
        assertEquals(20, config.k());
        assertEquals(16, config.index().numBands());
        assertEquals(12, config.index().rowsPerBand());
    }

    @Test
    void testYamlValuesApplied() throws IOException {
        Path file = writeConfig("""
                competitor_clustering:
                  k: 8
                  alpha: 0.4
                  threshold:
                    mode: percentile
                    percentile: 75
                  similarity_weights:
                    text: 0.9
                    category: 0.1
                  index:
                    type: exact
                  embedding:
                    batch_size: 16
                    initial_backoff_ms: 0
                  input: companies.csv
                  category_delimiter: ";"
                ai_service:
                  api_key: abc
                """);

        ClusteringSettings settings = ClusteringSettings.load(file);
        ClusteringConfig config = settings.toConfig(Map.of());

        assertEquals(8, config.k());
        assertEquals(0.4, config.alpha());
        assertEquals(ThresholdMode.PERCENTILE, config.threshold().mode());
        assertEquals(75.0, config.threshold().percentile());
        assertEquals(0.9, config.weights().textWeight());
        assertEquals(IndexType.EXACT, config.index().type());
        assertEquals(16, config.embedding().batchSize());
        assertEquals(0L, config.embedding().initialBackoffMillis());
        assertEquals(4, config.embedding().workers());
        assertEquals(Path.of("companies.csv"), settings.inputPath(null));
        assertEquals(";", settings.categoryDelimiter());
        assertEquals("abc", settings.aiService().get("api_key"));
    }

    @Test
    void testOverridesBeatYaml() throws IOException {
        Path file = writeConfig("""
                competitor_clustering:
                  k: 8
                  seed: 1
                  index:
                    type: exact
                """);
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("k", 30);
        overrides.put("index_type", "lsh");
        overrides.put("threshold_mode", "percentile");
        overrides.put("tau_percentile", 80.0);
        overrides.put("review_enabled", true);

        ClusteringConfig config = ClusteringSettings.load(file).toConfig(overrides);

        assertEquals(30, config.k());
        assertEquals(1L, config.seed());
        assertEquals(IndexType.LSH, config.index().type());
        assertEquals(ThresholdMode.PERCENTILE, config.threshold().mode());
        assertEquals(80.0, config.threshold().percentile());
        assertTrue(config.review().enabled());
    }

    @Test
    void testEmptySettingsFallBackToDefaults() {
        ClusteringSettings settings = ClusteringSettings.empty();

        assertEquals(ClusteringConfig.defaults(), settings.toConfig(null));
        assertNull(settings.inputPath(null));
        assertEquals(Path.of("out"), settings.outputDir(Path.of("out")));
        assertEquals(",", settings.categoryDelimiter());
        assertTrue(settings.aiService().isEmpty());
    }

    @Test
    void testInvalidValueRejected() throws IOException {
        Path file = writeConfig("""
                competitor_clustering:
                  alpha: 1.5
                """);

        ClusteringSettings settings = ClusteringSettings.load(file);
        assertThrows(IllegalArgumentException.class, () -> settings.toConfig(Map.of()));
    }

    @Test
    void testUnknownIndexTypeRejected() {
        Map<String, Object> overrides = Map.of("index_type", "annoy");

        assertThrows(IllegalArgumentException.class, () -> ClusteringSettings.empty().toConfig(overrides));
    }
}
