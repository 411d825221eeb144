package com.raditha.competitors.cli;

import com.raditha.competitors.ai.GeminiClient;
import com.raditha.competitors.config.ClusteringConfig;
import com.raditha.competitors.config.ClusteringSettings;
import com.raditha.competitors.embedding.EmbeddingModel;
import com.raditha.competitors.embedding.EmbeddingModels;
import com.raditha.competitors.exception.PipelineException;
import com.raditha.competitors.export.ResultExporter;
import com.raditha.competitors.model.SilhouetteResult;
import com.raditha.competitors.model.SizeDistribution;
import com.raditha.competitors.pipeline.ClusteringPipeline;
import com.raditha.competitors.pipeline.PipelineResult;
import com.raditha.competitors.review.ClusterReviewModel;
import com.raditha.competitors.review.GeminiClusterReviewModel;
import com.raditha.competitors.review.ReviewSummary;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for competitor clustering.
 * <p>
 * Usage:
 * java -jar competitor-clustering.jar [options]
 * <p>
 * Configuration priority: CLI arguments > competitors.yml > defaults
 */
@Command(name = "competitors", mixinStandardHelpOptions = true, version = "competitors v1.0.0",
        description = "Groups companies into competitor clusters from customer and product descriptions")
@SuppressWarnings("java:S106")
public class CompetitorsCLI implements Callable<Integer> {

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--input", description = "Input CSV with one company per row", paramLabel = "<path>")
    private Path input;

    @Option(names = "--output", description = "Output directory", paramLabel = "<path>")
    private Path output;

    @Option(names = "--model", description = "Embedding model: hashing-<dim> or gemini:<model>", paramLabel = "<id>")
    private String model;

    @Option(names = "--k", description = "Nearest neighbours per company (default: 20)", paramLabel = "<n>")
    private Integer k;

    @Option(names = "--tau", description = "Fixed edge threshold >= 0.0; above 1.0 keeps no edges (default: 0.55)",
            paramLabel = "<x>")
    private Double tau;

    @Option(names = "--tau-percentile", description = "Derive tau from this percentile (0-100) of candidate scores",
            paramLabel = "<p>")
    private Double tauPercentile;

    @Option(names = "--alpha", description = "Product weight in fusion 0.0-1.0 (default: 0.6)", paramLabel = "<x>")
    private Double alpha;

    @Option(names = "--seed", description = "Random seed (default: 42)", paramLabel = "<n>")
    private Long seed;

    @Option(names = "--resolution", description = "Modularity resolution (default: 1.0)", paramLabel = "<x>")
    private Double resolution;

    @Option(names = "--index", description = "Neighbour index: lsh or exact (default: lsh)", paramLabel = "<type>")
    private String indexType;

    @Option(names = "--workers", description = "Embedding worker threads (default: 4)", paramLabel = "<n>")
    private Integer workers;

    @Option(names = "--sample-size", description = "Clusters sampled for manual review (default: 10)",
            paramLabel = "<n>")
    private Integer sampleSize;

    @Option(names = "--llm-validate", description = "Review a subset of clusters with the Gemini API")
    private boolean llmValidate;

    @Option(names = "--llm-clusters", description = "Clusters to review (default: 10)", paramLabel = "<n>")
    private Integer llmClusters;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        ClusteringSettings settings = configFile != null
                ? ClusteringSettings.load(configFile)
                : ClusteringSettings.loadDefault();
        ClusteringConfig config = settings.toConfig(overrides());

        Path inputPath = settings.inputPath(input);
        if (inputPath == null) {
            throw new IllegalArgumentException("No input file given; use --input or set competitor_clustering.input");
        }
        if (!Files.exists(inputPath)) {
            throw new NoSuchFileException(inputPath.toString(), null, "Input file not found");
        }
        Path outputDir = settings.outputDir(output);

        EmbeddingModel embeddingModel = EmbeddingModels.create(config.modelId(), settings.aiService());
        ClusterReviewModel reviewModel = null;
        if (config.review().enabled()) {
            reviewModel = new GeminiClusterReviewModel(new GeminiClient(settings.aiService()),
                    config.review().model());
        }

        ClusteringPipeline pipeline = new ClusteringPipeline(config, embeddingModel, reviewModel);
        PipelineResult result = pipeline.run(inputPath, settings.categoryDelimiter(), new ResultExporter(outputDir));

        printSummary(result, outputDir);
        return 0;
    }

    /**
     * Command line with the exit-code mapping installed.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new CompetitorsCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof PipelineException pipelineException) {
                commandLine.getErr().println("Pipeline failed in stage " + pipelineException.getStage() + ": "
                        + ex.getMessage());
                return 5;
            } else if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                commandLine.getErr().println("Process interrupted: " + ex.getMessage());
                return 4;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (tau != null && tauPercentile != null) {
            throw new IllegalArgumentException("Cannot use both --tau and --tau-percentile");
        }
        if (configFile != null && !Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }
    }

    /**
     * Options given on the command line, keyed like competitors.yml.
     */
    Map<String, Object> overrides() {
        Map<String, Object> overrides = new HashMap<>();
        putIfSet(overrides, "model_name", model);
        putIfSet(overrides, "k", k);
        putIfSet(overrides, "alpha", alpha);
        putIfSet(overrides, "seed", seed);
        putIfSet(overrides, "resolution", resolution);
        putIfSet(overrides, "index_type", indexType);
        putIfSet(overrides, "workers", workers);
        putIfSet(overrides, "sample_size", sampleSize);
        putIfSet(overrides, "review_clusters", llmClusters);
        if (tau != null) {
            overrides.put("threshold_mode", "fixed");
            overrides.put("tau", tau);
        }
        if (tauPercentile != null) {
            overrides.put("threshold_mode", "percentile");
            overrides.put("tau_percentile", tauPercentile);
        }
        if (llmValidate) {
            overrides.put("review_enabled", true);
        }
        return overrides;
    }

    private static void putIfSet(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private void printSummary(PipelineResult result, Path outputDir) {
        SizeDistribution sizes = result.validation().sizeDistribution();
        SilhouetteResult silhouette = result.validation().silhouette();

        System.out.println("=".repeat(60));
        System.out.println("COMPETITOR CLUSTERING SUMMARY");
        System.out.println("=".repeat(60));
        System.out.printf("Companies:        %d read, %d clustered, %d excluded%n",
                result.inputCompanies(), result.space().size(), result.exclusions().size());
        System.out.printf("Threshold:        %s tau=%.4f%n",
                result.graph().threshold().mode(), result.graph().threshold().value());
        System.out.printf("Graph:            %d edges from %d candidate pairs%n",
                result.graph().edgeCount(), result.graph().candidatePairs());
        System.out.printf("Clusters:         %d (%d singletons, largest %d, median %.1f)%n",
                sizes.clusterCount(), sizes.singletons(), sizes.max(), sizes.median());
        System.out.printf("Modularity:       %.4f%n", result.partition().modularity());
        if (silhouette.defined()) {
            System.out.printf("Silhouette:       %.4f%n", silhouette.value());
        } else {
            System.out.println("Silhouette:       undefined (" + silhouette.reason() + ")");
        }
        result.reviewResult().ifPresent(review -> {
            ReviewSummary summary = review.summary();
            System.out.printf("LLM review:       %d clusters, average quality %.2f%n",
                    summary.clustersReviewed(), summary.averageQuality());
        });
        System.out.println("Output:           " + outputDir.toAbsolutePath());
    }
}
