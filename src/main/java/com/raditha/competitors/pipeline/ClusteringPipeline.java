package com.raditha.competitors.pipeline;

import com.raditha.competitors.clustering.CommunityDetector;
import com.raditha.competitors.config.ClusteringConfig;
import com.raditha.competitors.embedding.EmbeddingFuser;
import com.raditha.competitors.embedding.EmbeddingModel;
import com.raditha.competitors.export.ResultExporter;
import com.raditha.competitors.export.RunMetadata;
import com.raditha.competitors.graph.SimilarityGraphBuilder;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.Exclusion;
import com.raditha.competitors.model.NormalizedCompany;
import com.raditha.competitors.model.Partition;
import com.raditha.competitors.model.SimilarityGraph;
import com.raditha.competitors.model.ValidationReport;
import com.raditha.competitors.normalization.TextNormalizer;
import com.raditha.competitors.review.ClusterReviewModel;
import com.raditha.competitors.review.LlmClusterReviewer;
import com.raditha.competitors.review.ReviewResult;
import com.raditha.competitors.validation.ClusterValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Main orchestrator for competitor clustering.
 * Coordinates normalization, embedding, graph construction, community detection,
 * validation and the optional LLM review, then writes the artifacts. Nothing is
 * written unless every stage succeeded.
 */
public class ClusteringPipeline {
    private static final Logger logger = LoggerFactory.getLogger(ClusteringPipeline.class);

    private final ClusteringConfig config;
    private final TextNormalizer normalizer;
    private final EmbeddingFuser fuser;
    private final SimilarityGraphBuilder graphBuilder;
    private final CommunityDetector detector;
    private final ClusterValidator validator;
    private final ClusterReviewModel reviewModel;

    /**
     * Create a pipeline without LLM review.
     */
    public ClusteringPipeline(ClusteringConfig config, EmbeddingModel embeddingModel) {
        this(config, embeddingModel, null);
    }

    /**
     * @param config         Run configuration
     * @param embeddingModel Model producing the field vectors
     * @param reviewModel    Model answering review questions; may be {@code null}
     *                       when review is disabled
     */
    public ClusteringPipeline(ClusteringConfig config, EmbeddingModel embeddingModel,
            ClusterReviewModel reviewModel) {
        this.config = config;
        this.normalizer = new TextNormalizer();
        this.fuser = new EmbeddingFuser(embeddingModel, config);
        this.graphBuilder = new SimilarityGraphBuilder(config);
        this.detector = new CommunityDetector(config);
        this.validator = new ClusterValidator(config);
        this.reviewModel = reviewModel;
    }

    /**
     * Read the input file, run every stage and write the artifacts.
     *
     * @return Result of the run
     */
    public PipelineResult run(Path inputCsv, String categoryDelimiter, ResultExporter exporter)
            throws IOException, InterruptedException {
        CompanyInput input = new CompanyCsvReader(categoryDelimiter).read(inputCsv);
        PipelineResult result = run(input);
        export(result, exporter, categoryDelimiter);
        return result;
    }

    public PipelineResult run(CompanyInput input) throws InterruptedException {
        return run(input.companies(), input.exclusions(), input.rows());
    }

    /**
     * Run every stage in memory.
     *
     * @param companies       Valid input records
     * @param inputExclusions Records already rejected while reading
     * @param inputRows       Records read, including rejected ones
     */
    public PipelineResult run(List<Company> companies, List<Exclusion> inputExclusions, int inputRows)
            throws InterruptedException {
        logger.info("Clustering {} companies with model {} (k={}, alpha={}, seed={})",
                companies.size(), config.modelId(), config.k(), config.alpha(), config.seed());

        // Step 1: Normalize descriptions
        List<NormalizedCompany> normalized = normalizer.normalizeAll(companies);

        // Step 2: Embed and fuse
        EmbeddingSpace space = fuser.fuse(normalized);

        // Step 3: Similarity graph
        SimilarityGraph graph = graphBuilder.build(space);

        // Step 4: Communities
        Partition partition = detector.detect(graph);

        // Step 5: Diagnostics
        ValidationReport validation = validator.validate(space, graph, partition);

        // Step 6: Optional review
        ReviewResult review = review(space, partition);

        List<Exclusion> exclusions = new ArrayList<>(inputExclusions);
        exclusions.addAll(space.exclusions());
        return new PipelineResult(inputRows, exclusions, space, graph, partition, validation, review);
    }

    public PipelineResult run(List<Company> companies) throws InterruptedException {
        return run(companies, List.of(), companies.size());
    }

    private ReviewResult review(EmbeddingSpace space, Partition partition) {
        if (!config.review().enabled()) {
            return null;
        }
        if (reviewModel == null) {
            logger.warn("LLM review is enabled but no review model is configured; skipping");
            return null;
        }
        Map<String, Company> companies = new HashMap<>();
        for (Company company : space.companies()) {
            companies.put(company.id(), company);
        }
        return new LlmClusterReviewer(reviewModel, config.review(), config.seed()).review(partition, companies);
    }

    /**
     * Write every artifact of a finished run.
     *
     * @return Written files
     */
    public List<Path> export(PipelineResult result, ResultExporter exporter, String categoryDelimiter)
            throws IOException {
        List<Path> written = new ArrayList<>();
        written.add(exporter.exportAssignments(result.space(), result.partition(), categoryDelimiter));
        written.add(exporter.exportEmbeddings(result.space()));
        written.add(exporter.exportAdjacency(result.graph()));
        written.add(exporter.exportExclusions(result.exclusions()));
        if (result.review() != null) {
            written.addAll(exporter.exportReview(result.review()));
        }

        List<String> names = new ArrayList<>();
        for (Path path : written) {
            names.add(path.getFileName().toString());
        }
        names.add(ResultExporter.METADATA_FILE);
        written.add(exporter.exportMetadata(buildMetadata(result, names)));

        logger.info("Wrote {} files to {}", written.size(), exporter.outputDir());
        return written;
    }

    RunMetadata buildMetadata(PipelineResult result, List<String> outputFiles) {
        ValidationReport validation = result.validation();
        RunMetadata.Settings settings = new RunMetadata.Settings(
                result.space().modelId(),
                result.space().dimension(),
                config.k(),
                result.graph().threshold().mode().name(),
                result.graph().threshold().value(),
                result.graph().threshold().percentile(),
                config.alpha(),
                config.weights().textWeight(),
                config.weights().categoryWeight(),
                config.seed(),
                config.index().type().name(),
                config.resolution());
        RunMetadata.Metrics metrics = new RunMetadata.Metrics(
                result.inputCompanies(),
                result.space().size(),
                result.exclusions().size(),
                result.graph().candidatePairs(),
                result.graph().edgeCount(),
                result.partition().clusterCount(),
                result.partition().modularity(),
                validation.silhouette().valueOrNull(),
                validation.silhouette().sampledPoints(),
                validation.silhouette().reason(),
                validation.graphDensity(),
                validation.intraClusterDensity(),
                validation.sizeDistribution());
        return new RunMetadata(
                LocalDateTime.now(),
                settings,
                metrics,
                validation.samples(),
                result.exclusionCounts(),
                outputFiles,
                result.review() == null ? null : result.review().summary());
    }
}
