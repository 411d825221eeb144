package com.raditha.competitors.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.Exclusion;
import com.raditha.competitors.model.Partition;
import com.raditha.competitors.model.SimilarityGraph;
import com.raditha.competitors.review.ClusterReview;
import com.raditha.competitors.review.ReviewResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the clustering artifacts to the output directory.
 * Every file is written under a temporary name first and then moved into place,
 * so a reader never sees a half-written artifact.
 */
public class ResultExporter {
    private static final Logger logger = LoggerFactory.getLogger(ResultExporter.class);

    public static final String ASSIGNMENTS_FILE = "clustered_companies.csv";
    public static final String EMBEDDINGS_FILE = "embeddings.npy";
    public static final String ADJACENCY_FILE = "adjacency.csv";
    public static final String METADATA_FILE = "metadata.json";
    public static final String EXCLUSIONS_FILE = "excluded_companies.csv";
    public static final String REVIEW_RESULTS_FILE = "llm_validation_results.json";
    public static final String REVIEW_SUMMARY_FILE = "llm_validation_summary.csv";

    private static final byte[] NPY_MAGIC = { (byte) 0x93, 'N', 'U', 'M', 'P', 'Y', 1, 0 };

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private final CsvMapper csvMapper = new CsvMapper();

    private final Path outputDir;

    public ResultExporter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    /**
     * One row of the assignment table.
     */
    @JsonPropertyOrder({ "company_id", "cluster_id", "company_name", "main_customers", "main_product",
            "category_list", "description" })
    public record AssignmentRow(
            @JsonProperty("company_id") String companyId,
            @JsonProperty("cluster_id") int clusterId,
            @JsonProperty("company_name") String companyName,
            @JsonProperty("main_customers") String mainCustomers,
            @JsonProperty("main_product") String mainProduct,
            @JsonProperty("category_list") String categoryList,
            @JsonProperty("description") String description) {
    }

    /**
     * One directed entry of the adjacency list.
     */
    @JsonPropertyOrder({ "source", "target", "weight" })
    public record AdjacencyRow(
            @JsonProperty("source") String source,
            @JsonProperty("target") String target,
            @JsonProperty("weight") double weight) {
    }

    @JsonPropertyOrder({ "company_id", "reason", "detail" })
    public record ExclusionRow(
            @JsonProperty("company_id") String companyId,
            @JsonProperty("reason") String reason,
            @JsonProperty("detail") String detail) {
    }

    @JsonPropertyOrder({ "cluster_id", "cluster_quality_score", "avg_company_fit_score", "n_companies",
            "cluster_summary" })
    public record ReviewSummaryRow(
            @JsonProperty("cluster_id") int clusterId,
            @JsonProperty("cluster_quality_score") double clusterQualityScore,
            @JsonProperty("avg_company_fit_score") double avgCompanyFitScore,
            @JsonProperty("n_companies") int companies,
            @JsonProperty("cluster_summary") String clusterSummary) {
    }

    /**
     * Company to cluster assignment plus the original fields, in embedding-space order.
     */
    public Path exportAssignments(EmbeddingSpace space, Partition partition, String categoryDelimiter)
            throws IOException {
        List<AssignmentRow> rows = new ArrayList<>(space.size());
        for (Company company : space.companies()) {
            rows.add(new AssignmentRow(
                    company.id(),
                    partition.clusterOf(company.id()),
                    company.name(),
                    company.customerDescription(),
                    company.productDescription(),
                    company.joinedCategories(categoryDelimiter),
                    company.description()));
        }
        return writeCsv(ASSIGNMENTS_FILE, AssignmentRow.class, rows);
    }

    /**
     * Fused vectors as a float32 {@code .npy} array of shape (companies, dimension).
     */
    public Path exportEmbeddings(EmbeddingSpace space) throws IOException {
        return writeAtomically(EMBEDDINGS_FILE, tmp -> {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
                out.write(npyHeader(space.size(), space.dimension()));
                ByteBuffer row = ByteBuffer.allocate(space.dimension() * Float.BYTES)
                        .order(ByteOrder.LITTLE_ENDIAN);
                for (float[] v : space.vectors()) {
                    row.clear();
                    row.asFloatBuffer().put(v);
                    out.write(row.array());
                }
            }
        });
    }

    /**
     * Version 1.0 header: magic, header length, then a Python dict literal padded
     * with spaces and a newline so the data starts on a 64-byte boundary.
     */
    static byte[] npyHeader(int rows, int columns) {
        String dict = String.format("{'descr': '<f4', 'fortran_order': False, 'shape': (%d, %d), }", rows, columns);
        int unpadded = NPY_MAGIC.length + 2 + dict.length() + 1;
        int padding = (64 - unpadded % 64) % 64;
        String header = dict + " ".repeat(padding) + "\n";

        ByteBuffer buffer = ByteBuffer.allocate(NPY_MAGIC.length + 2 + header.length())
                .order(ByteOrder.LITTLE_ENDIAN);
        buffer.put(NPY_MAGIC);
        buffer.putShort((short) header.length());
        buffer.put(header.getBytes(StandardCharsets.US_ASCII));
        return buffer.array();
    }

    /**
     * Weighted adjacency with both directions of every edge, ordered by source then target.
     */
    public Path exportAdjacency(SimilarityGraph graph) throws IOException {
        List<AdjacencyRow> rows = new ArrayList<>(graph.edgeCount() * 2);
        for (int i = 0; i < graph.nodeCount(); i++) {
            int[] neighbors = graph.neighbors(i);
            double[] weights = graph.neighborWeights(i);
            for (int j = 0; j < neighbors.length; j++) {
                rows.add(new AdjacencyRow(graph.nodeId(i), graph.nodeId(neighbors[j]), weights[j]));
            }
        }
        return writeCsv(ADJACENCY_FILE, AdjacencyRow.class, rows);
    }

    public Path exportExclusions(List<Exclusion> exclusions) throws IOException {
        List<ExclusionRow> rows = exclusions.stream()
                .map(e -> new ExclusionRow(e.companyId(), e.reason().name(), e.detail()))
                .toList();
        return writeCsv(EXCLUSIONS_FILE, ExclusionRow.class, rows);
    }

    public Path exportMetadata(RunMetadata metadata) throws IOException {
        return writeAtomically(METADATA_FILE, tmp -> jsonMapper.writeValue(tmp.toFile(), metadata));
    }

    /**
     * Detailed review results as JSON plus one summary row per reviewed cluster.
     */
    public List<Path> exportReview(ReviewResult review) throws IOException {
        Path json = writeAtomically(REVIEW_RESULTS_FILE, tmp -> jsonMapper.writeValue(tmp.toFile(), review));

        List<ReviewSummaryRow> rows = new ArrayList<>();
        for (ClusterReview cluster : review.reviews()) {
            rows.add(new ReviewSummaryRow(
                    cluster.clusterId(),
                    cluster.qualityScore(),
                    cluster.averageFit(),
                    cluster.memberFits().size(),
                    cluster.summary()));
        }
        Path csv = writeCsv(REVIEW_SUMMARY_FILE, ReviewSummaryRow.class, rows);
        return List.of(json, csv);
    }

    private <T> Path writeCsv(String fileName, Class<T> rowType, List<T> rows) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        return writeAtomically(fileName, tmp -> {
            if (rows.isEmpty()) {
                // header only
                List<String> columns = new ArrayList<>();
                for (CsvSchema.Column column : schema) {
                    columns.add(column.getName());
                }
                Files.writeString(tmp, String.join(",", columns) + "\n");
            } else {
                csvMapper.writerFor(rowType).with(schema).writeValues(tmp.toFile()).writeAll(rows).close();
            }
        });
    }

    @FunctionalInterface
    private interface ArtifactWriter {
        void write(Path tmp) throws IOException;
    }

    private Path writeAtomically(String fileName, ArtifactWriter writer) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);
        Path tmp = Files.createTempFile(outputDir, fileName + ".", ".tmp");
        try {
            writer.write(tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to plain move", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
        logger.debug("Wrote {}", target);
        return target;
    }
}
