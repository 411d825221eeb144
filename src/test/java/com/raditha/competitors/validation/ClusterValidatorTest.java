package com.raditha.competitors.validation;

import com.raditha.competitors.config.ClusteringConfig;
import com.raditha.competitors.config.ValidationOptions;
import com.raditha.competitors.model.Cluster;
import com.raditha.competitors.model.ClusterDensity;
import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.Partition;
import com.raditha.competitors.model.ResolvedThreshold;
import com.raditha.competitors.model.SimilarityEdge;
import com.raditha.competitors.model.SimilarityGraph;
import com.raditha.competitors.model.SizeDistribution;
import com.raditha.competitors.model.ValidationReport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClusterValidatorTest {

    private static Partition partition(List<List<String>> groups) {
        List<Cluster> clusters = new ArrayList<>();
        Map<String, Integer> assignment = new HashMap<>();
        for (int c = 0; c < groups.size(); c++) {
            clusters.add(new Cluster(c, groups.get(c)));
            for (String id : groups.get(c)) {
                assignment.put(id, c);
            }
        }
        return new Partition(clusters, assignment, 0.0);
    }

    private static List<String> ids(int from, int to) {
        List<String> ids = new ArrayList<>();
        for (int i = from; i < to; i++) {
            ids.add("c" + i);
        }
        return ids;
    }

    @Test
    void testValidateTwoSeparatedPairs() {
        EmbeddingSpace space = SilhouetteCalculatorTest.space(List.of(
                new float[] { 0f, 0f }, new float[] { 0f, 1f },
                new float[] { 10f, 0f }, new float[] { 10f, 1f }));
        SimilarityGraph graph = new SimilarityGraph(space.ids(),
                List.of(new SimilarityEdge(0, 1, 0.9), new SimilarityEdge(2, 3, 0.8)),
                ResolvedThreshold.fixed(0.5), 4);
        Partition partition = partition(List.of(List.of("c0", "c1"), List.of("c2", "c3")));

        ValidationReport report = new ClusterValidator(ClusteringConfig.defaults()).validate(space, graph, partition);

        assertTrue(report.silhouette().defined());
        assertEquals(2.0 / 6.0, report.graphDensity(), 1e-12);
        assertEquals(1.0, report.intraClusterDensity(), 1e-12);
        assertEquals(2, report.clusterDensities().size());
        assertEquals(1.0, report.clusterDensities().get(0).density());
        assertEquals(2, report.samples().size());
        assertEquals(2, report.sizeDistribution().clusterCount());
    }

    @Test
    void testClusterDensities() {
        SimilarityGraph graph = new SimilarityGraph(ids(0, 5),
                List.of(new SimilarityEdge(0, 1, 0.9), new SimilarityEdge(1, 2, 0.9),
                        new SimilarityEdge(2, 3, 0.6)),
                ResolvedThreshold.fixed(0.5), 3);
        Partition partition = partition(List.of(List.of("c0", "c1", "c2"), List.of("c3"), List.of("c4")));
        int[] labels = partition.labels(graph.nodeIds());

        List<ClusterDensity> densities = ClusterValidator.clusterDensities(graph, partition, labels);

        assertEquals(2, densities.get(0).internalEdges());
        assertEquals(2.0 / 3.0, densities.get(0).density(), 1e-12);
        assertNull(densities.get(1).density());
        assertEquals(2.0 / 3.0, ClusterValidator.pooledDensity(densities), 1e-12);
    }

    @Test
    void testPooledDensityOfSingletonsIsZero() {
        List<ClusterDensity> densities = List.of(new ClusterDensity(0, 1, 0, null), new ClusterDensity(1, 1, 0, null));

        assertEquals(0.0, ClusterValidator.pooledDensity(densities));
    }

    @Test
    void testSizeDistribution() {
        List<List<String>> groups = new ArrayList<>();
        groups.add(ids(0, 60));
        groups.add(ids(60, 70));
        groups.add(ids(70, 73));
        groups.add(ids(73, 74));

        SizeDistribution sizes = ClusterValidator.sizeDistribution(partition(groups));

        assertEquals(4, sizes.clusterCount());
        assertEquals(74, sizes.companyCount());
        assertEquals(1, sizes.min());
        assertEquals(60, sizes.max());
        assertEquals(18.5, sizes.mean(), 1e-12);
        assertEquals(6.5, sizes.median(), 1e-12);
        assertEquals(1, sizes.singletons());
        assertEquals(2, sizes.smallClusters());
        assertEquals(1, sizes.mediumClusters());
        assertEquals(1, sizes.largeClusters());
        assertEquals(List.of(10, 25, 50, 75, 90, 95, 99), new ArrayList<>(sizes.percentiles().keySet()));
    }

    @Test
    void testEmptyPartitionGivesZeros() {
        EmbeddingSpace empty = new EmbeddingSpace(List.of(), List.of(), 0, "test", List.of());
        SimilarityGraph graph = new SimilarityGraph(List.of(), List.of(), ResolvedThreshold.fixed(0.5), 0);
        Partition partition = new Partition(List.of(), Map.of(), 0.0);

        ValidationReport report = new ClusterValidator(ClusteringConfig.defaults()).validate(empty, graph, partition);

        assertFalse(report.silhouette().defined());
        assertEquals(0, report.sizeDistribution().clusterCount());
        assertEquals(0.0, report.sizeDistribution().median());
        assertEquals(0.0, report.intraClusterDensity());
        assertTrue(report.samples().isEmpty());
    }

    @Test
    void testSampleSizeFromConfig() {
        EmbeddingSpace space = SilhouetteCalculatorTest.space(List.of(
                new float[] { 0f }, new float[] { 1f }, new float[] { 2f }, new float[] { 3f }));
        SimilarityGraph graph = new SimilarityGraph(space.ids(), List.of(), ResolvedThreshold.fixed(0.5), 0);
        Partition partition = partition(List.of(List.of("c0"), List.of("c1"), List.of("c2"), List.of("c3")));
        ClusteringConfig config = ClusteringConfig.defaults().withValidation(new ValidationOptions(2, 5, 100));

        ValidationReport report = new ClusterValidator(config).validate(space, graph, partition);

        assertEquals(2, report.samples().size());
        assertFalse(report.silhouette().defined());
    }
}
