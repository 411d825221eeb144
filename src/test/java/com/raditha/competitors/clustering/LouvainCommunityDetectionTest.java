package com.raditha.competitors.clustering;

import com.raditha.competitors.model.SimilarityEdge;
import com.raditha.competitors.model.SimilarityGraph;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LouvainCommunityDetectionTest {

    @Test
    void testSeparatesTwoCliques() {
        SimilarityGraph graph = GraphFixtures.cliques(2, 4);

        int[] labels = new LouvainCommunityDetection(1.0, 42L).detect(graph);

        for (int i = 1; i < 4; i++) {
            assertEquals(labels[0], labels[i]);
            assertEquals(labels[4], labels[4 + i]);
        }
        assertNotEquals(labels[0], labels[4]);
    }

    @Property(tries = 25)
    void cliquesRecoveredForAnySeed(@ForAll @LongRange(min = 0, max = 100_000) long seed) {
        SimilarityGraph graph = GraphFixtures.cliques(4, 5);

        int[] labels = new LouvainCommunityDetection(1.0, seed).detect(graph);

        for (int c = 0; c < 4; c++) {
            for (int i = 1; i < 5; i++) {
                assertEquals(labels[c * 5], labels[c * 5 + i]);
            }
        }
        assertEquals(4, Arrays.stream(labels).distinct().count());
    }

    @Test
    void testSameSeedSameLabels() {
        SimilarityGraph graph = randomGraph(200, 600, 7L);

        int[] first = new LouvainCommunityDetection(1.0, 42L).detect(graph);
        int[] second = new LouvainCommunityDetection(1.0, 42L).detect(graph);

        assertArrayEquals(first, second);
    }

    @Test
    void testGraphWithoutEdgesGivesSingletons() {
        SimilarityGraph graph = GraphFixtures.graph(5, List.of());

        int[] labels = new LouvainCommunityDetection(1.0, 42L).detect(graph);

        assertArrayEquals(new int[] { 0, 1, 2, 3, 4 }, labels);
    }

    @Test
    void testIsolatedNodeStaysAlone() {
        List<SimilarityEdge> edges = List.of(
                new SimilarityEdge(0, 1, 0.9), new SimilarityEdge(1, 2, 0.9), new SimilarityEdge(0, 2, 0.9));
        SimilarityGraph graph = GraphFixtures.graph(4, edges);

        int[] labels = new LouvainCommunityDetection(1.0, 42L).detect(graph);

        assertEquals(labels[0], labels[1]);
        assertEquals(labels[0], labels[2]);
        assertNotEquals(labels[0], labels[3]);
    }

    @Test
    void testHigherResolutionGivesMoreCommunities() {
        SimilarityGraph graph = randomGraph(150, 500, 3L);

        long coarse = Arrays.stream(new LouvainCommunityDetection(0.2, 42L).detect(graph)).distinct().count();
        long fine = Arrays.stream(new LouvainCommunityDetection(5.0, 42L).detect(graph)).distinct().count();

        assertTrue(fine > coarse, "fine=" + fine + " coarse=" + coarse);
    }

    @Test
    void testImprovesOnSingletonModularity() {
        SimilarityGraph graph = randomGraph(120, 400, 11L);
        int[] singletons = new int[120];
        for (int i = 0; i < singletons.length; i++) {
            singletons[i] = i;
        }

        int[] labels = new LouvainCommunityDetection(1.0, 42L).detect(graph);

        assertTrue(CommunityDetector.modularity(graph, labels, 1.0)
                > CommunityDetector.modularity(graph, singletons, 1.0));
    }

    @Test
    void testRejectsNonPositiveResolution() {
        assertThrows(IllegalArgumentException.class, () -> new LouvainCommunityDetection(0.0, 1L));
    }

    static SimilarityGraph randomGraph(int nodes, int edgeCount, long seed) {
        Random random = new Random(seed);
        boolean[][] present = new boolean[nodes][nodes];
        List<SimilarityEdge> edges = new ArrayList<>();
        while (edges.size() < edgeCount) {
            int a = random.nextInt(nodes);
            int b = random.nextInt(nodes);
            if (a == b || present[Math.min(a, b)][Math.max(a, b)]) {
                continue;
            }
            present[Math.min(a, b)][Math.max(a, b)] = true;
            edges.add(new SimilarityEdge(a, b, 0.5 + random.nextDouble() * 0.5));
        }
        return GraphFixtures.graph(nodes, edges);
    }
}
