package com.raditha.competitors.review;

import com.raditha.competitors.config.ReviewOptions;
import com.raditha.competitors.model.Cluster;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.Partition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class LlmClusterReviewerTest {

    private final Map<String, Company> companies = new HashMap<>();

    /**
     * Clusters of the given sizes, largest first as the detector orders them.
     */
    private Partition partition(int... sizes) {
        List<Cluster> clusters = new ArrayList<>();
        Map<String, Integer> assignment = new HashMap<>();
        for (int c = 0; c < sizes.length; c++) {
            List<String> members = new ArrayList<>();
            for (int m = 0; m < sizes[c]; m++) {
                String id = String.format("c%02d-m%02d", c, m);
                members.add(id);
                assignment.put(id, c);
                companies.put(id, new Company(id, "Company " + id, "small banks", "core banking software",
                        Set.of("fintech"), ""));
            }
            clusters.add(new Cluster(c, members));
        }
        return new Partition(clusters, assignment, 0.4);
    }

    @Test
    void testSelectionSkipsSingletons() {
        Partition partition = partition(5, 3, 1, 1);

        List<Cluster> selected = LlmClusterReviewer.selectClusters(partition, 10, new Random(1L));

        assertEquals(List.of(0, 1), selected.stream().map(Cluster::id).toList());
    }

    @Test
    void testSelectionTakesLargestThenRandom() {
        Partition partition = partition(20, 18, 16, 14, 12, 10, 8, 6, 4, 3, 2, 2);

        List<Cluster> selected = LlmClusterReviewer.selectClusters(partition, 5, new Random(1L));

        // 70% of 5 -> the three largest, then two drawn from the rest
        assertEquals(5, selected.size());
        assertEquals(List.of(0, 1, 2), selected.subList(0, 3).stream().map(Cluster::id).toList());
        assertEquals(5, selected.stream().map(Cluster::id).distinct().count());
        assertTrue(selected.subList(3, 5).stream().allMatch(c -> c.id() >= 3));
    }

    @Test
    void testReviewAsksSummaryQualityAndFit() {
        ClusterReviewModel model = mock(ClusterReviewModel.class);
        when(model.ask(contains("concise summary"))).thenReturn("Core banking vendors for small banks.");
        when(model.ask(contains("overall quality"))).thenReturn("Rating: 8. Clear competitors.");
        when(model.ask(contains("Target Company"))).thenReturn("9 - direct competitor");

        Partition partition = partition(3, 2);
        ReviewResult result = new LlmClusterReviewer(model, new ReviewOptions(true, 10, "gemini-2.0-flash"), 42L)
                .review(partition, companies);

        assertEquals(2, result.reviews().size());
        ClusterReview first = result.reviews().get(0);
        assertEquals(0, first.clusterId());
        assertEquals("Core banking vendors for small banks.", first.summary());
        assertEquals(8.0, first.qualityScore());
        assertEquals(3, first.memberFits().size());
        assertEquals(9.0, first.averageFit());
        assertEquals(8.0, result.summary().averageQuality());
        // summary + quality + one fit per member, for each cluster
        verify(model, times(2 + 3 + 2 + 2)).ask(anyString());
    }

    @Test
    void testFailedClusterIsSkipped() {
        ClusterReviewModel model = mock(ClusterReviewModel.class);
        when(model.ask(anyString())).thenReturn("7");
        when(model.ask(contains("c00-m00"))).thenThrow(new ReviewException("quota exceeded"));

        Partition partition = partition(3, 2);
        ReviewResult result = new LlmClusterReviewer(model, new ReviewOptions(true, 10, "gemini-2.0-flash"), 42L)
                .review(partition, companies);

        assertEquals(1, result.reviews().size());
        assertEquals(1, result.reviews().get(0).clusterId());
        assertEquals(1, result.summary().clustersReviewed());
    }

    @Test
    void testLargeClusterMembersCapped() {
        ClusterReviewModel model = mock(ClusterReviewModel.class);
        when(model.ask(anyString())).thenReturn("6");

        Partition partition = partition(30);
        ReviewResult result = new LlmClusterReviewer(model, new ReviewOptions(true, 10, "gemini-2.0-flash"), 42L)
                .review(partition, companies);

        assertEquals(LlmClusterReviewer.MEMBERS_PER_CLUSTER, result.reviews().get(0).memberFits().size());
        assertEquals(30, result.reviews().get(0).clusterSize());
    }

    @Test
    void testNoMultiMemberClusters() {
        ClusterReviewModel model = mock(ClusterReviewModel.class);

        ReviewResult result = new LlmClusterReviewer(model, new ReviewOptions(true, 10, "gemini-2.0-flash"), 42L)
                .review(partition(1, 1), companies);

        assertTrue(result.reviews().isEmpty());
        verifyNoInteractions(model);
    }

    @Test
    void testPromptsMentionCompanies() {
        Company company = new Company("acme", "Acme", "hospitals", "scheduling software", Set.of(), "");

        String listing = LlmClusterReviewer.listing(List.of(company));

        assertEquals("- Acme: scheduling software (Customers: hospitals)\n", listing);
        assertTrue(LlmClusterReviewer.summaryPrompt(listing).contains(listing));
        assertTrue(LlmClusterReviewer.fitPrompt(company, "Hospital software").contains("Description: N/A"));
    }
}
