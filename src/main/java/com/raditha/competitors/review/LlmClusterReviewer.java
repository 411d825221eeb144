package com.raditha.competitors.review;

import com.raditha.competitors.config.ReviewOptions;
import com.raditha.competitors.model.Cluster;
import com.raditha.competitors.model.Company;
import com.raditha.competitors.model.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Asks a language model to judge a subset of the clusters.
 *
 * <p>
 * Most of the reviewed clusters are the largest multi-member ones, the rest are
 * drawn at random from the remaining multi-member clusters. For every cluster the
 * model writes a segment summary, rates the cluster, then rates how well each
 * member fits. A cluster whose review fails is logged and left out.
 */
public class LlmClusterReviewer {
    private static final Logger logger = LoggerFactory.getLogger(LlmClusterReviewer.class);

    static final double LARGEST_SHARE = 0.7;
    static final int MEMBERS_PER_CLUSTER = 20;

    private static final String PERSONA = "You are an experienced business analyst and market researcher "
            + "specializing in competitive analysis and market segmentation.\n\n";

    private final ClusterReviewModel model;
    private final ReviewOptions options;
    private final long seed;

    public LlmClusterReviewer(ClusterReviewModel model, ReviewOptions options, long seed) {
        this.model = model;
        this.options = options;
        this.seed = seed;
    }

    /**
     * @param partition Detected clusters
     * @param companies Company by identifier
     */
    public ReviewResult review(Partition partition, Map<String, Company> companies) {
        Random random = new Random(seed);
        List<Cluster> selected = selectClusters(partition, options.clusters(), random);
        if (selected.isEmpty()) {
            logger.warn("No multi-member clusters found for review");
        } else {
            logger.info("Reviewing {} clusters with {}", selected.size(), options.model());
        }

        List<ClusterReview> reviews = new ArrayList<>();
        for (Cluster cluster : selected) {
            List<Company> members = new ArrayList<>();
            for (String id : pickMembers(cluster.memberIds(), random)) {
                members.add(companies.get(id));
            }
            try {
                reviews.add(reviewCluster(cluster, members));
            } catch (RuntimeException e) {
                logger.error("Error reviewing cluster {}: {}", cluster.id(), e.getMessage());
            }
        }

        ReviewSummary summary = ReviewSummary.of(reviews);
        logger.info("Review completed: {} clusters, average quality {}",
                summary.clustersReviewed(), String.format("%.2f", summary.averageQuality()));
        return new ReviewResult(options.model(), reviews, summary);
    }

    /**
     * Clusters to review: the largest {@code 70%} of the quota plus a random draw
     * from the remaining multi-member clusters.
     */
    static List<Cluster> selectClusters(Partition partition, int quota, Random random) {
        List<Cluster> multi = new ArrayList<>();
        for (Cluster cluster : partition.clusters()) {
            if (cluster.size() > 1) {
                multi.add(cluster);
            }
        }
        if (multi.size() <= quota) {
            return multi;
        }
        // clusters are already ordered by size, largest first
        int largest = (int) (quota * LARGEST_SHARE);
        List<Cluster> selected = new ArrayList<>(multi.subList(0, largest));
        List<Cluster> rest = new ArrayList<>(multi.subList(largest, multi.size()));
        Collections.shuffle(rest, random);
        selected.addAll(rest.subList(0, Math.min(quota - largest, rest.size())));
        return selected;
    }

    private List<String> pickMembers(List<String> memberIds, Random random) {
        if (memberIds.size() <= MEMBERS_PER_CLUSTER) {
            return memberIds;
        }
        List<String> shuffled = new ArrayList<>(memberIds);
        Collections.shuffle(shuffled, random);
        List<String> picked = new ArrayList<>(shuffled.subList(0, MEMBERS_PER_CLUSTER));
        Collections.sort(picked);
        return picked;
    }

    private ClusterReview reviewCluster(Cluster cluster, List<Company> members) {
        logger.debug("Reviewing cluster {} ({} members)", cluster.id(), cluster.size());
        String listing = listing(members);

        String summary = model.ask(summaryPrompt(listing));
        String qualityResponse = model.ask(qualityPrompt(listing, summary));
        double quality = ScoreExtractor.extract(qualityResponse);

        List<MemberFit> fits = new ArrayList<>();
        for (Company company : members) {
            String fitResponse = model.ask(fitPrompt(company, summary));
            fits.add(new MemberFit(company.id(), company.name(), ScoreExtractor.extract(fitResponse), fitResponse));
        }
        return new ClusterReview(cluster.id(), cluster.size(), summary, quality, qualityResponse, fits);
    }

    static String listing(List<Company> members) {
        StringBuilder sb = new StringBuilder();
        for (Company company : members) {
            sb.append("- ").append(displayName(company)).append(": ").append(company.productDescription())
                    .append(" (Customers: ").append(company.customerDescription()).append(")\n");
        }
        return sb.toString();
    }

    private static String displayName(Company company) {
        return company.name().isEmpty() ? company.id() : company.name();
    }

    static String summaryPrompt(String listing) {
        return PERSONA + """
                Based on the following cluster of companies, provide a concise summary (2-3 sentences) \
                of the core product-market segment this cluster represents:

                Cluster Companies:
                %s
                Focus on:
                - What type of product/service they offer
                - Who their target customers are
                - What market segment they serve""".formatted(listing);
    }

    static String qualityPrompt(String listing, String summary) {
        return PERSONA + """
                Rate the overall quality of this cluster on a scale of 1-10:

                Cluster Companies:
                %s
                Cluster Summary: %s

                Consider:
                - How cohesive are the companies?
                - Do they serve the same market?
                - Are they direct competitors?
                - Is the cluster too broad or too narrow?

                Rating Scale:
                1-2: Poor cluster - companies don't belong together
                3-4: Weak cluster - limited competitive relationship
                5-6: Fair cluster - some competitive overlap
                7-8: Good cluster - clear competitive group
                9-10: Excellent cluster - strong competitive relationship

                Provide your rating (1-10) and brief explanation:""".formatted(listing, summary);
    }

    static String fitPrompt(Company company, String summary) {
        String description = company.description().isEmpty() ? "N/A" : company.description();
        return PERSONA + """
                For the company below, rate how well it fits the core product-market segment of this \
                cluster on a scale of 1-10:

                Target Company:
                Name: %s
                Product: %s
                Customers: %s
                Description: %s

                Cluster Summary: %s

                Rating Scale:
                1-2: Completely different market/product (not a competitor)
                3-4: Somewhat related but different focus
                5-6: Moderately related, some overlap
                7-8: Good fit, clear competitor
                9-10: Excellent fit, direct competitor

                Provide your rating (1-10) and a brief explanation:""".formatted(
                displayName(company), company.productDescription(), company.customerDescription(),
                description, summary);
    }
}
