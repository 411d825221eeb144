package com.raditha.competitors.review;

import java.util.List;

/**
 * Aggregate of the cluster quality ratings.
 *
 * @param clustersReviewed Clusters with a quality rating
 * @param averageQuality   Mean quality rating
 * @param medianQuality    Median quality rating
 * @param highQuality      Clusters rated 7 or above
 * @param lowQuality       Clusters rated 4 or below
 */
public record ReviewSummary(
        int clustersReviewed,
        double averageQuality,
        double medianQuality,
        int highQuality,
        int lowQuality) {

    public static final double HIGH_QUALITY_MIN = 7.0;
    public static final double LOW_QUALITY_MAX = 4.0;

    public static ReviewSummary of(List<ClusterReview> reviews) {
        double[] scores = reviews.stream().mapToDouble(ClusterReview::qualityScore).sorted().toArray();
        if (scores.length == 0) {
            return new ReviewSummary(0, 0.0, 0.0, 0, 0);
        }
        double sum = 0.0;
        int high = 0;
        int low = 0;
        for (double score : scores) {
            sum += score;
            if (score >= HIGH_QUALITY_MIN) {
                high++;
            }
            if (score <= LOW_QUALITY_MAX) {
                low++;
            }
        }
        int mid = scores.length / 2;
        double median = scores.length % 2 == 1 ? scores[mid] : (scores[mid - 1] + scores[mid]) / 2.0;
        return new ReviewSummary(scores.length, sum / scores.length, median, high, low);
    }
}
