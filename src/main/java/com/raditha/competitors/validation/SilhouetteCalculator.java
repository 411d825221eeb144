package com.raditha.competitors.validation;

import com.raditha.competitors.embedding.VectorMath;
import com.raditha.competitors.model.EmbeddingSpace;
import com.raditha.competitors.model.SilhouetteResult;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

/**
 * Mean silhouette coefficient with euclidean distance over the fused vectors.
 *
 * <p>
 * For a point i: a(i) is its mean distance to the other points of its cluster,
 * b(i) the smallest mean distance to the points of another cluster, and
 * s(i) = (b - a) / max(a, b). Spaces larger than the sample size are evaluated
 * on a seeded sample of points.
 */
public class SilhouetteCalculator {

    private final int sampleSize;
    private final long seed;

    public SilhouetteCalculator(int sampleSize, long seed) {
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    /**
     * @param space  Embedding space
     * @param labels Cluster id per row of the space
     */
    public SilhouetteResult compute(EmbeddingSpace space, int[] labels) {
        Map<Integer, Integer> sizes = new HashMap<>();
        for (int label : labels) {
            sizes.merge(label, 1, Integer::sum);
        }
        if (sizes.size() < 2) {
            return SilhouetteResult.undefined("fewer than two clusters");
        }
        long singletons = sizes.values().stream().filter(s -> s < 2).count();
        if (singletons > 0) {
            return SilhouetteResult.undefined(singletons + " clusters have fewer than two members");
        }

        int[] points = samplePoints(labels.length);

        // dense index of each label present in the sample
        Map<Integer, Integer> slot = new HashMap<>();
        for (int p : points) {
            slot.putIfAbsent(labels[p], slot.size());
        }
        if (slot.size() < 2) {
            return SilhouetteResult.undefined("sample contains fewer than two clusters");
        }
        int[] counts = new int[slot.size()];
        for (int p : points) {
            counts[slot.get(labels[p])]++;
        }

        double[] distanceSums = new double[slot.size()];
        double total = 0.0;
        for (int p : points) {
            Arrays.fill(distanceSums, 0.0);
            float[] v = space.vector(p);
            for (int q : points) {
                if (q != p) {
                    distanceSums[slot.get(labels[q])] += VectorMath.euclideanDistance(v, space.vector(q));
                }
            }
            int own = slot.get(labels[p]);
            if (counts[own] < 2) {
                continue;
            }
            double a = distanceSums[own] / (counts[own] - 1);
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < counts.length; c++) {
                if (c != own && counts[c] > 0) {
                    b = Math.min(b, distanceSums[c] / counts[c]);
                }
            }
            double denominator = Math.max(a, b);
            total += denominator > 0.0 ? (b - a) / denominator : 0.0;
        }
        return SilhouetteResult.of(total / points.length, points.length);
    }

    private int[] samplePoints(int n) {
        int[] all = new int[n];
        for (int i = 0; i < n; i++) {
            all[i] = i;
        }
        if (n <= sampleSize) {
            return all;
        }
        Random random = new Random(seed);
        for (int i = n - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        int[] sample = Arrays.copyOf(all, sampleSize);
        Arrays.sort(sample);
        return sample;
    }
}
