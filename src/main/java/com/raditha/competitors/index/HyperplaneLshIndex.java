package com.raditha.competitors.index;

import com.raditha.competitors.embedding.VectorMath;
import com.raditha.competitors.exception.IndexBuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Random;

/**
 * Approximate cosine index using random-hyperplane LSH with banding.
 *
 * <p>
 * Every band owns {@code rowsPerBand} random Gaussian hyperplanes drawn from a
 * seeded generator. A vector's band signature is the bit pattern of which side of
 * each hyperplane it falls on. Vectors sharing a bucket in any band become
 * candidates, which are then re-ranked by exact cosine similarity.
 * <p>
 * Bucket keys are bit-packed longs: the band index in the top 8 bits, the hashed
 * signature in the remaining 56.
 */
public class HyperplaneLshIndex implements NearestNeighborIndex {
    private static final Logger logger = LoggerFactory.getLogger(HyperplaneLshIndex.class);

    private final int numBands;
    private final int rowsPerBand;
    private final int maxCandidates;
    private final long seed;

    private List<float[]> vectors = List.of();
    private long[][] bandKeys = new long[0][];
    private Map<Long, List<Integer>> buckets = Map.of();

    /**
     * @param numBands      Number of bands (at most 255, the band index is packed in 8 bits)
     * @param rowsPerBand   Hyperplanes per band (at most 56 bits per signature)
     * @param maxCandidates Upper bound on candidates re-ranked per query
     * @param seed          Seed for the hyperplanes
     */
    public HyperplaneLshIndex(int numBands, int rowsPerBand, int maxCandidates, long seed) {
        if (numBands < 1 || numBands > 255) {
            throw new IllegalArgumentException("numBands must be between 1 and 255");
        }
        if (rowsPerBand < 1 || rowsPerBand > 56) {
            throw new IllegalArgumentException("rowsPerBand must be between 1 and 56");
        }
        if (maxCandidates < 1) {
            throw new IllegalArgumentException("maxCandidates must be >= 1");
        }
        this.numBands = numBands;
        this.rowsPerBand = rowsPerBand;
        this.maxCandidates = maxCandidates;
        this.seed = seed;
    }

    @Override
    public void build(List<float[]> vectors) {
        int width = VectorChecks.requireUniformWidth(vectors);
        float[][][] planes = drawHyperplanes(width);

        long[][] keys = new long[vectors.size()][];
        Map<Long, List<Integer>> index = new HashMap<>();
        for (int i = 0; i < vectors.size(); i++) {
            keys[i] = new long[numBands];
            for (int b = 0; b < numBands; b++) {
                long bucketKey = generateBucketKey(b, signBits(vectors.get(i), planes[b]));
                keys[i][b] = bucketKey;
                index.computeIfAbsent(bucketKey, k -> new ArrayList<>()).add(i);
            }
        }

        this.vectors = List.copyOf(vectors);
        this.bandKeys = keys;
        this.buckets = index;
        logger.debug("LSH index built: {} vectors, {} bands x {} rows, {} buckets",
                vectors.size(), numBands, rowsPerBand, index.size());
    }

    @Override
    public List<Neighbor> query(int node, int k) {
        if (node < 0 || node >= vectors.size()) {
            throw new IndexBuildException("Query node out of range: " + node);
        }

        // candidate -> number of bands shared with the query
        Map<Integer, Integer> collisions = new HashMap<>();
        for (int b = 0; b < numBands; b++) {
            for (int candidate : buckets.getOrDefault(bandKeys[node][b], List.of())) {
                if (candidate != node) {
                    collisions.merge(candidate, 1, Integer::sum);
                }
            }
        }

        List<Integer> candidates = new ArrayList<>(collisions.keySet());
        if (candidates.size() > maxCandidates) {
            candidates.sort((a, c) -> {
                int cmp = Integer.compare(collisions.get(c), collisions.get(a));
                return cmp != 0 ? cmp : Integer.compare(a, c);
            });
            candidates = candidates.subList(0, maxCandidates);
        }

        float[] q = vectors.get(node);
        PriorityQueue<Neighbor> top = new PriorityQueue<>(Neighbor.BY_SIMILARITY.reversed());
        for (int candidate : candidates) {
            top.add(new Neighbor(candidate, VectorMath.dot(q, vectors.get(candidate))));
            if (top.size() > k) {
                top.poll();
            }
        }
        List<Neighbor> result = new ArrayList<>(top);
        result.sort(Neighbor.BY_SIMILARITY);
        return result;
    }

    private float[][][] drawHyperplanes(int width) {
        Random random = new Random(seed);
        float[][][] planes = new float[numBands][rowsPerBand][width];
        for (int b = 0; b < numBands; b++) {
            for (int r = 0; r < rowsPerBand; r++) {
                for (int d = 0; d < width; d++) {
                    planes[b][r][d] = (float) random.nextGaussian();
                }
            }
        }
        return planes;
    }

    private long signBits(float[] v, float[][] bandPlanes) {
        long bits = 0L;
        for (int r = 0; r < rowsPerBand; r++) {
            if (VectorMath.dot(v, bandPlanes[r]) >= 0.0) {
                bits |= 1L << r;
            }
        }
        return bits;
    }

    /**
     * Generate a bit-packed long key for a band and its signature.
     * Bits 63-56: bandIndex (8 bits), Bits 55-0: 56-bit hash of the sign bits.
     */
    private static long generateBucketKey(int bandIndex, long signature) {
        long bandPart = ((long) bandIndex) << 56;
        long hash = 0x9e3779b97f4a7c15L; // Golden ratio constant
        hash ^= signature;
        hash *= 0xff51afd7ed558ccdL; // MurmurHash3 constant
        hash ^= (hash >>> 33);
        return bandPart | (hash & 0x00FFFFFFFFFFFFFFL);
    }
}
