package com.raditha.competitors.embedding;

/**
 * Small dense-vector helpers shared by fusion, indexing and validation.
 * Vectors are stored as {@code float[]}; arithmetic is done in double.
 */
public final class VectorMath {

    /**
     * Norms below this are treated as zero.
     */
    public static final double ZERO_NORM = 1e-12;

    /**
     * Cosines this close to 1.0 are float rounding of identical directions.
     */
    public static final double UNIT_COSINE_TOLERANCE = 1e-6;

    private VectorMath() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static double dot(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vectors must have same dimensions: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += (double) a[i] * b[i];
        }
        return sum;
    }

    public static double norm(float[] v) {
        return Math.sqrt(dot(v, v));
    }

    /**
     * Unit-length copy of {@code v}, or {@code null} when {@code v} has zero length.
     */
    public static float[] normalize(float[] v) {
        double norm = norm(v);
        if (norm < ZERO_NORM) {
            return null;
        }
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = (float) (v[i] / norm);
        }
        return out;
    }

    /**
     * {@code wa * a + wb * b}; the result is not normalized.
     */
    public static float[] weightedSum(float[] a, double wa, float[] b, double wb) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vectors must have same dimensions: " + a.length + " vs " + b.length);
        }
        float[] out = new float[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = (float) (wa * a[i] + wb * b[i]);
        }
        return out;
    }

    public static double euclideanDistance(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Vectors must have same dimensions: " + a.length + " vs " + b.length);
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = (double) a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Cosine similarity of two unit vectors clamped to [0,1]. Values within
     * {@link #UNIT_COSINE_TOLERANCE} of 1.0 are reported as exactly 1.0.
     */
    public static double clampedCosine(float[] a, float[] b) {
        double cos = dot(a, b);
        if (cos < 0.0) {
            return 0.0;
        }
        if (cos >= 1.0 - UNIT_COSINE_TOLERANCE) {
            return 1.0;
        }
        return cos;
    }
}
