package com.researchmatch.similarity;

import com.researchmatch.exception.DimensionMismatchException;

/**
 * Cosine similarity between embedding vectors.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Compute the cosine of the angle between two vectors.
     *
     * @param a first vector
     * @param b second vector, same length as {@code a}
     * @return score in [-1, 1], or 0 when either vector has zero norm
     * @throws DimensionMismatchException if the lengths differ
     */
    public static double between(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new DimensionMismatchException(a.length, b.length);
        }

        double scaleA = maxAbs(a);
        double scaleB = maxAbs(b);
        if (scaleA == 0.0 || scaleB == 0.0) {
            return 0.0;
        }

        // components are scaled into [-1, 1] so the sums neither overflow nor underflow
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            double x = a[i] / scaleA;
            double y = b[i] / scaleB;
            dot += x * y;
            normA += x * x;
            normB += y * y;
        }

        double score = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // rounding can push parallel vectors just past 1
        return Math.max(-1.0, Math.min(1.0, score));
    }

    private static double maxAbs(double[] vector) {
        double max = 0.0;
        for (double value : vector) {
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }
}
