package com.researchmatch.similarity;

import com.researchmatch.exception.DimensionMismatchException;

import java.util.List;

/**
 * Vector helpers for building preference profiles and checking dimensionality.
 */
public final class ProfileVectors {

    private ProfileVectors() {
    }

    /**
     * Elementwise arithmetic mean of the given vectors.
     *
     * @param vectors non-empty list of equal-length vectors
     * @return the averaged vector
     */
    public static double[] average(List<double[]> vectors) {
        if (vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty list of vectors");
        }

        int dimension = vectors.get(0).length;
        double[] sum = new double[dimension];
        for (double[] vector : vectors) {
            requireDimension(vector, dimension);
            for (int i = 0; i < dimension; i++) {
                sum[i] += vector[i];
            }
        }

        for (int i = 0; i < dimension; i++) {
            sum[i] /= vectors.size();
        }
        return sum;
    }

    /**
     * @throws DimensionMismatchException if the vector is not {@code expected} long
     */
    public static double[] requireDimension(double[] vector, int expected) {
        if (vector.length != expected) {
            throw new DimensionMismatchException(expected, vector.length);
        }
        return vector;
    }
}
