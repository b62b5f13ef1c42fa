package com.researchmatch.exception;

/**
 * Thrown when two vectors, or a vector and the configured dimensionality,
 * do not have the same length.
 */
public class DimensionMismatchException extends ResearchMatchException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("Dimension mismatch: expected %d, got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
