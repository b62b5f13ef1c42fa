package com.researchmatch.similarity;

import com.researchmatch.exception.DimensionMismatchException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ProfileVectors.
 */
class ProfileVectorsTest {

    @Test
    void average_OfIdenticalCopies_ReturnsSameVector() {
        double[] v = {0.25, -0.5, 1.0, 0.0};

        assertThat(ProfileVectors.average(Collections.nCopies(4, v))).containsExactly(v);
    }

    @Test
    void average_IsElementwiseMean() {
        double[] mean = ProfileVectors.average(List.of(
                new double[]{1, 2, 3},
                new double[]{3, 4, 5}));

        assertThat(mean).containsExactly(2.0, 3.0, 4.0);
    }

    @Test
    void average_RejectsMixedDimensions() {
        assertThatThrownBy(() -> ProfileVectors.average(List.of(new double[]{1, 2}, new double[]{1, 2, 3})))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void average_RejectsEmptyList() {
        assertThatThrownBy(() -> ProfileVectors.average(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void requireDimension() {
        double[] v = {1, 2, 3};

        assertThat(ProfileVectors.requireDimension(v, 3)).isSameAs(v);
        assertThatThrownBy(() -> ProfileVectors.requireDimension(v, 1536))
                .isInstanceOf(DimensionMismatchException.class)
                .extracting("expected", "actual")
                .containsExactly(1536, 3);
    }
}
