package com.mcache.bloom;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class FilterParametersTest {

    @Test
    void estimateMatchesOptimalSizingFormula() {
        FilterParameters p = FilterParameters.estimate(1000, 0.01);

        double ln2 = Math.log(2);
        long m = (long) Math.ceil(-1000 * Math.log(0.01) / (ln2 * ln2));
        assertThat(p.getM()).isEqualTo(m).isEqualTo(9586L);
        assertThat(p.getK()).isEqualTo((int) Math.ceil(ln2 * m / 1000)).isEqualTo(7);
    }

    @Test
    void estimateDoesNotFloor() {
        FilterParameters p = FilterParameters.estimate(0, 0.01);

        assertThat(p.getM()).isZero();
        assertThat(p.getK()).isZero();
    }

    @Test
    void ofFloorsToOne() {
        FilterParameters p = FilterParameters.of(0, 0);

        assertThat(p.getM()).isEqualTo(1L);
        assertThat(p.getK()).isEqualTo(1);
        assertThat(FilterParameters.estimate(0, 0.01).floored()).isEqualTo(p);
        assertThat(FilterParameters.of(-5, -5)).isEqualTo(p);
    }
}
