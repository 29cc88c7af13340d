package com.searchnav.insights.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class ChiSquareTestTest {

    @Test
    void clearRateDifferenceIsSignificant() {
        // 2% vs 3% CTR over 10k impressions each
        double pValue = ChiSquareTest.pValue(200, 10_000, 300, 10_000).orElseThrow();

        assertThat(pValue).isLessThan(0.001);
    }

    @Test
    void nearlyEqualRatesAreNotSignificant() {
        double pValue = ChiSquareTest.pValue(200, 10_000, 205, 10_000).orElseThrow();

        assertThat(pValue).isGreaterThan(0.5);
    }

    @Test
    void identicalTablesHavePValueOfOne() {
        assertThat(ChiSquareTest.pValue(50, 100, 50, 100).orElseThrow()).isCloseTo(1d, within(1e-6));
    }

    @Test
    void degenerateTablesHaveNoPValue() {
        assertThat(ChiSquareTest.pValue(0, 100, 0, 100)).isEmpty();
        assertThat(ChiSquareTest.pValue(0, 0, 0, 0)).isEmpty();
        assertThat(ChiSquareTest.pValue(120, 100, 10, 100)).isEmpty();
    }

    @Test
    void survivalMatchesChiSquareCriticalValue() {
        assertThat(ChiSquareTest.survival(3.841458820694124)).isCloseTo(0.05, within(1e-4));
        assertThat(ChiSquareTest.survival(0)).isEqualTo(1d);
        assertThat(ChiSquareTest.erfc(0)).isCloseTo(1d, within(1e-6));
    }

    @Test
    void rejectsNonSquareTable() {
        assertThatThrownBy(() -> ChiSquareTest.pValue(new double[][] {{1, 2, 3}, {4, 5, 6}}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
