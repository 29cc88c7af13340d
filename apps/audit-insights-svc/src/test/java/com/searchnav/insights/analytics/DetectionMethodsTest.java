package com.searchnav.insights.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class DetectionMethodsTest {

    private static final double[] FLAT = {5, 5, 5, 5, 5};

    @Test
    void zScoreIgnoresZeroVarianceHistory() {
        DetectorResult result = DetectionMethods.zScore(10, FLAT, 2.5);

        assertThat(result.triggered()).isFalse();
        assertThat(result.magnitude()).isZero();
    }

    @Test
    void zScoreFlagsValueBeyondThreshold() {
        DetectorResult result = DetectionMethods.zScore(150, new double[] {100, 102, 98, 101, 99}, 2.5);

        assertThat(result.triggered()).isTrue();
        assertThat(result.magnitude()).isCloseTo(50 / Math.sqrt(2), within(1e-9));
    }

    @Test
    void iqrIgnoresZeroSpreadHistory() {
        DetectorResult result = DetectionMethods.iqr(10, FLAT, 1.5);

        assertThat(result.triggered()).isFalse();
        assertThat(result.magnitude()).isZero();
    }

    @Test
    void iqrMeasuresDistanceOutsideFenceInIqrUnits() {
        double[] history = {1, 2, 3, 4, 5};
        // q1 = 2, q3 = 4, iqr = 2, upper fence = 7

        DetectorResult above = DetectionMethods.iqr(11, history, 1.5);
        DetectorResult below = DetectionMethods.iqr(-3, history, 1.5);
        DetectorResult inside = DetectionMethods.iqr(6, history, 1.5);

        assertThat(above.triggered()).isTrue();
        assertThat(above.magnitude()).isCloseTo(2d, within(1e-12));
        assertThat(below.triggered()).isTrue();
        assertThat(below.magnitude()).isCloseTo(1d, within(1e-12));
        assertThat(inside.triggered()).isFalse();
    }

    @Test
    void trendResidualUsesRangeFloorForPerfectLine() {
        double[] line = {10, 20, 30, 40, 50};
        // next point on the line is 60; residual spread floors at 5% of range 40 = 2

        DetectorResult onTrend = DetectionMethods.trendResidual(60, line, 2.0, 0.05);
        DetectorResult offTrend = DetectionMethods.trendResidual(70, line, 2.0, 0.05);

        assertThat(onTrend.triggered()).isFalse();
        assertThat(offTrend.triggered()).isTrue();
        assertThat(offTrend.magnitude()).isCloseTo(5d, within(1e-9));
    }

    @Test
    void trendResidualNeverDividesByZeroOnFlatHistory() {
        DetectorResult result = DetectionMethods.trendResidual(10, FLAT, 2.0, 0.05);

        assertThat(result.triggered()).isFalse();
        assertThat(result.magnitude()).isZero();
    }

    @Test
    void trendResidualNeedsThreePoints() {
        assertThat(DetectionMethods.trendResidual(100, new double[] {1, 2}, 2.0, 0.05).triggered()).isFalse();
    }

    @Test
    void resultsCombineWithLogicalOr() {
        List<DetectorResult> results = List.of(
                DetectorResult.notTriggered(DetectorResult.Method.Z_SCORE),
                new DetectorResult(DetectorResult.Method.IQR, true, 1.2),
                DetectorResult.notTriggered(DetectorResult.Method.TREND_RESIDUAL));

        assertThat(DetectorResult.anyTriggered(results)).isTrue();
        assertThat(DetectorResult.magnitudeOf(results, DetectorResult.Method.IQR)).isEqualTo(1.2);
        assertThat(DetectorResult.anyTriggered(List.of(DetectorResult.notTriggered(DetectorResult.Method.IQR)))).isFalse();
    }
}
