package com.searchnav.insights.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.searchnav.insights.model.ComparisonOptions;
import com.searchnav.insights.model.MetricType;
import java.util.List;
import org.junit.jupiter.api.Test;

class InsightsPropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        InsightsProperties props = new InsightsProperties(null, null, null);

        assertThat(props.anomaly().zScoreThreshold()).isEqualTo(2.5);
        assertThat(props.anomaly().iqrMultiplier()).isEqualTo(1.5);
        assertThat(props.anomaly().minHistoricalPoints()).isEqualTo(5);
        assertThat(props.trend().stableSlopeThreshold()).isEqualTo(0.01);
        assertThat(props.trend().seasonalLags()).containsExactly(3, 4, 12);
        assertThat(props.comparison().defaultOptions()).isEqualTo(ComparisonOptions.defaults());
    }

    @Test
    void ladderIsChosenByMetricTier() {
        InsightsProperties.Anomaly anomaly = InsightsProperties.Anomaly.defaults();

        assertThat(anomaly.ladderFor(MetricType.ROAS).criticalDeviationPct()).isEqualTo(50d);
        assertThat(anomaly.ladderFor(MetricType.CTR).criticalDeviationPct()).isEqualTo(75d);
        assertThat(anomaly.ladderFor(MetricType.IMPRESSIONS).criticalDeviationPct()).isEqualTo(100d);
    }

    @Test
    void partialComparisonSectionKeepsOtherDefaults() {
        InsightsProperties.Comparison comparison = new InsightsProperties.Comparison(null, 0.99, null, true, null, null);

        ComparisonOptions options = comparison.defaultOptions();

        assertThat(options.confidenceLevel()).isEqualTo(0.99);
        assertThat(options.breakdownByCampaign()).isTrue();
        assertThat(options.breakdownByAdGroup()).isFalse();
        assertThat(options.minimumSampleSize()).isEqualTo(30);
    }

    @Test
    void emptyLagListUsesDefaultLags() {
        InsightsProperties.Trend trend = new InsightsProperties.Trend(null, null, null, null, List.of(), null, null, null);

        assertThat(trend.seasonalLags()).containsExactly(3, 4, 12);
    }

    @Test
    void rejectsInvalidThresholds() {
        assertThatThrownBy(() -> new InsightsProperties.Anomaly(0d, null, null, null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightsProperties.Trend(null, null, null, null, List.of(0), null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightsProperties.SeverityLadder(20d, 4d, 30d, 3d, 10d, 2d))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deviation");
        assertThatThrownBy(() -> new InsightsProperties.SeverityLadder(50d, null, 30d, 3d, 20d, 2.5d))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void comparisonSectionRejectsOutOfRangeValuesAtBinding() {
        assertThatThrownBy(() -> new InsightsProperties.Comparison(null, 1.0, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("confidenceLevel");
        assertThatThrownBy(() -> new InsightsProperties.Comparison(null, 0d, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InsightsProperties.Comparison(null, null, 0, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minimumSampleSize");
    }
}
