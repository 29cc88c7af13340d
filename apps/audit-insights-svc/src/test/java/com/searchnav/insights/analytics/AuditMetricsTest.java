package com.searchnav.insights.analytics;

import static com.searchnav.insights.analytics.AuditFixtures.audit;
import static org.assertj.core.api.Assertions.assertThat;

import com.searchnav.insights.model.AuditResult;
import com.searchnav.insights.model.MetricType;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuditMetricsTest {

    private final AuditResult audit = audit("a1", Instant.parse("2024-04-01T00:00:00Z"),
            Map.of("ctr", 0.031, "clicks", "420", "avg_quality_score", 6.5, "roas", "n/a"), 14);

    @Test
    void readsNumbersAndNumericStrings() {
        assertThat(AuditMetrics.getMetric(audit, MetricType.CTR)).hasValue(0.031);
        assertThat(AuditMetrics.getMetric(audit, MetricType.CLICKS)).hasValue(420d);
        assertThat(AuditMetrics.getMetric(audit, MetricType.QUALITY_SCORE)).hasValue(6.5);
    }

    @Test
    void issuesCountComesFromSummaryLevel() {
        assertThat(AuditMetrics.getMetric(audit, MetricType.ISSUES_COUNT)).hasValue(14d);
    }

    @Test
    void absentOrMalformedValuesAreEmpty() {
        Map<String, Object> metrics = new HashMap<>();
        metrics.put("total_spend", null);
        metrics.put("wasted_spend", Double.NaN);

        assertThat(AuditMetrics.getMetric(audit, MetricType.ROAS)).isEmpty();
        assertThat(AuditMetrics.getMetric(audit, MetricType.CONVERSIONS)).isEmpty();
        assertThat(AuditMetrics.getMetric(metrics, MetricType.TOTAL_SPEND)).isEmpty();
        assertThat(AuditMetrics.getMetric(metrics, MetricType.WASTED_SPEND)).isEmpty();
        assertThat(AuditMetrics.valueOrZero(metrics, MetricType.WASTED_SPEND)).isZero();
    }

    @Test
    void metricTypesResolveFromTheirValue() {
        assertThat(MetricType.fromValue("quality_score")).contains(MetricType.QUALITY_SCORE);
        assertThat(MetricType.fromValue("bounce_rate")).isEmpty();
        assertThat(MetricType.QUALITY_SCORE.fieldName()).isEqualTo("avg_quality_score");
        assertThat(MetricType.CONVERSIONS.tier()).isEqualTo(MetricType.Tier.CRITICAL);
    }
}
