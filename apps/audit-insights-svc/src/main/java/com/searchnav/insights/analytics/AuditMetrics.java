package com.searchnav.insights.analytics;

import com.searchnav.insights.model.AuditResult;
import com.searchnav.insights.model.MetricType;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Typed access to the loosely-structured audit summary. Absent or non-numeric values are empty,
 * never zero; callers choose their own default.
 */
public final class AuditMetrics {

    private AuditMetrics() {
    }

    public static OptionalDouble getMetric(AuditResult audit, MetricType metricType) {
        Map<String, Object> source = metricType.isSummaryLevel() ? audit.summary() : audit.metrics();
        return getMetric(source, metricType);
    }

    public static OptionalDouble getMetric(Map<String, Object> metrics, MetricType metricType) {
        Object value = metrics.get(metricType.fieldName());
        if (value instanceof Number number) {
            double numeric = number.doubleValue();
            return Double.isFinite(numeric) ? OptionalDouble.of(numeric) : OptionalDouble.empty();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                double numeric = Double.parseDouble(text.trim());
                return Double.isFinite(numeric) ? OptionalDouble.of(numeric) : OptionalDouble.empty();
            } catch (NumberFormatException ex) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    public static double valueOrZero(AuditResult audit, MetricType metricType) {
        return getMetric(audit, metricType).orElse(0d);
    }

    public static double valueOrZero(Map<String, Object> metrics, MetricType metricType) {
        return getMetric(metrics, metricType).orElse(0d);
    }
}
