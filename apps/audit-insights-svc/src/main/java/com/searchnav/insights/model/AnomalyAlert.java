package com.searchnav.insights.model;

import java.time.Instant;
import java.util.List;

public record AnomalyAlert(
        MetricType metricType,
        Instant timestamp,
        double expectedValue,
        double actualValue,
        double deviationPercentage,
        Severity severity,
        List<String> possibleCauses,
        List<String> recommendedActions
) {
    public AnomalyAlert {
        possibleCauses = List.copyOf(possibleCauses);
        recommendedActions = List.copyOf(recommendedActions);
    }
}
