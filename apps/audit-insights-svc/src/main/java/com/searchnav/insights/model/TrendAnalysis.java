package com.searchnav.insights.model;

import java.time.Instant;
import java.util.List;

public record TrendAnalysis(
        String customerId,
        MetricType metricType,
        Instant startDate,
        Instant endDate,
        TrendGranularity granularity,
        List<TrendDataPoint> dataPoints,
        TrendDirection trendDirection,
        double trendStrength,
        List<TrendDataPoint> forecast,
        boolean seasonalityDetected,
        int anomaliesDetected,
        List<String> insights
) {
    public TrendAnalysis {
        dataPoints = List.copyOf(dataPoints);
        forecast = forecast == null ? List.of() : List.copyOf(forecast);
        insights = insights == null ? List.of() : List.copyOf(insights);
    }

    public boolean hasForecast() {
        return !forecast.isEmpty();
    }

    public TrendAnalysis withInsights(List<String> newInsights) {
        return new TrendAnalysis(
                customerId,
                metricType,
                startDate,
                endDate,
                granularity,
                dataPoints,
                trendDirection,
                trendStrength,
                forecast,
                seasonalityDetected,
                anomaliesDetected,
                newInsights
        );
    }
}
