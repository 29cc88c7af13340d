package com.searchnav.insights.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One observation of a metric series. The anomaly flags are filled in by the trend analysis pass
 * that created the point; a point must not be shared between concurrent analyses.
 */
public class TrendDataPoint {

    private final Instant timestamp;
    private final double value;
    private final MetricType metricType;
    private boolean anomaly;
    private double anomalyScore;

    public TrendDataPoint(Instant timestamp, double value, MetricType metricType) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.value = value;
        this.metricType = Objects.requireNonNull(metricType, "metricType");
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public void setAnomaly(boolean anomaly) {
        this.anomaly = anomaly;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public void setAnomalyScore(double anomalyScore) {
        this.anomalyScore = anomalyScore;
    }

    @Override
    public String toString() {
        return "TrendDataPoint{" + metricType.value() + "@" + timestamp + "=" + value
                + (anomaly ? ", anomaly score " + anomalyScore : "") + "}";
    }
}
