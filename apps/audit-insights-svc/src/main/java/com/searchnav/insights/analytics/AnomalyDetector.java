package com.searchnav.insights.analytics;

import com.searchnav.insights.config.InsightsProperties;
import com.searchnav.insights.model.AnomalyAlert;
import com.searchnav.insights.model.MetricType;
import com.searchnav.insights.model.Severity;
import com.searchnav.insights.model.TrendDataPoint;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    private final InsightsProperties.Anomaly settings;

    public AnomalyDetector(InsightsProperties properties) {
        this.settings = properties.anomaly();
    }

    /**
     * Checks {@code currentValue} against its history with the z-score, IQR and trend-residual
     * tests. Returns empty when the history is too short or no test fires.
     */
    public Optional<AnomalyAlert> detect(double currentValue, List<Double> historicalValues, MetricType metricType, Instant timestamp) {
        if (historicalValues == null || historicalValues.size() < settings.minHistoricalPoints()) {
            return Optional.empty();
        }
        double[] history = Statistics.toArray(historicalValues);
        List<DetectorResult> results = runDetectors(currentValue, history);
        if (!DetectorResult.anyTriggered(results)) {
            return Optional.empty();
        }

        double expectedValue = Statistics.mean(history);
        double deviationPct = deviationPercentage(currentValue, expectedValue);
        double zScore = DetectorResult.magnitudeOf(results, DetectorResult.Method.Z_SCORE);
        Severity severity = classifySeverity(deviationPct, zScore, metricType);
        log.debug("Anomaly in {} at {}: actual={} expected={} deviation={}% severity={} detectors={}",
                metricType.value(), timestamp, currentValue, expectedValue, deviationPct, severity, results);

        return Optional.of(new AnomalyAlert(
                metricType,
                timestamp,
                expectedValue,
                currentValue,
                deviationPct,
                severity,
                possibleCauses(metricType, deviationPct, timestamp),
                recommendedActions(metricType, deviationPct, severity)
        ));
    }

    /**
     * Slides a window over the series and checks each point against the points just before it.
     */
    public List<AnomalyAlert> detectPatternAnomalies(List<TrendDataPoint> dataPoints) {
        if (dataPoints == null || dataPoints.size() < settings.minHistoricalPoints()) {
            return List.of();
        }
        int windowSize = Math.min(settings.patternWindowSize(), dataPoints.size() / 2);
        List<Double> values = dataPoints.stream().map(TrendDataPoint::getValue).toList();
        List<AnomalyAlert> alerts = new ArrayList<>();
        for (int i = windowSize; i < dataPoints.size(); i++) {
            TrendDataPoint point = dataPoints.get(i);
            detect(point.getValue(), values.subList(i - windowSize, i), point.getMetricType(), point.getTimestamp())
                    .ifPresent(alerts::add);
        }
        return alerts;
    }

    List<DetectorResult> runDetectors(double currentValue, double[] history) {
        return List.of(
                DetectionMethods.zScore(currentValue, history, settings.zScoreThreshold()),
                DetectionMethods.iqr(currentValue, history, settings.iqrMultiplier()),
                DetectionMethods.trendResidual(currentValue, history, settings.trendResidualThreshold(), settings.residualFloorFraction())
        );
    }

    static double deviationPercentage(double actual, double expected) {
        if (expected == 0d) {
            return actual == 0d ? 0d : 100d;
        }
        return (actual - expected) / expected * 100d;
    }

    /**
     * Walks the metric's tier ladder from critical down; the first level whose deviation or
     * z-score bound is exceeded wins.
     */
    public Severity classifySeverity(double deviationPct, double zScore, MetricType metricType) {
        InsightsProperties.SeverityLadder ladder = settings.ladderFor(metricType);
        double deviation = Math.abs(deviationPct);
        if (deviation > ladder.criticalDeviationPct() || zScore > ladder.criticalZScore()) {
            return Severity.CRITICAL;
        }
        if (deviation > ladder.highDeviationPct() || zScore > ladder.highZScore()) {
            return Severity.HIGH;
        }
        if (deviation > ladder.mediumDeviationPct() || zScore > ladder.mediumZScore()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    List<String> possibleCauses(MetricType metricType, double deviationPct, Instant timestamp) {
        List<String> causes = new ArrayList<>();
        ZonedDateTime at = timestamp.atZone(ZoneOffset.UTC);
        if (at.getDayOfWeek() == DayOfWeek.SATURDAY || at.getDayOfWeek() == DayOfWeek.SUNDAY) {
            causes.add("Weekend traffic patterns may differ from weekdays");
        }
        if (at.getDayOfMonth() <= 3 || at.getDayOfMonth() >= 28) {
            causes.add("Beginning or end of month budget changes");
        }

        switch (metricType) {
            case CTR -> causes.addAll(deviationPct < 0
                    ? List.of(
                            "Ad fatigue - audiences may have seen ads too frequently",
                            "Increased competition affecting ad positions",
                            "Seasonal relevance changes")
                    : List.of(
                            "Improved ad copy or creative",
                            "Better keyword-ad relevance",
                            "Competitor absence"));
            case COST_PER_CONVERSION -> causes.addAll(deviationPct > 0
                    ? List.of(
                            "Increased auction competition",
                            "Landing page performance issues",
                            "Targeting too broad audiences")
                    : List.of(
                            "Improved Quality Scores",
                            "Better conversion rate optimization",
                            "More efficient bidding"));
            case CONVERSIONS -> causes.addAll(deviationPct < 0
                    ? List.of(
                            "Website technical issues or downtime",
                            "Tracking problems or tag errors",
                            "External factors (weather, events, news)",
                            "Inventory or service availability issues")
                    : List.of(
                            "Successful promotions or sales",
                            "Improved user experience",
                            "Seasonal demand increase",
                            "Effective remarketing campaigns"));
            case WASTED_SPEND -> {
                if (deviationPct > 0) {
                    causes.addAll(List.of(
                            "New irrelevant search terms triggering ads",
                            "Broad match keywords too aggressive",
                            "Competitor brand bidding",
                            "Click fraud or invalid traffic"));
                }
            }
            default -> {
            }
        }

        causes.add("Recent campaign or bidding strategy changes");
        causes.add("Market conditions or competitor activity");
        return causes;
    }

    List<String> recommendedActions(MetricType metricType, double deviationPct, Severity severity) {
        List<String> actions = new ArrayList<>();
        if (severity.isAtLeast(Severity.HIGH)) {
            actions.add("Investigate immediately - check account for recent changes");
            actions.add("Review campaign performance reports for affected period");
        }

        if (metricType == MetricType.CTR && deviationPct < 0) {
            actions.addAll(List.of(
                    "Review search term reports for irrelevant queries",
                    "Check ad positions and impression share",
                    "Refresh ad copy and test new variations",
                    "Review keyword Quality Scores"));
        } else if (metricType == MetricType.COST_PER_CONVERSION && deviationPct > 0) {
            actions.addAll(List.of(
                    "Analyze auction insights for increased competition",
                    "Review and optimize landing page performance",
                    "Adjust bidding strategy or bid limits",
                    "Tighten audience targeting"));
        } else if (metricType == MetricType.CONVERSIONS && deviationPct < 0) {
            actions.addAll(List.of(
                    "Verify conversion tracking is working correctly",
                    "Check website analytics for technical issues",
                    "Review landing page load times and functionality",
                    "Confirm inventory/service availability"));
        } else if (metricType == MetricType.WASTED_SPEND && deviationPct > 0) {
            actions.addAll(List.of(
                    "Add negative keywords from search term report",
                    "Review and refine match types",
                    "Implement dayparting if waste occurs at specific times",
                    "Consider geographic bid adjustments"));
        }

        if (severity.isAtLeast(Severity.MEDIUM)) {
            actions.add("Set up automated alerts for this metric");
            actions.add("Document findings and actions taken");
        }
        return actions;
    }
}
