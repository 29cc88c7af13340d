package com.searchnav.insights.config;

import com.searchnav.insights.model.ComparisonOptions;
import com.searchnav.insights.model.MetricType;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "insights")
public record InsightsProperties(
        Anomaly anomaly,
        Trend trend,
        Comparison comparison
) {

    @ConstructorBinding
    public InsightsProperties {
        // every section is optional; absent sections fall back to the built-in thresholds
        anomaly = anomaly != null ? anomaly : Anomaly.defaults();
        trend = trend != null ? trend : Trend.defaults();
        comparison = comparison != null ? comparison : Comparison.defaults();
    }

    public static InsightsProperties defaults() {
        return new InsightsProperties(null, null, null);
    }

    /**
     * Ordered thresholds for one severity tier. A level is reached when either the absolute
     * deviation percentage or the z-score exceeds its bound.
     */
    public record SeverityLadder(
            Double criticalDeviationPct,
            Double criticalZScore,
            Double highDeviationPct,
            Double highZScore,
            Double mediumDeviationPct,
            Double mediumZScore
    ) {
        public SeverityLadder {
            if (criticalDeviationPct == null || criticalZScore == null
                    || highDeviationPct == null || highZScore == null
                    || mediumDeviationPct == null || mediumZScore == null) {
                throw new IllegalArgumentException("every severity threshold must be provided");
            }
            if (criticalDeviationPct < highDeviationPct || highDeviationPct < mediumDeviationPct) {
                throw new IllegalArgumentException("deviation thresholds must descend from critical to medium");
            }
            if (criticalZScore < highZScore || highZScore < mediumZScore) {
                throw new IllegalArgumentException("z-score thresholds must descend from critical to medium");
            }
        }
    }

    public record Anomaly(
            Double zScoreThreshold,
            Double iqrMultiplier,
            Integer minHistoricalPoints,
            Double trendResidualThreshold,
            Double residualFloorFraction,
            Integer patternWindowSize,
            SeverityLadder criticalTier,
            SeverityLadder highSensitivityTier,
            SeverityLadder otherTier
    ) {
        public Anomaly {
            zScoreThreshold = zScoreThreshold != null ? zScoreThreshold : 2.5d;
            iqrMultiplier = iqrMultiplier != null ? iqrMultiplier : 1.5d;
            minHistoricalPoints = minHistoricalPoints != null ? minHistoricalPoints : 5;
            trendResidualThreshold = trendResidualThreshold != null ? trendResidualThreshold : 2.0d;
            residualFloorFraction = residualFloorFraction != null ? residualFloorFraction : 0.05d;
            patternWindowSize = patternWindowSize != null ? patternWindowSize : 7;
            criticalTier = criticalTier != null ? criticalTier : new SeverityLadder(50d, 4d, 30d, 3d, 20d, 2.5d);
            highSensitivityTier = highSensitivityTier != null ? highSensitivityTier : new SeverityLadder(75d, 4.5d, 50d, 3.5d, 30d, 2.5d);
            otherTier = otherTier != null ? otherTier : new SeverityLadder(100d, 5d, 75d, 4d, 50d, 3d);
            if (zScoreThreshold <= 0) {
                throw new IllegalArgumentException("zScoreThreshold must be positive");
            }
            if (iqrMultiplier <= 0) {
                throw new IllegalArgumentException("iqrMultiplier must be positive");
            }
            if (minHistoricalPoints <= 0) {
                throw new IllegalArgumentException("minHistoricalPoints must be positive");
            }
            if (trendResidualThreshold <= 0) {
                throw new IllegalArgumentException("trendResidualThreshold must be positive");
            }
            if (residualFloorFraction < 0) {
                throw new IllegalArgumentException("residualFloorFraction must not be negative");
            }
            if (patternWindowSize <= 0) {
                throw new IllegalArgumentException("patternWindowSize must be positive");
            }
        }

        public static Anomaly defaults() {
            return new Anomaly(null, null, null, null, null, null, null, null, null);
        }

        public SeverityLadder ladderFor(MetricType metricType) {
            return switch (metricType.tier()) {
                case CRITICAL -> criticalTier;
                case HIGH_SENSITIVITY -> highSensitivityTier;
                case OTHER -> otherTier;
            };
        }
    }

    public record Trend(
            Double stableSlopeThreshold,
            Double zScoreThreshold,
            Integer seasonalityMinPoints,
            Double seasonalityThreshold,
            List<Integer> seasonalLags,
            Integer minForecastPoints,
            Double forecastInsightThresholdPct,
            Integer maxAnomalyDatesInInsight
    ) {
        public Trend {
            stableSlopeThreshold = stableSlopeThreshold != null ? stableSlopeThreshold : 0.01d;
            zScoreThreshold = zScoreThreshold != null ? zScoreThreshold : 2.5d;
            seasonalityMinPoints = seasonalityMinPoints != null ? seasonalityMinPoints : 12;
            seasonalityThreshold = seasonalityThreshold != null ? seasonalityThreshold : 0.3d;
            seasonalLags = seasonalLags != null && !seasonalLags.isEmpty() ? List.copyOf(seasonalLags) : List.of(3, 4, 12);
            minForecastPoints = minForecastPoints != null ? minForecastPoints : 3;
            forecastInsightThresholdPct = forecastInsightThresholdPct != null ? forecastInsightThresholdPct : 5d;
            maxAnomalyDatesInInsight = maxAnomalyDatesInInsight != null ? maxAnomalyDatesInInsight : 3;
            if (stableSlopeThreshold < 0) {
                throw new IllegalArgumentException("stableSlopeThreshold must not be negative");
            }
            if (zScoreThreshold <= 0) {
                throw new IllegalArgumentException("zScoreThreshold must be positive");
            }
            if (seasonalLags.stream().anyMatch(lag -> lag == null || lag <= 0)) {
                throw new IllegalArgumentException("seasonalLags must be positive");
            }
            if (minForecastPoints < 2) {
                throw new IllegalArgumentException("minForecastPoints must be at least 2");
            }
        }

        public static Trend defaults() {
            return new Trend(null, null, null, null, null, null, null, null);
        }
    }

    public record Comparison(
            Boolean includeStatisticalTests,
            Double confidenceLevel,
            Integer minimumSampleSize,
            Boolean breakdownByCampaign,
            Boolean breakdownByAdGroup,
            Boolean includeRecommendations
    ) {
        public Comparison {
            if (confidenceLevel != null && !(confidenceLevel > 0d && confidenceLevel < 1d)) {
                throw new IllegalArgumentException("confidenceLevel must be between 0 and 1 (exclusive)");
            }
            if (minimumSampleSize != null && minimumSampleSize <= 0) {
                throw new IllegalArgumentException("minimumSampleSize must be positive");
            }
        }

        public static Comparison defaults() {
            return new Comparison(null, null, null, null, null, null);
        }

        public ComparisonOptions defaultOptions() {
            ComparisonOptions fallback = ComparisonOptions.defaults();
            return new ComparisonOptions(
                    includeStatisticalTests != null ? includeStatisticalTests : fallback.includeStatisticalTests(),
                    confidenceLevel != null ? confidenceLevel : fallback.confidenceLevel(),
                    minimumSampleSize != null ? minimumSampleSize : fallback.minimumSampleSize(),
                    breakdownByCampaign != null ? breakdownByCampaign : fallback.breakdownByCampaign(),
                    breakdownByAdGroup != null ? breakdownByAdGroup : fallback.breakdownByAdGroup(),
                    includeRecommendations != null ? includeRecommendations : fallback.includeRecommendations()
            );
        }
    }
}
