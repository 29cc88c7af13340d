package com.searchnav.insights.model;

public record ComparisonOptions(
        boolean includeStatisticalTests,
        double confidenceLevel,
        int minimumSampleSize,
        boolean breakdownByCampaign,
        boolean breakdownByAdGroup,
        boolean includeRecommendations
) {
    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95d;
    public static final int DEFAULT_MINIMUM_SAMPLE_SIZE = 30;

    public ComparisonOptions {
        if (!(confidenceLevel > 0d && confidenceLevel < 1d)) {
            throw new IllegalArgumentException("confidenceLevel must be between 0 and 1 (exclusive)");
        }
        if (minimumSampleSize <= 0) {
            throw new IllegalArgumentException("minimumSampleSize must be positive");
        }
    }

    public static ComparisonOptions defaults() {
        return new ComparisonOptions(true, DEFAULT_CONFIDENCE_LEVEL, DEFAULT_MINIMUM_SAMPLE_SIZE, false, false, true);
    }

    public double significanceLevel() {
        return 1d - confidenceLevel;
    }

    public ComparisonOptions withBreakdowns(boolean byCampaign, boolean byAdGroup) {
        return new ComparisonOptions(includeStatisticalTests, confidenceLevel, minimumSampleSize, byCampaign, byAdGroup, includeRecommendations);
    }

    public ComparisonOptions withStatisticalTests(boolean enabled) {
        return new ComparisonOptions(enabled, confidenceLevel, minimumSampleSize, breakdownByCampaign, breakdownByAdGroup, includeRecommendations);
    }
}
