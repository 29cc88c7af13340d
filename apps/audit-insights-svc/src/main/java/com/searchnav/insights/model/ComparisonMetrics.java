package com.searchnav.insights.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deltas between a baseline and a comparison audit. Percentages are in percent units; for
 * {@code wastedSpendReduction*} a positive number means less waste.
 */
public record ComparisonMetrics(
        double totalSpendChange,
        double totalSpendChangePct,
        double wastedSpendReduction,
        double wastedSpendReductionPct,
        double costPerConversionChange,
        double costPerConversionChangePct,
        double roasChange,
        double roasChangePct,
        double ctrImprovement,
        double ctrImprovementPct,
        double conversionRateChange,
        double conversionRateChangePct,
        double qualityScoreTrend,
        double impressionsChange,
        double impressionsChangePct,
        double clicksChange,
        double clicksChangePct,
        double conversionsChange,
        double conversionsChangePct,
        int recommendationsImplemented,
        int recommendationsPending,
        int issuesResolved,
        int newIssuesFound,
        double keywordsAnalyzedChange,
        int negativeKeywordsAdded,
        int matchTypeOptimizations,
        Map<String, Boolean> isStatisticallySignificant
) {
    public static final String CTR_SIGNIFICANCE = "ctr";
    public static final String CONVERSION_RATE_SIGNIFICANCE = "conversion_rate";

    public ComparisonMetrics {
        isStatisticallySignificant = isStatisticallySignificant == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(isStatisticallySignificant));
    }

    public boolean isSignificant(String metric) {
        return Boolean.TRUE.equals(isStatisticallySignificant.get(metric));
    }

    public ComparisonMetrics withSignificance(Map<String, Boolean> significance) {
        return new ComparisonMetrics(
                totalSpendChange,
                totalSpendChangePct,
                wastedSpendReduction,
                wastedSpendReductionPct,
                costPerConversionChange,
                costPerConversionChangePct,
                roasChange,
                roasChangePct,
                ctrImprovement,
                ctrImprovementPct,
                conversionRateChange,
                conversionRateChangePct,
                qualityScoreTrend,
                impressionsChange,
                impressionsChangePct,
                clicksChange,
                clicksChangePct,
                conversionsChange,
                conversionsChangePct,
                recommendationsImplemented,
                recommendationsPending,
                issuesResolved,
                newIssuesFound,
                keywordsAnalyzedChange,
                negativeKeywordsAdded,
                matchTypeOptimizations,
                significance
        );
    }
}
