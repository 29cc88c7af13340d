package com.searchnav.insights.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ComparisonResult(
        String baselineAuditId,
        String comparisonAuditId,
        Instant baselineDate,
        Instant comparisonDate,
        ComparisonMetrics metrics,
        List<String> insights,
        List<String> warnings,
        Map<String, ComparisonMetrics> breakdownByCampaign,
        Map<String, ComparisonMetrics> breakdownByAdGroup,
        Optional<RecommendationsComparison> recommendationsComparison,
        Instant generatedAt
) {
    public ComparisonResult {
        insights = List.copyOf(insights);
        warnings = List.copyOf(warnings);
        breakdownByCampaign = breakdownByCampaign == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdownByCampaign));
        breakdownByAdGroup = breakdownByAdGroup == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(breakdownByAdGroup));
        recommendationsComparison = recommendationsComparison == null ? Optional.empty() : recommendationsComparison;
    }
}
