package com.searchnav.insights.model;

import java.util.List;

public record RecommendationsComparison(
        int baselineCount,
        int comparisonCount,
        List<String> newRecommendationTypes,
        List<String> resolvedRecommendationTypes,
        List<String> persistentRecommendationTypes
) {
    public RecommendationsComparison {
        newRecommendationTypes = List.copyOf(newRecommendationTypes);
        resolvedRecommendationTypes = List.copyOf(resolvedRecommendationTypes);
        persistentRecommendationTypes = List.copyOf(persistentRecommendationTypes);
    }
}
