package com.searchnav.insights.model;

import java.util.Arrays;
import java.util.Optional;

public enum MetricType {
    TOTAL_SPEND("total_spend", "total_spend", Tier.OTHER),
    WASTED_SPEND("wasted_spend", "wasted_spend", Tier.HIGH_SENSITIVITY),
    COST_PER_CONVERSION("cost_per_conversion", "cost_per_conversion", Tier.HIGH_SENSITIVITY),
    ROAS("roas", "roas", Tier.CRITICAL),
    CTR("ctr", "ctr", Tier.HIGH_SENSITIVITY),
    CONVERSION_RATE("conversion_rate", "conversion_rate", Tier.CRITICAL),
    QUALITY_SCORE("quality_score", "avg_quality_score", Tier.OTHER),
    IMPRESSIONS("impressions", "impressions", Tier.OTHER),
    CLICKS("clicks", "clicks", Tier.OTHER),
    CONVERSIONS("conversions", "conversions", Tier.CRITICAL),
    KEYWORDS_ANALYZED("keywords_analyzed", "keywords_analyzed", Tier.OTHER),
    ISSUES_COUNT("issues_count", "total_issues", Tier.OTHER);

    /**
     * Severity sensitivity of a metric. Each tier has its own threshold ladder.
     */
    public enum Tier {
        CRITICAL,
        HIGH_SENSITIVITY,
        OTHER
    }

    private final String value;
    private final String fieldName;
    private final Tier tier;

    MetricType(String value, String fieldName, Tier tier) {
        this.value = value;
        this.fieldName = fieldName;
        this.tier = tier;
    }

    public String value() {
        return value;
    }

    /**
     * Key of this metric inside {@code summary.metrics}, or inside {@code summary} itself for
     * {@link #ISSUES_COUNT}.
     */
    public String fieldName() {
        return fieldName;
    }

    public Tier tier() {
        return tier;
    }

    public boolean isSummaryLevel() {
        return this == ISSUES_COUNT;
    }

    public static Optional<MetricType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
