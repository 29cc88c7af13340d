package com.searchnav.insights.model;

public enum TrendGranularity {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    QUARTERLY("quarterly");

    private final String value;

    TrendGranularity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
