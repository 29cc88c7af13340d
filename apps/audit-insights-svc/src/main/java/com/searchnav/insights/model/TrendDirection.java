package com.searchnav.insights.model;

public enum TrendDirection {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String value;

    TrendDirection(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
