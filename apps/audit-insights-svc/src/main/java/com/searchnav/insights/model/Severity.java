package com.searchnav.insights.model;

public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
