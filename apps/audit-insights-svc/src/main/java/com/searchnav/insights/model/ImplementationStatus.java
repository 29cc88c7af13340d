package com.searchnav.insights.model;

public record ImplementationStatus(
        String recommendationId,
        String auditId,
        Status status,
        String notes
) {
    public enum Status {
        IMPLEMENTED,
        PENDING,
        UNKNOWN
    }
}
