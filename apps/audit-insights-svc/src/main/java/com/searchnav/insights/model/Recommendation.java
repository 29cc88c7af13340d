package com.searchnav.insights.model;

public record Recommendation(
        String id,
        String auditId,
        String type,
        String description
) {
}
