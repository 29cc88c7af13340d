package com.searchnav.insights.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Point-in-time audit snapshot as supplied by the storage layer. {@code summary} holds a
 * {@code metrics} map of named numbers plus {@code total_issues}; {@code details} optionally holds
 * {@code campaigns} and {@code ad_groups} maps keyed by entity id.
 */
public record AuditResult(
        String id,
        String customerId,
        Instant createdAt,
        Map<String, Object> summary,
        Map<String, Object> details
) {
    public static final String METRICS_KEY = "metrics";
    public static final String CAMPAIGNS_KEY = "campaigns";
    public static final String AD_GROUPS_KEY = "ad_groups";

    public AuditResult {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        summary = summary == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(summary));
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, Object> metrics() {
        return nestedMap(summary, METRICS_KEY);
    }

    public Map<String, Object> campaigns() {
        return nestedMap(details, CAMPAIGNS_KEY);
    }

    public Map<String, Object> adGroups() {
        return nestedMap(details, AD_GROUPS_KEY);
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> nestedMap(Map<String, Object> source, String key) {
        Object value = source.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }
}
