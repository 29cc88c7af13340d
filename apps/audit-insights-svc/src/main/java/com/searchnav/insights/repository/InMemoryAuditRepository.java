package com.searchnav.insights.repository;

import com.searchnav.insights.model.AuditResult;
import com.searchnav.insights.model.Recommendation;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAuditRepository implements AuditRepository {

    private final Map<String, AuditResult> storage = new ConcurrentHashMap<>();
    private final Map<String, List<Recommendation>> recommendations = new ConcurrentHashMap<>();

    public AuditResult save(AuditResult audit) {
        storage.put(audit.id(), audit);
        return audit;
    }

    public Recommendation saveRecommendation(Recommendation recommendation) {
        Objects.requireNonNull(recommendation.auditId(), "auditId");
        recommendations.computeIfAbsent(recommendation.auditId(), key -> new CopyOnWriteArrayList<>())
                .add(recommendation);
        return recommendation;
    }

    @Override
    public Optional<AuditResult> findById(String auditId) {
        if (auditId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(storage.get(auditId));
    }

    @Override
    public List<AuditResult> findByCustomerIdAndRange(String customerId, Instant fromInclusive, Instant toInclusive) {
        return storage.values().stream()
                .filter(audit -> Objects.equals(audit.customerId(), customerId))
                .filter(audit -> !audit.createdAt().isBefore(fromInclusive) && !audit.createdAt().isAfter(toInclusive))
                .sorted(Comparator.comparing(AuditResult::createdAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<Recommendation> findRecommendationsByAuditId(String auditId) {
        return List.copyOf(recommendations.getOrDefault(auditId, List.of()));
    }
}
