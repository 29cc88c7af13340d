package com.searchnav.insights.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.searchnav.insights.model.AuditResult;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InMemoryAuditRepositoryTest {

    private final InMemoryAuditRepository repository = new InMemoryAuditRepository();

    @Test
    void rangeQueryIsInclusiveAndSortedByCreation() {
        repository.save(audit("late", "cust-1", "2024-03-31T23:59:59Z"));
        repository.save(audit("early", "cust-1", "2024-03-01T00:00:00Z"));
        repository.save(audit("outside", "cust-1", "2024-04-01T00:00:00Z"));
        repository.save(audit("other", "cust-2", "2024-03-15T00:00:00Z"));

        var audits = repository.findByCustomerIdAndRange("cust-1",
                Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-31T23:59:59Z"));

        assertThat(audits).extracting(AuditResult::id).containsExactly("early", "late");
    }

    @Test
    void unknownIdsAreEmpty() {
        assertThat(repository.findById(null)).isEmpty();
        assertThat(repository.findById("missing")).isEmpty();
        assertThat(repository.findRecommendationsByAuditId("missing")).isEmpty();
    }

    private static AuditResult audit(String id, String customerId, String createdAt) {
        return new AuditResult(id, customerId, Instant.parse(createdAt), Map.of("metrics", Map.of("clicks", 1)), null);
    }
}
