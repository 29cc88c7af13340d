package com.searchnav.insights.repository;

import com.searchnav.insights.model.AuditResult;
import com.searchnav.insights.model.Recommendation;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to stored audit snapshots. Implementations signal backend failures with
 * {@link AuditFetchException}.
 */
public interface AuditRepository {

    Optional<AuditResult> findById(String auditId);

    List<AuditResult> findByCustomerIdAndRange(String customerId, Instant fromInclusive, Instant toInclusive);

    List<Recommendation> findRecommendationsByAuditId(String auditId);
}
