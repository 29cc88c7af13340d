package com.searchnav.insights.analytics;

import com.searchnav.insights.config.InsightsProperties;
import com.searchnav.insights.model.AuditResult;
import com.searchnav.insights.model.ComparisonMetrics;
import com.searchnav.insights.model.ComparisonOptions;
import com.searchnav.insights.model.ComparisonResult;
import com.searchnav.insights.model.ImplementationStatus;
import com.searchnav.insights.model.MetricType;
import com.searchnav.insights.model.Recommendation;
import com.searchnav.insights.model.RecommendationsComparison;
import com.searchnav.insights.repository.AuditFetchException;
import com.searchnav.insights.repository.AuditRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuditComparator {

    private static final Logger log = LoggerFactory.getLogger(AuditComparator.class);

    static final String IMPLEMENTED_IDS_KEY = "implemented_recommendation_ids";

    private final AuditRepository auditRepository;
    private final InsightsProperties.Comparison settings;

    public AuditComparator(AuditRepository auditRepository, InsightsProperties properties) {
        this.auditRepository = auditRepository;
        this.settings = properties.comparison();
    }

    public ComparisonResult compare(String baselineAuditId, String comparisonAuditId) {
        return compare(baselineAuditId, comparisonAuditId, settings.defaultOptions());
    }

    /**
     * Diffs two audits. Both must exist; a missing or unfetchable audit raises
     * {@link AuditNotFoundException}.
     */
    public ComparisonResult compare(String baselineAuditId, String comparisonAuditId, ComparisonOptions options) {
        ComparisonOptions effective = options != null ? options : settings.defaultOptions();
        AuditResult baseline = fetchAudit(baselineAuditId);
        AuditResult comparison = fetchAudit(comparisonAuditId);

        ComparisonMetrics metrics = calculateMetrics(
                baseline.metrics(),
                comparison.metrics(),
                AuditMetrics.valueOrZero(baseline, MetricType.ISSUES_COUNT),
                AuditMetrics.valueOrZero(comparison, MetricType.ISSUES_COUNT));
        if (effective.includeStatisticalTests()) {
            metrics = metrics.withSignificance(testSignificance(baseline.metrics(), comparison.metrics(), effective));
        }

        Map<String, ComparisonMetrics> byCampaign = effective.breakdownByCampaign()
                ? breakdown("Campaign", baseline.campaigns(), comparison.campaigns())
                : Map.of();
        Map<String, ComparisonMetrics> byAdGroup = effective.breakdownByAdGroup()
                ? breakdown("Ad group", baseline.adGroups(), comparison.adGroups())
                : Map.of();
        Optional<RecommendationsComparison> recommendations = effective.includeRecommendations()
                ? Optional.of(compareRecommendations(baselineAuditId, comparisonAuditId))
                : Optional.empty();

        log.debug("Compared audits {} -> {}: spend {}%, wasted spend reduction {}%",
                baselineAuditId, comparisonAuditId, metrics.totalSpendChangePct(), metrics.wastedSpendReductionPct());

        return new ComparisonResult(
                baselineAuditId,
                comparisonAuditId,
                baseline.createdAt(),
                comparison.createdAt(),
                metrics,
                generateInsights(metrics),
                generateWarnings(metrics),
                byCampaign,
                byAdGroup,
                recommendations,
                Instant.now()
        );
    }

    private AuditResult fetchAudit(String auditId) {
        if (auditId == null || auditId.isBlank()) {
            throw new IllegalArgumentException("audit id must be provided");
        }
        try {
            return auditRepository.findById(auditId)
                    .orElseThrow(() -> new AuditNotFoundException(auditId));
        } catch (AuditFetchException ex) {
            log.warn("Comparison: failed to fetch audit {}", auditId, ex);
            throw new AuditNotFoundException(auditId, ex);
        }
    }

    ComparisonMetrics calculateMetrics(Map<String, Object> baseline, Map<String, Object> comparison, double baselineIssues, double comparisonIssues) {
        double baselineSpend = AuditMetrics.valueOrZero(baseline, MetricType.TOTAL_SPEND);
        double comparisonSpend = AuditMetrics.valueOrZero(comparison, MetricType.TOTAL_SPEND);
        double baselineWasted = AuditMetrics.valueOrZero(baseline, MetricType.WASTED_SPEND);
        double comparisonWasted = AuditMetrics.valueOrZero(comparison, MetricType.WASTED_SPEND);
        double baselineCpc = AuditMetrics.valueOrZero(baseline, MetricType.COST_PER_CONVERSION);
        double comparisonCpc = AuditMetrics.valueOrZero(comparison, MetricType.COST_PER_CONVERSION);
        double baselineRoas = AuditMetrics.valueOrZero(baseline, MetricType.ROAS);
        double comparisonRoas = AuditMetrics.valueOrZero(comparison, MetricType.ROAS);
        double baselineCtr = AuditMetrics.valueOrZero(baseline, MetricType.CTR);
        double comparisonCtr = AuditMetrics.valueOrZero(comparison, MetricType.CTR);
        double baselineCvr = AuditMetrics.valueOrZero(baseline, MetricType.CONVERSION_RATE);
        double comparisonCvr = AuditMetrics.valueOrZero(comparison, MetricType.CONVERSION_RATE);
        double baselineImpressions = AuditMetrics.valueOrZero(baseline, MetricType.IMPRESSIONS);
        double comparisonImpressions = AuditMetrics.valueOrZero(comparison, MetricType.IMPRESSIONS);
        double baselineClicks = AuditMetrics.valueOrZero(baseline, MetricType.CLICKS);
        double comparisonClicks = AuditMetrics.valueOrZero(comparison, MetricType.CLICKS);
        double baselineConversions = AuditMetrics.valueOrZero(baseline, MetricType.CONVERSIONS);
        double comparisonConversions = AuditMetrics.valueOrZero(comparison, MetricType.CONVERSIONS);

        int issuesResolved = (int) Math.round(Math.max(0d, baselineIssues - comparisonIssues));
        int newIssues = (int) Math.round(Math.max(0d, comparisonIssues - baselineIssues));

        return new ComparisonMetrics(
                comparisonSpend - baselineSpend,
                Statistics.percentageChange(baselineSpend, comparisonSpend),
                baselineWasted - comparisonWasted,
                Statistics.percentageChange(baselineWasted, comparisonWasted, true),
                comparisonCpc - baselineCpc,
                Statistics.percentageChange(baselineCpc, comparisonCpc),
                comparisonRoas - baselineRoas,
                Statistics.percentageChange(baselineRoas, comparisonRoas),
                comparisonCtr - baselineCtr,
                Statistics.percentageChange(baselineCtr, comparisonCtr),
                comparisonCvr - baselineCvr,
                Statistics.percentageChange(baselineCvr, comparisonCvr),
                AuditMetrics.valueOrZero(comparison, MetricType.QUALITY_SCORE) - AuditMetrics.valueOrZero(baseline, MetricType.QUALITY_SCORE),
                comparisonImpressions - baselineImpressions,
                Statistics.percentageChange(baselineImpressions, comparisonImpressions),
                comparisonClicks - baselineClicks,
                Statistics.percentageChange(baselineClicks, comparisonClicks),
                comparisonConversions - baselineConversions,
                Statistics.percentageChange(baselineConversions, comparisonConversions),
                0,
                0,
                issuesResolved,
                newIssues,
                AuditMetrics.valueOrZero(comparison, MetricType.KEYWORDS_ANALYZED) - AuditMetrics.valueOrZero(baseline, MetricType.KEYWORDS_ANALYZED),
                0,
                0,
                Map.of()
        );
    }

    /**
     * Chi-square tests on CTR (clicks out of impressions) and conversion rate (conversions out of
     * clicks). A rate is only tested when both sides reach the minimum sample size.
     */
    Map<String, Boolean> testSignificance(Map<String, Object> baseline, Map<String, Object> comparison, ComparisonOptions options) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        double baselineImpressions = AuditMetrics.valueOrZero(baseline, MetricType.IMPRESSIONS);
        double comparisonImpressions = AuditMetrics.valueOrZero(comparison, MetricType.IMPRESSIONS);
        double baselineClicks = AuditMetrics.valueOrZero(baseline, MetricType.CLICKS);
        double comparisonClicks = AuditMetrics.valueOrZero(comparison, MetricType.CLICKS);
        double baselineConversions = AuditMetrics.valueOrZero(baseline, MetricType.CONVERSIONS);
        double comparisonConversions = AuditMetrics.valueOrZero(comparison, MetricType.CONVERSIONS);

        if (baselineImpressions >= options.minimumSampleSize() && comparisonImpressions >= options.minimumSampleSize()) {
            results.put(ComparisonMetrics.CTR_SIGNIFICANCE, isSignificant(
                    ChiSquareTest.pValue(baselineClicks, baselineImpressions, comparisonClicks, comparisonImpressions).orElse(1d),
                    options));
        }
        if (baselineClicks >= options.minimumSampleSize() && comparisonClicks >= options.minimumSampleSize()) {
            results.put(ComparisonMetrics.CONVERSION_RATE_SIGNIFICANCE, isSignificant(
                    ChiSquareTest.pValue(baselineConversions, baselineClicks, comparisonConversions, comparisonClicks).orElse(1d),
                    options));
        }
        return results;
    }

    private static boolean isSignificant(double pValue, ComparisonOptions options) {
        return pValue < options.significanceLevel();
    }

    List<String> generateInsights(ComparisonMetrics metrics) {
        List<String> insights = new ArrayList<>();
        if (metrics.wastedSpendReductionPct() > 10) {
            insights.add(String.format(Locale.US, "Excellent progress! Wasted spend reduced by %.1f%%, saving $%,.2f",
                    metrics.wastedSpendReductionPct(), metrics.wastedSpendReduction()));
        }
        if (metrics.roasChangePct() > 5) {
            insights.add(String.format(Locale.US, "ROAS improved by %.1f%%, indicating better return on ad spend",
                    metrics.roasChangePct()));
        }
        if (metrics.ctrImprovementPct() > 5) {
            insights.add(String.format(Locale.US, "CTR improved by %.1f%%, suggesting more relevant ads/keywords",
                    metrics.ctrImprovementPct()));
        }
        if (metrics.conversionRateChangePct() > 5) {
            insights.add(String.format(Locale.US, "Conversion rate increased by %.1f%%, resulting in %s more conversions",
                    metrics.conversionRateChangePct(), formatCount(metrics.conversionsChange())));
        }
        if (metrics.qualityScoreTrend() > 0.5) {
            insights.add(String.format(Locale.US, "Quality scores improved by %.1f points on average",
                    metrics.qualityScoreTrend()));
        }
        if (metrics.issuesResolved() > 0) {
            insights.add(metrics.issuesResolved() + " issues were resolved since the last audit");
        }
        if (metrics.newIssuesFound() > 0) {
            insights.add(metrics.newIssuesFound() + " new issues detected that require attention");
        }
        if (metrics.isSignificant(ComparisonMetrics.CTR_SIGNIFICANCE)) {
            insights.add(metrics.ctrImprovement() >= 0
                    ? "CTR improvement is statistically significant"
                    : "CTR decline is statistically significant");
        }
        if (metrics.isSignificant(ComparisonMetrics.CONVERSION_RATE_SIGNIFICANCE)) {
            insights.add(metrics.conversionRateChange() >= 0
                    ? "Conversion rate improvement is statistically significant"
                    : "Conversion rate decline is statistically significant");
        }
        return insights;
    }

    List<String> generateWarnings(ComparisonMetrics metrics) {
        List<String> warnings = new ArrayList<>();
        if (metrics.ctrImprovementPct() < -5) {
            warnings.add(String.format(Locale.US, "CTR decreased by %.1f%% - investigate ad relevance",
                    Math.abs(metrics.ctrImprovementPct())));
        }
        if (metrics.conversionRateChangePct() < -5) {
            warnings.add(String.format(Locale.US, "Conversion rate dropped by %.1f%% - check landing pages and user experience",
                    Math.abs(metrics.conversionRateChangePct())));
        }
        if (metrics.costPerConversionChangePct() > 10) {
            warnings.add(String.format(Locale.US, "Cost per conversion increased by %.1f%% - review bidding strategy",
                    metrics.costPerConversionChangePct()));
        }
        if (metrics.totalSpendChangePct() > 20 && metrics.conversionsChangePct() < 10) {
            warnings.add("Spend increased significantly without proportional conversion growth");
        }
        if (metrics.qualityScoreTrend() < -0.5) {
            warnings.add(String.format(Locale.US, "Quality scores declined by %.1f points - may lead to higher costs",
                    Math.abs(metrics.qualityScoreTrend())));
        }
        if (metrics.newIssuesFound() > metrics.issuesResolved()) {
            warnings.add("More new issues found (" + metrics.newIssuesFound() + ") than resolved (" + metrics.issuesResolved() + ")");
        }
        return warnings;
    }

    /**
     * Per-entity deltas from the nested {@code details} maps. Both audits must carry the level;
     * otherwise the breakdown is empty.
     */
    Map<String, ComparisonMetrics> breakdown(String level, Map<String, Object> baselineEntities, Map<String, Object> comparisonEntities) {
        if (baselineEntities.isEmpty() || comparisonEntities.isEmpty()) {
            log.warn("{}-level data not available in audit results; {} breakdown will be empty", level, level.toLowerCase(Locale.ROOT));
            return Map.of();
        }
        Set<String> entityIds = new TreeSet<>(baselineEntities.keySet());
        entityIds.addAll(comparisonEntities.keySet());

        Map<String, ComparisonMetrics> breakdown = new LinkedHashMap<>();
        for (String entityId : entityIds) {
            Map<String, Object> baselineData = entityMetrics(baselineEntities.get(entityId));
            Map<String, Object> comparisonData = entityMetrics(comparisonEntities.get(entityId));
            if (baselineData.isEmpty() && comparisonData.isEmpty()) {
                continue;
            }
            breakdown.put(entityId, calculateMetrics(
                    baselineData,
                    comparisonData,
                    AuditMetrics.valueOrZero(baselineData, MetricType.ISSUES_COUNT),
                    AuditMetrics.valueOrZero(comparisonData, MetricType.ISSUES_COUNT)));
        }
        return breakdown;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> entityMetrics(Object entity) {
        if (!(entity instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Object nested = map.get(AuditResult.METRICS_KEY);
        if (nested instanceof Map<?, ?> nestedMap) {
            Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) nestedMap);
            Object issues = map.get(MetricType.ISSUES_COUNT.fieldName());
            if (issues != null) {
                merged.putIfAbsent(MetricType.ISSUES_COUNT.fieldName(), issues);
            }
            return merged;
        }
        return (Map<String, Object>) map;
    }

    RecommendationsComparison compareRecommendations(String baselineAuditId, String comparisonAuditId) {
        List<Recommendation> baselineRecs = fetchRecommendations(baselineAuditId);
        List<Recommendation> comparisonRecs = fetchRecommendations(comparisonAuditId);
        if (baselineRecs.isEmpty() && comparisonRecs.isEmpty()) {
            log.warn("No recommendations recorded for audits {} and {}; recommendation comparison is empty", baselineAuditId, comparisonAuditId);
        }
        Set<String> baselineTypes = typesOf(baselineRecs);
        Set<String> comparisonTypes = typesOf(comparisonRecs);

        Set<String> added = new TreeSet<>(comparisonTypes);
        added.removeAll(baselineTypes);
        Set<String> resolved = new TreeSet<>(baselineTypes);
        resolved.removeAll(comparisonTypes);
        Set<String> persistent = new TreeSet<>(baselineTypes);
        persistent.retainAll(comparisonTypes);

        return new RecommendationsComparison(
                baselineRecs.size(),
                comparisonRecs.size(),
                List.copyOf(added),
                List.copyOf(resolved),
                List.copyOf(persistent));
    }

    private List<Recommendation> fetchRecommendations(String auditId) {
        try {
            List<Recommendation> recommendations = auditRepository.findRecommendationsByAuditId(auditId);
            return recommendations == null ? List.of() : recommendations;
        } catch (AuditFetchException ex) {
            log.warn("Comparison: failed to fetch recommendations for audit {}", auditId, ex);
            return List.of();
        }
    }

    private static Set<String> typesOf(List<Recommendation> recommendations) {
        return recommendations.stream()
                .map(Recommendation::type)
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Reports, per recommendation, whether the account state confirms it was applied. Without any
     * account state the status is UNKNOWN rather than a guess.
     */
    public List<ImplementationStatus> trackImplementation(List<Recommendation> recommendations, Map<String, Object> accountState) {
        if (recommendations == null || recommendations.isEmpty()) {
            return List.of();
        }
        if (accountState == null || accountState.isEmpty()) {
            log.warn("No account state provided; implementation status of {} recommendations cannot be verified", recommendations.size());
            return recommendations.stream()
                    .map(rec -> new ImplementationStatus(rec.id(), rec.auditId(), ImplementationStatus.Status.UNKNOWN,
                            "Account state data not available for verification"))
                    .toList();
        }
        Set<String> implementedIds = implementedIds(accountState.get(IMPLEMENTED_IDS_KEY));
        return recommendations.stream()
                .map(rec -> implementedIds.contains(rec.id())
                        ? new ImplementationStatus(rec.id(), rec.auditId(), ImplementationStatus.Status.IMPLEMENTED,
                                "Confirmed by current account state")
                        : new ImplementationStatus(rec.id(), rec.auditId(), ImplementationStatus.Status.PENDING,
                                "Not yet reflected in current account state"))
                .toList();
    }

    private static Set<String> implementedIds(Object value) {
        if (value instanceof Collection<?> ids) {
            return ids.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .collect(Collectors.toSet());
        }
        return Set.of();
    }

    static String formatCount(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return String.format(Locale.US, "%.1f", value);
    }
}
