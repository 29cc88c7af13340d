package com.searchnav.insights.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.searchnav.insights.model.AnomalyAlert;
import com.searchnav.insights.model.ComparisonMetrics;
import com.searchnav.insights.model.ComparisonResult;
import com.searchnav.insights.model.MetricType;
import com.searchnav.insights.model.RecommendationsComparison;
import com.searchnav.insights.model.TrendAnalysis;
import com.searchnav.insights.model.TrendDataPoint;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Flattens analytics results into the JSON layout consumed by the reporting and export jobs.
 */
@Component
public class AnalyticsJsonExporter {

    private final ObjectMapper objectMapper;

    public AnalyticsJsonExporter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toTree(ComparisonResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("baseline_audit_id", result.baselineAuditId());
        root.put("comparison_audit_id", result.comparisonAuditId());
        root.put("baseline_date", result.baselineDate().toString());
        root.put("comparison_date", result.comparisonDate().toString());
        root.put("generated_at", result.generatedAt().toString());
        root.set("metrics", metricsNode(result.metrics()));
        root.set("insights", stringArray(result.insights()));
        root.set("warnings", stringArray(result.warnings()));
        if (!result.breakdownByCampaign().isEmpty()) {
            root.set("breakdown_by_campaign", breakdownNode(result.breakdownByCampaign()));
        }
        if (!result.breakdownByAdGroup().isEmpty()) {
            root.set("breakdown_by_ad_group", breakdownNode(result.breakdownByAdGroup()));
        }
        root.set("recommendations_comparison", result.recommendationsComparison()
                .map(this::recommendationsNode)
                .orElse(null));
        return root;
    }

    public ObjectNode toTree(Map<MetricType, TrendAnalysis> analyses) {
        ObjectNode root = objectMapper.createObjectNode();
        analyses.forEach((metricType, analysis) -> root.set(metricType.value(), trendNode(analysis)));
        return root;
    }

    public ArrayNode toTree(Collection<AnomalyAlert> alerts) {
        ArrayNode array = objectMapper.createArrayNode();
        for (AnomalyAlert alert : alerts) {
            ObjectNode node = array.addObject();
            node.put("metric_type", alert.metricType().value());
            node.put("timestamp", alert.timestamp().toString());
            node.put("expected_value", alert.expectedValue());
            node.put("actual_value", alert.actualValue());
            node.put("deviation_percentage", alert.deviationPercentage());
            node.put("severity", alert.severity().value());
            node.set("possible_causes", stringArray(alert.possibleCauses()));
            node.set("recommended_actions", stringArray(alert.recommendedActions()));
        }
        return array;
    }

    public String toJson(ComparisonResult result) {
        return write(toTree(result));
    }

    public String toJson(Map<MetricType, TrendAnalysis> analyses) {
        return write(toTree(analyses));
    }

    public String toJson(Collection<AnomalyAlert> alerts) {
        return write(toTree(alerts));
    }

    private ObjectNode metricsNode(ComparisonMetrics metrics) {
        ObjectNode node = objectMapper.createObjectNode();

        ObjectNode costEfficiency = node.putObject("cost_efficiency");
        costEfficiency.put("total_spend_change", metrics.totalSpendChange());
        costEfficiency.put("total_spend_change_pct", metrics.totalSpendChangePct());
        costEfficiency.put("wasted_spend_reduction", metrics.wastedSpendReduction());
        costEfficiency.put("wasted_spend_reduction_pct", metrics.wastedSpendReductionPct());
        costEfficiency.put("cost_per_conversion_change", metrics.costPerConversionChange());
        costEfficiency.put("cost_per_conversion_change_pct", metrics.costPerConversionChangePct());
        costEfficiency.put("roas_change", metrics.roasChange());
        costEfficiency.put("roas_change_pct", metrics.roasChangePct());

        ObjectNode performance = node.putObject("performance");
        performance.put("ctr_improvement", metrics.ctrImprovement());
        performance.put("ctr_improvement_pct", metrics.ctrImprovementPct());
        performance.put("conversion_rate_change", metrics.conversionRateChange());
        performance.put("conversion_rate_change_pct", metrics.conversionRateChangePct());
        performance.put("quality_score_trend", metrics.qualityScoreTrend());

        ObjectNode volume = node.putObject("volume");
        volume.put("impressions_change", metrics.impressionsChange());
        volume.put("impressions_change_pct", metrics.impressionsChangePct());
        volume.put("clicks_change", metrics.clicksChange());
        volume.put("clicks_change_pct", metrics.clicksChangePct());
        volume.put("conversions_change", metrics.conversionsChange());
        volume.put("conversions_change_pct", metrics.conversionsChangePct());

        ObjectNode optimization = node.putObject("optimization");
        optimization.put("recommendations_implemented", metrics.recommendationsImplemented());
        optimization.put("recommendations_pending", metrics.recommendationsPending());
        optimization.put("issues_resolved", metrics.issuesResolved());
        optimization.put("new_issues_found", metrics.newIssuesFound());
        optimization.put("keywords_analyzed_change", metrics.keywordsAnalyzedChange());
        optimization.put("negative_keywords_added", metrics.negativeKeywordsAdded());
        optimization.put("match_type_optimizations", metrics.matchTypeOptimizations());

        ObjectNode significance = node.putObject("statistical_significance");
        metrics.isStatisticallySignificant().forEach(significance::put);
        return node;
    }

    private ObjectNode breakdownNode(Map<String, ComparisonMetrics> breakdown) {
        ObjectNode node = objectMapper.createObjectNode();
        breakdown.forEach((entityId, metrics) -> node.set(entityId, metricsNode(metrics)));
        return node;
    }

    private ObjectNode recommendationsNode(RecommendationsComparison comparison) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("baseline_count", comparison.baselineCount());
        node.put("comparison_count", comparison.comparisonCount());
        node.set("new_recommendation_types", stringArray(comparison.newRecommendationTypes()));
        node.set("resolved_recommendation_types", stringArray(comparison.resolvedRecommendationTypes()));
        node.set("persistent_recommendation_types", stringArray(comparison.persistentRecommendationTypes()));
        return node;
    }

    private ObjectNode trendNode(TrendAnalysis analysis) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("customer_id", analysis.customerId());
        node.put("metric_type", analysis.metricType().value());
        node.put("start_date", analysis.startDate().toString());
        node.put("end_date", analysis.endDate().toString());
        node.put("granularity", analysis.granularity().value());
        node.put("trend_direction", analysis.trendDirection().value());
        node.put("trend_strength", analysis.trendStrength());
        node.put("seasonality_detected", analysis.seasonalityDetected());
        node.put("anomalies_detected", analysis.anomaliesDetected());
        ArrayNode points = node.putArray("data_points");
        for (TrendDataPoint point : analysis.dataPoints()) {
            ObjectNode pointNode = points.addObject();
            pointNode.put("timestamp", point.getTimestamp().toString());
            pointNode.put("value", point.getValue());
            pointNode.put("is_anomaly", point.isAnomaly());
            pointNode.put("anomaly_score", point.getAnomalyScore());
        }
        ArrayNode forecast = node.putArray("forecast");
        for (TrendDataPoint point : analysis.forecast()) {
            ObjectNode pointNode = forecast.addObject();
            pointNode.put("timestamp", point.getTimestamp().toString());
            pointNode.put("value", point.getValue());
        }
        node.set("insights", stringArray(analysis.insights()));
        return node;
    }

    private ArrayNode stringArray(List<String> values) {
        ArrayNode array = objectMapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    private String write(Object tree) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize analytics result", ex);
        }
    }
}
