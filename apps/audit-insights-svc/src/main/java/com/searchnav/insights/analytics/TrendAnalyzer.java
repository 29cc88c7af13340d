package com.searchnav.insights.analytics;

import com.searchnav.insights.config.InsightsProperties;
import com.searchnav.insights.model.AuditResult;
import com.searchnav.insights.model.MetricType;
import com.searchnav.insights.model.TrendAnalysis;
import com.searchnav.insights.model.TrendDataPoint;
import com.searchnav.insights.model.TrendDirection;
import com.searchnav.insights.model.TrendGranularity;
import com.searchnav.insights.model.TrendRequest;
import com.searchnav.insights.repository.AuditFetchException;
import com.searchnav.insights.repository.AuditRepository;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class TrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);
    private static final DateTimeFormatter INSIGHT_DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final AuditRepository auditRepository;
    private final InsightsProperties.Trend settings;

    public TrendAnalyzer(AuditRepository auditRepository, InsightsProperties properties) {
        this.auditRepository = auditRepository;
        this.settings = properties.trend();
    }

    public Map<MetricType, TrendAnalysis> analyze(
            String customerId,
            List<MetricType> metricTypes,
            Instant startDate,
            Instant endDate,
            TrendGranularity granularity,
            boolean includeForecast,
            int forecastPeriods
    ) {
        return analyze(new TrendRequest(customerId, metricTypes, startDate, endDate, granularity, includeForecast, forecastPeriods));
    }

    public Map<MetricType, TrendAnalysis> analyze(TrendRequest request) {
        List<AuditResult> audits = fetchAudits(request);
        if (audits.isEmpty()) {
            log.warn("No audits found for customer {} between {} and {}", request.customerId(), request.startDate(), request.endDate());
            return Map.of();
        }

        SortedMap<String, List<AuditResult>> periods = groupByPeriod(audits, request.granularity());
        Map<MetricType, TrendAnalysis> results = new LinkedHashMap<>();
        for (MetricType metricType : request.metricTypes()) {
            results.put(metricType, analyzeMetric(request, metricType, periods));
        }
        log.debug("Trend analysis for customer {}: {} audits in {} {} periods, {} metrics",
                request.customerId(), audits.size(), periods.size(), request.granularity().value(), results.size());
        return results;
    }

    private List<AuditResult> fetchAudits(TrendRequest request) {
        try {
            List<AuditResult> audits = auditRepository.findByCustomerIdAndRange(request.customerId(), request.startDate(), request.endDate());
            return audits == null ? List.of() : audits;
        } catch (AuditFetchException ex) {
            log.warn("Trend analysis: failed to fetch audits for customer {}, treating range as empty", request.customerId(), ex);
            return List.of();
        }
    }

    TrendAnalysis analyzeMetric(TrendRequest request, MetricType metricType, SortedMap<String, List<AuditResult>> periods) {
        List<TrendDataPoint> dataPoints = extractDataPoints(metricType, periods);
        double[] values = dataPoints.stream().mapToDouble(TrendDataPoint::getValue).toArray();

        TrendFit trend = calculateTrend(values);
        int anomalies = flagAnomalies(dataPoints);
        boolean seasonal = values.length >= settings.seasonalityMinPoints() && detectSeasonality(values);
        List<TrendDataPoint> forecast = request.includeForecast() && dataPoints.size() >= settings.minForecastPoints()
                ? forecast(dataPoints, request.forecastPeriods(), request.granularity())
                : List.of();

        TrendAnalysis analysis = new TrendAnalysis(
                request.customerId(),
                metricType,
                request.startDate(),
                request.endDate(),
                request.granularity(),
                dataPoints,
                trend.direction(),
                trend.strength(),
                forecast,
                seasonal,
                anomalies,
                List.of()
        );
        return analysis.withInsights(generateInsights(analysis));
    }

    static SortedMap<String, List<AuditResult>> groupByPeriod(List<AuditResult> audits, TrendGranularity granularity) {
        SortedMap<String, List<AuditResult>> grouped = new TreeMap<>();
        for (AuditResult audit : audits) {
            grouped.computeIfAbsent(periodKey(audit.createdAt(), granularity), key -> new ArrayList<>()).add(audit);
        }
        return grouped;
    }

    static String periodKey(Instant timestamp, TrendGranularity granularity) {
        LocalDate date = timestamp.atZone(ZoneOffset.UTC).toLocalDate();
        return switch (granularity) {
            case DAILY -> date.toString();
            case WEEKLY -> {
                LocalDate monday = date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                yield String.format(Locale.ROOT, "%d-W%02d",
                        monday.get(IsoFields.WEEK_BASED_YEAR), monday.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            }
            case MONTHLY -> YearMonth.from(date).toString();
            case QUARTERLY -> date.getYear() + "-Q" + ((date.getMonthValue() - 1) / 3 + 1);
        };
    }

    /**
     * One point per period, taken from the most recently created audit of that period. Periods
     * whose representative audit lacks the metric are skipped.
     */
    static List<TrendDataPoint> extractDataPoints(MetricType metricType, SortedMap<String, List<AuditResult>> periods) {
        List<TrendDataPoint> dataPoints = new ArrayList<>();
        for (List<AuditResult> periodAudits : periods.values()) {
            AuditResult latest = periodAudits.stream()
                    .max(Comparator.comparing(AuditResult::createdAt))
                    .orElseThrow();
            OptionalDouble value = AuditMetrics.getMetric(latest, metricType);
            if (value.isPresent()) {
                dataPoints.add(new TrendDataPoint(latest.createdAt(), value.getAsDouble(), metricType));
            }
        }
        return dataPoints;
    }

    record TrendFit(TrendDirection direction, double strength) {
    }

    TrendFit calculateTrend(double[] values) {
        if (values.length < 2) {
            return new TrendFit(TrendDirection.STABLE, 0d);
        }
        LinearFit fit = Statistics.linearFit(values);
        return new TrendFit(directionOf(fit.slope()), Statistics.rSquared(values, fit));
    }

    TrendDirection directionOf(double slope) {
        if (Math.abs(slope) < settings.stableSlopeThreshold()) {
            return TrendDirection.STABLE;
        }
        return slope > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }

    /**
     * Scores every point against the whole series and marks the outliers in place.
     *
     * @return number of flagged points
     */
    int flagAnomalies(List<TrendDataPoint> dataPoints) {
        if (dataPoints.size() < 3) {
            return 0;
        }
        double[] values = dataPoints.stream().mapToDouble(TrendDataPoint::getValue).toArray();
        double mean = Statistics.mean(values);
        double stdDev = Statistics.stddev(values);
        int flagged = 0;
        for (TrendDataPoint point : dataPoints) {
            DetectorResult result = DetectionMethods.zScore(point.getValue(), mean, stdDev, settings.zScoreThreshold());
            point.setAnomaly(result.triggered());
            point.setAnomalyScore(result.magnitude());
            if (result.triggered()) {
                flagged++;
            }
        }
        return flagged;
    }

    boolean detectSeasonality(double[] values) {
        for (int lag : settings.seasonalLags()) {
            if (lag < values.length && Statistics.autocorrelation(values, lag) > settings.seasonalityThreshold()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extends the fitted line {@code periods} steps past the last point. Months and quarters are
     * stepped as 30 and 90 days.
     */
    List<TrendDataPoint> forecast(List<TrendDataPoint> dataPoints, int periods, TrendGranularity granularity) {
        double[] values = dataPoints.stream().mapToDouble(TrendDataPoint::getValue).toArray();
        LinearFit fit = Statistics.linearFit(values);
        TrendDataPoint last = dataPoints.get(dataPoints.size() - 1);
        Duration step = stepOf(granularity);
        List<TrendDataPoint> forecast = new ArrayList<>(periods);
        for (int i = 1; i <= periods; i++) {
            double predicted = fit.predict(values.length + i - 1);
            forecast.add(new TrendDataPoint(
                    last.getTimestamp().plus(step.multipliedBy(i)),
                    Math.max(0d, predicted),
                    last.getMetricType()));
        }
        return forecast;
    }

    static Duration stepOf(TrendGranularity granularity) {
        return switch (granularity) {
            case DAILY -> Duration.ofDays(1);
            case WEEKLY -> Duration.ofDays(7);
            case MONTHLY -> Duration.ofDays(30);
            case QUARTERLY -> Duration.ofDays(90);
        };
    }

    List<String> generateInsights(TrendAnalysis analysis) {
        List<String> insights = new ArrayList<>();
        String metricName = analysis.metricType().value();

        if (analysis.trendDirection() != TrendDirection.STABLE) {
            String strength;
            if (analysis.trendStrength() > 0.7) {
                strength = "strong";
            } else if (analysis.trendStrength() > 0.4) {
                strength = "moderate";
            } else {
                strength = "weak";
            }
            insights.add(metricName + " shows a " + strength + " " + analysis.trendDirection().value() + " trend");
        }

        if (analysis.anomaliesDetected() > 0) {
            List<String> dates = analysis.dataPoints().stream()
                    .filter(TrendDataPoint::isAnomaly)
                    .limit(settings.maxAnomalyDatesInInsight())
                    .map(point -> INSIGHT_DATE.format(point.getTimestamp()))
                    .toList();
            insights.add(analysis.anomaliesDetected() + " anomalies detected on: " + String.join(", ", dates));
        }

        if (analysis.seasonalityDetected()) {
            insights.add("Seasonal pattern detected in " + metricName);
        }

        if (analysis.hasForecast() && !analysis.dataPoints().isEmpty()) {
            double lastActual = analysis.dataPoints().get(analysis.dataPoints().size() - 1).getValue();
            double lastForecast = analysis.forecast().get(analysis.forecast().size() - 1).getValue();
            double changePct = Statistics.percentageChange(lastActual, lastForecast);
            if (Math.abs(changePct) > settings.forecastInsightThresholdPct()) {
                insights.add(String.format(Locale.ROOT, "Forecast suggests %.1f%% %s over next %d periods",
                        Math.abs(changePct), changePct > 0 ? "increase" : "decrease", analysis.forecast().size()));
            }
        }
        return insights;
    }
}
