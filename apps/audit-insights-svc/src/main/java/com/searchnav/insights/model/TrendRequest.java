package com.searchnav.insights.model;

import java.time.Instant;
import java.util.List;

public record TrendRequest(
        String customerId,
        List<MetricType> metricTypes,
        Instant startDate,
        Instant endDate,
        TrendGranularity granularity,
        boolean includeForecast,
        int forecastPeriods
) {
    public static final int DEFAULT_FORECAST_PERIODS = 3;

    public TrendRequest {
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("customerId must be provided");
        }
        if (startDate == null || endDate == null) {
            throw new IllegalArgumentException("startDate and endDate must be provided");
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("endDate must not be before startDate");
        }
        if (includeForecast && forecastPeriods <= 0) {
            throw new IllegalArgumentException("forecastPeriods must be positive when forecasting");
        }
        metricTypes = metricTypes == null ? List.of() : List.copyOf(metricTypes);
        granularity = granularity == null ? TrendGranularity.MONTHLY : granularity;
    }

    public static TrendRequest of(String customerId, List<MetricType> metricTypes, Instant startDate, Instant endDate) {
        return new TrendRequest(customerId, metricTypes, startDate, endDate, TrendGranularity.MONTHLY, false, DEFAULT_FORECAST_PERIODS);
    }
}
