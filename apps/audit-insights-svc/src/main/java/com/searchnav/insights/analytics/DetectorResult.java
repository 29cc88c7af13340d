package com.searchnav.insights.analytics;

import java.util.Collection;

/**
 * Outcome of a single detection method: whether it fired and how far the value was from the
 * expected range, in the method's own units.
 */
public record DetectorResult(Method method, boolean triggered, double magnitude) {

    public enum Method {
        Z_SCORE,
        IQR,
        TREND_RESIDUAL
    }

    public static DetectorResult notTriggered(Method method) {
        return new DetectorResult(method, false, 0d);
    }

    /**
     * A single firing method is enough to call the value anomalous.
     */
    public static boolean anyTriggered(Collection<DetectorResult> results) {
        return results.stream().anyMatch(DetectorResult::triggered);
    }

    public static double magnitudeOf(Collection<DetectorResult> results, Method method) {
        return results.stream()
                .filter(result -> result.method() == method)
                .mapToDouble(DetectorResult::magnitude)
                .findFirst()
                .orElse(0d);
    }
}
