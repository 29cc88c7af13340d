package com.searchnav.insights.analytics;

/**
 * The three statistical tests behind anomaly detection. Degenerate history (no spread, no residual
 * noise and no range) never fires a test.
 */
public final class DetectionMethods {

    private DetectionMethods() {
    }

    public static DetectorResult zScore(double current, double[] history, double threshold) {
        return zScore(current, Statistics.mean(history), Statistics.stddev(history), threshold);
    }

    public static DetectorResult zScore(double current, double mean, double stdDev, double threshold) {
        if (stdDev <= Statistics.EPSILON) {
            return DetectorResult.notTriggered(DetectorResult.Method.Z_SCORE);
        }
        double zScore = Math.abs((current - mean) / stdDev);
        return new DetectorResult(DetectorResult.Method.Z_SCORE, zScore > threshold, zScore);
    }

    public static DetectorResult iqr(double current, double[] history, double multiplier) {
        double q1 = Statistics.percentile(history, 25);
        double q3 = Statistics.percentile(history, 75);
        double iqr = q3 - q1;
        if (iqr <= Statistics.EPSILON) {
            return DetectorResult.notTriggered(DetectorResult.Method.IQR);
        }
        double lowerBound = q1 - multiplier * iqr;
        double upperBound = q3 + multiplier * iqr;
        if (current < lowerBound) {
            return new DetectorResult(DetectorResult.Method.IQR, true, (lowerBound - current) / iqr);
        }
        if (current > upperBound) {
            return new DetectorResult(DetectorResult.Method.IQR, true, (current - upperBound) / iqr);
        }
        return DetectorResult.notTriggered(DetectorResult.Method.IQR);
    }

    /**
     * Compares {@code current} with the next value of a line fitted through {@code history}.
     * A near-zero residual spread is floored at {@code floorFraction} of the history's range.
     */
    public static DetectorResult trendResidual(double current, double[] history, double threshold, double floorFraction) {
        if (history.length < 3) {
            return DetectorResult.notTriggered(DetectorResult.Method.TREND_RESIDUAL);
        }
        LinearFit fit = Statistics.linearFit(history);
        double predicted = fit.predict(history.length);
        double residualStd = Statistics.stddev(Statistics.residuals(history, fit));
        if (residualStd < 1e-6) {
            double range = Statistics.max(history) - Statistics.min(history);
            residualStd = Math.max(residualStd, range * floorFraction);
        }
        if (residualStd < 1e-6) {
            return DetectorResult.notTriggered(DetectorResult.Method.TREND_RESIDUAL);
        }
        double deviation = Math.abs(current - predicted) / residualStd;
        return new DetectorResult(DetectorResult.Method.TREND_RESIDUAL, deviation > threshold, deviation);
    }
}
