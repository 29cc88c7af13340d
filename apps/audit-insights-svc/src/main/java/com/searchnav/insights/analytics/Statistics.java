package com.searchnav.insights.analytics;

import java.util.Arrays;
import java.util.List;

/**
 * Numeric helpers shared by the detectors and analyzers. Every helper accepts empty or constant
 * input and resolves 0/0 to 0.0 instead of NaN.
 */
public final class Statistics {

    static final double EPSILON = 1e-12d;

    private Statistics() {
    }

    public static double[] toArray(List<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return new double[0];
        }
        double[] result = new double[values.size()];
        for (int i = 0; i < result.length; i++) {
            Number value = values.get(i);
            result[i] = value == null ? 0d : value.doubleValue();
        }
        return result;
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by N).
     */
    public static double stddev(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double mean = mean(values);
        double sumSquaredDiffs = 0d;
        for (double value : values) {
            double diff = value - mean;
            sumSquaredDiffs += diff * diff;
        }
        return Math.sqrt(sumSquaredDiffs / values.length);
    }

    public static double min(double[] values) {
        return Arrays.stream(values).min().orElse(0d);
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(0d);
    }

    /**
     * Percentile with linear interpolation between closest ranks.
     *
     * @param percentile value in [0, 100]
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return 0d;
        }
        double[] sortedValues = values.clone();
        Arrays.sort(sortedValues);
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    /**
     * Ordinary least squares over {@code x = 0..n-1}.
     */
    public static LinearFit linearFit(double[] y) {
        return linearFit(indexAxis(y.length), y);
    }

    public static LinearFit linearFit(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length");
        }
        if (y.length == 0) {
            return new LinearFit(0d, 0d);
        }
        double meanX = mean(x);
        double meanY = mean(y);
        double sxy = 0d;
        double sxx = 0d;
        for (int i = 0; i < x.length; i++) {
            double dx = x[i] - meanX;
            sxy += dx * (y[i] - meanY);
            sxx += dx * dx;
        }
        double slope = sxx == 0d ? 0d : sxy / sxx;
        return new LinearFit(slope, meanY - slope * meanX);
    }

    /**
     * Coefficient of determination of {@code fit} over the points, as a magnitude in [0, 1].
     */
    public static double rSquared(double[] x, double[] y, LinearFit fit) {
        if (y.length == 0) {
            return 0d;
        }
        double meanY = mean(y);
        double ssRes = 0d;
        double ssTot = 0d;
        for (int i = 0; i < y.length; i++) {
            double residual = y[i] - fit.predict(x[i]);
            ssRes += residual * residual;
            double deviation = y[i] - meanY;
            ssTot += deviation * deviation;
        }
        if (ssTot == 0d) {
            return 0d;
        }
        return Math.min(1d, Math.abs(1d - ssRes / ssTot));
    }

    public static double rSquared(double[] y, LinearFit fit) {
        return rSquared(indexAxis(y.length), y, fit);
    }

    public static double[] residuals(double[] y, LinearFit fit) {
        double[] residuals = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            residuals[i] = y[i] - fit.predict(i);
        }
        return residuals;
    }

    /**
     * Removes the least-squares line from the series.
     */
    public static double[] detrend(double[] values) {
        return residuals(values, linearFit(values));
    }

    /**
     * Autocorrelation of the detrended series at {@code lag}, normalized so that lag 0 yields 1.0.
     * Returns 0.0 for lags outside the series or when the detrended series has no energy.
     */
    public static double autocorrelation(double[] values, int lag) {
        if (lag < 0 || lag >= values.length) {
            return 0d;
        }
        double[] detrended = detrend(values);
        double energy = 0d;
        for (double value : detrended) {
            energy += value * value;
        }
        if (energy <= EPSILON) {
            return 0d;
        }
        double lagged = 0d;
        for (int i = 0; i + lag < detrended.length; i++) {
            lagged += detrended[i] * detrended[i + lag];
        }
        return lagged / energy;
    }

    /**
     * Relative change in percent. With {@code inverse}, a decrease is reported as a positive
     * number. A zero baseline yields 0 when the comparison is also zero, otherwise +/-100.
     */
    public static double percentageChange(double baseline, double comparison, boolean inverse) {
        if (baseline == 0d) {
            if (comparison == 0d) {
                return 0d;
            }
            return inverse ? -100d : 100d;
        }
        if (inverse) {
            return (baseline - comparison) / baseline * 100d;
        }
        return (comparison - baseline) / baseline * 100d;
    }

    public static double percentageChange(double baseline, double comparison) {
        return percentageChange(baseline, comparison, false);
    }

    private static double[] indexAxis(int length) {
        double[] x = new double[length];
        for (int i = 0; i < length; i++) {
            x[i] = i;
        }
        return x;
    }
}
