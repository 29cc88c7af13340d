package com.searchnav.insights.analytics;

/**
 * Least-squares line {@code y = slope * x + intercept}.
 */
public record LinearFit(double slope, double intercept) {

    public double predict(double x) {
        return slope * x + intercept;
    }
}
