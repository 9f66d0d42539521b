package com.finops.costanomaly.stats;

/**
 * Outcome of a statistic that may be undefined for its input
 * (empty series, zero variance, all-zero actuals).
 *
 * Callers collapse a failure to a documented default with {@link #orElse(double)}
 * instead of relying on exceptions.
 */
public record ComputationResult(
        double value,
        String failure
) {
    public static ComputationResult of(double value) {
        return new ComputationResult(value, null);
    }

    public static ComputationResult failed(String reason) {
        return new ComputationResult(Double.NaN, reason);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public double orElse(double fallback) {
        return isSuccess() ? value : fallback;
    }
}
