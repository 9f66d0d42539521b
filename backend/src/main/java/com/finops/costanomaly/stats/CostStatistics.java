package com.finops.costanomaly.stats;

import java.util.Arrays;

/**
 * Descriptive statistics over cost series.
 *
 * Variance and standard deviation are sample statistics (n - 1 denominator).
 * Quantiles use the exclusive method: the i-th q-quantile sits at rank i(n+1)/q,
 * linearly interpolated and clamped to the observed range.
 */
public final class CostStatistics {

    private CostStatistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    public static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = sorted(values);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    public static double sampleVariance(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquares = 0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        return sumSquares / (values.length - 1);
    }

    public static double sampleStdDev(double[] values) {
        return Math.sqrt(sampleVariance(values));
    }

    public static double min(double[] values) {
        return Arrays.stream(values).min().orElse(0.0);
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(0.0);
    }

    /**
     * Cut points dividing the series into {@code n} equal-probability groups.
     *
     * @return {@code n - 1} cut points, or an empty array for fewer than two values
     */
    public static double[] quantiles(double[] values, int n) {
        if (values.length < 2 || n < 2) {
            return new double[0];
        }
        double[] data = sorted(values);
        int ld = data.length;
        int m = ld + 1;
        double[] result = new double[n - 1];
        for (int i = 1; i < n; i++) {
            int j = i * m / n;
            j = Math.max(1, Math.min(j, ld - 1));
            int delta = i * m - j * n;
            result[i - 1] = (data[j - 1] * (n - delta) + data[j] * delta) / n;
        }
        return result;
    }

    /**
     * Ordinary least squares fit of {@code values} against their index.
     * A degenerate index (fewer than two points) yields a flat line through the mean.
     */
    public static LinearFit linearFit(double[] values) {
        int n = values.length;
        if (n == 0) {
            return new LinearFit(0.0, 0.0);
        }
        double xMean = (n - 1) / 2.0;
        double yMean = mean(values);

        double numerator = 0;
        double denominator = 0;
        for (int i = 0; i < n; i++) {
            numerator += (i - xMean) * (values[i] - yMean);
            denominator += (i - xMean) * (i - xMean);
        }

        double slope = denominator == 0 ? 0.0 : numerator / denominator;
        double intercept = yMean - slope * xMean;
        return new LinearFit(slope, intercept);
    }

    /**
     * Pearson correlation of two equally long series.
     */
    public static ComputationResult pearson(double[] actual, double[] predicted) {
        if (actual.length != predicted.length) {
            return ComputationResult.failed("Series length mismatch: " + actual.length + " vs " + predicted.length);
        }
        int n = actual.length;
        if (n < 2) {
            return ComputationResult.failed("Correlation needs at least 2 points, got " + n);
        }

        double actualMean = mean(actual);
        double predictedMean = mean(predicted);

        double numerator = 0;
        double actualVar = 0;
        double predictedVar = 0;
        for (int i = 0; i < n; i++) {
            double da = actual[i] - actualMean;
            double dp = predicted[i] - predictedMean;
            numerator += da * dp;
            actualVar += da * da;
            predictedVar += dp * dp;
        }

        double denominator = Math.sqrt(actualVar * predictedVar);
        if (denominator == 0) {
            return ComputationResult.failed("Zero variance in correlated series");
        }
        return ComputationResult.of(numerator / denominator);
    }

    /**
     * Mean absolute percentage error, skipping points whose actual value is zero.
     */
    public static ComputationResult meanAbsolutePercentageError(double[] actual, double[] predicted) {
        if (actual.length == 0 || actual.length != predicted.length) {
            return ComputationResult.failed("Cannot compare series of length " + actual.length + " and " + predicted.length);
        }
        double sum = 0;
        int counted = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] == 0) {
                continue;
            }
            sum += Math.abs((actual[i] - predicted[i]) / actual[i]) * 100;
            counted++;
        }
        if (counted == 0) {
            return ComputationResult.failed("All actual values are zero");
        }
        return ComputationResult.of(sum / counted);
    }

    private static double[] sorted(double[] values) {
        double[] copy = Arrays.copyOf(values, values.length);
        Arrays.sort(copy);
        return copy;
    }

    public record LinearFit(double slope, double intercept) {
        public double valueAt(int index) {
            return intercept + slope * index;
        }
    }
}
