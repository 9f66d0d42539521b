package com.finops.costanomaly.baseline;

import com.finops.costanomaly.stats.CostStatistics;

/**
 * Descriptive statistics of the cost series a baseline was built from.
 * {@code stdDev} and {@code variance} are sample statistics.
 */
public record BaselineStatistics(
        double mean,
        double median,
        double stdDev,
        double min,
        double max,
        double q25,
        double q75,
        double variance,
        int pointCount
) {
    public static BaselineStatistics of(double[] costs) {
        double min = CostStatistics.min(costs);
        double max = CostStatistics.max(costs);
        double[] quartiles = costs.length >= 4 ? CostStatistics.quantiles(costs, 4) : null;

        return new BaselineStatistics(
                CostStatistics.mean(costs),
                CostStatistics.median(costs),
                CostStatistics.sampleStdDev(costs),
                min,
                max,
                quartiles != null ? quartiles[0] : min,
                quartiles != null ? quartiles[2] : max,
                CostStatistics.sampleVariance(costs),
                costs.length
        );
    }

    /**
     * Distance from the mean in standard deviations; 0 for a flat series.
     */
    public double deviationsFromMean(double cost) {
        return stdDev == 0 ? 0.0 : (cost - mean) / stdDev;
    }
}
