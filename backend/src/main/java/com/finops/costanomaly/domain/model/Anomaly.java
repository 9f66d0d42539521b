package com.finops.costanomaly.domain.model;

import java.time.Instant;

/**
 * A cost point flagged by the scorer.
 *
 * {@code trendSlope} is set only for COST_TREND anomalies and holds the raw
 * slope of the trailing window, in cost units per observation.
 */
public record Anomaly(
        String id,
        Instant timestamp,
        AnomalyType type,
        AnomalySeverity severity,
        double actualCost,
        double expectedCost,
        double deviationPercentage,
        double deviationStdDevs,
        Double trendSlope,
        BaselineModelKind baselineModel,
        String region,
        Instant detectedAt
) {
    /**
     * Cost above expectation; negative for drops.
     */
    public double costImpact() {
        return actualCost - expectedCost;
    }
}
