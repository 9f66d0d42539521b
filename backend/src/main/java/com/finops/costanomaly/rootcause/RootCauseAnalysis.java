package com.finops.costanomaly.rootcause;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Attribution of one anomaly to services, resources and the surrounding cost pattern.
 *
 * {@code error} is set when part of the analysis could not be completed; whatever was
 * computed before the failure is still reported.
 */
public record RootCauseAnalysis(
        String anomalyId,
        Instant analyzedAt,
        List<ContributingFactor> contributingFactors,
        Map<String, ServiceContribution> serviceBreakdown,
        Map<String, ResourceContribution> resourceBreakdown,
        TimeWindowAnalysis timeWindow,
        List<Recommendation> recommendations,
        String error
) {
    public static RootCauseAnalysis failed(String anomalyId, Instant analyzedAt, String error) {
        return new RootCauseAnalysis(anomalyId, analyzedAt, List.of(), Map.of(), Map.of(),
                null, List.of(), error);
    }

    public boolean isComplete() {
        return error == null;
    }

    public enum FactorType {
        SERVICE,
        RESOURCE
    }

    public record ContributingFactor(
            FactorType type,
            String name,
            String resourceType,
            double contributionPercentage,
            double costIncrease,
            String description
    ) {}

    public record ServiceContribution(
            String serviceType,
            double costIncrease,
            int resourceCount,
            double avgIncreasePerResource,
            double contributionPercentage
    ) {}

    public record ResourceContribution(
            String resourceId,
            String resourceType,
            double currentCost,
            double historicalCost,
            double costIncrease,
            String region,
            double contributionPercentage
    ) {}

    /**
     * Cost behaviour in the hours around the anomaly. {@code emptyReason} is set, and every
     * other statistic left at zero, when no observation fell inside the window.
     */
    public record TimeWindowAnalysis(
            Instant windowStart,
            Instant windowEnd,
            int pointCount,
            double min,
            double max,
            double mean,
            double median,
            double stdDev,
            WindowTrend trend,
            double volatility,
            String emptyReason
    ) {
        static TimeWindowAnalysis empty(Instant windowStart, Instant windowEnd, String reason) {
            return new TimeWindowAnalysis(windowStart, windowEnd, 0, 0, 0, 0, 0, 0,
                    WindowTrend.insufficientData(), 0, reason);
        }

        public boolean isEmpty() {
            return pointCount == 0;
        }
    }

    public enum TrendDirection {
        INCREASING,
        DECREASING,
        STABLE,
        INSUFFICIENT_DATA
    }

    public record WindowTrend(
            TrendDirection direction,
            double slope,
            double startCost,
            double endCost,
            double totalChange,
            double percentageChange
    ) {
        static WindowTrend insufficientData() {
            return new WindowTrend(TrendDirection.INSUFFICIENT_DATA, 0, 0, 0, 0, 0);
        }
    }

    public enum RecommendationType {
        SERVICE_INVESTIGATION,
        RESOURCE_INVESTIGATION,
        MONITORING
    }

    public record Recommendation(
            RecommendationType type,
            String priority,
            String title,
            String description,
            String action,
            String target
    ) {}
}
