package com.finops.costanomaly.rootcause;

import com.finops.costanomaly.config.DetectionThresholds;
import com.finops.costanomaly.domain.model.Anomaly;
import com.finops.costanomaly.domain.model.CostDataPoint;
import com.finops.costanomaly.domain.model.ResourceCostSnapshot;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.ContributingFactor;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.FactorType;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.Recommendation;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.RecommendationType;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.ResourceContribution;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.ServiceContribution;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.TimeWindowAnalysis;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.TrendDirection;
import com.finops.costanomaly.rootcause.RootCauseAnalysis.WindowTrend;
import com.finops.costanomaly.stats.CostStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Attributes an anomaly to the services and resources whose cost rose.
 *
 * ATTRIBUTION:
 * Each resource contributes max(0, current - historical average). A service's or
 * resource's contribution percentage is its share of the total increase, so each
 * breakdown sums to 100% whenever anything increased at all.
 *
 * TIME WINDOW:
 * Observations within +/- timeWindowHours of the anomaly (inclusive) are summarized with
 * descriptive statistics, a local least squares trend and volatility (std dev / mean).
 *
 * Resource attribution failures leave the breakdowns empty and set
 * {@link RootCauseAnalysis#error()}; the time window analysis is still reported.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RootCauseAnalyzer {

    static final String UNKNOWN = "unknown";

    private final DetectionThresholds thresholds;
    private final Clock clock;

    public RootCauseAnalysis analyze(Anomaly anomaly, List<CostDataPoint> series,
                                     List<ResourceCostSnapshot> resources, String region) {
        DetectionThresholds.RootCauseSettings settings = thresholds.rootCause();

        Map<String, ServiceContribution> serviceBreakdown = Map.of();
        Map<String, ResourceContribution> resourceBreakdown = Map.of();
        List<ContributingFactor> factors = new ArrayList<>();
        String error = null;

        if (resources != null && !resources.isEmpty()) {
            try {
                validate(resources);
                serviceBreakdown = serviceContributions(resources);
                resourceBreakdown = resourceContributions(resources, region);
                factors.addAll(serviceFactors(serviceBreakdown, settings.serviceContributionThreshold()));
                factors.addAll(resourceFactors(resourceBreakdown, settings.resourceContributionThreshold()));
            } catch (InvalidResourceRecordException e) {
                log.warn("Resource attribution failed for anomaly {}: {}", anomaly.id(), e.getMessage());
                serviceBreakdown = Map.of();
                resourceBreakdown = Map.of();
                factors.clear();
                error = "Resource attribution unavailable: " + e.getMessage();
            }
        }

        TimeWindowAnalysis timeWindow = analyzeTimeWindow(
                anomaly.timestamp(), series, settings.timeWindowHours());

        return new RootCauseAnalysis(
                anomaly.id(),
                clock.instant(),
                List.copyOf(factors),
                serviceBreakdown,
                resourceBreakdown,
                timeWindow,
                recommendationsFor(factors),
                error
        );
    }

    Map<String, ServiceContribution> serviceContributions(List<ResourceCostSnapshot> resources) {
        Map<String, List<ResourceCostSnapshot>> byService = new LinkedHashMap<>();
        for (ResourceCostSnapshot resource : resources) {
            byService.computeIfAbsent(orUnknown(resource.resourceType()), k -> new ArrayList<>()).add(resource);
        }

        double totalIncrease = resources.stream().mapToDouble(ResourceCostSnapshot::costIncrease).sum();

        Map<String, ServiceContribution> breakdown = new LinkedHashMap<>();
        byService.forEach((service, members) -> {
            double increase = members.stream().mapToDouble(ResourceCostSnapshot::costIncrease).sum();
            breakdown.put(service, new ServiceContribution(
                    service,
                    increase,
                    members.size(),
                    increase / members.size(),
                    shareOf(increase, totalIncrease)
            ));
        });
        return Collections.unmodifiableMap(breakdown);
    }

    /**
     * Snapshots repeating a resource id are merged into one entry.
     */
    Map<String, ResourceContribution> resourceContributions(List<ResourceCostSnapshot> resources, String region) {
        Map<String, ResourceContribution> merged = new LinkedHashMap<>();
        for (ResourceCostSnapshot resource : resources) {
            String id = orUnknown(resource.resourceId());
            ResourceContribution existing = merged.get(id);
            double current = resource.current() + (existing != null ? existing.currentCost() : 0);
            double historical = resource.historical() + (existing != null ? existing.historicalCost() : 0);
            double increase = resource.costIncrease() + (existing != null ? existing.costIncrease() : 0);
            merged.put(id, new ResourceContribution(
                    id,
                    existing != null ? existing.resourceType() : orUnknown(resource.resourceType()),
                    current,
                    historical,
                    increase,
                    resource.region() != null ? resource.region() : region,
                    0.0
            ));
        }

        double totalIncrease = merged.values().stream().mapToDouble(ResourceContribution::costIncrease).sum();

        Map<String, ResourceContribution> breakdown = new LinkedHashMap<>();
        merged.forEach((id, c) -> breakdown.put(id, new ResourceContribution(
                c.resourceId(), c.resourceType(), c.currentCost(), c.historicalCost(),
                c.costIncrease(), c.region(), shareOf(c.costIncrease(), totalIncrease))));
        return Collections.unmodifiableMap(breakdown);
    }

    TimeWindowAnalysis analyzeTimeWindow(Instant anomalyTime, List<CostDataPoint> series, int windowHours) {
        Instant windowStart = anomalyTime.minus(Duration.ofHours(windowHours));
        Instant windowEnd = anomalyTime.plus(Duration.ofHours(windowHours));

        double[] costs = series.stream()
                .filter(CostDataPoint::hasCost)
                .filter(p -> !p.timestamp().isBefore(windowStart) && !p.timestamp().isAfter(windowEnd))
                .mapToDouble(CostDataPoint::cost)
                .toArray();

        if (costs.length == 0) {
            return TimeWindowAnalysis.empty(windowStart, windowEnd, "No data in time window");
        }

        double mean = CostStatistics.mean(costs);
        double stdDev = CostStatistics.sampleStdDev(costs);

        return new TimeWindowAnalysis(
                windowStart,
                windowEnd,
                costs.length,
                CostStatistics.min(costs),
                CostStatistics.max(costs),
                mean,
                CostStatistics.median(costs),
                stdDev,
                windowTrend(costs),
                mean > 0 && costs.length > 1 ? stdDev / mean : 0.0,
                null
        );
    }

    WindowTrend windowTrend(double[] costs) {
        if (costs.length < 2) {
            return WindowTrend.insufficientData();
        }

        double slope = CostStatistics.linearFit(costs).slope();
        double threshold = thresholds.rootCause().windowTrendSlopeThreshold();

        TrendDirection direction;
        if (slope > threshold) {
            direction = TrendDirection.INCREASING;
        } else if (slope < -threshold) {
            direction = TrendDirection.DECREASING;
        } else {
            direction = TrendDirection.STABLE;
        }

        double start = costs[0];
        double end = costs[costs.length - 1];
        return new WindowTrend(
                direction,
                slope,
                start,
                end,
                end - start,
                start > 0 ? (end - start) / start * 100 : 0.0
        );
    }

    private List<ContributingFactor> serviceFactors(Map<String, ServiceContribution> breakdown, double threshold) {
        List<ContributingFactor> factors = new ArrayList<>();
        for (ServiceContribution service : breakdown.values()) {
            if (service.contributionPercentage() >= threshold) {
                factors.add(new ContributingFactor(
                        FactorType.SERVICE,
                        service.serviceType(),
                        null,
                        service.contributionPercentage(),
                        service.costIncrease(),
                        String.format(Locale.ROOT, "Service %s contributed %.1f%% to the anomaly",
                                service.serviceType(), service.contributionPercentage())
                ));
            }
        }
        return factors;
    }

    private List<ContributingFactor> resourceFactors(Map<String, ResourceContribution> breakdown, double threshold) {
        List<ContributingFactor> factors = new ArrayList<>();
        for (ResourceContribution resource : breakdown.values()) {
            if (resource.contributionPercentage() >= threshold) {
                factors.add(new ContributingFactor(
                        FactorType.RESOURCE,
                        resource.resourceId(),
                        resource.resourceType(),
                        resource.contributionPercentage(),
                        resource.costIncrease(),
                        String.format(Locale.ROOT, "Resource %s contributed %.1f%% to the anomaly",
                                resource.resourceId(), resource.contributionPercentage())
                ));
            }
        }
        return factors;
    }

    List<Recommendation> recommendationsFor(List<ContributingFactor> factors) {
        List<Recommendation> recommendations = new ArrayList<>();

        for (ContributingFactor factor : factors) {
            double contribution = factor.contributionPercentage();
            switch (factor.type()) {
                case SERVICE -> recommendations.add(new Recommendation(
                        RecommendationType.SERVICE_INVESTIGATION,
                        contribution > 50 ? "HIGH" : "MEDIUM",
                        "Investigate " + factor.name() + " service cost increase",
                        String.format(Locale.ROOT, "Service %s contributed %.1f%% to the cost anomaly",
                                factor.name(), contribution),
                        "Review " + factor.name() + " resource usage and configuration changes",
                        factor.name()
                ));
                case RESOURCE -> recommendations.add(new Recommendation(
                        RecommendationType.RESOURCE_INVESTIGATION,
                        contribution > 30 ? "HIGH" : "MEDIUM",
                        "Investigate resource " + factor.name(),
                        String.format(Locale.ROOT, "Resource %s (%s) contributed %.1f%% to the cost anomaly",
                                factor.name(), factor.resourceType(), contribution),
                        "Review resource " + factor.name() + " configuration and usage patterns",
                        factor.name()
                ));
            }
        }

        recommendations.add(new Recommendation(
                RecommendationType.MONITORING,
                "MEDIUM",
                "Enhance cost monitoring",
                "Set up more granular cost monitoring to detect similar anomalies earlier",
                "Configure CloudWatch alarms and budget alerts for affected services",
                null
        ));

        return List.copyOf(recommendations);
    }

    private void validate(List<ResourceCostSnapshot> resources) {
        for (int i = 0; i < resources.size(); i++) {
            ResourceCostSnapshot resource = resources.get(i);
            if (resource == null) {
                throw new InvalidResourceRecordException("Resource record " + i + " is null");
            }
            requireValidCost(resource, "currentCost", resource.currentCost());
            requireValidCost(resource, "historicalAverageCost", resource.historicalAverageCost());
        }
    }

    private static void requireValidCost(ResourceCostSnapshot resource, String field, Double value) {
        if (value != null && (!Double.isFinite(value) || value < 0)) {
            throw new InvalidResourceRecordException(
                    "Resource " + orUnknown(resource.resourceId()) + " has invalid " + field + ": " + value);
        }
    }

    private static double shareOf(double part, double total) {
        return total > 0 ? part / total * 100 : 0.0;
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
