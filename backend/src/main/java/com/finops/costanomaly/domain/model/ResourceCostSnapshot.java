package com.finops.costanomaly.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Point-in-time cost of one resource, as reported by the resource scanners.
 *
 * When no historical average is known the resource is assumed unchanged,
 * so it contributes no cost increase.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceCostSnapshot(
        String resourceId,
        String resourceType,
        Double currentCost,
        Double historicalAverageCost,
        String region
) {
    public double current() {
        return currentCost != null ? currentCost : 0.0;
    }

    public double historical() {
        return historicalAverageCost != null ? historicalAverageCost : current();
    }

    public double costIncrease() {
        return Math.max(0, current() - historical());
    }
}
