package com.finops.costanomaly.domain.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * A single cost observation for an account and region.
 *
 * {@code cost} is null when the billing source reported the period without a value.
 * Such points count against data completeness and are excluded from baseline fitting.
 */
public record CostDataPoint(
        Instant timestamp,
        Double cost
) {
    public static final Comparator<CostDataPoint> BY_TIMESTAMP =
            Comparator.comparing(CostDataPoint::timestamp);

    public static CostDataPoint of(Instant timestamp, double cost) {
        return new CostDataPoint(timestamp, cost);
    }

    public boolean hasCost() {
        return cost != null;
    }
}
