package com.finops.costanomaly.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Baseline model families.
 *
 * Declaration order is significant: when two models score equally the one
 * declared first is selected.
 */
public enum BaselineModelKind {
    MOVING_AVERAGE("moving_average"),
    SEASONAL("seasonal_decomposition"),
    LINEAR_TREND("linear_trend"),
    PERCENTILE("percentile_based");

    private final String value;

    BaselineModelKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
