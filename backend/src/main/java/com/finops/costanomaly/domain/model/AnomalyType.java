package com.finops.costanomaly.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a flagged cost point.
 *
 * The scorer currently emits COST_SPIKE and COST_TREND. The remaining kinds are
 * produced by service- and region-level collectors and share the alerting path.
 */
public enum AnomalyType {
    COST_SPIKE("cost_spike"),
    COST_TREND("cost_trend"),
    USAGE_PATTERN("usage_pattern"),
    SERVICE_ANOMALY("service_anomaly"),
    REGIONAL_ANOMALY("regional_anomaly");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
