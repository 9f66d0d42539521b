package com.finops.costanomaly.alert;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertType {
    COST_ANOMALY("cost_anomaly");

    private final String value;

    AlertType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
