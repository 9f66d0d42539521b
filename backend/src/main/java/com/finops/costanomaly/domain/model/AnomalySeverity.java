package com.finops.costanomaly.domain.model;

/**
 * Severity bands, declared from least to most severe.
 *
 * Only MEDIUM and above produce alerts; LOW anomalies are reported but never alerted.
 */
public enum AnomalySeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int rank;

    AnomalySeverity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isAlertable() {
        return this != LOW;
    }

    public boolean isMoreSevereThan(AnomalySeverity other) {
        return rank > other.rank;
    }
}
