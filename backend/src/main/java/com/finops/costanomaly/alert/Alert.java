package com.finops.costanomaly.alert;

import com.finops.costanomaly.domain.model.Anomaly;
import com.finops.costanomaly.domain.model.AnomalySeverity;
import com.finops.costanomaly.rootcause.RootCauseAnalysis;

import java.time.Instant;
import java.util.List;

/**
 * Notification-ready view of an alertable anomaly. Delivery happens outside the engine.
 */
public record Alert(
        String id,
        Instant createdAt,
        AnomalySeverity severity,
        String title,
        String description,
        Anomaly anomaly,
        RootCauseAnalysis rootCause,
        List<RootCauseAnalysis.Recommendation> recommendations,
        String region,
        AlertType alertType
) {}
