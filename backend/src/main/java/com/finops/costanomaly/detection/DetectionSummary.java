package com.finops.costanomaly.detection;

import com.finops.costanomaly.domain.model.Anomaly;
import com.finops.costanomaly.domain.model.AnomalySeverity;
import com.finops.costanomaly.domain.model.AnomalyType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Roll-up of one detection run.
 *
 * {@code totalCostImpact} sums actual minus expected over all anomalies, so drops
 * offset spikes. {@code mostSevere} is the first anomaly of the highest severity,
 * null when nothing was flagged.
 */
public record DetectionSummary(
        int totalAnomalies,
        Map<AnomalySeverity, Integer> severityBreakdown,
        Map<AnomalyType, Integer> typeBreakdown,
        double totalCostImpact,
        Anomaly mostSevere
) {
    public static DetectionSummary empty() {
        return new DetectionSummary(0, Map.of(), Map.of(), 0.0, null);
    }

    public static DetectionSummary of(List<Anomaly> anomalies) {
        Map<AnomalySeverity, Integer> bySeverity = new EnumMap<>(AnomalySeverity.class);
        Map<AnomalyType, Integer> byType = new EnumMap<>(AnomalyType.class);
        double impact = 0;
        Anomaly mostSevere = null;

        for (Anomaly anomaly : anomalies) {
            bySeverity.merge(anomaly.severity(), 1, Integer::sum);
            byType.merge(anomaly.type(), 1, Integer::sum);
            impact += anomaly.costImpact();
            if (mostSevere == null || anomaly.severity().isMoreSevereThan(mostSevere.severity())) {
                mostSevere = anomaly;
            }
        }

        return new DetectionSummary(
                anomalies.size(),
                Collections.unmodifiableMap(bySeverity),
                Collections.unmodifiableMap(byType),
                impact,
                mostSevere
        );
    }
}
