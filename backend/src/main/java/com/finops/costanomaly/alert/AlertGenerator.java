package com.finops.costanomaly.alert;

import com.finops.costanomaly.domain.model.Anomaly;
import com.finops.costanomaly.rootcause.AnalyzedAnomaly;
import com.finops.costanomaly.rootcause.RootCauseAnalysis;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns analyzed anomalies of MEDIUM severity or above into alerts.
 * LOW anomalies stay in the detection result but are never alerted.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AlertGenerator {

    private final Clock clock;

    public List<Alert> generate(List<AnalyzedAnomaly> analyzed, String region) {
        Instant createdAt = clock.instant();
        List<Alert> alerts = new ArrayList<>();

        for (AnalyzedAnomaly entry : analyzed) {
            Anomaly anomaly = entry.anomaly();
            if (!anomaly.severity().isAlertable()) {
                continue;
            }

            RootCauseAnalysis rootCause = entry.rootCause();
            alerts.add(new Alert(
                    "alert-" + anomaly.id(),
                    createdAt,
                    anomaly.severity(),
                    "Cost Anomaly Detected: " + anomaly.type().getValue(),
                    describe(anomaly),
                    anomaly,
                    rootCause,
                    rootCause != null ? rootCause.recommendations() : List.of(),
                    region,
                    AlertType.COST_ANOMALY
            ));
        }

        if (!alerts.isEmpty()) {
            log.info("Generated {} alerts for region {} from {} anomalies", alerts.size(), region, analyzed.size());
        }
        return List.copyOf(alerts);
    }

    String describe(Anomaly anomaly) {
        return switch (anomaly.type()) {
            case COST_SPIKE -> String.format(Locale.ROOT,
                    "Cost spike detected: $%.2f vs expected $%.2f (%+.1f%% deviation)",
                    anomaly.actualCost(), anomaly.expectedCost(), anomaly.deviationPercentage());
            case COST_TREND -> String.format(Locale.ROOT,
                    "Unusual cost trend detected with %+.1f%% deviation from baseline",
                    anomaly.deviationPercentage());
            default -> String.format(Locale.ROOT,
                    "Cost anomaly detected: %+.1f%% deviation from expected patterns",
                    anomaly.deviationPercentage());
        };
    }
}
