package com.finops.costanomaly.detection;

import com.finops.costanomaly.alert.Alert;
import com.finops.costanomaly.alert.AlertGenerator;
import com.finops.costanomaly.baseline.BaselineAnalysis;
import com.finops.costanomaly.baseline.BaselineEstimator;
import com.finops.costanomaly.baseline.BaselineStore;
import com.finops.costanomaly.domain.model.Anomaly;
import com.finops.costanomaly.domain.model.CostDataPoint;
import com.finops.costanomaly.domain.model.RawCostRecord;
import com.finops.costanomaly.domain.model.ResourceCostSnapshot;
import com.finops.costanomaly.normalization.CostSeriesNormalizer;
import com.finops.costanomaly.normalization.CostSeriesNormalizer.NormalizedSeries;
import com.finops.costanomaly.quality.DataQualityReport;
import com.finops.costanomaly.quality.DataQualityValidator;
import com.finops.costanomaly.rootcause.AnalyzedAnomaly;
import com.finops.costanomaly.rootcause.RootCauseAnalysis;
import com.finops.costanomaly.rootcause.RootCauseAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs the full detection pipeline for one region.
 *
 * DETECTION FLOW:
 * 1. Normalize raw records into a time-ordered series
 * 2. Validate data quality; an unusable series ends the run with an insufficient-data result
 * 3. Estimate the baseline and score every point against it
 * 4. Attribute each anomaly to services, resources and the surrounding time window
 * 5. Compare with the region's previous baseline, then replace it in the store
 * 6. Alert on anomalies of MEDIUM severity or above and summarize the run
 *
 * A failure while analyzing one anomaly, or while generating alerts, is logged and
 * reported in the result; it never discards the anomalies already found.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyDetectionEngine {

    private final CostSeriesNormalizer normalizer;
    private final DataQualityValidator validator;
    private final BaselineEstimator estimator;
    private final AnomalyScorer scorer;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final AlertGenerator alertGenerator;
    private final BaselineStore baselineStore;
    private final Clock clock;

    /**
     * Detect anomalies in collector records whose timestamps are still ISO-8601 strings.
     */
    public DetectionResult detect(String region, List<RawCostRecord> records,
                                  List<ResourceCostSnapshot> resources) {
        requireRegion(region);
        return run(region, normalizer.normalize(records), resources);
    }

    public DetectionResult detectPoints(String region, List<CostDataPoint> points,
                                        List<ResourceCostSnapshot> resources) {
        requireRegion(region);
        return run(region, normalizer.normalizePoints(points), resources);
    }

    public Optional<BaselineAnalysis> baselineFor(String region) {
        requireRegion(region);
        return baselineStore.get(region);
    }

    private DetectionResult run(String region, NormalizedSeries normalized,
                                List<ResourceCostSnapshot> resources) {
        Instant startedAt = clock.instant();
        List<CostDataPoint> series = normalized.points();
        int skipped = normalized.skippedRecords();
        log.info("Starting anomaly detection for region {} over {} points ({} skipped)",
                region, series.size(), skipped);

        DataQualityReport quality = validator.validate(series);
        if (!quality.sufficient()) {
            log.info("Skipping detection for region {}: {}", region, quality.reason());
            return DetectionResult.insufficientData(region, startedAt,
                    BaselineAnalysis.notEstablished(quality.reason(), quality), skipped);
        }

        BaselineAnalysis baseline = estimator.estimate(series, quality);
        if (!baseline.established()) {
            log.info("Skipping detection for region {}: {}", region, baseline.reason());
            return DetectionResult.insufficientData(region, startedAt, baseline, skipped);
        }

        List<Anomaly> anomalies = scorer.score(series, baseline, region);

        List<AnalyzedAnomaly> analyzed = new ArrayList<>(anomalies.size());
        for (Anomaly anomaly : anomalies) {
            analyzed.add(new AnalyzedAnomaly(anomaly, analyzeRootCause(anomaly, series, resources, region)));
        }

        BaselineDrift drift = baselineStore.get(region)
                .filter(BaselineAnalysis::established)
                .map(previous -> BaselineDrift.between(previous, baseline))
                .orElse(null);
        if (drift != null && drift.modelChanged()) {
            log.info("Baseline model for region {} changed from {} to {}",
                    region, drift.previousModel(), drift.currentModel());
        }
        baselineStore.put(region, baseline);

        List<Alert> alerts = generateAlerts(analyzed, region);

        log.info("Detection for region {} complete: {} anomalies, {} alerts",
                region, anomalies.size(), alerts.size());

        return new DetectionResult(
                region,
                startedAt,
                List.copyOf(analyzed),
                baseline,
                alerts,
                DetectionSummary.of(anomalies),
                drift,
                null,
                skipped
        );
    }

    private RootCauseAnalysis analyzeRootCause(Anomaly anomaly, List<CostDataPoint> series,
                                               List<ResourceCostSnapshot> resources, String region) {
        try {
            return rootCauseAnalyzer.analyze(anomaly, series, resources, region);
        } catch (RuntimeException e) {
            log.warn("Root cause analysis failed for anomaly {}", anomaly.id(), e);
            return RootCauseAnalysis.failed(anomaly.id(), clock.instant(),
                    "Root cause analysis failed: " + e.getMessage());
        }
    }

    private List<Alert> generateAlerts(List<AnalyzedAnomaly> analyzed, String region) {
        try {
            return alertGenerator.generate(analyzed, region);
        } catch (RuntimeException e) {
            log.error("Alert generation failed for region {}", region, e);
            return List.of();
        }
    }

    private static void requireRegion(String region) {
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("Region must not be blank");
        }
    }
}
