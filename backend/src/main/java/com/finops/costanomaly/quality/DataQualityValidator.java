package com.finops.costanomaly.quality;

import com.finops.costanomaly.config.DetectionThresholds;
import com.finops.costanomaly.domain.model.CostDataPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Gatekeeper in front of baseline construction.
 *
 * CHECKS (fail-fast, in order):
 * 1. Series is non-empty
 * 2. At least {@code minDataPoints} points
 * 3. Timestamps present and spanning at least {@code minHistoricalDays} whole days
 * 4. Share of points carrying a cost at least {@code dataQualityThreshold}
 *
 * The first failing check determines the reported reason.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DataQualityValidator {

    private final DetectionThresholds thresholds;

    public DataQualityReport validate(List<CostDataPoint> series) {
        DetectionThresholds.BaselineRequirements requirements = thresholds.baseline();

        if (series == null || series.isEmpty()) {
            return DataQualityReport.insufficient("No cost data provided", 0);
        }

        int pointCount = series.size();
        if (pointCount < requirements.minDataPoints()) {
            return DataQualityReport.insufficient(
                    String.format(Locale.ROOT, "Insufficient data points: %d < %d", pointCount, requirements.minDataPoints()),
                    pointCount);
        }

        List<Instant> timestamps = series.stream()
                .map(CostDataPoint::timestamp)
                .filter(Objects::nonNull)
                .toList();
        if (timestamps.isEmpty()) {
            return DataQualityReport.insufficient("No valid timestamps in data", pointCount);
        }

        Instant earliest = timestamps.stream().min(Instant::compareTo).orElseThrow();
        Instant latest = timestamps.stream().max(Instant::compareTo).orElseThrow();
        long spanDays = Duration.between(earliest, latest).toDays();

        if (spanDays < requirements.minHistoricalDays()) {
            return DataQualityReport.insufficient(
                    String.format(Locale.ROOT, "Insufficient historical span: %d days < %d days",
                            spanDays, requirements.minHistoricalDays()),
                    pointCount, spanDays, earliest, latest);
        }

        int validPoints = (int) series.stream().filter(CostDataPoint::hasCost).count();
        double completeness = (double) validPoints / pointCount;

        if (completeness < requirements.dataQualityThreshold()) {
            return new DataQualityReport(
                    false,
                    String.format(Locale.ROOT, "Poor data quality: %.2f < %s", completeness, requirements.dataQualityThreshold()),
                    pointCount, validPoints, completeness, spanDays, earliest, latest);
        }

        if (spanDays < requirements.optimalHistoricalDays()) {
            log.debug("Baseline history spans {} days, below the optimal {} days",
                    spanDays, requirements.optimalHistoricalDays());
        }

        return new DataQualityReport(true, null, pointCount, validPoints, completeness,
                spanDays, earliest, latest);
    }
}
