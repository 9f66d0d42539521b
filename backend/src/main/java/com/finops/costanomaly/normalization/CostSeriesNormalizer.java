package com.finops.costanomaly.normalization;

import com.finops.costanomaly.domain.model.CostDataPoint;
import com.finops.costanomaly.domain.model.RawCostRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns collector output into a time-ordered cost series.
 *
 * NORMALIZATION RULES:
 * 1. Timestamps are parsed with {@link TimestampParser}; unparsable records are skipped, not fatal
 * 2. Missing costs are kept as null so data completeness can be measured downstream
 * 3. Records are sorted by timestamp; equal timestamps keep their input order
 * 4. Duplicate timestamps are not merged
 */
@Component
@Slf4j
public class CostSeriesNormalizer {

    public NormalizedSeries normalize(List<RawCostRecord> records) {
        if (records == null || records.isEmpty()) {
            return new NormalizedSeries(List.of(), 0);
        }

        List<CostDataPoint> points = new ArrayList<>(records.size());
        int skipped = 0;

        for (RawCostRecord record : records) {
            if (record == null) {
                skipped++;
                continue;
            }
            Optional<Instant> timestamp = TimestampParser.parse(record.timestamp());
            if (timestamp.isEmpty()) {
                log.warn("Skipping cost record with unparsable timestamp: '{}'", record.timestamp());
                skipped++;
                continue;
            }
            points.add(new CostDataPoint(timestamp.get(), record.cost()));
        }

        if (skipped > 0) {
            log.info("Normalized {} cost records, skipped {}", points.size(), skipped);
        }

        points.sort(CostDataPoint.BY_TIMESTAMP);
        return new NormalizedSeries(List.copyOf(points), skipped);
    }

    /**
     * Order already-parsed points; points without a timestamp are dropped.
     */
    public NormalizedSeries normalizePoints(List<CostDataPoint> points) {
        if (points == null || points.isEmpty()) {
            return new NormalizedSeries(List.of(), 0);
        }
        List<CostDataPoint> ordered = new ArrayList<>(points.size());
        int skipped = 0;
        for (CostDataPoint point : points) {
            if (point == null || point.timestamp() == null) {
                skipped++;
                continue;
            }
            ordered.add(point);
        }
        if (skipped > 0) {
            log.warn("Dropped {} cost points without a timestamp", skipped);
        }
        ordered.sort(CostDataPoint.BY_TIMESTAMP);
        return new NormalizedSeries(List.copyOf(ordered), skipped);
    }

    /**
     * Time-ordered series plus the number of input records that could not be used.
     */
    public record NormalizedSeries(
            List<CostDataPoint> points,
            int skippedRecords
    ) {}
}
