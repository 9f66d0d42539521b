package com.finops.costanomaly.quality;

import java.time.Instant;

/**
 * Result of checking whether a cost series can support a baseline.
 *
 * {@code reason} is set only when {@code sufficient} is false. Span and bounds are
 * null when validation stopped before timestamps were examined.
 */
public record DataQualityReport(
        boolean sufficient,
        String reason,
        int pointCount,
        int validPointCount,
        double completenessRatio,
        Long spanDays,
        Instant earliest,
        Instant latest
) {
    static DataQualityReport insufficient(String reason, int pointCount) {
        return new DataQualityReport(false, reason, pointCount, 0, 0.0, null, null, null);
    }

    static DataQualityReport insufficient(String reason, int pointCount, long spanDays,
                                          Instant earliest, Instant latest) {
        return new DataQualityReport(false, reason, pointCount, 0, 0.0, spanDays, earliest, latest);
    }
}
