package com.finops.costanomaly.detection;

import com.finops.costanomaly.alert.Alert;
import com.finops.costanomaly.baseline.BaselineAnalysis;
import com.finops.costanomaly.rootcause.AnalyzedAnomaly;

import java.time.Instant;
import java.util.List;

/**
 * Output of one detection run for a region.
 *
 * {@code baselineDrift} is null on the region's first run. {@code error} is set only when
 * the series could not support a baseline, in which case every list is empty.
 * {@code skippedRecords} counts input records dropped during normalization on either path.
 */
public record DetectionResult(
        String region,
        Instant timestamp,
        List<AnalyzedAnomaly> anomalies,
        BaselineAnalysis baselineAnalysis,
        List<Alert> alerts,
        DetectionSummary summary,
        BaselineDrift baselineDrift,
        String error,
        int skippedRecords
) {
    public static final String INSUFFICIENT_DATA = "Insufficient data to establish baseline patterns";

    static DetectionResult insufficientData(String region, Instant timestamp, BaselineAnalysis baseline,
                                            int skippedRecords) {
        return new DetectionResult(region, timestamp, List.of(), baseline, List.of(),
                DetectionSummary.empty(), null, INSUFFICIENT_DATA, skippedRecords);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
