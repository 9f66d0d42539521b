package com.finops.costanomaly.baseline;

import com.finops.costanomaly.domain.model.BaselineModelKind;
import com.finops.costanomaly.quality.DataQualityReport;

import java.time.Instant;
import java.util.Map;

/**
 * Everything learned from one baseline run: quality report, statistics,
 * every fitted model and the one selected for scoring.
 *
 * When {@code established} is false only {@code reason} and {@code qualityReport}
 * are populated, and the analysis must not be used for scoring.
 */
public record BaselineAnalysis(
        boolean established,
        String reason,
        DataQualityReport qualityReport,
        BaselineStatistics statistics,
        Map<BaselineModelKind, BaselineModel> models,
        BaselineModel selectedModel,
        BaselinePeriod period
) {
    public static BaselineAnalysis notEstablished(String reason, DataQualityReport qualityReport) {
        return new BaselineAnalysis(false, reason, qualityReport, null, Map.of(), null, null);
    }

    public BaselineModelKind selectedKind() {
        return selectedModel != null ? selectedModel.kind() : null;
    }

    public record BaselinePeriod(
            Instant start,
            Instant end,
            int pointCount
    ) {}
}
