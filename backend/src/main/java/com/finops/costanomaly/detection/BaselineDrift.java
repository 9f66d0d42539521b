package com.finops.costanomaly.detection;

import com.finops.costanomaly.baseline.BaselineAnalysis;
import com.finops.costanomaly.domain.model.BaselineModelKind;

/**
 * How the region's baseline moved since the previous run.
 * {@code meanShiftPercentage} is 0 when the previous mean was 0.
 */
public record BaselineDrift(
        BaselineModelKind previousModel,
        BaselineModelKind currentModel,
        boolean modelChanged,
        double previousMean,
        double currentMean,
        double meanShiftPercentage
) {
    static BaselineDrift between(BaselineAnalysis previous, BaselineAnalysis current) {
        double previousMean = previous.statistics().mean();
        double currentMean = current.statistics().mean();
        return new BaselineDrift(
                previous.selectedKind(),
                current.selectedKind(),
                previous.selectedKind() != current.selectedKind(),
                previousMean,
                currentMean,
                previousMean != 0 ? (currentMean - previousMean) / previousMean * 100 : 0.0
        );
    }
}
