package com.finops.costanomaly.rootcause;

import com.finops.costanomaly.domain.model.Anomaly;

/**
 * An anomaly together with the root cause analysis attached to it.
 */
public record AnalyzedAnomaly(
        Anomaly anomaly,
        RootCauseAnalysis rootCause
) {}
