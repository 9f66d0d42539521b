package com.finops.costanomaly.detection;

import com.finops.costanomaly.baseline.BaselineAnalysis;
import com.finops.costanomaly.baseline.BaselineModel;
import com.finops.costanomaly.baseline.BaselineStatistics;
import com.finops.costanomaly.config.DetectionThresholds;
import com.finops.costanomaly.domain.model.Anomaly;
import com.finops.costanomaly.domain.model.AnomalySeverity;
import com.finops.costanomaly.domain.model.AnomalyType;
import com.finops.costanomaly.domain.model.CostDataPoint;
import com.finops.costanomaly.stats.CostStatistics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Replays a cost series against its selected baseline and flags anomalous points.
 *
 * SPIKE TEST (per point):
 * |deviation std| >= costSpikeThreshold, or deviation % >= percentageIncreaseThreshold,
 * or (actual - expected) >= absoluteCostThreshold. Severity follows |deviation std|.
 *
 * TREND TEST (trailing window of consecutiveAnomalyThreshold points):
 * least squares slope normalized by the baseline std dev must reach costTrendThreshold.
 * On top of that slope threshold, every step in the window must move in the slope's
 * direction, so a single outlier inside a flat window is a spike, not a trend.
 * When the trend test fires it decides the point's type only.
 *
 * SEVERITY:
 * Always the band of |deviation std|, whichever test flagged the point, so severity is
 * monotonic in |deviation std| across every anomaly of a run.
 *
 * A point is flagged at most once and never un-flagged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyScorer {

    private final DetectionThresholds thresholds;
    private final Clock clock;

    public List<Anomaly> score(List<CostDataPoint> series, BaselineAnalysis baseline, String region) {
        if (!baseline.established()) {
            throw new IllegalArgumentException("Cannot score against a baseline that was not established");
        }

        DetectionThresholds.AnomalyThresholds limits = thresholds.anomaly();
        BaselineModel model = baseline.selectedModel();
        BaselineStatistics stats = baseline.statistics();

        List<CostDataPoint> valued = series.stream().filter(CostDataPoint::hasCost).toList();
        double[] costs = valued.stream().mapToDouble(CostDataPoint::cost).toArray();

        Instant detectedAt = clock.instant();
        List<Anomaly> anomalies = new ArrayList<>();

        for (int i = 0; i < costs.length; i++) {
            double actual = costs[i];
            double expected = model.expectedAt(i);

            double deviationPercentage = expected != 0 ? (actual - expected) / expected * 100 : 0.0;
            double deviationStd = stats.deviationsFromMean(actual);

            AnomalyType type = null;
            Double trendSlope = null;

            if (Math.abs(deviationStd) >= limits.costSpikeThreshold()
                    || deviationPercentage >= limits.percentageIncreaseThreshold()
                    || (actual - expected) >= limits.absoluteCostThreshold()) {
                type = AnomalyType.COST_SPIKE;
            }

            int window = limits.consecutiveAnomalyThreshold();
            if (i >= window - 1) {
                TrendSignal trend = trendSignal(Arrays.copyOfRange(costs, i - window + 1, i + 1), stats);
                if (trend.fires(limits.costTrendThreshold())) {
                    type = AnomalyType.COST_TREND;
                    trendSlope = trend.slope();
                }
            }

            if (type != null) {
                anomalies.add(new Anomaly(
                        String.format(Locale.ROOT, "anomaly-%s-%d-%d", region, detectedAt.getEpochSecond(), anomalies.size()),
                        valued.get(i).timestamp(),
                        type,
                        severityFor(Math.abs(deviationStd)),
                        actual,
                        expected,
                        deviationPercentage,
                        deviationStd,
                        trendSlope,
                        model.kind(),
                        region,
                        detectedAt
                ));
            }
        }

        log.debug("Scored {} points against {} baseline: {} anomalies",
                costs.length, model.kind(), anomalies.size());
        return anomalies;
    }

    /**
     * Highest band whose cutoff is met; anything flagged below the LOW cutoff is still LOW.
     */
    AnomalySeverity severityFor(double magnitude) {
        DetectionThresholds.SeverityMapping bands = thresholds.severity();
        if (magnitude >= bands.criticalThreshold()) {
            return AnomalySeverity.CRITICAL;
        } else if (magnitude >= bands.highThreshold()) {
            return AnomalySeverity.HIGH;
        } else if (magnitude >= bands.mediumThreshold()) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    private TrendSignal trendSignal(double[] window, BaselineStatistics stats) {
        double slope = CostStatistics.linearFit(window).slope();
        return new TrendSignal(slope, normalizedSlope(window, stats), movesConsistently(window, slope));
    }

    /**
     * |least squares slope of the window| / baseline std dev; 0 for a flat baseline.
     */
    static double normalizedSlope(double[] window, BaselineStatistics stats) {
        double slope = CostStatistics.linearFit(window).slope();
        return stats.stdDev() > 0 ? Math.abs(slope) / stats.stdDev() : 0.0;
    }

    private static boolean movesConsistently(double[] window, double slope) {
        if (slope == 0) {
            return false;
        }
        for (int i = 1; i < window.length; i++) {
            double step = window[i] - window[i - 1];
            if (slope > 0 ? step <= 0 : step >= 0) {
                return false;
            }
        }
        return true;
    }

    private record TrendSignal(double slope, double normalizedSlope, boolean consistent) {
        boolean fires(double threshold) {
            return consistent && normalizedSlope >= threshold;
        }
    }
}
