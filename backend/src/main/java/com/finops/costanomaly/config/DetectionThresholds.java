package com.finops.costanomaly.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Numeric cutoffs for baseline construction, anomaly scoring, severity banding and
 * root cause attribution.
 *
 * Bound once from {@code anomaly.detection.*} and never mutated afterwards.
 * Every group falls back to its defaults when omitted from configuration.
 *
 * VALIDATION:
 * Invalid values (negative or non-finite thresholds, unordered severity bands,
 * ratios outside [0,1]) throw {@link IllegalArgumentException} from the constructor,
 * which aborts application startup rather than surfacing on a detection call.
 */
@ConfigurationProperties(prefix = "anomaly.detection")
public record DetectionThresholds(
        @DefaultValue BaselineRequirements baseline,
        @DefaultValue AnomalyThresholds anomaly,
        @DefaultValue SeverityMapping severity,
        @DefaultValue RootCauseSettings rootCause
) {

    public DetectionThresholds {
        if (baseline == null) baseline = BaselineRequirements.DEFAULTS;
        if (anomaly == null) anomaly = AnomalyThresholds.DEFAULTS;
        if (severity == null) severity = SeverityMapping.DEFAULTS;
        if (rootCause == null) rootCause = RootCauseSettings.DEFAULTS;
    }

    public static DetectionThresholds defaults() {
        return new DetectionThresholds(null, null, null, null);
    }

    /**
     * Minimum history required before a baseline is trusted.
     */
    public record BaselineRequirements(
            @DefaultValue("14") int minHistoricalDays,
            @DefaultValue("30") int optimalHistoricalDays,
            @DefaultValue("24") int minDataPoints,
            @DefaultValue("0.8") double dataQualityThreshold
    ) {
        public static final BaselineRequirements DEFAULTS = new BaselineRequirements(14, 30, 24, 0.8);

        public BaselineRequirements {
            requirePositive("minHistoricalDays", minHistoricalDays);
            requirePositive("optimalHistoricalDays", optimalHistoricalDays);
            requirePositive("minDataPoints", minDataPoints);
            if (!Double.isFinite(dataQualityThreshold) || dataQualityThreshold < 0 || dataQualityThreshold > 1) {
                throw new IllegalArgumentException(
                        "dataQualityThreshold must be within [0,1]: " + dataQualityThreshold);
            }
        }
    }

    /**
     * Triggers for spike and trend classification.
     */
    public record AnomalyThresholds(
            @DefaultValue("2.0") double costSpikeThreshold,
            @DefaultValue("1.5") double costTrendThreshold,
            @DefaultValue("50.0") double percentageIncreaseThreshold,
            @DefaultValue("100.0") double absoluteCostThreshold,
            @DefaultValue("3") int consecutiveAnomalyThreshold
    ) {
        public static final AnomalyThresholds DEFAULTS = new AnomalyThresholds(2.0, 1.5, 50.0, 100.0, 3);

        public AnomalyThresholds {
            requireNonNegative("costSpikeThreshold", costSpikeThreshold);
            requireNonNegative("costTrendThreshold", costTrendThreshold);
            requireNonNegative("percentageIncreaseThreshold", percentageIncreaseThreshold);
            requireNonNegative("absoluteCostThreshold", absoluteCostThreshold);
            // a trend needs at least two points to have a slope
            if (consecutiveAnomalyThreshold < 2) {
                throw new IllegalArgumentException(
                        "consecutiveAnomalyThreshold must be at least 2: " + consecutiveAnomalyThreshold);
            }
        }
    }

    /**
     * Standard deviation cutoffs per severity band, strictly ascending.
     */
    public record SeverityMapping(
            @DefaultValue("1.5") double lowThreshold,
            @DefaultValue("2.0") double mediumThreshold,
            @DefaultValue("3.0") double highThreshold,
            @DefaultValue("4.0") double criticalThreshold
    ) {
        public static final SeverityMapping DEFAULTS = new SeverityMapping(1.5, 2.0, 3.0, 4.0);

        public SeverityMapping {
            requireNonNegative("lowThreshold", lowThreshold);
            requireNonNegative("mediumThreshold", mediumThreshold);
            requireNonNegative("highThreshold", highThreshold);
            requireNonNegative("criticalThreshold", criticalThreshold);
            if (!(lowThreshold < mediumThreshold && mediumThreshold < highThreshold
                    && highThreshold < criticalThreshold)) {
                throw new IllegalArgumentException(String.format(
                        "Severity thresholds must be strictly ascending: %s < %s < %s < %s",
                        lowThreshold, mediumThreshold, highThreshold, criticalThreshold));
            }
        }
    }

    /**
     * Attribution cutoffs and the analysis window around an anomaly.
     */
    public record RootCauseSettings(
            @DefaultValue("20.0") double serviceContributionThreshold,
            @DefaultValue("10.0") double resourceContributionThreshold,
            @DefaultValue("24") int timeWindowHours,
            @DefaultValue("0.1") double windowTrendSlopeThreshold
    ) {
        public static final RootCauseSettings DEFAULTS = new RootCauseSettings(20.0, 10.0, 24, 0.1);

        public RootCauseSettings {
            requireNonNegative("serviceContributionThreshold", serviceContributionThreshold);
            requireNonNegative("resourceContributionThreshold", resourceContributionThreshold);
            requirePositive("timeWindowHours", timeWindowHours);
            requireNonNegative("windowTrendSlopeThreshold", windowTrendSlopeThreshold);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(name + " must be a non-negative number: " + value);
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }
}
