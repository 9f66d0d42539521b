package com.finops.costanomaly.baseline;

import com.finops.costanomaly.domain.model.BaselineModelKind;

import java.util.List;
import java.util.Map;

/**
 * A fitted baseline: one expected cost per observation of the series it was fitted on.
 *
 * MODEL SCORING:
 * accuracy   = max(0, 100 - MAPE) over the fitted series
 * confidence = 100 * |pearson(actual, predicted)|
 * score      = 0.6 * accuracy + 0.4 * confidence
 *
 * Both inputs are on a 0-100 scale and collapse to 0 when undefined.
 */
public interface BaselineModel {

    double ACCURACY_WEIGHT = 0.6;
    double CONFIDENCE_WEIGHT = 0.4;

    BaselineModelKind kind();

    List<Double> predictions();

    double accuracy();

    double confidence();

    default double score() {
        return accuracy() * ACCURACY_WEIGHT + confidence() * CONFIDENCE_WEIGHT;
    }

    /**
     * Expected cost for an observation index. Indexes past the fitted range reuse the
     * last prediction unless the model knows how to extrapolate.
     */
    default double expectedAt(int index) {
        List<Double> predictions = predictions();
        if (predictions.isEmpty()) {
            return 0.0;
        }
        if (index < predictions.size()) {
            return predictions.get(index);
        }
        return predictions.get(predictions.size() - 1);
    }

    /**
     * Trailing mean over a fixed window, inclusive of the current point.
     */
    record MovingAverage(
            int windowSize,
            List<Double> predictions,
            double accuracy,
            double confidence
    ) implements BaselineModel {
        @Override
        public BaselineModelKind kind() {
            return BaselineModelKind.MOVING_AVERAGE;
        }
    }

    /**
     * Mean cost per hour of day (UTC), for series covering at least a week of hourly data.
     */
    record Seasonal(
            Map<Integer, Double> hourlyAverages,
            List<Double> predictions,
            double accuracy,
            double confidence
    ) implements BaselineModel {
        @Override
        public BaselineModelKind kind() {
            return BaselineModelKind.SEASONAL;
        }
    }

    /**
     * Least squares line of cost against observation index.
     */
    record LinearTrend(
            double slope,
            double intercept,
            List<Double> predictions,
            double accuracy,
            double confidence
    ) implements BaselineModel {
        @Override
        public BaselineModelKind kind() {
            return BaselineModelKind.LINEAR_TREND;
        }

        @Override
        public double expectedAt(int index) {
            if (predictions.isEmpty()) {
                return 0.0;
            }
            if (index < predictions.size()) {
                return predictions.get(index);
            }
            return intercept + slope * index;
        }
    }

    /**
     * Median for every point, with the surrounding percentile band kept for reporting.
     */
    record Percentile(
            double p10,
            double p25,
            double p50,
            double p75,
            double p90,
            List<Double> predictions,
            double accuracy,
            double confidence
    ) implements BaselineModel {
        @Override
        public BaselineModelKind kind() {
            return BaselineModelKind.PERCENTILE;
        }
    }
}
