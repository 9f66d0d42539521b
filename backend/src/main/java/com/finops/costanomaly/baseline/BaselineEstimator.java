package com.finops.costanomaly.baseline;

import com.finops.costanomaly.domain.model.BaselineModelKind;
import com.finops.costanomaly.domain.model.CostDataPoint;
import com.finops.costanomaly.quality.DataQualityReport;
import com.finops.costanomaly.stats.ComputationResult;
import com.finops.costanomaly.stats.CostStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fits competing baseline models to a validated cost series and selects the best one.
 *
 * MODELS:
 * 1. Moving average over the trailing 24 points (or the whole series if shorter)
 * 2. Seasonal hour-of-day averages, only with at least one week of hourly data
 * 3. Linear trend by least squares against the observation index
 * 4. Percentile: the median for every point
 *
 * SELECTION:
 * Highest {@link BaselineModel#score()} wins. Ties go to the model declared first in
 * {@link BaselineModelKind}, which keeps selection reproducible for identical input.
 */
@Service
@Slf4j
public class BaselineEstimator {

    static final int MOVING_AVERAGE_WINDOW = 24;
    static final int SEASONAL_MINIMUM_POINTS = 168;

    public BaselineAnalysis estimate(List<CostDataPoint> series, DataQualityReport qualityReport) {
        List<CostDataPoint> valued = series.stream()
                .filter(CostDataPoint::hasCost)
                .toList();

        if (valued.isEmpty()) {
            return BaselineAnalysis.notEstablished(
                    "Baseline not established: series has no cost values", qualityReport);
        }

        double[] costs = valued.stream().mapToDouble(CostDataPoint::cost).toArray();
        List<Instant> timestamps = valued.stream().map(CostDataPoint::timestamp).toList();

        BaselineStatistics statistics = BaselineStatistics.of(costs);

        Map<BaselineModelKind, BaselineModel> models = new EnumMap<>(BaselineModelKind.class);
        models.put(BaselineModelKind.MOVING_AVERAGE, movingAverage(costs));
        if (costs.length >= SEASONAL_MINIMUM_POINTS) {
            models.put(BaselineModelKind.SEASONAL, seasonal(costs, timestamps));
        }
        models.put(BaselineModelKind.LINEAR_TREND, linearTrend(costs));
        models.put(BaselineModelKind.PERCENTILE, percentile(costs));

        BaselineModel selected = selectBest(models);

        log.info("Baseline established from {} points: selected {} (score {})",
                costs.length, selected.kind(), String.format(Locale.ROOT, "%.2f", selected.score()));

        return new BaselineAnalysis(
                true,
                null,
                qualityReport,
                statistics,
                Collections.unmodifiableMap(models),
                selected,
                new BaselineAnalysis.BaselinePeriod(
                        timestamps.get(0), timestamps.get(timestamps.size() - 1), costs.length)
        );
    }

    BaselineModel.MovingAverage movingAverage(double[] costs) {
        int window = Math.min(MOVING_AVERAGE_WINDOW, costs.length);

        List<Double> predictions = new ArrayList<>(costs.length);
        for (int i = 0; i < costs.length; i++) {
            int start = Math.max(0, i - window + 1);
            double sum = 0;
            for (int j = start; j <= i; j++) {
                sum += costs[j];
            }
            predictions.add(sum / (i - start + 1));
        }

        return new BaselineModel.MovingAverage(
                window, List.copyOf(predictions),
                accuracy(BaselineModelKind.MOVING_AVERAGE, costs, predictions),
                confidence(BaselineModelKind.MOVING_AVERAGE, costs, predictions));
    }

    BaselineModel.Seasonal seasonal(double[] costs, List<Instant> timestamps) {
        Map<Integer, List<Double>> costsByHour = new TreeMap<>();
        for (int i = 0; i < costs.length; i++) {
            costsByHour.computeIfAbsent(hourOf(timestamps.get(i)), h -> new ArrayList<>()).add(costs[i]);
        }

        Map<Integer, Double> hourlyAverages = new TreeMap<>();
        costsByHour.forEach((hour, hourCosts) -> hourlyAverages.put(hour,
                hourCosts.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)));

        double globalMean = CostStatistics.mean(costs);
        List<Double> predictions = new ArrayList<>(costs.length);
        for (Instant timestamp : timestamps) {
            predictions.add(hourlyAverages.getOrDefault(hourOf(timestamp), globalMean));
        }

        return new BaselineModel.Seasonal(
                Collections.unmodifiableMap(hourlyAverages), List.copyOf(predictions),
                accuracy(BaselineModelKind.SEASONAL, costs, predictions),
                confidence(BaselineModelKind.SEASONAL, costs, predictions));
    }

    BaselineModel.LinearTrend linearTrend(double[] costs) {
        if (costs.length < 2) {
            // a single point has no trend; echo it back with zero fit quality
            List<Double> echo = new ArrayList<>();
            for (double cost : costs) echo.add(cost);
            double intercept = costs.length == 1 ? costs[0] : 0.0;
            return new BaselineModel.LinearTrend(0.0, intercept, List.copyOf(echo), 0.0, 0.0);
        }

        CostStatistics.LinearFit fit = CostStatistics.linearFit(costs);
        List<Double> predictions = new ArrayList<>(costs.length);
        for (int i = 0; i < costs.length; i++) {
            predictions.add(fit.valueAt(i));
        }

        return new BaselineModel.LinearTrend(
                fit.slope(), fit.intercept(), List.copyOf(predictions),
                accuracy(BaselineModelKind.LINEAR_TREND, costs, predictions),
                confidence(BaselineModelKind.LINEAR_TREND, costs, predictions));
    }

    BaselineModel.Percentile percentile(double[] costs) {
        double median = CostStatistics.median(costs);
        double min = CostStatistics.min(costs);
        double max = CostStatistics.max(costs);
        double[] deciles = costs.length >= 10 ? CostStatistics.quantiles(costs, 10) : null;
        double[] quartiles = costs.length >= 4 ? CostStatistics.quantiles(costs, 4) : null;

        List<Double> predictions = Collections.nCopies(costs.length, median);

        return new BaselineModel.Percentile(
                deciles != null ? deciles[0] : min,
                quartiles != null ? quartiles[0] : min,
                median,
                quartiles != null ? quartiles[2] : max,
                deciles != null ? deciles[8] : max,
                predictions,
                accuracy(BaselineModelKind.PERCENTILE, costs, predictions),
                confidence(BaselineModelKind.PERCENTILE, costs, predictions));
    }

    BaselineModel selectBest(Map<BaselineModelKind, BaselineModel> models) {
        BaselineModel best = null;
        for (BaselineModelKind kind : BaselineModelKind.values()) {
            BaselineModel candidate = models.get(kind);
            if (candidate == null) {
                continue;
            }
            log.debug("Baseline model {}: accuracy={}, confidence={}, score={}",
                    kind, candidate.accuracy(), candidate.confidence(), candidate.score());
            if (best == null || candidate.score() > best.score()) {
                best = candidate;
            }
        }
        if (best == null) {
            throw new IllegalStateException("No baseline models were fitted");
        }
        return best;
    }

    private double accuracy(BaselineModelKind kind, double[] actual, List<Double> predicted) {
        ComputationResult mape = CostStatistics.meanAbsolutePercentageError(actual, toArray(predicted));
        if (!mape.isSuccess()) {
            log.debug("Accuracy of {} undefined ({}), using 0", kind, mape.failure());
        }
        return mape.isSuccess() ? Math.max(0.0, 100.0 - mape.value()) : 0.0;
    }

    private double confidence(BaselineModelKind kind, double[] actual, List<Double> predicted) {
        ComputationResult correlation = CostStatistics.pearson(actual, toArray(predicted));
        if (!correlation.isSuccess()) {
            log.debug("Confidence of {} undefined ({}), using 0", kind, correlation.failure());
        }
        return Math.min(100.0, Math.abs(correlation.orElse(0.0)) * 100.0);
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static int hourOf(Instant timestamp) {
        return timestamp.atZone(ZoneOffset.UTC).getHour();
    }
}
