package com.finops.costanomaly.baseline;

import com.finops.costanomaly.CostSeries;
import com.finops.costanomaly.domain.model.BaselineModelKind;
import com.finops.costanomaly.domain.model.CostDataPoint;
import com.finops.costanomaly.quality.DataQualityReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for BaselineEstimator.
 *
 * Test strategy:
 * 1. Model selection on flat, spiky, trending and hourly-seasonal series
 * 2. Shape of every fitted model (prediction length, parameters)
 * 3. Degenerate input (empty, single point, missing costs)
 */
class BaselineEstimatorTest {

    private BaselineEstimator estimator;

    @BeforeEach
    void setUp() {
        estimator = new BaselineEstimator();
    }

    @Nested
    @DisplayName("Model Selection Tests")
    class ModelSelectionTests {

        @Test
        @DisplayName("Should select moving average on a flat series when every model ties")
        void shouldBreakTiesByDeclarationOrder() {
            // When
            var analysis = estimator.estimate(CostSeries.flat(), report());

            // Then
            assertThat(analysis.established()).isTrue();
            assertThat(analysis.selectedKind()).isEqualTo(BaselineModelKind.MOVING_AVERAGE);
            assertThat(analysis.models().values())
                    .allSatisfy(model -> assertThat(model.score()).isCloseTo(60.0, within(1e-9)));
            assertThat(analysis.statistics().stdDev()).isZero();
            assertThat(analysis.models()).doesNotContainKey(BaselineModelKind.SEASONAL);
        }

        @Test
        @DisplayName("Should select the percentile model when a single spike distorts the moving average")
        void shouldSelectPercentileForSingleSpike() {
            // When
            var analysis = estimator.estimate(CostSeries.singleSpike(), report());

            // Then
            assertThat(analysis.selectedKind()).isEqualTo(BaselineModelKind.PERCENTILE);
            assertThat(analysis.selectedModel().score()).isCloseTo(58.775, within(1e-3));
            assertThat(analysis.models().get(BaselineModelKind.MOVING_AVERAGE).score())
                    .isCloseTo(54.008, within(1e-3));
            assertThat(analysis.statistics().mean()).isCloseTo(20.2083, within(1e-4));
            assertThat(analysis.statistics().stdDev()).isCloseTo(70.7254, within(1e-4));
        }

        @Test
        @DisplayName("Should select the linear trend for a steadily rising series")
        void shouldSelectLinearTrendForRamp() {
            // When
            var analysis = estimator.estimate(CostSeries.linearRamp(), report());

            // Then
            assertThat(analysis.selectedKind()).isEqualTo(BaselineModelKind.LINEAR_TREND);
            assertThat(analysis.selectedModel().accuracy()).isCloseTo(100.0, within(1e-6));
            var linear = (BaselineModel.LinearTrend) analysis.selectedModel();
            assertThat(linear.slope()).isCloseTo(200.0 / 199.0, within(1e-9));
            assertThat(linear.intercept()).isCloseTo(10.0, within(1e-9));
            assertThat(analysis.models()).containsKey(BaselineModelKind.SEASONAL);
        }

        @Test
        @DisplayName("Should select the seasonal model for a repeating hour-of-day pattern")
        void shouldSelectSeasonalForDailyCycle() {
            // Given eight days of hourly costs following the hour of day
            var series = CostSeries.series(192, Duration.ofHours(1), i -> 10.0 + (i % 24));

            // When
            var analysis = estimator.estimate(series, report());

            // Then
            assertThat(analysis.selectedKind()).isEqualTo(BaselineModelKind.SEASONAL);
            assertThat(analysis.selectedModel().score()).isCloseTo(100.0, within(1e-6));
            var seasonal = (BaselineModel.Seasonal) analysis.selectedModel();
            assertThat(seasonal.hourlyAverages()).hasSize(24).containsEntry(5, 15.0);
        }

        @Test
        @DisplayName("Should select the same model for identical input")
        void shouldBeDeterministic() {
            var first = estimator.estimate(CostSeries.singleSpike(), report());
            var second = estimator.estimate(CostSeries.singleSpike(), report());

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("Model Fitting Tests")
    class ModelFittingTests {

        @Test
        @DisplayName("Should produce one prediction per valued point for every model")
        void shouldMatchPredictionLength() {
            var analysis = estimator.estimate(CostSeries.linearRamp(), report());

            assertThat(analysis.models().values())
                    .allSatisfy(model -> assertThat(model.predictions()).hasSize(200));
        }

        @Test
        @DisplayName("Should average the trailing window including the current point")
        void shouldComputeTrailingMovingAverage() {
            // Given
            double[] costs = new double[30];
            for (int i = 0; i < costs.length; i++) costs[i] = i;

            // When
            var model = estimator.movingAverage(costs);

            // Then
            assertThat(model.windowSize()).isEqualTo(24);
            assertThat(model.predictions().get(0)).isEqualTo(0.0);
            assertThat(model.predictions().get(3)).isEqualTo(1.5);
            assertThat(model.predictions().get(29)).isEqualTo(17.5);
        }

        @Test
        @DisplayName("Should echo a single point with zero fit quality")
        void shouldEchoSinglePointTrend() {
            var model = estimator.linearTrend(new double[]{42.0});

            assertThat(model.predictions()).containsExactly(42.0);
            assertThat(model.slope()).isZero();
            assertThat(model.score()).isZero();
        }

        @Test
        @DisplayName("Should fall back to min and max for percentile bands on short series")
        void shouldUseExtremesForShortPercentiles() {
            var model = estimator.percentile(new double[]{5, 1, 9});

            assertThat(model.p50()).isEqualTo(5.0);
            assertThat(model.p10()).isEqualTo(1.0);
            assertThat(model.p25()).isEqualTo(1.0);
            assertThat(model.p75()).isEqualTo(9.0);
            assertThat(model.p90()).isEqualTo(9.0);
        }

        @Test
        @DisplayName("Should fit only points carrying a cost")
        void shouldIgnoreMissingCosts() {
            // Given
            var t = Instant.parse("2024-01-01T00:00:00Z");
            var series = List.of(
                    CostDataPoint.of(t, 10.0),
                    new CostDataPoint(t.plusSeconds(3600), null),
                    CostDataPoint.of(t.plusSeconds(7200), 20.0));

            // When
            var analysis = estimator.estimate(series, report());

            // Then
            assertThat(analysis.period().pointCount()).isEqualTo(2);
            assertThat(analysis.statistics().mean()).isEqualTo(15.0);
        }

        @Test
        @DisplayName("Should not establish a baseline without any cost value")
        void shouldRejectEmptySeries() {
            var analysis = estimator.estimate(List.of(), report());

            assertThat(analysis.established()).isFalse();
            assertThat(analysis.reason()).contains("no cost values");
            assertThat(analysis.models()).isEmpty();
        }

        @Test
        @DisplayName("Should pick the highest score from an explicit model set")
        void shouldSelectHighestScore() {
            // Given
            var low = new BaselineModel.MovingAverage(24, List.of(1.0), 10.0, 10.0);
            var high = new BaselineModel.Percentile(1, 1, 1, 1, 1, List.of(1.0), 90.0, 50.0);

            // When
            var best = estimator.selectBest(Map.of(
                    BaselineModelKind.MOVING_AVERAGE, low,
                    BaselineModelKind.PERCENTILE, high));

            // Then
            assertThat(best).isSameAs(high);
        }
    }

    private static DataQualityReport report() {
        return new DataQualityReport(true, null, 48, 48, 1.0, 47L, null, null);
    }
}
