package com.finops.costanomaly.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CostStatisticsTest {

    private static final double[] ONE_TO_TEN = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

    @Nested
    @DisplayName("Descriptive statistics")
    class DescriptiveTests {

        @Test
        @DisplayName("Should compute sample variance with an n - 1 denominator")
        void shouldComputeSampleVariance() {
            assertThat(CostStatistics.sampleVariance(new double[]{2, 4, 4, 4, 5, 5, 7, 9}))
                    .isCloseTo(32.0 / 7.0, within(1e-12));
            assertThat(CostStatistics.sampleVariance(new double[]{5})).isZero();
        }

        @Test
        @DisplayName("Should take the midpoint median of an even series")
        void shouldComputeMedian() {
            assertThat(CostStatistics.median(new double[]{4, 1, 3, 2})).isEqualTo(2.5);
            assertThat(CostStatistics.median(new double[]{7, 1, 3})).isEqualTo(3.0);
            assertThat(CostStatistics.median(new double[0])).isZero();
        }

        @Test
        @DisplayName("Should compute exclusive quartiles and deciles")
        void shouldComputeExclusiveQuantiles() {
            assertThat(CostStatistics.quantiles(ONE_TO_TEN, 4)).containsExactly(2.75, 5.5, 8.25);
            assertThat(CostStatistics.quantiles(ONE_TO_TEN, 10)[0]).isCloseTo(1.1, within(1e-12));
            assertThat(CostStatistics.quantiles(ONE_TO_TEN, 10)[8]).isCloseTo(9.9, within(1e-12));
        }
    }

    @Nested
    @DisplayName("Fits and fail-soft measures")
    class FitTests {

        @Test
        @DisplayName("Should recover an exact line")
        void shouldFitExactLine() {
            var fit = CostStatistics.linearFit(new double[]{3, 5, 7, 9});

            assertThat(fit.slope()).isCloseTo(2.0, within(1e-12));
            assertThat(fit.intercept()).isCloseTo(3.0, within(1e-12));
            assertThat(fit.valueAt(10)).isCloseTo(23.0, within(1e-12));
        }

        @Test
        @DisplayName("Should report correlation as failed for constant input")
        void shouldFailCorrelationOnZeroVariance() {
            var result = CostStatistics.pearson(new double[]{1, 2, 3}, new double[]{5, 5, 5});

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.orElse(0.0)).isZero();
        }

        @Test
        @DisplayName("Should correlate perfectly anti-correlated series at -1")
        void shouldCorrelateNegatively() {
            var result = CostStatistics.pearson(new double[]{1, 2, 3}, new double[]{6, 4, 2});

            assertThat(result.value()).isCloseTo(-1.0, within(1e-12));
        }

        @Test
        @DisplayName("Should skip zero actuals in MAPE and fail when all are zero")
        void shouldComputeMape() {
            var mape = CostStatistics.meanAbsolutePercentageError(
                    new double[]{0, 10, 20}, new double[]{5, 11, 18});

            assertThat(mape.value()).isCloseTo(10.0, within(1e-12));
            assertThat(CostStatistics.meanAbsolutePercentageError(new double[]{0, 0}, new double[]{1, 1})
                    .isSuccess()).isFalse();
        }
    }
}
