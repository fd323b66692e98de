package com.btcdirection.common.indicator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RollingStatisticsTest {

    private static final Double[] ONE_TO_FIVE = {1.0, 2.0, 3.0, 4.0, 5.0};

    @Nested
    @DisplayName("mean()")
    class MeanTests {

        @Test
        @DisplayName("trailing window ending at index")
        void trailingWindow() {
            assertEquals(4.0, RollingStatistics.mean(ONE_TO_FIVE, 4, 3));
        }

        @Test
        @DisplayName("window reaching before index 0 → null")
        void insufficientHistory() {
            assertNull(RollingStatistics.mean(ONE_TO_FIVE, 1, 3));
        }

        @Test
        @DisplayName("null inside window → null")
        void nullInsideWindow() {
            Double[] series = {1.0, null, 3.0};
            assertNull(RollingStatistics.mean(series, 2, 3));
            assertEquals(3.0, RollingStatistics.mean(series, 2, 1));
        }
    }

    @Nested
    @DisplayName("dispersion")
    class DispersionTests {

        @Test
        @DisplayName("sample variance uses n - 1")
        void sampleVariance() {
            assertEquals(2.5, RollingStatistics.sampleVariance(ONE_TO_FIVE, 4, 5), 1e-12);
        }

        @Test
        @DisplayName("covariance of perfectly scaled series")
        void covariance() {
            Double[] doubled = {2.0, 4.0, 6.0, 8.0, 10.0};
            assertEquals(5.0, RollingStatistics.sampleCovariance(ONE_TO_FIVE, doubled, 4, 5), 1e-12);
        }

        @Test
        @DisplayName("pearson of perfectly anti-correlated series → -1")
        void pearsonNegative() {
            Double[] reversed = {5.0, 4.0, 3.0, 2.0, 1.0};
            assertEquals(-1.0, RollingStatistics.pearson(ONE_TO_FIVE, reversed, 4, 5), 1e-12);
        }

        @Test
        @DisplayName("pearson against a constant series → null, never NaN")
        void pearsonZeroVariance() {
            Double[] flat = {3.0, 3.0, 3.0, 3.0, 3.0};
            assertNull(RollingStatistics.pearson(ONE_TO_FIVE, flat, 4, 5));
        }

        @Test
        @DisplayName("window of one has no sample variance")
        void singleObservation() {
            assertNull(RollingStatistics.sampleVariance(ONE_TO_FIVE, 4, 1));
        }
    }

    @Nested
    @DisplayName("point helpers")
    class PointTests {

        @Test
        @DisplayName("change over lag")
        void change() {
            assertEquals(1.5, RollingStatistics.change(ONE_TO_FIVE, 4, 3), 1e-12);
        }

        @Test
        @DisplayName("divide by zero → null")
        void divideByZero() {
            assertNull(RollingStatistics.divide(1.0, 0.0));
            assertNull(RollingStatistics.divide(null, 2.0));
        }

        @Test
        @DisplayName("non-finite → null")
        void nonFinite() {
            assertNull(RollingStatistics.finite(Double.POSITIVE_INFINITY));
            assertNull(RollingStatistics.finite(Double.NaN));
            assertEquals(1.0, RollingStatistics.finite(1.0));
        }
    }
}
