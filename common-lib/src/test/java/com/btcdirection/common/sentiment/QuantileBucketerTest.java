package com.btcdirection.common.sentiment;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuantileBucketerTest {

    private static final double[] ONE_TO_TEN = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

    @Test
    @DisplayName("Largest value lands in the top quintile")
    void topBucket() {
        assertEquals(4, QuantileBucketer.bucket(ONE_TO_TEN, 10, 5));
    }

    @Test
    @DisplayName("Smallest value belongs to bucket 0")
    void lowestEdge() {
        assertEquals(0, QuantileBucketer.bucket(ONE_TO_TEN, 1, 5));
    }

    @Test
    @DisplayName("Intervals are right-closed on interpolated edges")
    void interiorValue() {
        // edges 1, 2.8, 4.6, 6.4, 8.2, 10
        assertEquals(1, QuantileBucketer.bucket(ONE_TO_TEN, 3, 5));
        assertEquals(2, QuantileBucketer.bucket(ONE_TO_TEN, 4.6, 5));
    }

    @Test
    @DisplayName("Few distinct values collapse the bucket count")
    void collapsedEdges() {
        double[] sample = {1, 1, 2, 2, 3, 3};
        assertEquals(2, QuantileBucketer.bucket(sample, 3, 5));
        assertEquals(0, QuantileBucketer.bucket(sample, 1, 5));
    }

    @Test
    @DisplayName("Degenerate samples map to the middle bucket")
    void degenerate() {
        assertEquals(QuantileBucketer.MIDDLE_BUCKET, QuantileBucketer.bucket(new double[]{0.3, 0.3}, 0.3, 5));
        assertEquals(QuantileBucketer.MIDDLE_BUCKET, QuantileBucketer.bucket(new double[0], 0.3, 5));
    }

    @Test
    @DisplayName("Sample order does not matter")
    void orderIndependent() {
        double[] shuffled = {7, 3, 10, 1, 5, 9, 2, 8, 4, 6};
        assertEquals(QuantileBucketer.bucket(ONE_TO_TEN, 6, 5), QuantileBucketer.bucket(shuffled, 6, 5));
    }
}
