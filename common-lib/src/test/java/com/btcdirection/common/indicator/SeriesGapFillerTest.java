package com.btcdirection.common.indicator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeriesGapFillerTest {

    @Test
    @DisplayName("forward fill carries the last value and leaves a leading gap")
    void forwardFill() {
        Double[] out = SeriesGapFiller.forwardFill(new Double[] {null, 1.0, null, null, 4.0});
        assertArrayEquals(new Double[] {null, 1.0, 1.0, 1.0, 4.0}, out);
    }

    @Test
    @DisplayName("backward fill takes the next value")
    void backwardFill() {
        Double[] out = SeriesGapFiller.backwardFill(new Double[] {null, null, 2.0, null});
        assertArrayEquals(new Double[] {2.0, 2.0, 2.0, null}, out);
    }

    @Test
    @DisplayName("linear interpolation fills interior runs only")
    void linear() {
        Double[] out = SeriesGapFiller.interpolateLinear(new Double[] {null, 0.0, null, null, 3.0, null});
        assertNull(out[0]);
        assertEquals(1.0, out[2], 1e-12);
        assertEquals(2.0, out[3], 1e-12);
        assertNull(out[5]);
    }

    @Test
    @DisplayName("calendar alignment leaves no null when one value exists")
    void alignToCalendar() {
        Double[] out = SeriesGapFiller.alignToCalendar(new Double[] {null, null, 10.0, null, null, 13.0, null});
        assertArrayEquals(new Double[] {10.0, 10.0, 10.0, 10.0, 10.0, 13.0, 13.0}, out);
    }

    @Test
    @DisplayName("input array is never mutated")
    void inputUntouched() {
        Double[] input = {null, 1.0};
        SeriesGapFiller.alignToCalendar(input);
        assertNull(input[0]);
    }

    @Test
    @DisplayName("entirely missing series is detected")
    void entirelyMissing() {
        assertTrue(SeriesGapFiller.isEntirelyMissing(new Double[] {null, null}));
        assertFalse(SeriesGapFiller.isEntirelyMissing(new Double[] {null, 0.0}));
    }
}
