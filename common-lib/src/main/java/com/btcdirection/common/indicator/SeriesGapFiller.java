package com.btcdirection.common.indicator;

import java.util.Arrays;

/**
 * Gap filling for nullable, evenly spaced series. Each method returns a new array
 * and never touches its input.
 */
public final class SeriesGapFiller {

    private SeriesGapFiller() {}

    public static Double[] forwardFill(Double[] series) {
        Double[] out = Arrays.copyOf(series, series.length);
        Double last = null;
        for (int i = 0; i < out.length; i++) {
            if (out[i] == null) out[i] = last;
            else last = out[i];
        }
        return out;
    }

    public static Double[] backwardFill(Double[] series) {
        Double[] out = Arrays.copyOf(series, series.length);
        Double next = null;
        for (int i = out.length - 1; i >= 0; i--) {
            if (out[i] == null) out[i] = next;
            else next = out[i];
        }
        return out;
    }

    /**
     * Linear interpolation across interior null runs. Leading and trailing runs
     * have only one anchor and stay null.
     */
    public static Double[] interpolateLinear(Double[] series) {
        Double[] out = Arrays.copyOf(series, series.length);
        int lastKnown = -1;
        for (int i = 0; i < out.length; i++) {
            if (out[i] == null) continue;
            if (lastKnown >= 0 && i - lastKnown > 1) {
                double start = out[lastKnown];
                double step  = (out[i] - start) / (i - lastKnown);
                for (int j = lastKnown + 1; j < i; j++) {
                    out[j] = start + step * (j - lastKnown);
                }
            }
            lastKnown = i;
        }
        return out;
    }

    /**
     * Reference-asset calendar alignment: forward-fill, then linear interpolation,
     * then backward-fill for a leading gap.
     */
    public static Double[] alignToCalendar(Double[] series) {
        return backwardFill(interpolateLinear(forwardFill(series)));
    }

    public static boolean isEntirelyMissing(Double[] series) {
        for (Double v : series) {
            if (v != null) return false;
        }
        return true;
    }
}
