package com.btcdirection.common.indicator;

/**
 * Pure trailing-window calculations over oldest-first series.
 *
 * <p>Every window ends at index {@code end} inclusive and covers {@code window}
 * observations. A result is {@code null} when the window reaches before index 0,
 * contains a {@code null}, or would not be a finite number. Dispersion measures
 * use the sample (n - 1) estimator. Summation always runs oldest to newest so
 * repeated runs over the same input produce bit-identical results.
 */
public final class RollingStatistics {

    private RollingStatistics() {}

    // ── central tendency ────────────────────────────────────────────────────

    public static Double mean(Double[] series, int end, int window) {
        if (!covers(series, end, window)) return null;
        double sum = 0;
        for (int i = end - window + 1; i <= end; i++) sum += series[i];
        return finite(sum / window);
    }

    // ── dispersion ──────────────────────────────────────────────────────────

    public static Double sampleVariance(Double[] series, int end, int window) {
        return sampleCovariance(series, series, end, window);
    }

    public static Double sampleStdDev(Double[] series, int end, int window) {
        Double variance = sampleVariance(series, end, window);
        return variance == null ? null : finite(Math.sqrt(variance));
    }

    public static Double sampleCovariance(Double[] x, Double[] y, int end, int window) {
        if (window < 2 || !covers(x, end, window) || !covers(y, end, window)) return null;
        Double meanX = mean(x, end, window);
        Double meanY = mean(y, end, window);
        if (meanX == null || meanY == null) return null;
        double acc = 0;
        for (int i = end - window + 1; i <= end; i++) {
            acc += (x[i] - meanX) * (y[i] - meanY);
        }
        return finite(acc / (window - 1));
    }

    /**
     * Pearson correlation over the window; {@code null} when either side has zero variance.
     */
    public static Double pearson(Double[] x, Double[] y, int end, int window) {
        Double cov = sampleCovariance(x, y, end, window);
        Double sx  = sampleStdDev(x, end, window);
        Double sy  = sampleStdDev(y, end, window);
        if (cov == null || sx == null || sy == null) return null;
        return divide(cov, sx * sy);
    }

    // ── point helpers ───────────────────────────────────────────────────────

    /**
     * Fractional change {@code series[end] / series[end - lag] - 1}.
     */
    public static Double change(Double[] series, int end, int lag) {
        if (end - lag < 0 || end >= series.length) return null;
        Double current  = series[end];
        Double previous = series[end - lag];
        if (current == null || previous == null) return null;
        Double ratio = divide(current, previous);
        return ratio == null ? null : ratio - 1.0;
    }

    public static Double divide(Double numerator, Double denominator) {
        if (numerator == null || denominator == null || denominator == 0.0) return null;
        return finite(numerator / denominator);
    }

    public static Double finite(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private static boolean covers(Double[] series, int end, int window) {
        if (series == null || window < 1 || end >= series.length || end - window + 1 < 0) return false;
        for (int i = end - window + 1; i <= end; i++) {
            if (series[i] == null) return false;
        }
        return true;
    }
}
