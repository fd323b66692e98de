package com.btcdirection.common.sentiment;

import java.util.Arrays;

/**
 * Equal-frequency bucketing of one value against a sample it belongs to.
 *
 * <p>Edges are the linear-interpolated sample quantiles at {@code k / q}. Equal
 * edges collapse, so a sample with few distinct values produces fewer buckets.
 * Intervals are right-closed and the lowest edge belongs to bucket 0. A sample
 * with a single distinct value maps everything to {@link #MIDDLE_BUCKET}.
 */
public final class QuantileBucketer {

    public static final int DEFAULT_BUCKETS = 5;
    public static final int MIDDLE_BUCKET   = 2;

    private QuantileBucketer() {}

    /**
     * @param sample  trailing values, any order, must contain {@code value}'s peers
     * @param value   the value to place
     * @param buckets requested bucket count
     * @return 0-based bucket index
     */
    public static int bucket(double[] sample, double value, int buckets) {
        if (sample == null || sample.length == 0) return MIDDLE_BUCKET;
        double[] sorted = Arrays.copyOf(sample, sample.length);
        Arrays.sort(sorted);

        int distinct = distinctCount(sorted);
        if (distinct <= 1) return MIDDLE_BUCKET;

        double[] edges = edges(sorted, Math.min(buckets, distinct));
        for (int j = 0; j < edges.length - 1; j++) {
            if (value <= edges[j + 1]) return j;
        }
        return edges.length - 2;
    }

    static double[] edges(double[] sorted, int q) {
        double[] raw = new double[q + 1];
        for (int k = 0; k <= q; k++) {
            raw[k] = quantile(sorted, (double) k / q);
        }
        double[] unique = new double[raw.length];
        int size = 0;
        for (double edge : raw) {
            if (size == 0 || edge != unique[size - 1]) unique[size++] = edge;
        }
        return Arrays.copyOf(unique, size);
    }

    static double quantile(double[] sorted, double p) {
        double position = p * (sorted.length - 1);
        int lo = (int) Math.floor(position);
        int hi = (int) Math.ceil(position);
        return sorted[lo] + (sorted[hi] - sorted[lo]) * (position - lo);
    }

    private static int distinctCount(double[] sorted) {
        int count = 0;
        for (int i = 0; i < sorted.length; i++) {
            if (i == 0 || sorted[i] != sorted[i - 1]) count++;
        }
        return count;
    }
}
