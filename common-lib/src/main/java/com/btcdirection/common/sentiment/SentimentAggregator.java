package com.btcdirection.common.sentiment;

import com.btcdirection.common.indicator.RollingStatistics;
import com.btcdirection.common.indicator.SeriesGapFiller;
import com.btcdirection.common.model.DailySentimentRow;
import com.btcdirection.common.model.SentimentProvenance;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reduces article-level scores to one {@link DailySentimentRow} per calendar day.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Mean of the day's article scores; days without articles stay empty.</li>
 *   <li>Gap fill: forward-fill (seeded with the carried-in mean, when given),
 *       backward-fill, linear interpolation, and {@value #NEUTRAL_SENTIMENT} when
 *       nothing at all was observed. After the first two passes only an all-empty
 *       series still has gaps, so the linear pass never changes a value in this
 *       order; it stays so a reordered fill keeps interior gaps bounded by their
 *       neighbours.</li>
 *   <li>Rolling fields on the filled series: 3d / 5d mean, 5d sample std,
 *       first and second difference.</li>
 *   <li>Quantile bucket of each day against its trailing {@code quantileWindow} days.</li>
 * </ol>
 */
public final class SentimentAggregator {

    public static final double NEUTRAL_SENTIMENT = 0.0;

    static final int SHORT_WINDOW = 3;
    static final int LONG_WINDOW  = 5;
    static final int Q2_BUCKET    = 1;
    static final int Q5_BUCKET    = 4;

    private final int quantileWindow;

    public SentimentAggregator(int quantileWindow) {
        if (quantileWindow < 1) {
            throw new IllegalArgumentException("quantile window must be >= 1, got " + quantileWindow);
        }
        this.quantileWindow = quantileWindow;
    }

    public int quantileWindow() {
        return quantileWindow;
    }

    /**
     * @param from          first day, inclusive
     * @param to            last day, inclusive
     * @param scoresByDate  article scores per day; missing keys mean no articles
     * @return one row per day in {@code [from, to]}, oldest first
     */
    public List<DailySentimentRow> aggregate(LocalDate from, LocalDate to,
                                             Map<LocalDate, List<Double>> scoresByDate) {
        return aggregate(from, to, scoresByDate, null);
    }

    /**
     * Aggregates a range that continues an earlier series.
     *
     * <p>{@code carriedMean} is the daily mean of the last observed day before
     * {@code from}. Leading empty days are forward-filled from it, exactly as they
     * would be if the range had been aggregated together with its past.
     *
     * @param carriedMean last observed daily mean before {@code from}; {@code null} when none
     */
    public List<DailySentimentRow> aggregate(LocalDate from, LocalDate to,
                                             Map<LocalDate, List<Double>> scoresByDate,
                                             Double carriedMean) {
        if (to.isBefore(from)) return List.of();

        List<LocalDate> days = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) days.add(d);
        int n = days.size();

        Double[] observed = new Double[n];
        int[] counts = new int[n];
        for (int i = 0; i < n; i++) {
            List<Double> scores = scoresByDate.getOrDefault(days.get(i), List.of());
            counts[i] = scores.size();
            observed[i] = dailyMean(scores);
        }

        Double[] filled = fill(observed, carriedMean);

        Double[] delta = new Double[n];
        for (int i = 1; i < n; i++) delta[i] = filled[i] - filled[i - 1];

        List<DailySentimentRow> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            int bucket = QuantileBucketer.bucket(trailing(filled, i), filled[i],
                                                 QuantileBucketer.DEFAULT_BUCKETS);
            rows.add(new DailySentimentRow(
                days.get(i),
                filled[i],
                observed[i] != null ? SentimentProvenance.OBSERVED : SentimentProvenance.INTERPOLATED,
                counts[i],
                RollingStatistics.mean(filled, i, SHORT_WINDOW),
                RollingStatistics.mean(filled, i, LONG_WINDOW),
                RollingStatistics.sampleStdDev(filled, i, LONG_WINDOW),
                delta[i],
                (i >= 2) ? delta[i] - delta[i - 1] : null,
                bucket,
                bucket == Q2_BUCKET,
                bucket == Q5_BUCKET));
        }
        return rows;
    }

    /** Mean of one day's article scores in the given order; {@code null} when empty. */
    public static Double dailyMean(List<Double> scores) {
        if (scores.isEmpty()) return null;
        double sum = 0;
        for (double s : scores) sum += s;
        return sum / scores.size();
    }

    static Double[] fill(Double[] observed, Double carriedMean) {
        Double[] seeded = new Double[observed.length + 1];
        seeded[0] = carriedMean;
        System.arraycopy(observed, 0, seeded, 1, observed.length);

        Double[] filled = Arrays.copyOfRange(SeriesGapFiller.interpolateLinear(
            SeriesGapFiller.backwardFill(SeriesGapFiller.forwardFill(seeded))), 1, seeded.length);
        for (int i = 0; i < filled.length; i++) {
            if (filled[i] == null) filled[i] = NEUTRAL_SENTIMENT;
        }
        return filled;
    }

    private double[] trailing(Double[] series, int end) {
        int start = Math.max(0, end - quantileWindow + 1);
        double[] sample = new double[end - start + 1];
        for (int i = start; i <= end; i++) sample[i - start] = series[i];
        return sample;
    }
}
