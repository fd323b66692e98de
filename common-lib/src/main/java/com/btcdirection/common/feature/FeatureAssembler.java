package com.btcdirection.common.feature;

import com.btcdirection.common.exception.IncompleteFeatureRowException;
import com.btcdirection.common.model.DailyIndicatorRow;
import com.btcdirection.common.model.DailySentimentRow;
import com.btcdirection.common.model.FeatureRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Joins indicator and sentiment rows on date and derives the contract features.
 *
 * <h3>Interaction features</h3>
 * <pre>
 *   sent_q2_flag_x_close_to_sma10  = q2Flag × close_to_sma10_ratio
 *   sent_cross_up_x_high_low_range = [sentiment > sent_3d ∧ sentiment > 0] × high_low_range
 *   sent_neg_x_high_low_range      = [sentiment < -0.2] × high_low_range
 * </pre>
 * Each is the exact product of its factors; a null factor makes the product null.
 *
 * <p>The join is inner: a date missing on either side produces nothing. A joined
 * date with any null contract feature is dropped and reported, never persisted
 * with partial values. Contract names without a dedicated extractor are read from
 * the indicator row's cross-asset columns.
 */
public final class FeatureAssembler {

    public static final double NEGATIVE_SENTIMENT_THRESHOLD = -0.2;

    /**
     * @param rows    complete rows, oldest first
     * @param dropped dates that joined but had null contract features
     */
    public record Assembly(List<FeatureRow> rows, List<IncompleteFeatureRowException> dropped) {}

    private record Joined(DailyIndicatorRow indicator, DailySentimentRow sentiment) {}

    private final FeatureContract contract;
    private final Map<String, Function<Joined, Double>> extractors;

    public FeatureAssembler(FeatureContract contract) {
        this.contract   = contract;
        this.extractors = extractors();
    }

    public FeatureContract contract() {
        return contract;
    }

    /**
     * @param indicators   indicator rows (any order)
     * @param sentiments   sentiment rows (any order)
     * @param closesByDate primary close per date, used for the next-day target
     */
    public Assembly assemble(List<DailyIndicatorRow> indicators,
                             List<DailySentimentRow> sentiments,
                             Map<LocalDate, Double> closesByDate) {
        Map<LocalDate, DailySentimentRow> sentimentByDate = new TreeMap<>();
        for (DailySentimentRow s : sentiments) sentimentByDate.put(s.date(), s);

        Map<LocalDate, DailyIndicatorRow> indicatorByDate = new TreeMap<>();
        for (DailyIndicatorRow r : indicators) indicatorByDate.put(r.date(), r);

        List<FeatureRow> rows = new ArrayList<>();
        List<IncompleteFeatureRowException> dropped = new ArrayList<>();

        for (Map.Entry<LocalDate, DailyIndicatorRow> entry : indicatorByDate.entrySet()) {
            DailySentimentRow sentiment = sentimentByDate.get(entry.getKey());
            if (sentiment == null) continue;

            Joined joined = new Joined(entry.getValue(), sentiment);
            Map<String, Double> features = new LinkedHashMap<>();
            for (String name : contract.names()) {
                Function<Joined, Double> extractor = extractors.get(name);
                features.put(name, extractor != null
                    ? extractor.apply(joined)
                    : joined.indicator().crossAssetValue(name));
            }

            try {
                contract.requireComplete(entry.getKey(), features);
            } catch (IncompleteFeatureRowException e) {
                dropped.add(e);
                continue;
            }
            rows.add(new FeatureRow(entry.getKey(), contract.version(), features,
                                    target(entry.getValue(), closesByDate)));
        }
        return new Assembly(rows, dropped);
    }

    static Integer target(DailyIndicatorRow row, Map<LocalDate, Double> closesByDate) {
        Double next = closesByDate.get(row.date().plusDays(1));
        if (next == null) return null;
        return next > row.close() ? 1 : 0;
    }

    static Double crossUpFlag(DailySentimentRow s) {
        if (s.sent3d() == null) return null;
        return flag(s.meanSentiment() > s.sent3d() && s.meanSentiment() > 0);
    }

    static Double negativeFlag(DailySentimentRow s) {
        return flag(s.meanSentiment() < NEGATIVE_SENTIMENT_THRESHOLD);
    }

    static Double product(Double a, Double b) {
        return (a == null || b == null) ? null : a * b;
    }

    private static Double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }

    private static Map<String, Function<Joined, Double>> extractors() {
        Map<String, Function<Joined, Double>> m = new LinkedHashMap<>();
        m.put(FeatureContract.ROC_1D,         j -> j.indicator().roc1d());
        m.put(FeatureContract.ROC_3D,         j -> j.indicator().roc3d());
        m.put(FeatureContract.HIGH_LOW_RANGE, j -> j.indicator().highLowRange());
        m.put(FeatureContract.BB_WIDTH,       j -> j.indicator().bbWidth());
        m.put(FeatureContract.SENT_5D,        j -> j.sentiment().sent5d());
        m.put(FeatureContract.SENT_ACCEL,     j -> j.sentiment().sentAccel());
        m.put(FeatureContract.SENT_VOL,       j -> j.sentiment().sentVol());
        m.put(FeatureContract.SENT_Q5_FLAG,   j -> flag(j.sentiment().q5Flag()));
        m.put(FeatureContract.SENT_Q2_FLAG_X_CLOSE_TO_SMA10,
            j -> product(flag(j.sentiment().q2Flag()), j.indicator().closeToSma10Ratio()));
        m.put(FeatureContract.SENT_CROSS_UP_X_HIGH_LOW_RANGE,
            j -> product(crossUpFlag(j.sentiment()), j.indicator().highLowRange()));
        m.put(FeatureContract.SENT_NEG_X_HIGH_LOW_RANGE,
            j -> product(negativeFlag(j.sentiment()), j.indicator().highLowRange()));
        return Map.copyOf(m);
    }
}
