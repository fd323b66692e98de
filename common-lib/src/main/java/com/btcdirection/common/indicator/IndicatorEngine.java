package com.btcdirection.common.indicator;

import com.btcdirection.common.model.DailyIndicatorRow;
import com.btcdirection.common.model.DailyMarketObservation;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link DailyIndicatorRow}s from an oldest-first daily market series.
 *
 * <h3>Indicators</h3>
 * <pre>
 *   close_to_sma10_ratio = close / SMA(close, sma)
 *   high_low_range       = (high - low) / close
 *   roc_1d, roc_3d       = (close[t] / close[t-k] - 1) * 100
 *   bb_width             = ((MA20 + 2σ20) - (MA20 - 2σ20)) / MA20
 *   volume_change_1d     = volume[t] / volume[t-1] - 1
 *   {p}_{ref}_corr_5d    = pearson(ret, refRet) over the correlation window
 *   {p}_{ref}_beta_10d   = cov(ret, refRet) / var(refRet) over the beta window
 * </pre>
 *
 * <p>Rows are emitted only from the first index where every primary-asset window
 * is full. Reference closes are aligned to the primary calendar with
 * {@link SeriesGapFiller#alignToCalendar}; a reference with no observation at all
 * is dropped from the output columns rather than zero-filled.
 *
 * <p>Stateless and deterministic: identical input yields bit-identical rows.
 */
public final class IndicatorEngine {

    public record Windows(int sma, int bollinger, int correlation, int beta) {

        public Windows {
            if (sma < 1 || bollinger < 2 || correlation < 2 || beta < 2) {
                throw new IllegalArgumentException("invalid indicator windows: " + this);
            }
        }

        public static Windows defaults() {
            return new Windows(10, 20, 5, 10);
        }

        /** Index of the first row whose windows are all populated. */
        public int firstCompleteIndex() {
            int needed = Math.max(Math.max(sma, bollinger), Math.max(correlation + 1, beta + 1));
            return Math.max(needed, ROC_LONG + 1) - 1;
        }
    }

    static final int ROC_SHORT = 1;
    static final int ROC_LONG  = 3;

    private final String primaryKey;
    private final List<String> referenceKeys;
    private final Windows windows;

    public IndicatorEngine(String primaryKey, List<String> referenceKeys, Windows windows) {
        this.primaryKey    = primaryKey;
        this.referenceKeys = List.copyOf(referenceKeys);
        this.windows       = windows;
    }

    public Windows windows() {
        return windows;
    }

    public String correlationColumn(String referenceKey) {
        return primaryKey + "_" + referenceKey + "_corr_" + windows.correlation() + "d";
    }

    public String betaColumn(String referenceKey) {
        return primaryKey + "_" + referenceKey + "_beta_" + windows.beta() + "d";
    }

    /**
     * @param observations oldest-first, strictly increasing dates
     * @return one row per date with complete windows; empty when history is too short
     */
    public List<DailyIndicatorRow> compute(List<DailyMarketObservation> observations) {
        requireOrdered(observations);
        int n = observations.size();
        int first = windows.firstCompleteIndex();
        if (n <= first) return List.of();

        Double[] close  = new Double[n];
        Double[] volume = new Double[n];
        for (int i = 0; i < n; i++) {
            close[i]  = observations.get(i).close();
            volume[i] = observations.get(i).volume();
        }
        Double[] returns = returns(close);

        Map<String, Double[]> referenceReturns = new LinkedHashMap<>();
        for (String ref : referenceKeys) {
            Double[] raw = new Double[n];
            for (int i = 0; i < n; i++) {
                raw[i] = observations.get(i).referenceCloses().get(ref);
            }
            if (SeriesGapFiller.isEntirelyMissing(raw)) continue;
            referenceReturns.put(ref, returns(SeriesGapFiller.alignToCalendar(raw)));
        }

        List<DailyIndicatorRow> rows = new ArrayList<>(n - first);
        for (int i = first; i < n; i++) {
            DailyMarketObservation obs = observations.get(i);

            Double sma      = RollingStatistics.mean(close, i, windows.sma());
            Double ma       = RollingStatistics.mean(close, i, windows.bollinger());
            Double sd       = RollingStatistics.sampleStdDev(close, i, windows.bollinger());
            Double bbWidth  = (ma == null || sd == null)
                ? null
                : RollingStatistics.divide((ma + 2 * sd) - (ma - 2 * sd), ma);

            Map<String, Double> crossAsset = new LinkedHashMap<>();
            for (Map.Entry<String, Double[]> ref : referenceReturns.entrySet()) {
                Double[] refRet = ref.getValue();
                crossAsset.put(correlationColumn(ref.getKey()),
                    RollingStatistics.pearson(returns, refRet, i, windows.correlation()));
                crossAsset.put(betaColumn(ref.getKey()),
                    RollingStatistics.divide(
                        RollingStatistics.sampleCovariance(returns, refRet, i, windows.beta()),
                        RollingStatistics.sampleVariance(refRet, i, windows.beta())));
            }

            rows.add(new DailyIndicatorRow(
                obs.date(),
                obs.close(),
                RollingStatistics.divide(close[i], sma),
                RollingStatistics.divide(obs.high() - obs.low(), close[i]),
                percent(RollingStatistics.change(close, i, ROC_SHORT)),
                percent(RollingStatistics.change(close, i, ROC_LONG)),
                bbWidth,
                RollingStatistics.change(volume, i, 1),
                crossAsset));
        }
        return rows;
    }

    private static Double[] returns(Double[] prices) {
        Double[] out = new Double[prices.length];
        for (int i = 1; i < prices.length; i++) {
            out[i] = RollingStatistics.change(prices, i, 1);
        }
        return out;
    }

    private static Double percent(Double fraction) {
        return fraction == null ? null : RollingStatistics.finite(fraction * 100);
    }

    private static void requireOrdered(List<DailyMarketObservation> observations) {
        LocalDate previous = null;
        for (DailyMarketObservation obs : observations) {
            if (obs.date() == null) {
                throw new IllegalArgumentException("market observation without date");
            }
            if (previous != null && !obs.date().isAfter(previous)) {
                throw new IllegalArgumentException(
                    "market observations must be strictly ordered by date: " + previous + " then " + obs.date());
            }
            previous = obs.date();
        }
    }
}
