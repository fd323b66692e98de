package com.btcdirection.common.feature;

import com.btcdirection.common.exception.IncompleteFeatureRowException;
import com.btcdirection.common.model.FeatureRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The fixed, named, ordered set of scalar inputs every persisted {@link FeatureRow}
 * carries. Version {@value #V1} holds 13 features.
 */
public final class FeatureContract {

    public static final String V1 = "v1";

    public static final String BTC_NASDAQ_BETA_10D            = "btc_nasdaq_beta_10d";
    public static final String SENT_Q5_FLAG                   = "sent_q5_flag";
    public static final String ROC_1D                         = "roc_1d";
    public static final String HIGH_LOW_RANGE                 = "high_low_range";
    public static final String ROC_3D                         = "roc_3d";
    public static final String SENT_5D                        = "sent_5d";
    public static final String SENT_CROSS_UP_X_HIGH_LOW_RANGE = "sent_cross_up_x_high_low_range";
    public static final String BTC_NASDAQ_CORR_5D             = "btc_nasdaq_corr_5d";
    public static final String BB_WIDTH                       = "bb_width";
    public static final String SENT_ACCEL                     = "sent_accel";
    public static final String SENT_VOL                       = "sent_vol";
    public static final String SENT_NEG_X_HIGH_LOW_RANGE      = "sent_neg_x_high_low_range";
    public static final String SENT_Q2_FLAG_X_CLOSE_TO_SMA10  = "sent_q2_flag_x_close_to_sma10";

    private static final FeatureContract V1_CONTRACT = new FeatureContract(V1, List.of(
        BTC_NASDAQ_BETA_10D,
        SENT_Q5_FLAG,
        ROC_1D,
        HIGH_LOW_RANGE,
        ROC_3D,
        SENT_5D,
        SENT_CROSS_UP_X_HIGH_LOW_RANGE,
        BTC_NASDAQ_CORR_5D,
        BB_WIDTH,
        SENT_ACCEL,
        SENT_VOL,
        SENT_NEG_X_HIGH_LOW_RANGE,
        SENT_Q2_FLAG_X_CLOSE_TO_SMA10
    ));

    private final String version;
    private final List<String> names;

    FeatureContract(String version, List<String> names) {
        this.version = version;
        this.names   = List.copyOf(names);
    }

    public static FeatureContract v1() {
        return V1_CONTRACT;
    }

    public String version() {
        return version;
    }

    public List<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    /**
     * @return contract names whose value is absent or null, in contract order
     */
    public List<String> nullFeatures(Map<String, Double> features) {
        List<String> missing = new ArrayList<>();
        for (String name : names) {
            if (features.get(name) == null) missing.add(name);
        }
        return missing;
    }

    /**
     * @throws IncompleteFeatureRowException when any contract feature is null
     */
    public void requireComplete(LocalDate date, Map<String, Double> features) {
        List<String> missing = nullFeatures(features);
        if (!missing.isEmpty()) {
            throw new IncompleteFeatureRowException(date, missing);
        }
    }

    /**
     * Values of {@code row} in contract order.
     */
    public double[] vector(FeatureRow row) {
        requireComplete(row.date(), row.features());
        double[] out = new double[names.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = row.features().get(names.get(i));
        }
        return out;
    }
}
