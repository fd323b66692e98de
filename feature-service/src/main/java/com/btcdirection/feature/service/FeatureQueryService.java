package com.btcdirection.feature.service;

import com.btcdirection.common.feature.FeatureContract;
import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.feature.model.FeatureRecord;
import com.btcdirection.feature.repository.FeatureRecordRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read side of the feature table, used by the prediction service.
 */
@Service
public class FeatureQueryService {

    private final FeatureRecordRepository featureRepository;
    private final int maxLimit;

    public FeatureQueryService(FeatureRecordRepository featureRepository,
                               @Value("${feature.query.max-limit:1000}") int maxLimit) {
        this.featureRepository = featureRepository;
        this.maxLimit          = maxLimit;
    }

    /**
     * @return up to {@code limit} rows dated on or before {@code asOf}, oldest first
     */
    public Flux<FeatureRow> latest(LocalDate asOf, int limit) {
        if (limit < 1 || limit > maxLimit) {
            return Flux.error(new IllegalArgumentException(
                "limit must be between 1 and " + maxLimit + ", got " + limit));
        }
        return featureRepository.findLatest(asOf, limit).map(FeatureQueryService::toRow);
    }

    static FeatureRow toRow(FeatureRecord r) {
        Map<String, Double> f = new LinkedHashMap<>();
        f.put(FeatureContract.BTC_NASDAQ_BETA_10D,            r.getBtcNasdaqBeta10d());
        f.put(FeatureContract.SENT_Q5_FLAG,                   r.getSentQ5Flag());
        f.put(FeatureContract.ROC_1D,                         r.getRoc1d());
        f.put(FeatureContract.HIGH_LOW_RANGE,                 r.getHighLowRange());
        f.put(FeatureContract.ROC_3D,                         r.getRoc3d());
        f.put(FeatureContract.SENT_5D,                        r.getSent5d());
        f.put(FeatureContract.SENT_CROSS_UP_X_HIGH_LOW_RANGE, r.getSentCrossUpXHighLowRange());
        f.put(FeatureContract.BTC_NASDAQ_CORR_5D,             r.getBtcNasdaqCorr5d());
        f.put(FeatureContract.BB_WIDTH,                       r.getBbWidth());
        f.put(FeatureContract.SENT_ACCEL,                     r.getSentAccel());
        f.put(FeatureContract.SENT_VOL,                       r.getSentVol());
        f.put(FeatureContract.SENT_NEG_X_HIGH_LOW_RANGE,      r.getSentNegXHighLowRange());
        f.put(FeatureContract.SENT_Q2_FLAG_X_CLOSE_TO_SMA10,  r.getSentQ2FlagXCloseToSma10());
        return new FeatureRow(r.getObsDate(), r.getContractVersion(), f, r.getTargetNextday());
    }
}
