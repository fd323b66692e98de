package com.btcdirection.feature.repository;

import com.btcdirection.feature.model.FeatureRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface FeatureRecordRepository extends ReactiveCrudRepository<FeatureRecord, LocalDate> {

    /** Latest persisted feature date, the incremental watermark. Empty when the table is empty. */
    @Query("SELECT obs_date FROM feature_row ORDER BY obs_date DESC LIMIT 1")
    Mono<LocalDate> findLatestDate();

    /**
     * The {@code limit} most recent rows on or before {@code asOf}, returned oldest first.
     */
    @Query("""
        SELECT * FROM (
            SELECT * FROM feature_row
            WHERE obs_date <= :asOf
            ORDER BY obs_date DESC
            LIMIT :limit
        ) recent
        ORDER BY obs_date ASC
        """)
    Flux<FeatureRecord> findLatest(LocalDate asOf, int limit);

    @Modifying
    @Query("""
        INSERT INTO feature_row
            (obs_date, contract_version,
             btc_nasdaq_beta_10d, sent_q5_flag, roc_1d, high_low_range, roc_3d, sent_5d,
             sent_cross_up_x_high_low_range, btc_nasdaq_corr_5d, bb_width, sent_accel,
             sent_vol, sent_neg_x_high_low_range, sent_q2_flag_x_close_to_sma10,
             target_nextday, updated_at)
        VALUES
            (:obsDate, :contractVersion,
             :beta10d, :q5Flag, :roc1d, :highLowRange, :roc3d, :sent5d,
             :crossUpXRange, :corr5d, :bbWidth, :sentAccel,
             :sentVol, :negXRange, :q2XSmaRatio,
             :target, NOW())
        ON CONFLICT (obs_date) DO UPDATE SET
            contract_version               = EXCLUDED.contract_version,
            btc_nasdaq_beta_10d            = EXCLUDED.btc_nasdaq_beta_10d,
            sent_q5_flag                   = EXCLUDED.sent_q5_flag,
            roc_1d                         = EXCLUDED.roc_1d,
            high_low_range                 = EXCLUDED.high_low_range,
            roc_3d                         = EXCLUDED.roc_3d,
            sent_5d                        = EXCLUDED.sent_5d,
            sent_cross_up_x_high_low_range = EXCLUDED.sent_cross_up_x_high_low_range,
            btc_nasdaq_corr_5d             = EXCLUDED.btc_nasdaq_corr_5d,
            bb_width                       = EXCLUDED.bb_width,
            sent_accel                     = EXCLUDED.sent_accel,
            sent_vol                       = EXCLUDED.sent_vol,
            sent_neg_x_high_low_range      = EXCLUDED.sent_neg_x_high_low_range,
            sent_q2_flag_x_close_to_sma10  = EXCLUDED.sent_q2_flag_x_close_to_sma10,
            target_nextday                 = EXCLUDED.target_nextday,
            updated_at                     = NOW()
        """)
    Mono<Void> upsert(LocalDate obsDate, String contractVersion,
                      double beta10d, double q5Flag, double roc1d, double highLowRange,
                      double roc3d, double sent5d, double crossUpXRange, double corr5d,
                      double bbWidth, double sentAccel, double sentVol, double negXRange,
                      double q2XSmaRatio, Integer target);
}
