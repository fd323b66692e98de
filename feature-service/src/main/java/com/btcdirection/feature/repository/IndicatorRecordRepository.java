package com.btcdirection.feature.repository;

import com.btcdirection.feature.model.IndicatorRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface IndicatorRecordRepository extends ReactiveCrudRepository<IndicatorRecord, LocalDate> {

    /**
     * Upsert by date. Re-derived rows overwrite the stored values.
     */
    @Modifying
    @Query("""
        INSERT INTO daily_indicator
            (obs_date, close, close_to_sma10_ratio, high_low_range, roc_1d, roc_3d,
             bb_width, volume_change_1d, cross_asset, updated_at)
        VALUES
            (:obsDate, :close, :closeToSma10Ratio, :highLowRange, :roc1d, :roc3d,
             :bbWidth, :volumeChange1d, :crossAsset, NOW())
        ON CONFLICT (obs_date) DO UPDATE SET
            close                = EXCLUDED.close,
            close_to_sma10_ratio = EXCLUDED.close_to_sma10_ratio,
            high_low_range       = EXCLUDED.high_low_range,
            roc_1d               = EXCLUDED.roc_1d,
            roc_3d               = EXCLUDED.roc_3d,
            bb_width             = EXCLUDED.bb_width,
            volume_change_1d     = EXCLUDED.volume_change_1d,
            cross_asset          = EXCLUDED.cross_asset,
            updated_at           = NOW()
        """)
    Mono<Void> upsert(LocalDate obsDate, double close, Double closeToSma10Ratio, Double highLowRange,
                      Double roc1d, Double roc3d, Double bbWidth, Double volumeChange1d,
                      String crossAsset);
}
