package com.btcdirection.feature.repository;

import com.btcdirection.feature.model.SentimentRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface SentimentRecordRepository extends ReactiveCrudRepository<SentimentRecord, LocalDate> {

    @Modifying
    @Query("""
        INSERT INTO daily_sentiment
            (obs_date, mean_sentiment, provenance, article_count, sent_3d, sent_5d,
             sent_vol, sent_delta, sent_accel, quantile_bucket, q2_flag, q5_flag, updated_at)
        VALUES
            (:obsDate, :meanSentiment, :provenance, :articleCount, :sent3d, :sent5d,
             :sentVol, :sentDelta, :sentAccel, :quantileBucket, :q2Flag, :q5Flag, NOW())
        ON CONFLICT (obs_date) DO UPDATE SET
            mean_sentiment  = EXCLUDED.mean_sentiment,
            provenance      = EXCLUDED.provenance,
            article_count   = EXCLUDED.article_count,
            sent_3d         = EXCLUDED.sent_3d,
            sent_5d         = EXCLUDED.sent_5d,
            sent_vol        = EXCLUDED.sent_vol,
            sent_delta      = EXCLUDED.sent_delta,
            sent_accel      = EXCLUDED.sent_accel,
            quantile_bucket = EXCLUDED.quantile_bucket,
            q2_flag         = EXCLUDED.q2_flag,
            q5_flag         = EXCLUDED.q5_flag,
            updated_at      = NOW()
        """)
    Mono<Void> upsert(LocalDate obsDate, double meanSentiment, String provenance, int articleCount,
                      Double sent3d, Double sent5d, Double sentVol, Double sentDelta, Double sentAccel,
                      int quantileBucket, boolean q2Flag, boolean q5Flag);
}
