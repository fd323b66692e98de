package com.btcdirection.prediction.repository;

import com.btcdirection.prediction.model.EnsembleDecisionRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface EnsembleDecisionRepository extends ReactiveCrudRepository<EnsembleDecisionRecord, LocalDate> {

    @Query("SELECT * FROM ensemble_decision ORDER BY target_date DESC LIMIT 1")
    Mono<EnsembleDecisionRecord> findLatest();

    /** Decisions with {@code target_date >= from}, most recent first. */
    @Query("SELECT * FROM ensemble_decision WHERE target_date >= :from ORDER BY target_date DESC")
    Flux<EnsembleDecisionRecord> findSince(LocalDate from);

    @Modifying
    @Query("""
        INSERT INTO ensemble_decision
            (target_date, feature_date, direction, confidence, probability_up, threshold,
             confidence_level, contract_version, components, updated_at)
        VALUES
            (:targetDate, :featureDate, :direction, :confidence, :probabilityUp, :threshold,
             :confidenceLevel, :contractVersion, :components, NOW())
        ON CONFLICT (target_date) DO UPDATE SET
            feature_date     = EXCLUDED.feature_date,
            direction        = EXCLUDED.direction,
            confidence       = EXCLUDED.confidence,
            probability_up   = EXCLUDED.probability_up,
            threshold        = EXCLUDED.threshold,
            confidence_level = EXCLUDED.confidence_level,
            contract_version = EXCLUDED.contract_version,
            components       = EXCLUDED.components,
            updated_at       = NOW()
        """)
    Mono<Void> upsert(LocalDate targetDate, LocalDate featureDate, int direction, double confidence,
                      double probabilityUp, double threshold, String confidenceLevel,
                      String contractVersion, String components);
}
