package com.btcdirection.feature.repository;

import com.btcdirection.feature.model.MarketObservation;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface MarketObservationRepository extends ReactiveCrudRepository<MarketObservation, LocalDate> {

    @Query("""
        SELECT * FROM market_observation
        WHERE obs_date BETWEEN :from AND :through
        ORDER BY obs_date ASC
        """)
    Flux<MarketObservation> findBetween(LocalDate from, LocalDate through);

    /** First observation date on or after {@code from}; where a full run starts. */
    @Query("SELECT obs_date FROM market_observation WHERE obs_date >= :from ORDER BY obs_date ASC LIMIT 1")
    Mono<LocalDate> findFirstDateFrom(LocalDate from);
}
