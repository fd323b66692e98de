package com.btcdirection.feature.repository;

import com.btcdirection.feature.model.ReferenceClose;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDate;

@Repository
public interface ReferenceCloseRepository extends ReactiveCrudRepository<ReferenceClose, Long> {

    @Query("""
        SELECT * FROM reference_close
        WHERE asset = :asset
          AND obs_date BETWEEN :from AND :through
        ORDER BY obs_date ASC
        """)
    Flux<ReferenceClose> findBetween(String asset, LocalDate from, LocalDate through);
}
