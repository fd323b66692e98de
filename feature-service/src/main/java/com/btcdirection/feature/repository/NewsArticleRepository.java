package com.btcdirection.feature.repository;

import com.btcdirection.feature.model.NewsArticle;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

@Repository
public interface NewsArticleRepository extends ReactiveCrudRepository<NewsArticle, Long> {

    /** Oldest unscored articles first, so a backlog drains in date order. */
    @Query("""
        SELECT * FROM news_article
        WHERE sentiment_score IS NULL
        ORDER BY published_date ASC, id ASC
        LIMIT :limit
        """)
    Flux<NewsArticle> findUnscored(int limit);

    @Query("""
        SELECT * FROM news_article
        WHERE sentiment_score IS NOT NULL
          AND published_date BETWEEN :from AND :through
        ORDER BY published_date ASC, id ASC
        """)
    Flux<NewsArticle> findScoredBetween(LocalDate from, LocalDate through);

    /** Latest day in {@code [floor, before)} with at least one scored article. */
    @Query("""
        SELECT published_date FROM news_article
        WHERE sentiment_score IS NOT NULL
          AND published_date >= :floor
          AND published_date < :before
        ORDER BY published_date DESC
        LIMIT 1
        """)
    Mono<LocalDate> findLastScoredDateBefore(LocalDate floor, LocalDate before);

    @Modifying
    @Query("""
        UPDATE news_article
        SET sentiment_score = :score,
            scored_at       = NOW()
        WHERE id = :id
        """)
    Mono<Void> updateScore(Long id, double score);
}
