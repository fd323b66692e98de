package com.btcdirection.feature.service;

import com.btcdirection.feature.client.SentimentScoringClient;
import com.btcdirection.feature.dto.ScoringReport;
import com.btcdirection.feature.model.NewsArticle;
import com.btcdirection.feature.repository.NewsArticleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Scores stored articles that have no sentiment yet.
 *
 * <p>Each article is scored independently with bounded concurrency. A failed call
 * or a score outside [-1, 1] leaves the article unscored for the next run; it
 * never fails the pass.
 */
@Service
public class ArticleScoringService {

    private static final Logger log = LoggerFactory.getLogger(ArticleScoringService.class);

    static final int MAX_TEXT_CHARS = 4000;

    private final NewsArticleRepository articleRepository;
    private final SentimentScoringClient scoringClient;
    private final boolean enabled;
    private final int batchSize;
    private final int concurrency;

    public ArticleScoringService(NewsArticleRepository articleRepository,
                                 SentimentScoringClient scoringClient,
                                 @Value("${sentiment.scoring.enabled:true}") boolean enabled,
                                 @Value("${sentiment.scoring.batch-size:500}") int batchSize,
                                 @Value("${sentiment.scoring.concurrency:4}") int concurrency) {
        this.articleRepository = articleRepository;
        this.scoringClient     = scoringClient;
        this.enabled           = enabled;
        this.batchSize         = batchSize;
        this.concurrency       = concurrency;
    }

    public Mono<ScoringReport> scorePending() {
        if (!enabled) {
            log.debug("Article scoring disabled");
            return Mono.just(ScoringReport.empty());
        }
        return articleRepository.findUnscored(batchSize)
            .flatMap(this::scoreOne, concurrency)
            .collectList()
            .map(results -> {
                int scored = (int) results.stream().filter(Boolean::booleanValue).count();
                return new ScoringReport(results.size(), scored, results.size() - scored);
            })
            .doOnNext(r -> {
                if (r.attempted() > 0) {
                    log.info("Article scoring complete. attempted={} scored={} failed={}",
                             r.attempted(), r.scored(), r.failed());
                }
            });
    }

    private Mono<Boolean> scoreOne(NewsArticle article) {
        String text = text(article);
        if (text.isEmpty()) {
            log.warn("Article has no text to score. id={} date={}", article.getId(), article.getPublishedDate());
            return Mono.just(false);
        }
        return scoringClient.score(text)
            .flatMap(score -> {
                if (!isValidScore(score)) {
                    log.warn("Rejected sentiment score. id={} date={} score={}",
                             article.getId(), article.getPublishedDate(), score);
                    return Mono.just(false);
                }
                return articleRepository.updateScore(article.getId(), score).thenReturn(true);
            })
            .defaultIfEmpty(false)
            .onErrorResume(e -> {
                log.warn("Article scoring failed. id={} date={} reason={}",
                         article.getId(), article.getPublishedDate(), e.getMessage());
                return Mono.just(false);
            });
    }

    static boolean isValidScore(Double score) {
        return score != null && Double.isFinite(score) && score >= -1.0 && score <= 1.0;
    }

    static String text(NewsArticle article) {
        StringBuilder sb = new StringBuilder();
        if (article.getTitle() != null && !article.getTitle().isBlank()) {
            sb.append(article.getTitle().trim());
        }
        if (article.getContent() != null && !article.getContent().isBlank()) {
            if (sb.length() > 0) sb.append(". ");
            sb.append(article.getContent().trim());
        }
        return sb.length() > MAX_TEXT_CHARS ? sb.substring(0, MAX_TEXT_CHARS) : sb.toString();
    }
}
