package com.btcdirection.feature.service;

import com.btcdirection.feature.client.SentimentScoringClient;
import com.btcdirection.feature.dto.ScoringReport;
import com.btcdirection.feature.model.NewsArticle;
import com.btcdirection.feature.repository.NewsArticleRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArticleScoringServiceTest {

    @Mock private NewsArticleRepository articleRepository;
    @Mock private SentimentScoringClient scoringClient;

    private static NewsArticle article(long id, String title, String content) {
        NewsArticle a = new NewsArticle();
        a.setId(id);
        a.setPublishedDate(LocalDate.of(2025, 5, 1));
        a.setTitle(title);
        a.setContent(content);
        return a;
    }

    @Test
    @DisplayName("Valid scores are stored, invalid or failed ones leave the article unscored")
    void mixedOutcomes() {
        when(articleRepository.findUnscored(500)).thenReturn(Flux.just(
            article(1, "ETF inflows surge", "Record week."),
            article(2, "Exchange hacked", null),
            article(3, "Miners capitulate", null),
            article(4, " ", null)));
        when(scoringClient.score("ETF inflows surge. Record week.")).thenReturn(Mono.just(0.7));
        when(scoringClient.score("Exchange hacked")).thenReturn(Mono.just(-1.4));
        when(scoringClient.score("Miners capitulate")).thenReturn(Mono.error(new IllegalStateException("503")));
        when(articleRepository.updateScore(1L, 0.7)).thenReturn(Mono.empty());

        ArticleScoringService service = new ArticleScoringService(articleRepository, scoringClient, true, 500, 1);

        StepVerifier.create(service.scorePending())
            .expectNext(new ScoringReport(4, 1, 3))
            .verifyComplete();

        verify(articleRepository).updateScore(1L, 0.7);
        verify(articleRepository, never()).updateScore(eq(2L), anyDouble());
    }

    @Test
    @DisplayName("Disabled scoring does not touch the store or the scorer")
    void disabled() {
        ArticleScoringService service = new ArticleScoringService(articleRepository, scoringClient, false, 500, 4);
        StepVerifier.create(service.scorePending())
            .expectNext(ScoringReport.empty())
            .verifyComplete();
        verifyNoInteractions(articleRepository, scoringClient);
    }

    @Test
    @DisplayName("Score bounds are inclusive and non-finite values are rejected")
    void bounds() {
        assertThat(ArticleScoringService.isValidScore(-1.0)).isTrue();
        assertThat(ArticleScoringService.isValidScore(1.0)).isTrue();
        assertThat(ArticleScoringService.isValidScore(Double.NaN)).isFalse();
        assertThat(ArticleScoringService.isValidScore(null)).isFalse();
    }

    @Test
    @DisplayName("Long text is truncated before scoring")
    void truncation() {
        String text = ArticleScoringService.text(article(9, "t", "x".repeat(10_000)));
        assertThat(text).hasSize(ArticleScoringService.MAX_TEXT_CHARS).startsWith("t. x");
    }
}
