package com.btcdirection.feature.client;

import com.btcdirection.feature.dto.ScoreRequest;
import com.btcdirection.feature.dto.ScoreResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Calls the sentiment-scoring sidecar: {@code POST /score {"text": ...}} → {@code {"score": s}}.
 *
 * <p>The classifier itself is a black box here. Errors propagate to the caller,
 * which decides whether the article stays unscored.
 */
@Component
public class SentimentScoringClient {

    private static final Logger log = LoggerFactory.getLogger(SentimentScoringClient.class);

    private final WebClient sentimentScorerClient;
    private final Duration timeout;

    public SentimentScoringClient(@Qualifier("sentimentScorerClient") WebClient sentimentScorerClient,
                                  @Value("${sentiment.scoring.timeout-ms:10000}") long timeoutMs) {
        this.sentimentScorerClient = sentimentScorerClient;
        this.timeout = Duration.ofMillis(timeoutMs);
    }

    /**
     * @return the raw score; empty when the sidecar answered without one
     */
    public Mono<Double> score(String text) {
        return sentimentScorerClient.post()
            .uri("/score")
            .bodyValue(new ScoreRequest(text))
            .retrieve()
            .bodyToMono(ScoreResponse.class)
            .timeout(timeout)
            .flatMap(response -> Mono.justOrEmpty(response.score()))
            .doOnError(e -> log.debug("Sentiment scorer call failed. chars={} reason={}",
                                      text.length(), e.getMessage()));
    }
}
