package com.btcdirection.prediction.client;

import com.btcdirection.common.exception.PipelineException;
import com.btcdirection.common.model.FeatureRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.LocalDate;

/**
 * Reads persisted feature rows from feature-service.
 */
@Component
public class FeatureServiceClient {

    private static final Logger log = LoggerFactory.getLogger(FeatureServiceClient.class);

    private final WebClient featureServiceClient;

    public FeatureServiceClient(@Qualifier("featureServiceClient") WebClient featureServiceClient) {
        this.featureServiceClient = featureServiceClient;
    }

    /**
     * @return up to {@code limit} rows dated on or before {@code asOf}, oldest first
     */
    public Flux<FeatureRow> fetchLatest(LocalDate asOf, int limit) {
        return featureServiceClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/features")
                .queryParam("asOf", asOf)
                .queryParam("limit", limit)
                .build())
            .retrieve()
            .bodyToFlux(FeatureRow.class)
            .onErrorMap(e -> !(e instanceof PipelineException), e -> {
                log.warn("Feature fetch failed. asOf={} limit={} reason={}", asOf, limit, e.getMessage());
                return new PipelineException("features", "feature rows unavailable: " + e.getMessage(), e);
            });
    }
}
