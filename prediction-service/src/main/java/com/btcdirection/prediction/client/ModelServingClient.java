package com.btcdirection.prediction.client;

import com.btcdirection.prediction.dto.PredictRequest;
import com.btcdirection.prediction.dto.PredictResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Calls the model-serving sidecar that hosts the serialized artifacts.
 * Each component posts to its own path and gets back {@code {"probabilityUp": p}}.
 */
@Component
public class ModelServingClient {

    private final WebClient modelServingClient;

    public ModelServingClient(@Qualifier("modelServingClient") WebClient modelServingClient) {
        this.modelServingClient = modelServingClient;
    }

    public Mono<Double> predict(String path, PredictRequest request) {
        return modelServingClient.post()
            .uri(path)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(PredictResponse.class)
            .flatMap(response -> response.probabilityUp() == null
                ? Mono.error(new IllegalStateException(
                    "model " + request.modelId() + " answered without probabilityUp"))
                : Mono.just(response.probabilityUp()));
    }
}
