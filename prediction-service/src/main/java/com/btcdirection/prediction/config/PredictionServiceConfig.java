package com.btcdirection.prediction.config;

import com.btcdirection.common.ensemble.EnsembleEngine;
import com.btcdirection.common.ensemble.WeightedProbabilityEnsemble;
import com.btcdirection.common.feature.FeatureContract;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class PredictionServiceConfig {

    @Value("${services.feature.base-url}")
    private String featureServiceUrl;

    @Value("${services.model-serving.base-url}")
    private String modelServingUrl;

    @Bean
    public WebClient featureServiceClient(WebClient.Builder builder) {
        return builder.baseUrl(featureServiceUrl).build();
    }

    @Bean
    public WebClient modelServingClient(WebClient.Builder builder) {
        return builder.baseUrl(modelServingUrl).build();
    }

    @Bean
    public EnsembleEngine ensembleEngine(EnsembleProperties properties) {
        return new WeightedProbabilityEnsemble(FeatureContract.v1(), properties.getThreshold());
    }

    /** All calendar-day boundaries are UTC. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
