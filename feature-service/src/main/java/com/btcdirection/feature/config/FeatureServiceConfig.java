package com.btcdirection.feature.config;

import com.btcdirection.common.feature.FeatureAssembler;
import com.btcdirection.common.feature.FeatureContract;
import com.btcdirection.common.indicator.IndicatorEngine;
import com.btcdirection.common.sentiment.SentimentAggregator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

@Configuration
public class FeatureServiceConfig {

    @Value("${services.sentiment-scorer.base-url}")
    private String sentimentScorerUrl;

    @Value("${feature.primary-asset:btc}")
    private String primaryAsset;

    @Value("${feature.reference-assets:nasdaq}")
    private List<String> referenceAssets;

    @Value("${indicator.sma-window:10}")
    private int smaWindow;

    @Value("${indicator.bb-window:20}")
    private int bbWindow;

    @Value("${indicator.corr-window:5}")
    private int corrWindow;

    @Value("${indicator.beta-window:10}")
    private int betaWindow;

    @Value("${sentiment.quantile-window:90}")
    private int quantileWindow;

    @Bean
    public WebClient sentimentScorerClient(WebClient.Builder builder) {
        return builder.baseUrl(sentimentScorerUrl).build();
    }

    @Bean
    public IndicatorEngine indicatorEngine() {
        return new IndicatorEngine(primaryAsset, referenceAssets,
            new IndicatorEngine.Windows(smaWindow, bbWindow, corrWindow, betaWindow));
    }

    @Bean
    public SentimentAggregator sentimentAggregator() {
        return new SentimentAggregator(quantileWindow);
    }

    @Bean
    public FeatureAssembler featureAssembler() {
        return new FeatureAssembler(FeatureContract.v1());
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
