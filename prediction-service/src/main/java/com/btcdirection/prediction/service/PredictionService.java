package com.btcdirection.prediction.service;

import com.btcdirection.common.ensemble.EnsembleEngine;
import com.btcdirection.common.exception.MissingUpstreamDataException;
import com.btcdirection.common.exception.NoViableModelComponentsException;
import com.btcdirection.common.exception.UpstreamWriteFailureException;
import com.btcdirection.common.feature.FeatureContract;
import com.btcdirection.common.model.ComponentOutput;
import com.btcdirection.common.model.ConfidenceLevel;
import com.btcdirection.common.model.EnsembleDecision;
import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.prediction.client.FeatureServiceClient;
import com.btcdirection.prediction.component.ModelComponentRegistry;
import com.btcdirection.prediction.dto.LatestDecision;
import com.btcdirection.prediction.dto.SystemStatus;
import com.btcdirection.prediction.model.EnsembleDecisionRecord;
import com.btcdirection.prediction.repository.EnsembleDecisionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Runs one prediction cycle and serves the stored decisions.
 *
 * <p>A cycle reads the latest complete feature rows, lets the ensemble decide and
 * upserts the decision by target date, so repeating a cycle on the same input
 * rewrites the same row.
 */
@Service
public class PredictionService {

    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);

    static final int MAX_HISTORY_DAYS = 365;
    static final String TABLE = "ensemble_decision";

    private static final TypeReference<List<ComponentOutput>> OUTPUTS = new TypeReference<>() {};

    private final FeatureServiceClient featureClient;
    private final ModelComponentRegistry registry;
    private final EnsembleEngine engine;
    private final EnsembleDecisionRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration minBackoff;

    public PredictionService(FeatureServiceClient featureClient,
                             ModelComponentRegistry registry,
                             EnsembleEngine engine,
                             EnsembleDecisionRepository repository,
                             ObjectMapper objectMapper,
                             Clock clock,
                             @Value("${prediction.store.retry.max-attempts:3}") int maxAttempts,
                             @Value("${prediction.store.retry.min-backoff-ms:200}") long minBackoffMs) {
        this.featureClient = featureClient;
        this.registry      = registry;
        this.engine        = engine;
        this.repository    = repository;
        this.objectMapper  = objectMapper;
        this.clock         = clock;
        this.maxAttempts   = Math.max(1, maxAttempts);
        this.minBackoff    = Duration.ofMillis(minBackoffMs);
    }

    /**
     * Decides the direction for the day after the latest feature row dated on or
     * before {@code asOf} (today in UTC when null).
     *
     * @throws MissingUpstreamDataException      (signalled) when no complete feature row exists
     * @throws NoViableModelComponentsException  (signalled) when no component produced a probability
     * @throws UpstreamWriteFailureException     (signalled) when the decision cannot be stored
     */
    public Mono<EnsembleDecision> predictNextDay(LocalDate asOf) {
        LocalDate effective = asOf != null ? asOf : today();
        int limit = registry.maxWindow();
        log.info("Prediction cycle started. asOf={} historyLimit={}", effective, limit);

        return featureClient.fetchLatest(effective, limit)
            .collectList()
            .map(PredictionService::completeRows)
            .flatMap(rows -> {
                if (rows.isEmpty()) {
                    return Mono.error(new MissingUpstreamDataException(
                        "features", "no complete feature row on or before " + effective));
                }
                return Mono.fromCallable(() -> engine.decide(rows, registry.components()))
                    .subscribeOn(Schedulers.boundedElastic());
            })
            .doOnNext(this::logOutcome)
            .doOnError(NoViableModelComponentsException.class, e ->
                log.error("Prediction cycle failed, no viable components. asOf={} outputs={}",
                          effective, describe(e.getOutputs())))
            .flatMap(this::store);
    }

    /** Stored decision whose target is tomorrow (UTC); empty when none exists. */
    public Mono<EnsembleDecision> tomorrow() {
        return repository.findById(today().plusDays(1)).map(this::toDecision);
    }

    /** Most recent stored decision; empty when the table is empty. */
    public Mono<LatestDecision> latest() {
        LocalDate today = today();
        return repository.findLatest()
            .map(r -> new LatestDecision(toDecision(r), r.getTargetDate().isAfter(today)));
    }

    /**
     * Decisions targeting the last {@code days} days or later, most recent first.
     *
     * @throws IllegalArgumentException when {@code days} is outside 1..365
     */
    public Flux<EnsembleDecision> history(int days) {
        if (days < 1 || days > MAX_HISTORY_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_HISTORY_DAYS + ", got " + days);
        }
        return repository.findSince(today().minusDays(days)).map(this::toDecision);
    }

    /** Whether tomorrow's decision exists, and the target date of the latest one. */
    public Mono<SystemStatus> status() {
        Mono<Boolean> hasTomorrow = repository.findById(today().plusDays(1)).hasElement();
        Mono<Optional<LocalDate>> latestTarget = repository.findLatest()
            .map(r -> Optional.of(r.getTargetDate()))
            .defaultIfEmpty(Optional.empty());
        return Mono.zip(hasTomorrow, latestTarget)
            .map(t -> new SystemStatus("OK", t.getT1(), t.getT2().orElse(null)));
    }

    static List<FeatureRow> completeRows(List<FeatureRow> rows) {
        FeatureContract contract = FeatureContract.v1();
        List<FeatureRow> complete = rows.stream()
            .filter(r -> contract.nullFeatures(r.features()).isEmpty())
            .collect(Collectors.toList());
        if (complete.size() < rows.size()) {
            log.warn("Incomplete feature rows skipped. received={} complete={}", rows.size(), complete.size());
        }
        return complete;
    }

    private Mono<EnsembleDecision> store(EnsembleDecision decision) {
        String components = writeComponents(decision);
        return Mono.defer(() -> repository.upsert(
                decision.targetDate(), decision.featureDate(), decision.direction(),
                decision.confidence(), decision.probabilityUp(), decision.threshold(),
                decision.confidenceLevel().name(), decision.contractVersion(), components))
            .retryWhen(Retry.backoff(maxAttempts - 1, minBackoff))
            .onErrorMap(e -> {
                Throwable cause = Exceptions.isRetryExhausted(e) ? e.getCause() : e;
                log.error("Decision write failed. targetDate={} attempts={} reason={}",
                          decision.targetDate(), maxAttempts, cause.getMessage());
                return new UpstreamWriteFailureException(TABLE, decision.targetDate(), cause);
            })
            .thenReturn(decision)
            .doOnSuccess(d -> log.info("Decision stored. targetDate={} direction={}",
                                       d.targetDate(), d.direction()));
    }

    private void logOutcome(EnsembleDecision decision) {
        decision.components().stream()
            .filter(o -> !o.status().contributed())
            .forEach(o -> log.warn("Component did not vote. component={} status={} detail={}",
                                   o.componentId(), o.status(), o.detail()));
        log.info("Ensemble decided. targetDate={} featureDate={} direction={} probabilityUp={} confidence={} level={}",
                 decision.targetDate(), decision.featureDate(), decision.direction(),
                 String.format("%.4f", decision.probabilityUp()),
                 String.format("%.4f", decision.confidence()), decision.confidenceLevel());
    }

    private static String describe(List<ComponentOutput> outputs) {
        return outputs.stream()
            .map(o -> o.componentId() + ":" + o.status())
            .collect(Collectors.joining(","));
    }

    private String writeComponents(EnsembleDecision decision) {
        try {
            return objectMapper.writeValueAsString(decision.components());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize component outputs for " + decision.targetDate(), e);
        }
    }

    EnsembleDecision toDecision(EnsembleDecisionRecord record) {
        List<ComponentOutput> outputs;
        try {
            outputs = record.getComponents() == null
                ? List.of()
                : objectMapper.readValue(record.getComponents(), OUTPUTS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot read component outputs for " + record.getTargetDate(), e);
        }
        return new EnsembleDecision(
            record.getTargetDate(),
            record.getFeatureDate(),
            record.getDirection(),
            record.getConfidence(),
            record.getProbabilityUp(),
            record.getThreshold(),
            ConfidenceLevel.valueOf(record.getConfidenceLevel()),
            record.getContractVersion(),
            outputs);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
