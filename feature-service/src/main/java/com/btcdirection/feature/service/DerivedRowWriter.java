package com.btcdirection.feature.service;

import com.btcdirection.common.exception.UpstreamWriteFailureException;
import com.btcdirection.common.feature.FeatureContract;
import com.btcdirection.common.model.DailyIndicatorRow;
import com.btcdirection.common.model.DailySentimentRow;
import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.feature.repository.FeatureRecordRepository;
import com.btcdirection.feature.repository.IndicatorRecordRepository;
import com.btcdirection.feature.repository.SentimentRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Upserts derived rows one date at a time.
 *
 * <p>Writes are sequential in date order. Each write is retried with backoff; a
 * write that still fails is logged as an {@link UpstreamWriteFailureException}
 * and counted, and the remaining dates are still written.
 */
@Component
public class DerivedRowWriter {

    private static final Logger log = LoggerFactory.getLogger(DerivedRowWriter.class);

    /**
     * @param written the rows that reached the store, in write order
     */
    public record WriteResult<T>(String table, List<T> written, int failed) {}

    private final IndicatorRecordRepository indicatorRepository;
    private final SentimentRecordRepository sentimentRepository;
    private final FeatureRecordRepository featureRepository;
    private final ObjectMapper objectMapper;
    private final int maxAttempts;
    private final Duration minBackoff;

    public DerivedRowWriter(IndicatorRecordRepository indicatorRepository,
                            SentimentRecordRepository sentimentRepository,
                            FeatureRecordRepository featureRepository,
                            ObjectMapper objectMapper,
                            @Value("${feature.store.retry.max-attempts:3}") int maxAttempts,
                            @Value("${feature.store.retry.min-backoff-ms:200}") long minBackoffMs) {
        this.indicatorRepository = indicatorRepository;
        this.sentimentRepository = sentimentRepository;
        this.featureRepository   = featureRepository;
        this.objectMapper        = objectMapper;
        this.maxAttempts         = maxAttempts;
        this.minBackoff          = Duration.ofMillis(minBackoffMs);
    }

    public Mono<WriteResult<DailyIndicatorRow>> writeIndicators(List<DailyIndicatorRow> rows) {
        return write("daily_indicator", rows, DailyIndicatorRow::date, r -> indicatorRepository.upsert(
            r.date(), r.close(), r.closeToSma10Ratio(), r.highLowRange(), r.roc1d(), r.roc3d(),
            r.bbWidth(), r.volumeChange1d(), crossAssetJson(r)));
    }

    public Mono<WriteResult<DailySentimentRow>> writeSentiments(List<DailySentimentRow> rows) {
        return write("daily_sentiment", rows, DailySentimentRow::date, s -> sentimentRepository.upsert(
            s.date(), s.meanSentiment(), s.provenance().name(), s.articleCount(),
            s.sent3d(), s.sent5d(), s.sentVol(), s.sentDelta(), s.sentAccel(),
            s.quantileBucket(), s.q2Flag(), s.q5Flag()));
    }

    public Mono<WriteResult<FeatureRow>> writeFeatures(List<FeatureRow> rows) {
        return write("feature_row", rows, FeatureRow::date, f -> featureRepository.upsert(
            f.date(), f.contractVersion(),
            f.feature(FeatureContract.BTC_NASDAQ_BETA_10D),
            f.feature(FeatureContract.SENT_Q5_FLAG),
            f.feature(FeatureContract.ROC_1D),
            f.feature(FeatureContract.HIGH_LOW_RANGE),
            f.feature(FeatureContract.ROC_3D),
            f.feature(FeatureContract.SENT_5D),
            f.feature(FeatureContract.SENT_CROSS_UP_X_HIGH_LOW_RANGE),
            f.feature(FeatureContract.BTC_NASDAQ_CORR_5D),
            f.feature(FeatureContract.BB_WIDTH),
            f.feature(FeatureContract.SENT_ACCEL),
            f.feature(FeatureContract.SENT_VOL),
            f.feature(FeatureContract.SENT_NEG_X_HIGH_LOW_RANGE),
            f.feature(FeatureContract.SENT_Q2_FLAG_X_CLOSE_TO_SMA10),
            f.target()));
    }

    private record Outcome<T>(T row, boolean written) {}

    private <T> Mono<WriteResult<T>> write(String table, List<T> rows,
                                           Function<T, LocalDate> dateOf,
                                           Function<T, Mono<Void>> upsert) {
        return Flux.fromIterable(rows)
            .concatMap(row -> Mono.defer(() -> upsert.apply(row))
                .retryWhen(Retry.backoff(Math.max(0, maxAttempts - 1), minBackoff))
                .thenReturn(new Outcome<>(row, true))
                .onErrorResume(e -> {
                    UpstreamWriteFailureException failure =
                        new UpstreamWriteFailureException(table, dateOf.apply(row), unwrap(e));
                    log.error("{} attempts={} reason={}",
                              failure.getMessage(), maxAttempts, failure.getCause().getMessage());
                    return Mono.just(new Outcome<>(row, false));
                }))
            .collectList()
            .map(outcomes -> {
                List<T> written = new ArrayList<>(outcomes.size());
                for (Outcome<T> o : outcomes) {
                    if (o.written()) written.add(o.row());
                }
                return new WriteResult<>(table, List.copyOf(written), outcomes.size() - written.size());
            })
            .doOnNext(r -> log.info("Rows upserted. table={} written={} failed={}",
                                    table, r.written().size(), r.failed()));
    }

    private String crossAssetJson(DailyIndicatorRow row) {
        try {
            return objectMapper.writeValueAsString(row.crossAsset());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize cross-asset columns for " + row.date(), e);
        }
    }

    private static Throwable unwrap(Throwable e) {
        // Retry.backoff wraps the last error once attempts are exhausted
        return Exceptions.isRetryExhausted(e) && e.getCause() != null ? e.getCause() : e;
    }
}
