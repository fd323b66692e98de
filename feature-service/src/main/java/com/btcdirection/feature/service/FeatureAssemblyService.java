package com.btcdirection.feature.service;

import com.btcdirection.common.exception.IncompleteFeatureRowException;
import com.btcdirection.common.exception.MissingUpstreamDataException;
import com.btcdirection.common.feature.FeatureAssembler;
import com.btcdirection.common.feature.IncrementalWindow;
import com.btcdirection.common.indicator.IndicatorEngine;
import com.btcdirection.common.model.DailyIndicatorRow;
import com.btcdirection.common.model.DailyMarketObservation;
import com.btcdirection.common.model.DailySentimentRow;
import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.common.sentiment.SentimentAggregator;
import com.btcdirection.feature.dto.AssemblyReport;
import com.btcdirection.feature.dto.ScoringReport;
import com.btcdirection.feature.model.MarketObservation;
import com.btcdirection.feature.model.NewsArticle;
import com.btcdirection.feature.model.ReferenceClose;
import com.btcdirection.feature.repository.FeatureRecordRepository;
import com.btcdirection.feature.repository.MarketObservationRepository;
import com.btcdirection.feature.repository.NewsArticleRepository;
import com.btcdirection.feature.repository.ReferenceCloseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Implements {@code assemble_features(update_only)}.
 *
 * <h3>Run</h3>
 * <ol>
 *   <li>Score pending articles (failures leave them unscored).</li>
 *   <li>Resolve the {@link IncrementalWindow}: full, or from the persisted watermark.</li>
 *   <li>Load market observations, reference closes and scored articles for the load range.
 *       An incremental run also loads the last observed daily sentiment before the
 *       range, so leading days without articles fill exactly as in a full run.</li>
 *   <li>Compute indicators and daily sentiment, then join into feature rows.</li>
 *   <li>Upsert every derived row inside the write range, overwriting stored ones.</li>
 * </ol>
 *
 * <p>Computation runs on {@code boundedElastic}; it is CPU-bound over a few
 * thousand rows at most.
 */
@Service
public class FeatureAssemblyService {

    private static final Logger log = LoggerFactory.getLogger(FeatureAssemblyService.class);

    static final int MIN_SENTIMENT_LOOKBACK = 4;

    private final MarketObservationRepository marketRepository;
    private final ReferenceCloseRepository referenceRepository;
    private final NewsArticleRepository articleRepository;
    private final FeatureRecordRepository featureRepository;
    private final ArticleScoringService scoringService;
    private final DerivedRowWriter writer;
    private final IndicatorEngine indicatorEngine;
    private final SentimentAggregator sentimentAggregator;
    private final FeatureAssembler featureAssembler;
    private final Clock clock;
    private final List<String> referenceAssets;
    private final LocalDate historyStart;
    private final int bufferDays;

    public FeatureAssemblyService(MarketObservationRepository marketRepository,
                                  ReferenceCloseRepository referenceRepository,
                                  NewsArticleRepository articleRepository,
                                  FeatureRecordRepository featureRepository,
                                  ArticleScoringService scoringService,
                                  DerivedRowWriter writer,
                                  IndicatorEngine indicatorEngine,
                                  SentimentAggregator sentimentAggregator,
                                  FeatureAssembler featureAssembler,
                                  Clock clock,
                                  @Value("${feature.reference-assets:nasdaq}") List<String> referenceAssets,
                                  @Value("${feature.history-start:2015-01-01}") String historyStart,
                                  @Value("${feature.incremental.buffer-days:10}") int bufferDays) {
        this.marketRepository    = marketRepository;
        this.referenceRepository = referenceRepository;
        this.articleRepository   = articleRepository;
        this.featureRepository   = featureRepository;
        this.scoringService      = scoringService;
        this.writer              = writer;
        this.indicatorEngine     = indicatorEngine;
        this.sentimentAggregator = sentimentAggregator;
        this.featureAssembler    = featureAssembler;
        this.clock               = clock;
        this.referenceAssets     = List.copyOf(referenceAssets);
        this.historyStart        = LocalDate.parse(historyStart);
        this.bufferDays          = bufferDays;
    }

    /**
     * Days of upstream history needed before the re-derivation start so that every
     * rolling value there equals a full recomputation.
     */
    int lookbackDays() {
        return Math.max(indicatorEngine.windows().firstCompleteIndex(),
               Math.max(sentimentAggregator.quantileWindow() - 1, MIN_SENTIMENT_LOOKBACK));
    }

    public Mono<AssemblyReport> assembleFeatures(boolean updateOnly) {
        LocalDate today = LocalDate.now(clock);
        log.info("Feature assembly started. updateOnly={} through={}", updateOnly, today);

        return scoringService.scorePending()
            .onErrorResume(e -> {
                log.warn("Article scoring pass failed, continuing with stored scores. reason={}", e.getMessage());
                return Mono.just(ScoringReport.empty());
            })
            .flatMap(scoring -> resolveWindow(updateOnly, today)
                .flatMap(window -> run(window, scoring)))
            .doOnSuccess(r -> log.info(
                "Feature assembly complete. mode={} rederiveFrom={} persisted={} dropped={} writeFailures={}",
                r.mode(), r.rederiveFrom(), r.persistedRows(), r.droppedIncomplete(), r.writeFailures()))
            .doOnError(e -> log.error("Feature assembly failed. updateOnly={} reason={}",
                                      updateOnly, e.getMessage()));
    }

    Mono<IncrementalWindow> resolveWindow(boolean updateOnly, LocalDate today) {
        if (!updateOnly) {
            return Mono.just(IncrementalWindow.full(today));
        }
        return featureRepository.findLatestDate()
            .map(watermark -> IncrementalWindow.fromWatermark(watermark, bufferDays, lookbackDays(), today))
            .doOnNext(w -> log.info("Incremental window resolved. rederiveFrom={} loadFrom={}",
                                    w.rederiveFrom(), w.loadFrom()))
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.info("No persisted features yet, falling back to a full run");
                return IncrementalWindow.full(today);
            }));
    }

    private Mono<AssemblyReport> run(IncrementalWindow window, ScoringReport scoring) {
        LocalDate from = window.loadFrom() != null ? window.loadFrom() : historyStart;
        LocalDate through = window.through();

        Mono<List<MarketObservation>> market = marketRepository.findBetween(from, through).collectList();
        Mono<Map<String, Map<LocalDate, Double>>> references = loadReferences(from, through);
        Mono<Map<LocalDate, List<Double>>> scores = articleRepository.findScoredBetween(from, through)
            .collectList()
            .map(FeatureAssemblyService::scoresByDate);
        Mono<Optional<Double>> carried = window.isIncremental()
            ? carriedSentiment(from)
            : Mono.just(Optional.empty());

        return Mono.zip(market, references, scores, carried)
            .flatMap(t -> {
                if (t.getT1().isEmpty()) {
                    return Mono.error(new MissingUpstreamDataException("market",
                        "no market observations between " + from + " and " + through));
                }
                return Mono.fromCallable(() -> derive(window, t.getT1(), t.getT2(), t.getT3(),
                                                      t.getT4().orElse(null)))
                    .subscribeOn(Schedulers.boundedElastic());
            })
            .flatMap(derived -> persist(window, derived, scoring));
    }

    /**
     * Daily mean of the last day before {@code loadFrom} that had scored articles,
     * looking no further back than where a full run would start.
     */
    Mono<Optional<Double>> carriedSentiment(LocalDate loadFrom) {
        return marketRepository.findFirstDateFrom(historyStart)
            .flatMap(fullStart -> articleRepository.findLastScoredDateBefore(fullStart, loadFrom))
            .flatMap(day -> articleRepository.findScoredBetween(day, day)
                .mapNotNull(NewsArticle::getSentimentScore)
                .collectList()
                .mapNotNull(SentimentAggregator::dailyMean)
                .doOnNext(mean -> log.debug("Carried-in sentiment. day={} mean={}", day, mean)))
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    private Mono<Map<String, Map<LocalDate, Double>>> loadReferences(LocalDate from, LocalDate through) {
        return Flux.fromIterable(referenceAssets)
            .concatMap(asset -> referenceRepository.findBetween(asset, from, through)
                .collectMap(ReferenceClose::getObsDate, ReferenceClose::getClose)
                .map(closes -> Map.entry(asset, closes)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    /** Pure derivation step; every list is oldest first. */
    record Derived(List<DailyIndicatorRow> indicators,
                   List<DailySentimentRow> sentiments,
                   List<FeatureRow> features,
                   List<IncompleteFeatureRowException> dropped) {}

    Derived derive(IncrementalWindow window,
                   List<MarketObservation> market,
                   Map<String, Map<LocalDate, Double>> references,
                   Map<LocalDate, List<Double>> scores,
                   Double carriedSentiment) {
        List<DailyMarketObservation> observations = new ArrayList<>(market.size());
        Map<LocalDate, Double> closes = new HashMap<>();
        for (MarketObservation m : market) {
            Map<String, Double> refCloses = new LinkedHashMap<>();
            references.forEach((asset, byDate) -> {
                Double close = byDate.get(m.getObsDate());
                if (close != null) refCloses.put(asset, close);
            });
            observations.add(new DailyMarketObservation(m.getObsDate(), m.getOpen(), m.getHigh(),
                m.getLow(), m.getClose(), m.getVolume(), refCloses));
            closes.put(m.getObsDate(), m.getClose());
        }

        List<DailyIndicatorRow> indicators = indicatorEngine.compute(observations);
        if (indicators.isEmpty()) {
            throw new MissingUpstreamDataException("indicator",
                observations.size() + " market observations are not enough to fill the indicator windows");
        }

        LocalDate first = observations.get(0).date();
        LocalDate last  = observations.get(observations.size() - 1).date();
        List<DailySentimentRow> sentiments = sentimentAggregator.aggregate(first, last, scores, carriedSentiment);

        FeatureAssembler.Assembly assembly = featureAssembler.assemble(indicators, sentiments, closes);
        for (IncompleteFeatureRowException e : assembly.dropped()) {
            log.debug("Feature row dropped. date={} nullFeatures={}", e.getDate(), e.getNullFeatures());
        }

        return new Derived(
            indicators.stream().filter(r -> window.writes(r.date())).toList(),
            sentiments.stream().filter(s -> window.writes(s.date())).toList(),
            assembly.rows().stream().filter(f -> window.writes(f.date())).toList(),
            assembly.dropped().stream().filter(e -> window.writes(e.getDate())).toList());
    }

    private Mono<AssemblyReport> persist(IncrementalWindow window, Derived derived, ScoringReport scoring) {
        if (!derived.dropped().isEmpty()) {
            log.warn("Incomplete feature rows dropped. count={} first={} last={}",
                     derived.dropped().size(),
                     derived.dropped().get(0).getDate(),
                     derived.dropped().get(derived.dropped().size() - 1).getDate());
        }
        return writer.writeIndicators(derived.indicators())
            .flatMap(indicators -> writer.writeSentiments(derived.sentiments())
                .flatMap(sentiments -> writer.writeFeatures(derived.features())
                    .map(features -> new AssemblyReport(
                        window.isIncremental() ? AssemblyReport.INCREMENTAL : AssemblyReport.FULL,
                        window.rederiveFrom(),
                        window.through(),
                        features.written().size(),
                        derived.dropped().size(),
                        indicators.failed() + sentiments.failed() + features.failed(),
                        indicators.written().size(),
                        sentiments.written().size(),
                        scoring,
                        features.written()))));
    }

    static Map<LocalDate, List<Double>> scoresByDate(List<NewsArticle> articles) {
        Map<LocalDate, List<Double>> byDate = new TreeMap<>();
        for (NewsArticle a : articles) {
            if (a.getSentimentScore() == null || a.getPublishedDate() == null) continue;
            byDate.computeIfAbsent(a.getPublishedDate(), d -> new ArrayList<>()).add(a.getSentimentScore());
        }
        return byDate;
    }
}
