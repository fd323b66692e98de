package com.btcdirection.common.sentiment;

import com.btcdirection.common.model.DailySentimentRow;
import com.btcdirection.common.model.SentimentProvenance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SentimentAggregatorTest {

    private static final LocalDate D0 = LocalDate.of(2025, 3, 1);

    private final SentimentAggregator aggregator = new SentimentAggregator(90);

    private static Map<LocalDate, List<Double>> scores(Double... perDay) {
        Map<LocalDate, List<Double>> m = new HashMap<>();
        for (int i = 0; i < perDay.length; i++) {
            if (perDay[i] != null) m.put(D0.plusDays(i), List.of(perDay[i]));
        }
        return m;
    }

    @Nested
    @DisplayName("daily mean and gap filling")
    class FillTests {

        @Test
        @DisplayName("day with several articles takes their mean")
        void mean() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0,
                Map.of(D0, List.of(0.2, 0.4, 0.6)));
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0).meanSentiment()).isCloseTo(0.4, within(1e-12));
            assertThat(rows.get(0).articleCount()).isEqualTo(3);
            assertThat(rows.get(0).provenance()).isEqualTo(SentimentProvenance.OBSERVED);
        }

        @Test
        @DisplayName("one row per calendar day, gaps marked as filled")
        void everyDay() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(4),
                scores(0.1, null, null, 0.5, null));
            assertThat(rows).extracting(DailySentimentRow::date)
                .containsExactly(D0, D0.plusDays(1), D0.plusDays(2), D0.plusDays(3), D0.plusDays(4));
            assertThat(rows).extracting(DailySentimentRow::provenance).containsExactly(
                SentimentProvenance.OBSERVED, SentimentProvenance.INTERPOLATED,
                SentimentProvenance.INTERPOLATED, SentimentProvenance.OBSERVED,
                SentimentProvenance.INTERPOLATED);
            assertThat(rows.get(1).articleCount()).isZero();
        }

        @Test
        @DisplayName("filled values stay within the neighbouring observations")
        void boundedFill() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(3),
                scores(0.1, null, null, 0.5));
            for (DailySentimentRow row : rows) {
                assertThat(row.meanSentiment()).isBetween(0.1, 0.5);
            }
        }

        @Test
        @DisplayName("leading gap takes the first observation")
        void leadingGap() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(2),
                scores(null, null, -0.3));
            assertThat(rows).extracting(DailySentimentRow::meanSentiment)
                .containsExactly(-0.3, -0.3, -0.3);
        }

        @Test
        @DisplayName("batch without any article is neutral and raises no flag")
        void noArticles() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(6), Map.of());
            assertThat(rows).hasSize(7).allSatisfy(row -> {
                assertThat(row.meanSentiment()).isEqualTo(SentimentAggregator.NEUTRAL_SENTIMENT);
                assertThat(row.provenance()).isEqualTo(SentimentProvenance.INTERPOLATED);
                assertThat(row.q2Flag()).isFalse();
                assertThat(row.q5Flag()).isFalse();
            });
        }

        @Test
        @DisplayName("inverted range yields nothing")
        void invertedRange() {
            assertThat(aggregator.aggregate(D0, D0.minusDays(1), Map.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("rolling fields")
    class RollingTests {

        private final List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(5),
            scores(0.1, 0.2, 0.4, 0.3, 0.5, 0.2));

        @Test
        @DisplayName("windows are null until enough history exists")
        void warmUp() {
            assertThat(rows.get(1).sent3d()).isNull();
            assertThat(rows.get(2).sent3d()).isNotNull();
            assertThat(rows.subList(0, 4)).allSatisfy(r -> {
                assertThat(r.sent5d()).isNull();
                assertThat(r.sentVol()).isNull();
            });
            assertThat(rows.get(4).sent5d()).isCloseTo(0.3, within(1e-12));
            assertThat(rows.get(0).sentDelta()).isNull();
            assertThat(rows.get(1).sentAccel()).isNull();
        }

        @Test
        @DisplayName("delta and acceleration are first and second differences")
        void differences() {
            assertThat(rows.get(3).sentDelta()).isCloseTo(-0.1, within(1e-12));
            // (0.3 - 0.4) - (0.4 - 0.2)
            assertThat(rows.get(3).sentAccel()).isCloseTo(-0.3, within(1e-12));
        }

        @Test
        @DisplayName("volatility is the 5-day sample standard deviation")
        void volatility() {
            // 0.1 0.2 0.4 0.3 0.5 → mean 0.3, squared deviations sum 0.1
            assertThat(rows.get(4).sentVol()).isCloseTo(Math.sqrt(0.1 / 4), within(1e-12));
        }
    }

    @Nested
    @DisplayName("quantile flags")
    class FlagTests {

        @Test
        @DisplayName("highest value of the trailing window raises the q5 flag")
        void topQuintile() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(4),
                scores(0.1, 0.2, 0.3, 0.4, 0.5));
            DailySentimentRow last = rows.get(4);
            assertThat(last.quantileBucket()).isEqualTo(4);
            assertThat(last.q5Flag()).isTrue();
            assertThat(last.q2Flag()).isFalse();
        }

        @Test
        @DisplayName("second-lowest quintile raises the q2 flag")
        void secondQuintile() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(9),
                scores(0.5, 0.6, 0.7, 0.8, 0.9, 1.0, 0.1, 0.2, 0.3, 0.25));
            DailySentimentRow last = rows.get(9);
            assertThat(last.quantileBucket()).isEqualTo(1);
            assertThat(last.q2Flag()).isTrue();
            assertThat(last.q5Flag()).isFalse();
        }

        @Test
        @DisplayName("a day is bucketed only against its trailing window")
        void trailingWindowOnly() {
            SentimentAggregator shortWindow = new SentimentAggregator(3);
            List<DailySentimentRow> rows = shortWindow.aggregate(D0, D0.plusDays(5),
                scores(0.9, 0.8, 0.7, 0.1, 0.2, 0.3));
            // trailing sample for the last day is 0.1, 0.2, 0.3 only
            assertThat(rows.get(5).quantileBucket()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("continuing an earlier series")
    class ContinuationTests {

        private final SentimentAggregator windowed = new SentimentAggregator(20);

        /** 60 days; day 29 is strongly positive and days 30..33 have no articles. */
        private Map<LocalDate, List<Double>> history() {
            Map<LocalDate, List<Double>> m = new HashMap<>();
            for (int i = 0; i < 60; i++) {
                if (i >= 30 && i <= 33) continue;
                double score = i == 29 ? 0.95 : 0.5 * Math.sin(i / 2.0);
                m.put(D0.plusDays(i), List.of(score));
            }
            return m;
        }

        private Map<LocalDate, List<Double>> from(Map<LocalDate, List<Double>> all, LocalDate start) {
            Map<LocalDate, List<Double>> m = new HashMap<>();
            all.forEach((d, v) -> { if (!d.isBefore(start)) m.put(d, v); });
            return m;
        }

        @Test
        @DisplayName("leading empty days forward-fill from the carried mean, matching the whole-series run")
        void carriedMeanMatchesWholeSeries() {
            Map<LocalDate, List<Double>> all = history();
            LocalDate start = D0.plusDays(30);
            LocalDate end = D0.plusDays(59);

            List<DailySentimentRow> whole = windowed.aggregate(D0, end, all);
            List<DailySentimentRow> tail  = windowed.aggregate(start, end, from(all, start), 0.95);

            assertThat(tail).extracting(DailySentimentRow::meanSentiment)
                .containsExactlyElementsOf(whole.subList(30, 60).stream()
                    .map(DailySentimentRow::meanSentiment).toList());
            assertThat(tail.subList(19, 30)).isEqualTo(whole.subList(49, 60));
            assertThat(tail.get(0).provenance()).isEqualTo(SentimentProvenance.INTERPOLATED);
        }

        @Test
        @DisplayName("without a carried mean, leading empty days take the next observed day")
        void noCarriedMean() {
            Map<LocalDate, List<Double>> all = history();
            LocalDate start = D0.plusDays(30);

            List<DailySentimentRow> tail = windowed.aggregate(start, D0.plusDays(59), from(all, start), null);

            assertThat(tail.get(0).meanSentiment()).isEqualTo(0.5 * Math.sin(34 / 2.0));
        }

        @Test
        @DisplayName("an interior gap keeps the last observed value")
        void interiorGapForwardFills() {
            List<DailySentimentRow> rows = aggregator.aggregate(D0, D0.plusDays(3), scores(0.1, null, null, 0.7));
            assertThat(rows).extracting(DailySentimentRow::meanSentiment).containsExactly(0.1, 0.1, 0.1, 0.7);
        }
    }
}
