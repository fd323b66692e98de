package com.btcdirection.common.feature;

import com.btcdirection.common.exception.IncompleteFeatureRowException;
import com.btcdirection.common.model.DailyIndicatorRow;
import com.btcdirection.common.model.DailySentimentRow;
import com.btcdirection.common.model.FeatureRow;
import com.btcdirection.common.model.SentimentProvenance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static com.btcdirection.common.feature.FeatureContract.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeatureAssemblerTest {

    private static final LocalDate D1 = LocalDate.of(2025, 6, 1);
    private static final LocalDate D2 = D1.plusDays(1);
    private static final LocalDate D3 = D1.plusDays(2);
    private static final LocalDate D4 = D1.plusDays(3);

    private final FeatureAssembler assembler = new FeatureAssembler(FeatureContract.v1());

    private static DailyIndicatorRow indicator(LocalDate date, double close) {
        return new DailyIndicatorRow(date, close, 1.02, 0.04, 0.5, 1.5, 0.12, 0.03,
            Map.of(BTC_NASDAQ_CORR_5D, 0.6, BTC_NASDAQ_BETA_10D, 1.3));
    }

    private static DailySentimentRow sentiment(LocalDate date, double mean, Double sent3d,
                                               boolean q2, boolean q5) {
        return new DailySentimentRow(date, mean, SentimentProvenance.OBSERVED, 4,
            sent3d, 0.1, 0.05, 0.02, -0.01, q5 ? 4 : (q2 ? 1 : 2), q2, q5);
    }

    private FeatureRow single(DailyIndicatorRow ind, DailySentimentRow sent) {
        FeatureAssembler.Assembly a = assembler.assemble(List.of(ind), List.of(sent), Map.of());
        assertThat(a.rows()).hasSize(1);
        return a.rows().get(0);
    }

    @Nested
    @DisplayName("join")
    class JoinTests {

        @Test
        @DisplayName("only dates present on both sides produce rows, oldest first")
        void innerJoin() {
            FeatureAssembler.Assembly a = assembler.assemble(
                List.of(indicator(D3, 100), indicator(D1, 100), indicator(D2, 100)),
                List.of(sentiment(D2, 0.1, 0.1, false, false),
                        sentiment(D3, 0.1, 0.1, false, false),
                        sentiment(D4, 0.1, 0.1, false, false)),
                Map.of());
            assertThat(a.rows()).extracting(FeatureRow::date).containsExactly(D2, D3);
            assertThat(a.dropped()).isEmpty();
        }

        @Test
        @DisplayName("features follow contract order and carry the contract version")
        void contractOrder() {
            FeatureRow row = single(indicator(D1, 100), sentiment(D1, 0.1, 0.1, false, false));
            assertThat(List.copyOf(row.features().keySet())).isEqualTo(FeatureContract.v1().names());
            assertThat(row.contractVersion()).isEqualTo(V1);
            assertThat(row.feature(BTC_NASDAQ_BETA_10D)).isEqualTo(1.3);
            assertThat(row.feature(SENT_5D)).isEqualTo(0.1);
        }
    }

    @Nested
    @DisplayName("interaction features")
    class InteractionTests {

        @Test
        @DisplayName("q2 flag times close-to-SMA ratio")
        void q2Product() {
            assertThat(single(indicator(D1, 100), sentiment(D1, 0.1, 0.1, true, false))
                .feature(SENT_Q2_FLAG_X_CLOSE_TO_SMA10)).isEqualTo(1.02);
            assertThat(single(indicator(D1, 100), sentiment(D1, 0.1, 0.1, false, false))
                .feature(SENT_Q2_FLAG_X_CLOSE_TO_SMA10)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("cross-up requires sentiment above its 3-day mean and above zero")
        void crossUp() {
            assertThat(single(indicator(D1, 100), sentiment(D1, 0.5, 0.3, false, false))
                .feature(SENT_CROSS_UP_X_HIGH_LOW_RANGE)).isEqualTo(0.04);
            assertThat(single(indicator(D1, 100), sentiment(D1, -0.1, -0.3, false, false))
                .feature(SENT_CROSS_UP_X_HIGH_LOW_RANGE)).isEqualTo(0.0);
            assertThat(single(indicator(D1, 100), sentiment(D1, 0.2, 0.3, false, false))
                .feature(SENT_CROSS_UP_X_HIGH_LOW_RANGE)).isEqualTo(0.0);
        }

        @Test
        @DisplayName("negative flag uses a strict -0.2 threshold")
        void negativeThreshold() {
            assertThat(single(indicator(D1, 100), sentiment(D1, -0.2, 0.0, false, false))
                .feature(SENT_NEG_X_HIGH_LOW_RANGE)).isEqualTo(0.0);
            assertThat(single(indicator(D1, 100), sentiment(D1, -0.21, 0.0, false, false))
                .feature(SENT_NEG_X_HIGH_LOW_RANGE)).isCloseTo(0.04, within(1e-15));
        }

        @Test
        @DisplayName("q5 flag is carried as 0/1")
        void q5Flag() {
            assertThat(single(indicator(D1, 100), sentiment(D1, 0.1, 0.1, false, true))
                .feature(SENT_Q5_FLAG)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("incomplete rows")
    class IncompleteTests {

        @Test
        @DisplayName("row with a null rolling field is dropped and reported")
        void nullRolling() {
            DailySentimentRow noHistory = new DailySentimentRow(D1, 0.1, SentimentProvenance.OBSERVED, 1,
                null, null, null, null, null, 2, false, false);
            FeatureAssembler.Assembly a = assembler.assemble(
                List.of(indicator(D1, 100), indicator(D2, 100)),
                List.of(noHistory, sentiment(D2, 0.1, 0.1, false, false)),
                Map.of());
            assertThat(a.rows()).extracting(FeatureRow::date).containsExactly(D2);
            assertThat(a.dropped()).singleElement().satisfies(e -> {
                assertThat(e.getDate()).isEqualTo(D1);
                assertThat(e.getNullFeatures()).containsExactly(
                    SENT_5D, SENT_CROSS_UP_X_HIGH_LOW_RANGE, SENT_ACCEL, SENT_VOL);
            });
        }

        @Test
        @DisplayName("missing reference columns are named in the drop report")
        void missingCrossAsset() {
            DailyIndicatorRow noRef = new DailyIndicatorRow(D1, 100, 1.0, 0.04, 0.5, 1.5, 0.12, 0.03, Map.of());
            FeatureAssembler.Assembly a = assembler.assemble(List.of(noRef),
                List.of(sentiment(D1, 0.1, 0.1, false, false)), Map.of());
            assertThat(a.rows()).isEmpty();
            assertThat(a.dropped()).extracting(IncompleteFeatureRowException::getNullFeatures)
                .containsExactly(List.of(BTC_NASDAQ_BETA_10D, BTC_NASDAQ_CORR_5D));
        }
    }

    @Nested
    @DisplayName("target")
    class TargetTests {

        @Test
        @DisplayName("1 when the next close is higher, 0 when equal or lower, null when unknown")
        void nextDayTarget() {
            FeatureAssembler.Assembly a = assembler.assemble(
                List.of(indicator(D1, 100), indicator(D2, 101), indicator(D3, 101)),
                List.of(sentiment(D1, 0.1, 0.1, false, false),
                        sentiment(D2, 0.1, 0.1, false, false),
                        sentiment(D3, 0.1, 0.1, false, false)),
                Map.of(D1, 100.0, D2, 101.0, D3, 101.0));
            assertThat(a.rows()).extracting(FeatureRow::target).containsExactly(1, 0, null);
            assertThat(a.rows().get(2).hasTarget()).isFalse();
        }
    }
}
