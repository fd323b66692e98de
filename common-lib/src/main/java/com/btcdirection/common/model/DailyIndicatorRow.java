package com.btcdirection.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Technical indicators for one date with a fully populated trailing window.
 *
 * <p>{@code crossAsset} holds the correlation / beta columns keyed by their
 * contract-style name (e.g. {@code btc_nasdaq_corr_5d}). A value may be
 * {@code null} when its rolling variance was zero; a reference asset that was
 * entirely absent contributes no keys at all.
 */
public record DailyIndicatorRow(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("close") double close,
    @JsonProperty("closeToSma10Ratio") Double closeToSma10Ratio,
    @JsonProperty("highLowRange") Double highLowRange,
    @JsonProperty("roc1d") Double roc1d,
    @JsonProperty("roc3d") Double roc3d,
    @JsonProperty("bbWidth") Double bbWidth,
    @JsonProperty("volumeChange1d") Double volumeChange1d,
    @JsonProperty("crossAsset") Map<String, Double> crossAsset
) {
    public DailyIndicatorRow {
        // LinkedHashMap keeps column order and tolerates null values
        crossAsset = crossAsset == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(crossAsset));
    }

    public Double crossAssetValue(String column) {
        return crossAsset.get(column);
    }
}
