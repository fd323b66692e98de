package com.btcdirection.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Map;

/**
 * One calendar day of primary-asset OHLCV plus the close of every reference asset
 * that traded that day. Reference assets that did not trade are simply absent
 * from {@code referenceCloses}; the indicator engine reindexes them.
 */
public record DailyMarketObservation(
    @JsonProperty("date") LocalDate date,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") Double volume,
    @JsonProperty("referenceCloses") Map<String, Double> referenceCloses
) {
    public DailyMarketObservation {
        referenceCloses = referenceCloses == null ? Map.of() : Map.copyOf(referenceCloses);
    }
}
