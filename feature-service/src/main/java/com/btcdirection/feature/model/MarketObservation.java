package com.btcdirection.feature.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

/**
 * One UTC day of primary-asset OHLCV, written by the market collector.
 */
@Data
@NoArgsConstructor
@Table("market_observation")
public class MarketObservation {

    @Id
    private LocalDate obsDate;

    private double open;
    private double high;
    private double low;
    private double close;
    private Double volume;
}
