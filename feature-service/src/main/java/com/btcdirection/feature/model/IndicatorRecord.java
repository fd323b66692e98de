package com.btcdirection.feature.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@Table("daily_indicator")
public class IndicatorRecord {

    @Id
    private LocalDate obsDate;

    private double close;
    private Double closeToSma10Ratio;
    private Double highLowRange;
    @Column("roc_1d")
    private Double roc1d;
    @Column("roc_3d")
    private Double roc3d;
    private Double bbWidth;
    @Column("volume_change_1d")
    private Double volumeChange1d;

    /** JSON object of cross-asset columns, e.g. {@code {"btc_nasdaq_corr_5d":0.41}}. */
    private String crossAsset;
}
