package com.btcdirection.feature.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

/**
 * Persisted contract-v1 feature row. One column per contract feature so the
 * table can be read directly by training jobs.
 */
@Data
@NoArgsConstructor
@Table("feature_row")
public class FeatureRecord {

    @Id
    private LocalDate obsDate;

    private String contractVersion;

    @Column("btc_nasdaq_beta_10d")            private double btcNasdaqBeta10d;
    @Column("sent_q5_flag")                   private double sentQ5Flag;
    @Column("roc_1d")                         private double roc1d;
    @Column("high_low_range")                 private double highLowRange;
    @Column("roc_3d")                         private double roc3d;
    @Column("sent_5d")                        private double sent5d;
    @Column("sent_cross_up_x_high_low_range") private double sentCrossUpXHighLowRange;
    @Column("btc_nasdaq_corr_5d")             private double btcNasdaqCorr5d;
    @Column("bb_width")                       private double bbWidth;
    @Column("sent_accel")                     private double sentAccel;
    @Column("sent_vol")                       private double sentVol;
    @Column("sent_neg_x_high_low_range")      private double sentNegXHighLowRange;
    @Column("sent_q2_flag_x_close_to_sma10")  private double sentQ2FlagXCloseToSma10;

    @Column("target_nextday")
    private Integer targetNextday;
}
