package com.btcdirection.feature.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@Table("daily_sentiment")
public class SentimentRecord {

    @Id
    private LocalDate obsDate;

    private double  meanSentiment;
    private String  provenance;
    private int     articleCount;
    @Column("sent_3d")
    private Double  sent3d;
    @Column("sent_5d")
    private Double  sent5d;
    private Double  sentVol;
    private Double  sentDelta;
    private Double  sentAccel;
    private int     quantileBucket;
    private boolean q2Flag;
    private boolean q5Flag;
}
