package com.btcdirection.prediction.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("ensemble_decision")
public class EnsembleDecisionRecord {

    @Id
    private LocalDate targetDate;

    private LocalDate featureDate;
    private int       direction;
    private double    confidence;
    private double    probabilityUp;
    private double    threshold;
    private String    confidenceLevel;
    private String    contractVersion;
    /** JSON array of per-component outputs. */
    private String    components;
    private LocalDateTime updatedAt;
}
