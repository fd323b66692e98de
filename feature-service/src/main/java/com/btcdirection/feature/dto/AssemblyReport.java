package com.btcdirection.feature.dto;

import com.btcdirection.common.model.FeatureRow;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one {@code assemble_features} run.
 *
 * @param mode              {@code FULL} or {@code INCREMENTAL}
 * @param rederiveFrom      first re-derived date, {@code null} for a full run
 * @param through           last date considered (UTC today)
 * @param persistedRows     feature rows written successfully
 * @param droppedIncomplete joined dates dropped for null contract features
 * @param writeFailures     rows of any table that could not be written after retries
 * @param rows              the feature rows written, oldest first
 */
public record AssemblyReport(
    String mode,
    LocalDate rederiveFrom,
    LocalDate through,
    int persistedRows,
    int droppedIncomplete,
    int writeFailures,
    int indicatorRows,
    int sentimentRows,
    ScoringReport scoring,
    List<FeatureRow> rows
) {
    public static final String FULL        = "FULL";
    public static final String INCREMENTAL = "INCREMENTAL";
}
