package com.btcdirection.common.exception;

import java.time.LocalDate;

/**
 * Persisting one record failed after retries. Counted per record; never aborts a batch.
 */
public class UpstreamWriteFailureException extends PipelineException {
    private final String table;
    private final LocalDate date;

    public UpstreamWriteFailureException(String table, LocalDate date, Throwable cause) {
        super("store", "write to " + table + " failed for date " + date, cause);
        this.table = table;
        this.date = date;
    }

    public String getTable() {
        return table;
    }

    public LocalDate getDate() {
        return date;
    }
}
