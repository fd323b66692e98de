package com.btcdirection.common.feature;

import java.time.LocalDate;

/**
 * Date bounds of one feature assembly run.
 *
 * <p>Incremental runs re-derive everything from {@code watermark - buffer} and
 * overwrite those rows even when already persisted, because late sentiment can
 * change rolling values that span the boundary. Upstream data is read from
 * {@code lookback} days earlier still so every rolling window at the
 * re-derivation start is fully populated. Full runs have no lower bound.
 *
 * @param loadFrom     first upstream date to read; {@code null} = unbounded
 * @param rederiveFrom first derived date to write; {@code null} = all
 * @param through      last date, inclusive
 */
public record IncrementalWindow(LocalDate loadFrom, LocalDate rederiveFrom, LocalDate through) {

    public static IncrementalWindow full(LocalDate through) {
        return new IncrementalWindow(null, null, through);
    }

    public static IncrementalWindow fromWatermark(LocalDate watermark, int bufferDays,
                                                  int lookbackDays, LocalDate through) {
        if (bufferDays < 0 || lookbackDays < 0) {
            throw new IllegalArgumentException("buffer and lookback must be non-negative");
        }
        LocalDate rederiveFrom = watermark.minusDays(bufferDays);
        return new IncrementalWindow(rederiveFrom.minusDays(lookbackDays), rederiveFrom, through);
    }

    public boolean isIncremental() {
        return rederiveFrom != null;
    }

    /** Whether a derived row for {@code date} belongs to this run's write set. */
    public boolean writes(LocalDate date) {
        if (date.isAfter(through)) return false;
        return rederiveFrom == null || !date.isBefore(rederiveFrom);
    }
}
