package com.btcdirection.common.exception;

import java.time.LocalDate;
import java.util.List;

/**
 * A joined row has one or more null contract features. The assembler drops the
 * date; callers never see this as an aborting error.
 */
public class IncompleteFeatureRowException extends PipelineException {
    private final LocalDate date;
    private final List<String> nullFeatures;

    public IncompleteFeatureRowException(LocalDate date, List<String> nullFeatures) {
        super("feature", "row " + date + " has null features " + nullFeatures);
        this.date = date;
        this.nullFeatures = List.copyOf(nullFeatures);
    }

    public LocalDate getDate() {
        return date;
    }

    public List<String> getNullFeatures() {
        return nullFeatures;
    }
}
