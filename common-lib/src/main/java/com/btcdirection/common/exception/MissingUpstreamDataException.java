package com.btcdirection.common.exception;

/**
 * Market or sentiment input is absent or too short for the requested range.
 * Recoverable by widening the range or skipping the cycle.
 */
public class MissingUpstreamDataException extends PipelineException {

    public MissingUpstreamDataException(String stage, String message) {
        super(stage, message);
    }
}
