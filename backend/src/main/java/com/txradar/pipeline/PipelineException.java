package com.txradar.pipeline;

import lombok.Getter;

/**
 * Fatal pipeline error: the batch cannot be profiled at all. The only condition that aborts a run.
 * API layer maps it to 422 with the error code.
 */
@Getter
public class PipelineException extends RuntimeException {

    public static final String EMPTY_BATCH = "EMPTY_BATCH";
    public static final String UNRECOGNIZED_SCHEMA = "UNRECOGNIZED_SCHEMA";

    private final String errorCode;

    public PipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
