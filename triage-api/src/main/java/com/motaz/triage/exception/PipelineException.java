package com.motaz.triage.exception;

import lombok.Getter;

/**
 * Base of every failure the pipeline reports to its callers. The attached
 * {@link ErrorCode} decides the HTTP status.
 */
@Getter
public class PipelineException extends RuntimeException {

    private final ErrorCode errorCode;

    public PipelineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PipelineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
