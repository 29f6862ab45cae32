package com.motaz.triage.exception;

/** A stage could not be handed to its worker pool; the caller may retry later. */
public class PipelineBusyException extends PipelineException {

    public PipelineBusyException(String message, Throwable cause) {
        super(ErrorCode.BUSY, message, cause);
    }
}
