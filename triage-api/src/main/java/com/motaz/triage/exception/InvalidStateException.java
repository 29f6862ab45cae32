package com.motaz.triage.exception;

public class InvalidStateException extends PipelineException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
