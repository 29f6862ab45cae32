package com.motaz.triage.exception;

public class ModelUnavailableException extends PipelineException {

    public ModelUnavailableException(String message) {
        super(ErrorCode.MODEL_UNAVAILABLE, message);
    }
}
