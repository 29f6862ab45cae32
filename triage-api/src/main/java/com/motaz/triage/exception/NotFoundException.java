package com.motaz.triage.exception;

public class NotFoundException extends PipelineException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException dataset(Long datasetId) {
        return new NotFoundException("Dataset " + datasetId + " not found");
    }
}
