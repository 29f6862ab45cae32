package com.motaz.triage.exception;

public class SchemaMismatchException extends PipelineException {

    public SchemaMismatchException(String message) {
        super(ErrorCode.SCHEMA_MISMATCH, message);
    }
}
