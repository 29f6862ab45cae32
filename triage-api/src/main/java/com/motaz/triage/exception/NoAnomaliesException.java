package com.motaz.triage.exception;

public class NoAnomaliesException extends PipelineException {

    public NoAnomaliesException(Long datasetId) {
        super(ErrorCode.NO_ANOMALIES, "No anomalies detected for dataset " + datasetId);
    }
}
