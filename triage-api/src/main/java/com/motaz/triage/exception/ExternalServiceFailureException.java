package com.motaz.triage.exception;

import com.motaz.triage.dto.TriageSummaryDto;
import lombok.Getter;

/**
 * Raised when every anomaly selected for triage failed at the reasoning
 * service. The summary still lists the per-anomaly errors.
 */
@Getter
public class ExternalServiceFailureException extends PipelineException {

    private final TriageSummaryDto summary;

    public ExternalServiceFailureException(String message, TriageSummaryDto summary) {
        super(ErrorCode.EXTERNAL_SERVICE_FAILURE, message);
        this.summary = summary;
    }
}
