package com.motaz.triage.reasoning;

import com.motaz.triage.exception.ErrorCode;
import com.motaz.triage.exception.PipelineException;

public class ReasoningException extends PipelineException {

    public ReasoningException(String message) {
        super(ErrorCode.EXTERNAL_SERVICE_FAILURE, message);
    }

    public ReasoningException(String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_SERVICE_FAILURE, message, cause);
    }
}
