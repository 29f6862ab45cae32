package com.motaz.triage.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_STATE(HttpStatus.CONFLICT),
    SCHEMA_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY),
    MODEL_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    NO_ANOMALIES(HttpStatus.CONFLICT),
    EXTERNAL_SERVICE_FAILURE(HttpStatus.BAD_GATEWAY),
    TIMEOUT(HttpStatus.GATEWAY_TIMEOUT),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST),
    BUSY(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }
}
