package com.motaz.triage.controller;

import com.motaz.triage.dto.ErrorResponseDto;
import com.motaz.triage.exception.ErrorCode;
import com.motaz.triage.exception.PipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponseDto> handlePipelineException(PipelineException e) {
        ErrorCode code = e.getErrorCode();
        if (code.getHttpStatus().is5xxServerError()) {
            log.warn("{}: {}", code, e.getMessage());
        } else {
            log.debug("{}: {}", code, e.getMessage());
        }
        return respond(code, e.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class, MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class, MaxUploadSizeExceededException.class})
    public ResponseEntity<ErrorResponseDto> handleBadRequest(Exception e) {
        return respond(ErrorCode.INVALID_REQUEST, e.getMessage());
    }

    /**
     * Everything else. Spring MVC's own errors (unsupported method, unknown
     * path) keep their status; anything unexpected is logged and reported as
     * INTERNAL without leaking its message.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            if (status.is4xxClientError()) {
                ErrorCode code = status.value() == HttpStatus.NOT_FOUND.value() ? ErrorCode.NOT_FOUND : ErrorCode.INVALID_REQUEST;
                return ResponseEntity.status(status).body(body(code, e.getMessage()));
            }
        }
        log.error("Unhandled error", e);
        return respond(ErrorCode.INTERNAL, "Unexpected error, see server logs");
    }

    private static ResponseEntity<ErrorResponseDto> respond(ErrorCode code, String message) {
        return ResponseEntity.status(code.getHttpStatus()).body(body(code, message));
    }

    private static ErrorResponseDto body(ErrorCode code, String message) {
        return ErrorResponseDto.builder()
                .code(code.name())
                .message(message)
                .timestamp(Instant.now())
                .build();
    }
}
