package com.trialwatch.controller;

import com.trialwatch.client.ExternalApiException;
import com.trialwatch.service.SyncInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Maps pipeline failures to JSON error responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ApiError(int status, String error, String message, Instant timestamp) {

        static ApiError of(HttpStatus status, String message) {
            return new ApiError(status.value(), status.getReasonPhrase(), message, Instant.now());
        }
    }

    @ExceptionHandler(ExternalApiException.class)
    public ResponseEntity<ApiError> upstreamFailure(ExternalApiException e) {
        log.warn("[api] upstream call failed (status {}): {}", e.getStatusCode(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> badRequest(RuntimeException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(SyncInProgressException.class)
    public ResponseEntity<ApiError> conflict(SyncInProgressException e) {
        return respond(HttpStatus.CONFLICT, e.getMessage());
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiError.of(status, message));
    }
}
