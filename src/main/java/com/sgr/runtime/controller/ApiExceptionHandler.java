package com.sgr.runtime.controller;

import com.sgr.runtime.common.RuntimeConfigException;
import com.sgr.runtime.common.StoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps runtime errors onto HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RuntimeConfigException.class)
    public ResponseEntity<ErrorResponse> handleConfig(RuntimeConfigException e) {
        HttpStatus status;
        switch (e.getReason()) {
            case CONFIG_NOT_FOUND:
                status = HttpStatus.NOT_FOUND;
                break;
            case CONFIG_UNREACHABLE:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            default:
                status = HttpStatus.UNPROCESSABLE_ENTITY;
        }
        log.warn("Agent configuration error {}: {}", e.getReason(), e.getMessage());
        return ResponseEntity.status(status).body(new ErrorResponse(e.getReason().name(), e.getMessage()));
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleStore(StoreUnavailableException e) {
        log.warn("Store [{}] unavailable: {}", e.getStore(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse("STORE_UNAVAILABLE", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    public record ErrorResponse(String reason, String message) {
    }
}
