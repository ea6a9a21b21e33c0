package com.shareledger.api.controller;

import com.shareledger.common.exception.ErrorCategory;
import com.shareledger.common.exception.ShareLedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for REST APIs.
 *
 * Ledger rejections are returned verbatim with their stable error code.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ShareLedgerException.class)
    public ResponseEntity<Map<String, String>> handleLedgerException(ShareLedgerException e) {
        HttpStatus status = statusFor(e.getCategory());
        log.warn("Rejected call: {} ({})", e.getErrorCode().getLabel(), e.getMessage());

        Map<String, String> error = new HashMap<>();
        error.put("error", e.getMessage());
        error.put("code", e.getErrorCode().getLabel());
        error.put("codeNumber", String.valueOf(e.getErrorCode().getNumber()));
        error.put("category", e.getCategory().name());
        error.put("status", String.valueOf(status.value()));
        return ResponseEntity.status(status).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationErrors(MethodArgumentNotValidException e) {
        Map<String, String> errors = new HashMap<>();
        e.getBindingResult().getFieldErrors().forEach(error ->
            errors.put(error.getField(), error.getDefaultMessage())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, String>> handleMissingHeader(MissingRequestHeaderException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Missing header: " + e.getHeaderName());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleIllegalArgument(IllegalArgumentException e) {
        return buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred: " + e.getMessage());
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case STATE_CONFLICT -> HttpStatus.CONFLICT;
            case STALE_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private ResponseEntity<Map<String, String>> buildErrorResponse(HttpStatus status, String message) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("status", String.valueOf(status.value()));
        return ResponseEntity.status(status).body(error);
    }
}
