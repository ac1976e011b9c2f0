package com.wallet.monitor.controller;

import com.wallet.monitor.adapter.UnsupportedChainException;
import com.wallet.monitor.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps caller errors to 400 with an {@code {error, field}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnsupportedChainException.class)
    public ResponseEntity<Map<String, String>> handleUnsupportedChain(UnsupportedChainException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return badRequest(ex.getMessage(), "chain");
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException ex) {
        log.debug("Rejected request: {} ({})", ex.getMessage(), ex.getField());
        return badRequest(ex.getMessage(), ex.getField());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return badRequest("Malformed request body", "body");
    }

    private ResponseEntity<Map<String, String>> badRequest(String error, String field) {
        return ResponseEntity.badRequest().body(Map.of("error", error, "field", field));
    }
}
