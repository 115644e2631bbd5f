package com.historian.anomaly.controller;

import com.historian.anomaly.exception.InsufficientDataException;
import com.historian.anomaly.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps analysis errors to 400 responses in the same {@code {"error": ..., "field": ...}}
 * shape the config endpoints use.
 */
@RestControllerAdvice
public class AnalysisExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AnalysisExceptionHandler.class);

    @ExceptionHandler(InvalidConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidConfiguration(InvalidConfigurationException e) {
        log.warn("Rejected analysis request: invalid {}: {}", e.getField(), e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Map<String, Object>> handleInsufficientData(InsufficientDataException e) {
        log.warn("Rejected analysis request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "error", e.getMessage(),
                "minimumRequired", e.getMinimumRequired()));
    }
}
