package com.cloud.costspike.controller;

import com.cloud.costspike.exception.CostDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.Map;

/**
 * Maps rejected input to 400 responses the dashboard can show verbatim.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CostDataException.class)
    public ResponseEntity<Map<String, String>> handleCostData(CostDataException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", e.getMessage(),
                "type", e.getKind().name()));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<Map<String, String>> handleMissingFile(MissingServletRequestPartException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", "Multipart part '" + e.getRequestPartName() + "' is required"));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> handleTooLarge(MaxUploadSizeExceededException e) {
        log.warn("Upload rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of(
                "error", "Uploaded file exceeds the maximum allowed size"));
    }
}
