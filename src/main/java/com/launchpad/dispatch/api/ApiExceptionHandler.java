package com.launchpad.dispatch.api;

import com.launchpad.core.model.LaunchConflictException;
import com.launchpad.core.model.LaunchNotFoundException;
import com.launchpad.core.model.LaunchPersistenceException;
import com.launchpad.core.model.LaunchSequencingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps launch errors to HTTP responses with a small JSON error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(LaunchNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(LaunchNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getLaunchId(), e.getMessage());
    }

    @ExceptionHandler(LaunchSequencingException.class)
    public ResponseEntity<Map<String, String>> sequencing(LaunchSequencingException e) {
        log.info("Rejected out-of-sequence request: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getLaunchId(), e.getMessage());
    }

    @ExceptionHandler(LaunchConflictException.class)
    public ResponseEntity<Map<String, String>> conflict(LaunchConflictException e) {
        log.info("Rejected conflicting request: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getLaunchId(), e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, null, e.getMessage());
    }

    @ExceptionHandler(LaunchPersistenceException.class)
    public ResponseEntity<Map<String, String>> storageFailure(LaunchPersistenceException e) {
        log.error("Storage failure for launch {}", e.getLaunchId(), e);
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getLaunchId(), "Launch store unavailable");
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String launchId, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message != null ? message : status.getReasonPhrase());
        if (launchId != null) {
            body.put("launch_id", launchId);
        }
        return ResponseEntity.status(status).body(body);
    }
}
