package com.hospitality.staysync.controller;

import com.hospitality.staysync.exception.StayNotFoundException;
import com.hospitality.staysync.exception.StaySyncException;
import com.hospitality.staysync.exception.UnknownPmsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Consistent JSON error bodies for sync exceptions that reach the REST layer.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UnknownPmsException.class)
    public ResponseEntity<Map<String, String>> handleUnknownPms(UnknownPmsException ex) {
        log.warn("Unknown PMS: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "UNKNOWN_PMS", ex.getMessage());
    }

    @ExceptionHandler(StayNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleStayNotFound(StayNotFoundException ex) {
        log.warn("Stay not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "STAY_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(StaySyncException.class)
    public ResponseEntity<Map<String, String>> handleSyncException(StaySyncException ex) {
        log.error("Sync error: {}", ex.getMessage(), ex);
        return error(HttpStatus.BAD_GATEWAY, "SYNC_ERROR", ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "errorCode", code,
                "message", message == null ? "" : message
        ));
    }
}
