package com.example.coldchain.controller;

import com.example.coldchain.exception.AlertLockedException;
import com.example.coldchain.exception.InvalidTransitionException;
import com.example.coldchain.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain errors to HTTP: unknown id 404, illegal transition 409,
 * alert or row busy 409, bad input 400, anything else 500.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Object> handleNotFound(NotFoundException ex) {
        log.warn("Not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), null);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<Object> handleInvalidTransition(InvalidTransitionException ex) {
        log.warn("Rejected transition: {} (current status {})", ex.getMessage(), ex.getCurrentStatus());
        return body(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), ex.getCurrentStatus());
    }

    @ExceptionHandler(AlertLockedException.class)
    public ResponseEntity<Object> handleLocked(AlertLockedException ex) {
        log.warn("Alert {} busy: {}", ex.getAlertId(), ex.getMessage());
        return body(HttpStatus.CONFLICT, "Conflict", "Alert is being processed, try again.", null);
    }

    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<Object> handleRowLockTimeout(PessimisticLockingFailureException ex) {
        log.warn("Row lock wait timed out: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "Conflict", "Resource is busy, try again.", null);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Object> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected error while handling request", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred.", null);
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message, String currentStatus) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        if (currentStatus != null) {
            body.put("current_status", currentStatus);
        }
        return ResponseEntity.status(status).body(body);
    }
}
