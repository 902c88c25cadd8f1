package com.pathtopology.engine.controller;

import com.pathtopology.engine.exception.ElevationUnavailableException;
import com.pathtopology.engine.exception.EventNotFoundException;
import com.pathtopology.engine.exception.InvalidEventException;
import com.pathtopology.engine.exception.InvalidGeometryException;
import com.pathtopology.engine.exception.NonSimpleGeometryException;
import com.pathtopology.engine.exception.SegmentNotFoundException;
import com.pathtopology.engine.exception.SegmentOverlapException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps pipeline failures to JSON error bodies.
 *
 * By the time a handler runs the transaction has already been rolled back.
 */
@RestControllerAdvice
@Slf4j
public class TopologyExceptionHandler {

    @ExceptionHandler(SegmentOverlapException.class)
    public ResponseEntity<?> handleOverlap(SegmentOverlapException e) {
        log.warn("Rejected segment write: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "REJECTED");
        body.put("error", "SEGMENT_OVERLAP");
        body.put("message", e.getMessage());
        body.put("conflictingSegmentId", e.getConflictingSegmentId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
    }

    @ExceptionHandler(NonSimpleGeometryException.class)
    public ResponseEntity<?> handleNonSimple(NonSimpleGeometryException e) {
        log.warn("Rejected segment write: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "NON_SIMPLE_GEOMETRY", e.getMessage());
    }

    @ExceptionHandler(InvalidGeometryException.class)
    public ResponseEntity<?> handleInvalidGeometry(InvalidGeometryException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_GEOMETRY", e.getMessage());
    }

    @ExceptionHandler(InvalidEventException.class)
    public ResponseEntity<?> handleInvalidEvent(InvalidEventException e) {
        return error(HttpStatus.BAD_REQUEST, "INVALID_EVENT", e.getMessage());
    }

    @ExceptionHandler({SegmentNotFoundException.class, EventNotFoundException.class})
    public ResponseEntity<?> handleNotFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(ElevationUnavailableException.class)
    public ResponseEntity<?> handleElevationUnavailable(ElevationUnavailableException e) {
        log.error("Segment write aborted: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "ELEVATION_UNAVAILABLE", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> handleValidation(MethodArgumentNotValidException e) {
        List<String> violations = e.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
            .toList();
        return ResponseEntity.badRequest().body(Map.of(
            "status", "REJECTED",
            "error", "INVALID_REQUEST",
            "violations", violations
        ));
    }

    private static ResponseEntity<?> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
            "status", "REJECTED",
            "error", error,
            "message", message
        ));
    }
}
