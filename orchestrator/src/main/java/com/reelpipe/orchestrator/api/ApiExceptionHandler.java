package com.reelpipe.orchestrator.api;

import com.reelpipe.orchestrator.service.ChunkGroupNotFoundException;
import com.reelpipe.orchestrator.service.IllegalJobStateException;
import com.reelpipe.orchestrator.service.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps service exceptions to HTTP statuses with a {"error", "status"} body.
 *
 * 404 unknown job or chunk group, 409 transition not allowed in the current
 * state, 400 malformed input.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({JobNotFoundException.class, ChunkGroupNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalJobStateException.class)
    public ResponseEntity<Map<String, Object>> conflict(IllegalJobStateException e) {
        log.info("Rejected request: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    // A second active job for the same project and kind lost the race on the unique index.
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> duplicate(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return body(HttpStatus.CONFLICT, "an active job already exists for this project and kind");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message == null ? status.getReasonPhrase() : message,
                             "status", status.value()));
    }
}
