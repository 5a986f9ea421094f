package com.example.cronkeeper.exception;

import com.example.cronkeeper.dto.ControlResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for the control plane.
 * Renders every failure as a {@code {code, data}} envelope whose code matches the HTTP status.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ControlResponse<String>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        var errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(this::formatFieldError)
                .toList();

        log.warn("Validation failed: {}", errors);

        return respond(HttpStatus.BAD_REQUEST, "Validation failed: " + String.join(", ", errors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ControlResponse<String>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Malformed request: {}", ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ControlResponse<String>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());

        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(InvalidTokenException.class)
    public ResponseEntity<ControlResponse<String>> handleInvalidToken(InvalidTokenException ex) {
        return respond(HttpStatus.UNAUTHORIZED, ex.getMessage());
    }

    @ExceptionHandler(EntryNotFoundException.class)
    public ResponseEntity<ControlResponse<String>> handleEntryNotFound(EntryNotFoundException ex) {
        log.warn(ex.getMessage());

        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(WorkTransitionException.class)
    public ResponseEntity<ControlResponse<String>> handleWorkTransition(WorkTransitionException ex) {
        log.error("Transition of entry {} failed: {}", ex.getEntryName(), ex.getMessage());

        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ControlResponse<String>> handleIllegalState(IllegalStateException ex) {
        log.warn("Invalid state: {}", ex.getMessage());

        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ConfigPersistenceException.class)
    public ResponseEntity<ControlResponse<String>> handleConfigPersistence(ConfigPersistenceException ex) {
        log.error("Config persistence error: {}", ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ControlResponse<String>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);

        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + ex.getMessage());
    }

    private ResponseEntity<ControlResponse<String>> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ControlResponse.error(status.value(), message));
    }

    private String formatFieldError(FieldError error) {
        return String.format("%s: %s", error.getField(), error.getDefaultMessage());
    }
}
