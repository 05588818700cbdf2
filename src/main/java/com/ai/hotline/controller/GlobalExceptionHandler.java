package com.ai.hotline.controller;

import com.ai.hotline.exception.ArtifactNotFoundException;
import com.ai.hotline.exception.BackendUnavailableException;
import com.ai.hotline.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Error bodies for the non-webhook routes. Webhook turns never reach this class:
 * they always answer with a control document.
 */
@RestControllerAdvice
class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ArtifactNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(ArtifactNotFoundException ex) {
        log.info("Audio not found: {}", ex.getArtifactId());
        return error(HttpStatus.NOT_FOUND, ex, "Audio not found", "No audio artifact with that id");
    }

    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    ResponseEntity<ApiError> handleBackendUnavailable(BackendUnavailableException ex) {
        log.error("Backend unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex,
                "Backend service temporarily unavailable", "Backend: " + ex.getBackend());
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ApiError("InternalServerError", "An unexpected error occurred",
                        "See server logs", Instant.now()));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity
                .status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    @Getter
    @ToString
    @AllArgsConstructor
    static class ApiError {
        private final String errorCode;
        private final String message;
        private final String details;
        private final Instant timestamp;
    }
}
