package com.machine.signals.exception;

import com.machine.common.exception.InvalidSignalTypeException;
import com.machine.common.model.SignalType;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Arrays;
import java.util.List;

/**
 * Global exception handler for REST endpoints.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final List<String> SUPPORTED_TYPES = Arrays.stream(SignalType.values())
            .map(SignalType::getValue)
            .toList();

    /**
     * Unknown signal types are client errors and are not logged as faults.
     */
    @ExceptionHandler(InvalidSignalTypeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignalType(
            InvalidSignalTypeException ex, HttpServletRequest request) {

        log.debug("Rejected signal type '{}' for {}", ex.getSignalType(), request.getRequestURI());

        ErrorResponse response = ErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Invalid Signal Type")
                .message(ex.getMessage())
                .path(request.getRequestURI())
                .supportedTypes(SUPPORTED_TYPES)
                .build();

        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        log.error("Storage constraint violated for {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        ErrorResponse response = ErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("Internal Server Error")
                .message("Stored data violates the signal table constraints")
                .path(request.getRequestURI())
                .reason(ex.reason())
                .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    /**
     * Unreachable storage, an exhausted pool or a transient failure: the
     * service is up but cannot answer right now.
     */
    @ExceptionHandler(SignalStorageException.class)
    public ResponseEntity<ErrorResponse> handleStorageFailure(
            SignalStorageException ex, HttpServletRequest request) {

        log.warn("Storage unavailable for {} ({}): {}", request.getRequestURI(), ex.reason(), ex.getMessage());

        ErrorResponse response = ErrorResponse.builder()
                .status(HttpStatus.SERVICE_UNAVAILABLE.value())
                .error("Service Unavailable")
                .message("Signal storage is currently unavailable")
                .path(request.getRequestURI())
                .reason(ex.reason())
                .build();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    /**
     * Handle all other exceptions. Framework errors that carry their own status
     * (unknown path, wrong method) keep it.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {

        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            log.debug("Request {} failed with {}: {}", request.getRequestURI(), status, ex.getMessage());
            return ResponseEntity.status(status).body(ErrorResponse.builder()
                    .status(status.value())
                    .error(framework.getBody().getTitle())
                    .message(ex.getMessage())
                    .path(request.getRequestURI())
                    .build());
        }

        log.error("Unexpected error for {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        ErrorResponse response = ErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("Internal Server Error")
                .message("An unexpected error occurred")
                .path(request.getRequestURI())
                .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
