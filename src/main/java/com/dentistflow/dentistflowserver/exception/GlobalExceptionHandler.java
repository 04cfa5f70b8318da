package com.dentistflow.dentistflowserver.exception;

import com.dentistflow.dentistflowserver.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Maps every exception leaving a controller to the {@link ApiResponse} error
 * envelope. Only messages written for callers are passed through, anything
 * unexpected gets a generic text and a stack trace in the log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ClinicException.class)
    public ResponseEntity<ApiResponse<Void>> handleClinicException(ClinicException ex, HttpServletRequest request) {
        if (ex.getKind() == ErrorKind.INTERNAL) {
            log.error("{} {} failed: {}", request.getMethod(), request.getRequestURI(), ex.getMessage(), ex);
        } else {
            log.debug("{} {} -> {}: {}", request.getMethod(), request.getRequestURI(), ex.getKind(), ex.getMessage());
        }
        return respond(ex.getKind(), ex.getMessage());
    }

    // @Valid on @RequestBody
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(MethodArgumentNotValidException ex) {
        String errorMessage = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining(", "));
        return respond(ErrorKind.VALIDATION_ERROR, errorMessage);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(ErrorKind.VALIDATION_ERROR, "Invalid request body");
    }

    // e.g. /api/appointments/abc
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return respond(ErrorKind.VALIDATION_ERROR, "Invalid " + ex.getName());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiResponse<Void>> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return respond(ErrorKind.VALIDATION_ERROR, "Method " + ex.getMethod() + " not supported");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handle404(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(ErrorKind.NOT_FOUND, "Resource not found: " + request.getRequestURI());
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAccessDenied(AccessDeniedException ex) {
        return respond(ErrorKind.PERMISSION_DENIED, "Permission denied.");
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleStorageError(DataAccessException ex, HttpServletRequest request) {
        log.error("Storage failure on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorKind.INTERNAL, "Storage failure");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleInternalError(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ErrorKind.INTERNAL, "Internal server error");
    }

    private static ResponseEntity<ApiResponse<Void>> respond(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.getStatus()).body(ApiResponse.error(kind, message));
    }
}
