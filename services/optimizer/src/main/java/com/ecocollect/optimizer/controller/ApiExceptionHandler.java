// =============================================================================
// EcoCollect - API Exception Handler
// =============================================================================
package com.ecocollect.optimizer.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.stream.Collectors;

/**
 * Renders failures as {@code {"message": ..., "error": ...}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {
    
    static final String ROUTE_FAILURE_MESSAGE = "Error optimizing routes";
    static final String UNEXPECTED_MESSAGE = "Unexpected error";
    
    private static final String ROUTES_PATH = "/api/v1/routes";
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(new ErrorResponse("Invalid request", details));
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("Malformed request body", null));
    }
    
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
        return ResponseEntity.status(e.getStatusCode()).body(new ErrorResponse(e.getReason(), null));
    }
    
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e, HttpServletRequest request) {
        log.error("Unhandled error: path={}", request.getRequestURI(), e);
        String message = request.getRequestURI().startsWith(ROUTES_PATH)
                ? ROUTE_FAILURE_MESSAGE
                : UNEXPECTED_MESSAGE;
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(message, e.getMessage()));
    }
    
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(String message, String error) {}
}
