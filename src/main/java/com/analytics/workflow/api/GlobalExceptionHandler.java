package com.analytics.workflow.api;

import com.analytics.workflow.domain.exception.ExecutionNotFoundException;
import com.analytics.workflow.domain.exception.QueueBackendUnavailableException;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.exception.WorkflowEngineException;
import com.analytics.workflow.domain.exception.WorkflowNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex,
                                                                HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.put(error.getField(), error.getDefaultMessage());
        }
        
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, ValidationException.CODE, "Request validation failed", request);
        body.setDetails(errors);
        return ResponseEntity.badRequest().body(body);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, HttpServletRequest request) {
        log.debug("Validation error on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), request);
    }
    
    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        log.debug("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ValidationException.CODE, ex.getMessage(), request);
    }
    
    @ExceptionHandler({WorkflowNotFoundException.class, ExecutionNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(WorkflowEngineException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(QueueBackendUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleQueueUnavailable(QueueBackendUnavailableException ex,
                                                                HttpServletRequest request) {
        log.warn("Webhook queue unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(WorkflowEngineException.class)
    public ResponseEntity<ErrorResponse> handleEngineError(WorkflowEngineException ex, HttpServletRequest request) {
        log.error("Workflow engine error on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage(), request);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error on {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", request);
    }
    
    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message,
                                                         HttpServletRequest request) {
        return ResponseEntity.status(status).body(build(status, errorCode, message, request));
    }
    
    private static ErrorResponse build(HttpStatus status, String errorCode, String message, HttpServletRequest request) {
        return ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .errorCode(errorCode)
                .message(message)
                .path(request.getRequestURI())
                .build();
    }
}
