package com.analytics.workflow.api;

import com.analytics.workflow.domain.exception.ExecutionNotFoundException;
import com.analytics.workflow.domain.exception.QueueBackendUnavailableException;
import com.analytics.workflow.domain.exception.ValidationException;
import com.analytics.workflow.domain.exception.WorkflowNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {
    
    private GlobalExceptionHandler handler;
    private MockHttpServletRequest request;
    
    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        request = new MockHttpServletRequest("GET", "/api/v1/workflows/wf-1");
    }
    
    @Test
    void testHandleNotFound_MapsTo404WithCode() {
        // When
        ResponseEntity<ErrorResponse> workflow = handler.handleNotFound(new WorkflowNotFoundException("wf-1"), request);
        ResponseEntity<ErrorResponse> execution = handler.handleNotFound(new ExecutionNotFoundException("exec-1"), request);
        
        // Then
        assertEquals(HttpStatus.NOT_FOUND, workflow.getStatusCode());
        assertEquals("WORKFLOW_NOT_FOUND", workflow.getBody().getErrorCode());
        assertEquals("/api/v1/workflows/wf-1", workflow.getBody().getPath());
        assertEquals(404, execution.getBody().getStatus());
    }
    
    @Test
    void testHandleValidation_MapsTo400() {
        // When
        ResponseEntity<ErrorResponse> response = handler.handleValidation(
                new ValidationException("since must not be after until"), request);
        
        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(ValidationException.CODE, response.getBody().getErrorCode());
        assertEquals("since must not be after until", response.getBody().getMessage());
    }
    
    @Test
    void testHandleBadRequest_IllegalArgumentUsesValidationCode() {
        // When
        ResponseEntity<ErrorResponse> response = handler.handleBadRequest(
                new IllegalArgumentException("tenantId is required"), request);
        
        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(ValidationException.CODE, response.getBody().getErrorCode());
    }
    
    @Test
    void testHandleQueueUnavailable_MapsTo503() {
        // When
        ResponseEntity<ErrorResponse> response = handler.handleQueueUnavailable(
                new QueueBackendUnavailableException("redis down", new RuntimeException("refused")), request);
        
        // Then
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals("QUEUE_UNAVAILABLE", response.getBody().getErrorCode());
    }
    
    @Test
    void testHandleUnexpected_HidesInternalMessage() {
        // When
        ResponseEntity<ErrorResponse> response = handler.handleUnexpected(new IllegalStateException("secret"), request);
        
        // Then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("INTERNAL_ERROR", response.getBody().getErrorCode());
        assertFalse(response.getBody().getMessage().contains("secret"));
    }
}
