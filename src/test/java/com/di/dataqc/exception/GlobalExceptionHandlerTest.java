package com.di.dataqc.exception;

import com.di.dataqc.aspect.ErrorCategory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for GlobalExceptionHandler error bodies.
 */
@DisplayName("GlobalExceptionHandler Tests")
class GlobalExceptionHandlerTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should build an error body with category and path")
    void testErrorResponse() {
        MDC.put("requestPath", "/api/v1/qc/run");
        GlobalExceptionHandler.ErrorResponse response = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.NOT_FOUND, new ResourceNotFoundException("Result", "abc"), HttpStatus.NOT_FOUND);

        assertEquals(404, response.getStatus());
        assertEquals("Not Found", response.getError());
        assertEquals("Result not found: abc", response.getMessage());
        assertEquals("NOT_FOUND", response.getErrorCategory());
        assertEquals("Not found", response.getErrorCategoryName());
        assertEquals("/api/v1/qc/run", response.getPath());
        assertEquals(ResourceNotFoundException.class.getName(), response.getDetails().get("exceptionType"));
        assertFalse(response.getDetails().containsKey("rootCauseType"));
    }

    @Test
    @DisplayName("Should report the root cause and an unknown path")
    void testRootCause() {
        ConnectorException ex = new ConnectorException("file", "Failed to read a.csv", new IOException("disk"));
        GlobalExceptionHandler.ErrorResponse response = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.CONNECTOR_ERROR, ex, HttpStatus.BAD_REQUEST);

        assertEquals("/unknown", response.getPath());
        assertEquals(IOException.class.getName(), response.getDetails().get("rootCauseType"));
        assertEquals("disk", response.getDetails().get("rootCauseMessage"));
    }

    @Test
    @DisplayName("Should fall back to the exception type when there is no message")
    void testNoMessage() {
        GlobalExceptionHandler.ErrorResponse response = GlobalExceptionHandler.buildErrorResponse(
                ErrorCategory.APPLICATION_ERROR, new IllegalStateException(), HttpStatus.INTERNAL_SERVER_ERROR);
        assertEquals("IllegalStateException", response.getMessage());
    }
}
