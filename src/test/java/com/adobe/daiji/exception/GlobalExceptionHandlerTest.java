package com.adobe.daiji.exception;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link GlobalExceptionHandler}.
 * Calls each handler method directly.
 */
@DisplayName("GlobalExceptionHandler Unit Tests")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
        MDC.clear();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("handleMalformedNumeral returns 400 naming the input")
    void shouldHandleMalformedNumeral() {
        MalformedNumeralException ex = new MalformedNumeralException("壱x", "unexpected character 'X'");

        ResponseEntity<String> response = handler.handleMalformedNumeral(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(GlobalExceptionHandler.TEXT_PLAIN_UTF8, response.getHeaders().getContentType());
        assertEquals("Error: Malformed numeral '壱x': unexpected character 'X'", response.getBody());
    }

    @Test
    @DisplayName("handleLargeUnitOverflow returns 400 with group details")
    void shouldHandleLargeUnitOverflow() {
        ResponseEntity<String> response = handler.handleLargeUnitOverflow(new LargeUnitOverflowException(17, 17));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertTrue(response.getBody().contains("4-digit group 17"));
    }

    @Test
    @DisplayName("handleInvalidInputException returns 400 with message")
    void shouldHandleInvalidInputException() {
        InvalidInputException ex = new InvalidInputException("Missing required parameter.");

        ResponseEntity<String> response = handler.handleInvalidInputException(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Error: Missing required parameter.", response.getBody());
    }

    @Test
    @DisplayName("handleMissingParameter returns 400 with parameter name")
    void shouldHandleMissingParameter() {
        MissingServletRequestParameterException ex =
            new MissingServletRequestParameterException("query", "String");

        ResponseEntity<String> response = handler.handleMissingParameter(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertTrue(response.getBody().contains("query"));
    }

    @Test
    @DisplayName("handleTypeMismatch returns 400 with parameter details")
    void shouldHandleTypeMismatch() {
        MethodArgumentTypeMismatchException ex = new MethodArgumentTypeMismatchException(
            "maybe", Boolean.class, "appendOne", null, new IllegalArgumentException("Invalid boolean value")
        );

        ResponseEntity<String> response = handler.handleTypeMismatch(ex);

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("Error: Invalid value 'maybe' for parameter 'appendOne'. Expected Boolean.", response.getBody());
    }

    @Test
    @DisplayName("handleNoResourceFound returns 404 with path")
    void shouldHandleNoResourceFound() {
        NoResourceFoundException ex = new NoResourceFoundException(HttpMethod.GET, "nonexistent");

        ResponseEntity<String> response = handler.handleNoResourceFound(ex);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertTrue(response.getBody().contains("not found"));
    }

    @Test
    @DisplayName("ConfigurationException falls through to the generic 500 response")
    void shouldTreatConfigurationExceptionAsUnexpected() {
        ResponseEntity<String> response = handler.handleGenericException(
            new ConfigurationException("The positional-unit name table needs at least 4 entries, got: 2"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertFalse(response.getBody().contains("positional-unit"));
        assertTrue(response.getBody().startsWith("Error: An unexpected error occurred."));
    }

    @Test
    @DisplayName("handleGenericException returns 500 without correlation ID")
    void shouldHandleGenericExceptionWithoutCorrelationId() {
        ResponseEntity<String> response = handler.handleGenericException(new RuntimeException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertFalse(response.getBody().contains("Reference"));
        assertFalse(response.getBody().contains("boom"));
    }

    @Test
    @DisplayName("handleGenericException includes the correlation ID when present")
    void shouldHandleGenericExceptionWithCorrelationId() {
        MDC.put("correlationId", "abc12345");

        ResponseEntity<String> response = handler.handleGenericException(new IllegalStateException("boom"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertTrue(response.getBody().contains("(Reference: abc12345)"));
    }
}
