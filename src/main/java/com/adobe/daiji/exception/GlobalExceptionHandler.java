package com.adobe.daiji.exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.nio.charset.StandardCharsets;

/**
 * Global exception handler for the daiji API.
 *
 * <p>Error responses are UTF-8 plain text of the form {@code Error: <message>};
 * success responses are JSON.</p>
 *
 * <h2>Status Mapping:</h2>
 * <ul>
 *   <li>{@link MalformedNumeralException}, {@link LargeUnitOverflowException},
 *       other {@link InvalidInputException}s and bad parameters → 400</li>
 *   <li>{@link NoResourceFoundException} → 404</li>
 *   <li>Anything unexpected → 500</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Plain text with an explicit charset, since messages echo kanji input back.
     */
    public static final MediaType TEXT_PLAIN_UTF8 = new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8);

    /**
     * Handles numerals that do not follow the accepted grammar.
     *
     * @param ex the MalformedNumeralException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(MalformedNumeralException.class)
    public ResponseEntity<String> handleMalformedNumeral(MalformedNumeralException ex) {
        logger.warn("Malformed numeral: {}", ex.getMessage());

        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles values too large for the configured large-unit table.
     *
     * @param ex the LargeUnitOverflowException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(LargeUnitOverflowException.class)
    public ResponseEntity<String> handleLargeUnitOverflow(LargeUnitOverflowException ex) {
        logger.warn("Large unit overflow at group {}: {}", ex.getGroupIndex(), ex.getMessage());

        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles the remaining validation errors.
     *
     * @param ex the InvalidInputException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<String> handleInvalidInputException(InvalidInputException ex) {
        logger.warn("Invalid input: {}", ex.getMessage());

        return buildErrorResponse(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    /**
     * Handles missing required request parameters.
     *
     * @param ex the MissingServletRequestParameterException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<String> handleMissingParameter(MissingServletRequestParameterException ex) {
        String paramName = ex.getParameterName();
        logger.warn("Missing required parameter: {}", paramName);

        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Missing required parameter '" + paramName + "'");
    }

    /**
     * Handles type mismatch exceptions, e.g. {@code appendOne=maybe}.
     *
     * @param ex the MethodArgumentTypeMismatchException
     * @return ResponseEntity with plain text error message and 400 status
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<String> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String paramName = ex.getName();
        Object value = ex.getValue();
        logger.warn("Type mismatch for parameter '{}': {}", paramName, value);

        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "value";
        return buildErrorResponse(HttpStatus.BAD_REQUEST,
            "Invalid value '" + value + "' for parameter '" + paramName + "'. Expected " + expected + ".");
    }

    /**
     * Handles requests for non-existent resources (404).
     *
     * @param ex the NoResourceFoundException
     * @return ResponseEntity with plain text error message and 404 status
     */
    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<String> handleNoResourceFound(NoResourceFoundException ex) {
        logger.warn("Resource not found: {}", ex.getResourcePath());

        return buildErrorResponse(HttpStatus.NOT_FOUND, "Resource not found: " + ex.getResourcePath());
    }

    /**
     * Catch-all handler for unexpected exceptions.
     *
     * <p>Includes the correlation ID in the response for easier issue reporting.</p>
     *
     * @param ex the Exception
     * @return ResponseEntity with generic error message and 500 status
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleGenericException(Exception ex) {
        String correlationId = MDC.get("correlationId");
        logger.error("Unexpected error occurred [correlationId={}]", correlationId, ex);

        String message = "An unexpected error occurred. Please try again later.";
        if (correlationId != null) {
            message += " (Reference: " + correlationId + ")";
        }

        return buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    private ResponseEntity<String> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity
            .status(status)
            .contentType(TEXT_PLAIN_UTF8)
            .body("Error: " + message);
    }
}
