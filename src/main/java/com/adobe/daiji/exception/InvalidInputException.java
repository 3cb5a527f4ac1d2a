package com.adobe.daiji.exception;

/**
 * Exception thrown when a conversion request carries input that cannot be converted.
 * 
 * <p>This is the base type for all client-side failures of the daiji conversion,
 * such as:</p>
 * <ul>
 *   <li>Missing or blank query parameter</li>
 *   <li>Malformed numeral text ({@link MalformedNumeralException})</li>
 *   <li>A value too large for the configured large-unit table
 *       ({@link LargeUnitOverflowException})</li>
 * </ul>
 * 
 * <p>This exception results in a 400 Bad Request HTTP response with a
 * plain text error message.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class InvalidInputException extends RuntimeException {

    /**
     * Constructs an InvalidInputException with the specified message.
     * 
     * @param message the error message describing the validation failure
     */
    public InvalidInputException(String message) {
        super(message);
    }

    /**
     * Constructs an InvalidInputException with a message and cause.
     * 
     * @param message the error message
     * @param cause   the underlying cause of the exception
     */
    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
