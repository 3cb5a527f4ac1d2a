package com.adobe.daiji.exception;

/**
 * Thrown when numeral text does not follow the accepted grammar
 * {@code [+-]digits[.digits][E[+-]digits]}, or when a value cannot be
 * stringified into that grammar.
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class MalformedNumeralException extends InvalidInputException {

    private final String numeral;

    public MalformedNumeralException(String numeral, String reason) {
        super(String.format("Malformed numeral '%s': %s", numeral, reason));
        this.numeral = numeral;
    }

    public MalformedNumeralException(String numeral, String reason, Throwable cause) {
        super(String.format("Malformed numeral '%s': %s", numeral, reason), cause);
        this.numeral = numeral;
    }

    /**
     * @return the offending input exactly as received
     */
    public String getNumeral() {
        return numeral;
    }
}
