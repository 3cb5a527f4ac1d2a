package com.adobe.daiji.model;

import com.adobe.daiji.exception.MalformedNumeralException;

/**
 * Canonical, exponent-free form of a numeral: a sign plus an integer digit
 * string and a fraction digit string.
 *
 * <p>The record normalizes itself on construction:</p>
 * <ul>
 *   <li>leading zeros of {@code integerDigits} and trailing zeros of
 *       {@code fractionDigits} are stripped</li>
 *   <li>an empty string means the part is absent</li>
 *   <li>a value with neither part is zero, and zero is never negative</li>
 * </ul>
 *
 * <h2>Examples:</h2>
 * <pre>
 * new NumeralDecomposition(false, "00120", "3040")  → 120.304
 * new NumeralDecomposition(true,  "",      "5")     → -0.5
 * new NumeralDecomposition(true,  "000",   "00")    → 0 (minus cleared)
 * </pre>
 *
 * <p>Instances are immutable; truncation returns a new value.</p>
 *
 * @param minus          true if the value is negative (always false for zero)
 * @param integerDigits  the integer part, digits only, without leading zeros
 * @param fractionDigits the fraction part, digits only, without trailing zeros
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public record NumeralDecomposition(boolean minus, String integerDigits, String fractionDigits) {

    /**
     * The zero value.
     */
    public static final NumeralDecomposition ZERO = new NumeralDecomposition(false, "", "");

    /**
     * Validates both digit strings and applies the zero normalization rules.
     *
     * @throws MalformedNumeralException if either string contains a character other than '0'-'9'
     */
    public NumeralDecomposition {
        integerDigits = stripLeadingZeros(requireDigits(integerDigits, "integer"));
        fractionDigits = stripTrailingZeros(requireDigits(fractionDigits, "fraction"));
        if (integerDigits.isEmpty() && fractionDigits.isEmpty()) {
            minus = false;
        }
    }

    /**
     * @return true if the value is exactly zero
     */
    public boolean isZero() {
        return integerDigits.isEmpty() && fractionDigits.isEmpty();
    }

    public boolean hasIntegerPart() {
        return !integerDigits.isEmpty();
    }

    public boolean hasFractionPart() {
        return !fractionDigits.isEmpty();
    }

    /**
     * Drops the fraction part. The result may be zero, in which case the sign is cleared.
     *
     * @return this value truncated toward zero
     */
    public NumeralDecomposition withoutFraction() {
        if (fractionDigits.isEmpty()) {
            return this;
        }
        return new NumeralDecomposition(minus, integerDigits, "");
    }

    /**
     * Drops the integer part. The result may be zero, in which case the sign is cleared.
     *
     * @return the signed fraction part of this value
     */
    public NumeralDecomposition withoutInteger() {
        if (integerDigits.isEmpty()) {
            return this;
        }
        return new NumeralDecomposition(minus, "", fractionDigits);
    }

    /**
     * Formats the value as {@code [-]integer[.fraction]}.
     *
     * <pre>
     * 0        → "0"
     * 0.1      → "0.1"
     * -1.2     → "-1.2"
     * 1203045  → "1203045"
     * </pre>
     *
     * @return the plain decimal representation, never in exponent form
     */
    public String toPlainString() {
        if (isZero()) {
            return "0";
        }

        StringBuilder sb = new StringBuilder(integerDigits.length() + fractionDigits.length() + 3);
        if (minus) {
            sb.append('-');
        }
        sb.append(integerDigits.isEmpty() ? "0" : integerDigits);
        if (!fractionDigits.isEmpty()) {
            sb.append('.').append(fractionDigits);
        }
        return sb.toString();
    }

    private static String requireDigits(String digits, String part) {
        if (digits == null) {
            throw new MalformedNumeralException("null", part + " digits must not be null");
        }
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedNumeralException(digits,
                    String.format("unexpected character '%c' in %s digits", c, part));
            }
        }
        return digits;
    }

    private static String stripLeadingZeros(String digits) {
        int start = 0;
        while (start < digits.length() && digits.charAt(start) == '0') {
            start++;
        }
        return digits.substring(start);
    }

    private static String stripTrailingZeros(String digits) {
        int end = digits.length();
        while (end > 0 && digits.charAt(end - 1) == '0') {
            end--;
        }
        return digits.substring(0, end);
    }
}
