package com.adobe.daiji.converter;

import com.adobe.daiji.exception.MalformedNumeralException;
import com.adobe.daiji.model.NumeralDecomposition;

import java.util.Locale;

/**
 * Parses numeral text into its canonical {@link NumeralDecomposition}.
 *
 * <h2>Accepted Grammar:</h2>
 * <pre>
 * [+-] digits [. digits] [E [+-] digits]
 * </pre>
 * <p>Commas and spaces may appear anywhere and are removed first; the
 * exponent marker is case-insensitive.</p>
 *
 * <h2>Algorithm:</h2>
 * <ol>
 *   <li>Remove commas and spaces, trim, upper-case</li>
 *   <li>Take the sign from the first character, discard all leading signs</li>
 *   <li>Split into mantissa and exponent at 'E', mantissa into integer and
 *       fraction parts at '.'</li>
 *   <li>Strip leading integer zeros and trailing fraction zeros; if nothing
 *       is left the value is zero and the exponent is ignored</li>
 *   <li>Apply the exponent by moving one digit at a time across the decimal
 *       point, writing '0' when a side runs out of digits</li>
 * </ol>
 *
 * <p>Shifting is purely lexical, so no precision is lost and the exponent is
 * bounded only by {@link #getMaxExponent()}.</p>
 *
 * <h2>Examples:</h2>
 * <pre>
 * "120.3045E4" → 1203045
 * "31.4e-1"    → 3.14
 * "-1,234.50"  → -1234.5
 * "0E5"        → 0
 * </pre>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class NumeralNormalizer {

    private static final char EXPONENT_MARKER = 'E';
    private static final char DECIMAL_POINT = '.';

    // Largest array size most JVMs allocate.
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private final int maxExponent;

    /**
     * Creates a normalizer that accepts any exponent an {@code int} can hold.
     */
    public NumeralNormalizer() {
        this(Integer.MAX_VALUE);
    }

    /**
     * Creates a normalizer that rejects exponents whose magnitude exceeds the limit.
     *
     * @param maxExponent the largest accepted absolute exponent value
     * @throws IllegalArgumentException if the limit is negative
     */
    public NumeralNormalizer(int maxExponent) {
        if (maxExponent < 0) {
            throw new IllegalArgumentException("Maximum exponent must not be negative, got: " + maxExponent);
        }
        this.maxExponent = maxExponent;
    }

    public int getMaxExponent() {
        return maxExponent;
    }

    /**
     * Normalizes numeral text.
     *
     * @param numeral the numeral text
     * @return the canonical decomposition
     * @throws MalformedNumeralException if the text does not follow the accepted grammar
     */
    public NumeralDecomposition normalize(String numeral) {
        if (numeral == null) {
            throw new MalformedNumeralException("null", "numeral must not be null");
        }

        String text = numeral.replace(",", "").replace(" ", "").trim().toUpperCase(Locale.ROOT);
        if (text.isEmpty()) {
            throw new MalformedNumeralException(numeral, "no numeral characters found");
        }

        boolean minus = text.charAt(0) == '-';
        text = stripLeadingSigns(text);

        int markerIndex = text.indexOf(EXPONENT_MARKER);
        String mantissa = markerIndex < 0 ? text : text.substring(0, markerIndex);
        int exponent = markerIndex < 0 ? 0 : parseExponent(numeral, text.substring(markerIndex + 1));

        int pointIndex = mantissa.indexOf(DECIMAL_POINT);
        String integerPart = pointIndex < 0 ? mantissa : mantissa.substring(0, pointIndex);
        String fractionPart = pointIndex < 0 ? "" : mantissa.substring(pointIndex + 1);
        if (fractionPart.indexOf(DECIMAL_POINT) >= 0) {
            throw new MalformedNumeralException(numeral, "more than one decimal point");
        }
        if (integerPart.isEmpty() && fractionPart.isEmpty()) {
            throw new MalformedNumeralException(numeral, "mantissa has no digits");
        }
        requireDigits(numeral, integerPart);
        requireDigits(numeral, fractionPart);

        NumeralDecomposition unshifted = new NumeralDecomposition(minus, integerPart, fractionPart);
        if (unshifted.isZero() || exponent == 0) {
            return unshifted;
        }

        return shift(unshifted, exponent);
    }

    /**
     * Moves the decimal point {@code exponent} places, right for positive values
     * and left for negative ones, writing '0' for each place beyond the digits
     * on the side being drained. Runs in time linear in the digit count plus
     * the exponent magnitude.
     */
    private static NumeralDecomposition shift(NumeralDecomposition value, int exponent) {
        String integerPart = value.integerDigits();
        String fractionPart = value.fractionDigits();

        if (exponent > 0) {
            int moved = Math.min(exponent, fractionPart.length());
            StringBuilder integerDigits = new StringBuilder(capacity((long) integerPart.length() + exponent))
                .append(integerPart)
                .append(fractionPart, 0, moved);
            appendZeros(integerDigits, exponent - moved);
            return new NumeralDecomposition(value.minus(), integerDigits.toString(), fractionPart.substring(moved));
        }

        long places = -(long) exponent;
        int moved = (int) Math.min(places, integerPart.length());
        int kept = integerPart.length() - moved;
        StringBuilder fractionDigits = new StringBuilder(capacity(places + fractionPart.length()));
        appendZeros(fractionDigits, places - moved);
        fractionDigits.append(integerPart, kept, integerPart.length()).append(fractionPart);
        return new NumeralDecomposition(value.minus(), integerPart.substring(0, kept), fractionDigits.toString());
    }

    private static int capacity(long digits) {
        return (int) Math.min(digits, MAX_CAPACITY);
    }

    private static void appendZeros(StringBuilder digits, long count) {
        for (long i = 0; i < count; i++) {
            digits.append('0');
        }
    }

    private int parseExponent(String numeral, String field) {
        if (field.indexOf(EXPONENT_MARKER) >= 0) {
            throw new MalformedNumeralException(numeral, "more than one exponent marker");
        }
        if (field.isEmpty()) {
            throw new MalformedNumeralException(numeral, "exponent is empty");
        }

        int exponent;
        try {
            exponent = Integer.parseInt(field);
        } catch (NumberFormatException e) {
            throw new MalformedNumeralException(numeral, "exponent '" + field + "' is not an integer", e);
        }

        if (Math.abs((long) exponent) > maxExponent) {
            throw new MalformedNumeralException(numeral,
                String.format("exponent %d exceeds the limit of %d", exponent, maxExponent));
        }
        return exponent;
    }

    private static void requireDigits(String numeral, String part) {
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c < '0' || c > '9') {
                throw new MalformedNumeralException(numeral, String.format("unexpected character '%c'", c));
            }
        }
    }

    private static String stripLeadingSigns(String text) {
        int start = 0;
        while (start < text.length() && (text.charAt(start) == '-' || text.charAt(start) == '+')) {
            start++;
        }
        return text.substring(start);
    }
}
