package com.adobe.daiji.converter;

import com.adobe.daiji.exception.MalformedNumeralException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns built-in numeric values into numeral text the {@link NumeralNormalizer} accepts.
 *
 * <h2>Supported Types:</h2>
 * <ul>
 *   <li><b>Byte, Short, Integer, Long, AtomicInteger, AtomicLong, BigInteger:</b>
 *       exact decimal digits</li>
 *   <li><b>Float, Double:</b> the exact binary value rounded to
 *       {@value #FLOATING_POINT_DIGITS} significant digits, which keeps every
 *       digit a double can carry (0.1 → 0.10000000000000000555111512312578270)</li>
 *   <li><b>BigDecimal:</b> its full unscaled value and scale</li>
 * </ul>
 *
 * <p>Any other {@link Number} subtype is rejected rather than guessed at.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public final class NumeralFormatter {

    /**
     * Significant digits kept when expanding binary floating-point values.
     */
    public static final int FLOATING_POINT_DIGITS = 35;

    private static final MathContext FLOATING_POINT_CONTEXT =
        new MathContext(FLOATING_POINT_DIGITS, RoundingMode.HALF_EVEN);

    private NumeralFormatter() {
    }

    /**
     * Formats a numeric value as numeral text.
     *
     * @param value the value to format
     * @return numeral text, possibly in exponent form
     * @throws NullPointerException      if value is null
     * @throws MalformedNumeralException if the value is NaN, infinite, or of an unsupported type
     */
    public static String format(Number value) {
        Objects.requireNonNull(value, "value must not be null");

        if (value instanceof Integer || value instanceof Long
                || value instanceof Short || value instanceof Byte
                || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return Long.toString(value.longValue());
        }
        if (value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof BigDecimal) {
            return value.toString();
        }
        if (value instanceof Double || value instanceof Float) {
            return format(value.doubleValue());
        }

        throw new MalformedNumeralException(String.valueOf(value),
            "unsupported numeric type " + value.getClass().getName());
    }

    /**
     * Formats a binary floating-point value.
     *
     * @param value the value to format
     * @return numeral text with at most {@value #FLOATING_POINT_DIGITS} significant digits
     * @throws MalformedNumeralException if the value is NaN or infinite
     */
    public static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new MalformedNumeralException(Double.toString(value), "not a finite number");
        }
        return new BigDecimal(value).round(FLOATING_POINT_CONTEXT).toString();
    }

    /**
     * Formats an integral value.
     *
     * @param value the value to format
     * @return the exact decimal digits
     */
    public static String format(long value) {
        return Long.toString(value);
    }
}
