package com.adobe.daiji.converter;

import com.adobe.daiji.model.NumeralDecomposition;

/**
 * Interface for converting numerals to the Japanese daiji (formal kanji numeral) form.
 *
 * <p>Daiji are the forgery-resistant numerals used on legal and financial
 * documents: 壱, 弐 and 参 cannot be turned into other digits by adding strokes
 * the way 一, 二 and 三 can.</p>
 *
 * <h2>Conversion Pipeline:</h2>
 * <ol>
 *   <li>Numeric values are formatted as numeral text ({@link NumeralFormatter})</li>
 *   <li>Numeral text is normalized into an exponent-free decomposition ({@link NumeralNormalizer})</li>
 *   <li>The integer part of the decomposition is rendered as daiji ({@link DaijiRenderer})</li>
 * </ol>
 *
 * <h3>Examples (default configuration):</h3>
 * <pre>
 * convert("0")           → "零"
 * convert("1000")        → "壱千"
 * convert("12345")       → "壱万弐千参百四拾五"
 * convert("120.3045E4")  → "壱百弐拾万参千四拾五"
 * convert(123456789)     → "壱億弐千参百四拾五万六千七百八拾九"
 * convert("-42.9")       → "-四拾弐"
 * </pre>
 *
 * <p>Implementations are immutable: the configuration is fixed at construction
 * and {@link #withConfiguration(DaijiConfiguration)} returns a new converter.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public interface DaijiNumeralConverter {

    /**
     * Converts numeral text to daiji. The fraction part is truncated.
     *
     * @param numeral text of the form {@code [+-]digits[.digits][E[+-]digits]};
     *                commas and spaces are ignored
     * @return the daiji representation
     * @throws com.adobe.daiji.exception.MalformedNumeralException if the text is not a numeral
     * @throws com.adobe.daiji.exception.LargeUnitOverflowException if the value needs a large
     *         unit beyond the configured table and the policy is {@link OverflowPolicy#FAIL}
     */
    String convert(String numeral);

    /**
     * Converts a numeric value to daiji. The fraction part is truncated.
     *
     * @param value a supported numeric value (see {@link NumeralFormatter})
     * @return the daiji representation
     * @throws com.adobe.daiji.exception.MalformedNumeralException if the value is not finite
     *         or of an unsupported type
     */
    String convert(Number value);

    /**
     * Normalizes numeral text without rendering it.
     *
     * @param numeral the numeral text
     * @return the canonical decomposition
     * @throws com.adobe.daiji.exception.MalformedNumeralException if the text is not a numeral
     */
    NumeralDecomposition normalize(String numeral);

    /**
     * Renders an already normalized value. The fraction part is truncated.
     *
     * @param decomposition the canonical value
     * @return the daiji representation
     * @throws com.adobe.daiji.exception.LargeUnitOverflowException if the value needs a large
     *         unit beyond the configured table and the policy is {@link OverflowPolicy#FAIL}
     */
    String render(NumeralDecomposition decomposition);

    /**
     * @return the configuration this converter renders with
     */
    DaijiConfiguration getConfiguration();

    /**
     * Returns a converter that renders with a different configuration.
     *
     * @param configuration the configuration to use
     * @return a converter sharing this converter's parsing rules
     */
    DaijiNumeralConverter withConfiguration(DaijiConfiguration configuration);
}
