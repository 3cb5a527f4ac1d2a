package com.adobe.daiji.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response model exposing the canonical decomposition of a numeral.
 *
 * <pre>
 * {
 *     "input": "-31.4E-1",
 *     "negative": true,
 *     "zero": false,
 *     "integerDigits": "3",
 *     "fractionDigits": "14",
 *     "plain": "-3.14"
 * }
 * </pre>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Schema(description = "Canonical exponent-free decomposition of a numeral")
public record DecompositionResult(

    @Schema(description = "The numeral as supplied", example = "-31.4E-1")
    String input,

    @Schema(description = "Whether the value is negative", example = "true")
    boolean negative,

    @Schema(description = "Whether the value is exactly zero", example = "false")
    boolean zero,

    @Schema(description = "Integer digits without leading zeros", example = "3")
    String integerDigits,

    @Schema(description = "Fraction digits without trailing zeros", example = "14")
    String fractionDigits,

    @Schema(description = "Plain decimal form", example = "-3.14")
    String plain

) {
    /**
     * Factory method to create a DecompositionResult from a numeral and its decomposition.
     *
     * @param numeral       the numeral as supplied
     * @param decomposition the canonical decomposition of the numeral
     * @return a new DecompositionResult instance
     */
    public static DecompositionResult of(String numeral, NumeralDecomposition decomposition) {
        return new DecompositionResult(
            numeral,
            decomposition.minus(),
            decomposition.isZero(),
            decomposition.integerDigits(),
            decomposition.fractionDigits(),
            decomposition.toPlainString());
    }
}
