package com.adobe.daiji.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Response model for a single daiji conversion.
 *
 * <h2>Response Format:</h2>
 * <pre>
 * {
 *     "input": "12345",
 *     "output": "壱万弐千参百四拾五"
 * }
 * </pre>
 *
 * @param input  the numeral exactly as supplied by the client
 * @param output the daiji representation
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Schema(description = "Result of a numeral to daiji conversion")
public record ConversionResult(

    @Schema(
        description = "The numeral as supplied",
        example = "120.3045E4"
    )
    String input,

    @Schema(
        description = "The daiji representation",
        example = "壱百弐拾万参千四拾五"
    )
    String output

) {
    /**
     * Factory method to create a ConversionResult from a numeral and its daiji form.
     *
     * @param numeral the numeral that was converted
     * @param daiji   the daiji result
     * @return a new ConversionResult instance
     */
    public static ConversionResult of(String numeral, String daiji) {
        return new ConversionResult(numeral, daiji);
    }
}
