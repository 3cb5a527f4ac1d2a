package com.adobe.daiji.controller;

import com.adobe.daiji.exception.InvalidInputException;
import com.adobe.daiji.model.ConversionResult;
import com.adobe.daiji.model.DecompositionResult;
import com.adobe.daiji.service.DaijiNumeralService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for daiji conversion endpoints.
 *
 * <ul>
 *   <li>Conversion: GET /daiji?query={numeral}[&amp;appendOne={boolean}]</li>
 *   <li>Decomposition: GET /daiji/decomposition?query={numeral}</li>
 * </ul>
 *
 * <h2>Response Formats:</h2>
 * <ul>
 *   <li><b>Success:</b> JSON</li>
 *   <li><b>Error:</b> Plain text message</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@RestController
@RequestMapping("/daiji")
@Tag(name = "Daiji Conversion", description = "Convert numerals to formal Japanese kanji numerals")
public class DaijiNumeralController {

    private static final Logger logger = LoggerFactory.getLogger(DaijiNumeralController.class);

    private final DaijiNumeralService daijiNumeralService;

    public DaijiNumeralController(DaijiNumeralService daijiNumeralService) {
        this.daijiNumeralService = daijiNumeralService;
    }

    /**
     * Converts a numeral to daiji.
     *
     * <h3>Example:</h3>
     * <pre>
     * Request:  GET /daiji?query=12345
     * Response: {"input": "12345", "output": "壱万弐千参百四拾五"}
     * </pre>
     *
     * @param query     the numeral, e.g. {@code 12,345} or {@code 1.2345E4}
     * @param appendOne optional override of the 壱-before-千百拾 rule
     * @return ResponseEntity containing the conversion result as JSON
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Convert numeral to daiji",
        description = "Converts a decimal or exponential numeral to daiji. The fraction is truncated. " +
                      "Use 'appendOne' to choose between 壱千 and 千 style for this request."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful conversion",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ConversionResult.class)
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed numeral or value too large for the unit table",
            content = @Content(mediaType = "text/plain")
        )
    })
    public ResponseEntity<ConversionResult> convert(
            @Parameter(description = "Numeral to convert, e.g. 12345, -1,000.5 or 120.3045E4")
            @RequestParam(required = false) String query,

            @Parameter(description = "Write 壱 before 千, 百 and 拾 (defaults to the configured rule)")
            @RequestParam(required = false) Boolean appendOne) {

        String numeral = requireQuery(query);
        logger.info("Processing conversion request for: {}", numeral);

        ConversionResult result = daijiNumeralService.convert(numeral, appendOne);

        logger.info("Successfully converted {} to {}", result.input(), result.output());
        return ResponseEntity.ok(result);
    }

    /**
     * Returns the canonical decomposition of a numeral.
     *
     * <h3>Example:</h3>
     * <pre>
     * Request:  GET /daiji/decomposition?query=-31.4E-1
     * Response: {"input": "-31.4E-1", "negative": true, "zero": false,
     *            "integerDigits": "3", "fractionDigits": "14", "plain": "-3.14"}
     * </pre>
     *
     * @param query the numeral to decompose
     * @return ResponseEntity containing the decomposition as JSON
     */
    @GetMapping(value = "/decomposition", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(
        summary = "Decompose numeral",
        description = "Returns the sign, integer digits and fraction digits of a numeral with the exponent applied."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successful decomposition",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = DecompositionResult.class)
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Malformed numeral",
            content = @Content(mediaType = "text/plain")
        )
    })
    public ResponseEntity<DecompositionResult> decompose(
            @Parameter(description = "Numeral to decompose")
            @RequestParam(required = false) String query) {

        String numeral = requireQuery(query);
        logger.info("Processing decomposition request for: {}", numeral);

        DecompositionResult result = daijiNumeralService.decompose(numeral);

        logger.info("Successfully decomposed {} to {}", result.input(), result.plain());
        return ResponseEntity.ok(result);
    }

    private static String requireQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidInputException(
                "Missing required parameter. Provide 'query' with the numeral to convert.");
        }
        return query;
    }
}
