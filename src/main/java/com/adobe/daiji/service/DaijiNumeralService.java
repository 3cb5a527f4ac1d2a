package com.adobe.daiji.service;

import com.adobe.daiji.converter.DaijiNumeralConverter;
import com.adobe.daiji.model.ConversionResult;
import com.adobe.daiji.model.DecompositionResult;
import com.adobe.daiji.model.NumeralDecomposition;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service layer for daiji conversion operations.
 *
 * <h2>Responsibilities:</h2>
 * <ul>
 *   <li>Numeral to daiji conversion, optionally overriding the 壱 rule per call</li>
 *   <li>Numeral decomposition for clients that need the canonical digits</li>
 *   <li>Logging and Micrometer metrics around both</li>
 * </ul>
 *
 * <h2>Metrics:</h2>
 * <ul>
 *   <li>{@code daiji.conversions.total} - counter tagged by operation and outcome</li>
 *   <li>{@code daiji.conversion.time} - conversion latency</li>
 *   <li>{@code daiji.conversion.digits} - integer digit count of converted values</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Service
public class DaijiNumeralService {

    private static final Logger logger = LoggerFactory.getLogger(DaijiNumeralService.class);

    private static final String CONVERSIONS_METRIC = "daiji.conversions.total";

    private final DaijiNumeralConverter converter;

    private final Timer conversionTimer;
    private final DistributionSummary digitCountDistribution;
    private final Counter convertSuccessCounter;
    private final Counter convertFailureCounter;
    private final Counter decomposeSuccessCounter;
    private final Counter decomposeFailureCounter;

    /**
     * Constructs the service with required dependencies.
     *
     * @param converter     the daiji converter
     * @param meterRegistry the Micrometer registry for metrics
     */
    public DaijiNumeralService(DaijiNumeralConverter converter, MeterRegistry meterRegistry) {
        this.converter = converter;

        this.conversionTimer = Timer.builder("daiji.conversion.time")
            .description("Time taken to convert a numeral to daiji")
            .register(meterRegistry);

        this.digitCountDistribution = DistributionSummary.builder("daiji.conversion.digits")
            .description("Integer digit count of converted numerals")
            .baseUnit("digits")
            .register(meterRegistry);

        this.convertSuccessCounter = conversionCounter(meterRegistry, "convert", "success");
        this.convertFailureCounter = conversionCounter(meterRegistry, "convert", "failure");
        this.decomposeSuccessCounter = conversionCounter(meterRegistry, "decompose", "success");
        this.decomposeFailureCounter = conversionCounter(meterRegistry, "decompose", "failure");
    }

    private static Counter conversionCounter(MeterRegistry meterRegistry, String operation, String outcome) {
        return Counter.builder(CONVERSIONS_METRIC)
            .description("Daiji conversion requests")
            .tag("operation", operation)
            .tag("outcome", outcome)
            .register(meterRegistry);
    }

    /**
     * Converts a numeral with the configured rules.
     *
     * @param numeral the numeral text
     * @return ConversionResult containing the input and its daiji form
     * @throws com.adobe.daiji.exception.InvalidInputException if the numeral cannot be converted
     */
    public ConversionResult convert(String numeral) {
        return convert(numeral, null);
    }

    /**
     * Converts a numeral, optionally overriding whether 壱 is written before 千, 百 and 拾.
     *
     * @param numeral   the numeral text
     * @param appendOne the override, or null to keep the configured rule
     * @return ConversionResult containing the input and its daiji form
     * @throws com.adobe.daiji.exception.InvalidInputException if the numeral cannot be converted
     */
    public ConversionResult convert(String numeral, Boolean appendOne) {
        logger.debug("Converting numeral: {} (appendOne={})", numeral, appendOne);

        DaijiNumeralConverter effective = appendOne == null
            ? converter
            : converter.withConfiguration(
                converter.getConfiguration().withAppendOneBeforeSmallUnits(appendOne));

        String daiji;
        try {
            daiji = conversionTimer.record(() -> {
                NumeralDecomposition decomposition = effective.normalize(numeral);
                digitCountDistribution.record(decomposition.integerDigits().length());
                return effective.render(decomposition);
            });
        } catch (RuntimeException e) {
            convertFailureCounter.increment();
            throw e;
        }
        convertSuccessCounter.increment();

        logger.debug("Converted {} to {}", numeral, daiji);
        return ConversionResult.of(numeral, daiji);
    }

    /**
     * Normalizes a numeral into its canonical decomposition.
     *
     * @param numeral the numeral text
     * @return DecompositionResult describing the sign and digit strings
     * @throws com.adobe.daiji.exception.MalformedNumeralException if the text is not a numeral
     */
    public DecompositionResult decompose(String numeral) {
        logger.debug("Decomposing numeral: {}", numeral);

        NumeralDecomposition decomposition;
        try {
            decomposition = converter.normalize(numeral);
        } catch (RuntimeException e) {
            decomposeFailureCounter.increment();
            throw e;
        }
        decomposeSuccessCounter.increment();

        logger.debug("Decomposed {} to {}", numeral, decomposition.toPlainString());
        return DecompositionResult.of(numeral, decomposition);
    }
}
