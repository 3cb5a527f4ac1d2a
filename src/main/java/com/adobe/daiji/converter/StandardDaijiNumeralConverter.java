package com.adobe.daiji.converter;

import com.adobe.daiji.model.NumeralDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Standard daiji converter composing a {@link NumeralNormalizer} and a {@link DaijiRenderer}.
 *
 * <h2>Algorithm:</h2>
 * <p>The numeral is first normalized into a sign, an integer digit string and
 * a fraction digit string; exponents are applied by shifting digits, never
 * by arithmetic, so values of any size convert without loss. The renderer
 * then drops the fraction and writes the integer digits in 4-digit groups.</p>
 *
 * <h2>Complexity Analysis:</h2>
 * <ul>
 *   <li><b>Normalization:</b> O(d + |e|) for d digits and exponent e</li>
 *   <li><b>Rendering:</b> O(d)</li>
 * </ul>
 *
 * <h2>Thread Safety:</h2>
 * <p>This class is thread-safe. The configuration is immutable and neither the
 * normalizer nor the renderer keeps per-call state.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class StandardDaijiNumeralConverter implements DaijiNumeralConverter {

    private static final Logger logger = LoggerFactory.getLogger(StandardDaijiNumeralConverter.class);

    private final NumeralNormalizer normalizer;
    private final DaijiRenderer renderer;
    private final DaijiConfiguration configuration;

    /**
     * Creates a converter with the standard daiji tables and an unbounded exponent.
     */
    public StandardDaijiNumeralConverter() {
        this(new NumeralNormalizer(), new DaijiRenderer(), DaijiConfiguration.defaults());
    }

    /**
     * Creates a converter with the given tables and an unbounded exponent.
     *
     * @param configuration the unit and glyph tables
     */
    public StandardDaijiNumeralConverter(DaijiConfiguration configuration) {
        this(new NumeralNormalizer(), new DaijiRenderer(), configuration);
    }

    /**
     * Creates a converter from its parts.
     *
     * @param normalizer    the numeral parser
     * @param renderer      the daiji writer
     * @param configuration the unit and glyph tables
     */
    public StandardDaijiNumeralConverter(NumeralNormalizer normalizer,
                                         DaijiRenderer renderer,
                                         DaijiConfiguration configuration) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.configuration = Objects.requireNonNull(configuration, "configuration must not be null");
    }

    @Override
    public String convert(String numeral) {
        NumeralDecomposition decomposition = normalizer.normalize(numeral);
        String daiji = renderer.render(decomposition, configuration);

        logger.trace("Rendered {} ({}) as {}", numeral, decomposition.toPlainString(), daiji);
        return daiji;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Floating-point values are expanded to
     * {@value NumeralFormatter#FLOATING_POINT_DIGITS} significant digits before
     * truncation, so {@code convert(1e20)} yields 壱垓 rather than a rounded
     * approximation.</p>
     */
    @Override
    public String convert(Number value) {
        return convert(NumeralFormatter.format(value));
    }

    @Override
    public NumeralDecomposition normalize(String numeral) {
        return normalizer.normalize(numeral);
    }

    @Override
    public String render(NumeralDecomposition decomposition) {
        return renderer.render(decomposition, configuration);
    }

    @Override
    public DaijiConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public DaijiNumeralConverter withConfiguration(DaijiConfiguration configuration) {
        if (this.configuration.equals(configuration)) {
            return this;
        }
        return new StandardDaijiNumeralConverter(normalizer, renderer, configuration);
    }

    public NumeralNormalizer getNormalizer() {
        return normalizer;
    }
}
