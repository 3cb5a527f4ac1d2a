package com.adobe.daiji.config;

import com.adobe.daiji.converter.DaijiConfiguration;
import com.adobe.daiji.converter.OverflowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Externalized daiji settings bound from {@code app.daiji.*}.
 *
 * <pre>
 * app:
 *   daiji:
 *     large-unit-names: ["", 万, 億, 兆]
 *     positional-unit-names: [千, 百, 拾, ""]
 *     digit-glyphs: [零, 壱, 弐, 参, 四, 五, 六, 七, 八, 九]
 *     append-one-before-small-units: true
 *     overflow-policy: omit-unit
 *     max-exponent: 4096
 * </pre>
 *
 * <p>Tables left unset keep the standard daiji tables of
 * {@link DaijiConfiguration#defaults()}.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@ConfigurationProperties(prefix = "app.daiji")
public class DaijiProperties {

    private List<String> largeUnitNames;
    private List<String> positionalUnitNames;
    private List<Character> digitGlyphs;
    private boolean appendOneBeforeSmallUnits = true;
    private OverflowPolicy overflowPolicy = OverflowPolicy.OMIT_UNIT;

    /**
     * Largest accepted exponent magnitude; bounds the digits a request can expand to.
     */
    private int maxExponent = 4096;

    /**
     * Builds the immutable configuration, validating every table that was set.
     *
     * @return the configuration described by these properties
     * @throws com.adobe.daiji.exception.ConfigurationException if a table is too short
     */
    public DaijiConfiguration toConfiguration() {
        DaijiConfiguration configuration = DaijiConfiguration.defaults()
            .withAppendOneBeforeSmallUnits(appendOneBeforeSmallUnits)
            .withOverflowPolicy(overflowPolicy);

        if (largeUnitNames != null) {
            configuration = configuration.withLargeUnitNames(largeUnitNames);
        }
        if (positionalUnitNames != null) {
            configuration = configuration.withPositionalUnitNames(positionalUnitNames);
        }
        if (digitGlyphs != null) {
            configuration = configuration.withDigitGlyphs(digitGlyphs);
        }
        return configuration;
    }

    public List<String> getLargeUnitNames() {
        return largeUnitNames;
    }

    public void setLargeUnitNames(List<String> largeUnitNames) {
        this.largeUnitNames = largeUnitNames;
    }

    public List<String> getPositionalUnitNames() {
        return positionalUnitNames;
    }

    public void setPositionalUnitNames(List<String> positionalUnitNames) {
        this.positionalUnitNames = positionalUnitNames;
    }

    public List<Character> getDigitGlyphs() {
        return digitGlyphs;
    }

    public void setDigitGlyphs(List<Character> digitGlyphs) {
        this.digitGlyphs = digitGlyphs;
    }

    public boolean isAppendOneBeforeSmallUnits() {
        return appendOneBeforeSmallUnits;
    }

    public void setAppendOneBeforeSmallUnits(boolean appendOneBeforeSmallUnits) {
        this.appendOneBeforeSmallUnits = appendOneBeforeSmallUnits;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public void setOverflowPolicy(OverflowPolicy overflowPolicy) {
        this.overflowPolicy = overflowPolicy;
    }

    public int getMaxExponent() {
        return maxExponent;
    }

    public void setMaxExponent(int maxExponent) {
        this.maxExponent = maxExponent;
    }
}
