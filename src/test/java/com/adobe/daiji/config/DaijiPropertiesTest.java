package com.adobe.daiji.config;

import com.adobe.daiji.converter.DaijiConfiguration;
import com.adobe.daiji.converter.OverflowPolicy;
import com.adobe.daiji.exception.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DaijiProperties}.
 */
@DisplayName("DaijiProperties Tests")
class DaijiPropertiesTest {

    private DaijiProperties properties;

    @BeforeEach
    void setUp() {
        properties = new DaijiProperties();
    }

    @Test
    @DisplayName("Unset properties produce the default configuration")
    void shouldDefaultToStandardTables() {
        assertEquals(DaijiConfiguration.defaults(), properties.toConfiguration());
        assertEquals(4096, properties.getMaxExponent());
    }

    @Test
    @DisplayName("Set tables and flags override the defaults")
    void shouldApplyOverrides() {
        properties.setLargeUnitNames(List.of("", "万", "億"));
        properties.setDigitGlyphs(List.of('〇', '一', '二', '三', '四', '五', '六', '七', '八', '九'));
        properties.setAppendOneBeforeSmallUnits(false);
        properties.setOverflowPolicy(OverflowPolicy.FAIL);

        DaijiConfiguration configuration = properties.toConfiguration();

        assertEquals(List.of("", "万", "億"), configuration.getLargeUnitNames());
        assertEquals('〇', configuration.getDigitGlyphs().get(0));
        assertEquals(DaijiConfiguration.defaults().getPositionalUnitNames(), configuration.getPositionalUnitNames());
        assertFalse(configuration.isAppendOneBeforeSmallUnits());
        assertEquals(OverflowPolicy.FAIL, configuration.getOverflowPolicy());
    }

    @Test
    @DisplayName("An invalid table fails when the configuration is built")
    void shouldRejectInvalidTable() {
        properties.setPositionalUnitNames(List.of("千", "百"));

        assertThrows(ConfigurationException.class, properties::toConfiguration);
    }
}
