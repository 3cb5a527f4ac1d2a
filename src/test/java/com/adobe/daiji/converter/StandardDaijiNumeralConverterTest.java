package com.adobe.daiji.converter;

import com.adobe.daiji.exception.LargeUnitOverflowException;
import com.adobe.daiji.exception.MalformedNumeralException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAdder;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StandardDaijiNumeralConverter.
 *
 * Tests cover:
 * - String conversions in plain and exponent form
 * - Conversions from built-in numeric types
 * - Configuration swapping without mutation
 * - Error handling
 */
@DisplayName("StandardDaijiNumeralConverter Tests")
class StandardDaijiNumeralConverterTest {

    private StandardDaijiNumeralConverter converter;

    @BeforeEach
    void setUp() {
        converter = new StandardDaijiNumeralConverter();
    }

    @Nested
    @DisplayName("String Conversions")
    class StringConversions {

        @ParameterizedTest(name = "\"{0}\" should convert to {1}")
        @CsvSource({
            "0,             零",
            "12345,         壱万弐千参百四拾五",
            "'12,345',      壱万弐千参百四拾五",
            "120.3045E4,    壱百弐拾万参千四拾五",
            "-42.9,         -四拾弐",
            "-0.9,          零",
            "1E8,           壱億",
            "1E64,          壱不可思議"
        })
        void shouldConvertNumeralText(String input, String expected) {
            assertEquals(expected, converter.convert(input));
        }

        @ParameterizedTest(name = "\"{0}\" should equal 1203045")
        @ValueSource(strings = {"1203045", "1,203,045", "120.3045E4", "0.1203045E7", "12030450E-1", "1203045.999"})
        void equivalentFormsShouldConvertIdentically(String input) {
            assertEquals(converter.convert("1203045"), converter.convert(input));
        }

        @Test
        @DisplayName("Malformed text is rejected")
        void shouldRejectMalformedText() {
            assertThrows(MalformedNumeralException.class, () -> converter.convert("twelve"));
        }
    }

    @Nested
    @DisplayName("Number Conversions")
    class NumberConversions {

        @Test
        @DisplayName("Integral types convert exactly")
        void shouldConvertIntegralTypes() {
            assertEquals("零", converter.convert(0));
            assertEquals("壱万弐千参百四拾五", converter.convert(12345));
            assertEquals("壱億弐千参百四拾五万六千七百八拾九", converter.convert(123456789L));
            assertEquals("壱拾", converter.convert((short) 10));
            assertEquals("壱", converter.convert((byte) 1));
            assertEquals("壱千", converter.convert(new AtomicLong(1000)));
        }

        @Test
        @DisplayName("Arbitrary precision types convert exactly")
        void shouldConvertArbitraryPrecisionTypes() {
            assertEquals("壱垓", converter.convert(BigInteger.TEN.pow(20)));
            assertEquals("壱百弐拾万参千四拾五", converter.convert(new BigDecimal("120.3045E4")));
            assertEquals("壱百穣", converter.convert(new BigDecimal("1E+30")));
        }

        @Test
        @DisplayName("Floating-point values are truncated toward zero")
        void shouldTruncateFloatingPoint() {
            assertEquals("壱万弐千参百四拾五", converter.convert(12345.678));
            assertEquals("零", converter.convert(-0.5));
            assertEquals("参", converter.convert(3.99f));
            assertEquals("-七", converter.convert(-7.25));
        }

        @Test
        @DisplayName("1e20 converts without rounding artifacts")
        void shouldConvertLargeDoubleExactly() {
            assertEquals("壱垓", converter.convert(1e20));
        }

        @Test
        @DisplayName("NaN and infinities are rejected")
        void shouldRejectNonFiniteValues() {
            assertThrows(MalformedNumeralException.class, () -> converter.convert(Double.NaN));
            assertThrows(MalformedNumeralException.class, () -> converter.convert(Double.POSITIVE_INFINITY));
            assertThrows(MalformedNumeralException.class, () -> converter.convert(Float.NEGATIVE_INFINITY));
        }

        @Test
        @DisplayName("Unsupported Number subtypes are rejected")
        void shouldRejectUnsupportedType() {
            DoubleAdder adder = new DoubleAdder();
            adder.add(5);

            assertThrows(MalformedNumeralException.class, () -> converter.convert(adder));
        }

        @Test
        @DisplayName("Null Number is rejected")
        void shouldRejectNullNumber() {
            assertThrows(NullPointerException.class, () -> converter.convert((Number) null));
        }

        @Test
        @DisplayName("Very large doubles overflow the default table under FAIL policy")
        void shouldOverflowForHugeDouble() {
            StandardDaijiNumeralConverter failing = new StandardDaijiNumeralConverter(
                DaijiConfiguration.defaults().withOverflowPolicy(OverflowPolicy.FAIL));

            assertThrows(LargeUnitOverflowException.class, () -> failing.convert(1e300));
        }
    }

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Default converter uses the standard tables")
        void shouldUseDefaults() {
            assertEquals(DaijiConfiguration.defaults(), converter.getConfiguration());
            assertEquals(Integer.MAX_VALUE, converter.getNormalizer().getMaxExponent());
        }

        @Test
        @DisplayName("withConfiguration returns a new converter and leaves the receiver unchanged")
        void shouldNotMutateReceiver() {
            DaijiNumeralConverter bare = converter.withConfiguration(
                converter.getConfiguration().withAppendOneBeforeSmallUnits(false));

            assertNotSame(converter, bare);
            assertEquals("千", bare.convert("1000"));
            assertEquals("壱千", converter.convert("1000"));
        }

        @Test
        @DisplayName("withConfiguration returns the same converter for an equal configuration")
        void shouldReuseConverterForEqualConfiguration() {
            assertSame(converter, converter.withConfiguration(DaijiConfiguration.defaults()));
        }

        @Test
        @DisplayName("withConfiguration keeps the normalizer and its exponent limit")
        void shouldKeepNormalizer() {
            StandardDaijiNumeralConverter limited = new StandardDaijiNumeralConverter(
                new NumeralNormalizer(3), new DaijiRenderer(), DaijiConfiguration.defaults());

            DaijiNumeralConverter bare = limited.withConfiguration(
                DaijiConfiguration.defaults().withAppendOneBeforeSmallUnits(false));

            assertThrows(MalformedNumeralException.class, () -> bare.convert("1E4"));
        }

        @Test
        @DisplayName("Null parts are rejected")
        void shouldRejectNullParts() {
            assertThrows(NullPointerException.class,
                () -> new StandardDaijiNumeralConverter(null, new DaijiRenderer(), DaijiConfiguration.defaults()));
            assertThrows(NullPointerException.class,
                () -> new StandardDaijiNumeralConverter((DaijiConfiguration) null));
        }
    }
}
