package com.adobe.daiji.converter;

import com.adobe.daiji.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable unit-name and glyph tables used to render daiji.
 *
 * <p>Every property can be overridden independently through the {@code with…}
 * methods, each of which validates its table and returns a new instance.
 * Instances hold no per-call state and may be shared between threads.</p>
 *
 * <h2>Defaults:</h2>
 * <ul>
 *   <li><b>Large units:</b> "", 万, 億, 兆, 京, 垓, 𥝱, 穣, 溝, 澗, 正, 載, 極,
 *       恒河沙, 阿僧祇, 那由他, 不可思議</li>
 *   <li><b>Positional units:</b> 千, 百, 拾, ""</li>
 *   <li><b>Digit glyphs:</b> 零 壱 弐 参 四 五 六 七 八 九</li>
 *   <li><b>Append one before small units:</b> true (壱千, 壱百, 壱拾)</li>
 *   <li><b>Overflow policy:</b> {@link OverflowPolicy#OMIT_UNIT}</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public final class DaijiConfiguration {

    /**
     * Number of positional units per group: thousand, hundred, ten, ones.
     */
    public static final int POSITIONAL_UNIT_COUNT = 4;

    /**
     * Number of digit glyphs: one per decimal digit.
     */
    public static final int DIGIT_GLYPH_COUNT = 10;

    static final List<String> DEFAULT_LARGE_UNIT_NAMES = List.of(
        "", "万", "億", "兆", "京", "垓", "𥝱", "穣", "溝", "澗", "正", "載", "極",
        "恒河沙", "阿僧祇", "那由他", "不可思議"
    );

    static final List<String> DEFAULT_POSITIONAL_UNIT_NAMES = List.of("千", "百", "拾", "");

    static final List<Character> DEFAULT_DIGIT_GLYPHS = List.of(
        '零', '壱', '弐', '参', '四', '五', '六', '七', '八', '九'
    );

    private static final DaijiConfiguration DEFAULTS = new DaijiConfiguration(
        DEFAULT_LARGE_UNIT_NAMES,
        DEFAULT_POSITIONAL_UNIT_NAMES,
        DEFAULT_DIGIT_GLYPHS,
        true,
        OverflowPolicy.OMIT_UNIT);

    private final List<String> largeUnitNames;
    private final List<String> positionalUnitNames;
    private final List<Character> digitGlyphs;
    private final boolean appendOneBeforeSmallUnits;
    private final OverflowPolicy overflowPolicy;

    private DaijiConfiguration(List<String> largeUnitNames,
                               List<String> positionalUnitNames,
                               List<Character> digitGlyphs,
                               boolean appendOneBeforeSmallUnits,
                               OverflowPolicy overflowPolicy) {
        this.largeUnitNames = largeUnitNames;
        this.positionalUnitNames = positionalUnitNames;
        this.digitGlyphs = digitGlyphs;
        this.appendOneBeforeSmallUnits = appendOneBeforeSmallUnits;
        this.overflowPolicy = overflowPolicy;
    }

    /**
     * @return the standard daiji configuration
     */
    public static DaijiConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Replaces the large-unit table. Index 0 names the lowest group and is
     * conventionally empty, index 1 is 10^4, index 2 is 10^8, and so on.
     *
     * @param names at least one unit name, none null
     * @return a copy using the given table
     * @throws ConfigurationException if the table is null, empty, or has a null entry
     */
    public DaijiConfiguration withLargeUnitNames(List<String> names) {
        List<String> table = copyNames(names, 1, "large-unit");
        return new DaijiConfiguration(table, positionalUnitNames, digitGlyphs,
            appendOneBeforeSmallUnits, overflowPolicy);
    }

    /**
     * Replaces the positional-unit table, ordered thousand, hundred, ten, ones.
     * Entries beyond the fourth are ignored.
     *
     * @param names at least four unit names, none null
     * @return a copy using the given table
     * @throws ConfigurationException if the table has fewer than four entries or a null entry
     */
    public DaijiConfiguration withPositionalUnitNames(List<String> names) {
        List<String> table = copyNames(names, POSITIONAL_UNIT_COUNT, "positional-unit");
        return new DaijiConfiguration(largeUnitNames, table, digitGlyphs,
            appendOneBeforeSmallUnits, overflowPolicy);
    }

    /**
     * Replaces the digit glyph table, indexed by digit value.
     * Entries beyond the tenth are ignored.
     *
     * @param glyphs at least ten glyphs, none null
     * @return a copy using the given table
     * @throws ConfigurationException if the table has fewer than ten entries or a null entry
     */
    public DaijiConfiguration withDigitGlyphs(List<Character> glyphs) {
        if (glyphs == null || glyphs.size() < DIGIT_GLYPH_COUNT) {
            throw new ConfigurationException(String.format(
                "Digit glyph table needs at least %d entries, got: %d",
                DIGIT_GLYPH_COUNT, glyphs == null ? 0 : glyphs.size()));
        }
        if (containsNull(glyphs)) {
            throw new ConfigurationException("Digit glyph table must not contain null entries");
        }
        return new DaijiConfiguration(largeUnitNames, positionalUnitNames,
            Collections.unmodifiableList(new ArrayList<>(glyphs)),
            appendOneBeforeSmallUnits, overflowPolicy);
    }

    /**
     * @param append whether 壱 is written before 千, 百 and 拾
     * @return a copy using the given flag
     */
    public DaijiConfiguration withAppendOneBeforeSmallUnits(boolean append) {
        if (append == appendOneBeforeSmallUnits) {
            return this;
        }
        return new DaijiConfiguration(largeUnitNames, positionalUnitNames, digitGlyphs,
            append, overflowPolicy);
    }

    /**
     * @param policy behavior for groups beyond the large-unit table
     * @return a copy using the given policy
     * @throws ConfigurationException if the policy is null
     */
    public DaijiConfiguration withOverflowPolicy(OverflowPolicy policy) {
        if (policy == null) {
            throw new ConfigurationException("Overflow policy must not be null");
        }
        return new DaijiConfiguration(largeUnitNames, positionalUnitNames, digitGlyphs,
            appendOneBeforeSmallUnits, policy);
    }

    public List<String> getLargeUnitNames() {
        return largeUnitNames;
    }

    public List<String> getPositionalUnitNames() {
        return positionalUnitNames;
    }

    public List<Character> getDigitGlyphs() {
        return digitGlyphs;
    }

    public boolean isAppendOneBeforeSmallUnits() {
        return appendOneBeforeSmallUnits;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    boolean hasLargeUnitName(int groupIndex) {
        return groupIndex < largeUnitNames.size();
    }

    String largeUnitName(int groupIndex) {
        return largeUnitNames.get(groupIndex);
    }

    String positionalUnitName(int position) {
        return positionalUnitNames.get(position);
    }

    char digitGlyph(int digit) {
        return digitGlyphs.get(digit);
    }

    private static List<String> copyNames(List<String> names, int minimumSize, String tableName) {
        if (names == null || names.size() < minimumSize) {
            throw new ConfigurationException(String.format(
                "The %s name table needs at least %d entries, got: %d",
                tableName, minimumSize, names == null ? 0 : names.size()));
        }
        if (containsNull(names)) {
            throw new ConfigurationException(
                "The " + tableName + " name table must not contain null entries");
        }
        return Collections.unmodifiableList(new ArrayList<>(names));
    }

    private static boolean containsNull(List<?> table) {
        for (Object entry : table) {
            if (entry == null) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DaijiConfiguration)) {
            return false;
        }
        DaijiConfiguration that = (DaijiConfiguration) o;
        return appendOneBeforeSmallUnits == that.appendOneBeforeSmallUnits
            && largeUnitNames.equals(that.largeUnitNames)
            && positionalUnitNames.equals(that.positionalUnitNames)
            && digitGlyphs.equals(that.digitGlyphs)
            && overflowPolicy == that.overflowPolicy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(largeUnitNames, positionalUnitNames, digitGlyphs,
            appendOneBeforeSmallUnits, overflowPolicy);
    }

    @Override
    public String toString() {
        return "DaijiConfiguration{largeUnits=" + largeUnitNames.size()
            + ", positionalUnits=" + positionalUnitNames
            + ", digitGlyphs=" + digitGlyphs
            + ", appendOneBeforeSmallUnits=" + appendOneBeforeSmallUnits
            + ", overflowPolicy=" + overflowPolicy + '}';
    }
}
