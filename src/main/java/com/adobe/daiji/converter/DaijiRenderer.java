package com.adobe.daiji.converter;

import com.adobe.daiji.exception.LargeUnitOverflowException;
import com.adobe.daiji.model.NumeralDecomposition;

/**
 * Renders the integer part of a {@link NumeralDecomposition} as daiji.
 *
 * <p>Digits are walked left to right in 4-digit groups. Within a group each
 * position has a unit (千, 百, 拾, none); each group has a large unit
 * (none, 万, 億, 兆, …) that is written once after the group's ones position,
 * but only if the group wrote anything.</p>
 *
 * <h2>Rules:</h2>
 * <ul>
 *   <li>The fraction is truncated, never rounded; a value that truncates to
 *       zero renders as the zero glyph without a sign</li>
 *   <li>Zero digits write nothing, not even their unit</li>
 *   <li>A 1 at the ones position is always written; a 1 before 千, 百 or 拾
 *       is written only when {@link DaijiConfiguration#isAppendOneBeforeSmallUnits()}
 *       is set, so 1000 is either 壱千 or 千</li>
 *   <li>A group beyond the large-unit table fails or loses its unit name,
 *       depending on {@link DaijiConfiguration#getOverflowPolicy()}</li>
 * </ul>
 *
 * <h2>Examples (default configuration):</h2>
 * <pre>
 * 0         → 零
 * 10        → 壱拾
 * 12345     → 壱万弐千参百四拾五
 * 100000000 → 壱億
 * 123456789 → 壱億弐千参百四拾五万六千七百八拾九
 * </pre>
 *
 * <p>The renderer keeps no state; one instance can serve any number of
 * configurations and threads.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class DaijiRenderer {

    private static final int GROUP_SIZE = 4;
    private static final int ONES_POSITION = GROUP_SIZE - 1;

    /**
     * Renders a decomposition.
     *
     * @param decomposition the value to render; its fraction is ignored
     * @param configuration the unit and glyph tables
     * @return the daiji string
     * @throws LargeUnitOverflowException if a group has no large-unit name and
     *                                    the policy is {@link OverflowPolicy#FAIL}
     */
    public String render(NumeralDecomposition decomposition, DaijiConfiguration configuration) {
        NumeralDecomposition integral = decomposition.withoutFraction();
        if (integral.isZero()) {
            return String.valueOf(configuration.digitGlyph(0));
        }

        StringBuilder result = new StringBuilder(64);
        if (integral.minus()) {
            result.append('-');
        }

        String digits = integral.integerDigits();
        int groupIndex = (digits.length() - 1) / GROUP_SIZE;
        int position = (GROUP_SIZE - digits.length() % GROUP_SIZE) % GROUP_SIZE;
        boolean groupWritten = false;

        for (int i = 0; i < digits.length(); i++) {
            int digit = digits.charAt(i) - '0';

            if (digit != 0) {
                if (position == ONES_POSITION || digit != 1 || configuration.isAppendOneBeforeSmallUnits()) {
                    result.append(configuration.digitGlyph(digit));
                    groupWritten = true;
                }

                String unit = configuration.positionalUnitName(position);
                if (!unit.isEmpty()) {
                    result.append(unit);
                    groupWritten = true;
                }
            }

            if (position == ONES_POSITION && groupWritten) {
                appendLargeUnit(result, groupIndex, configuration);
            }

            position = (position + 1) % GROUP_SIZE;
            if (position == 0) {
                groupWritten = false;
                groupIndex--;
            }
        }

        return result.toString();
    }

    private static void appendLargeUnit(StringBuilder result, int groupIndex, DaijiConfiguration configuration) {
        if (configuration.hasLargeUnitName(groupIndex)) {
            result.append(configuration.largeUnitName(groupIndex));
        } else if (configuration.getOverflowPolicy() == OverflowPolicy.FAIL) {
            throw new LargeUnitOverflowException(groupIndex, configuration.getLargeUnitNames().size());
        }
    }
}
