package com.adobe.daiji.exception;

/**
 * Thrown by the renderer when a 4-digit group needs a large-unit name beyond
 * the configured table and the overflow policy is
 * {@link com.adobe.daiji.converter.OverflowPolicy#FAIL}.
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class LargeUnitOverflowException extends InvalidInputException {

    private final int groupIndex;
    private final int availableUnits;

    public LargeUnitOverflowException(int groupIndex, int availableUnits) {
        super(String.format(
            "No large-unit name for 4-digit group %d (configured table has %d entries)",
            groupIndex, availableUnits));
        this.groupIndex = groupIndex;
        this.availableUnits = availableUnits;
    }

    public int getGroupIndex() {
        return groupIndex;
    }

    public int getAvailableUnits() {
        return availableUnits;
    }
}
