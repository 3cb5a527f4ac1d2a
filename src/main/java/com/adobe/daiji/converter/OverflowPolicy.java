package com.adobe.daiji.converter;

/**
 * What the renderer does when a 4-digit group has no large-unit name in the
 * configured table.
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public enum OverflowPolicy {

    /**
     * Throw {@link com.adobe.daiji.exception.LargeUnitOverflowException}.
     */
    FAIL,

    /**
     * Render the group's digits without a trailing unit name.
     */
    OMIT_UNIT
}
