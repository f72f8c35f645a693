package org.spindlecheck.runtime.model;

/**
 * Attachment states of a single kinetochore.
 */
public enum KinetochoreState {
    DETACHED,
    ATTACHED_RELAXED,
    ATTACHED_TENSIONED,
    /** Merotelic attachment: bound to both poles at once. Never satisfies the checkpoint. */
    MISATTACHED;

    /**
     * Checks whether this state is bound to the spindle in any way.
     * @return true for every state except {@link #DETACHED}
     */
    public boolean isAttached() {
        return this != DETACHED;
    }

    /**
     * Checks whether this state can take part in tension generation with a sister,
     * i.e. it is attached and not misattached.
     * @return true for {@link #ATTACHED_RELAXED} and {@link #ATTACHED_TENSIONED}
     */
    public boolean isProperlyAttached() {
        return this == ATTACHED_RELAXED || this == ATTACHED_TENSIONED;
    }
}
