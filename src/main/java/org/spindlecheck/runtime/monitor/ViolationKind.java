package org.spindlecheck.runtime.monitor;

/**
 * The two safety properties checked on every tick.
 */
public enum ViolationKind {
    /** Committed while not every kinetochore reports readiness. */
    COMMIT_WHILE_NOT_READY,
    /** Committed while at least one kinetochore is misattached. */
    COMMIT_WITH_MISATTACHMENT
}
