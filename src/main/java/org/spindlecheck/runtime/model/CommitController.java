package org.spindlecheck.runtime.model;

/**
 * The APC/C switch: a one-way latch that commits to anaphase the first time the
 * bus concentration falls below the activation threshold. There is no way back.
 */
public class CommitController {

    private final double activationThreshold;
    private boolean committed = false;
    private long commitTick = -1L;

    /**
     * @param activationThreshold Bus level below which the latch closes.
     */
    public CommitController(double activationThreshold) {
        this.activationThreshold = activationThreshold;
    }

    /**
     * Evaluates the current bus level.
     * @param tick The tick being evaluated, recorded when the latch closes.
     * @param busLevel The current bus concentration.
     * @return the latch value, true forever once set
     */
    public boolean evaluate(long tick, double busLevel) {
        if (!committed && busLevel < activationThreshold) {
            committed = true;
            commitTick = tick;
        }
        return committed;
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * @return the tick at which the latch closed, or -1 while still open
     */
    public long getCommitTick() {
        return commitTick;
    }

    public double getActivationThreshold() {
        return activationThreshold;
    }
}
