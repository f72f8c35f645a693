package org.spindlecheck.runtime;

/**
 * Top-level state of a mitosis run.
 */
public enum SimulationOutcome {
    RUNNING(false),
    /** Soft warning: mitosis took longer than expected. The run continues. */
    MITOTIC_ARREST(false),
    /** Mitosis exceeded the maximum safe duration; the cell dies. */
    APOPTOSIS(true),
    ANAPHASE_COMPLETED(true);

    private final boolean terminal;

    SimulationOutcome(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
