package org.spindlecheck.runtime;

/**
 * An edge taken by the outcome state machine.
 *
 * @param tick the tick on which the transition happened
 * @param from the outcome before the transition
 * @param to the outcome after the transition
 */
public record OutcomeTransition(long tick, SimulationOutcome from, SimulationOutcome to) {
}
