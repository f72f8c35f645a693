package org.spindlecheck.runtime;

import org.spindlecheck.runtime.monitor.SafetyReport;

import java.util.List;

/**
 * Everything a finished run produced.
 *
 * @param outcome the final outcome
 * @param lastTick the last tick that was executed, or -1 if none was
 * @param commitTick the tick at which the commit latch closed, or -1
 * @param ticks the report of every executed tick
 * @param transitions the outcome transitions in the order they were taken
 * @param safetyReport the safety monitor's end-of-run report
 */
public record SimulationResult(SimulationOutcome outcome,
                               long lastTick,
                               long commitTick,
                               List<TickReport> ticks,
                               List<OutcomeTransition> transitions,
                               SafetyReport safetyReport) {

    public SimulationResult {
        ticks = List.copyOf(ticks);
        transitions = List.copyOf(transitions);
    }
}
