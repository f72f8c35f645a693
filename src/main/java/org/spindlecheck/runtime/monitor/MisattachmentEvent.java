package org.spindlecheck.runtime.monitor;

/**
 * A kinetochore observed in a merotelic attachment on a given tick.
 *
 * @param tick the tick of the observation
 * @param agentId uid of the kinetochore
 */
public record MisattachmentEvent(long tick, int agentId) {
}
