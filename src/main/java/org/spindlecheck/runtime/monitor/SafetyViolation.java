package org.spindlecheck.runtime.monitor;

/**
 * A single recorded safety violation.
 *
 * @param tick the tick on which the violation was observed
 * @param kind the violated property
 * @param message a human readable description
 */
public record SafetyViolation(long tick, ViolationKind kind, String message) {
}
