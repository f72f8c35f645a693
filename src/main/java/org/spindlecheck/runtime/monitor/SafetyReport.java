package org.spindlecheck.runtime.monitor;

import java.util.List;

/**
 * End-of-run summary produced by {@link SafetyMonitor#report()}.
 *
 * @param violations every violation in the order it was recorded
 * @param misattachmentEventCount number of (tick, kinetochore) misattachment observations
 * @param affectedAgentCount number of distinct kinetochores that were ever misattached
 */
public record SafetyReport(List<SafetyViolation> violations, int misattachmentEventCount, int affectedAgentCount) {

    public SafetyReport {
        violations = List.copyOf(violations);
    }

    /**
     * @return true when no safety violation was recorded
     */
    public boolean passed() {
        return violations.isEmpty();
    }
}
