package org.spindlecheck.runtime.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runtime verifier for the checkpoint safety properties
 * {@code G(committed -> allReady)} and {@code G(committed -> misattached == 0)}.
 * <p>
 * The monitor only observes: it receives plain values, keeps append-only logs and never
 * stops or alters the simulation. A failed check is reported, not thrown.
 * </p>
 */
public class SafetyMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(SafetyMonitor.class);

    private final List<SafetyViolation> violations = new ArrayList<>();
    private final List<MisattachmentEvent> misattachmentEvents = new ArrayList<>();

    /**
     * Checks both safety properties for one tick. Each one is checked independently, so a
     * single tick can record two violations.
     *
     * @param tick the current tick
     * @param allReady whether every kinetochore reports readiness
     * @param committed whether the commit latch is set
     * @param misattachedCount number of misattached kinetochores
     * @return true if the tick is safe
     */
    public boolean check(long tick, boolean allReady, boolean committed, int misattachedCount) {
        boolean ok = true;
        if (committed && !allReady) {
            record(tick, ViolationKind.COMMIT_WHILE_NOT_READY,
                    "Tick " + tick + ": anaphase triggered while the system is not ready");
            ok = false;
        }
        if (committed && misattachedCount > 0) {
            record(tick, ViolationKind.COMMIT_WITH_MISATTACHMENT,
                    "Tick " + tick + ": anaphase triggered with " + misattachedCount + " misattached kinetochores");
            ok = false;
        }
        return ok;
    }

    private void record(long tick, ViolationKind kind, String message) {
        violations.add(new SafetyViolation(tick, kind, message));
        LOG.warn("Safety violation {}: {}", kind, message);
    }

    /**
     * Records that a kinetochore was misattached on a tick.
     * @param tick the tick of the observation
     * @param agentId uid of the kinetochore
     */
    public void logMisattachment(long tick, int agentId) {
        misattachmentEvents.add(new MisattachmentEvent(tick, agentId));
    }

    /**
     * Builds the end-of-run report and logs its summary.
     * @return the report
     */
    public SafetyReport report() {
        Set<Integer> affected = new HashSet<>();
        for (MisattachmentEvent event : misattachmentEvents) {
            affected.add(event.agentId());
        }
        SafetyReport report = new SafetyReport(violations, misattachmentEvents.size(), affected.size());

        if (report.passed()) {
            LOG.info("Safety check passed, no violations recorded");
        } else {
            LOG.info("Safety check failed with {} violations", violations.size());
        }
        if (!misattachmentEvents.isEmpty()) {
            LOG.info("Misattachment events: {}, affected kinetochores: {}",
                    report.misattachmentEventCount(), report.affectedAgentCount());
        }
        return report;
    }

    public List<SafetyViolation> getViolations() {
        return Collections.unmodifiableList(violations);
    }

    public List<MisattachmentEvent> getMisattachmentEvents() {
        return Collections.unmodifiableList(misattachmentEvents);
    }
}
