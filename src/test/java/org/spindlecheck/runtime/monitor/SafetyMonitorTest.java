package org.spindlecheck.runtime.monitor;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.spindlecheck.junit.extensions.logging.AllowLog;
import org.spindlecheck.junit.extensions.logging.ExpectLog;
import org.spindlecheck.junit.extensions.logging.LogLevel;
import org.spindlecheck.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SafetyMonitorTest {

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*SafetyMonitor", messagePattern = "Safety violation .*")
    void flagsExactlyTheUnsafeCombinations() {
        for (boolean committed : new boolean[]{false, true}) {
            for (boolean allReady : new boolean[]{false, true}) {
                for (int misattached : new int[]{0, 1, 5}) {
                    SafetyMonitor monitor = new SafetyMonitor();

                    boolean ok = monitor.check(7, allReady, committed, misattached);

                    int expected = (committed && !allReady ? 1 : 0) + (committed && misattached > 0 ? 1 : 0);
                    assertThat(monitor.getViolations())
                            .as("committed=%s allReady=%s misattached=%d", committed, allReady, misattached)
                            .hasSize(expected);
                    assertThat(ok).isEqualTo(expected == 0);
                }
            }
        }
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Safety violation COMMIT_WHILE_NOT_READY: Tick 12: .*")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Safety violation COMMIT_WITH_MISATTACHMENT: Tick 12: .* 3 misattached .*")
    void recordsBothViolationsOfOneTickIndependently() {
        SafetyMonitor monitor = new SafetyMonitor();

        monitor.check(12, false, true, 3);

        assertThat(monitor.getViolations())
                .extracting(SafetyViolation::kind)
                .containsExactly(ViolationKind.COMMIT_WHILE_NOT_READY, ViolationKind.COMMIT_WITH_MISATTACHMENT);
        assertThat(monitor.getViolations()).allMatch(v -> v.tick() == 12);
    }

    @Test
    void uncommittedTicksAreAlwaysSafe() {
        SafetyMonitor monitor = new SafetyMonitor();

        for (long tick = 0; tick < 100; tick++) {
            assertThat(monitor.check(tick, false, false, 46)).isTrue();
        }

        assertThat(monitor.report().passed()).isTrue();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Safety violation .*")
    void reportCountsMisattachmentEventsAndDistinctAgents() {
        SafetyMonitor monitor = new SafetyMonitor();
        monitor.logMisattachment(0, 4);
        monitor.logMisattachment(1, 4);
        monitor.logMisattachment(1, 9);
        monitor.check(1, true, true, 1);

        SafetyReport report = monitor.report();

        assertThat(report.passed()).isFalse();
        assertThat(report.violations()).hasSize(1);
        assertThat(report.misattachmentEventCount()).isEqualTo(3);
        assertThat(report.affectedAgentCount()).isEqualTo(2);
        assertThat(monitor.getMisattachmentEvents()).containsExactly(
                new MisattachmentEvent(0, 4), new MisattachmentEvent(1, 4), new MisattachmentEvent(1, 9));
    }
}
