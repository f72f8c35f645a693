package org.spindlecheck.cli.rendering;

import org.spindlecheck.runtime.SimulationOutcome;
import org.spindlecheck.runtime.SimulationResult;
import org.spindlecheck.runtime.TickReport;
import org.spindlecheck.runtime.monitor.SafetyReport;
import org.spindlecheck.runtime.monitor.SafetyViolation;
import org.spindlecheck.runtime.spi.ITickListener;

import java.io.PrintWriter;
import java.util.Locale;

/**
 * Prints a human readable trace of a run: one line per sampled tick, then the safety
 * report and the final state.
 * <p>
 * A tick is printed when its index is a multiple of the sampling interval, or when anything
 * noteworthy is true for it (commit, misattachment, arrest).
 * </p>
 */
public class ConsoleReportRenderer implements ITickListener {

    private final PrintWriter out;
    private final int everyNTicks;

    /**
     * @param out Destination of the rendered text.
     * @param everyNTicks Sampling interval for unremarkable ticks, must be >= 1.
     */
    public ConsoleReportRenderer(PrintWriter out, int everyNTicks) {
        if (everyNTicks < 1) {
            throw new IllegalArgumentException("everyNTicks must be >= 1, was " + everyNTicks);
        }
        this.out = out;
        this.everyNTicks = everyNTicks;
    }

    @Override
    public void onTick(TickReport report) {
        if (report.tick() % everyNTicks == 0 || report.committed() || report.misattachedCount() > 0 || report.arrested()) {
            out.println(formatTick(report));
            out.flush();
        }
    }

    /**
     * Formats a single tick line, e.g. {@code T=007 | MCC: 3.20 | Ready: 2/4 | Anaphase: false}.
     * @param report the tick
     * @return the line
     */
    public static String formatTick(TickReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "T=%03d | MCC: %.2f | Ready: %d/%d",
                report.tick(), report.busConcentration(), report.readyCount(), report.totalCount()));
        if (report.misattachedCount() > 0) {
            sb.append(" | Misattached: ").append(report.misattachedCount());
        }
        if (report.arrested()) {
            sb.append(" | ARRESTED");
        }
        sb.append(" | Anaphase: ").append(report.committed());
        return sb.toString();
    }

    /**
     * Prints the safety report and the final state of a finished run.
     * @param result the run result
     */
    public void renderSummary(SimulationResult result) {
        SafetyReport safety = result.safetyReport();
        out.println();
        if (safety.passed()) {
            out.println("[VERIFIER] SAFETY CHECK PASSED");
        } else {
            out.println("[VERIFIER] SAFETY VIOLATIONS FOUND (" + safety.violations().size() + "):");
            for (SafetyViolation violation : safety.violations()) {
                out.println("  " + violation.message());
            }
        }
        if (safety.misattachmentEventCount() > 0) {
            out.println("[MISATTACHMENT] Total misattachment events: " + safety.misattachmentEventCount());
            out.println("[MISATTACHMENT] Affected kinetochores: " + safety.affectedAgentCount());
        }
        out.println("[FINAL STATE] " + describe(result.outcome(), result.lastTick()));
        out.flush();
    }

    private static String describe(SimulationOutcome outcome, long lastTick) {
        return switch (outcome) {
            case ANAPHASE_COMPLETED -> "Anaphase completed at tick " + lastTick;
            case APOPTOSIS -> "Apoptosis at tick " + lastTick + ", mitosis exceeded the maximum safe duration";
            case MITOTIC_ARREST -> "Mitotic arrest, tick budget exhausted at tick " + lastTick;
            case RUNNING -> "Running, tick budget exhausted at tick " + lastTick;
        };
    }
}
