package org.spindlecheck.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spindlecheck.runtime.internal.services.SeededRandomProvider;
import org.spindlecheck.runtime.model.CommitController;
import org.spindlecheck.runtime.model.Kinetochore;
import org.spindlecheck.runtime.model.KinetochoreState;
import org.spindlecheck.runtime.model.PhysicsParameters;
import org.spindlecheck.runtime.model.SignalBus;
import org.spindlecheck.runtime.model.variants.IKinetochoreVariant;
import org.spindlecheck.runtime.model.variants.VariantType;
import org.spindlecheck.runtime.monitor.SafetyMonitor;
import org.spindlecheck.runtime.monitor.SafetyReport;
import org.spindlecheck.runtime.spi.IRandomProvider;
import org.spindlecheck.runtime.spi.ITickListener;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drives the checkpoint simulation tick by tick and owns the outcome state machine.
 * <p>
 * A tick updates every sister pair in pair order, aggregates the emitted signals, feeds the
 * signal bus, asks the commit controller for a decision, lets the safety monitor check the
 * result and finally applies the timeout policy. Both kinetochores of a pair read the
 * sibling's state as it was before the tick, so the pair order never influences a result.
 * </p>
 */
public class Simulation {
    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private final SimulationSettings settings;
    private final PhysicsParameters physics;
    private final List<Kinetochore> kinetochores;
    private final List<IRandomProvider> kinetochoreRandom;
    private final SignalBus bus;
    private final CommitController controller;
    private final SafetyMonitor monitor;
    private final List<TickReport> tickReports = new ArrayList<>();
    private final List<OutcomeTransition> transitions = new ArrayList<>();
    private final List<ITickListener> listeners = new ArrayList<>();

    private SimulationOutcome outcome = SimulationOutcome.RUNNING;
    private boolean arrested = false;
    private long currentTick = 0L;

    /**
     * Creates a simulation whose randomness is seeded from {@link SimulationSettings#seed()}.
     * @param settings The run settings.
     */
    public Simulation(SimulationSettings settings) {
        this(settings, new SeededRandomProvider(settings.seed()));
    }

    /**
     * Creates a simulation with an explicit random provider. Every kinetochore receives its own
     * stream derived from it.
     * @param settings The run settings.
     * @param randomProvider The root random provider of the run.
     */
    public Simulation(SimulationSettings settings, IRandomProvider randomProvider) {
        this.settings = settings;
        this.physics = settings.physics();
        this.bus = new SignalBus(settings.bus().productionRate(), settings.bus().degradationRate(),
                settings.bus().initialConcentration());
        this.controller = new CommitController(settings.bus().activationThreshold());
        this.monitor = new SafetyMonitor();

        int total = settings.totalKinetochores();
        this.kinetochores = new ArrayList<>(total);
        this.kinetochoreRandom = new ArrayList<>(total);
        for (int uid = 0; uid < total; uid++) {
            int pairId = uid / 2;
            VariantType type = settings.variantAssignments().get(pairId);
            IKinetochoreVariant variant = type != null ? type.getVariant() : IKinetochoreVariant.NONE;
            kinetochores.add(new Kinetochore(uid, pairId, physics.getTensionThreshold(), physics.getNoiseLevel(), variant));
            kinetochoreRandom.add(randomProvider.deriveFor("kinetochore", uid));
        }
    }

    /**
     * Registers a listener that receives every tick report.
     * @param listener The listener.
     */
    public void addTickListener(ITickListener listener) {
        listeners.add(listener);
    }

    /**
     * Executes a single tick.
     * @return the report of the executed tick
     * @throws IllegalStateException if the run already reached a terminal outcome
     */
    public TickReport tick() {
        if (outcome.isTerminal()) {
            throw new IllegalStateException("Simulation already finished with outcome " + outcome);
        }
        long tick = currentTick;

        KinetochoreState[] snapshot = new KinetochoreState[kinetochores.size()];
        for (int i = 0; i < snapshot.length; i++) {
            snapshot[i] = kinetochores.get(i).getState();
        }

        double totalFlux = 0.0;
        int readyCount = 0;
        int misattachedCount = 0;
        for (int i = 0; i + 1 < kinetochores.size(); i += 2) {
            Kinetochore first = kinetochores.get(i);
            Kinetochore second = kinetochores.get(i + 1);
            first.update(snapshot[i + 1], physics, kinetochoreRandom.get(i));
            second.update(snapshot[i], physics, kinetochoreRandom.get(i + 1));

            for (Kinetochore k : List.of(first, second)) {
                totalFlux += k.emitSignal();
                if (k.isReady()) {
                    readyCount++;
                }
                if (k.isMisattached()) {
                    misattachedCount++;
                    monitor.logMisattachment(tick, k.getUid());
                }
            }
        }

        double level = bus.update(totalFlux);
        boolean committed = controller.evaluate(tick, level);
        boolean allReady = readyCount == kinetochores.size();
        monitor.check(tick, allReady, committed, misattachedCount);

        applyOutcomePolicy(tick, committed, readyCount, level);

        TickReport report = new TickReport(tick, level, readyCount, kinetochores.size(), misattachedCount, arrested, committed);
        tickReports.add(report);
        if (LOG.isDebugEnabled()) {
            LOG.debug("Tick={} MCC={} Ready={}/{} Misattached={} Arrested={} Committed={}",
                    tick, String.format("%.2f", level), readyCount, kinetochores.size(), misattachedCount, arrested, committed);
        }
        for (ITickListener listener : listeners) {
            listener.onTick(report);
        }
        currentTick++;
        return report;
    }

    /**
     * Arrest is checked before apoptosis, and apoptosis before the commit, so coinciding
     * thresholds produce the arrest entry first.
     */
    private void applyOutcomePolicy(long tick, boolean committed, int readyCount, double level) {
        if (!arrested && !committed && tick >= settings.maxMitosisTime()) {
            arrested = true;
            transitionTo(tick, SimulationOutcome.MITOTIC_ARREST);
            LOG.warn("Mitotic arrest at tick {}: ready {}/{}, MCC {}",
                    tick, readyCount, kinetochores.size(), String.format("%.2f", level));
        }
        if (tick >= settings.apoptosisThreshold()) {
            transitionTo(tick, SimulationOutcome.APOPTOSIS);
            LOG.warn("Apoptosis at tick {}: mitosis exceeded the maximum safe duration", tick);
            return;
        }
        if (committed) {
            transitionTo(tick, SimulationOutcome.ANAPHASE_COMPLETED);
            LOG.info("Anaphase triggered at tick {}", tick);
        }
    }

    private void transitionTo(long tick, SimulationOutcome next) {
        transitions.add(new OutcomeTransition(tick, outcome, next));
        outcome = next;
    }

    /**
     * Runs ticks until a terminal outcome is reached or the tick budget is exhausted,
     * then builds the safety report.
     * @return the result of the run
     */
    public SimulationResult run() {
        LOG.info("Simulation started: kinetochores={}, pairs={}, variants={}, activationThreshold={}, seed={}",
                kinetochores.size(), settings.pairCount(), settings.variantAssignments().size(),
                settings.bus().activationThreshold(), settings.seed());
        while (!outcome.isTerminal() && currentTick <= settings.maxTicks()) {
            tick();
        }
        SafetyReport report = monitor.report();
        return new SimulationResult(outcome, currentTick - 1, controller.getCommitTick(), tickReports, transitions, report);
    }

    public boolean isFinished() {
        return outcome.isTerminal() || currentTick > settings.maxTicks();
    }

    public SimulationOutcome getOutcome() { return outcome; }

    public boolean isArrested() { return arrested; }

    public long getCurrentTick() { return currentTick; }

    public SimulationSettings getSettings() { return settings; }

    public List<Kinetochore> getKinetochores() { return Collections.unmodifiableList(kinetochores); }

    public SignalBus getBus() { return bus; }

    public CommitController getController() { return controller; }

    public SafetyMonitor getMonitor() { return monitor; }

    public List<TickReport> getTickReports() { return Collections.unmodifiableList(tickReports); }

    public List<OutcomeTransition> getTransitions() { return Collections.unmodifiableList(transitions); }
}
