package org.spindlecheck.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The cytoplasmic MCC pool: a leaky integrator over the inhibitory flux of all kinetochores.
 * <p>
 * Aggregating many independent binary signals and low-pass filtering them keeps the noise of a
 * single kinetochore from reaching the commit decision.
 * </p>
 */
public class SignalBus {

    private final double productionRate;
    private final double degradationRate;
    private final List<Double> history = new ArrayList<>();
    private double concentration;

    /**
     * Creates a bus.
     * @param productionRate Concentration added per unit of flux.
     * @param degradationRate Fraction of the concentration that decays per tick, in [0, 1].
     * @param initialConcentration Concentration before the first tick.
     */
    public SignalBus(double productionRate, double degradationRate, double initialConcentration) {
        if (productionRate < 0.0) {
            throw new IllegalArgumentException("productionRate must be >= 0, was " + productionRate);
        }
        if (degradationRate < 0.0 || degradationRate > 1.0) {
            throw new IllegalArgumentException("degradationRate must be within [0, 1], was " + degradationRate);
        }
        this.productionRate = productionRate;
        this.degradationRate = degradationRate;
        this.concentration = Math.max(0.0, initialConcentration);
    }

    /**
     * Applies one tick of decay and production.
     * @param totalFlux Sum of the signals emitted by all kinetochores this tick.
     * @return the new concentration
     */
    public double update(double totalFlux) {
        concentration = concentration * (1.0 - degradationRate) + totalFlux * productionRate;
        concentration = Math.max(0.0, concentration);
        history.add(concentration);
        return concentration;
    }

    public double getConcentration() {
        return concentration;
    }

    public double getProductionRate() {
        return productionRate;
    }

    public double getDegradationRate() {
        return degradationRate;
    }

    /**
     * Returns the concentration after every update so far, oldest first.
     * @return an unmodifiable view of the history
     */
    public List<Double> getHistory() {
        return Collections.unmodifiableList(history);
    }
}
