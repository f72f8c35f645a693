package org.spindlecheck.runtime.model;

/**
 * Parameters of the signal bus and the commit controller.
 *
 * @param productionRate concentration added per unit of emitted signal
 * @param degradationRate fraction of the concentration decaying per tick
 * @param activationThreshold bus level below which the controller commits
 * @param initialConcentration bus level before the first tick
 */
public record BusParameters(double productionRate,
                            double degradationRate,
                            double activationThreshold,
                            double initialConcentration) {

    public static final double DEFAULT_INITIAL_CONCENTRATION = 100.0;

    public BusParameters {
        if (productionRate < 0.0) {
            throw new IllegalArgumentException("mccProductionRate must be >= 0, was " + productionRate);
        }
        if (degradationRate < 0.0 || degradationRate > 1.0) {
            throw new IllegalArgumentException("mccDegradationRate must be within [0, 1], was " + degradationRate);
        }
        if (initialConcentration < 0.0) {
            throw new IllegalArgumentException("initialConcentration must be >= 0, was " + initialConcentration);
        }
    }

    /**
     * Creates parameters with the default initial concentration.
     */
    public BusParameters(double productionRate, double degradationRate, double activationThreshold) {
        this(productionRate, degradationRate, activationThreshold, DEFAULT_INITIAL_CONCENTRATION);
    }
}
