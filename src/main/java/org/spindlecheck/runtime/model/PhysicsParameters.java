package org.spindlecheck.runtime.model;

/**
 * Immutable set of physical parameters read by every kinetochore during a tick.
 * <p>
 * Instances are shared by all kinetochores of a run. Variants that need a modified value
 * derive a copy through {@link #withDetachProbability(double)} or
 * {@link #withMisattachProbability(double)}; nothing ever mutates a shared instance.
 * </p>
 */
public final class PhysicsParameters {

    public static final double DEFAULT_MISATTACH_PROBABILITY = 0.02;
    public static final double DEFAULT_MISATTACH_DETACH_MULTIPLIER = 2.0;
    public static final int DEFAULT_TENSION_STABILITY_WINDOW = 3;
    public static final double DEFAULT_WAPL_RELAXED_THRESHOLD = 0.5;
    public static final double DEFAULT_WAPL_UNLOAD_PROBABILITY = 0.005;
    public static final double DEFAULT_CTCF_INSTABILITY = 0.1;
    public static final double DEFAULT_HYPERSTABILIZATION_FACTOR = 0.1;
    public static final double DEFAULT_MEROTELIC_DRIFT_MULTIPLIER = 5.0;

    private final double tensionThreshold;
    private final double noiseLevel;
    private final double attachProbability;
    private final double detachProbability;
    private final double misattachProbability;
    private final double misattachDetachMultiplier;
    private final int tensionStabilityWindow;
    private final double waplRelaxedThreshold;
    private final double waplUnloadProbability;
    private final double ctcfInstability;
    private final double hyperstabilizationFactor;
    private final double merotelicDriftMultiplier;

    private PhysicsParameters(Builder b) {
        this.tensionThreshold = b.tensionThreshold;
        this.noiseLevel = requireNonNegative("noiseLevel", b.noiseLevel);
        this.attachProbability = requireProbability("attachProbability", b.attachProbability);
        this.detachProbability = requireProbability("detachProbability", b.detachProbability);
        this.misattachProbability = requireProbability("misattachProbability", b.misattachProbability);
        this.misattachDetachMultiplier = requireNonNegative("misattachDetachMultiplier", b.misattachDetachMultiplier);
        if (b.tensionStabilityWindow < 1) {
            throw new IllegalArgumentException("tensionStabilityWindow must be >= 1, was " + b.tensionStabilityWindow);
        }
        this.tensionStabilityWindow = b.tensionStabilityWindow;
        if (b.waplRelaxedThreshold <= 0.0) {
            throw new IllegalArgumentException("waplRelaxedThreshold must be > 0, was " + b.waplRelaxedThreshold);
        }
        this.waplRelaxedThreshold = b.waplRelaxedThreshold;
        this.waplUnloadProbability = requireProbability("waplUnloadProbability", b.waplUnloadProbability);
        this.ctcfInstability = requireProbability("ctcfInstability", b.ctcfInstability);
        this.hyperstabilizationFactor = requireNonNegative("hyperstabilizationFactor", b.hyperstabilizationFactor);
        this.merotelicDriftMultiplier = requireNonNegative("merotelicDriftMultiplier", b.merotelicDriftMultiplier);
    }

    /**
     * Starts a builder with the four mandatory values; every optional value starts at its default.
     *
     * @param tensionThreshold minimum tension that counts towards stable bi-orientation
     * @param noiseLevel standard deviation of the tension measurement noise
     * @param attachProbability per-tick attach probability of a detached kinetochore
     * @param detachProbability per-tick detach probability of an attached kinetochore
     * @return a new builder
     */
    public static Builder builder(double tensionThreshold, double noiseLevel,
                                  double attachProbability, double detachProbability) {
        return new Builder(tensionThreshold, noiseLevel, attachProbability, detachProbability);
    }

    /**
     * Returns a copy of these parameters with a different detach probability.
     * Values above 1.0 are capped, since they are only ever compared against a uniform draw.
     *
     * @param value the derived detach probability
     * @return a new instance, this instance is left untouched
     */
    public PhysicsParameters withDetachProbability(double value) {
        return toBuilder().detachProbability(Math.min(1.0, value)).build();
    }

    /**
     * Returns a copy of these parameters with a different misattach probability.
     * Values above 1.0 are capped.
     *
     * @param value the derived misattach probability
     * @return a new instance, this instance is left untouched
     */
    public PhysicsParameters withMisattachProbability(double value) {
        return toBuilder().misattachProbability(Math.min(1.0, value)).build();
    }

    public Builder toBuilder() {
        return new Builder(tensionThreshold, noiseLevel, attachProbability, detachProbability)
                .misattachProbability(misattachProbability)
                .misattachDetachMultiplier(misattachDetachMultiplier)
                .tensionStabilityWindow(tensionStabilityWindow)
                .waplRelaxedThreshold(waplRelaxedThreshold)
                .waplUnloadProbability(waplUnloadProbability)
                .ctcfInstability(ctcfInstability)
                .hyperstabilizationFactor(hyperstabilizationFactor)
                .merotelicDriftMultiplier(merotelicDriftMultiplier);
    }

    public double getTensionThreshold() { return tensionThreshold; }
    public double getNoiseLevel() { return noiseLevel; }
    public double getAttachProbability() { return attachProbability; }
    public double getDetachProbability() { return detachProbability; }
    public double getMisattachProbability() { return misattachProbability; }
    public double getMisattachDetachMultiplier() { return misattachDetachMultiplier; }
    public int getTensionStabilityWindow() { return tensionStabilityWindow; }
    public double getWaplRelaxedThreshold() { return waplRelaxedThreshold; }
    public double getWaplUnloadProbability() { return waplUnloadProbability; }
    public double getCtcfInstability() { return ctcfInstability; }
    public double getHyperstabilizationFactor() { return hyperstabilizationFactor; }
    public double getMerotelicDriftMultiplier() { return merotelicDriftMultiplier; }

    @Override
    public String toString() {
        return "PhysicsParameters{tensionThreshold=" + tensionThreshold
                + ", noiseLevel=" + noiseLevel
                + ", attachProbability=" + attachProbability
                + ", detachProbability=" + detachProbability
                + ", misattachProbability=" + misattachProbability
                + ", tensionStabilityWindow=" + tensionStabilityWindow + "}";
    }

    private static double requireProbability(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be within [0, 1], was " + value);
        }
        return value;
    }

    private static double requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || value < 0.0) {
            throw new IllegalArgumentException(name + " must be >= 0, was " + value);
        }
        return value;
    }

    /**
     * Builder for {@link PhysicsParameters}. Optional values default to the documented constants.
     */
    public static final class Builder {
        private final double tensionThreshold;
        private final double noiseLevel;
        private final double attachProbability;
        private double detachProbability;
        private double misattachProbability = DEFAULT_MISATTACH_PROBABILITY;
        private double misattachDetachMultiplier = DEFAULT_MISATTACH_DETACH_MULTIPLIER;
        private int tensionStabilityWindow = DEFAULT_TENSION_STABILITY_WINDOW;
        private double waplRelaxedThreshold = DEFAULT_WAPL_RELAXED_THRESHOLD;
        private double waplUnloadProbability = DEFAULT_WAPL_UNLOAD_PROBABILITY;
        private double ctcfInstability = DEFAULT_CTCF_INSTABILITY;
        private double hyperstabilizationFactor = DEFAULT_HYPERSTABILIZATION_FACTOR;
        private double merotelicDriftMultiplier = DEFAULT_MEROTELIC_DRIFT_MULTIPLIER;

        private Builder(double tensionThreshold, double noiseLevel, double attachProbability, double detachProbability) {
            this.tensionThreshold = tensionThreshold;
            this.noiseLevel = noiseLevel;
            this.attachProbability = attachProbability;
            this.detachProbability = detachProbability;
        }

        private Builder detachProbability(double value) { this.detachProbability = value; return this; }
        public Builder misattachProbability(double value) { this.misattachProbability = value; return this; }
        public Builder misattachDetachMultiplier(double value) { this.misattachDetachMultiplier = value; return this; }
        public Builder tensionStabilityWindow(int value) { this.tensionStabilityWindow = value; return this; }
        public Builder waplRelaxedThreshold(double value) { this.waplRelaxedThreshold = value; return this; }
        public Builder waplUnloadProbability(double value) { this.waplUnloadProbability = value; return this; }
        public Builder ctcfInstability(double value) { this.ctcfInstability = value; return this; }
        public Builder hyperstabilizationFactor(double value) { this.hyperstabilizationFactor = value; return this; }
        public Builder merotelicDriftMultiplier(double value) { this.merotelicDriftMultiplier = value; return this; }

        public PhysicsParameters build() {
            return new PhysicsParameters(this);
        }
    }
}
