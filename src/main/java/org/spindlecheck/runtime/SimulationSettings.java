package org.spindlecheck.runtime;

import com.typesafe.config.Config;
import org.spindlecheck.runtime.model.BusParameters;
import org.spindlecheck.runtime.model.PhysicsParameters;
import org.spindlecheck.runtime.model.variants.VariantType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable settings of one simulation run.
 *
 * @param seed seed of the run's random provider
 * @param chromosomes number of chromosomes
 * @param kinetochoresPerChromosome kinetochores per chromosome, normally 2
 * @param physics kinetochore physics shared by all kinetochores
 * @param bus signal bus and controller parameters
 * @param maxMitosisTime tick from which mitotic arrest is entered
 * @param apoptosisThreshold tick from which the run ends in apoptosis
 * @param variantAssignments pair id to variant; pairs without an entry use the standard behaviour
 */
public record SimulationSettings(long seed,
                                 int chromosomes,
                                 int kinetochoresPerChromosome,
                                 PhysicsParameters physics,
                                 BusParameters bus,
                                 int maxMitosisTime,
                                 int apoptosisThreshold,
                                 Map<Integer, VariantType> variantAssignments) {

    public static final int DEFAULT_MAX_MITOSIS_TIME = 200;
    public static final int DEFAULT_APOPTOSIS_THRESHOLD = 250;

    public SimulationSettings {
        if (chromosomes < 1) {
            throw new IllegalArgumentException("chromosomes must be >= 1, was " + chromosomes);
        }
        if (kinetochoresPerChromosome < 1) {
            throw new IllegalArgumentException("kinetochoresPerChromosome must be >= 1, was " + kinetochoresPerChromosome);
        }
        int total = chromosomes * kinetochoresPerChromosome;
        if (total % 2 != 0) {
            throw new IllegalArgumentException("Kinetochores are simulated in sister pairs, but the population has "
                    + total + " kinetochores (" + chromosomes + " x " + kinetochoresPerChromosome + ")");
        }
        if (maxMitosisTime < 0 || apoptosisThreshold < 0) {
            throw new IllegalArgumentException("maxMitosisTime and apoptosisThreshold must be >= 0");
        }
        int pairs = total / 2;
        for (Integer pairId : variantAssignments.keySet()) {
            if (pairId < 0 || pairId >= pairs) {
                throw new IllegalArgumentException("Variant assigned to pair " + pairId
                        + ", but only pairs 0.." + (pairs - 1) + " exist");
            }
        }
        variantAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(variantAssignments));
    }

    /**
     * @return total number of kinetochores
     */
    public int totalKinetochores() {
        return chromosomes * kinetochoresPerChromosome;
    }

    /**
     * @return number of sister pairs
     */
    public int pairCount() {
        return totalKinetochores() / 2;
    }

    /**
     * @return the last tick a run may execute
     */
    public int maxTicks() {
        return Math.max(maxMitosisTime, apoptosisThreshold);
    }

    /**
     * Returns a copy with a different seed.
     * @param newSeed the seed
     * @return the new settings
     */
    public SimulationSettings withSeed(long newSeed) {
        return new SimulationSettings(newSeed, chromosomes, kinetochoresPerChromosome, physics, bus,
                maxMitosisTime, apoptosisThreshold, variantAssignments);
    }

    /**
     * Reads settings from the {@code spindlecheck} block of the HOCON configuration.
     * <p>
     * Required values missing from {@code options} raise a {@link com.typesafe.config.ConfigException};
     * optional physics values fall back to the defaults of {@link PhysicsParameters}.
     * </p>
     *
     * @param options the {@code spindlecheck} configuration block
     * @return the settings
     * @throws IllegalArgumentException if a value is out of range or a variant assignment is invalid
     */
    public static SimulationSettings fromConfig(Config options) {
        long seed = options.hasPath("seed") ? options.getLong("seed") : System.currentTimeMillis();

        Config population = options.getConfig("population");
        int chromosomes = population.getInt("chromosomes");
        int perChromosome = population.hasPath("kinetochoresPerChromosome")
                ? population.getInt("kinetochoresPerChromosome") : 2;

        PhysicsParameters physics = readPhysics(options.getConfig("physics"));

        Config busConfig = options.getConfig("bus");
        BusParameters bus = new BusParameters(
                busConfig.getDouble("mccProductionRate"),
                busConfig.getDouble("mccDegradationRate"),
                busConfig.getDouble("apcActivationThreshold"),
                busConfig.hasPath("initialConcentration")
                        ? busConfig.getDouble("initialConcentration") : BusParameters.DEFAULT_INITIAL_CONCENTRATION);

        int maxMitosisTime = options.hasPath("limits.maxMitosisTime")
                ? options.getInt("limits.maxMitosisTime") : DEFAULT_MAX_MITOSIS_TIME;
        int apoptosisThreshold = options.hasPath("limits.apoptosisThreshold")
                ? options.getInt("limits.apoptosisThreshold") : DEFAULT_APOPTOSIS_THRESHOLD;

        Map<Integer, VariantType> assignments = options.hasPath("variants")
                ? readVariants(options.getConfig("variants")) : Map.of();

        return new SimulationSettings(seed, chromosomes, perChromosome, physics, bus,
                maxMitosisTime, apoptosisThreshold, assignments);
    }

    private static PhysicsParameters readPhysics(Config physics) {
        PhysicsParameters.Builder builder = PhysicsParameters.builder(
                physics.getDouble("tensionThreshold"),
                physics.getDouble("noiseLevel"),
                physics.getDouble("attachProbability"),
                physics.getDouble("detachProbability"));
        if (physics.hasPath("misattachProbability")) builder.misattachProbability(physics.getDouble("misattachProbability"));
        if (physics.hasPath("misattachDetachMultiplier")) builder.misattachDetachMultiplier(physics.getDouble("misattachDetachMultiplier"));
        if (physics.hasPath("tensionStabilityWindow")) builder.tensionStabilityWindow(physics.getInt("tensionStabilityWindow"));
        if (physics.hasPath("waplRelaxedThreshold")) builder.waplRelaxedThreshold(physics.getDouble("waplRelaxedThreshold"));
        if (physics.hasPath("waplUnloadProbability")) builder.waplUnloadProbability(physics.getDouble("waplUnloadProbability"));
        if (physics.hasPath("ctcfInstability")) builder.ctcfInstability(physics.getDouble("ctcfInstability"));
        if (physics.hasPath("hyperstabilizationFactor")) builder.hyperstabilizationFactor(physics.getDouble("hyperstabilizationFactor"));
        if (physics.hasPath("merotelicDriftMultiplier")) builder.merotelicDriftMultiplier(physics.getDouble("merotelicDriftMultiplier"));
        return builder.build();
    }

    private static Map<Integer, VariantType> readVariants(Config variants) {
        boolean enabled = !variants.hasPath("enabled") || variants.getBoolean("enabled");
        if (!enabled) {
            return Map.of();
        }
        Map<Integer, VariantType> assignments = new LinkedHashMap<>();
        for (String key : variants.root().keySet()) {
            if ("enabled".equals(key)) {
                continue;
            }
            VariantType type = VariantType.fromConfigKey(key);
            List<Integer> pairIds = variants.getIntList(key);
            for (Integer pairId : pairIds) {
                VariantType previous = assignments.putIfAbsent(pairId, type);
                if (previous != null && previous != type) {
                    throw new IllegalArgumentException("Pair " + pairId + " is assigned to both "
                            + previous.getConfigKey() + " and " + type.getConfigKey());
                }
            }
        }
        return assignments;
    }
}
