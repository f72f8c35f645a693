package org.spindlecheck.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spindlecheck.runtime.model.BusParameters;
import org.spindlecheck.runtime.model.variants.VariantType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@Tag("unit")
class SimulationSettingsTest {

    private static Config withDefaults(String hocon) {
        return ConfigFactory.parseString(hocon)
                .withFallback(ConfigFactory.defaultReference())
                .resolve()
                .getConfig("spindlecheck");
    }

    @Test
    void referenceConfigurationDescribesTheStandardCell() {
        SimulationSettings s = SimulationSettings.fromConfig(ConfigFactory.load().getConfig("spindlecheck"));

        assertThat(s.seed()).isEqualTo(42L);
        assertThat(s.totalKinetochores()).isEqualTo(46);
        assertThat(s.pairCount()).isEqualTo(23);
        assertThat(s.physics().getTensionThreshold()).isEqualTo(0.8);
        assertThat(s.physics().getTensionStabilityWindow()).isEqualTo(3);
        assertThat(s.bus()).isEqualTo(new BusParameters(1.0, 0.2, 2.0, 100.0));
        assertThat(s.maxMitosisTime()).isEqualTo(200);
        assertThat(s.apoptosisThreshold()).isEqualTo(250);
        assertThat(s.maxTicks()).isEqualTo(250);
        assertThat(s.variantAssignments()).isEmpty();
    }

    @Test
    void readsVariantAssignmentsWhenEnabled() {
        SimulationSettings s = SimulationSettings.fromConfig(withDefaults(
                "spindlecheck.variants { enabled = true, faultySensor = [3], hyperstable = [5, 6] }"));

        assertThat(s.variantAssignments()).containsOnly(
                entry(3, VariantType.FAULTY_SENSOR),
                entry(5, VariantType.HYPERSTABLE),
                entry(6, VariantType.HYPERSTABLE));
    }

    @Test
    void ignoresVariantListsWhileDisabled() {
        SimulationSettings s = SimulationSettings.fromConfig(withDefaults(
                "spindlecheck.variants.faultySensor = [1, 2]"));

        assertThat(s.variantAssignments()).isEmpty();
    }

    @Test
    void optionalValuesFallBackToDefaults() {
        Config minimal = ConfigFactory.parseString("""
                population { chromosomes = 2 }
                physics { tensionThreshold = 0.7, noiseLevel = 0.0, attachProbability = 0.5, detachProbability = 0.01 }
                bus { mccProductionRate = 1.0, mccDegradationRate = 0.5, apcActivationThreshold = 1.0 }
                """);

        SimulationSettings s = SimulationSettings.fromConfig(minimal);

        assertThat(s.kinetochoresPerChromosome()).isEqualTo(2);
        assertThat(s.physics().getMisattachProbability()).isEqualTo(0.02);
        assertThat(s.bus().initialConcentration()).isEqualTo(BusParameters.DEFAULT_INITIAL_CONCENTRATION);
        assertThat(s.maxMitosisTime()).isEqualTo(SimulationSettings.DEFAULT_MAX_MITOSIS_TIME);
        assertThat(s.apoptosisThreshold()).isEqualTo(SimulationSettings.DEFAULT_APOPTOSIS_THRESHOLD);
    }

    @Test
    void missingRequiredValueIsAConfigError() {
        Config broken = ConfigFactory.parseString("""
                population { chromosomes = 2 }
                physics { tensionThreshold = 0.7, noiseLevel = 0.0, attachProbability = 0.5 }
                bus { mccProductionRate = 1.0, mccDegradationRate = 0.5, apcActivationThreshold = 1.0 }
                """);

        assertThatThrownBy(() -> SimulationSettings.fromConfig(broken))
                .isInstanceOf(ConfigException.Missing.class)
                .hasMessageContaining("detachProbability");
    }

    @Test
    void rejectsInvalidPopulationsAndAssignments() {
        assertThatThrownBy(() -> SimulationSettings.fromConfig(withDefaults(
                "spindlecheck.population { chromosomes = 3, kinetochoresPerChromosome = 1 }")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sister pairs");
        assertThatThrownBy(() -> SimulationSettings.fromConfig(withDefaults(
                "spindlecheck.variants { enabled = true, hyperstable = [23] }")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pair 23");
        assertThatThrownBy(() -> SimulationSettings.fromConfig(withDefaults(
                "spindlecheck.variants { enabled = true, hyperstable = [1], faultySensor = [1] }")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Pair 1");
        assertThatThrownBy(() -> SimulationSettings.fromConfig(withDefaults(
                "spindlecheck.variants { enabled = true, bub1Loss = [1] }")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bub1Loss");
        assertThatThrownBy(() -> SimulationSettings.fromConfig(withDefaults(
                "spindlecheck.physics.attachProbability = 1.5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("attachProbability");
    }

    @Test
    void withSeedKeepsEverythingElse() {
        SimulationSettings s = SimulationSettings.fromConfig(ConfigFactory.load().getConfig("spindlecheck"));

        SimulationSettings reseeded = s.withSeed(99L);

        assertThat(reseeded.seed()).isEqualTo(99L);
        assertThat(reseeded.physics()).isSameAs(s.physics());
        assertThat(reseeded.bus()).isEqualTo(s.bus());
    }
}
