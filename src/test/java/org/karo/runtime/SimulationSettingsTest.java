package org.karo.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.karo.runtime.model.Boundary;
import org.karo.runtime.rules.RuleRegistry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class SimulationSettingsTest {

    private static Config karo(String overrides) {
        return ConfigFactory.parseString(overrides).withFallback(ConfigFactory.load()).getConfig("karo");
    }

    @Test
    void referenceDefaultsMatchBuilderDefaults() {
        assertThat(SimulationSettings.fromConfig(karo(""))).isEqualTo(SimulationSettings.builder().build());
    }

    @Test
    void readsAllKeys() {
        SimulationSettings settings = SimulationSettings.fromConfig(karo("""
                karo {
                  track { length = 25, boundary = marked }
                  simulation {
                    mode = asynchronous
                    seed = 7
                    tie-break = highest-id
                    parallelism = 3
                    max-ticks = 100
                    max-time = 12.5
                    check-invariants = false
                  }
                }
                """));

        assertThat(settings.trackLength()).isEqualTo(25);
        assertThat(settings.boundary()).isEqualTo(Boundary.MARKED);
        assertThat(settings.mode()).isEqualTo(SchedulingMode.ASYNCHRONOUS);
        assertThat(settings.seed()).isEqualTo(7L);
        assertThat(settings.tieBreak()).isEqualTo(TieBreak.HIGHEST_ID);
        assertThat(settings.parallelism()).isEqualTo(3);
        assertThat(settings.maxTicks()).isEqualTo(100L);
        assertThat(settings.maxTime()).isEqualTo(12.5);
        assertThat(settings.checkInvariants()).isFalse();
    }

    @Test
    void unknownEnumValueIsRejected() {
        assertThatThrownBy(() -> SimulationSettings.fromConfig(karo("karo.track.boundary = periodic")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("periodic");
    }

    @Test
    void wrongTypeIsRejected() {
        assertThatThrownBy(() -> SimulationSettings.fromConfig(karo("karo.track.length = long")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> SimulationSettings.builder().trackLength(0).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SimulationSettings.builder().maxTime(Double.NaN).build())
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> SimulationSettings.builder().parallelism(-1).build())
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void markedTrackNeedsRoomForBothMarkers() {
        SimulationSettings settings = SimulationSettings.builder().trackLength(1).boundary(Boundary.MARKED).build();

        assertThatThrownBy(() -> new Simulation(settings, new RuleRegistry()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void toBuilderCopiesEverything() {
        SimulationSettings settings = SimulationSettings.builder().seed(99).mode(SchedulingMode.ASYNCHRONOUS).build();

        assertThat(settings.toBuilder().build()).isEqualTo(settings);
        assertThat(settings.toBuilder().seed(1).build().mode()).isEqualTo(SchedulingMode.ASYNCHRONOUS);
    }
}
