package org.karo.runtime.resume;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.karo.runtime.EngineState;
import org.karo.runtime.RunResult;
import org.karo.runtime.SchedulingMode;
import org.karo.runtime.Simulation;
import org.karo.runtime.SimulationSettings;
import org.karo.runtime.model.Boundary;
import org.karo.runtime.model.ParticleSpec;
import org.karo.runtime.model.TrajectoryEntry;
import org.karo.runtime.rules.RuleRegistry;
import org.karo.test.utils.TestRegistries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

@Tag("integration")
class SimulationCheckpointTest {

    private static Simulation populated(SchedulingMode mode, int parallelism) {
        SimulationSettings settings = SimulationSettings.builder()
                .trackLength(40)
                .boundary(Boundary.MARKED)
                .mode(mode)
                .seed(1234L)
                .parallelism(parallelism)
                .build();
        Simulation simulation = new Simulation(settings, TestRegistries.standard());
        for (int site = 2; site < 38; site += 4) {
            simulation.addParticle(ParticleSpec.at(site).traits(TestRegistries.RANDOM_WALKER, TestRegistries.MORTAL)
                    .state(TestRegistries.MORTAL, "lifetime", 8 + site).build());
        }
        simulation.addParticle(ParticleSpec.at(39 - 2).traits(TestRegistries.LEFT_WALKER).build());
        return simulation;
    }

    private static void assertResumesIdentically(SchedulingMode mode, long warmUp, long steps) {
        Simulation baseline = populated(mode, 1);
        try {
            baseline.run(warmUp).orThrow();
            String json = CheckpointCodec.toJson(baseline);
            List<TrajectoryEntry> expected = baseline.run(steps).orThrow().entries();

            Simulation resumed = SimulationRestorer.restore(json, TestRegistries.standard());
            try {
                assertThat(resumed.getTick()).isEqualTo(warmUp);
                RunResult actual = resumed.run(steps).orThrow();

                assertThat(actual.entries()).isEqualTo(expected);
                assertThat(resumed.getTime()).isEqualTo(baseline.getTime());
                assertThat(resumed.getNextParticleId()).isEqualTo(baseline.getNextParticleId());
            } finally {
                resumed.shutdown();
            }
        } finally {
            baseline.shutdown();
        }
    }

    @Test
    void synchronousRunContinuesIdentically() {
        assertResumesIdentically(SchedulingMode.SYNCHRONOUS, 5, 20);
    }

    @Test
    void asynchronousRunContinuesIdentically() {
        assertResumesIdentically(SchedulingMode.ASYNCHRONOUS, 30, 60);
    }

    @Test
    void restoreMayChangeParallelism() {
        Simulation baseline = populated(SchedulingMode.SYNCHRONOUS, 1);
        baseline.run(3).orThrow();
        SimulationCheckpoint checkpoint = CheckpointCodec.capture(baseline);
        List<TrajectoryEntry> expected = baseline.run(10).orThrow().entries();

        Simulation resumed = SimulationRestorer.restore(checkpoint, TestRegistries.standard(), 4);
        try {
            assertThat(resumed.getSettings().parallelism()).isEqualTo(4);
            assertThat(resumed.run(10).orThrow().entries()).isEqualTo(expected);
        } finally {
            resumed.shutdown();
        }
    }

    @Test
    void checkpointCarriesTraitState() {
        Simulation simulation = populated(SchedulingMode.SYNCHRONOUS, 1);
        simulation.run(2).orThrow();

        SimulationCheckpoint checkpoint = CheckpointCodec.fromJson(CheckpointCodec.toJson(simulation));

        SimulationCheckpoint.ParticleData first = checkpoint.particles().stream()
                .filter(p -> p.traits().contains(TestRegistries.MORTAL))
                .findFirst()
                .orElseThrow();
        assertThat(first.state()).anySatisfy(state -> {
            assertThat(state.trait()).isEqualTo(TestRegistries.MORTAL);
            assertThat(state.entries()).contains(new SimulationCheckpoint.StateEntry("lifetime", "int", "10"));
        });
        assertThat(checkpoint.tick()).isEqualTo(2);
        assertThat(checkpoint.events()).isEmpty();
    }

    @Test
    void malformedJsonIsRejected() {
        assertThatThrownBy(() -> CheckpointCodec.fromJson("{ not json")).isInstanceOf(CheckpointException.class);
        assertThatThrownBy(() -> CheckpointCodec.fromJson("")).isInstanceOf(CheckpointException.class);
    }

    @Test
    void unsupportedVersionIsRejected() {
        Simulation simulation = populated(SchedulingMode.SYNCHRONOUS, 1);
        JsonObject json = JsonParser.parseString(CheckpointCodec.toJson(simulation)).getAsJsonObject();
        json.addProperty("formatVersion", 99);

        assertThatThrownBy(() -> CheckpointCodec.fromJson(json.toString()))
                .isInstanceOf(CheckpointException.class)
                .hasMessageContaining("99");
    }

    @Test
    void unknownTraitIsRejected() {
        String json = CheckpointCodec.toJson(populated(SchedulingMode.SYNCHRONOUS, 1));

        assertThatThrownBy(() -> SimulationRestorer.restore(json, new RuleRegistry()))
                .isInstanceOf(CheckpointException.class)
                .hasMessageContaining(TestRegistries.RANDOM_WALKER);
    }

    @Test
    void failedSimulationCannotBeCheckpointed() {
        RuleRegistry registry = new RuleRegistry().bindStepRule("broken", ctx -> {
            throw new IllegalStateException("broken");
        });
        Simulation simulation = new Simulation(SimulationSettings.builder().build(), registry);
        simulation.addParticle(ParticleSpec.at(1).traits("broken").build());
        simulation.stepOnce();

        assertThat(simulation.getState()).isEqualTo(EngineState.FAILED);
        assertThatThrownBy(() -> CheckpointCodec.capture(simulation)).isInstanceOf(CheckpointException.class);
    }
}
