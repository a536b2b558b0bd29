package org.karo.runtime.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.karo.runtime.SchedulingMode;
import org.karo.runtime.Simulation;
import org.karo.runtime.SimulationSettings;
import org.karo.runtime.model.Boundary;
import org.karo.runtime.model.ParticleSnapshot;
import org.karo.runtime.model.ParticleSpec;
import org.karo.test.utils.TestRegistries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class IntervalSamplerTest {

    private Simulation simulation;

    @AfterEach
    void tearDown() {
        if (simulation != null) {
            simulation.close();
        }
    }

    private void setUp(SchedulingMode mode) {
        SimulationSettings settings = SimulationSettings.builder()
                .trackLength(10).boundary(Boundary.CLOSED).mode(mode).build();
        simulation = new Simulation(settings, TestRegistries.standard());
    }

    private static List<Double> times(IntervalSampler sampler) {
        return sampler.getSamples().stream().map(Sample::time).collect(Collectors.toList());
    }

    private static List<Integer> sitesOf(IntervalSampler sampler, int id) {
        return sampler.getSamples().stream()
                .map(sample -> sample.snapshot().getParticle(id).map(ParticleSnapshot::getSite).orElse(-1))
                .collect(Collectors.toList());
    }

    @Test
    void samplesEveryTickInSynchronousMode() {
        setUp(SchedulingMode.SYNCHRONOUS);
        int walker = simulation.addParticle(ParticleSpec.at(0).traits(TestRegistries.WALKER).build());
        IntervalSampler sampler = IntervalSampler.attach(simulation, 1.0);

        simulation.run(3);
        sampler.flush(simulation.getTime());

        assertThat(times(sampler)).containsExactly(0.0, 1.0, 2.0, 3.0);
        assertThat(sitesOf(sampler, walker)).containsExactly(0, 1, 2, 3);
    }

    @Test
    void coarserGridSkipsIntermediateTicks() {
        setUp(SchedulingMode.SYNCHRONOUS);
        int walker = simulation.addParticle(ParticleSpec.at(0).traits(TestRegistries.WALKER).build());
        IntervalSampler sampler = IntervalSampler.attach(simulation, 2.0);

        simulation.run(5);
        sampler.flush(simulation.getTime());

        assertThat(times(sampler)).containsExactly(0.0, 2.0, 4.0);
        assertThat(sitesOf(sampler, walker)).containsExactly(0, 2, 4);
    }

    @Test
    void asynchronousGridPointTakesTheLastCommitAtOrBeforeIt() {
        setUp(SchedulingMode.ASYNCHRONOUS);
        // Steps fire at 0.0, 1.0 and 2.0.
        int walker = simulation.addParticle(ParticleSpec.at(0).traits(TestRegistries.WALKER).build());
        IntervalSampler sampler = IntervalSampler.attach(simulation, 0.5);

        simulation.runUntil(2.5);
        sampler.flush(2.5);

        assertThat(times(sampler)).containsExactly(0.0, 0.5, 1.0, 1.5, 2.0, 2.5);
        assertThat(sitesOf(sampler, walker)).containsExactly(1, 1, 2, 2, 3, 3);
    }

    @Test
    void gridMayStartLater() {
        setUp(SchedulingMode.SYNCHRONOUS);
        int walker = simulation.addParticle(ParticleSpec.at(0).traits(TestRegistries.WALKER).build());
        IntervalSampler sampler = IntervalSampler.attach(simulation, 2.0, 1.5);

        simulation.run(6);
        sampler.flush(simulation.getTime());

        assertThat(times(sampler)).containsExactly(2.0, 3.5, 5.0);
        assertThat(sitesOf(sampler, walker)).containsExactly(2, 3, 5);
    }

    @Test
    void removedParticlesDisappearFromLaterSamples() {
        setUp(SchedulingMode.SYNCHRONOUS);
        int mortal = simulation.addParticle(ParticleSpec.at(3).traits(TestRegistries.MORTAL)
                .state(TestRegistries.MORTAL, "lifetime", 2).build());
        IntervalSampler sampler = IntervalSampler.attach(simulation, 1.0);

        simulation.run(4);
        sampler.flush(simulation.getTime());

        assertThat(sitesOf(sampler, mortal)).startsWith(3).endsWith(-1);
        assertThat(sampler.getSamples().get(sampler.getSamples().size() - 1).snapshot().getLiveCount()).isZero();
    }

    @Test
    void rejectsInvalidGrid() {
        setUp(SchedulingMode.SYNCHRONOUS);
        simulation.addParticle(ParticleSpec.at(0).traits(TestRegistries.WALKER).build());
        simulation.run(2);

        assertThatThrownBy(() -> IntervalSampler.attach(simulation, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IntervalSampler.attach(simulation, 1.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("before the current simulation time");
    }
}
