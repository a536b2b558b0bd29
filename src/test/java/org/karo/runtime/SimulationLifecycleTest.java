package org.karo.runtime;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.karo.runtime.model.Boundary;
import org.karo.runtime.model.EventKind;
import org.karo.runtime.model.ParticleSpec;
import org.karo.runtime.model.TrajectoryEntry;
import org.karo.runtime.rules.RuleRegistry;
import org.karo.runtime.spi.CollisionOutcome;
import org.karo.runtime.spi.LifetimeDecision;
import org.karo.runtime.spi.StepDecision;
import org.karo.test.utils.TestRegistries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Creation and removal of particles during synchronous runs.
 */
@Tag("unit")
class SimulationLifecycleTest {

    private Simulation simulation;

    @AfterEach
    void tearDown() {
        if (simulation != null) {
            simulation.shutdown();
        }
    }

    private void create(RuleRegistry registry, int length) {
        simulation = new Simulation(SimulationSettings.builder().trackLength(length).boundary(Boundary.CLOSED).build(), registry);
    }

    @Test
    void particleExpiresExactlyAtItsLifetime() {
        create(TestRegistries.standard(), 5);
        int id = simulation.addParticle(ParticleSpec.at(2).traits(TestRegistries.MORTAL)
                .state(TestRegistries.MORTAL, "lifetime", 3).build());

        RunResult result = simulation.run(10);

        assertThat(result.entries()).containsExactly(new TrajectoryEntry(3, 3.0, id, 2, -1, EventKind.EXPIRED));
        assertThat(result.termination()).isEqualTo(Termination.NO_PARTICLES);
        assertThat(simulation.getTick()).isEqualTo(3);
    }

    @Test
    void expiryIsCheckedAfterMoving() {
        create(TestRegistries.standard(), 10);
        int id = simulation.addParticle(ParticleSpec.at(0).traits(TestRegistries.WALKER, TestRegistries.MORTAL)
                .state(TestRegistries.MORTAL, "lifetime", 2).build());

        RunResult result = simulation.run(5);

        assertThat(result.entries()).containsExactly(
                new TrajectoryEntry(1, 1.0, id, 0, 1, EventKind.MOVED),
                new TrajectoryEntry(2, 2.0, id, 1, 2, EventKind.MOVED),
                new TrajectoryEntry(2, 2.0, id, 2, -1, EventKind.EXPIRED));
    }

    @Test
    void stepRuleCanRemoveItsParticle() {
        create(new RuleRegistry().bindStepRule("fragile", ctx -> StepDecision.remove()), 5);
        int id = simulation.addParticle(ParticleSpec.at(3).traits("fragile").build());

        RunResult result = simulation.stepOnce();

        assertThat(result.entries()).containsExactly(new TrajectoryEntry(1, 1.0, id, 3, -1, EventKind.REMOVED));
        assertThat(simulation.getTrack().isOccupied(3)).isFalse();
    }

    @Test
    void spawnOnOccupiedSiteIsDropped() {
        create(new RuleRegistry().bindStepRule("spawner", ctx -> {
            ctx.spawn(ParticleSpec.at(3).build());
            return StepDecision.stay();
        }), 5);
        simulation.addParticle(ParticleSpec.at(1).traits("spawner").build());

        RunResult result = simulation.run(3);

        assertThat(result.entries()).containsExactly(TrajectoryEntry.spawned(1, 1.0, 2, 3));
        assertThat(simulation.getParticles()).hasSize(2);
    }

    @Test
    void removalHandlerSpawnsReplacement() {
        RuleRegistry registry = new RuleRegistry()
                .declareMarker("ash")
                .bindStepRule("phoenix", ctx -> StepDecision.remove())
                .bindRemovalHandler("phoenix", ctx -> {
                    ctx.spawn(ParticleSpec.at(ctx.getLastSite()).traits("ash").build());
                    return true;
                });
        create(registry, 5);
        int phoenix = simulation.addParticle(ParticleSpec.at(2).traits("phoenix").build());

        RunResult result = simulation.run(5);

        assertThat(result.entries()).containsExactly(
                new TrajectoryEntry(1, 1.0, phoenix, 2, -1, EventKind.REMOVED),
                TrajectoryEntry.spawned(1, 1.0, phoenix + 1, 2));
        assertThat(simulation.getTrack().particleAt(2).hasTrait("ash")).isTrue();
        // Only identifying particles remain.
        assertThat(result.termination()).isEqualTo(Termination.NO_PARTICLES);
    }

    @Test
    void removalHandlerSeesReason() {
        List<EventKind> reasons = new ArrayList<>();
        RuleRegistry registry = TestRegistries.standard()
                .bindCollisionRule("prey", ctx -> CollisionOutcome.merge(CollisionOutcome.Survivor.MOVER))
                .bindRemovalHandler("prey", ctx -> reasons.add(ctx.getReason()));
        create(registry, 6);
        simulation.addParticle(ParticleSpec.at(1).traits(TestRegistries.WALKER).build());
        int prey = simulation.addParticle(ParticleSpec.at(2).traits("prey").build());
        int external = simulation.addParticle(ParticleSpec.at(5).traits("prey").build());

        simulation.stepOnce();
        simulation.removeParticle(external);

        assertThat(reasons).containsExactly(EventKind.MERGED, EventKind.REMOVED);
        assertThat(simulation.getParticle(prey)).isEmpty();
    }

    @Test
    void globalLifetimeRuleAppliesToAllLiveParticles() {
        RuleRegistry registry = TestRegistries.standard()
                .setGlobalLifetimeRule(ctx -> ctx.getTick() >= 2 ? LifetimeDecision.expired() : LifetimeDecision.pass());
        simulation = new Simulation(SimulationSettings.builder().trackLength(8).boundary(Boundary.MARKED).build(), registry);
        simulation.addParticle(ParticleSpec.at(2).traits(TestRegistries.WALKER).build());
        simulation.addParticle(ParticleSpec.at(5).traits(TestRegistries.LEFT_WALKER).build());

        RunResult result = simulation.run(10);

        assertThat(result.termination()).isEqualTo(Termination.NO_PARTICLES);
        assertThat(result.entries()).filteredOn(e -> e.kind() == EventKind.EXPIRED).hasSize(2);
        // Markers never expire.
        assertThat(simulation.getParticles()).hasSize(2);
    }
}
