package org.karo.runtime.resume;

import java.io.UncheckedIOException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import org.karo.runtime.SchedulingMode;
import org.karo.runtime.Simulation;
import org.karo.runtime.SimulationException;
import org.karo.runtime.SimulationSettings;
import org.karo.runtime.TieBreak;
import org.karo.runtime.model.Boundary;
import org.karo.runtime.model.TraitState;
import org.karo.runtime.rules.RuleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link SimulationCheckpoint} back into a runnable {@link Simulation}.
 * <p>
 * The restored simulation continues exactly where the checkpointed one stopped: same
 * clock, particle ids, trait state, random stream positions, pending events and event
 * sequence numbers. Given the same rules, its further trajectory is identical to the
 * uninterrupted run's.
 */
public final class SimulationRestorer {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationRestorer.class);

    private SimulationRestorer() {
    }

    /**
     * @param checkpoint The checkpoint to restore
     * @param registry Rules of the resumed run; frozen by this call
     * @throws CheckpointException if the checkpoint is inconsistent or refers to unknown traits
     */
    public static Simulation restore(SimulationCheckpoint checkpoint, RuleRegistry registry) {
        return restore(checkpoint, registry, checkpoint.settings().parallelism());
    }

    /**
     * Restores with a different number of planning threads, which does not affect the trajectory.
     */
    public static Simulation restore(SimulationCheckpoint checkpoint, RuleRegistry registry, int parallelism) {
        SimulationSettings settings = toSettings(checkpoint.settings()).toBuilder().parallelism(parallelism).build();
        Simulation simulation = Simulation.forResume(settings, registry,
                checkpoint.tick(), checkpoint.time(), checkpoint.nextParticleId());
        try {
            for (SimulationCheckpoint.ParticleData particle : checkpoint.particles()) {
                Map<String, TraitState> states = new LinkedHashMap<>();
                for (SimulationCheckpoint.TraitStateData traitState : particle.state()) {
                    states.put(traitState.trait(), CheckpointCodec.decodeState(traitState.entries()));
                }
                simulation.restoreParticle(particle.id(), particle.site(), particle.traits(), states,
                        Base64.getDecoder().decode(particle.randomState()),
                        particle.createdAtTick(), particle.createdAtTime());
            }
            for (SimulationCheckpoint.EventData event : checkpoint.events()) {
                simulation.restoreEvent(CheckpointCodec.decodeEvent(event));
            }
            simulation.restoreEventSequence(checkpoint.nextEventSequence());
        } catch (CheckpointException e) {
            simulation.shutdown();
            throw e;
        } catch (SimulationException | IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            simulation.shutdown();
            throw new CheckpointException("Failed to restore checkpoint at tick " + checkpoint.tick() + ": " + e.getMessage(), e);
        }
        LOG.info("Restored simulation at tick {} (time {}) with {} particles and {} pending events",
                checkpoint.tick(), checkpoint.time(), checkpoint.particles().size(), checkpoint.events().size());
        return simulation;
    }

    /**
     * Shorthand for {@code restore(CheckpointCodec.fromJson(json), registry)}.
     */
    public static Simulation restore(String json, RuleRegistry registry) {
        return restore(CheckpointCodec.fromJson(json), registry);
    }

    private static SimulationSettings toSettings(SimulationCheckpoint.Settings data) {
        try {
            return SimulationSettings.builder()
                    .trackLength(data.trackLength())
                    .boundary(Boundary.valueOf(data.boundary()))
                    .mode(SchedulingMode.valueOf(data.mode()))
                    .seed(data.seed())
                    .tieBreak(TieBreak.valueOf(data.tieBreak()))
                    .parallelism(data.parallelism())
                    .maxTicks(data.maxTicks())
                    .maxTime(data.maxTime())
                    .checkInvariants(data.checkInvariants())
                    .build();
        } catch (IllegalArgumentException | NullPointerException | SimulationException e) {
            throw new CheckpointException("Invalid settings in checkpoint: " + e.getMessage(), e);
        }
    }
}
