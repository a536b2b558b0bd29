package org.karo.runtime.resume;

import java.util.List;

/**
 * Serializable state of a simulation at a step boundary: settings, clock, particles
 * with their trait state and random streams, and the pending asynchronous events.
 * Rules are not part of a checkpoint; the restoring side supplies them.
 *
 * @param formatVersion Layout version, see {@link CheckpointCodec#FORMAT_VERSION}
 * @param settings Run parameters of the checkpointed simulation
 * @param tick Ticks completed or events processed
 * @param time Simulation time
 * @param nextParticleId Next id to assign
 * @param nextEventSequence Next event sequence number
 * @param particles Live particles in ascending id order
 * @param events Pending events in firing order
 */
public record SimulationCheckpoint(
        int formatVersion,
        Settings settings,
        long tick,
        double time,
        int nextParticleId,
        long nextEventSequence,
        List<ParticleData> particles,
        List<EventData> events) {

    public record Settings(
            int trackLength,
            String boundary,
            String mode,
            long seed,
            String tieBreak,
            int parallelism,
            long maxTicks,
            double maxTime,
            boolean checkInvariants) {
    }

    /**
     * @param randomState Base64 of the particle's random stream state
     * @param state Trait-private state, one list of entries per trait in attachment order
     */
    public record ParticleData(
            int id,
            int site,
            List<String> traits,
            List<TraitStateData> state,
            String randomState,
            long createdAtTick,
            double createdAtTime) {
    }

    public record TraitStateData(String trait, List<StateEntry> entries) {
    }

    /**
     * One typed state value. The value is kept as a string so that the type survives
     * JSON number handling unchanged.
     *
     * @param type One of {@code int}, {@code long}, {@code double}, {@code boolean}, {@code string}
     */
    public record StateEntry(String key, String type, String value) {
    }

    public record EventData(double time, long sequence, int particleId, String kind) {
    }
}
