package org.karo.runtime.model;

import java.util.List;
import java.util.Optional;

import org.karo.runtime.EngineState;

/**
 * Immutable, read-only picture of a simulation between two commits.
 * Handed to observers and available from the simulation on demand.
 */
public final class SimulationSnapshot {

    private final long tick;
    private final double time;
    private final EngineState state;
    private final TrackSnapshot track;
    private final List<ParticleSnapshot> particles;

    /**
     * @param particles Particles in ascending id order
     */
    public SimulationSnapshot(long tick, double time, EngineState state, TrackSnapshot track,
                              List<ParticleSnapshot> particles) {
        this.tick = tick;
        this.time = time;
        this.state = state;
        this.track = track;
        this.particles = List.copyOf(particles);
    }

    public long getTick() {
        return tick;
    }

    public double getTime() {
        return time;
    }

    public EngineState getState() {
        return state;
    }

    public TrackView getTrack() {
        return track;
    }

    /**
     * @return all particles, markers included, in ascending id order
     */
    public List<ParticleSnapshot> getParticles() {
        return particles;
    }

    public Optional<ParticleSnapshot> getParticle(int id) {
        return Optional.ofNullable(track.particle(id));
    }

    /**
     * @return the number of particles that are not identifying-only
     */
    public long getLiveCount() {
        return particles.stream().filter(p -> !p.isIdentifyingOnly()).count();
    }
}
