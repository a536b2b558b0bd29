package org.karo.runtime.model;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;

/**
 * Immutable copy of a track's occupancy and its particles at one instant.
 * <p>
 * Synchronous ticks evaluate every stepping rule against the snapshot taken before
 * the tick, so earlier evaluations cannot influence later ones. Safe to share
 * between planning threads.
 */
public final class TrackSnapshot implements TrackView {

    private final int length;
    private final Boundary boundary;
    private final int[] occupants;
    private final Int2ObjectMap<ParticleSnapshot> particles;

    TrackSnapshot(int length, Boundary boundary, int[] occupants, Int2ObjectMap<ParticleSnapshot> particles) {
        this.length = length;
        this.boundary = boundary;
        this.occupants = occupants;
        this.particles = particles;
    }

    @Override
    public int getLength() {
        return length;
    }

    @Override
    public Boundary getBoundary() {
        return boundary;
    }

    @Override
    public int occupantAt(int site) {
        return isInBounds(site) ? occupants[site] : EMPTY;
    }

    @Override
    public ParticleSnapshot particleAt(int site) {
        int id = occupantAt(site);
        return id == EMPTY ? null : particles.get(id);
    }

    /**
     * @return the frozen particle with the given id, or {@code null} if it was not on the track
     */
    public ParticleSnapshot particle(int id) {
        return particles.get(id);
    }
}
