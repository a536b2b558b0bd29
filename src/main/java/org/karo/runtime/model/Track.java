package org.karo.runtime.model;

import java.util.Arrays;
import java.util.function.IntFunction;

import org.karo.runtime.BoundaryException;
import org.karo.runtime.ConfigurationException;
import org.karo.runtime.SiteOccupiedException;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

/**
 * Authoritative occupancy state of a one-dimensional sequence of sites.
 * <p>
 * Each site holds at most one particle id. The track holds ids only; particle
 * objects are resolved through the registry passed at construction. Mutation happens
 * exclusively in the simulation's commit phase.
 * <p>
 * <b>Thread safety:</b> not thread-safe. Parallel planning reads a {@link TrackSnapshot}.
 */
public class Track implements TrackView {

    private final int length;
    private final Boundary boundary;
    private final int[] occupants;
    private final IntFunction<? extends ParticleView> resolver;

    /**
     * @param length Number of sites, at least 1 (at least 2 for {@link Boundary#MARKED})
     * @param boundary End behaviour
     * @param resolver Looks up a particle by id
     * @throws ConfigurationException on an invalid length
     */
    public Track(int length, Boundary boundary, IntFunction<? extends ParticleView> resolver) {
        if (length < 1) {
            throw new ConfigurationException("Track length must be positive, was " + length);
        }
        if (boundary == Boundary.MARKED && length < 2) {
            throw new ConfigurationException("A marker-bounded track needs at least 2 sites, was " + length);
        }
        this.length = length;
        this.boundary = boundary;
        this.occupants = new int[length];
        this.resolver = resolver;
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
    public ParticleView particleAt(int site) {
        int id = occupantAt(site);
        return id == EMPTY ? null : resolver.apply(id);
    }

    /**
     * Puts a particle id on a site.
     *
     * @throws BoundaryException if the site is outside the track
     * @throws SiteOccupiedException if the site already holds a particle
     */
    public void place(int particleId, int site) {
        if (!isInBounds(site)) {
            throw new BoundaryException("Site " + site + " is outside the track [0, " + (length - 1) + "]", site);
        }
        if (occupants[site] != EMPTY) {
            throw new SiteOccupiedException(site, occupants[site]);
        }
        occupants[site] = particleId;
    }

    /**
     * Empties a site.
     *
     * @return the evicted id, or {@link #EMPTY} if the site was already empty
     */
    public int vacate(int site) {
        if (!isInBounds(site)) {
            throw new BoundaryException("Site " + site + " is outside the track [0, " + (length - 1) + "]", site);
        }
        int previous = occupants[site];
        occupants[site] = EMPTY;
        return previous;
    }

    /**
     * @return the number of occupied sites
     */
    public int occupiedCount() {
        int count = 0;
        for (int id : occupants) {
            if (id != EMPTY) {
                count++;
            }
        }
        return count;
    }

    /**
     * Freezes the current occupancy together with copies of the occupying particles.
     *
     * @param particles The live particles, by id
     */
    public TrackSnapshot snapshot(Int2ObjectMap<Particle> particles) {
        Int2ObjectMap<ParticleSnapshot> frozen = new Int2ObjectOpenHashMap<>();
        for (int id : occupants) {
            if (id != EMPTY) {
                Particle particle = particles.get(id);
                if (particle != null) {
                    frozen.put(id, particle.snapshot());
                }
            }
        }
        return new TrackSnapshot(length, boundary, Arrays.copyOf(occupants, length), frozen);
    }

    /**
     * @return a copy of the raw site array
     */
    public int[] toArray() {
        return Arrays.copyOf(occupants, length);
    }
}
