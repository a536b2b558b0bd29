package org.karo.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only occupancy queries over a track. Implemented by the live {@link Track}
 * and by the frozen {@link TrackSnapshot}.
 */
public interface TrackView {

    /** Occupant id of an empty site. */
    int EMPTY = 0;

    int getLength();

    Boundary getBoundary();

    default boolean isInBounds(int site) {
        return site >= 0 && site < getLength();
    }

    /**
     * @return the occupant's id, or {@link #EMPTY} when the site is empty or out of bounds
     */
    int occupantAt(int site);

    default boolean isOccupied(int site) {
        return occupantAt(site) != EMPTY;
    }

    /**
     * @return the occupant, or {@code null} when the site is empty or out of bounds
     */
    ParticleView particleAt(int site);

    /**
     * @return the in-bounds sites adjacent to {@code site}, lower first
     */
    default int[] neighbors(int site) {
        boolean left = isInBounds(site - 1);
        boolean right = isInBounds(site + 1);
        if (left && right) {
            return new int[] {site - 1, site + 1};
        }
        if (left) {
            return new int[] {site - 1};
        }
        return right ? new int[] {site + 1} : new int[0];
    }

    /**
     * Finds the first empty site starting at {@code start} (inclusive) and walking in
     * {@code direction}. Useful for locating the end of a train of particles.
     *
     * @param direction -1 or +1
     * @return the empty site, or the first out-of-bounds site in {@code direction}
     *         ({@code -1} or {@code getLength()}) when the train reaches the end of the track
     */
    default int nextEmpty(int start, int direction) {
        if (direction != -1 && direction != 1) {
            throw new IllegalArgumentException("direction must be -1 or +1, was " + direction);
        }
        int site = start;
        while (isInBounds(site) && isOccupied(site)) {
            site += direction;
        }
        return site;
    }

    /**
     * @return the particles on sites {@code from..to} (inclusive, clipped to the track),
     *         in ascending site order
     */
    default List<ParticleView> occupantsIn(int from, int to) {
        int lo = Math.max(0, Math.min(from, to));
        int hi = Math.min(getLength() - 1, Math.max(from, to));
        List<ParticleView> result = new ArrayList<>();
        for (int site = lo; site <= hi; site++) {
            ParticleView particle = particleAt(site);
            if (particle != null) {
                result.add(particle);
            }
        }
        return result;
    }
}
