package org.karo.runtime.model;

/**
 * How the two ends of a {@link Track} behave.
 */
public enum Boundary {
    /** Particles displaced off an end leave the simulation. */
    OPEN,
    /** The ends act as walls: a move off the track is blocked. */
    CLOSED,
    /**
     * The engine places a track-end marker particle on the first and last site.
     * Moves into a marker go through collision dispatch; a move beyond one is fatal.
     */
    MARKED
}
