package org.karo.runtime.model;

import java.util.List;

/**
 * Read-only view of a particle as seen by rules and observers.
 */
public interface ParticleView {

    int getId();

    int getSite();

    /**
     * @return trait names in attachment order
     */
    List<String> getTraitNames();

    boolean hasTrait(String traitName);

    /**
     * @throws IllegalArgumentException if the particle does not carry the trait
     */
    TraitStateView getState(String traitName);

    /**
     * @return true if the particle carries traits and every one is a marker; such particles do not count
     *         as live particles for termination
     */
    boolean isIdentifyingOnly();

    /**
     * @return the tick at which the particle was created
     */
    long getCreatedAtTick();

    /**
     * @return the simulation time at which the particle was created
     */
    double getCreatedAtTime();
}
