package org.karo.runtime;

import java.util.Comparator;

import org.karo.runtime.model.Particle;

/**
 * Deterministic winner selection when several particles request the same target
 * site within one synchronous tick.
 */
public enum TieBreak {
    LOWEST_ID(Comparator.comparingInt(Particle::getId)),
    HIGHEST_ID(Comparator.comparingInt(Particle::getId).reversed());

    private final Comparator<Particle> order;

    TieBreak(Comparator<Particle> order) {
        this.order = order;
    }

    /**
     * @return comparator that sorts the winning particle first
     */
    public Comparator<Particle> order() {
        return order;
    }
}
