package org.karo.runtime.spi;

import org.karo.runtime.model.Particle;
import org.karo.runtime.model.TraitState;
import org.karo.runtime.model.TrackView;

/**
 * Common part of the context objects handed to rules.
 * <p>
 * Contexts are reused across invocations to avoid allocation. The engine binds the
 * trait whose handler is currently running, which decides what {@link #getState()}
 * returns. Global fallback rules run unbound and have no trait-private state.
 */
public abstract class RuleContext {

    private TrackView track;
    private long tick;
    private double time;
    private Particle stateOwner;
    private String boundTrait;

    /**
     * <b>Internal use only:</b> called by the engine before each dispatch round.
     */
    protected void resetCommon(TrackView track, long tick, double time) {
        this.track = track;
        this.tick = tick;
        this.time = time;
        this.stateOwner = null;
        this.boundTrait = null;
    }

    /**
     * <b>Internal use only:</b> binds the trait whose handler is about to run.
     *
     * @param owner The particle carrying the trait, or {@code null} for a global rule
     * @param traitName The trait name, or {@code null} for a global rule
     */
    public void bindTrait(Particle owner, String traitName) {
        this.stateOwner = owner;
        this.boundTrait = traitName;
    }

    /**
     * @return the trait whose handler is running, or {@code null} for a global rule
     */
    public String getBoundTrait() {
        return boundTrait;
    }

    /**
     * Trait-private state of the running handler's trait. This is the only state a
     * rule may modify.
     *
     * @throws IllegalStateException when called from a global fallback rule
     */
    public TraitState getState() {
        if (boundTrait == null) {
            throw new IllegalStateException("Global rules have no trait-private state");
        }
        return stateOwner.getMutableState(boundTrait);
    }

    /**
     * @return read-only view of the track the rule is evaluated against
     */
    public TrackView getTrack() {
        return track;
    }

    public long getTick() {
        return tick;
    }

    public double getTime() {
        return time;
    }
}
