package org.karo.runtime.spi;

import org.karo.runtime.model.Particle;
import org.karo.runtime.model.ParticleView;
import org.karo.runtime.model.TrackView;

/**
 * Context passed to {@link ICollisionRule#collide(CollisionContext)}.
 * <p>
 * {@link #getState()} returns the state of whichever party carries the trait whose
 * rule is running; {@link #isMoverRule()} tells which side that is.
 */
public class CollisionContext extends RuleContext {

    private Particle mover;
    private Particle occupant;
    private int direction;
    private boolean moverRule;

    /**
     * <b>Internal use only:</b> prepares the context for one collision.
     */
    public void reset(Particle mover, Particle occupant, int direction, TrackView track, long tick, double time) {
        resetCommon(track, tick, time);
        this.mover = mover;
        this.occupant = occupant;
        this.direction = direction;
        this.moverRule = false;
    }

    @Override
    public void bindTrait(Particle owner, String traitName) {
        super.bindTrait(owner, traitName);
        this.moverRule = owner == mover;
    }

    public ParticleView getMover() {
        return mover;
    }

    public ParticleView getOccupant() {
        return occupant;
    }

    /**
     * @return -1 or +1, the direction of the attempted move
     */
    public int getDirection() {
        return direction;
    }

    /**
     * @return true if the running rule belongs to one of the mover's traits
     */
    public boolean isMoverRule() {
        return moverRule;
    }

    /**
     * @return the mover's random stream
     */
    public IRandomProvider getRandom() {
        return mover.getRandom();
    }
}
