package org.karo.runtime.spi;

import org.karo.runtime.model.Particle;
import org.karo.runtime.model.ParticleView;
import org.karo.runtime.model.TrackView;

/**
 * Context passed to {@link ILifetimeRule#check(LifetimeContext)}.
 */
public class LifetimeContext extends RuleContext {

    private Particle particle;

    /**
     * <b>Internal use only.</b>
     */
    public void reset(Particle particle, TrackView track, long tick, double time) {
        resetCommon(track, tick, time);
        this.particle = particle;
    }

    public ParticleView getParticle() {
        return particle;
    }

    public IRandomProvider getRandom() {
        return particle.getRandom();
    }
}
