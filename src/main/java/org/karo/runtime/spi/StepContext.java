package org.karo.runtime.spi;

import java.util.List;

import org.karo.runtime.model.Particle;
import org.karo.runtime.model.ParticleSpec;
import org.karo.runtime.model.ParticleView;
import org.karo.runtime.model.TrackView;

/**
 * Context passed to {@link IStepRule#step(StepContext)}.
 * <p>
 * In synchronous mode {@link #getTrack()} is the pre-tick snapshot, so particles
 * evaluated early in a tick do not influence later ones. In asynchronous mode it is
 * the live track.
 * <p>
 * <b>Thread safety:</b> during parallel planning each thread owns its own context
 * and each particle is planned by exactly one thread.
 */
public class StepContext extends RuleContext {

    private Particle particle;
    private List<ParticleSpec> spawnSink;

    /**
     * <b>Internal use only:</b> prepares the context for one particle.
     */
    public void reset(Particle particle, TrackView track, long tick, double time, List<ParticleSpec> spawnSink) {
        resetCommon(track, tick, time);
        this.particle = particle;
        this.spawnSink = spawnSink;
    }

    public ParticleView getParticle() {
        return particle;
    }

    /**
     * @return the particle's current site
     */
    public int getSite() {
        return particle.getSite();
    }

    /**
     * @return the particle's own random stream
     */
    public IRandomProvider getRandom() {
        return particle.getRandom();
    }

    /**
     * Requests a new particle. The spawn is applied when the step commits; if the
     * site is occupied at that point the request is dropped.
     */
    public void spawn(ParticleSpec spec) {
        spawnSink.add(spec);
    }
}
