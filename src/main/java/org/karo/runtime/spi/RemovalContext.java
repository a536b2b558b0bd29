package org.karo.runtime.spi;

import java.util.List;

import org.karo.runtime.model.EventKind;
import org.karo.runtime.model.Particle;
import org.karo.runtime.model.ParticleSpec;
import org.karo.runtime.model.ParticleView;
import org.karo.runtime.model.TrackView;

/**
 * Context passed to {@link IRemovalHandler#onRemoval(RemovalContext)}.
 * <p>
 * The particle has already been taken off the track; {@link #getLastSite()} is
 * where it was (or -1 if it never reached the track).
 */
public class RemovalContext extends RuleContext {

    private Particle particle;
    private EventKind reason;
    private int lastSite;
    private List<ParticleSpec> spawnSink;

    /**
     * <b>Internal use only.</b>
     */
    public void reset(Particle particle, EventKind reason, int lastSite, TrackView track,
                      long tick, double time, List<ParticleSpec> spawnSink) {
        resetCommon(track, tick, time);
        this.particle = particle;
        this.reason = reason;
        this.lastSite = lastSite;
        this.spawnSink = spawnSink;
    }

    public ParticleView getParticle() {
        return particle;
    }

    /**
     * @return REMOVED, EXPIRED, MERGED or EXITED
     */
    public EventKind getReason() {
        return reason;
    }

    public int getLastSite() {
        return lastSite;
    }

    public IRandomProvider getRandom() {
        return particle.getRandom();
    }

    /**
     * Queues a replacement particle, applied within the same commit.
     */
    public void spawn(ParticleSpec spec) {
        spawnSink.add(spec);
    }
}
