package org.karo.runtime.spi;

import org.karo.runtime.model.ParticleView;

/**
 * Decides how a particle wants to move at a scheduling opportunity.
 * <p>
 * Rules are stateless with respect to the engine. Anything they need to remember
 * lives in the particle's trait-private state, reachable through
 * {@link StepContext#getState()}. Rules must not perform I/O and must not touch the
 * track; they only describe an intent.
 * <p>
 * Implementations loaded from configuration must provide either a public no-arg
 * constructor or one taking a {@code com.typesafe.config.Config} of options.
 */
@FunctionalInterface
public interface IStepRule {

    /**
     * @param context The particle, its neighbourhood and its random stream
     * @return a decision; {@link StepDecision#pass()} hands over to the next trait
     */
    StepDecision step(StepContext context);

    /**
     * Waiting time before the first asynchronous opportunity of a new particle.
     *
     * @param particle The particle being scheduled
     * @param random The particle's random stream
     * @return a non-negative delay
     */
    default double initialDelay(ParticleView particle, IRandomProvider random) {
        return 0.0;
    }
}
