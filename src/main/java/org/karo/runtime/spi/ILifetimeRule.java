package org.karo.runtime.spi;

/**
 * Decides whether a particle has outlived its lifetime.
 * <p>
 * In synchronous mode the check runs after every committed tick. In asynchronous
 * mode it runs after each of the particle's own events and at the time returned by
 * {@link LifetimeDecision#aliveUntil(double)}, so expiry happens exactly on time.
 */
@FunctionalInterface
public interface ILifetimeRule {

    LifetimeDecision check(LifetimeContext context);
}
