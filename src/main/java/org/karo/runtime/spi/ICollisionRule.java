package org.karo.runtime.spi;

/**
 * Resolves a move that targets an occupied site.
 * <p>
 * Collision rules are consulted mover-first: the mover's traits in attachment order,
 * then the occupant's traits in attachment order, then the global fallback. The first
 * rule that returns something other than {@link CollisionOutcome#pass()} decides.
 */
@FunctionalInterface
public interface ICollisionRule {

    /**
     * @param context The mover, the occupant and the direction of the attempted move
     * @return the outcome; {@link CollisionOutcome#pass()} hands over to the next rule
     */
    CollisionOutcome collide(CollisionContext context);
}
