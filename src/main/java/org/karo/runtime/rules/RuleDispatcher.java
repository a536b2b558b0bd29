package org.karo.runtime.rules;

import org.karo.runtime.RuleException;
import org.karo.runtime.SimulationException;
import org.karo.runtime.model.Particle;
import org.karo.runtime.model.Trait;
import org.karo.runtime.spi.CollisionContext;
import org.karo.runtime.spi.CollisionOutcome;
import org.karo.runtime.spi.ICollisionRule;
import org.karo.runtime.spi.ILifetimeRule;
import org.karo.runtime.spi.IRandomProvider;
import org.karo.runtime.spi.IRemovalHandler;
import org.karo.runtime.spi.IStepRule;
import org.karo.runtime.spi.LifetimeContext;
import org.karo.runtime.spi.LifetimeDecision;
import org.karo.runtime.spi.RemovalContext;
import org.karo.runtime.spi.StepContext;
import org.karo.runtime.spi.StepDecision;

/**
 * Routes events to the handlers of a particle's traits.
 * <p>
 * For every event kind the dispatcher scans the particle's traits in attachment
 * order and takes the first <em>definite</em> answer; a handler returning
 * {@code pass()} has no opinion and the scan continues. If no trait answers, the
 * registry's global fallback rule is asked, and if that passes too, the built-in
 * default applies:
 * <ul>
 *   <li>stepping: stay</li>
 *   <li>collision: blocked</li>
 *   <li>lifetime: alive</li>
 * </ul>
 * <b>Collision precedence:</b> the mover's traits are consulted before the
 * occupant's, each side in attachment order, then the global collision rule. The
 * first definite outcome is authoritative.
 * <p>
 * Handler failures other than {@link SimulationException}s, and return values
 * outside the handler contract, surface as {@link RuleException} naming the particle
 * and trait.
 */
public class RuleDispatcher {

    private final RuleRegistry registry;

    public RuleDispatcher(RuleRegistry registry) {
        this.registry = registry;
    }

    public RuleRegistry getRegistry() {
        return registry;
    }

    /**
     * @return true if any trait of the particle, or the global fallback, has a stepping
     *         rule. Identifying-only particles never step.
     */
    public boolean hasStepRule(Particle particle) {
        if (particle.isIdentifyingOnly()) {
            return false;
        }
        if (registry.getGlobalStepRule() != null) {
            return true;
        }
        for (Trait trait : particle.getTraits()) {
            if (trait.getStepRule() != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return true if any trait of the particle, or the global fallback, has a lifetime
     *         rule. Identifying-only particles never expire.
     */
    public boolean hasLifetimeRule(Particle particle) {
        if (particle.isIdentifyingOnly()) {
            return false;
        }
        if (registry.getGlobalLifetimeRule() != null) {
            return true;
        }
        for (Trait trait : particle.getTraits()) {
            if (trait.getLifetimeRule() != null) {
                return true;
            }
        }
        return false;
    }

    /**
     * Asks the first stepping rule of the particle (or the global one) for the delay
     * before the particle's first asynchronous event.
     *
     * @throws RuleException for a negative or NaN delay
     */
    public double initialDelay(Particle particle, IRandomProvider random) {
        String traitName = null;
        IStepRule rule = registry.getGlobalStepRule();
        for (Trait trait : particle.getTraits()) {
            if (trait.getStepRule() != null) {
                traitName = trait.getName();
                rule = trait.getStepRule();
                break;
            }
        }
        if (rule == null) {
            return Double.POSITIVE_INFINITY;
        }
        double delay;
        try {
            delay = rule.initialDelay(particle, random);
        } catch (SimulationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure("initial delay", particle, traitName, e);
        }
        if (Double.isNaN(delay) || delay < 0) {
            throw new RuleException("Initial delay must be >= 0, was " + delay, particle.getId(), traitName);
        }
        return delay;
    }

    /**
     * Dispatches a stepping opportunity. The context must already be reset for the particle.
     */
    public StepDecision dispatchStep(Particle particle, StepContext context) {
        for (Trait trait : particle.getTraits()) {
            IStepRule rule = trait.getStepRule();
            if (rule != null) {
                context.bindTrait(particle, trait.getName());
                StepDecision decision = invokeStep(rule, particle, trait.getName(), context);
                if (decision.isDefinite()) {
                    return decision;
                }
            }
        }
        IStepRule global = registry.getGlobalStepRule();
        if (global != null) {
            context.bindTrait(null, null);
            StepDecision decision = invokeStep(global, particle, null, context);
            if (decision.isDefinite()) {
                return decision;
            }
        }
        return StepDecision.stay();
    }

    /**
     * Dispatches a contested move. The context must already be reset for the pair.
     */
    public CollisionOutcome dispatchCollision(Particle mover, Particle occupant, CollisionContext context) {
        CollisionOutcome outcome = scanCollision(mover, mover, context);
        if (outcome != null) {
            return outcome;
        }
        outcome = scanCollision(occupant, mover, context);
        if (outcome != null) {
            return outcome;
        }
        ICollisionRule global = registry.getGlobalCollisionRule();
        if (global != null) {
            context.bindTrait(null, null);
            outcome = invokeCollision(global, mover, null, context);
            if (outcome.isDefinite()) {
                return outcome;
            }
        }
        return CollisionOutcome.blocked();
    }

    /**
     * Dispatches a lifetime check. The context must already be reset for the particle.
     */
    public LifetimeDecision dispatchLifetime(Particle particle, LifetimeContext context) {
        for (Trait trait : particle.getTraits()) {
            ILifetimeRule rule = trait.getLifetimeRule();
            if (rule != null) {
                context.bindTrait(particle, trait.getName());
                LifetimeDecision decision = invokeLifetime(rule, particle, trait.getName(), context);
                if (decision.isDefinite()) {
                    return decision;
                }
            }
        }
        ILifetimeRule global = registry.getGlobalLifetimeRule();
        if (global != null) {
            context.bindTrait(null, null);
            LifetimeDecision decision = invokeLifetime(global, particle, null, context);
            if (decision.isDefinite()) {
                return decision;
            }
        }
        return LifetimeDecision.alive();
    }

    /**
     * Runs the removal handlers of a particle in attachment order until one reports
     * that it handled the removal.
     *
     * @return true if a handler claimed the removal
     */
    public boolean dispatchRemoval(Particle particle, RemovalContext context) {
        for (Trait trait : particle.getTraits()) {
            IRemovalHandler handler = trait.getRemovalHandler();
            if (handler == null) {
                continue;
            }
            context.bindTrait(particle, trait.getName());
            boolean handled;
            try {
                handled = handler.onRemoval(context);
            } catch (SimulationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw failure("removal handler", particle, trait.getName(), e);
            }
            if (handled) {
                return true;
            }
        }
        return false;
    }

    private CollisionOutcome scanCollision(Particle owner, Particle mover, CollisionContext context) {
        for (Trait trait : owner.getTraits()) {
            ICollisionRule rule = trait.getCollisionRule();
            if (rule != null) {
                context.bindTrait(owner, trait.getName());
                CollisionOutcome outcome = invokeCollision(rule, owner, trait.getName(), context);
                if (outcome.isDefinite()) {
                    return outcome;
                }
            }
        }
        return null;
    }

    private StepDecision invokeStep(IStepRule rule, Particle particle, String traitName, StepContext context) {
        StepDecision decision;
        try {
            decision = rule.step(context);
        } catch (SimulationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure("step rule", particle, traitName, e);
        }
        if (decision == null) {
            throw new RuleException("Step rule returned null", particle.getId(), traitName);
        }
        if (decision.getAction() == StepDecision.Action.MOVE
                && decision.getDisplacement() != 1 && decision.getDisplacement() != -1) {
            throw new RuleException("Step rule requested displacement " + decision.getDisplacement()
                    + "; only adjacent moves (-1, +1) are allowed", particle.getId(), traitName);
        }
        if (decision.hasDelay() && !(decision.getDelay() > 0)) {
            throw new RuleException("Step delay must be > 0, was " + decision.getDelay(), particle.getId(), traitName);
        }
        return decision;
    }

    private CollisionOutcome invokeCollision(ICollisionRule rule, Particle owner, String traitName, CollisionContext context) {
        CollisionOutcome outcome;
        try {
            outcome = rule.collide(context);
        } catch (SimulationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure("collision rule", owner, traitName, e);
        }
        if (outcome == null) {
            throw new RuleException("Collision rule returned null", owner.getId(), traitName);
        }
        return outcome;
    }

    private LifetimeDecision invokeLifetime(ILifetimeRule rule, Particle particle, String traitName, LifetimeContext context) {
        LifetimeDecision decision;
        try {
            decision = rule.check(context);
        } catch (SimulationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw failure("lifetime rule", particle, traitName, e);
        }
        if (decision == null) {
            throw new RuleException("Lifetime rule returned null", particle.getId(), traitName);
        }
        return decision;
    }

    private static RuleException failure(String what, Particle particle, String traitName, RuntimeException cause) {
        String owner = traitName != null ? "trait '" + traitName + "'" : "global rule";
        return new RuleException("The " + what + " of " + owner + " failed for particle " + particle.getId()
                + ": " + cause.getMessage(), particle.getId(), traitName, cause);
    }
}
