package org.karo.runtime.rules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.karo.runtime.ConfigurationException;
import org.karo.runtime.model.Trait;
import org.karo.runtime.spi.ICollisionRule;
import org.karo.runtime.spi.ILifetimeRule;
import org.karo.runtime.spi.IRemovalHandler;
import org.karo.runtime.spi.IStepRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The set of traits and global fallback rules of one simulation.
 * <p>
 * A registry is built once, handed to a {@link org.karo.runtime.Simulation}, and frozen
 * by it; there is no process-wide registry, so independent simulations never share
 * rules by accident. Handlers can be bound trait by trait; each trait holds at most
 * one handler per event kind. The built-in {@link StandardTraits#TRACK_END} marker is
 * always present.
 * <p>
 * <b>Thread safety:</b> mutation is not thread-safe; once frozen the registry is
 * read-only and safe to share.
 */
public class RuleRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(RuleRegistry.class);

    private final Map<String, Trait> traits = new LinkedHashMap<>();
    private IStepRule globalStepRule;
    private ICollisionRule globalCollisionRule;
    private ILifetimeRule globalLifetimeRule;
    private boolean frozen;

    public RuleRegistry() {
        traits.put(StandardTraits.TRACK_END_NAME, StandardTraits.TRACK_END);
    }

    /**
     * Registers a fully built trait.
     *
     * @throws ConfigurationException if a trait of that name exists
     */
    public RuleRegistry register(Trait trait) {
        checkMutable();
        if (traits.containsKey(trait.getName())) {
            throw new ConfigurationException("Trait '" + trait.getName() + "' is already registered");
        }
        traits.put(trait.getName(), trait);
        LOG.debug("Registered {}", trait);
        return this;
    }

    /**
     * Declares an identifying-only trait.
     */
    public RuleRegistry declareMarker(String name) {
        return register(Trait.marker(name));
    }

    public RuleRegistry bindStepRule(String traitName, IStepRule rule) {
        Objects.requireNonNull(rule, "rule");
        Trait existing = lookupMutable(traitName);
        if (existing != null && existing.getStepRule() != null) {
            throw new ConfigurationException("Trait '" + traitName + "' already has a step rule");
        }
        return replace(builderFor(existing, traitName).onStep(rule).build());
    }

    public RuleRegistry bindCollisionRule(String traitName, ICollisionRule rule) {
        Objects.requireNonNull(rule, "rule");
        Trait existing = lookupMutable(traitName);
        if (existing != null && existing.getCollisionRule() != null) {
            throw new ConfigurationException("Trait '" + traitName + "' already has a collision rule");
        }
        return replace(builderFor(existing, traitName).onCollision(rule).build());
    }

    public RuleRegistry bindLifetimeRule(String traitName, ILifetimeRule rule) {
        Objects.requireNonNull(rule, "rule");
        Trait existing = lookupMutable(traitName);
        if (existing != null && existing.getLifetimeRule() != null) {
            throw new ConfigurationException("Trait '" + traitName + "' already has a lifetime rule");
        }
        return replace(builderFor(existing, traitName).onLifetime(rule).build());
    }

    public RuleRegistry bindRemovalHandler(String traitName, IRemovalHandler handler) {
        Objects.requireNonNull(handler, "handler");
        Trait existing = lookupMutable(traitName);
        if (existing != null && existing.getRemovalHandler() != null) {
            throw new ConfigurationException("Trait '" + traitName + "' already has a removal handler");
        }
        return replace(builderFor(existing, traitName).onRemoval(handler).build());
    }

    /**
     * Sets the stepping rule consulted when no trait of a particle gives a definite answer.
     */
    public RuleRegistry setGlobalStepRule(IStepRule rule) {
        checkMutable();
        this.globalStepRule = rule;
        return this;
    }

    /**
     * Sets the collision rule consulted when neither party's traits give a definite answer.
     */
    public RuleRegistry setGlobalCollisionRule(ICollisionRule rule) {
        checkMutable();
        this.globalCollisionRule = rule;
        return this;
    }

    public RuleRegistry setGlobalLifetimeRule(ILifetimeRule rule) {
        checkMutable();
        this.globalLifetimeRule = rule;
        return this;
    }

    /** @return the global stepping rule, or {@code null} */
    public IStepRule getGlobalStepRule() {
        return globalStepRule;
    }

    /** @return the global collision rule, or {@code null} */
    public ICollisionRule getGlobalCollisionRule() {
        return globalCollisionRule;
    }

    /** @return the global lifetime rule, or {@code null} */
    public ILifetimeRule getGlobalLifetimeRule() {
        return globalLifetimeRule;
    }

    public boolean contains(String traitName) {
        return traits.containsKey(traitName);
    }

    /**
     * @throws ConfigurationException if no such trait is registered
     */
    public Trait getTrait(String traitName) {
        Trait trait = traits.get(traitName);
        if (trait == null) {
            throw new ConfigurationException("Unknown trait '" + traitName + "'");
        }
        return trait;
    }

    /**
     * @return all traits in registration order
     */
    public Collection<Trait> getTraits() {
        return Collections.unmodifiableCollection(traits.values());
    }

    /**
     * Resolves the trait names of a particle, keeping their order.
     *
     * @throws ConfigurationException on unknown or repeated names
     */
    public List<Trait> resolve(List<String> traitNames) {
        List<Trait> resolved = new ArrayList<>(traitNames.size());
        Set<String> seen = new HashSet<>();
        for (String name : traitNames) {
            if (!seen.add(name)) {
                throw new ConfigurationException("Trait '" + name + "' is attached twice");
            }
            resolved.add(getTrait(name));
        }
        return resolved;
    }

    /**
     * Makes the registry read-only. Called by the simulation that takes ownership of it.
     */
    public void freeze() {
        if (!frozen) {
            frozen = true;
            LOG.debug("Rule registry frozen with {} traits", traits.size());
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    private Trait lookupMutable(String traitName) {
        checkMutable();
        return traits.get(traitName);
    }

    private static Trait.Builder builderFor(Trait existing, String traitName) {
        return existing == null ? Trait.behavior(traitName) : existing.toBuilder();
    }

    private RuleRegistry replace(Trait trait) {
        traits.put(trait.getName(), trait);
        LOG.debug("Bound rules of {}", trait);
        return this;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Rule registry is frozen; register rules before creating the simulation");
        }
    }
}
