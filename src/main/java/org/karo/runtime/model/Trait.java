package org.karo.runtime.model;

import org.karo.runtime.ConfigurationException;
import org.karo.runtime.spi.ICollisionRule;
import org.karo.runtime.spi.ILifetimeRule;
import org.karo.runtime.spi.IRemovalHandler;
import org.karo.runtime.spi.IStepRule;

/**
 * A named capability bundle attached to particles.
 * <p>
 * A trait carries at most one handler per event kind (stepping, collision, lifetime,
 * removal). Marker traits carry none and only serve as tags that other rules can
 * test for with {@link ParticleView#hasTrait(String)}. Traits are immutable; a
 * particle's behaviour is the union of its traits' handlers, consulted in
 * attachment order.
 */
public final class Trait {

    public enum Kind {
        /** Identifying-only: no handlers, used as a predicate by other rules. */
        MARKER,
        /** Provides at least one handler. */
        BEHAVIOR
    }

    private final String name;
    private final Kind kind;
    private final IStepRule stepRule;
    private final ICollisionRule collisionRule;
    private final ILifetimeRule lifetimeRule;
    private final IRemovalHandler removalHandler;

    private Trait(Builder builder) {
        this.name = builder.name;
        this.kind = builder.marker ? Kind.MARKER : Kind.BEHAVIOR;
        this.stepRule = builder.stepRule;
        this.collisionRule = builder.collisionRule;
        this.lifetimeRule = builder.lifetimeRule;
        this.removalHandler = builder.removalHandler;
    }

    /**
     * Creates an identifying-only trait.
     */
    public static Trait marker(String name) {
        return new Builder(name, true).build();
    }

    /**
     * Starts a behaviour trait; at least one handler must be set before {@link Builder#build()}.
     */
    public static Builder behavior(String name) {
        return new Builder(name, false);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isMarker() {
        return kind == Kind.MARKER;
    }

    /** @return the stepping rule, or {@code null} */
    public IStepRule getStepRule() {
        return stepRule;
    }

    /** @return the collision rule, or {@code null} */
    public ICollisionRule getCollisionRule() {
        return collisionRule;
    }

    /** @return the lifetime rule, or {@code null} */
    public ILifetimeRule getLifetimeRule() {
        return lifetimeRule;
    }

    /** @return the removal handler, or {@code null} */
    public IRemovalHandler getRemovalHandler() {
        return removalHandler;
    }

    /**
     * Starts a builder pre-populated with this trait's handlers, used to bind further
     * handlers to an already registered trait.
     *
     * @throws ConfigurationException if this is a marker
     */
    public Builder toBuilder() {
        if (isMarker()) {
            throw new ConfigurationException("Marker trait '" + name + "' cannot carry rules");
        }
        return new Builder(name, false)
                .onStep(stepRule)
                .onCollision(collisionRule)
                .onLifetime(lifetimeRule)
                .onRemoval(removalHandler);
    }

    @Override
    public String toString() {
        return "Trait[" + name + ", " + kind + "]";
    }

    public static final class Builder {
        private final String name;
        private final boolean marker;
        private IStepRule stepRule;
        private ICollisionRule collisionRule;
        private ILifetimeRule lifetimeRule;
        private IRemovalHandler removalHandler;

        private Builder(String name, boolean marker) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Trait name must not be blank");
            }
            this.name = name;
            this.marker = marker;
        }

        public Builder onStep(IStepRule rule) {
            this.stepRule = rule;
            return this;
        }

        public Builder onCollision(ICollisionRule rule) {
            this.collisionRule = rule;
            return this;
        }

        public Builder onLifetime(ILifetimeRule rule) {
            this.lifetimeRule = rule;
            return this;
        }

        public Builder onRemoval(IRemovalHandler handler) {
            this.removalHandler = handler;
            return this;
        }

        /**
         * @throws ConfigurationException if a behaviour trait has no handler
         */
        public Trait build() {
            boolean hasHandler = stepRule != null || collisionRule != null
                    || lifetimeRule != null || removalHandler != null;
            if (!marker && !hasHandler) {
                throw new ConfigurationException("Behaviour trait '" + name + "' has no rule bound");
            }
            return new Trait(this);
        }
    }
}
