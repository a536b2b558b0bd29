package org.karo.runtime.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.karo.runtime.RuleException;
import org.karo.runtime.internal.SeededRandomProvider;
import org.karo.runtime.model.Boundary;
import org.karo.runtime.model.Particle;
import org.karo.runtime.model.Track;
import org.karo.runtime.spi.CollisionContext;
import org.karo.runtime.spi.CollisionOutcome;
import org.karo.runtime.spi.LifetimeContext;
import org.karo.runtime.spi.LifetimeDecision;
import org.karo.runtime.spi.StepContext;
import org.karo.runtime.spi.StepDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;

@Tag("unit")
class RuleDispatcherTest {

    private final Int2ObjectOpenHashMap<Particle> particles = new Int2ObjectOpenHashMap<>();
    private Track track;
    private RuleRegistry registry;

    @BeforeEach
    void setUp() {
        track = new Track(10, Boundary.CLOSED, particles::get);
        registry = new RuleRegistry();
    }

    private Particle particle(int id, int site, String... traits) {
        Particle particle = new Particle(id, site, registry.resolve(List.of(traits)), Map.of(),
                new SeededRandomProvider(id), 0, 0.0);
        particles.put(id, particle);
        track.place(id, site);
        return particle;
    }

    private StepDecision step(RuleDispatcher dispatcher, Particle particle) {
        StepContext context = new StepContext();
        context.reset(particle, track, 0, 0.0, new ArrayList<>());
        return dispatcher.dispatchStep(particle, context);
    }

    private CollisionOutcome collide(RuleDispatcher dispatcher, Particle mover, Particle occupant) {
        CollisionContext context = new CollisionContext();
        context.reset(mover, occupant, 1, track, 0, 0.0);
        return dispatcher.dispatchCollision(mover, occupant, context);
    }

    @Test
    void stepTakesFirstDefiniteAnswerInAttachmentOrder() {
        registry.bindStepRule("undecided", ctx -> StepDecision.pass())
                .bindStepRule("right", ctx -> StepDecision.move(1))
                .bindStepRule("left", ctx -> StepDecision.move(-1));
        RuleDispatcher dispatcher = new RuleDispatcher(registry);

        assertThat(step(dispatcher, particle(1, 5, "undecided", "right", "left")).getDisplacement()).isEqualTo(1);
        assertThat(step(dispatcher, particle(2, 7, "left", "right")).getDisplacement()).isEqualTo(-1);
    }

    @Test
    void stepFallsBackToGlobalRuleThenToStay() {
        registry.bindStepRule("undecided", ctx -> StepDecision.pass());
        Particle particle = particle(1, 5, "undecided");

        assertThat(step(new RuleDispatcher(registry), particle).getAction()).isEqualTo(StepDecision.Action.STAY);

        RuleRegistry withGlobal = new RuleRegistry()
                .bindStepRule("undecided", ctx -> StepDecision.pass())
                .setGlobalStepRule(ctx -> StepDecision.remove());
        assertThat(step(new RuleDispatcher(withGlobal), particle).getAction()).isEqualTo(StepDecision.Action.REMOVE);
    }

    @Test
    void moverTraitsTakePrecedenceOverOccupantTraits() {
        registry.bindCollisionRule("swapper", ctx -> CollisionOutcome.swap())
                .bindCollisionRule("absorber", ctx -> CollisionOutcome.merge(CollisionOutcome.Survivor.OCCUPANT))
                .bindCollisionRule("neutral", ctx -> CollisionOutcome.pass());
        RuleDispatcher dispatcher = new RuleDispatcher(registry);
        Particle swapper = particle(1, 1, "swapper");
        Particle absorber = particle(2, 2, "absorber");
        Particle neutral = particle(3, 3, "neutral");

        assertThat(collide(dispatcher, swapper, absorber).getType()).isEqualTo(CollisionOutcome.Type.SWAP);
        assertThat(collide(dispatcher, absorber, swapper).getType()).isEqualTo(CollisionOutcome.Type.MERGE);
        // A mover without an opinion defers to the occupant.
        assertThat(collide(dispatcher, neutral, swapper).getType()).isEqualTo(CollisionOutcome.Type.SWAP);
    }

    @Test
    void collisionFallsBackToGlobalRuleThenToBlocked() {
        registry.declareMarker("plain");
        Particle mover = particle(1, 1, "plain");
        Particle occupant = particle(2, 2, "plain");

        assertThat(collide(new RuleDispatcher(registry), mover, occupant).getType())
                .isEqualTo(CollisionOutcome.Type.BLOCKED);

        RuleRegistry withGlobal = new RuleRegistry().declareMarker("plain")
                .setGlobalCollisionRule(ctx -> CollisionOutcome.bounce());
        assertThat(collide(new RuleDispatcher(withGlobal), mover, occupant).getType())
                .isEqualTo(CollisionOutcome.Type.BOUNCE);
    }

    @Test
    void collisionContextBindsStateOfTheRuleOwner() {
        registry.bindCollisionRule("counter", ctx -> {
            ctx.getState().set("hits", ctx.getState().getInt("hits", 0) + 1);
            ctx.getState().set("asMover", ctx.isMoverRule());
            return CollisionOutcome.blocked();
        });
        registry.declareMarker("plain");
        RuleDispatcher dispatcher = new RuleDispatcher(registry);
        Particle mover = particle(1, 1, "plain");
        Particle occupant = particle(2, 2, "counter");

        collide(dispatcher, mover, occupant);

        assertThat(occupant.getState("counter").getInt("hits", 0)).isEqualTo(1);
        assertThat(occupant.getState("counter").getBoolean("asMover", true)).isFalse();
    }

    @Test
    void globalRulesHaveNoTraitState() {
        RuleRegistry global = new RuleRegistry().declareMarker("plain")
                .setGlobalStepRule(ctx -> {
                    ctx.getState();
                    return StepDecision.stay();
                });
        RuleDispatcher dispatcher = new RuleDispatcher(global);
        registry = global;
        Particle particle = particle(1, 1, "plain");

        // Identifying-only particles never step, but a direct dispatch still reaches the global rule.
        assertThatThrownBy(() -> step(dispatcher, particle)).isInstanceOf(RuleException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void failingRuleIsWrappedWithParticleAndTrait() {
        registry.bindStepRule("faulty", ctx -> {
            throw new IllegalArgumentException("boom");
        });
        Particle particle = particle(4, 4, "faulty");

        assertThatThrownBy(() -> step(new RuleDispatcher(registry), particle))
                .isInstanceOf(RuleException.class)
                .hasMessageContaining("boom")
                .satisfies(e -> {
                    RuleException rule = (RuleException) e;
                    assertThat(rule.getParticleId()).isEqualTo(4);
                    assertThat(rule.getTraitName()).isEqualTo("faulty");
                });
    }

    @Test
    void contractViolationsAreRuleErrors() {
        registry.bindStepRule("null", ctx -> null)
                .bindStepRule("jumper", ctx -> StepDecision.move(2))
                .bindStepRule("eager", ctx -> StepDecision.move(1).after(0.0))
                .bindStepRule("nan", ctx -> StepDecision.move(1).after(Double.NaN));
        RuleDispatcher dispatcher = new RuleDispatcher(registry);

        assertThatThrownBy(() -> step(dispatcher, particle(1, 1, "null"))).isInstanceOf(RuleException.class);
        assertThatThrownBy(() -> step(dispatcher, particle(2, 2, "jumper")))
                .isInstanceOf(RuleException.class)
                .hasMessageContaining("displacement 2");
        assertThatThrownBy(() -> step(dispatcher, particle(3, 3, "eager"))).isInstanceOf(RuleException.class);
        assertThatThrownBy(() -> step(dispatcher, particle(4, 4, "nan"))).isInstanceOf(RuleException.class);
    }

    @Test
    void lifetimeDefaultsToAlive() {
        registry.declareMarker("plain");
        Particle particle = particle(1, 1, "plain");
        LifetimeContext context = new LifetimeContext();
        context.reset(particle, track, 0, 0.0);

        assertThat(new RuleDispatcher(registry).dispatchLifetime(particle, context).getVerdict())
                .isEqualTo(LifetimeDecision.Verdict.ALIVE);
    }
}
