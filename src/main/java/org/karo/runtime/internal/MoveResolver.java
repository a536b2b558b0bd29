package org.karo.runtime.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

import org.karo.runtime.BoundaryException;
import org.karo.runtime.model.EventKind;
import org.karo.runtime.model.Particle;
import org.karo.runtime.model.TrackView;
import org.karo.runtime.rules.RuleDispatcher;
import org.karo.runtime.rules.StandardTraits;
import org.karo.runtime.spi.CollisionContext;
import org.karo.runtime.spi.CollisionOutcome;

/**
 * Turns a single move request into a {@link MovePlan}, consulting collision rules
 * when the target is occupied.
 * <p>
 * Resolution is evaluated against the given view (the pre-tick snapshot in
 * synchronous mode, the live track in asynchronous mode) and never mutates it.
 * <ul>
 *   <li>Off-track target: blocked on a closed track, exit on an open track,
 *       {@link BoundaryException} on a marker-bounded track.</li>
 *   <li>Swap: mover and occupant exchange sites.</li>
 *   <li>Merge: the non-surviving party is removed; a surviving mover takes the site.</li>
 *   <li>Bounce: the mover goes one site the other way if that site is free, else stays.</li>
 *   <li>Push: the occupant is displaced one site further in the same direction,
 *       recursively. Each link is resolved by collision dispatch between the pushed
 *       particle and its own neighbour; only Push continues and Merge ends a chain,
 *       anything else blocks the whole chain.</li>
 * </ul>
 * Track-end markers never move, so swapping with or pushing one is blocked.
 */
public class MoveResolver {

    private final RuleDispatcher dispatcher;
    private final IntFunction<Particle> particles;

    /**
     * @param particles Resolves live particles by id
     */
    public MoveResolver(RuleDispatcher dispatcher, IntFunction<Particle> particles) {
        this.dispatcher = dispatcher;
        this.particles = particles;
    }

    /**
     * Plans a removal requested by a stepping rule.
     */
    public MovePlan planRemoval(Particle particle) {
        return MovePlan.single(particle.getId(),
                new MovePlan.Op(particle.getId(), particle.getSite(), -1, EventKind.REMOVED));
    }

    /**
     * Resolves a request to move {@code mover} one site in {@code direction}.
     *
     * @param mover The requesting particle
     * @param direction -1 or +1
     * @param view Occupancy to resolve against
     * @param context Reusable collision context
     * @throws BoundaryException if a marker-bounded track would be left
     */
    public MovePlan resolve(Particle mover, int direction, TrackView view, CollisionContext context,
                            long tick, double time) {
        int from = mover.getSite();
        int target = from + direction;
        if (!view.isInBounds(target)) {
            MovePlan.Op exit = offTrack(mover, from, target, view);
            return exit == null ? MovePlan.none(mover.getId()) : MovePlan.single(mover.getId(), exit);
        }
        int occupantId = view.occupantAt(target);
        if (occupantId == TrackView.EMPTY) {
            return MovePlan.single(mover.getId(), new MovePlan.Op(mover.getId(), from, target, EventKind.MOVED));
        }

        Particle occupant = particles.apply(occupantId);
        context.reset(mover, occupant, direction, view, tick, time);
        CollisionOutcome outcome = dispatcher.dispatchCollision(mover, occupant, context);
        switch (outcome.getType()) {
            case SWAP:
                if (isImmovable(occupant)) {
                    return MovePlan.none(mover.getId());
                }
                return MovePlan.of(mover.getId(), List.of(
                        new MovePlan.Op(mover.getId(), from, target, EventKind.SWAPPED),
                        new MovePlan.Op(occupantId, target, from, EventKind.SWAPPED)));
            case MERGE:
                if (outcome.getSurvivor() == CollisionOutcome.Survivor.MOVER) {
                    return MovePlan.of(mover.getId(), List.of(
                            new MovePlan.Op(mover.getId(), from, target, EventKind.MOVED),
                            new MovePlan.Op(occupantId, target, -1, EventKind.MERGED)));
                }
                return MovePlan.single(mover.getId(), new MovePlan.Op(mover.getId(), from, -1, EventKind.MERGED));
            case BOUNCE:
                int back = from - direction;
                if (view.isInBounds(back) && !view.isOccupied(back)) {
                    return MovePlan.single(mover.getId(), new MovePlan.Op(mover.getId(), from, back, EventKind.BOUNCED));
                }
                return MovePlan.none(mover.getId());
            case PUSH:
                List<MovePlan.Op> chain = new ArrayList<>();
                chain.add(new MovePlan.Op(mover.getId(), from, target, EventKind.MOVED));
                if (!push(occupant, target, direction, view, context, tick, time, chain)) {
                    return MovePlan.none(mover.getId());
                }
                return MovePlan.of(mover.getId(), chain);
            default:
                return MovePlan.none(mover.getId());
        }
    }

    /**
     * Adds the ops displacing {@code pushed} (and whatever it pushes in turn) to {@code chain}.
     *
     * @return false if the chain is blocked
     */
    private boolean push(Particle pushed, int site, int direction, TrackView view, CollisionContext context,
                         long tick, double time, List<MovePlan.Op> chain) {
        if (isImmovable(pushed)) {
            return false;
        }
        int next = site + direction;
        if (!view.isInBounds(next)) {
            MovePlan.Op exit = offTrack(pushed, site, next, view);
            if (exit == null) {
                return false;
            }
            chain.add(exit);
            return true;
        }
        int nextId = view.occupantAt(next);
        if (nextId == TrackView.EMPTY) {
            chain.add(new MovePlan.Op(pushed.getId(), site, next, EventKind.PUSHED));
            return true;
        }
        Particle neighbour = particles.apply(nextId);
        context.reset(pushed, neighbour, direction, view, tick, time);
        CollisionOutcome outcome = dispatcher.dispatchCollision(pushed, neighbour, context);
        switch (outcome.getType()) {
            case PUSH:
                chain.add(new MovePlan.Op(pushed.getId(), site, next, EventKind.PUSHED));
                return push(neighbour, next, direction, view, context, tick, time, chain);
            case MERGE:
                if (outcome.getSurvivor() == CollisionOutcome.Survivor.MOVER) {
                    chain.add(new MovePlan.Op(pushed.getId(), site, next, EventKind.PUSHED));
                    chain.add(new MovePlan.Op(nextId, next, -1, EventKind.MERGED));
                } else {
                    chain.add(new MovePlan.Op(pushed.getId(), site, -1, EventKind.MERGED));
                }
                return true;
            default:
                return false;
        }
    }

    /**
     * @return the exit op for an open track, or {@code null} when the move is blocked
     */
    private static MovePlan.Op offTrack(Particle particle, int site, int target, TrackView view) {
        switch (view.getBoundary()) {
            case OPEN:
                return new MovePlan.Op(particle.getId(), site, -1, EventKind.EXITED);
            case MARKED:
                throw new BoundaryException("Particle " + particle.getId() + " tried to leave the marker-bounded track at site "
                        + target + " with no track-end marker to stop it", target);
            default:
                return null;
        }
    }

    private static boolean isImmovable(Particle particle) {
        return particle.hasTrait(StandardTraits.TRACK_END_NAME);
    }
}
