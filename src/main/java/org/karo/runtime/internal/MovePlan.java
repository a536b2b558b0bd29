package org.karo.runtime.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.karo.runtime.model.EventKind;
import org.karo.runtime.model.Track;
import org.karo.runtime.model.TrackView;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;

/**
 * The state changes one resolved move request wants to commit, applied atomically.
 * <p>
 * An empty plan means the request resolved to "nothing happens" (blocked, or a
 * bounce with nowhere to go). Operations are kept in log order: the initiating
 * particle first, then the particles it displaced.
 */
public final class MovePlan {

    /**
     * One particle's change within a plan.
     *
     * @param particleId The particle
     * @param fromSite Its site before the plan
     * @param toSite Its site after the plan, or -1 when it leaves the track
     * @param kind Log kind of the change
     */
    public record Op(int particleId, int fromSite, int toSite, EventKind kind) {

        public boolean isRemoval() {
            return toSite < 0;
        }
    }

    private final int initiatorId;
    private final List<Op> ops;

    private MovePlan(int initiatorId, List<Op> ops) {
        this.initiatorId = initiatorId;
        this.ops = ops;
    }

    public static MovePlan none(int initiatorId) {
        return new MovePlan(initiatorId, Collections.emptyList());
    }

    public static MovePlan of(int initiatorId, List<Op> ops) {
        return new MovePlan(initiatorId, List.copyOf(ops));
    }

    public static MovePlan single(int initiatorId, Op op) {
        return new MovePlan(initiatorId, List.of(op));
    }

    public int getInitiatorId() {
        return initiatorId;
    }

    public List<Op> getOps() {
        return ops;
    }

    public boolean isEmpty() {
        return ops.isEmpty();
    }

    /**
     * @return true for the plan of a particle that asked to be removed
     */
    public boolean isSelfRemoval() {
        return ops.size() == 1 && ops.get(0).particleId() == initiatorId && ops.get(0).kind() == EventKind.REMOVED;
    }

    /**
     * Checks that the plan can still be applied to the live track: every particle is
     * still where the plan found it, none was already changed earlier in the same
     * tick, and every target site is empty or vacated by the plan itself.
     *
     * @param touched Particles already changed in the current tick
     */
    public boolean isApplicable(TrackView track, IntSet touched) {
        IntSet leaving = new IntOpenHashSet();
        for (Op op : ops) {
            if (touched.contains(op.particleId()) || track.occupantAt(op.fromSite()) != op.particleId()) {
                return false;
            }
            leaving.add(op.particleId());
        }
        IntSet targets = new IntOpenHashSet();
        for (Op op : ops) {
            if (op.isRemoval()) {
                continue;
            }
            if (!targets.add(op.toSite())) {
                return false;
            }
            int occupant = track.occupantAt(op.toSite());
            if (occupant != TrackView.EMPTY && !leaving.contains(occupant)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Applies the plan to the track: all sources are vacated before any target is
     * taken, so swaps and chains never see a half-applied state.
     *
     * @return the ops that took particles off the track, in plan order
     */
    public List<Op> applyTo(Track track) {
        List<Op> removals = new ArrayList<>();
        for (Op op : ops) {
            track.vacate(op.fromSite());
        }
        for (Op op : ops) {
            if (op.isRemoval()) {
                removals.add(op);
            } else {
                track.place(op.particleId(), op.toSite());
            }
        }
        return removals;
    }

    @Override
    public String toString() {
        return "MovePlan[" + initiatorId + ": " + ops + "]";
    }
}
