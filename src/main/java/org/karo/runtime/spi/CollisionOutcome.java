package org.karo.runtime.spi;

/**
 * The answer of an {@link ICollisionRule}.
 */
public final class CollisionOutcome {

    public enum Type {
        /** No opinion, ask the next rule. */
        PASS,
        /** The mover stays where it is. */
        BLOCKED,
        /** Mover and occupant exchange sites. */
        SWAP,
        /** One party absorbs the other; see {@link Survivor}. */
        MERGE,
        /** The mover goes one site in the opposite direction instead, if that site is free. */
        BOUNCE,
        /** The occupant is displaced one site further, itself subject to collision checks. */
        PUSH
    }

    /**
     * Which identity persists after a merge.
     */
    public enum Survivor {
        /** The occupant is removed and the mover takes its site. */
        MOVER,
        /** The mover is removed and the occupant stays. */
        OCCUPANT
    }

    private static final CollisionOutcome PASS = new CollisionOutcome(Type.PASS, null);
    private static final CollisionOutcome BLOCKED = new CollisionOutcome(Type.BLOCKED, null);
    private static final CollisionOutcome SWAP = new CollisionOutcome(Type.SWAP, null);
    private static final CollisionOutcome BOUNCE = new CollisionOutcome(Type.BOUNCE, null);
    private static final CollisionOutcome PUSH = new CollisionOutcome(Type.PUSH, null);
    private static final CollisionOutcome MERGE_MOVER = new CollisionOutcome(Type.MERGE, Survivor.MOVER);
    private static final CollisionOutcome MERGE_OCCUPANT = new CollisionOutcome(Type.MERGE, Survivor.OCCUPANT);

    private final Type type;
    private final Survivor survivor;

    private CollisionOutcome(Type type, Survivor survivor) {
        this.type = type;
        this.survivor = survivor;
    }

    public static CollisionOutcome pass() {
        return PASS;
    }

    public static CollisionOutcome blocked() {
        return BLOCKED;
    }

    public static CollisionOutcome swap() {
        return SWAP;
    }

    public static CollisionOutcome bounce() {
        return BOUNCE;
    }

    public static CollisionOutcome push() {
        return PUSH;
    }

    public static CollisionOutcome merge(Survivor survivor) {
        return survivor == Survivor.MOVER ? MERGE_MOVER : MERGE_OCCUPANT;
    }

    public Type getType() {
        return type;
    }

    /**
     * @return the surviving party for {@link Type#MERGE}, otherwise {@code null}
     */
    public Survivor getSurvivor() {
        return survivor;
    }

    public boolean isDefinite() {
        return type != Type.PASS;
    }

    @Override
    public String toString() {
        return survivor == null ? type.name() : type + "(" + survivor + ")";
    }
}
