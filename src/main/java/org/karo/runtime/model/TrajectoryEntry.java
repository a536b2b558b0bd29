package org.karo.runtime.model;

/**
 * One committed state change.
 *
 * @param tick Tick index (synchronous) or processed-event count (asynchronous) at which the change committed
 * @param time Simulation time of the commit
 * @param particleId The particle that changed
 * @param fromSite Site before the change, or {@link #NO_SITE} for spawns
 * @param toSite Site after the change, or {@link #NO_SITE} for removals
 * @param kind What happened
 */
public record TrajectoryEntry(long tick, double time, int particleId, int fromSite, int toSite, EventKind kind) {

    public static final int NO_SITE = -1;

    public static TrajectoryEntry spawned(long tick, double time, int particleId, int site) {
        return new TrajectoryEntry(tick, time, particleId, NO_SITE, site, EventKind.SPAWNED);
    }

    public static TrajectoryEntry moved(long tick, double time, int particleId, int fromSite, int toSite, EventKind kind) {
        return new TrajectoryEntry(tick, time, particleId, fromSite, toSite, kind);
    }

    public static TrajectoryEntry removed(long tick, double time, int particleId, int fromSite, EventKind kind) {
        return new TrajectoryEntry(tick, time, particleId, fromSite, NO_SITE, kind);
    }

    /**
     * Canonical single-line form. Doubles use {@link Double#toString(double)} so two
     * logs are byte-identical exactly when their entries are equal.
     */
    public String format() {
        return tick + "\t" + Double.toString(time) + "\t" + particleId + "\t" + fromSite + "\t" + toSite + "\t" + kind;
    }
}
