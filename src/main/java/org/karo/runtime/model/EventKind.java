package org.karo.runtime.model;

/**
 * Kind of a committed state change recorded in the trajectory log.
 */
public enum EventKind {
    SPAWNED,
    MOVED,
    /** Displaced by another particle's push. */
    PUSHED,
    SWAPPED,
    BOUNCED,
    /** Absorbed by the other party of a merge. */
    MERGED,
    /** Removed by a rule or by an external request. */
    REMOVED,
    /** Removed because its lifetime rule declared it expired. */
    EXPIRED,
    /** Displaced off an open track end. */
    EXITED;

    /**
     * @return true if the particle no longer exists after this event
     */
    public boolean isRemoval() {
        return this == MERGED || this == REMOVED || this == EXPIRED || this == EXITED;
    }
}
