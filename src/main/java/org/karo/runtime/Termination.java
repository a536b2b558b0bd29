package org.karo.runtime;

/**
 * Why a call to one of the run methods returned.
 */
public enum Termination {
    /** The requested number of steps was executed. */
    STEPS_COMPLETED,
    /** The tick or time passed to {@code runUntil} was reached. */
    TARGET_REACHED,
    /** The configured {@code max-ticks} or {@code max-time} was reached. */
    LIMIT_REACHED,
    /** No particle other than identifying-only markers is left. */
    NO_PARTICLES,
    /** An external stop request was honoured at a step boundary. */
    STOP_REQUESTED,
    /** Asynchronous mode only: no event is pending. */
    QUEUE_EXHAUSTED,
    /** A step failed; the error is attached to the result. */
    FAILED;

    /**
     * @return true if the simulation cannot be continued after this termination
     */
    public boolean isFinal() {
        return this == LIMIT_REACHED || this == NO_PARTICLES || this == QUEUE_EXHAUSTED || this == FAILED;
    }
}
