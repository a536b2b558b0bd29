package org.karo.runtime.internal;

/**
 * A pending asynchronous event. Events are ordered by time, then by the sequence
 * number assigned when they were scheduled.
 *
 * @param time Simulation time at which the event fires
 * @param sequence Scheduling order, unique per simulation
 * @param particleId The particle concerned
 * @param kind What to evaluate
 */
public record ScheduledEvent(double time, long sequence, int particleId, Kind kind) {

    public enum Kind {
        /** Evaluate the particle's stepping rule. */
        STEP,
        /** Evaluate the particle's lifetime rule. */
        LIFETIME
    }
}
