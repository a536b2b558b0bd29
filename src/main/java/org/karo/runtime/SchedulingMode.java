package org.karo.runtime;

/**
 * How the engine advances time. Chosen once per simulation and never mixed within a run.
 */
public enum SchedulingMode {
    /**
     * Tick-based: every particle plans against the pre-tick track, all approved
     * changes commit together at the tick boundary.
     */
    SYNCHRONOUS,
    /**
     * Event-based: particles are kept in a queue keyed by their next event time,
     * one event is evaluated and committed at a time.
     */
    ASYNCHRONOUS
}
