package org.karo.runtime;

/**
 * Lifecycle of the {@link Simulation} state machine.
 * <p>
 * {@code IDLE → STEPPING → RESOLVING → COMMITTING → IDLE ...} until the run ends in
 * {@code FINISHED} or {@code FAILED}.
 */
public enum EngineState {
    IDLE,
    STEPPING,
    RESOLVING,
    COMMITTING,
    FINISHED,
    FAILED;

    /**
     * @return true if no further step can be executed
     */
    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }
}
