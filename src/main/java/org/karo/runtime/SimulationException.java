package org.karo.runtime;

/**
 * Base class of every error the simulation engine reports.
 * <p>
 * Run methods never throw these; they return them inside a {@link RunResult}
 * together with the trajectory committed up to the failure point. Callers that
 * prefer exceptions use {@link RunResult#orThrow()}.
 */
public class SimulationException extends RuntimeException {

    /**
     * Creates a SimulationException with the specified message.
     *
     * @param message Description of the failure
     */
    public SimulationException(String message) {
        super(message);
    }

    /**
     * Creates a SimulationException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception
     */
    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
