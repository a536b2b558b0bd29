package org.karo.runtime;

/**
 * Thrown when track occupancy and particle positions disagree after a commit.
 * <p>
 * This signals an engine defect rather than bad input, so it always aborts the run.
 */
public class InvariantViolationException extends SimulationException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
