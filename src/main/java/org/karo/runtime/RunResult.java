package org.karo.runtime;

import java.util.List;
import java.util.Optional;

import org.karo.runtime.model.TrajectoryEntry;

/**
 * Outcome of {@link Simulation#stepOnce()}, {@link Simulation#run(long)} and
 * {@link Simulation#runUntil(double)}.
 *
 * @param entries Trajectory entries committed during the call, in commit order
 * @param termination Why the call returned
 * @param error The failure that halted the run, or {@code null}
 */
public record RunResult(List<TrajectoryEntry> entries, Termination termination, SimulationException error) {

    public RunResult {
        entries = List.copyOf(entries);
    }

    public boolean isSuccessful() {
        return error == null;
    }

    public Optional<SimulationException> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Rethrows the attached error, if any.
     *
     * @return this result when the run did not fail
     * @throws SimulationException the error that halted the run
     */
    public RunResult orThrow() {
        if (error != null) {
            throw error;
        }
        return this;
    }
}
