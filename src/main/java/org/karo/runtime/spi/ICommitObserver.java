package org.karo.runtime.spi;

import java.util.List;

import org.karo.runtime.model.SimulationSnapshot;
import org.karo.runtime.model.TrajectoryEntry;

/**
 * Observation hook invoked once per committed step (tick or event).
 * <p>
 * Observers receive an immutable snapshot, so they can be used for external
 * logging or plotting without affecting the run. An observer that throws is logged
 * and skipped; it never halts the simulation.
 */
@FunctionalInterface
public interface ICommitObserver {

    /**
     * @param snapshot Immutable state after the commit
     * @param committed Entries committed by this step, possibly empty
     */
    void onCommit(SimulationSnapshot snapshot, List<TrajectoryEntry> committed);
}
