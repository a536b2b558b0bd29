package org.karo.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of every committed state change of a simulation.
 * <p>
 * <b>Thread safety:</b> not thread-safe. It is written by the engine thread only;
 * readers should use the copies handed out by the run methods or observers.
 */
public final class TrajectoryLog {

    private final List<TrajectoryEntry> entries = new ArrayList<>();

    /**
     * <b>Internal use only:</b> appends the entries of one commit.
     */
    public void appendAll(List<TrajectoryEntry> committed) {
        entries.addAll(committed);
    }

    public int size() {
        return entries.size();
    }

    public List<TrajectoryEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * @return a copy of the entries appended at or after {@code fromIndex}
     */
    public List<TrajectoryEntry> since(int fromIndex) {
        return List.copyOf(entries.subList(fromIndex, entries.size()));
    }

    /**
     * @return all entries of one particle, in commit order
     */
    public List<TrajectoryEntry> forParticle(int particleId) {
        List<TrajectoryEntry> result = new ArrayList<>();
        for (TrajectoryEntry entry : entries) {
            if (entry.particleId() == particleId) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Renders the canonical text form, one {@link TrajectoryEntry#format()} line per entry.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (TrajectoryEntry entry : entries) {
            sb.append(entry.format()).append('\n');
        }
        return sb.toString();
    }
}
