package org.karo.runtime.report;

import org.karo.runtime.model.SimulationSnapshot;

/**
 * State of a simulation at one point of a sampling grid.
 *
 * @param time The grid time
 * @param snapshot The state in effect at {@code time}: the result of the last commit at or before it
 */
public record Sample(double time, SimulationSnapshot snapshot) {
}
