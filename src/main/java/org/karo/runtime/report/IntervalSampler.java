package org.karo.runtime.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.karo.runtime.Simulation;
import org.karo.runtime.model.SimulationSnapshot;
import org.karo.runtime.model.TrajectoryEntry;
import org.karo.runtime.spi.ICommitObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the simulation state on a fixed time grid {@code start, start + step, ...},
 * independent of when commits happen.
 * <p>
 * A grid point is recorded once a commit strictly after it arrives, because commits
 * at exactly the grid time still belong to it. After a run, {@link #flush(double)}
 * records the remaining points up to the time the run stopped at.
 * <p>
 * <b>Thread safety:</b> not thread-safe; it is called from the engine thread.
 */
public class IntervalSampler implements ICommitObserver {

    private static final Logger LOG = LoggerFactory.getLogger(IntervalSampler.class);

    private final double start;
    private final double step;
    private final List<Sample> samples = new ArrayList<>();
    private long nextIndex;
    private SimulationSnapshot current;

    IntervalSampler(SimulationSnapshot initial, double start, double step) {
        if (!(step > 0) || Double.isInfinite(step)) {
            throw new IllegalArgumentException("step must be positive and finite, was " + step);
        }
        if (Double.isNaN(start) || Double.isInfinite(start)) {
            throw new IllegalArgumentException("start must be finite, was " + start);
        }
        if (start < initial.getTime()) {
            throw new IllegalArgumentException("start " + start + " lies before the current simulation time " + initial.getTime());
        }
        this.start = start;
        this.step = step;
        this.current = initial;
    }

    /**
     * Samples every {@code step} time units, starting at the current simulation time.
     */
    public static IntervalSampler attach(Simulation simulation, double step) {
        return attach(simulation, simulation.getTime(), step);
    }

    /**
     * Registers a sampler on {@code simulation} whose grid starts at {@code start}.
     *
     * @throws IllegalArgumentException if {@code step} is not positive or {@code start} lies in the past
     */
    public static IntervalSampler attach(Simulation simulation, double start, double step) {
        IntervalSampler sampler = new IntervalSampler(simulation.snapshot(), start, step);
        simulation.addCommitObserver(sampler);
        LOG.debug("Sampling every {} time units from {}", step, start);
        return sampler;
    }

    @Override
    public void onCommit(SimulationSnapshot snapshot, List<TrajectoryEntry> committed) {
        while (nextTime() < snapshot.getTime()) {
            record();
        }
        current = snapshot;
    }

    /**
     * Records every outstanding grid point at or before {@code until} from the latest state.
     * Call it with the time a run stopped at; later commits never fall on those points.
     */
    public void flush(double until) {
        while (nextTime() <= until) {
            record();
        }
    }

    public List<Sample> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    public double getStep() {
        return step;
    }

    private double nextTime() {
        return start + nextIndex * step;
    }

    private void record() {
        samples.add(new Sample(nextTime(), current));
        nextIndex++;
    }
}
