package org.karo.runtime;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * Barrier-synchronized thread pool used to evaluate stepping rules of a synchronous
 * tick in parallel.
 * <p>
 * The pool keeps {@code P-1} parked daemon threads alive between ticks; the calling
 * thread takes part as worker 0. Each {@link #dispatch(int, RangeTask)} splits the
 * index range {@code [0, size)} into P contiguous slices and returns once every slice
 * is done. Planning results are written into per-index slots, so the outcome does not
 * depend on which thread planned which particle.
 * <p>
 * <b>Thread safety:</b> {@link #dispatch(int, RangeTask)} must be called from the
 * thread that owns the simulation and is not reentrant. {@link #shutdown()} is
 * idempotent.
 */
public class PlanWorkerPool {

    /**
     * Work on the index slice {@code [fromInclusive, toExclusive)}.
     */
    @FunctionalInterface
    public interface RangeTask {
        void run(int fromInclusive, int toExclusive);
    }

    private static final ThreadLocal<Integer> SLOT = new ThreadLocal<>();

    private final Thread[] workers;
    private final int parallelism;
    private final AtomicInteger finished = new AtomicInteger();
    private final AtomicInteger parked = new AtomicInteger();
    private final AtomicReference<Throwable> firstFailure = new AtomicReference<>();

    private volatile int generation;
    private volatile int size;
    private volatile RangeTask task;
    private volatile boolean stopped;

    /**
     * @param parallelism Total number of threads including the caller, at least 2
     */
    public PlanWorkerPool(int parallelism) {
        if (parallelism < 2) {
            throw new IllegalArgumentException("Parallelism must be >= 2, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.workers = new Thread[parallelism - 1];
        for (int i = 0; i < workers.length; i++) {
            int slot = i + 1;
            workers[i] = new Thread(() -> workerLoop(slot), "karo-planner-" + slot);
            workers[i].setDaemon(true);
            workers[i].start();
        }
        // A worker that has not read the initial generation would miss the first dispatch.
        while (parked.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    /**
     * @return the slot of the calling thread during a dispatch, 0 for the caller
     */
    public static int currentSlot() {
        return SLOT.get();
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Runs {@code task} over {@code [0, totalSize)} on all threads and waits for completion.
     * The first failure of any thread is rethrown after all slices have finished.
     */
    public void dispatch(int totalSize, RangeTask task) {
        if (totalSize <= 0) {
            return;
        }
        this.size = totalSize;
        this.task = task;
        firstFailure.set(null);
        finished.set(0);
        generation++;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }

        SLOT.set(0);
        try {
            task.run(0, Math.min(sliceSize(totalSize), totalSize));
        } catch (Throwable t) {
            firstFailure.compareAndSet(null, t);
        }
        while (finished.get() < workers.length) {
            Thread.onSpinWait();
        }

        Throwable failure = firstFailure.get();
        if (failure instanceof RuntimeException re) {
            throw re;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure != null) {
            throw new IllegalStateException("Planning thread failed", failure);
        }
    }

    /**
     * Stops and joins all worker threads.
     */
    public void shutdown() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private int sliceSize(int totalSize) {
        return (totalSize + parallelism - 1) / parallelism;
    }

    private void workerLoop(int slot) {
        SLOT.set(slot);
        int seen = generation;
        parked.incrementAndGet();
        while (!stopped) {
            LockSupport.park();
            if (stopped) {
                break;
            }
            int current = generation;
            if (current == seen) {
                continue;
            }
            seen = current;
            try {
                int total = size;
                int from = slot * sliceSize(total);
                int to = Math.min(from + sliceSize(total), total);
                if (from < total) {
                    task.run(from, to);
                }
            } catch (Throwable t) {
                firstFailure.compareAndSet(null, t);
            }
            finished.incrementAndGet();
        }
    }
}
