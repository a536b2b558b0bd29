package org.karo.runtime.internal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectRBTreeSet;
import it.unimi.dsi.fastutil.objects.ObjectSortedSet;

/**
 * Priority queue of the asynchronous scheduler.
 * <p>
 * Each particle has at most one pending event per {@link ScheduledEvent.Kind};
 * scheduling a new one replaces the old. Equal times are served in scheduling order,
 * which makes the event order fully determined by the run's history.
 */
public class EventQueue {

    private static final Comparator<ScheduledEvent> ORDER = Comparator
            .comparingDouble(ScheduledEvent::time)
            .thenComparingLong(ScheduledEvent::sequence);

    private final ObjectSortedSet<ScheduledEvent> queue = new ObjectRBTreeSet<>(ORDER);
    private final Int2ObjectMap<ScheduledEvent> stepEvents = new Int2ObjectOpenHashMap<>();
    private final Int2ObjectMap<ScheduledEvent> lifetimeEvents = new Int2ObjectOpenHashMap<>();
    private long nextSequence;

    /**
     * Schedules (or reschedules) an event for a particle.
     *
     * @return the event that was queued
     */
    public ScheduledEvent schedule(int particleId, ScheduledEvent.Kind kind, double time) {
        return insert(new ScheduledEvent(time, nextSequence++, particleId, kind));
    }

    /**
     * Re-inserts an event with its original sequence number, used when resuming from a checkpoint.
     */
    public void restore(ScheduledEvent event) {
        insert(event);
        nextSequence = Math.max(nextSequence, event.sequence() + 1);
    }

    /**
     * Drops the pending event of the given kind, if any.
     */
    public void cancel(int particleId, ScheduledEvent.Kind kind) {
        ScheduledEvent existing = index(kind).remove(particleId);
        if (existing != null) {
            queue.remove(existing);
        }
    }

    /**
     * Drops all pending events of a particle.
     */
    public void cancelAll(int particleId) {
        cancel(particleId, ScheduledEvent.Kind.STEP);
        cancel(particleId, ScheduledEvent.Kind.LIFETIME);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    /**
     * @return the earliest event without removing it, or {@code null}
     */
    public ScheduledEvent peek() {
        return queue.isEmpty() ? null : queue.first();
    }

    /**
     * Removes and returns the earliest event, or {@code null} if the queue is empty.
     */
    public ScheduledEvent poll() {
        if (queue.isEmpty()) {
            return null;
        }
        ScheduledEvent event = queue.first();
        queue.remove(event);
        index(event.kind()).remove(event.particleId());
        return event;
    }

    public boolean hasPending(int particleId, ScheduledEvent.Kind kind) {
        return index(kind).containsKey(particleId);
    }

    /**
     * @return all pending events in firing order
     */
    public List<ScheduledEvent> pending() {
        return new ArrayList<>(queue);
    }

    public long getNextSequence() {
        return nextSequence;
    }

    public void setNextSequence(long nextSequence) {
        this.nextSequence = nextSequence;
    }

    public void clear() {
        queue.clear();
        stepEvents.clear();
        lifetimeEvents.clear();
    }

    private ScheduledEvent insert(ScheduledEvent event) {
        cancel(event.particleId(), event.kind());
        queue.add(event);
        index(event.kind()).put(event.particleId(), event);
        return event;
    }

    private Int2ObjectMap<ScheduledEvent> index(ScheduledEvent.Kind kind) {
        return kind == ScheduledEvent.Kind.STEP ? stepEvents : lifetimeEvents;
    }
}
