package com.turnqueue.engine;

import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Schedules {@link Updatable} entities by tick and updates them in order.
 * <p>
 * Each call to {@link #step(EffectSink)} processes the single active entity with the earliest
 * scheduled tick, moving the simulation one small step forward. Entities scheduled for the same
 * tick are processed in the order they were pushed.
 * <p>
 * There is no removal operation. An entity is cancelled by {@link Updatable#deactivate()}; its
 * entry stays in the queue until its turn comes and is discarded then.
 * <p>
 * An entity may be scheduled at most once at a time. Callers must not update a scheduled entity
 * themselves. This class is not thread-safe.
 */
public class UpdateQueue {

    private static final Logger logger = Logger.getLogger(UpdateQueue.class.getName());

    private static final Comparator<Entry> ORDER =
            Comparator.comparingLong(Entry::tick).thenComparingLong(Entry::sequence);

    /**
     * A scheduled entity together with the tick of its next update.
     * The sequence number keeps entries with equal ticks in insertion order.
     */
    private record Entry(long tick, long sequence, Updatable updatable) {
    }

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private final Set<Updatable> scheduled = Collections.newSetFromMap(new IdentityHashMap<>());
    private long nextSequence;

    /**
     * Schedules an entity for its first update.
     *
     * @param tick the tick of the first update
     * @param updatable the entity to schedule
     * @throws IllegalArgumentException if the tick is negative
     * @throws IllegalStateException if the entity is already scheduled in this queue
     */
    public void push(long tick, Updatable updatable) {
        Objects.requireNonNull(updatable, "updatable");
        if (tick < 0) {
            throw new IllegalArgumentException("Tick must not be negative: " + tick);
        }
        if (!scheduled.add(updatable)) {
            throw new IllegalStateException("Entity is already scheduled: " + updatable);
        }
        enqueue(tick, updatable);
    }

    /**
     * Processes the next active entity.
     * <p>
     * Inactive entities found at the head of the queue are discarded. The first active one is
     * updated with the given sink and, if it asks for it, rescheduled at its tick plus the
     * returned delay.
     *
     * @param effects the sink passed to the updated entity
     * @return the tick of the processed update, or empty if no active entities are left
     */
    public OptionalLong step(EffectSink effects) {
        Objects.requireNonNull(effects, "effects");
        Entry entry = pollActive();
        if (entry == null) {
            return OptionalLong.empty();
        }

        long now = entry.tick();
        Updatable updatable = entry.updatable();
        OptionalLong delay;
        try {
            delay = updatable.update(effects);
        } catch (RuntimeException e) {
            scheduled.remove(updatable);
            throw e;
        }

        if (delay.isPresent()) {
            reschedule(now, delay.getAsLong(), updatable);
        } else {
            scheduled.remove(updatable);
        }
        return OptionalLong.of(now);
    }

    /**
     * Returns the tick of the next update without performing it.
     * Inactive entities at the head of the queue are discarded, as in {@link #step(EffectSink)}.
     *
     * @return the tick of the next active entity, or empty if none are left
     */
    public OptionalLong nextTick() {
        discardInactiveHead();
        Entry head = queue.peek();
        return head == null ? OptionalLong.empty() : OptionalLong.of(head.tick());
    }

    /**
     * Returns whether the entity currently has an entry in this queue.
     * A deactivated entity stays scheduled until the queue reaches and discards it.
     *
     * @param updatable the entity to look up
     * @return true if the entity is scheduled
     */
    public boolean isScheduled(Updatable updatable) {
        return scheduled.contains(updatable);
    }

    /**
     * Returns the number of entries held, including deactivated entries not yet discarded.
     *
     * @return the number of entries
     */
    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    private void reschedule(long now, long delay, Updatable updatable) {
        if (delay < 0) {
            scheduled.remove(updatable);
            throw new IllegalStateException("Entity returned a negative delay " + delay + ": " + updatable);
        }
        long next;
        try {
            next = Math.addExact(now, delay);
        } catch (ArithmeticException e) {
            scheduled.remove(updatable);
            throw e;
        }
        enqueue(next, updatable);
    }

    private void enqueue(long tick, Updatable updatable) {
        queue.add(new Entry(tick, nextSequence++, updatable));
    }

    private Entry pollActive() {
        discardInactiveHead();
        Entry entry = queue.poll();
        if (entry == null) {
            logger.fine("Update queue exhausted");
        }
        return entry;
    }

    private void discardInactiveHead() {
        Entry head = queue.peek();
        while (head != null && !head.updatable().isActive()) {
            Entry discarded = queue.poll();
            scheduled.remove(discarded.updatable());
            logger.fine(() -> "Discarded inactive entity at tick " + discarded.tick() + ": " + discarded.updatable());
            head = queue.peek();
        }
    }

    @Override
    public String toString() {
        return queue.stream()
                .sorted(ORDER)
                .map(entry -> Long.toString(entry.tick()))
                .collect(Collectors.joining(", ", "UpdateQueue[", "]"));
    }
}
