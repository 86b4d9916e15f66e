package com.turnqueue.engine;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Logger;

/**
 * Drives an {@link UpdateQueue} and hands the resulting effects to an {@link EffectHandler}.
 * <p>
 * After every processed update the effect sink is drained and each effect is dispatched in the
 * order it was emitted, so effects reach the handler in the same order entities were updated.
 */
public class SimulationLoop {

    private static final Logger logger = Logger.getLogger(SimulationLoop.class.getName());

    private final UpdateQueue queue;
    private final EffectSink effects = new EffectSink();
    private final EffectHandler handler;
    private OptionalLong currentTick = OptionalLong.empty();

    /**
     * Creates a loop over a new, empty queue.
     *
     * @param handler the handler receiving drained effects
     */
    public SimulationLoop(EffectHandler handler) {
        this(new UpdateQueue(), handler);
    }

    /**
     * Creates a loop over an existing queue.
     *
     * @param queue the queue to drive
     * @param handler the handler receiving drained effects
     */
    public SimulationLoop(UpdateQueue queue, EffectHandler handler) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    /**
     * Schedules an entity on the underlying queue.
     *
     * @param tick the tick of the first update
     * @param updatable the entity to schedule
     * @see UpdateQueue#push(long, Updatable)
     */
    public void schedule(long tick, Updatable updatable) {
        queue.push(tick, updatable);
    }

    /**
     * Processes one update and dispatches the effects it produced.
     *
     * @return the tick of the processed update, or empty if the queue is exhausted
     */
    public OptionalLong advance() {
        OptionalLong tick = queue.step(effects);
        if (tick.isPresent()) {
            currentTick = tick;
        }
        dispatch();
        return tick;
    }

    /**
     * Processes updates until the next one would be scheduled after the given tick.
     *
     * @param limitTick the last tick to process, inclusive
     * @return the number of updates processed
     */
    public int runUntil(long limitTick) {
        int processed = 0;
        OptionalLong next = queue.nextTick();
        while (next.isPresent() && next.getAsLong() <= limitTick) {
            advance();
            processed++;
            next = queue.nextTick();
        }
        logger.fine("Processed " + processed + " updates up to tick " + limitTick);
        return processed;
    }

    /**
     * Processes updates until no active entities are left.
     * Does not return while any entity keeps rescheduling itself.
     *
     * @return the number of updates processed
     */
    public int runToCompletion() {
        int processed = 0;
        while (advance().isPresent()) {
            processed++;
        }
        logger.fine("Update queue exhausted after " + processed + " updates");
        return processed;
    }

    /**
     * Returns the tick of the last processed update.
     *
     * @return the current tick, or empty if nothing has been processed yet
     */
    public OptionalLong currentTick() {
        return currentTick;
    }

    public UpdateQueue queue() {
        return queue;
    }

    private void dispatch() {
        List<Effect> drained = effects.drain();
        for (Effect effect : drained) {
            handler.handle(effect);
        }
    }
}
