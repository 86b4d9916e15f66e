package com.turnqueue.engine;

import java.util.OptionalLong;

/**
 * Contract for any entity that can be processed by an {@link UpdateQueue}.
 * <p>
 * Entities are registered with a queue and updated in tick order. Each update may append
 * {@link Effect}s to the supplied sink and decides whether the entity stays scheduled.
 * <p>
 * {@link #update(EffectSink)} is meant to be called only by {@link UpdateQueue#step(EffectSink)},
 * which always checks {@link #isActive()} first.
 */
public interface Updatable {

    /**
     * Performs one unit of work for this entity.
     *
     * @param effects the sink receiving any externally observable outcomes of this update
     * @return the number of ticks until the next update, or empty if the entity should not be
     *         updated again
     */
    OptionalLong update(EffectSink effects);

    /**
     * Returns whether this entity should still be updated.
     *
     * @return true if the entity is active
     */
    boolean isActive();

    /**
     * Marks this entity as permanently inactive.
     * A queue holding the entity skips and discards it when its turn comes.
     */
    void deactivate();
}
