package com.turnqueue.engine;

import com.turnqueue.engine.Effect.Log;
import com.turnqueue.message.Message;

/**
 * Receives the effects drained by a {@link SimulationLoop}, one variant per method.
 */
public interface EffectHandler {

    /**
     * Called for each {@link Log} effect.
     *
     * @param message the logged message
     */
    void onLog(Message message);

    /**
     * Dispatches an effect to the method for its variant.
     *
     * @param effect the effect to handle
     */
    default void handle(Effect effect) {
        if (effect instanceof Log log) {
            onLog(log.message());
        } else {
            throw new IllegalArgumentException("Unsupported effect: " + effect);
        }
    }
}
