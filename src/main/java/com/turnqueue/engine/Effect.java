package com.turnqueue.engine;

import com.turnqueue.message.Message;

import java.util.Objects;

/**
 * Marker interface for all effects produced by updates.
 * Effects describe outcomes that matter to systems outside the update queue, such as messages
 * to display. The queue only carries them; interpreting them is up to the driving loop.
 */
public sealed interface Effect permits Effect.Log {

    /**
     * Effect carrying a message to be logged for the player.
     *
     * @param message the message to log
     */
    record Log(Message message) implements Effect {

        public Log {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String toString() {
            return "Log[message=" + message + "]";
        }
    }
}
