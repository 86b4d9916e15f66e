package com.turnqueue.entities;

import com.turnqueue.engine.AbstractUpdatable;
import com.turnqueue.engine.Effect.Log;
import com.turnqueue.engine.EffectSink;
import com.turnqueue.message.Message;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * An entity that logs a single message when its turn comes and is then done.
 */
public class Messenger extends AbstractUpdatable {

    private final Message message;

    public Messenger(Message message) {
        this.message = Objects.requireNonNull(message, "message");
    }

    @Override
    public OptionalLong update(EffectSink effects) {
        effects.emit(new Log(message));
        return OptionalLong.empty();
    }

    public Message message() {
        return message;
    }

    @Override
    public String toString() {
        return "Messenger[message=" + message + "]";
    }
}
