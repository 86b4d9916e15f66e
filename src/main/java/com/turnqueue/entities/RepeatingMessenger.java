package com.turnqueue.entities;

import com.turnqueue.engine.AbstractUpdatable;
import com.turnqueue.engine.Effect.Log;
import com.turnqueue.engine.EffectSink;
import com.turnqueue.message.Message;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * An entity that logs the same message a fixed number of times, a fixed number of ticks apart.
 */
public class RepeatingMessenger extends AbstractUpdatable {

    private final Message message;
    private final long interval;
    private final int repetitions;
    private int emitted;

    /**
     * @param message the message to log
     * @param interval the ticks between two messages; 0 repeats within the same tick
     * @param repetitions how many times the message is logged, at least 1
     */
    public RepeatingMessenger(Message message, long interval, int repetitions) {
        this.message = Objects.requireNonNull(message, "message");
        if (interval < 0) {
            throw new IllegalArgumentException("Interval must not be negative: " + interval);
        }
        if (repetitions < 1) {
            throw new IllegalArgumentException("Repetitions must be at least 1: " + repetitions);
        }
        this.interval = interval;
        this.repetitions = repetitions;
    }

    @Override
    public OptionalLong update(EffectSink effects) {
        effects.emit(new Log(message));
        emitted++;
        return emitted < repetitions ? OptionalLong.of(interval) : OptionalLong.empty();
    }

    public int emitted() {
        return emitted;
    }

    @Override
    public String toString() {
        return "RepeatingMessenger[message=" + message +
                ", interval=" + interval +
                ", emitted=" + emitted + "/" + repetitions + "]";
    }
}
