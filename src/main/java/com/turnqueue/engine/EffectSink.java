package com.turnqueue.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, append-only buffer of effects collected during updates.
 * <p>
 * Entities append through {@link #emit(Effect)}. The driving loop takes everything out with
 * {@link #drain()}, in the order it was appended.
 */
public class EffectSink {

    private final List<Effect> effects = new ArrayList<>();

    /**
     * Appends an effect.
     *
     * @param effect the effect to append
     */
    public void emit(Effect effect) {
        effects.add(Objects.requireNonNull(effect, "effect"));
    }

    /**
     * Removes and returns all collected effects.
     *
     * @return the effects in append order; empty if nothing was collected
     */
    public List<Effect> drain() {
        if (effects.isEmpty()) {
            return List.of();
        }
        List<Effect> drained = List.copyOf(effects);
        effects.clear();
        return drained;
    }

    public int size() {
        return effects.size();
    }

    public boolean isEmpty() {
        return effects.isEmpty();
    }

    @Override
    public String toString() {
        return "EffectSink" + effects;
    }
}
