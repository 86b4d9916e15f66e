package com.turnqueue.engine;

/**
 * Base class for updatables that keeps the active flag.
 * Subclasses only implement {@link #update(EffectSink)}.
 */
public abstract class AbstractUpdatable implements Updatable {

    private boolean active = true;

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void deactivate() {
        active = false;
    }
}
