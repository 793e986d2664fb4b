package com.agentstrike.config;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * In-memory settings holder. Readers get whatever snapshot was published last;
 * writers publish a whole new snapshot via a volatile reference swap.
 */
public class MutableSettingsSource implements SettingsSource {

    private volatile AgentSettings settings;
    private final CopyOnWriteArrayList<Consumer<AgentSettings>> listeners = new CopyOnWriteArrayList<>();

    public MutableSettingsSource() {
        this(AgentSettings.defaults());
    }

    public MutableSettingsSource(AgentSettings initial) {
        this.settings = Objects.requireNonNull(initial, "initial");
    }

    @Override
    public AgentSettings current() {
        return settings;
    }

    public void set(AgentSettings next) {
        this.settings = Objects.requireNonNull(next, "next");
        notifyListeners(next);
    }

    /** Atomically derives and publishes a new snapshot from the current one. */
    public AgentSettings update(UnaryOperator<AgentSettings> change) {
        AgentSettings next;
        synchronized (this) {
            next = Objects.requireNonNull(change.apply(settings), "updated settings");
            this.settings = next;
        }
        notifyListeners(next);
        return next;
    }

    public void addListener(Consumer<AgentSettings> listener) {
        listeners.add(listener);
    }

    // Outside the lock
    private void notifyListeners(AgentSettings next) {
        for (Consumer<AgentSettings> l : listeners) {
            l.accept(next);
        }
    }
}
