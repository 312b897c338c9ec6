package org.javai.regular.config;

import java.util.Objects;

/**
 * Holds the installed {@link ScheduleConfig}. Reads and replacements go through one lock,
 * so a reader sees either the old config or the new one, never a mix.
 */
public final class ConfigCell {

    private final Object lock = new Object();
    private ScheduleConfig current;

    public ConfigCell(ScheduleConfig initial) {
        this.current = Objects.requireNonNull(initial, "initial must not be null");
    }

    public ScheduleConfig get() {
        synchronized (lock) {
            return current;
        }
    }

    /**
     * Installs a new config and returns the one it replaced.
     */
    public ScheduleConfig replace(ScheduleConfig next) {
        Objects.requireNonNull(next, "next must not be null");
        synchronized (lock) {
            ScheduleConfig previous = current;
            current = next;
            return previous;
        }
    }
}
