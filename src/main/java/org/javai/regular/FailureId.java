package org.javai.regular;

import java.util.Objects;

/**
 * A namespaced, stable identifier for a type of failure.
 *
 * @param namespace The subsystem (e.g., "config", "task", "engine")
 * @param name The specific failure within that namespace (e.g., "invalid_window")
 */
public record FailureId(String namespace, String name) {

    public static final FailureId INVALID_WINDOW = new FailureId("config", "invalid_window");
    public static final FailureId UNREADABLE_CONFIG = new FailureId("config", "unreadable");
    public static final FailureId TASK_FAILED = new FailureId("task", "failed");
    public static final FailureId TASK_DEFECT = new FailureId("task", "defect");
    public static final FailureId CANCELLED = new FailureId("engine", "cancelled");

    public FailureId {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }

    public static FailureId of(String namespace, String name) {
        return new FailureId(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + ":" + name;
    }
}
