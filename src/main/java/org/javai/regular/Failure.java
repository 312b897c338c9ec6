package org.javai.regular;

import java.time.Instant;
import java.util.Objects;

/**
 * A failure produced by the engine, ready for reporting.
 *
 * @param id The failure identifier (namespace:name)
 * @param message Human-readable description
 * @param type Where the failure came from
 * @param operation The engine name or the operation that failed (e.g., "setConfig")
 * @param occurredAt When the failure happened
 * @param exception The underlying exception (may be null)
 */
public record Failure(
        FailureId id,
        String message,
        FailureType type,
        String operation,
        Instant occurredAt,
        Throwable exception
) {

    public Failure {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(occurredAt, "occurredAt must not be null");
    }

    // === Factory methods ===

    /**
     * Creates a configuration failure.
     */
    public static Failure configuration(FailureId id, String message, String operation, Throwable exception) {
        return new Failure(id, message, FailureType.CONFIGURATION, operation, Instant.now(), exception);
    }

    /**
     * Creates a failure for a task that threw a checked exception.
     */
    public static Failure task(String operation, Throwable exception) {
        return new Failure(FailureId.TASK_FAILED, describe(exception), FailureType.TASK,
                operation, Instant.now(), exception);
    }

    /**
     * Creates a failure for a task that threw an unchecked exception.
     */
    public static Failure defect(String operation, Throwable exception) {
        return new Failure(FailureId.TASK_DEFECT, describe(exception), FailureType.DEFECT,
                operation, Instant.now(), exception);
    }

    /**
     * Creates a cancellation failure.
     */
    public static Failure cancelled(String operation) {
        return new Failure(FailureId.CANCELLED, "execution context cancelled", FailureType.CANCELLED,
                operation, Instant.now(), null);
    }

    /**
     * Returns true for the failure types the run loop may retry.
     */
    public boolean isRetryable() {
        return type == FailureType.TASK || type == FailureType.DEFECT;
    }

    private static String describe(Throwable exception) {
        if (exception == null) {
            return "task failed";
        }
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }
}
