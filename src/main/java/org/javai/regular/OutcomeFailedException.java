package org.javai.regular;

/**
 * Thrown by {@link Outcome#getOrThrow()} when the outcome is a failure.
 */
public class OutcomeFailedException extends RuntimeException {

    private final Failure failure;

    public OutcomeFailedException(Failure failure) {
        super(failure.id() + ": " + failure.message(), failure.exception());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }
}
