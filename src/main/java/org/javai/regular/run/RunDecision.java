package org.javai.regular.run;

import java.time.Duration;
import java.util.Objects;

/**
 * What the run loop does after an invocation.
 */
public sealed interface RunDecision permits RunDecision.Continue, RunDecision.Stop {

    /**
     * Invoke the task again after waiting for the specified delay.
     */
    record Continue(Duration delay) implements RunDecision {
        public Continue {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }

        public static Continue immediately() {
            return new Continue(Duration.ZERO);
        }

        public static Continue after(Duration delay) {
            return new Continue(delay);
        }
    }

    /**
     * Leave the loop.
     */
    record Stop() implements RunDecision {}

    /**
     * Maps a configured delay to a decision: negative stops, anything else continues.
     */
    static RunDecision forDelay(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        return delay.isNegative() ? new Stop() : Continue.after(delay);
    }
}
