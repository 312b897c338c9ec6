package org.javai.regular.run;

import org.javai.regular.ExecutionContext;

import java.time.Duration;

/**
 * Pauses the run loop between invocations.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Sleeps for the given positive duration.
     */
    void sleep(ExecutionContext context, Duration duration) throws InterruptedException;

    /**
     * Wakes up early when the context is cancelled. The default.
     */
    static Sleeper cancellable() {
        return ExecutionContext::await;
    }

    /**
     * Always sleeps the full duration; cancellation is seen at the next loop iteration.
     */
    static Sleeper uninterruptible() {
        return (context, duration) -> Thread.sleep(duration.toMillis());
    }
}
