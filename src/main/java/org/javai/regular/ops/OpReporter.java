package org.javai.regular.ops;

import org.javai.regular.Failure;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;

import java.time.Duration;

/**
 * Receives what the engine does, for logging and operator notification.
 * Implementations must be safe for use from several threads.
 *
 * <p>Every method except {@link #report(Failure)} defaults to a no-op.
 */
public interface OpReporter {

    /**
     * Reports a task failure.
     */
    void report(Failure failure);

    /**
     * The run loop will invoke the task again after a failure.
     *
     * @param name the engine name
     * @param failure the failure that triggered the retry
     * @param consecutiveFailures failures in a row so far (1-based)
     * @param delay the pause before the next invocation
     */
    default void reportRetryScheduled(String name, Failure failure, int consecutiveFailures, Duration delay) {
    }

    /**
     * The run loop will invoke the task again after a success.
     *
     * @param name the engine name
     * @param invocations invocations made by this run loop so far
     * @param delay the pause before the next invocation
     */
    default void reportContinueScheduled(String name, long invocations, Duration delay) {
    }

    /**
     * The engine is waiting for the top of the minute before scheduling.
     */
    default void reportAlignmentWait(String name, Duration wait) {
    }

    /**
     * The polling loop is looking for a window to open.
     */
    default void reportPolling(String name) {
    }

    default void reportWindowOpened(String name, TimeWindow window) {
    }

    default void reportWindowClosed(String name, TimeWindow window) {
    }

    /**
     * A window's run loop returned.
     *
     * @param outcome Ok, the task's fatal failure, or a {@code CANCELLED} failure
     */
    default void reportRunEnded(String name, TimeWindow window, Outcome<Void> outcome) {
    }

    /**
     * The engine left its polling loop after a shutdown.
     */
    default void reportStopped(String name) {
    }

    /**
     * A reporter that does nothing. The default when no reporter is given.
     */
    static OpReporter noOp() {
        return failure -> {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     */
    static OpReporter composite(OpReporter... reporters) {
        return CompositeOpReporter.of(reporters);
    }
}
