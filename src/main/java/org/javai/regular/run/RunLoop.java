package org.javai.regular.run;

import org.javai.regular.ExecutionContext;
import org.javai.regular.Failure;
import org.javai.regular.Outcome;
import org.javai.regular.Task;
import org.javai.regular.config.ScheduleConfig;
import org.javai.regular.ops.OpReporter;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Invokes a task over and over, pausing between invocations according to the live config.
 *
 * <p>After a success the loop waits {@link ScheduleConfig#successDelay()}, after a failure
 * {@link ScheduleConfig#failureDelay()}. A negative delay ends the loop: with the success
 * outcome after a success, with the failure after a failure. Otherwise the loop only ends
 * when its context is cancelled, which is checked before every invocation.
 *
 * <p>The config is read through a supplier on every iteration, so a replacement takes
 * effect at the next decision. A pause that has already started is not shortened or
 * lengthened by a replacement.
 */
public final class RunLoop {

    private final Supplier<ScheduleConfig> config;
    private final TaskBoundary boundary;
    private final OpReporter reporter;
    private final Sleeper sleeper;

    public RunLoop(Supplier<ScheduleConfig> config, OpReporter reporter, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.boundary = new TaskBoundary(reporter);
    }

    /**
     * Runs the task until a negative delay or cancellation stops it.
     *
     * @param context cancellation scope for the loop and the task
     * @param task the task to invoke
     * @return Ok after a success with a negative success delay; the task's failure after a
     *         failure with a negative failure delay; a {@code CANCELLED} failure otherwise
     */
    public Outcome<Void> execute(ExecutionContext context, Task task) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(task, "task must not be null");

        int consecutiveFailures = 0;
        long invocations = 0;
        while (true) {
            ScheduleConfig current = config.get();
            if (context.isCancelled()) {
                return Outcome.fail(Failure.cancelled(current.name()));
            }

            invocations++;
            Outcome<Void> result = boundary.invoke(current.name(), context, task);

            if (result instanceof Outcome.Fail<Void> fail) {
                Failure failure = fail.failure();
                if (!failure.isRetryable()) {
                    return result;
                }
                consecutiveFailures++;
                current = config.get();
                if (!(current.afterFailure() instanceof RunDecision.Continue next)) {
                    return result;
                }
                reporter.reportRetryScheduled(current.name(), failure, consecutiveFailures, next.delay());
                if (!pause(context, next.delay())) {
                    return Outcome.fail(Failure.cancelled(current.name()));
                }
                continue;
            }

            consecutiveFailures = 0;
            current = config.get();
            if (!(current.afterSuccess() instanceof RunDecision.Continue next)) {
                return result;
            }
            reporter.reportContinueScheduled(current.name(), invocations, next.delay());
            if (!pause(context, next.delay())) {
                return Outcome.fail(Failure.cancelled(current.name()));
            }
        }
    }

    /**
     * @return false if the thread was interrupted while sleeping
     */
    private boolean pause(ExecutionContext context, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(context, delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
