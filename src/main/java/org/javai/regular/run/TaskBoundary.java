package org.javai.regular.run;

import org.javai.regular.ExecutionContext;
import org.javai.regular.Failure;
import org.javai.regular.Outcome;
import org.javai.regular.Task;
import org.javai.regular.ops.OpReporter;

import java.util.Objects;

/**
 * Invokes a {@link Task} and translates whatever it throws into an {@link Outcome}.
 *
 * <p>Checked exceptions become {@code TASK} failures and unchecked exceptions become
 * {@code DEFECT} failures; both are reported. An interruption, or any exception thrown after
 * the context was cancelled, becomes a {@code CANCELLED} failure and is not reported.
 * {@link Error}s propagate.
 */
public final class TaskBoundary {

    private final OpReporter reporter;

    public TaskBoundary(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Runs the task once.
     *
     * @param operation the engine name, used for reporting
     * @param context the context handed to the task
     * @param task the task
     * @return Ok when the task returned normally, otherwise Fail with a classified failure
     */
    public Outcome<Void> invoke(String operation, ExecutionContext context, Task task) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(task, "task must not be null");

        try {
            task.run(context);
            return Outcome.ok();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail(Failure.cancelled(operation));
        } catch (RuntimeException e) {
            return handle(context, Failure.defect(operation, e));
        } catch (Exception e) {
            return handle(context, Failure.task(operation, e));
        }
    }

    private Outcome<Void> handle(ExecutionContext context, Failure failure) {
        if (context.isCancelled()) {
            return Outcome.fail(Failure.cancelled(failure.operation()));
        }
        reporter.report(failure);
        return Outcome.fail(failure);
    }
}
