package org.javai.regular;

import java.util.Objects;

/**
 * A unit of work the engine invokes repeatedly.
 *
 * <p>A task reports failure by throwing. Long-running tasks should poll
 * {@link ExecutionContext#isCancelled()} so that a window end or shutdown can stop them.
 */
@FunctionalInterface
public interface Task {

    /**
     * Runs the task once.
     *
     * @param context cancelled when the task's window ends or the engine shuts down
     * @throws Exception if the task failed
     */
    void run(ExecutionContext context) throws Exception;

    /**
     * Adapts a plain {@link Runnable} that ignores the context.
     */
    static Task of(Runnable runnable) {
        Objects.requireNonNull(runnable, "runnable must not be null");
        return context -> runnable.run();
    }
}
