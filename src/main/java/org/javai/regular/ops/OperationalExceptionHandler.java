package org.javai.regular.ops;

import org.javai.regular.Failure;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reports throwables that escape a window worker thread.
 *
 * <p>The run loop turns every {@link Exception} from a task into an outcome, so what reaches
 * this handler is an {@link Error} or a bug in the engine itself.</p>
 *
 * <p>For thread pools:</p>
 * <pre>{@code
 * ExecutorService executor = Executors.newCachedThreadPool(handler.threadFactory("sync-window"));
 * }</pre>
 */
public final class OperationalExceptionHandler implements UncaughtExceptionHandler {

    private final OpReporter reporter;

    public OperationalExceptionHandler(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    @Override
    public void uncaughtException(Thread thread, Throwable throwable) {
        reporter.report(Failure.defect("UncaughtException:" + thread.getName(), throwable));
    }

    /**
     * Installs this handler on a specific thread.
     */
    public void installOn(Thread thread) {
        thread.setUncaughtExceptionHandler(this);
    }

    /**
     * Creates a ThreadFactory for daemon threads named {@code namePrefix-N} that carry this handler.
     */
    public ThreadFactory threadFactory(String namePrefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                installOn(thread);
                return thread;
            }
        };
    }
}
