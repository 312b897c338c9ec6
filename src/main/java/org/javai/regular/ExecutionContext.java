package org.javai.regular;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A cancellation scope passed to tasks and loops.
 *
 * <p>Contexts form a tree. Cancelling a context cancels all of its descendants; cancelling a
 * child leaves its parent untouched. Cancellation is one-way and idempotent.
 *
 * <pre>{@code
 * ExecutionContext root = ExecutionContext.background();
 * ExecutionContext window = root.withCancel();
 *
 * window.cancel();           // root keeps running
 * root.cancel();             // cancels every remaining child
 * }</pre>
 */
public final class ExecutionContext {

    private static final Duration LONGEST_WAIT = Duration.ofNanos(Long.MAX_VALUE);

    private final ExecutionContext parent;
    private final CountDownLatch done = new CountDownLatch(1);
    private final List<ExecutionContext> children = new CopyOnWriteArrayList<>();

    private ExecutionContext(ExecutionContext parent) {
        this.parent = parent;
    }

    /**
     * Creates a new root context that is cancelled only through {@link #cancel()}.
     */
    public static ExecutionContext background() {
        return new ExecutionContext(null);
    }

    /**
     * Derives a child context. If this context is already cancelled, so is the child.
     */
    public ExecutionContext withCancel() {
        ExecutionContext child = new ExecutionContext(this);
        children.add(child);
        // cancel() may have run between the add and here
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    /**
     * Cancels this context and all of its descendants.
     *
     * @return true if this call performed the cancellation, false if it was already cancelled
     */
    public boolean cancel() {
        synchronized (done) {
            if (done.getCount() == 0) {
                return false;
            }
            done.countDown();
        }
        for (ExecutionContext child : children) {
            child.cancel();
        }
        children.clear();
        if (parent != null) {
            parent.children.remove(this);
        }
        return true;
    }

    public boolean isCancelled() {
        return done.getCount() == 0;
    }

    /**
     * Blocks until this context is cancelled or the timeout elapses. Timeouts beyond about
     * 292 years wait as long as {@code Long.MAX_VALUE} nanoseconds.
     *
     * @return true if the context was cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isNegative() || timeout.isZero()) {
            return isCancelled();
        }
        long nanos = timeout.compareTo(LONGEST_WAIT) > 0 ? Long.MAX_VALUE : timeout.toNanos();
        return done.await(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Blocks until this context is cancelled.
     */
    public void awaitCancellation() throws InterruptedException {
        done.await();
    }
}
