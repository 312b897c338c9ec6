package org.javai.regular;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ExecutionContextTest {

    @Test
    void background_isNotCancelled() {
        assertThat(ExecutionContext.background().isCancelled()).isFalse();
    }

    @Test
    void cancel_isIdempotent() {
        ExecutionContext context = ExecutionContext.background();

        assertThat(context.cancel()).isTrue();
        assertThat(context.cancel()).isFalse();
        assertThat(context.isCancelled()).isTrue();
    }

    @Test
    void cancel_propagatesToDescendants() {
        ExecutionContext root = ExecutionContext.background();
        ExecutionContext child = root.withCancel();
        ExecutionContext grandchild = child.withCancel();

        root.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(grandchild.isCancelled()).isTrue();
    }

    @Test
    void cancelChild_leavesParentAndSiblingsRunning() {
        ExecutionContext root = ExecutionContext.background();
        ExecutionContext first = root.withCancel();
        ExecutionContext second = root.withCancel();

        first.cancel();

        assertThat(root.isCancelled()).isFalse();
        assertThat(second.isCancelled()).isFalse();
    }

    @Test
    void withCancel_onCancelledParent_returnsCancelledChild() {
        ExecutionContext root = ExecutionContext.background();
        root.cancel();

        assertThat(root.withCancel().isCancelled()).isTrue();
    }

    @Test
    void await_timesOutWhenNotCancelled() throws InterruptedException {
        ExecutionContext context = ExecutionContext.background();

        assertThat(context.await(Duration.ofMillis(20))).isFalse();
        assertThat(context.await(Duration.ZERO)).isFalse();
    }

    @Test
    void await_returnsEarlyOnCancellation() throws InterruptedException {
        ExecutionContext context = ExecutionContext.background();
        CountDownLatch waiting = new CountDownLatch(1);
        Thread canceller = new Thread(() -> {
            try {
                waiting.await();
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            context.cancel();
        });
        canceller.start();

        long started = System.nanoTime();
        waiting.countDown();
        boolean cancelled = context.await(Duration.ofSeconds(10));

        assertThat(cancelled).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        canceller.join(TimeUnit.SECONDS.toMillis(1));
    }

    @Test
    void await_timeoutBeyondNanosecondRange_waitsForCancellation() throws InterruptedException {
        ExecutionContext context = ExecutionContext.background();
        Thread canceller = new Thread(() -> {
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            context.cancel();
        });
        canceller.start();

        assertThat(context.await(Duration.ofMillis(Long.MAX_VALUE))).isTrue();
        assertThat(context.await(Duration.ofSeconds(Long.MAX_VALUE))).isTrue();
        canceller.join(TimeUnit.SECONDS.toMillis(1));
    }

    @Test
    void awaitCancellation_returnsOnceParentCancelled() throws InterruptedException {
        ExecutionContext root = ExecutionContext.background();
        ExecutionContext child = root.withCancel();
        root.cancel();

        child.awaitCancellation();

        assertThat(child.isCancelled()).isTrue();
    }
}
