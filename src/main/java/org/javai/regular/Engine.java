package org.javai.regular;

import org.javai.regular.config.ConfigCell;
import org.javai.regular.config.EngineConfig;
import org.javai.regular.config.ScheduleConfig;
import org.javai.regular.ops.OpReporter;
import org.javai.regular.ops.OperationalExceptionHandler;
import org.javai.regular.run.RunLoop;
import org.javai.regular.run.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a task repeatedly, either continuously or inside daily time windows.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Engine engine = Engine.create(
 *         EngineConfig.builder()
 *             .name("sync")
 *             .window("22:00", "06:00")
 *             .successDelay(Duration.ofMinutes(5))
 *             .failureDelay(Duration.ofSeconds(30))
 *             .build(),
 *         new Log4jOpReporter())
 *     .getOrThrow();
 *
 * // blocks until shutdown() is called from another thread
 * Outcome<Void> result = engine.start(ExecutionContext.background(), context -> sync.run());
 * }</pre>
 *
 * <p>With no windows configured, {@link #start} runs the task loop directly and returns what
 * it returns. With windows, {@code start} first waits for the top of the minute, then checks
 * once per minute whether a window has opened or closed. An opened window gets its own run
 * loop on a worker thread under a child context; when the window ends that context is
 * cancelled. Only one window is active at a time.
 *
 * <p>The config can be replaced at any time with {@link #setConfig}; loops pick up the new
 * values at their next decision.
 */
public final class Engine {

    static final Duration POLL_INTERVAL = Duration.ofMinutes(1);

    private final ConfigCell config;
    private final OpReporter reporter;
    private final Clock clock;
    private final Duration pollInterval;
    private final RunLoop runLoop;
    private final OperationalExceptionHandler exceptionHandler;
    private final AtomicReference<ExecutionContext> session = new AtomicReference<>();

    private Engine(ScheduleConfig initial, OpReporter reporter, Clock clock, Sleeper sleeper, Duration pollInterval) {
        this.config = new ConfigCell(initial);
        this.reporter = reporter;
        this.clock = clock;
        this.pollInterval = pollInterval;
        this.runLoop = new RunLoop(config::get, reporter, sleeper);
        this.exceptionHandler = new OperationalExceptionHandler(reporter);
    }

    /**
     * Creates an engine that reports nothing.
     *
     * @return the engine, or a {@link FailureType#CONFIGURATION} failure
     */
    public static Outcome<Engine> create(EngineConfig config) {
        return builder().config(config).build();
    }

    /**
     * Creates an engine reporting to the given reporter; null means {@link OpReporter#noOp()}.
     *
     * @return the engine, or a {@link FailureType#CONFIGURATION} failure
     */
    public static Outcome<Engine> create(EngineConfig config, OpReporter reporter) {
        return builder().config(config).reporter(reporter).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates and installs a new config. A null config is ignored.
     *
     * <p>If any window fails to parse, nothing is installed and the failure names the
     * window's position.
     */
    public Outcome<Void> setConfig(EngineConfig next) {
        if (next == null) {
            return Outcome.ok();
        }
        return ScheduleConfig.parse(next).map(parsed -> {
            config.replace(parsed);
            return null;
        });
    }

    /**
     * Returns the installed config. The snapshot is immutable.
     */
    public ScheduleConfig getConfig() {
        return config.get();
    }

    /**
     * True between the start of {@link #start} and its return.
     */
    public boolean isRunning() {
        return session.get() != null;
    }

    /**
     * Runs the schedule, blocking the calling thread until it stops.
     *
     * @param context cancelling it stops the engine like {@link #shutdown()}
     * @param task the work to invoke
     * @return Ok after a shutdown or a one-shot success; the task's failure when the failure
     *         delay is negative and no windows are configured; a {@code CANCELLED} failure when
     *         {@code context} was cancelled before or during a continuous run
     * @throws IllegalStateException if another {@code start} call on this engine has not returned
     */
    public Outcome<Void> start(ExecutionContext context, Task task) {
        Objects.requireNonNull(context, "context must not be null");
        Objects.requireNonNull(task, "task must not be null");

        ExecutionContext current = context.withCancel();
        if (!session.compareAndSet(null, current)) {
            current.cancel();
            throw new IllegalStateException("engine '" + name() + "' is already running");
        }
        try {
            if (context.isCancelled()) {
                return Outcome.fail(Failure.cancelled(name()));
            }
            if (!alignToMinute(current)) {
                reporter.reportStopped(name());
                return Outcome.ok();
            }
            if (config.get().continuous()) {
                return runContinuously(context, current, task);
            }
            return poll(current, task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.fail(Failure.cancelled(name()));
        } finally {
            session.compareAndSet(current, null);
            current.cancel();
        }
    }

    /**
     * Stops the current {@link #start} call and any active window. Returns without waiting.
     * Does nothing when the engine is not running; safe to call repeatedly.
     */
    public void shutdown() {
        ExecutionContext current = session.get();
        if (current != null) {
            current.cancel();
        }
    }

    private String name() {
        return config.get().name();
    }

    /**
     * Waits until the clock's second is 0, so that minute ticks line up with window edges.
     *
     * @return false if the session was cancelled while waiting
     */
    private boolean alignToMinute(ExecutionContext current) throws InterruptedException {
        while (true) {
            int second = LocalTime.now(clock).getSecond();
            if (second == 0) {
                return true;
            }
            Duration wait = Duration.ofSeconds(60 - second);
            reporter.reportAlignmentWait(name(), wait);
            if (current.await(wait)) {
                return false;
            }
        }
    }

    private Outcome<Void> runContinuously(ExecutionContext caller, ExecutionContext current, Task task) {
        Outcome<Void> outcome = runLoop.execute(current, task);
        if (outcome.failedWith(FailureType.CANCELLED) && current.isCancelled() && !caller.isCancelled()) {
            reporter.reportStopped(name());
            return Outcome.ok();
        }
        return outcome;
    }

    /**
     * The polling loop. {@code active} is only read and written on this thread; window worker
     * threads never touch it, which is why it needs no lock.
     *
     * <p>Ticks run at a fixed rate from the aligned start, so time spent scanning and reporting
     * does not push later ticks off the minute boundary.
     */
    private Outcome<Void> poll(ExecutionContext current, Task task) throws InterruptedException {
        ExecutorService workers = Executors.newCachedThreadPool(exceptionHandler.threadFactory(name() + "-window"));
        ActiveWindow active = null;
        long tickNanos = pollInterval.toNanos();
        long nextTick = System.nanoTime();
        try {
            while (true) {
                ScheduleConfig snapshot = config.get();
                if (active != null && !active.isConfiguredIn(snapshot)) {
                    active = close(snapshot.name(), active);
                }
                if (active == null) {
                    reporter.reportPolling(snapshot.name());
                }

                LocalTime now = LocalTime.now(clock);
                for (TimeWindow window : snapshot.windows()) {
                    if (active != null && !active.owns(window)) {
                        continue;
                    }
                    WindowState state = window.check(now);
                    if (state.isOpen() && active == null) {
                        active = open(snapshot.name(), window, current, task, workers);
                        break;
                    }
                    if (state.ended() && active != null) {
                        active = close(snapshot.name(), active);
                    }
                }

                nextTick = nextTick(nextTick, tickNanos);
                if (current.await(Duration.ofNanos(nextTick - System.nanoTime()))) {
                    if (active != null) {
                        active.context().cancel();
                    }
                    reporter.reportStopped(name());
                    return Outcome.ok();
                }
            }
        } finally {
            workers.shutdown();
        }
    }

    /**
     * Advances the deadline by one tick. Ticks missed by a slow scan are dropped rather than
     * run back to back.
     */
    private static long nextTick(long previous, long tickNanos) {
        long next = previous + tickNanos;
        long now = System.nanoTime();
        if (next - now <= 0) {
            next += ((now - next) / tickNanos + 1) * tickNanos;
        }
        return next;
    }

    private ActiveWindow open(String name, TimeWindow window, ExecutionContext current, Task task,
                              ExecutorService workers) {
        ExecutionContext windowContext = current.withCancel();
        reporter.reportWindowOpened(name, window);
        workers.execute(() -> {
            Outcome<Void> outcome = runLoop.execute(windowContext, task);
            reporter.reportRunEnded(name(), window, outcome);
        });
        return new ActiveWindow(window.start(), window, windowContext);
    }

    private ActiveWindow close(String name, ActiveWindow active) {
        active.context().cancel();
        reporter.reportWindowClosed(name, active.window());
        return null;
    }

    /**
     * The window whose run loop is executing. Identified by its start time, so a config
     * replacement that only moves the end keeps the window running.
     */
    private record ActiveWindow(LocalTime token, TimeWindow window, ExecutionContext context) {

        boolean owns(TimeWindow candidate) {
            return token.equals(candidate.start());
        }

        boolean isConfiguredIn(ScheduleConfig snapshot) {
            return snapshot.windows().stream().anyMatch(this::owns);
        }
    }

    /**
     * Builder for an {@link Engine}.
     */
    public static final class Builder {
        private EngineConfig config;
        private OpReporter reporter = OpReporter.noOp();
        private Clock clock = Clock.systemDefaultZone();
        private Sleeper sleeper = Sleeper.cancellable();
        private Duration pollInterval = POLL_INTERVAL;

        private Builder() {}

        /**
         * Sets the initial config (required).
         */
        public Builder config(EngineConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the reporter (optional, defaults to no-op; null also means no-op).
         */
        public Builder reporter(OpReporter reporter) {
            this.reporter = reporter == null ? OpReporter.noOp() : reporter;
            return this;
        }

        /**
         * Sets the clock windows are evaluated against (optional, defaults to the system clock
         * in the default time zone).
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets how the run loop pauses between invocations (optional, defaults to
         * {@link Sleeper#cancellable()}).
         */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Sets the polling tick for testing (package-private).
         */
        Builder pollInterval(Duration pollInterval) {
            Objects.requireNonNull(pollInterval, "pollInterval must not be null");
            if (pollInterval.isZero() || pollInterval.isNegative()) {
                throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
            }
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Builds the engine.
         *
         * @return the engine, or a {@link FailureType#CONFIGURATION} failure
         * @throws NullPointerException if config has not been set
         */
        public Outcome<Engine> build() {
            Objects.requireNonNull(config, "config must be set");
            return ScheduleConfig.parse(config)
                    .map(initial -> new Engine(initial, reporter, clock, sleeper, pollInterval));
        }
    }
}
