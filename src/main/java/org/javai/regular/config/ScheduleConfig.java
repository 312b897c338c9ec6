package org.javai.regular.config;

import org.javai.regular.Failure;
import org.javai.regular.FailureId;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;
import org.javai.regular.run.RunDecision;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A validated, immutable schedule as installed in an engine.
 *
 * @param name the task name, never blank
 * @param windows parsed daily windows, in configuration order
 * @param successDelay pause after a success; negative means stop
 * @param failureDelay pause after a failure; negative means fail immediately
 */
public record ScheduleConfig(
        String name,
        List<TimeWindow> windows,
        Duration successDelay,
        Duration failureDelay
) {

    public static final String DEFAULT_NAME = "regular";

    public ScheduleConfig {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(successDelay, "successDelay must not be null");
        Objects.requireNonNull(failureDelay, "failureDelay must not be null");
        windows = List.copyOf(windows);
    }

    /**
     * Validates a raw config. Every window is parsed in order; the first bad one rejects the
     * whole config with a failure naming its position.
     */
    public static Outcome<ScheduleConfig> parse(EngineConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        List<TimeWindow> windows = new ArrayList<>(config.windows().size());
        for (int i = 0; i < config.windows().size(); i++) {
            WindowSpec spec = config.windows().get(i);
            Outcome<TimeWindow> window = spec == null
                    ? TimeWindow.parse(null, null)
                    : spec.parse();
            if (window instanceof Outcome.Fail<TimeWindow> fail) {
                return Outcome.fail(Failure.configuration(
                        FailureId.INVALID_WINDOW,
                        "time window " + i + " is invalid: " + fail.failure().message(),
                        "ScheduleConfig.parse",
                        fail.failure().exception()));
            }
            windows.add(window.getOrThrow());
        }

        String name = config.name() == null || config.name().isBlank() ? DEFAULT_NAME : config.name();
        return Outcome.ok(new ScheduleConfig(
                name,
                windows,
                Duration.ofMillis(config.successDelayMillis()),
                Duration.ofMillis(config.failureDelayMillis())));
    }

    public boolean continuous() {
        return windows.isEmpty();
    }

    /**
     * What the run loop does after a successful invocation.
     */
    public RunDecision afterSuccess() {
        return RunDecision.forDelay(successDelay);
    }

    /**
     * What the run loop does after a failed invocation.
     */
    public RunDecision afterFailure() {
        return RunDecision.forDelay(failureDelay);
    }
}
