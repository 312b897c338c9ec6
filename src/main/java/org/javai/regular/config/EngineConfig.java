package org.javai.regular.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Schedule description as supplied by the caller, before validation.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * EngineConfig config = EngineConfig.builder()
 *     .name("sync")
 *     .window("22:00", "06:00")
 *     .successDelay(Duration.ofMinutes(5))
 *     .failureDelay(Duration.ofSeconds(30))
 *     .build();
 * }</pre>
 *
 * <p>The same structure can be read from JSON with {@link ConfigLoader}.
 *
 * @param name the task name used in log output; blank means {@code "regular"}
 * @param windows daily windows to run in; null or empty means "run continuously"
 * @param successDelayMillis pause after a success; negative means stop after one success
 * @param failureDelayMillis pause after a failure; negative means fail immediately without retrying
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
        @JsonProperty("name") String name,
        @JsonProperty("windows") List<WindowSpec> windows,
        @JsonProperty("successDelayMillis") long successDelayMillis,
        @JsonProperty("failureDelayMillis") long failureDelayMillis
) {

    public EngineConfig {
        // null entries are kept so validation can report them by position
        windows = windows == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(windows));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private final List<WindowSpec> windows = new ArrayList<>();
        private long successDelayMillis;
        private long failureDelayMillis;

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Adds a daily window given as two {@code "HH:MM"} strings.
         */
        public Builder window(String start, String end) {
            windows.add(new WindowSpec(start, end));
            return this;
        }

        public Builder successDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay must not be null");
            this.successDelayMillis = delay.toMillis();
            return this;
        }

        public Builder successDelayMillis(long millis) {
            this.successDelayMillis = millis;
            return this;
        }

        public Builder failureDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay must not be null");
            this.failureDelayMillis = delay.toMillis();
            return this;
        }

        public Builder failureDelayMillis(long millis) {
            this.failureDelayMillis = millis;
            return this;
        }

        /**
         * Stop after the first successful invocation.
         */
        public Builder runOnce() {
            return successDelayMillis(-1);
        }

        /**
         * Return the first task failure instead of retrying.
         */
        public Builder noRetry() {
            return failureDelayMillis(-1);
        }

        public EngineConfig build() {
            return new EngineConfig(name, windows, successDelayMillis, failureDelayMillis);
        }
    }
}
