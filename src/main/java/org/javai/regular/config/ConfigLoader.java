package org.javai.regular.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.regular.Failure;
import org.javai.regular.FailureId;
import org.javai.regular.Outcome;
import org.javai.regular.ops.OpReporterUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads an {@link EngineConfig} from JSON.
 *
 * <pre>{@code
 * {
 *   "name": "sync",
 *   "windows": [ { "start": "22:00", "end": "06:00" } ],
 *   "successDelayMillis": 300000,
 *   "failureDelayMillis": 30000
 * }
 * }</pre>
 *
 * <p>Unknown fields are ignored; missing delays default to 0. Window strings are not
 * validated here, that happens when the config is installed.
 */
public final class ConfigLoader {

    public static final String CONFIG_PROPERTY = "regular.config";
    public static final String CONFIG_ENV = "REGULAR_CONFIG";

    private final ObjectMapper objectMapper;

    public ConfigLoader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false));
    }

    public ConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public Outcome<EngineConfig> parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return Outcome.ok(objectMapper.readValue(json, EngineConfig.class));
        } catch (JsonProcessingException e) {
            return unreadable("config is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Outcome<EngineConfig> load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            return Outcome.ok(objectMapper.readValue(Files.readString(path), EngineConfig.class));
        } catch (JsonProcessingException e) {
            return unreadable(path + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            return unreadable("cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Loads the file named by system property {@value #CONFIG_PROPERTY}, or environment
     * variable {@value #CONFIG_ENV} when the property is not set.
     *
     * @throws IllegalStateException if neither is set
     */
    public Outcome<EngineConfig> fromEnvironment() {
        return load(Path.of(OpReporterUtils.resolveConfig(CONFIG_PROPERTY, CONFIG_ENV)));
    }

    private static <T> Outcome<T> unreadable(String message, Exception e) {
        return Outcome.fail(Failure.configuration(FailureId.UNREADABLE_CONFIG, message, "ConfigLoader", e));
    }
}
