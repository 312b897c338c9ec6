package org.javai.regular.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;

/**
 * The external form of a time window: a pair of {@code "HH:MM"} strings.
 *
 * @param start when the window opens, e.g. {@code "09:00"}
 * @param end when the window closes, e.g. {@code "17:30"}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WindowSpec(
        @JsonProperty("start") String start,
        @JsonProperty("end") String end
) {

    public static WindowSpec of(String start, String end) {
        return new WindowSpec(start, end);
    }

    public Outcome<TimeWindow> parse() {
        return TimeWindow.parse(start, end);
    }
}
