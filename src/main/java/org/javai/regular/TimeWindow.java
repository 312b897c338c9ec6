package org.javai.regular;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A daily time-of-day window during which the scheduled task should run.
 *
 * <pre>{@code
 * // Business hours
 * TimeWindow.parse("09:00", "17:00")
 *
 * // Overnight, wraps midnight
 * new TimeWindow(22, 0, 6, 0)
 * }</pre>
 *
 * <p>When the end lies before the start, the window wraps across midnight. A window whose
 * start equals its end is always started and never ended as far as {@link #check} is
 * concerned.
 *
 * @param startHour the starting hour (0-23)
 * @param startMinute the starting minute (0-59)
 * @param endHour the ending hour (0-23)
 * @param endMinute the ending minute (0-59)
 */
public record TimeWindow(int startHour, int startMinute, int endHour, int endMinute) {

    private static final Pattern CLOCK = Pattern.compile("(\\d{1,2}):(\\d{2})");

    /**
     * Canonical constructor with validation.
     */
    public TimeWindow {
        requireClock("start", startHour, startMinute);
        requireClock("end", endHour, endMinute);
    }

    /**
     * Parses a window from two {@code "HH:MM"} strings.
     *
     * @param start the start of the window, e.g. {@code "22:00"}
     * @param end the end of the window, e.g. {@code "06:00"}
     * @return the parsed window, or a {@link FailureType#CONFIGURATION} failure naming the bad field
     */
    public static Outcome<TimeWindow> parse(String start, String end) {
        Outcome<int[]> startClock = parseClock("start", start);
        if (startClock instanceof Outcome.Fail<int[]> fail) {
            return Outcome.fail(fail.failure());
        }
        Outcome<int[]> endClock = parseClock("end", end);
        if (endClock instanceof Outcome.Fail<int[]> fail) {
            return Outcome.fail(fail.failure());
        }
        int[] s = startClock.getOrThrow();
        int[] e = endClock.getOrThrow();
        return Outcome.ok(new TimeWindow(s[0], s[1], e[0], e[1]));
    }

    public LocalTime start() {
        return LocalTime.of(startHour, startMinute);
    }

    public LocalTime end() {
        return LocalTime.of(endHour, endMinute);
    }

    /**
     * True when the window crosses midnight.
     */
    public boolean wraps() {
        return start().isAfter(end());
    }

    public WindowState check(LocalTime now) {
        return check(now.getHour(), now.getMinute());
    }

    public WindowState check(int currentHour, int currentMinute) {
        return check(startHour, startMinute, endHour, endMinute, currentHour, currentMinute);
    }

    /**
     * Decides whether "now" has reached the start and end boundaries of a window.
     *
     * <p>All values are compared as times of day on one synthetic day:
     * <ul>
     *   <li>start == end: always started, never ended;</li>
     *   <li>start before end: started once now &ge; start, ended once now &ge; end;</li>
     *   <li>start after end (wraps midnight): ended once now &ge; end; started when now &ge; start
     *       or the end has not been reached yet, and a started window is never reported ended.</li>
     * </ul>
     */
    public static WindowState check(int startHour, int startMinute, int endHour, int endMinute,
                                    int currentHour, int currentMinute) {
        int startTime = minuteOfDay(startHour, startMinute);
        int endTime = minuteOfDay(endHour, endMinute);
        int currentTime = minuteOfDay(currentHour, currentMinute);

        if (startTime == endTime) {
            return new WindowState(true, false);
        }
        if (startTime < endTime) {
            return new WindowState(currentTime >= startTime, currentTime >= endTime);
        }
        boolean ended = currentTime >= endTime;
        if (currentTime >= startTime || !ended) {
            return new WindowState(true, false);
        }
        return new WindowState(false, true);
    }

    @Override
    public String toString() {
        return "%02d:%02d-%02d:%02d".formatted(startHour, startMinute, endHour, endMinute);
    }

    private static int minuteOfDay(int hour, int minute) {
        return hour * 60 + minute;
    }

    private static Outcome<int[]> parseClock(String field, String value) {
        if (value == null) {
            return invalid(field, value, "value is missing");
        }
        Matcher matcher = CLOCK.matcher(value.trim());
        if (!matcher.matches()) {
            return invalid(field, value, "expected HH:MM");
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23) {
            return invalid(field, value, "hour must be between 0 and 23");
        }
        if (minute > 59) {
            return invalid(field, value, "minute must be between 0 and 59");
        }
        return Outcome.ok(new int[] {hour, minute});
    }

    private static <T> Outcome<T> invalid(String field, String value, String reason) {
        return Outcome.fail(Failure.configuration(
                FailureId.INVALID_WINDOW,
                field + " time '" + value + "' is invalid: " + reason,
                "TimeWindow.parse",
                null));
    }

    private static void requireClock(String label, int hour, int minute) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(label + " hour must be between 0 and 23, got: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException(label + " minute must be between 0 and 59, got: " + minute);
        }
    }
}
