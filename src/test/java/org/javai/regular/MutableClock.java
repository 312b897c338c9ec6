package org.javai.regular;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A UTC clock tests can move while the engine is running.
 */
public final class MutableClock extends Clock {

    private static final LocalDate DAY = LocalDate.of(2026, 10, 18);

    private volatile Instant instant;

    private MutableClock(Instant instant) {
        this.instant = instant;
    }

    public static MutableClock at(int hour, int minute) {
        return at(hour, minute, 0);
    }

    public static MutableClock at(int hour, int minute, int second) {
        return new MutableClock(DAY.atTime(LocalTime.of(hour, minute, second)).toInstant(ZoneOffset.UTC));
    }

    public void set(int hour, int minute) {
        instant = DAY.atTime(LocalTime.of(hour, minute)).toInstant(ZoneOffset.UTC);
    }

    public void nextDay(int hour, int minute) {
        instant = DAY.plusDays(1).atTime(LocalTime.of(hour, minute)).toInstant(ZoneOffset.UTC);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        throw new UnsupportedOperationException("MutableClock is always UTC");
    }

    @Override
    public Instant instant() {
        return instant;
    }
}
