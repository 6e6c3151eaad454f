package io.surfworks.hybridforge.report;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock for measuring stage and transfer durations.
 *
 * <p>Instants are derived from {@link System#nanoTime()} relative to the
 * moment the clock was created, so they never go backwards when the system
 * time is adjusted. Only differences between instants are meaningful.
 */
public final class MonotonicClock extends Clock {

    private final Instant origin;
    private final long originNanos;

    public MonotonicClock() {
        this.origin = Instant.now();
        this.originNanos = System.nanoTime();
    }

    @Override
    public Instant instant() {
        return origin.plusNanos(System.nanoTime() - originNanos);
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }

    /**
     * Returns the time from {@code start} to now on the given clock, or zero
     * if the clock reads earlier than {@code start}.
     */
    public static Duration elapsedSince(Clock clock, Instant start) {
        Duration elapsed = Duration.between(start, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }
}
