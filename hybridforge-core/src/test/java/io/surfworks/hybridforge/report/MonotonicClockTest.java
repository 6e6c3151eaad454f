package io.surfworks.hybridforge.report;

import io.surfworks.hybridforge.testing.ManualClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MonotonicClockTest {

    @Test
    void instantsNeverDecrease() {
        MonotonicClock clock = new MonotonicClock();
        Instant previous = clock.instant();
        for (int i = 0; i < 10_000; i++) {
            Instant next = clock.instant();
            assertFalse(next.isBefore(previous));
            previous = next;
        }
    }

    @Test
    void elapsedSinceMeasuresForwardTime() {
        ManualClock clock = new ManualClock();
        Instant start = clock.instant();
        clock.advance(Duration.ofMillis(1500));

        assertEquals(Duration.ofMillis(1500), MonotonicClock.elapsedSince(clock, start));
    }

    @Test
    void elapsedSinceIsZeroWhenClockReadsEarlier() {
        ManualClock clock = new ManualClock();
        Instant start = clock.instant().plusSeconds(5);

        assertEquals(Duration.ZERO, MonotonicClock.elapsedSince(clock, start));
    }
}
