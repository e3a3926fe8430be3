package org.caureq.nodetelemetry.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class PeriodicTaskTest {

    private final Clock clock = Clock.systemUTC();

    @Test
    void failingBodyIsRecordedNotThrown() {
        var calls = new AtomicInteger();
        var task = new PeriodicTask("publish", Duration.ofMinutes(5), () -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("store locked");
        }, clock);

        assertDoesNotThrow(task::run);
        var failed = task.status();
        assertEquals(PeriodicTask.Outcome.FAILED, failed.lastOutcome());
        assertEquals("store locked", failed.lastError());
        assertEquals(PeriodicTask.State.IDLE, failed.state());

        task.run();
        var ok = task.status();
        assertEquals(PeriodicTask.Outcome.OK, ok.lastOutcome());
        assertNull(ok.lastError());
        assertEquals(2, ok.runs());
    }

    @Test
    void neverRunTaskHasNoTimestamps() {
        var status = new PeriodicTask("rollup-daily", Duration.ofDays(1), () -> { }, clock).status();

        assertEquals(PeriodicTask.Outcome.NEVER_RUN, status.lastOutcome());
        assertNull(status.lastStarted());
        assertEquals(0, status.runs());
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> new PeriodicTask("x", Duration.ZERO, () -> { }, clock));
        assertThrows(IllegalArgumentException.class, () -> new PeriodicTask("x", Duration.ofSeconds(-1), () -> { }, clock));
        assertThrows(IllegalArgumentException.class, () -> new PeriodicTask("x", null, () -> { }, clock));
    }
}
