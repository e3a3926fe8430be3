package org.caureq.nodetelemetry.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One periodic job: Idle -> Running -> Idle, forever.
 * {@link #run()} never throws; an exception escaping the body would cancel the
 * executor's periodic schedule, so it is logged and recorded as the last outcome instead.
 */
@Slf4j
public class PeriodicTask implements Runnable {
    public enum State { IDLE, RUNNING }
    public enum Outcome { NEVER_RUN, OK, FAILED }

    public record Status(String name, Duration interval, State state, Outcome lastOutcome,
                         Instant lastStarted, Instant lastFinished, long runs, String lastError) {}

    private final String name;
    private final Duration interval;
    private final Runnable body;
    private final Clock clock;

    private volatile State state = State.IDLE;
    private volatile Outcome lastOutcome = Outcome.NEVER_RUN;
    private volatile Instant lastStarted;
    private volatile Instant lastFinished;
    private volatile String lastError;
    private final AtomicLong runs = new AtomicLong();

    public PeriodicTask(String name, Duration interval, Runnable body, Clock clock) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("task " + name + " needs a positive interval, got " + interval);
        }
        this.name = name;
        this.interval = interval;
        this.body = body;
        this.clock = clock;
    }

    public String name() { return name; }
    public Duration interval() { return interval; }

    @Override
    public void run() {
        state = State.RUNNING;
        lastStarted = clock.instant();
        try {
            body.run();
            lastOutcome = Outcome.OK;
            lastError = null;
        } catch (RuntimeException e) {
            lastOutcome = Outcome.FAILED;
            lastError = e.getMessage();
            log.error("[Scheduler] task {} failed", name, e);
        } finally {
            runs.incrementAndGet();
            lastFinished = clock.instant();
            state = State.IDLE;
        }
    }

    public Status status() {
        return new Status(name, interval, state, lastOutcome, lastStarted, lastFinished, runs.get(), lastError);
    }
}
