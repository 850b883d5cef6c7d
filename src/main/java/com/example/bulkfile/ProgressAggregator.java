package com.example.bulkfile;

import com.example.bulkfile.model.ProgressState;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Run-wide completed/error counters shared by all workers.
 *
 * <p>Each counter only ever grows. A snapshot reads each counter atomically, but the two
 * counters are not read as one unit.</p>
 */
public final class ProgressAggregator {
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final Clock clock;
    private final Instant startedAt;

    public ProgressAggregator() {
        this(Clock.systemUTC());
    }

    public ProgressAggregator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.instant();
    }

    public void add(long completed, long errors) {
        if (completed < 0 || errors < 0) {
            throw new IllegalArgumentException("Progress increments must not be negative");
        }
        if (completed > 0) {
            this.completed.addAndGet(completed);
        }
        if (errors > 0) {
            this.errors.addAndGet(errors);
        }
    }

    public ProgressState snapshot() {
        return new ProgressState(completed.get(), errors.get(), startedAt);
    }

    /**
     * Items processed per second since the aggregator was created.
     */
    public double rate() {
        return rate(snapshot());
    }

    /**
     * Estimated time until {@code total} items are processed; empty while no rate is known.
     */
    public Optional<Duration> eta(long total) {
        ProgressState state = snapshot();
        long remaining = total - state.processed();
        if (remaining <= 0) {
            return Optional.of(Duration.ZERO);
        }
        double rate = rate(state);
        if (rate <= 0) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis((long) Math.ceil(remaining / rate * 1000.0)));
    }

    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    private double rate(ProgressState state) {
        long elapsedMillis = elapsed().toMillis();
        if (elapsedMillis <= 0) {
            return 0.0;
        }
        return state.processed() * 1000.0 / elapsedMillis;
    }
}
