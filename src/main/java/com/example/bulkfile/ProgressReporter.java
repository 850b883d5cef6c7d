package com.example.bulkfile;

import com.example.bulkfile.model.ProgressState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Logs a progress line at a fixed interval. Polling cadence lives here so the aggregator
 * never has to throttle its readers.
 */
public final class ProgressReporter implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressReporter.class);

    private final ProgressAggregator progress;
    private final long total;
    private final ScheduledExecutorService scheduler;

    private ProgressReporter(ProgressAggregator progress, long total) {
        this.progress = progress;
        this.total = total;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("progress", true));
    }

    public static ProgressReporter start(ProgressAggregator progress, long total, Duration interval) {
        ProgressReporter reporter = new ProgressReporter(progress, total);
        long millis = Math.max(1L, interval.toMillis());
        reporter.scheduler.scheduleAtFixedRate(reporter::report, millis, millis, TimeUnit.MILLISECONDS);
        return reporter;
    }

    void report() {
        try {
            LOGGER.info(line(progress.snapshot(), progress.rate(), progress.eta(total), total));
        } catch (RuntimeException ex) {
            LOGGER.warn("Could not report progress; retrying next interval", ex);
        }
    }

    static String line(ProgressState state, double rate, Optional<Duration> eta, long total) {
        int percent = total <= 0 ? 100 : (int) Math.min(100, state.processed() * 100 / total);
        return String.format(Locale.ROOT, "Progress: %d%% (%d/%d) created=%d errors=%d rate=%.1f/s eta=%s",
                percent,
                state.processed(),
                total,
                state.completed(),
                state.errors(),
                rate,
                eta.map(ProgressReporter::formatDuration).orElse("unknown"));
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.toSeconds();
        return String.format(Locale.ROOT, "%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
