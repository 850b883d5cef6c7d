package com.example.bulkfile;

import com.example.bulkfile.directory.DirectoryCache;
import com.example.bulkfile.directory.DirectoryUnavailableException;
import com.example.bulkfile.model.Batch;
import com.example.bulkfile.model.BatchResult;
import com.example.bulkfile.model.ProgressState;
import com.example.bulkfile.model.Summary;
import com.example.bulkfile.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Splits the planned work into batches, feeds them to a {@link WorkerPool} and folds the
 * batch results into a {@link Summary}.
 *
 * <p>A scheduler runs once. Its {@link #state()} moves through
 * {@code PLANNED -> SUBMITTING -> DRAINING -> DONE}. Progress is posted to the shared
 * {@link ProgressAggregator} once per finished batch, from the worker that finished it.</p>
 */
public final class TaskScheduler {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskScheduler.class);

    private final EngineConfig config;
    private final BatchProcessor processor;
    private final DirectoryCache cache;
    private final ProgressAggregator progress;
    private final WorkerPool pool;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile SchedulerState state = SchedulerState.PLANNED;

    public TaskScheduler(EngineConfig config,
                         BatchProcessor processor,
                         DirectoryCache cache,
                         ProgressAggregator progress) {
        this(config, processor, cache, progress, new WorkerPool(), Clock.systemUTC());
    }

    public TaskScheduler(EngineConfig config,
                         BatchProcessor processor,
                         DirectoryCache cache,
                         ProgressAggregator progress,
                         WorkerPool pool,
                         Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.cache = cache;
        this.progress = Objects.requireNonNull(progress, "progress");
        this.pool = Objects.requireNonNull(pool, "pool");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Splits items into consecutive batches of at most {@code batchSize}, keeping input order.
     */
    public static List<Batch> split(List<WorkItem> items, int batchSize) {
        if (batchSize <= 0) {
            throw new ConfigException("batchSize must be positive, was " + batchSize);
        }
        List<Batch> batches = new ArrayList<>((items.size() + batchSize - 1) / batchSize);
        for (int start = 0, index = 0; start < items.size(); start += batchSize, index++) {
            int end = Math.min(items.size(), start + batchSize);
            batches.add(new Batch(index, items.subList(start, end)));
        }
        return batches;
    }

    public Summary execute(List<WorkItem> items) throws InterruptedException {
        return execute(items, config.batchSize(), config.cap());
    }

    /**
     * Runs every batch, or stops submitting once {@code cap} items were processed (created or
     * failed). Batches already submitted always finish.
     *
     * @throws ConfigException       if the configuration or arguments are invalid; no work is started
     * @throws IllegalStateException if this scheduler already ran
     * @throws InterruptedException  if the calling thread is interrupted while waiting for workers
     */
    public Summary execute(List<WorkItem> items, int batchSize, Optional<Long> cap) throws InterruptedException {
        if (items == null) {
            throw new ConfigException("items must not be null");
        }
        config.validate();
        if (batchSize <= 0) {
            throw new ConfigException("batchSize must be positive, was " + batchSize);
        }
        if (cap.isPresent() && cap.get() < 0) {
            throw new ConfigException("cap must not be negative, was " + cap.get());
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("TaskScheduler instances run once; create a new one");
        }

        Instant startedAt = clock.instant();
        List<Batch> batches = split(items, batchSize);
        LOGGER.info("Planned {} items in {} batches of up to {}", items.size(), batches.size(), batchSize);
        warmDirectory();

        int workers = config.maxWorkers() > 0
                ? config.maxWorkers()
                : WorkerPool.defaultWorkerCount(items.size(), batchSize);
        SubmissionGate gate = cap
                .map(limit -> SubmissionGate.cap(limit, () -> progress.snapshot().processed()))
                .orElse(SubmissionGate.OPEN);

        List<BatchResult> results;
        ProgressReporter reporter = config.progressIntervalSeconds() > 0
                ? ProgressReporter.start(progress, items.size(), Duration.ofSeconds(config.progressIntervalSeconds()))
                : null;
        try {
            transition(SchedulerState.SUBMITTING);
            results = pool.run(batches, workers, processor, gate, new BatchListener() {
                @Override
                public void batchCompleted(BatchResult result) {
                    progress.add(result.created(), result.errors());
                }

                @Override
                public void submissionsClosed(int submittedBatches) {
                    transition(SchedulerState.DRAINING);
                }
            });
        } finally {
            if (reporter != null) {
                reporter.close();
            }
        }

        Summary summary = Summary.from(results, items.size(),
                Duration.between(startedAt, clock.instant()), config.maxReportedFailures());
        transition(SchedulerState.DONE);
        logSummary(summary);
        return summary;
    }

    public SchedulerState state() {
        return state;
    }

    public ProgressAggregator progress() {
        return progress;
    }

    private void warmDirectory() {
        if (cache == null) {
            return;
        }
        try {
            cache.warm(false);
        } catch (DirectoryUnavailableException | RuntimeException ex) {
            LOGGER.warn("Directory warm-up failed; items without cached groups get fallback owners: {}", ex.getMessage());
        }
    }

    private void transition(SchedulerState next) {
        LOGGER.debug("Scheduler {} -> {}", state, next);
        state = next;
    }

    private void logSummary(Summary summary) {
        ProgressState snapshot = progress.snapshot();
        if (summary.stoppedByCap()) {
            LOGGER.info("Stopped by cap after {} of {} items: created={} errors={} in {}",
                    summary.submittedItems(), summary.plannedItems(),
                    summary.totalCreated(), summary.totalErrors(), summary.duration());
        } else {
            LOGGER.info("Processed {} items: created={} errors={} fallbackOwners={} in {}",
                    summary.totalProcessed(), summary.totalCreated(), summary.totalErrors(),
                    summary.fallbackIdentities(), summary.duration());
        }
        if (snapshot.completed() != summary.totalCreated() || snapshot.errors() != summary.totalErrors()) {
            LOGGER.warn("Progress counters ({} created, {} errors) disagree with batch results", snapshot.completed(), snapshot.errors());
        }
    }
}
