package com.example.bulkfile;

import com.example.bulkfile.model.Batch;
import com.example.bulkfile.model.BatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs batches on a bounded set of worker threads.
 *
 * <p>At most {@code maxWorkers} batches are in flight; the next one is submitted only when a
 * worker frees up, which lets a {@link SubmissionGate} stop the run between batches. A batch
 * whose processing throws is reported as all errors and never affects other batches.
 * {@code run} returns once every submitted batch has a result.</p>
 */
public final class WorkerPool {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerPool.class);

    private final String threadPrefix;

    public WorkerPool() {
        this("batch-worker");
    }

    public WorkerPool(String threadPrefix) {
        this.threadPrefix = threadPrefix;
    }

    /**
     * Worker count used when none is configured: bounded by the CPUs and by the number of
     * batches, so small plans do not pay for idle threads.
     */
    public static int defaultWorkerCount(int itemCount, int batchSize) {
        if (itemCount <= 0 || batchSize <= 0) {
            return 1;
        }
        int batches = (int) Math.min(Integer.MAX_VALUE, ((long) itemCount + batchSize - 1) / batchSize);
        if (batches < 2) {
            return 1;
        }
        return Math.max(1, Math.min(Runtime.getRuntime().availableProcessors(), batches));
    }

    public List<BatchResult> run(List<Batch> batches, int maxWorkers, BatchProcessor processor)
            throws InterruptedException {
        return run(batches, maxWorkers, processor, SubmissionGate.OPEN, BatchListener.NONE);
    }

    /**
     * Runs batches in order of submission until they are exhausted or the gate stops the run.
     *
     * @return one result per submitted batch, ordered by batch index
     * @throws InterruptedException if the calling thread is interrupted; workers are cancelled
     */
    public List<BatchResult> run(List<Batch> batches,
                                 int maxWorkers,
                                 BatchProcessor processor,
                                 SubmissionGate gate,
                                 BatchListener listener) throws InterruptedException {
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive, was " + maxWorkers);
        }
        if (batches.isEmpty()) {
            listener.submissionsClosed(0);
            return List.of();
        }

        int workers = Math.min(maxWorkers, batches.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory(threadPrefix, false));
        CompletionService<BatchResult> completions = new ExecutorCompletionService<>(executor);
        Map<Future<BatchResult>, Batch> inFlight = new HashMap<>();
        List<BatchResult> results = new ArrayList<>(batches.size());
        long inFlightItems = 0;
        int next = 0;

        try {
            while (next < batches.size()) {
                if (inFlight.size() >= workers) {
                    inFlightItems -= collect(completions.take(), inFlight, results, listener);
                    continue;
                }
                SubmissionGate.Decision decision = gate.decide(inFlightItems);
                if (decision == SubmissionGate.Decision.STOP) {
                    LOGGER.info("Submission stopped after {} of {} batches", next, batches.size());
                    break;
                }
                if (decision == SubmissionGate.Decision.HOLD && !inFlight.isEmpty()) {
                    inFlightItems -= collect(completions.take(), inFlight, results, listener);
                    continue;
                }

                Batch batch = batches.get(next++);
                Future<BatchResult> future = completions.submit(() -> execute(batch, processor, listener));
                inFlight.put(future, batch);
                inFlightItems += batch.size();
            }

            listener.submissionsClosed(next);
            while (!inFlight.isEmpty()) {
                inFlightItems -= collect(completions.take(), inFlight, results, listener);
            }
        } finally {
            executor.shutdownNow();
        }

        results.sort(Comparator.comparingInt(BatchResult::batchIndex));
        return results;
    }

    private BatchResult execute(Batch batch, BatchProcessor processor, BatchListener listener) {
        BatchResult result;
        try {
            result = processor.process(batch);
            if (result == null || result.processed() != batch.size()) {
                throw new IllegalStateException("Batch " + batch.index() + " accounted for "
                        + (result == null ? 0 : result.processed()) + " of " + batch.size() + " items");
            }
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            LOGGER.error("Batch {} failed; counting all {} items as errors", batch.index(), batch.size(), ex);
            result = BatchResult.failed(batch, ex);
        }
        listener.batchCompleted(result);
        return result;
    }

    /**
     * Records a finished future and returns the number of items it releases.
     */
    private long collect(Future<BatchResult> future,
                         Map<Future<BatchResult>, Batch> inFlight,
                         List<BatchResult> results,
                         BatchListener listener) throws InterruptedException {
        Batch batch = inFlight.remove(future);
        BatchResult result;
        try {
            result = future.get();
        } catch (ExecutionException ex) {
            // only reachable for Errors, execute() converts every Exception itself
            LOGGER.error("Worker died on batch {}; counting all {} items as errors", batch.index(), batch.size(), ex.getCause());
            result = BatchResult.failed(batch, ex.getCause());
            listener.batchCompleted(result);
        }
        results.add(result);
        return batch.size();
    }
}
