package com.example.bulkfile;

import com.example.bulkfile.directory.DirectoryCache;
import com.example.bulkfile.model.Batch;
import com.example.bulkfile.model.BatchResult;
import com.example.bulkfile.model.ItemFailure;
import com.example.bulkfile.model.ProgressState;
import com.example.bulkfile.model.Summary;
import com.example.bulkfile.model.WorkItem;
import com.example.bulkfile.testutil.InMemoryFilePrimitives;
import com.example.bulkfile.testutil.ScriptedDirectoryProvider;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskSchedulerTest {
    private static final EngineConfig QUIET = EngineConfig.defaults().withProgressIntervalSeconds(0);

    private static List<WorkItem> items(int count) {
        List<WorkItem> items = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            items.add(WorkItem.file("/share/dept" + (i % 7) + "/file-" + i + ".txt", 4, "dept" + (i % 7)));
        }
        return items;
    }

    private static BatchResult allCreated(Batch batch) {
        return new BatchResult(batch.index(), batch.size(), 0, 0, List.of());
    }

    private static TaskScheduler scheduler(EngineConfig config, BatchProcessor processor) {
        return new TaskScheduler(config, processor, null, new ProgressAggregator());
    }

    @Test
    void splitProducesCeilingBatchCountInInputOrder() {
        for (int count : new int[] {1, 49, 50, 51, 100, 237, 1000}) {
            for (int size : new int[] {1, 7, 50, 1000}) {
                List<WorkItem> items = items(count);
                List<Batch> batches = TaskScheduler.split(items, size);

                assertEquals((count + size - 1) / size, batches.size(), count + "/" + size);
                List<WorkItem> rejoined = new ArrayList<>();
                for (int i = 0; i < batches.size(); i++) {
                    assertEquals(i, batches.get(i).index());
                    assertTrue(batches.get(i).size() <= size);
                    rejoined.addAll(batches.get(i).items());
                }
                assertEquals(items, rejoined);
            }
        }
    }

    @Test
    void splitOfEmptyPlanHasNoBatches() {
        assertTrue(TaskScheduler.split(List.of(), 10).isEmpty());
    }

    @Test
    void runsAllBatchesOfAnUnevenPlan() throws Exception {
        List<Integer> sizes = new CopyOnWriteArrayList<>();
        TaskScheduler scheduler = scheduler(QUIET.withMaxWorkers(4), batch -> {
            sizes.add(batch.size());
            return allCreated(batch);
        });

        Summary summary = scheduler.execute(items(237), 50, Optional.empty());

        assertEquals(5, sizes.size());
        assertEquals(List.of(37, 50, 50, 50, 50), sizes.stream().sorted().toList());
        assertEquals(237, summary.totalCreated() + summary.totalErrors());
        assertEquals(237, summary.submittedItems());
        assertFalse(summary.stoppedByCap());
        assertEquals(SchedulerState.DONE, scheduler.state());
    }

    @Test
    void totalsAlwaysCoverEveryItemWithoutCap() throws Exception {
        TaskScheduler scheduler = scheduler(QUIET.withMaxWorkers(3), batch -> {
            if (batch.index() == 4) {
                throw new IllegalStateException("worker blew up");
            }
            long errors = batch.index() % 2;
            List<ItemFailure> failures = new ArrayList<>();
            for (int i = 0; i < errors; i++) {
                failures.add(ItemFailure.of(batch.items().get(i), new RuntimeException("no space")));
            }
            return new BatchResult(batch.index(), batch.size() - errors, errors, 0, failures);
        });

        Summary summary = scheduler.execute(items(500), 40, Optional.empty());

        assertEquals(500, summary.totalProcessed());
        assertEquals(40 + 6, summary.totalErrors());
        ProgressState state = scheduler.progress().snapshot();
        assertEquals(summary.totalCreated(), state.completed());
        assertEquals(summary.totalErrors(), state.errors());
    }

    @Test
    void capStopsSubmissionWithinOneBatchOfTheLimit() throws Exception {
        AtomicInteger batchesRun = new AtomicInteger();
        TaskScheduler scheduler = scheduler(QUIET.withMaxWorkers(4), batch -> {
            batchesRun.incrementAndGet();
            Thread.sleep(2);
            return allCreated(batch);
        });

        Summary summary = scheduler.execute(items(1000), 50, Optional.of(100L));

        long total = summary.totalCreated() + summary.totalErrors();
        assertTrue(total >= 100 && total <= 149, "processed " + total);
        assertTrue(summary.stoppedByCap());
        assertEquals(1000, summary.plannedItems());
        assertEquals(total / 50, batchesRun.get());
        assertEquals(SchedulerState.DONE, scheduler.state());
    }

    @Test
    void capCountsFailedItemsToo() throws Exception {
        TaskScheduler scheduler = scheduler(QUIET.withMaxWorkers(4), batch -> {
            Thread.sleep(2);
            List<ItemFailure> failures = new ArrayList<>();
            for (WorkItem item : batch.items()) {
                failures.add(ItemFailure.of(item, new RuntimeException("read-only share")));
            }
            return new BatchResult(batch.index(), 0, batch.size(), 0, failures);
        });

        Summary summary = scheduler.execute(items(1000), 50, Optional.of(100L));

        long total = summary.totalCreated() + summary.totalErrors();
        assertTrue(total >= 100 && total <= 149, "processed " + total);
        assertEquals(0, summary.totalCreated());
        assertTrue(summary.stoppedByCap());
    }

    @Test
    void capComesFromConfigByDefault() throws Exception {
        TaskScheduler scheduler = scheduler(QUIET.withBatchSize(10).withCap(25L).withMaxWorkers(1), TaskSchedulerTest::allCreated);

        Summary summary = scheduler.execute(items(100));

        assertEquals(30, summary.totalCreated());
        assertTrue(summary.stoppedByCap());
    }

    @Test
    void zeroCapSubmitsNothing() throws Exception {
        TaskScheduler scheduler = scheduler(QUIET, TaskSchedulerTest::allCreated);

        Summary summary = scheduler.execute(items(10), 5, Optional.of(0L));

        assertEquals(0, summary.totalProcessed());
        assertTrue(summary.stoppedByCap());
    }

    @Test
    void directoryOutageNeverTurnsIntoItemErrors() throws Exception {
        ScriptedDirectoryProvider provider = new ScriptedDirectoryProvider().group("dept1", "alice");
        provider.setAvailable(false);
        IdentityPolicy policy = IdentityPolicy.defaults();
        List<WorkItem> items = items(120);
        DirectoryCache cache = new DirectoryCache(provider, policy.groupKeysFor(items.stream().map(WorkItem::tag).toList()));
        InMemoryFilePrimitives files = new InMemoryFilePrimitives();
        BulkFileBuilder builder = new BulkFileBuilder(files, new TemplateContentStubProvider(), new MimeTypeDetector(new Tika()));
        BatchPipeline pipeline = new BatchPipeline(builder, new IdentityAssigner(cache, policy), files);
        TaskScheduler scheduler = new TaskScheduler(QUIET.withMaxWorkers(4), pipeline, cache,
                new ProgressAggregator(), new WorkerPool(), Clock.systemUTC());

        Summary summary = scheduler.execute(items, 25, Optional.empty());

        assertEquals(120, summary.totalCreated());
        assertEquals(0, summary.totalErrors());
        assertEquals(120, summary.fallbackIdentities());
        assertEquals(120, files.files().size());
        assertTrue(files.owners().values().stream().allMatch("Everyone"::equals));
    }

    @Test
    void uncheckedDirectoryFailureFallsBackInsteadOfAborting() throws Exception {
        ScriptedDirectoryProvider provider = new ScriptedDirectoryProvider().group("dept1", "alice");
        provider.failFetchesWith(new IllegalStateException("ldap connection reset"), Integer.MAX_VALUE);
        IdentityPolicy policy = IdentityPolicy.defaults();
        List<WorkItem> items = items(20);
        DirectoryCache cache = new DirectoryCache(provider, policy.groupKeysFor(items.stream().map(WorkItem::tag).toList()));
        InMemoryFilePrimitives files = new InMemoryFilePrimitives();
        BulkFileBuilder builder = new BulkFileBuilder(files, ContentStubProvider.NONE, new MimeTypeDetector(new Tika()));
        BatchPipeline pipeline = new BatchPipeline(builder, new IdentityAssigner(cache, policy), files);

        Summary summary = new TaskScheduler(QUIET.withMaxWorkers(2), pipeline, cache, new ProgressAggregator())
                .execute(items, 5, Optional.empty());

        assertEquals(20, summary.totalCreated());
        assertEquals(0, summary.totalErrors());
        assertEquals(20, summary.fallbackIdentities());
    }

    @Test
    void collidingTargetsBothSucceedWithDistinctPaths() throws Exception {
        InMemoryFilePrimitives files = new InMemoryFilePrimitives();
        DirectoryCache cache = new DirectoryCache(new ScriptedDirectoryProvider(), List.of("AllEmployees"));
        BulkFileBuilder builder = new BulkFileBuilder(files, ContentStubProvider.NONE, new MimeTypeDetector(new Tika()));
        BatchPipeline pipeline = new BatchPipeline(builder, new IdentityAssigner(cache, IdentityPolicy.defaults()), files);
        String target = Path.of("/share/Sales/forecast.xlsx").toAbsolutePath().toString();
        List<WorkItem> items = List.of(WorkItem.file(target, 8, "Sales"), WorkItem.file(target, 8, "Sales"));

        Summary summary = new TaskScheduler(QUIET.withMaxWorkers(2), pipeline, cache, new ProgressAggregator())
                .execute(items, 1, Optional.empty());

        assertEquals(2, summary.totalCreated());
        assertEquals(2, files.files().size());
        assertTrue(files.files().containsKey(Path.of(target)));
        assertTrue(files.files().containsKey(Path.of(target).resolveSibling("forecast (1).xlsx")));
    }

    @Test
    void invalidBatchSizeFailsBeforeAnyWork() {
        AtomicInteger calls = new AtomicInteger();
        TaskScheduler scheduler = scheduler(QUIET, batch -> {
            calls.incrementAndGet();
            return allCreated(batch);
        });

        assertThrows(ConfigException.class, () -> scheduler.execute(items(10), 0, Optional.empty()));
        assertEquals(0, calls.get());
        assertEquals(SchedulerState.PLANNED, scheduler.state());
    }

    @Test
    void invalidConfigFailsBeforeAnyWork() {
        TaskScheduler scheduler = scheduler(QUIET.withBatchSize(-5), TaskSchedulerTest::allCreated);

        assertThrows(ConfigException.class, () -> scheduler.execute(items(10)));
    }

    @Test
    void negativeCapIsAConfigError() {
        TaskScheduler scheduler = scheduler(QUIET, TaskSchedulerTest::allCreated);

        assertThrows(ConfigException.class, () -> scheduler.execute(items(10), 5, Optional.of(-1L)));
    }

    @Test
    void schedulerRunsOnlyOnce() throws Exception {
        TaskScheduler scheduler = scheduler(QUIET, TaskSchedulerTest::allCreated);
        scheduler.execute(items(5), 5, Optional.empty());

        assertThrows(IllegalStateException.class, () -> scheduler.execute(items(5), 5, Optional.empty()));
    }

    @Test
    void passesThroughDrainingBeforeDone() throws Exception {
        List<SchedulerState> seen = new CopyOnWriteArrayList<>();
        TaskScheduler[] holder = new TaskScheduler[1];
        holder[0] = scheduler(QUIET.withMaxWorkers(1), batch -> {
            seen.add(holder[0].state());
            return allCreated(batch);
        });

        holder[0].execute(items(30), 10, Optional.empty());

        assertTrue(seen.contains(SchedulerState.SUBMITTING));
        assertTrue(seen.stream().allMatch(state -> state == SchedulerState.SUBMITTING || state == SchedulerState.DRAINING));
        assertEquals(SchedulerState.DONE, holder[0].state());
    }

    @Test
    void failuresInSummaryAreBounded() throws Exception {
        EngineConfig config = new EngineConfig(10, 2, 300, Optional.empty(), 0, 3,
                IdentityPolicy.defaults(), Optional.empty(), Optional.empty());
        TaskScheduler scheduler = scheduler(config, batch -> {
            throw new IllegalStateException("disk gone");
        });

        Summary summary = scheduler.execute(items(50));

        assertEquals(50, summary.totalErrors());
        assertEquals(3, summary.failures().size());
    }
}
