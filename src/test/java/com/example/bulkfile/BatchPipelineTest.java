package com.example.bulkfile;

import com.example.bulkfile.directory.DirectoryCache;
import com.example.bulkfile.model.Batch;
import com.example.bulkfile.model.BatchResult;
import com.example.bulkfile.model.WorkItem;
import com.example.bulkfile.testutil.InMemoryFilePrimitives;
import com.example.bulkfile.testutil.ScriptedDirectoryProvider;
import org.apache.tika.Tika;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchPipelineTest {
    private static final Path ROOT = Path.of("/share").toAbsolutePath();

    private final InMemoryFilePrimitives files = new InMemoryFilePrimitives();
    private final ScriptedDirectoryProvider directory = new ScriptedDirectoryProvider()
            .group("finance", "alice", "bob")
            .group("AllEmployees", "zed");

    private BatchPipeline pipeline(DirectoryCache cache) {
        BulkFileBuilder builder = new BulkFileBuilder(files, new TemplateContentStubProvider(), new MimeTypeDetector(new Tika()));
        return new BatchPipeline(builder, new IdentityAssigner(cache, IdentityPolicy.defaults()), files);
    }

    private DirectoryCache warmedCache() throws Exception {
        DirectoryCache cache = new DirectoryCache(directory, List.of("finance", "AllEmployees"));
        cache.warm(false);
        return cache;
    }

    private static WorkItem item(String relative, String tag) {
        return WorkItem.file(ROOT.resolve(relative).toString(), 2, tag);
    }

    @Test
    void ensuresEachDirectoryOncePerBatch() throws Exception {
        Batch batch = new Batch(0, List.of(
                item("Finance/a.txt", "Finance"),
                item("Finance/b.txt", "Finance"),
                item("Legal/c.txt", "Legal"),
                item("Finance/d.txt", "Finance")));

        BatchResult result = pipeline(warmedCache()).process(batch);

        assertEquals(4, result.created());
        assertEquals(0, result.errors());
        assertEquals(1, files.ensureCalls(ROOT.resolve("Finance")));
        assertEquals(1, files.ensureCalls(ROOT.resolve("Legal")));
    }

    @Test
    void failingItemDoesNotStopTheBatch() throws Exception {
        files.failAllocationWhen(path -> path.getFileName().toString().startsWith("bad"));
        Batch batch = new Batch(3, List.of(
                item("Finance/a.txt", "Finance"),
                item("Finance/bad.txt", "Finance"),
                item("Finance/c.txt", "Finance")));

        BatchResult result = pipeline(warmedCache()).process(batch);

        assertEquals(3, result.batchIndex());
        assertEquals(2, result.created());
        assertEquals(1, result.errors());
        assertEquals(batch.size(), result.processed());
        assertTrue(result.failures().get(0).path().endsWith("bad.txt"));
        assertTrue(result.failures().get(0).error().contains("sparse allocation not supported"));
    }

    @Test
    void unusableDirectoryFailsOnlyItsItems() throws Exception {
        files.failDirectoryWhen(dir -> dir.endsWith("Locked"));
        Batch batch = new Batch(0, List.of(
                item("Locked/a.txt", "Finance"),
                item("Open/b.txt", "Finance"),
                item("Locked/c.txt", "Finance")));

        BatchResult result = pipeline(warmedCache()).process(batch);

        assertEquals(1, result.created());
        assertEquals(2, result.errors());
    }

    @Test
    void ownersComeFromTheTagGroupWithDomainPrefix() throws Exception {
        Batch batch = new Batch(0, List.of(item("Finance/a.txt", "Finance")));

        BatchResult result = pipeline(warmedCache()).process(batch);

        String owner = files.owners().get(ROOT.resolve("Finance/a.txt"));
        assertTrue(owner.equals("CORP\\alice") || owner.equals("CORP\\bob"), owner);
        assertEquals(0, result.fallbackIdentities());
    }

    @Test
    void directoryOutageFallsBackWithoutItemErrors() throws Exception {
        directory.setAvailable(false);
        DirectoryCache cache = new DirectoryCache(directory, List.of("finance", "AllEmployees"));
        Batch batch = new Batch(0, List.of(item("Finance/a.txt", "Finance"), item("HR/b.txt", "HR")));

        BatchResult result = pipeline(cache).process(batch);

        assertEquals(2, result.created());
        assertEquals(0, result.errors());
        assertEquals(2, result.fallbackIdentities());
        assertEquals("Everyone", files.owners().get(ROOT.resolve("HR/b.txt")));
    }

    @Test
    void rejectedOwnerCountsAsFallbackNotError() throws Exception {
        files.rejectOwnerWhen(principal -> true);
        Batch batch = new Batch(0, List.of(item("Finance/a.txt", "Finance")));

        BatchResult result = pipeline(warmedCache()).process(batch);

        assertEquals(1, result.created());
        assertEquals(0, result.errors());
        assertEquals(1, result.fallbackIdentities());
    }

    @Test
    void invalidPathIsAnItemError() throws Exception {
        Batch batch = new Batch(0, List.of(
                WorkItem.file("bad\u0000name.txt", 1, "Finance"),
                item("Finance/ok.txt", "Finance")));

        BatchResult result = pipeline(warmedCache()).process(batch);

        assertEquals(1, result.created());
        assertEquals(1, result.errors());
    }
}
