package com.example.bulkfile;

import com.example.bulkfile.model.Batch;
import com.example.bulkfile.model.BatchResult;
import com.example.bulkfile.model.Identity;
import com.example.bulkfile.model.ItemFailure;
import com.example.bulkfile.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-batch pipeline: create each item's file, then give it an owner.
 *
 * <p>Items are grouped by parent directory so each directory is ensured once per batch.
 * A failing item is recorded and the batch moves on.</p>
 */
public final class BatchPipeline implements BatchProcessor {
    private static final Logger LOGGER = LoggerFactory.getLogger(BatchPipeline.class);

    private final BulkFileBuilder builder;
    private final IdentityAssigner identities;
    private final FilePrimitives files;

    public BatchPipeline(BulkFileBuilder builder, IdentityAssigner identities, FilePrimitives files) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.files = Objects.requireNonNull(files, "files");
    }

    @Override
    public BatchResult process(Batch batch) {
        long created = 0;
        long fallbacks = 0;
        List<ItemFailure> failures = new ArrayList<>();

        for (Map.Entry<Path, List<WorkItem>> group : groupByDirectory(batch.items(), failures).entrySet()) {
            Path directory = group.getKey();
            try {
                files.ensureDirectory(directory);
            } catch (IOException | RuntimeException ex) {
                LOGGER.warn("Failed to create directory {}; skipping {} items", directory, group.getValue().size(), ex);
                for (WorkItem item : group.getValue()) {
                    failures.add(ItemFailure.of(item, ex));
                }
                continue;
            }

            for (WorkItem item : group.getValue()) {
                Path path;
                try {
                    path = builder.allocate(item);
                } catch (IOException | RuntimeException ex) {
                    LOGGER.warn("Failed to create {}", item.targetPath(), ex);
                    failures.add(ItemFailure.of(item, ex));
                    continue;
                }
                created++;
                if (!applyIdentity(path, item)) {
                    fallbacks++;
                }
            }
        }

        return new BatchResult(batch.index(), created, failures.size(), fallbacks, failures);
    }

    /**
     * Returns true when the item ended up owned by a directory member.
     */
    private boolean applyIdentity(Path path, WorkItem item) {
        Identity identity = identities.assign(item);
        try {
            files.applyOwner(path, identity.principal());
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Could not make {} the owner of {}: {}", identity.principal(), path, ex.toString());
            return false;
        }
        return identity.fromDirectory();
    }

    private static Map<Path, List<WorkItem>> groupByDirectory(List<WorkItem> items, List<ItemFailure> failures) {
        Map<Path, List<WorkItem>> groups = new LinkedHashMap<>();
        for (WorkItem item : items) {
            Path directory;
            try {
                directory = item.path().toAbsolutePath().getParent();
            } catch (InvalidPathException ex) {
                LOGGER.warn("Skipping item with invalid path {}", item.targetPath(), ex);
                failures.add(ItemFailure.of(item, ex));
                continue;
            }
            if (directory == null) {
                failures.add(new ItemFailure(item.targetPath(), item.kind(), "target has no parent directory"));
                continue;
            }
            groups.computeIfAbsent(directory, ignored -> new ArrayList<>()).add(item);
        }
        return groups;
    }
}
