package com.example.bulkfile;

import com.example.bulkfile.model.ItemKind;
import com.example.bulkfile.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Materialises planned items as sparse files with a format stub.
 *
 * <p>Existing paths are never overwritten: the first free name out of {@code name.ext},
 * {@code name (1).ext}, {@code name (2).ext} ... is claimed atomically, so concurrent workers
 * that generated the same name end up with distinct files.</p>
 */
public final class BulkFileBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(BulkFileBuilder.class);
    static final int MAX_RENAME_ATTEMPTS = 10_000;

    private final FilePrimitives files;
    private final ContentStubProvider stubs;
    private final MimeTypeDetector mimeTypes;

    public BulkFileBuilder(FilePrimitives files, ContentStubProvider stubs, MimeTypeDetector mimeTypes) {
        this.files = Objects.requireNonNull(files, "files");
        this.stubs = Objects.requireNonNull(stubs, "stubs");
        this.mimeTypes = Objects.requireNonNull(mimeTypes, "mimeTypes");
    }

    /**
     * Creates the item's parent directory if needed, then the file itself.
     *
     * @return the path actually created, which differs from the target after a collision
     */
    public Path createSparse(WorkItem item) throws IOException {
        Path parent = item.path().toAbsolutePath().getParent();
        if (parent != null) {
            files.ensureDirectory(parent);
        }
        return allocate(item);
    }

    /**
     * Creates the file assuming its parent directory already exists.
     */
    Path allocate(WorkItem item) throws IOException {
        long bytes = Math.multiplyExact(item.sizeKb(), 1024L);
        Path created = claim(item.path().toAbsolutePath(), bytes);
        if (item.kind() == ItemKind.CLUTTER) {
            return created;
        }
        try {
            byte[] stub = stubs.stubFor(mimeTypes.detect(created));
            if (stub.length > 0) {
                files.writeStub(created, stub);
            }
        } catch (IOException | RuntimeException ex) {
            discard(created, ex);
            throw ex;
        }
        return created;
    }

    private Path claim(Path target, long bytes) throws IOException {
        for (int attempt = 0; attempt <= MAX_RENAME_ATTEMPTS; attempt++) {
            Path candidate = attempt == 0 ? target : disambiguate(target, attempt);
            try {
                files.allocateSparse(candidate, bytes);
                if (attempt > 0) {
                    LOGGER.debug("{} already existed; created {} instead", target, candidate.getFileName());
                }
                return candidate;
            } catch (FileAlreadyExistsException ex) {
                // taken, try the next suffix
            }
        }
        throw new FileAlreadyExistsException(target.toString(), null,
                "no free name after " + MAX_RENAME_ATTEMPTS + " attempts");
    }

    private void discard(Path created, Exception cause) {
        try {
            files.delete(created);
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
        }
    }

    /**
     * Returns {@code base (n).ext} next to the target. Dot files keep their leading dot.
     */
    static Path disambiguate(Path target, int n) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        return target.resolveSibling(base + " (" + n + ")" + extension);
    }
}
