package com.example.bulkfile;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;

/**
 * Storage primitives the engine orchestrates. Implementations do no locking of their own;
 * concurrent writers are kept apart by {@link #allocateSparse} refusing existing paths.
 */
public interface FilePrimitives {
    /**
     * Creates the directory and any missing parents. Succeeds if it already exists.
     */
    void ensureDirectory(Path directory) throws IOException;

    /**
     * Creates a new file of {@code bytes} length without writing content.
     *
     * @throws FileAlreadyExistsException if the path is taken
     */
    void allocateSparse(Path file, long bytes) throws IOException;

    /**
     * Writes the stub at offset 0 without growing the file past its allocated length.
     */
    void writeStub(Path file, byte[] stub) throws IOException;

    /**
     * Makes the named principal the owner of the file.
     */
    void applyOwner(Path file, String principal) throws IOException;

    void delete(Path file) throws IOException;
}
