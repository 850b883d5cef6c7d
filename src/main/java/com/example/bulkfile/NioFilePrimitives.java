package com.example.bulkfile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.UserPrincipal;
import java.nio.file.attribute.UserPrincipalLookupService;

/**
 * {@link FilePrimitives} backed by java.nio. Allocation opens the file with the sparse hint and
 * writes a single byte at the last offset, which leaves the rest unallocated on filesystems
 * that support holes.
 */
public final class NioFilePrimitives implements FilePrimitives {
    private static final byte[] TAIL = new byte[1];

    @Override
    public void ensureDirectory(Path directory) throws IOException {
        Files.createDirectories(directory);
    }

    @Override
    public void allocateSparse(Path file, long bytes) throws IOException {
        if (bytes < 0) {
            throw new IllegalArgumentException("bytes must not be negative: " + bytes);
        }
        SeekableByteChannel channel = Files.newByteChannel(file,
                StandardOpenOption.CREATE_NEW,
                StandardOpenOption.WRITE,
                StandardOpenOption.SPARSE);
        try (channel) {
            if (bytes > 0) {
                channel.position(bytes - 1);
                channel.write(ByteBuffer.wrap(TAIL));
            }
        } catch (IOException | RuntimeException ex) {
            // the file is ours at this point, so a half-allocated one can go
            try {
                Files.deleteIfExists(file);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
    }

    @Override
    public void writeStub(Path file, byte[] stub) throws IOException {
        if (stub.length == 0) {
            return;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            int length = (int) Math.min(stub.length, channel.size());
            ByteBuffer buffer = ByteBuffer.wrap(stub, 0, length);
            long position = 0;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
        }
    }

    @Override
    public void applyOwner(Path file, String principal) throws IOException {
        UserPrincipalLookupService lookup = file.getFileSystem().getUserPrincipalLookupService();
        UserPrincipal owner = lookup.lookupPrincipalByName(principal);
        Files.setOwner(file, owner);
    }

    @Override
    public void delete(Path file) throws IOException {
        Files.deleteIfExists(file);
    }
}
