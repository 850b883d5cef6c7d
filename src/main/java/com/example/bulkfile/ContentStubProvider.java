package com.example.bulkfile;

/**
 * Supplies the placeholder bytes written at the start of a created file.
 */
@FunctionalInterface
public interface ContentStubProvider {
    /**
     * Returns the stub for a MIME type, or an empty array when the kind needs none.
     */
    byte[] stubFor(String kind);

    ContentStubProvider NONE = kind -> new byte[0];
}
