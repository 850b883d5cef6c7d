package com.example.bulkfile.directory;

/**
 * Raised when the directory service cannot answer a lookup.
 */
public class DirectoryUnavailableException extends Exception {
    public DirectoryUnavailableException(String message) {
        super(message);
    }

    public DirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
