package com.example.bulkfile.model;

/**
 * Owner principal chosen for a created file and where it came from.
 */
public record Identity(
        String principal,
        IdentitySource source
) {
    public boolean fromDirectory() {
        return source == IdentitySource.DIRECTORY;
    }
}
