package com.example.bulkfile.directory;

import java.time.Instant;
import java.util.List;

/**
 * Cached membership of one directory group.
 */
public record DirectoryCacheEntry(
        String key,
        List<String> members,
        Instant expiresAt
) {
    public DirectoryCacheEntry {
        members = List.copyOf(members);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
