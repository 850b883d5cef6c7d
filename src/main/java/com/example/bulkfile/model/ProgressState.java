package com.example.bulkfile.model;

import java.time.Instant;

/**
 * Point-in-time view of the shared run counters.
 */
public record ProgressState(
        long completed,
        long errors,
        Instant startedAt
) {
    public long processed() {
        return completed + errors;
    }
}
