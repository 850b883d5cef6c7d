package com.example.bulkfile.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one finished batch. {@code created + errors} always equals the batch size.
 */
public record BatchResult(
        int batchIndex,
        long created,
        long errors,
        long fallbackIdentities,
        List<ItemFailure> failures
) {
    public BatchResult {
        if (created < 0 || errors < 0 || fallbackIdentities < 0) {
            throw new IllegalArgumentException("Batch counters must not be negative");
        }
        failures = List.copyOf(failures);
    }

    /**
     * Converts a batch whose processing blew up into an all-errors result.
     */
    public static BatchResult failed(Batch batch, Throwable cause) {
        List<ItemFailure> failures = new ArrayList<>(batch.size());
        for (WorkItem item : batch.items()) {
            failures.add(ItemFailure.of(item, cause));
        }
        return new BatchResult(batch.index(), 0, batch.size(), 0, failures);
    }

    public long processed() {
        return created + errors;
    }
}
