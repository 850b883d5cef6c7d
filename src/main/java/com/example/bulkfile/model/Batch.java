package com.example.bulkfile.model;

import java.util.List;

/**
 * Ordered slice of the work list handed to exactly one worker.
 */
public record Batch(
        int index,
        List<WorkItem> items
) {
    public Batch {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
