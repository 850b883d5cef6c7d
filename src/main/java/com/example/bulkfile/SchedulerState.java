package com.example.bulkfile;

/**
 * Lifecycle of a {@link TaskScheduler} run.
 */
public enum SchedulerState {
    /** Batches computed, nothing started. */
    PLANNED,
    /** Batches are being handed to the worker pool; a cap may end this early. */
    SUBMITTING,
    /** No more submissions; waiting for in-flight batches. */
    DRAINING,
    /** Terminal. The summary has been returned. */
    DONE
}
