package com.example.bulkfile;

import com.example.bulkfile.model.BatchResult;

/**
 * Callbacks from {@link WorkerPool}. {@link #batchCompleted} runs on the worker thread that
 * finished the batch, or on the submitting thread when the worker itself died.
 */
public interface BatchListener {
    default void batchCompleted(BatchResult result) {
    }

    default void submissionsClosed(int submittedBatches) {
    }

    BatchListener NONE = new BatchListener() {
    };
}
