package com.example.bulkfile;

import com.example.bulkfile.model.Batch;
import com.example.bulkfile.model.BatchResult;

/**
 * Work applied to one batch on a worker thread.
 */
@FunctionalInterface
public interface BatchProcessor {
    BatchResult process(Batch batch) throws Exception;
}
