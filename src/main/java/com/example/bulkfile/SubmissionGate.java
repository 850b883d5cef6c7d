package com.example.bulkfile;

import java.util.function.LongSupplier;

/**
 * Consulted before each batch submission.
 */
@FunctionalInterface
public interface SubmissionGate {
    enum Decision {
        SUBMIT,
        /** Wait for an in-flight batch to finish, then ask again. */
        HOLD,
        STOP
    }

    /**
     * @param inFlightItems items in batches submitted but not yet finished
     */
    Decision decide(long inFlightItems);

    /**
     * Default gate used when no cap is configured (never stops early).
     */
    SubmissionGate OPEN = inFlightItems -> Decision.SUBMIT;

    /**
     * Stops once {@code processed} reaches the cap, and holds a submission while the batches
     * already in flight could reach it on their own.
     *
     * <p>Failed items count toward the cap, so a run with item errors still ends with
     * between {@code cap} and {@code cap + batchSize - 1} items processed.</p>
     *
     * @param processed items finished so far, created plus failed
     */
    static SubmissionGate cap(long cap, LongSupplier processed) {
        return inFlightItems -> {
            long done = processed.getAsLong();
            if (done >= cap) {
                return Decision.STOP;
            }
            if (done + inFlightItems >= cap) {
                return Decision.HOLD;
            }
            return Decision.SUBMIT;
        };
    }
}
