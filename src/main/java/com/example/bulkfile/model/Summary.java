package com.example.bulkfile.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Final outcome of a scheduler run.
 *
 * <p>Without a cap {@code totalCreated + totalErrors == plannedItems}; when the cap stops
 * submission early the totals only cover {@code submittedItems}.</p>
 */
public record Summary(
        long totalCreated,
        long totalErrors,
        long fallbackIdentities,
        long plannedItems,
        long submittedItems,
        boolean stoppedByCap,
        Duration duration,
        List<ItemFailure> failures
) {
    public Summary {
        failures = List.copyOf(failures);
    }

    /**
     * Folds batch results into a summary, keeping at most {@code maxFailures} failure records.
     */
    public static Summary from(List<BatchResult> results,
                               long plannedItems,
                               Duration duration,
                               int maxFailures) {
        long created = 0;
        long errors = 0;
        long fallbacks = 0;
        List<ItemFailure> failures = new ArrayList<>();
        for (BatchResult result : results) {
            created += result.created();
            errors += result.errors();
            fallbacks += result.fallbackIdentities();
            for (ItemFailure failure : result.failures()) {
                if (failures.size() >= maxFailures) {
                    break;
                }
                failures.add(failure);
            }
        }
        long submitted = created + errors;
        return new Summary(created, errors, fallbacks, plannedItems, submitted,
                submitted < plannedItems, duration, failures);
    }

    public long totalProcessed() {
        return totalCreated + totalErrors;
    }
}
