package com.reviewgate.recovery;

import java.time.Duration;

/**
 * Tuning for the reconciliation scanner.
 *
 * @param interval Delay between two scan passes
 * @param compensationGrace Minimum age of a terminal run before its compensation is replayed
 * @param retention How long terminal runs are kept; null keeps them forever
 * @param batchSize Maximum runs handled per category and pass
 */
public record ReconciliationSettings(
    Duration interval,
    Duration compensationGrace,
    Duration retention,
    int batchSize
) {
    public static final int DEFAULT_BATCH_SIZE = 100;

    public ReconciliationSettings {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        compensationGrace = compensationGrace != null ? compensationGrace : Duration.ZERO;
        if (batchSize <= 0) {
            batchSize = DEFAULT_BATCH_SIZE;
        }
    }

    public static ReconciliationSettings defaults() {
        return new ReconciliationSettings(Duration.ofSeconds(30), Duration.ofMinutes(1), Duration.ofDays(30),
            DEFAULT_BATCH_SIZE);
    }
}
