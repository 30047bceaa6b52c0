package com.reviewgate.core.model;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * How often and how patiently an agent call is repeated after a transient
 * failure. Pipeline defaults carry one; a task may narrow its retry count.
 *
 * {@code maxAttempts} counts the first call: a task configured with 2 retries
 * has 3 attempts. Out-of-range values are clamped on construction.
 *
 * Error codes: a code in {@code nonRetryableErrors} is final. When
 * {@code retryableErrors} is non-empty only the codes it lists are retried.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryableErrors,
    Set<String> nonRetryableErrors
) {
    private static final int DEFAULT_ATTEMPTS = 3;
    private static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    private static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(1);

    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff != null ? initialBackoff : Duration.ZERO;
        maxBackoff = maxBackoff != null ? maxBackoff : initialBackoff;
        backoffMultiplier = Math.max(1.0, backoffMultiplier);
        jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        retryableErrors = retryableErrors != null ? Set.copyOf(retryableErrors) : Set.of();
        nonRetryableErrors = nonRetryableErrors != null ? Set.copyOf(nonRetryableErrors) : Set.of();
    }

    /**
     * Three attempts, doubling from one second up to a minute, 10% jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }

    public static RetryPolicy noRetry() {
        return builder()
            .maxAttempts(1)
            .initialBackoff(Duration.ZERO)
            .maxBackoff(Duration.ZERO)
            .backoffMultiplier(1.0)
            .jitterFactor(0.0)
            .build();
    }

    /**
     * Same backoff, with {@code retries} further attempts after the first.
     */
    public RetryPolicy withRetries(int retries) {
        return new RetryPolicy(Math.max(0, retries) + 1, initialBackoff, maxBackoff,
            backoffMultiplier, jitterFactor, retryableErrors, nonRetryableErrors);
    }

    /**
     * Wait before the attempt after {@code failedAttempt}: the initial backoff
     * grown geometrically, capped at {@code maxBackoff}, then spread by up to
     * {@code jitterFactor} either way.
     *
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return The delay before the next attempt
     */
    public Duration computeBackoff(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        double grown = initialBackoff.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
        double capped = Math.min(grown, maxBackoff.toMillis());
        if (jitterFactor == 0.0) {
            return Duration.ofMillis((long) capped);
        }
        double spread = jitterFactor * (2 * ThreadLocalRandom.current().nextDouble() - 1);
        return Duration.ofMillis((long) (capped * (1 + spread)));
    }

    /**
     * @param errorCode Code of the failed attempt, may be null
     * @return true if the code allows another attempt
     */
    public boolean shouldRetry(String errorCode) {
        if (errorCode == null) {
            return retryableErrors.isEmpty();
        }
        if (nonRetryableErrors.contains(errorCode)) {
            return false;
        }
        return retryableErrors.isEmpty() || retryableErrors.contains(errorCode);
    }

    public boolean hasMoreAttempts(int attempt) {
        return attempt < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts from {@link #defaultPolicy()}'s values.
     */
    public static class Builder {
        private int maxAttempts = DEFAULT_ATTEMPTS;
        private Duration initialBackoff = DEFAULT_INITIAL_BACKOFF;
        private Duration maxBackoff = DEFAULT_MAX_BACKOFF;
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> retryableErrors = Set.of();
        private Set<String> nonRetryableErrors = Set.of();

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryableErrors(Set<String> retryableErrors) {
            this.retryableErrors = retryableErrors;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, backoffMultiplier,
                jitterFactor, retryableErrors, nonRetryableErrors);
        }
    }
}
