package com.reviewgate.engine.execution;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests to avoid real sleeps.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
