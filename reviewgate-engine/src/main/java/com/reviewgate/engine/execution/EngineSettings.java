package com.reviewgate.engine.execution;

import com.reviewgate.core.model.DecisionPolicy;

import java.time.Duration;

/**
 * Process-level settings of an execution engine.
 *
 * @param ownerId Identity written into run leases
 * @param leaseDuration How long a claim stays valid without a write
 * @param defaultPolicy Decision policy for pipelines that declare none
 */
public record EngineSettings(
    String ownerId,
    Duration leaseDuration,
    DecisionPolicy defaultPolicy
) {
    public EngineSettings {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        leaseDuration = leaseDuration != null ? leaseDuration : Duration.ofSeconds(30);
        defaultPolicy = defaultPolicy != null ? defaultPolicy : DecisionPolicy.defaultPolicy();
    }

    /**
     * Interval at which a waiting engine renews its lease.
     */
    public Duration renewInterval() {
        Duration third = leaseDuration.dividedBy(3);
        return third.compareTo(Duration.ofMillis(100)) < 0 ? Duration.ofMillis(100) : third;
    }
}
