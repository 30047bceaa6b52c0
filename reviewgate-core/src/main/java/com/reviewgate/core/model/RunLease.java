package com.reviewgate.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Ownership of a run by one engine process. Renewed on every write by the
 * owner; an expired lease may be taken over.
 */
public record RunLease(
    String ownerId,
    Instant acquiredAt,
    Instant expiresAt
) {
    public static RunLease acquire(String ownerId, Instant now, Duration duration) {
        return new RunLease(ownerId, now, now.plus(duration));
    }

    public boolean isActive(Instant now) {
        return expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String candidate) {
        return ownerId.equals(candidate);
    }

    /**
     * A lease can be claimed by its owner, or by anyone once expired.
     */
    public boolean canBeClaimedBy(String candidate, Instant now) {
        return isHeldBy(candidate) || !isActive(now);
    }

    public RunLease renew(Instant now, Duration duration) {
        return new RunLease(ownerId, acquiredAt, now.plus(duration));
    }
}
