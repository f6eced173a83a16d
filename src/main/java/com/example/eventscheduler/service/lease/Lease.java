package com.example.eventscheduler.service.lease;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A granted claim on one schedule.
 * <p>
 * version is the schedule version produced by the lease write; it is the only
 * token this worker may present on its next conditional write.
 */
@Value
@Builder(toBuilder = true)
public class Lease {

    UUID scheduleId;
    String owner;
    long version;
    Instant grantedAt;
    Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    /**
     * Check if the remaining lifetime is within the renewal margin
     */
    public boolean needsRenewalAt(Instant now, long renewalMarginMs) {
        return !now.isBefore(expiresAt.minusMillis(renewalMarginMs));
    }
}
