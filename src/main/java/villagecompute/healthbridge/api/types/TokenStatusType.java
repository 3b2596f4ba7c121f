/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Derived view of the stored credential for the admin status endpoint.
 *
 * <p>
 * When nothing is stored only {@code configured=false}, {@code should_refresh=true} and the coordinator state are
 * populated.
 *
 * @param configured
 *            whether a token pair is stored
 * @param expiresAt
 *            expiry of the stored access token
 * @param expiresInHours
 *            hours until expiry, rounded to two decimals (negative once expired)
 * @param shouldRefresh
 *            true iff now is within the look-ahead window of expiry
 * @param lastRefreshedAt
 *            when the stored pair was obtained
 * @param expired
 *            true at or after expiry
 * @param state
 *            refresh coordinator state (IDLE, REFRESHING, FAILED)
 * @param failureReason
 *            why the coordinator is FAILED, otherwise null
 */
public record TokenStatusType(@JsonProperty("configured") boolean configured,
        @JsonProperty("expires_at") Instant expiresAt, @JsonProperty("expires_in_hours") Double expiresInHours,
        @JsonProperty("should_refresh") boolean shouldRefresh,
        @JsonProperty("last_refreshed_at") Instant lastRefreshedAt, @JsonProperty("expired") boolean expired,
        @JsonProperty("state") String state, @JsonProperty("failure_reason") String failureReason) {
}
