/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a successful token refresh.
 *
 * @param expiresAt
 *            expiry of the new access token
 * @param expiresInSeconds
 *            seconds from refresh completion to expiry
 * @param lastRefreshedAt
 *            completion time of the vendor call
 * @param sync
 *            result of mirroring the pair to Railway
 */
public record RefreshResultType(@JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("expires_in_seconds") long expiresInSeconds,
        @JsonProperty("last_refreshed_at") Instant lastRefreshedAt, @JsonProperty("sync") ConfigSyncResultType sync) {

    public static RefreshResultType of(TokenPairType pair, ConfigSyncResultType sync) {
        long expiresIn = pair.expiresAt().getEpochSecond() - pair.lastRefreshedAt().getEpochSecond();
        return new RefreshResultType(pair.expiresAt(), expiresIn, pair.lastRefreshedAt(), sync);
    }
}
