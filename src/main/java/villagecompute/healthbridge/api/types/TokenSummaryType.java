/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.healthbridge.util.TokenMasker;

/**
 * Masked summary of a freshly obtained token pair, returned by the code exchange endpoint.
 */
public record TokenSummaryType(@JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken, @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("last_refreshed_at") Instant lastRefreshedAt, @JsonProperty("user_id") String userId,
        @JsonProperty("scope") String scope, @JsonProperty("sync") ConfigSyncResultType sync) {

    public static TokenSummaryType of(TokenPairType pair, ConfigSyncResultType sync) {
        return new TokenSummaryType(TokenMasker.mask(pair.accessToken()), TokenMasker.mask(pair.refreshToken()),
                pair.expiresAt(), pair.lastRefreshedAt(), pair.vendorUserId(), pair.scope(), sync);
    }
}
