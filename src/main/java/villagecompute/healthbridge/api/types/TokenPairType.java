/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import java.time.Duration;
import java.time.Instant;

import villagecompute.healthbridge.util.TokenMasker;

/**
 * Decrypted view of the live Withings credential.
 *
 * <p>
 * Produced by the OAuth client after a code exchange or refresh, and by the token store on load. {@link #toString()}
 * masks both tokens so instances are safe to log.
 *
 * @param accessToken
 *            the Withings access token
 * @param refreshToken
 *            the refresh token returned with it (replaces the previous one)
 * @param expiresAt
 *            completion time of the vendor call plus {@code expires_in}
 * @param lastRefreshedAt
 *            completion time of the vendor call that produced this pair
 * @param vendorUserId
 *            the Withings user id the grant belongs to
 * @param scope
 *            granted scopes (comma-separated)
 */
public record TokenPairType(String accessToken, String refreshToken, Instant expiresAt, Instant lastRefreshedAt,
        String vendorUserId, String scope) {

    /**
     * Whether the pair has entered the proactive refresh window.
     *
     * @param now
     *            the current instant
     * @param window
     *            look-ahead window before expiry
     * @return true once {@code now >= expiresAt - window}, including after expiry
     */
    public boolean isDueForRefresh(Instant now, Duration window) {
        return !now.isBefore(expiresAt.minus(window));
    }

    /**
     * @param now
     *            the current instant
     * @return true at or after the expiry instant
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "TokenPairType[accessToken=" + TokenMasker.mask(accessToken) + ", refreshToken="
                + TokenMasker.mask(refreshToken) + ", expiresAt=" + expiresAt + ", lastRefreshedAt=" + lastRefreshedAt
                + ", vendorUserId=" + vendorUserId + ", scope=" + scope + "]";
    }
}
