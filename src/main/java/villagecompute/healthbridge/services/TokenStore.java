/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.services;

import java.time.Instant;
import java.util.Optional;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.healthbridge.api.types.TokenPairType;
import villagecompute.healthbridge.data.models.TokenRecord;

/**
 * Persistence for the single live Withings credential.
 *
 * <p>
 * Token values pass through {@link TokenCipher} on the way in and out. Each {@link #save(TokenPairType)} runs in its
 * own transaction and updates one row, so a concurrent {@link #load()} observes either the previous pair or the new
 * one, never a mix.
 *
 * <p>
 * <b>Invariants enforced on save:</b>
 * <ul>
 * <li>Access and refresh tokens are non-empty</li>
 * <li>{@code last_refreshed_at} never moves backwards</li>
 * </ul>
 */
@ApplicationScoped
public class TokenStore {

    private static final Logger LOG = Logger.getLogger(TokenStore.class);

    @Inject
    TokenCipher cipher;

    /**
     * Loads and decrypts the live credential.
     *
     * @return the current pair, or empty before the first authorization
     */
    @Transactional
    public Optional<TokenPairType> load() {
        return TokenRecord.findCurrent().map(this::toType);
    }

    /**
     * Overwrites the live credential with a new pair.
     *
     * <p>
     * Withings has already rotated the refresh token by the time a pair arrives here, so a pair is never rejected for
     * its timestamp. If the clock stepped backwards, {@code last_refreshed_at} keeps the stored value.
     *
     * @param pair
     *            the pair returned by Withings
     * @throws IllegalArgumentException
     *             if either token is empty
     */
    @Transactional
    public void save(TokenPairType pair) {
        if (pair.accessToken() == null || pair.accessToken().isEmpty() || pair.refreshToken() == null
                || pair.refreshToken().isEmpty()) {
            throw new IllegalArgumentException("Refusing to persist a token pair with an empty token");
        }
        if (pair.expiresAt() == null || pair.lastRefreshedAt() == null) {
            throw new IllegalArgumentException("Token pair must carry expires_at and last_refreshed_at");
        }

        Instant now = Instant.now();
        Instant refreshedAt = pair.lastRefreshedAt();
        TokenRecord record = TokenRecord.findCurrent().orElse(null);
        if (record == null) {
            record = new TokenRecord();
            record.id = TokenRecord.SINGLETON_ID;
            record.createdAt = now;
        } else if (refreshedAt.isBefore(record.lastRefreshedAt)) {
            LOG.warnf("Clock went backwards: stored token refreshed at %s, new pair at %s; keeping the later time",
                    record.lastRefreshedAt, refreshedAt);
            refreshedAt = record.lastRefreshedAt;
        }

        record.accessTokenEncrypted = cipher.encrypt(pair.accessToken());
        record.refreshTokenEncrypted = cipher.encrypt(pair.refreshToken());
        record.expiresAt = pair.expiresAt();
        record.lastRefreshedAt = refreshedAt;
        record.vendorUserId = pair.vendorUserId();
        record.scope = pair.scope();
        record.updatedAt = now;
        record.persist();

        LOG.infof("Persisted token pair %s", pair);
    }

    private TokenPairType toType(TokenRecord record) {
        return new TokenPairType(cipher.decrypt(record.accessTokenEncrypted),
                cipher.decrypt(record.refreshTokenEncrypted), record.expiresAt, record.lastRefreshedAt,
                record.vendorUserId, record.scope);
    }
}
