/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.data.models;

import java.time.Instant;
import java.util.Optional;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * The single live Withings credential row for this deployment.
 *
 * <p>
 * There is exactly one row, keyed by {@link #SINGLETON_ID}. Every refresh overwrites it; no history is kept. Token
 * columns hold ciphertext produced by {@link villagecompute.healthbridge.services.TokenCipher} and are only read
 * through {@link villagecompute.healthbridge.services.TokenStore}.
 */
@Entity
@Table(
        name = "oauth_token_records")
public class TokenRecord extends PanacheEntityBase {

    public static final long SINGLETON_ID = 1L;

    @Id
    public Long id;

    @Column(
            name = "access_token_encrypted",
            nullable = false,
            columnDefinition = "TEXT")
    public String accessTokenEncrypted;

    @Column(
            name = "refresh_token_encrypted",
            nullable = false,
            columnDefinition = "TEXT")
    public String refreshTokenEncrypted;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    @Column(
            name = "last_refreshed_at",
            nullable = false)
    public Instant lastRefreshedAt;

    @Column(
            name = "vendor_user_id")
    public String vendorUserId;

    @Column
    public String scope;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Finds the live credential row.
     *
     * @return the row, or empty before the first successful authorization
     */
    public static Optional<TokenRecord> findCurrent() {
        return findByIdOptional(SINGLETON_ID);
    }
}
