/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.services;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.healthbridge.exceptions.ConfigurationException;

/**
 * Symmetric encryption of OAuth token material at rest.
 *
 * <p>
 * Uses AES-256-GCM with a fresh 12-byte IV per call, so encrypting the same value twice yields different ciphertexts.
 * The stored form is Base64({@code iv || ciphertext || tag}). Only a holder of the process-wide key can decrypt.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code healthbridge.token.encryption-key} - Base64-encoded 32-byte key (from TOKEN_ENCRYPTION_KEY env var)</li>
 * </ul>
 *
 * <p>
 * The key is validated at startup. A missing or malformed key aborts boot with {@link ConfigurationException}. Neither
 * plaintext nor ciphertext is ever logged.
 */
@ApplicationScoped
@Startup
public class TokenCipher {

    private static final Logger LOG = Logger.getLogger(TokenCipher.class);

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int IV_LENGTH_BYTES = 12;
    private static final int TAG_LENGTH_BITS = 128;

    @ConfigProperty(
            name = "healthbridge.token.encryption-key",
            defaultValue = "")
    String encryptionKey;

    private final SecureRandom secureRandom = new SecureRandom();

    private SecretKey secretKey;

    /**
     * Decodes and validates the encryption key.
     *
     * @throws ConfigurationException
     *             if the key is absent, not Base64, or not 32 bytes long
     */
    @PostConstruct
    public void init() {
        if (encryptionKey == null || encryptionKey.isBlank()) {
            String message = "TOKEN_ENCRYPTION_KEY is not configured. Token storage requires a Base64-encoded "
                    + "32-byte key.";
            LOG.fatal(message);
            throw new ConfigurationException(message);
        }

        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encryptionKey.trim());
        } catch (IllegalArgumentException e) {
            String message = "TOKEN_ENCRYPTION_KEY is not valid Base64";
            LOG.fatal(message);
            throw new ConfigurationException(message, e);
        }

        if (keyBytes.length != KEY_LENGTH_BYTES) {
            String message = String.format("TOKEN_ENCRYPTION_KEY must decode to %d bytes, got %d", KEY_LENGTH_BYTES,
                    keyBytes.length);
            LOG.fatal(message);
            throw new ConfigurationException(message);
        }

        secretKey = new SecretKeySpec(keyBytes, "AES");
        LOG.info("Token cipher initialized (AES-256-GCM)");
    }

    /**
     * Encrypts a token value.
     *
     * @param plaintext
     *            the value to protect (empty string allowed)
     * @return Base64 ciphertext including IV and authentication tag
     */
    public String encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        try {
            byte[] iv = new byte[IV_LENGTH_BYTES];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key(), new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            ByteBuffer buffer = ByteBuffer.allocate(iv.length + sealed.length);
            buffer.put(iv).put(sealed);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Token encryption failed", e);
        }
    }

    /**
     * Decrypts a value produced by {@link #encrypt(String)}.
     *
     * @param ciphertext
     *            Base64 ciphertext
     * @return the original plaintext
     * @throws ConfigurationException
     *             if the value cannot be authenticated with the configured key (rotated key or corrupted row)
     */
    public String decrypt(String ciphertext) {
        if (ciphertext == null) {
            throw new IllegalArgumentException("ciphertext must not be null");
        }
        try {
            byte[] payload = Base64.getDecoder().decode(ciphertext);
            if (payload.length < IV_LENGTH_BYTES) {
                throw new ConfigurationException("Stored token ciphertext is truncated");
            }

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key(), new GCMParameterSpec(TAG_LENGTH_BITS, payload, 0, IV_LENGTH_BYTES));
            byte[] plain = cipher.doFinal(payload, IV_LENGTH_BYTES, payload.length - IV_LENGTH_BYTES);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw new ConfigurationException(
                    "Stored token could not be decrypted; the encryption key may have changed", e);
        }
    }

    private SecretKey key() {
        if (secretKey == null) {
            throw new ConfigurationException("Token cipher used before initialization");
        }
        return secretKey;
    }
}
