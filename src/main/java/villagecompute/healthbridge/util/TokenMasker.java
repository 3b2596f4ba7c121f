/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.util;

/**
 * Renders secret values for logs and admin responses.
 *
 * <p>
 * Only the last {@value #VISIBLE_SUFFIX_LENGTH} characters are kept; everything before them is replaced by
 * {@value #MASK}. Values no longer than the suffix are masked entirely.
 */
public final class TokenMasker {

    public static final String MASK = "****";
    public static final int VISIBLE_SUFFIX_LENGTH = 4;
    public static final String NONE = "[none]";

    private TokenMasker() {
        // Utility class, no instantiation
    }

    /**
     * Masks a secret value.
     *
     * @param secret
     *            the token or secret (may be null)
     * @return masked rendering safe to log
     */
    public static String mask(String secret) {
        if (secret == null) {
            return NONE;
        }
        if (secret.length() <= VISIBLE_SUFFIX_LENGTH) {
            return MASK;
        }
        return MASK + secret.substring(secret.length() - VISIBLE_SUFFIX_LENGTH);
    }
}
