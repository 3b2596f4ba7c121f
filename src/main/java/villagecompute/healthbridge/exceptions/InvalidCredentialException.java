/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.exceptions;

/**
 * Exception thrown when Withings rejects an authorization code or refresh token.
 *
 * <p>
 * This is the signal that a human has to re-authorize the application. It is never retried automatically and always
 * reaches the caller (scheduler log or admin response).
 */
public class InvalidCredentialException extends RuntimeException {

    private final Integer vendorStatus;

    public InvalidCredentialException(String message) {
        this(message, null);
    }

    public InvalidCredentialException(String message, Integer vendorStatus) {
        super(message);
        this.vendorStatus = vendorStatus;
    }

    /**
     * @return the numeric Withings status that caused the rejection, or null when the rejection was local
     */
    public Integer getVendorStatus() {
        return vendorStatus;
    }
}
