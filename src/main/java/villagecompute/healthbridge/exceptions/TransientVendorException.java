/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.exceptions;

/**
 * Exception thrown when a Withings call fails for a reason that is safe to retry.
 *
 * <p>
 * Covers connection failures, timeouts, non-2xx HTTP responses, throttling statuses and malformed success envelopes.
 * The scheduler absorbs these and retries on its next tick; admin-triggered calls surface them as retryable.
 */
public class TransientVendorException extends RuntimeException {

    public TransientVendorException(String message) {
        super(message);
    }

    public TransientVendorException(String message, Throwable cause) {
        super(message, cause);
    }
}
