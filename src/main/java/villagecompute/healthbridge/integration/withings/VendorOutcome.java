/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.integration.withings;

/**
 * Outcome taxonomy every Withings OAuth response is reduced to.
 */
public enum VendorOutcome {

    /** Status 0: the body carries a usable token pair. */
    SUCCESS,

    /** The authorization code or refresh token was rejected; user re-authorization is required. */
    INVALID_CREDENTIAL,

    /** Network failure, timeout, throttling or unknown status; safe to retry later. */
    TRANSIENT
}
