/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.integration.withings;

import java.util.Map;

import org.jboss.logging.Logger;

/**
 * Maps numeric Withings response statuses to a {@link VendorOutcome}.
 *
 * <p>
 * Withings answers logical errors with HTTP 200 and a non-zero {@code status} field, so the numeric code is the only
 * reliable signal. Error strings are never inspected.
 *
 * <p>
 * Statuses absent from the table are treated as {@link VendorOutcome#TRANSIENT}: retrying an unknown failure on the
 * next tick is harmless, while discarding a credential is not.
 *
 * <p>
 * See: https://developer.withings.com/api-reference/#section/Response-status
 */
public final class WithingsStatus {

    private static final Logger LOG = Logger.getLogger(WithingsStatus.class);

    public static final int OK = 0;
    public static final int INVALID_AUTHORIZATION_CODE = 29;
    public static final int INVALID_REFRESH_TOKEN = 503;

    private static final Map<Integer, VendorOutcome> OUTCOMES = Map.ofEntries(Map.entry(OK, VendorOutcome.SUCCESS),
            Map.entry(INVALID_AUTHORIZATION_CODE, VendorOutcome.INVALID_CREDENTIAL),
            Map.entry(100, VendorOutcome.INVALID_CREDENTIAL), Map.entry(101, VendorOutcome.INVALID_CREDENTIAL),
            Map.entry(102, VendorOutcome.INVALID_CREDENTIAL), Map.entry(200, VendorOutcome.INVALID_CREDENTIAL),
            Map.entry(214, VendorOutcome.INVALID_CREDENTIAL), Map.entry(277, VendorOutcome.INVALID_CREDENTIAL),
            Map.entry(401, VendorOutcome.INVALID_CREDENTIAL),
            Map.entry(INVALID_REFRESH_TOKEN, VendorOutcome.INVALID_CREDENTIAL),
            Map.entry(2554, VendorOutcome.INVALID_CREDENTIAL), Map.entry(2555, VendorOutcome.INVALID_CREDENTIAL),
            Map.entry(522, VendorOutcome.TRANSIENT), Map.entry(601, VendorOutcome.TRANSIENT),
            Map.entry(2553, VendorOutcome.TRANSIENT));

    private WithingsStatus() {
        // Utility class, no instantiation
    }

    /**
     * Classifies a Withings status code.
     *
     * @param status
     *            the {@code status} field of the response envelope
     * @return the mapped outcome
     */
    public static VendorOutcome classify(int status) {
        VendorOutcome outcome = OUTCOMES.get(status);
        if (outcome == null) {
            LOG.warnf("Unmapped Withings status %d, treating as transient", status);
            return VendorOutcome.TRANSIENT;
        }
        return outcome;
    }
}
