/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of mirroring the token pair into the Railway variable store.
 *
 * <p>
 * A failed or skipped sync is a warning only; the token pair it describes has already been persisted.
 *
 * @param attempted
 *            whether a push was requested and Railway was configured
 * @param persisted
 *            whether Railway accepted the variables
 * @param redeployTriggered
 *            whether a redeploy was requested and accepted
 * @param message
 *            explanation when nothing was persisted, or when the redeploy failed
 */
public record ConfigSyncResultType(boolean attempted, boolean persisted,
        @JsonProperty("redeploy_triggered") boolean redeployTriggered, String message) {

    public static ConfigSyncResultType notRequested() {
        return new ConfigSyncResultType(false, false, false, "Propagation not requested");
    }

    public static ConfigSyncResultType skipped(String message) {
        return new ConfigSyncResultType(false, false, false, message);
    }

    public static ConfigSyncResultType failed(String message) {
        return new ConfigSyncResultType(true, false, false, message);
    }

    public static ConfigSyncResultType persisted(boolean redeployTriggered, String message) {
        return new ConfigSyncResultType(true, true, redeployTriggered, message);
    }
}
