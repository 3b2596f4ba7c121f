/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.exceptions;

/**
 * Exception thrown when propagating the token pair to the Railway variable store fails.
 *
 * <p>
 * Never escapes {@link villagecompute.healthbridge.services.ConfigSyncService}: it is converted into a warning on the
 * sync result and does not affect the validity of the token pair that was already persisted.
 */
public class ConfigSyncException extends RuntimeException {

    public ConfigSyncException(String message) {
        super(message);
    }

    public ConfigSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
