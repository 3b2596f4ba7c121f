/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.exceptions;

/**
 * Exception thrown when required deployment configuration is missing or malformed.
 *
 * <p>
 * Raised at startup for an absent or invalid token encryption key and for missing Withings client credentials. This is
 * a fatal condition: the application refuses to start and the error is never retried.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
