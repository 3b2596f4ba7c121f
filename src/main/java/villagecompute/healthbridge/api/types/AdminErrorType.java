/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body for admin endpoints. Absent fields are omitted from the JSON.
 *
 * @param error
 *            taxonomy name (invalid_credential, transient, configuration, bad_request, unauthorized, unavailable)
 * @param message
 *            human-readable detail
 * @param retryable
 *            set for transient failures
 * @param reauthorizationUrl
 *            consent URL to restart the OAuth flow, set for invalid credentials
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdminErrorType(@JsonProperty("error") String error, @JsonProperty("message") String message,
        @JsonProperty("retryable") Boolean retryable,
        @JsonProperty("reauthorization_url") String reauthorizationUrl) {

    public static AdminErrorType of(String error, String message) {
        return new AdminErrorType(error, message, null, null);
    }
}
