/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Which settings are present. Never carries secret values.
 *
 * @param withingsClientConfigured
 *            client id and secret are set
 * @param redirectUri
 *            OAuth callback URL (not secret)
 * @param bootstrapTokenConfigured
 *            a bootstrap refresh token is set
 * @param railwayConfigured
 *            all Railway settings are set
 * @param railwayMissing
 *            names of unset Railway environment variables
 * @param schedulerEnabled
 *            automatic refresh is on
 * @param refreshWindowHours
 *            look-ahead window in hours
 */
public record ConfigStatusType(@JsonProperty("withings_client_configured") boolean withingsClientConfigured,
        @JsonProperty("redirect_uri") String redirectUri,
        @JsonProperty("bootstrap_token_configured") boolean bootstrapTokenConfigured,
        @JsonProperty("railway_configured") boolean railwayConfigured,
        @JsonProperty("railway_missing") List<String> railwayMissing,
        @JsonProperty("scheduler_enabled") boolean schedulerEnabled,
        @JsonProperty("refresh_window_hours") long refreshWindowHours) {
}
