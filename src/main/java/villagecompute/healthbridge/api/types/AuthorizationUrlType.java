/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param authorizationUrl
 *            Withings consent URL to open in a browser
 * @param state
 *            CSRF value embedded in the URL
 */
public record AuthorizationUrlType(@JsonProperty("authorization_url") String authorizationUrl,
        @JsonProperty("state") String state) {
}
