/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Withings OAuth 2.0 token response envelope.
 *
 * <p>
 * Returned by POST https://wbsapi.withings.net/v2/oauth2 ({@code action=requesttoken}) for both the
 * {@code authorization_code} and {@code refresh_token} grants.
 *
 * @param status
 *            Withings status code (0 on success)
 * @param body
 *            token payload, present on success
 * @param error
 *            human-readable error, present on failure
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record WithingsTokenResponseType(Integer status, Body body, String error) {

    /**
     * Token payload.
     *
     * @param userId
     *            Withings user id
     * @param accessToken
     *            the access token
     * @param refreshToken
     *            the rotated refresh token
     * @param expiresIn
     *            access token lifetime in seconds (typically 10800)
     * @param scope
     *            granted scopes
     * @param tokenType
     *            always "Bearer"
     */
    @JsonIgnoreProperties(
            ignoreUnknown = true)
    public record Body(@JsonProperty("userid") String userId, @JsonProperty("access_token") String accessToken,
            @JsonProperty("refresh_token") String refreshToken, @JsonProperty("expires_in") Long expiresIn,
            String scope, @JsonProperty("token_type") String tokenType) {

        @Override
        public String toString() {
            return "Body[userId=" + userId + ", expiresIn=" + expiresIn + ", scope=" + scope + "]";
        }
    }
}
