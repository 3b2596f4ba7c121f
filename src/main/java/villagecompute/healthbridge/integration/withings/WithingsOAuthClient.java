/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.integration.withings;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.healthbridge.api.types.TokenPairType;
import villagecompute.healthbridge.api.types.WithingsTokenResponseType;
import villagecompute.healthbridge.exceptions.InvalidCredentialException;
import villagecompute.healthbridge.exceptions.TransientVendorException;

/**
 * Client for the Withings OAuth 2.0 authorization code flow.
 *
 * <p>
 * Provides methods for:
 *
 * <ul>
 * <li>Generating the user consent URL (no network call)
 * <li>Exchanging an authorization code for a token pair
 * <li>Refreshing a token pair with the current refresh token
 * </ul>
 *
 * <p>
 * Every outbound call is bounded by {@code healthbridge.withings.timeout}. Outcomes are decided by
 * {@link WithingsStatus}: invalid credentials raise {@link InvalidCredentialException}, everything retryable raises
 * {@link TransientVendorException}.
 *
 * <p>
 * Configuration properties:
 *
 * <ul>
 * <li>healthbridge.withings.auth-url
 * <li>healthbridge.withings.api-base-url
 * <li>healthbridge.withings.scope
 * <li>healthbridge.withings.timeout
 * </ul>
 *
 * <p>
 * See: https://developer.withings.com/api-reference/#tag/oauth2
 */
@ApplicationScoped
public class WithingsOAuthClient {

    private static final Logger LOG = Logger.getLogger(WithingsOAuthClient.class);

    static final String TOKEN_PATH = "/v2/oauth2";

    @ConfigProperty(
            name = "healthbridge.withings.auth-url",
            defaultValue = "https://account.withings.com/oauth2_user/authorize2")
    String authUrl;

    @ConfigProperty(
            name = "healthbridge.withings.api-base-url",
            defaultValue = "https://wbsapi.withings.net")
    String apiBaseUrl;

    @ConfigProperty(
            name = "healthbridge.withings.scope",
            defaultValue = "user.metrics,user.activity,user.sleepevents")
    String scope;

    @ConfigProperty(
            name = "healthbridge.withings.timeout",
            defaultValue = "30s")
    Duration timeout;

    @Inject
    ObjectMapper objectMapper;

    private HttpClient httpClient;

    @PostConstruct
    void init() {
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    /**
     * Generate the Withings authorization URL.
     *
     * <p>
     * Builds the consent URL with {@code response_type=code}, {@code client_id}, {@code redirect_uri},
     * {@code scope} and {@code state}.
     *
     * @param clientId
     *            Withings application client id
     * @param redirectUri
     *            callback URL registered with Withings
     * @param state
     *            opaque CSRF value echoed back on the callback
     * @return full authorization URL
     */
    public String buildAuthorizationUrl(String clientId, String redirectUri, String state) {
        if (clientId == null || clientId.isBlank() || redirectUri == null || redirectUri.isBlank()) {
            throw new IllegalArgumentException("client_id and redirect_uri are required");
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("response_type", "code");
        params.put("client_id", clientId);
        params.put("redirect_uri", redirectUri);
        params.put("scope", scope);
        params.put("state", state);
        return authUrl + "?" + encode(params);
    }

    /**
     * Exchange an authorization code for a token pair.
     *
     * @param code
     *            authorization code from the OAuth callback
     * @param clientId
     *            Withings application client id
     * @param clientSecret
     *            Withings application secret
     * @param redirectUri
     *            the redirect URI used in the authorization request
     * @return the new token pair
     * @throws InvalidCredentialException
     *             if Withings rejects the code
     * @throws TransientVendorException
     *             on timeout, connection failure or an unusable response
     */
    public TokenPairType exchangeCode(String code, String clientId, String clientSecret, String redirectUri) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("action", "requesttoken");
        form.put("grant_type", "authorization_code");
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("code", code);
        form.put("redirect_uri", redirectUri);
        return requestToken(form, "authorization_code");
    }

    /**
     * Refresh the token pair.
     *
     * <p>
     * Withings rotates the refresh token on every call; the returned pair must replace the stored one.
     *
     * @param refreshToken
     *            the current refresh token
     * @param clientId
     *            Withings application client id
     * @param clientSecret
     *            Withings application secret
     * @return the new token pair
     * @throws InvalidCredentialException
     *             if the refresh token is invalid or revoked
     * @throws TransientVendorException
     *             on timeout, connection failure or an unusable response
     */
    public TokenPairType refresh(String refreshToken, String clientId, String clientSecret) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("action", "requesttoken");
        form.put("grant_type", "refresh_token");
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("refresh_token", refreshToken);
        return requestToken(form, "refresh_token");
    }

    private TokenPairType requestToken(Map<String, String> form, String grantType) {
        HttpRequest request = HttpRequest.newBuilder().uri(URI.create(apiBaseUrl + TOKEN_PATH)).timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encode(form))).build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            LOG.warnf("Withings %s request timed out after %s", grantType, timeout);
            throw new TransientVendorException("Withings token endpoint timed out", e);
        } catch (IOException e) {
            LOG.warnf("Withings %s request failed: %s", grantType, e.getMessage());
            throw new TransientVendorException("Withings token endpoint unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientVendorException("Interrupted while calling Withings token endpoint", e);
        }

        Instant completedAt = Instant.now();

        if (response.statusCode() / 100 != 2) {
            LOG.warnf("Withings %s returned HTTP %d", grantType, response.statusCode());
            throw new TransientVendorException("Withings token endpoint returned HTTP " + response.statusCode());
        }

        WithingsTokenResponseType envelope;
        try {
            envelope = objectMapper.readValue(response.body(), WithingsTokenResponseType.class);
        } catch (JsonProcessingException e) {
            throw new TransientVendorException("Withings token endpoint returned an unreadable body", e);
        }

        if (envelope.status() == null) {
            throw new TransientVendorException("Withings response is missing the status field");
        }

        int status = envelope.status();
        VendorOutcome outcome = WithingsStatus.classify(status);
        LOG.infof("Withings %s response status=%d outcome=%s", grantType, status, outcome);

        return switch (outcome) {
            case INVALID_CREDENTIAL -> throw new InvalidCredentialException(
                    String.format("Withings rejected %s (status %d: %s)", grantType, status, envelope.error()), status);
            case TRANSIENT -> throw new TransientVendorException(
                    String.format("Withings %s failed (status %d: %s)", grantType, status, envelope.error()));
            case SUCCESS -> toTokenPair(envelope.body(), completedAt);
        };
    }

    private TokenPairType toTokenPair(WithingsTokenResponseType.Body body, Instant completedAt) {
        if (body == null || isBlank(body.accessToken()) || isBlank(body.refreshToken()) || body.expiresIn() == null
                || body.expiresIn() <= 0) {
            throw new TransientVendorException("Withings success response is missing token fields: " + body);
        }
        return new TokenPairType(body.accessToken(), body.refreshToken(), completedAt.plusSeconds(body.expiresIn()),
                completedAt, body.userId(), body.scope());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String encode(Map<String, String> params) {
        return params.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue() == null ? "" : e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
