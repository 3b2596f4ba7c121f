/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.config;

import java.time.Duration;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.healthbridge.exceptions.ConfigurationException;
import villagecompute.healthbridge.util.TokenMasker;

/**
 * Deployment-time Withings application credentials and refresh policy.
 *
 * <p>
 * Client id and secret are long-lived, supplied by the deployment, and never mutated or persisted by the token
 * lifecycle. Startup fails with {@link ConfigurationException} when either is missing.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code healthbridge.withings.client-id} - Withings application client id (WITHINGS_CLIENT_ID)</li>
 * <li>{@code healthbridge.withings.client-secret} - Withings application secret (WITHINGS_CLIENT_SECRET)</li>
 * <li>{@code healthbridge.withings.redirect-uri} - OAuth callback registered with Withings</li>
 * <li>{@code healthbridge.withings.bootstrap-refresh-token} - optional refresh token used to seed an empty store
 * (WITHINGS_REFRESH_TOKEN)</li>
 * <li>{@code healthbridge.token.refresh-window} - proactive refresh look-ahead (default: 24h)</li>
 * </ul>
 */
@ApplicationScoped
@Startup
public class WithingsConfig {

    private static final Logger LOG = Logger.getLogger(WithingsConfig.class);

    @ConfigProperty(
            name = "healthbridge.withings.client-id",
            defaultValue = "")
    String clientId;

    @ConfigProperty(
            name = "healthbridge.withings.client-secret",
            defaultValue = "")
    String clientSecret;

    @ConfigProperty(
            name = "healthbridge.withings.redirect-uri",
            defaultValue = "http://localhost:8080/auth/withings/callback")
    String redirectUri;

    @ConfigProperty(
            name = "healthbridge.withings.bootstrap-refresh-token")
    Optional<String> bootstrapRefreshToken;

    @ConfigProperty(
            name = "healthbridge.token.refresh-window",
            defaultValue = "24h")
    Duration refreshWindow;

    /**
     * Validates that the application credentials are present.
     *
     * @throws ConfigurationException
     *             if client id or secret is missing
     */
    @PostConstruct
    public void validateConfiguration() {
        if (clientId == null || clientId.isBlank()) {
            fail("WITHINGS_CLIENT_ID is not configured");
        }
        if (clientSecret == null || clientSecret.isBlank()) {
            fail("WITHINGS_CLIENT_SECRET is not configured");
        }
        if (refreshWindow == null || refreshWindow.isNegative()) {
            fail("healthbridge.token.refresh-window must be a non-negative duration");
        }
        LOG.infof("Withings credentials configured: client_id=%s, refresh window=%s, bootstrap token=%s",
                TokenMasker.mask(clientId), refreshWindow, getBootstrapRefreshToken().isPresent() ? "present" : "absent");
    }

    private void fail(String message) {
        LOG.fatal(message);
        throw new ConfigurationException(message);
    }

    public String getClientId() {
        return clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public String getRedirectUri() {
        return redirectUri;
    }

    public Duration getRefreshWindow() {
        return refreshWindow;
    }

    public Optional<String> getBootstrapRefreshToken() {
        return bootstrapRefreshToken == null ? Optional.empty() : bootstrapRefreshToken.filter(t -> !t.isBlank());
    }
}
