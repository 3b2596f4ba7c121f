/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.services;

import java.util.LinkedHashMap;
import java.util.Map;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.healthbridge.api.types.ConfigSyncResultType;
import villagecompute.healthbridge.api.types.TokenPairType;
import villagecompute.healthbridge.exceptions.ConfigSyncException;
import villagecompute.healthbridge.integration.railway.RailwayClient;

/**
 * Best-effort propagation of the live token pair to the Railway deployment variables.
 *
 * <p>
 * Runs strictly after the token store commit. Every failure is logged and returned as a warning on
 * {@link ConfigSyncResultType}; nothing here throws into the caller or rolls back the stored pair.
 *
 * <p>
 * Variable values are derived only from the pair itself, so pushing the same pair twice writes the same values.
 */
@ApplicationScoped
public class ConfigSyncService {

    private static final Logger LOG = Logger.getLogger(ConfigSyncService.class);

    public static final String VAR_ACCESS_TOKEN = "WITHINGS_ACCESS_TOKEN";
    public static final String VAR_REFRESH_TOKEN = "WITHINGS_REFRESH_TOKEN";
    public static final String VAR_EXPIRES_AT = "WITHINGS_TOKEN_EXPIRES_AT";
    public static final String VAR_LAST_REFRESHED = "WITHINGS_TOKEN_LAST_REFRESHED";

    @Inject
    RailwayClient railwayClient;

    /**
     * Pushes the pair to Railway.
     *
     * @param pair
     *            the pair that was just persisted
     * @param redeploy
     *            whether to redeploy the service after a successful upsert
     * @return the sync outcome (never null)
     */
    public ConfigSyncResultType push(TokenPairType pair, boolean redeploy) {
        if (!railwayClient.isConfigured()) {
            String message = "Railway not configured, tokens not mirrored. Missing: "
                    + String.join(", ", railwayClient.getMissingConfig());
            LOG.debug(message);
            return ConfigSyncResultType.skipped(message);
        }

        try {
            railwayClient.upsertVariables(toVariables(pair));
        } catch (ConfigSyncException e) {
            LOG.warnf("Token pair persisted but Railway sync failed: %s", e.getMessage());
            return ConfigSyncResultType.failed(e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Token pair persisted but Railway sync failed unexpectedly");
            return ConfigSyncResultType.failed("Railway sync failed: " + e.getMessage());
        }

        if (!redeploy) {
            return ConfigSyncResultType.persisted(false, "Railway variables updated");
        }

        try {
            railwayClient.redeploy();
            return ConfigSyncResultType.persisted(true, "Railway variables updated and redeploy triggered");
        } catch (ConfigSyncException e) {
            LOG.warnf("Railway variables updated but redeploy failed: %s", e.getMessage());
            return ConfigSyncResultType.persisted(false, "Railway variables updated; redeploy failed: " + e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Railway variables updated but redeploy failed unexpectedly");
            return ConfigSyncResultType.persisted(false, "Railway variables updated; redeploy failed: " + e.getMessage());
        }
    }

    /**
     * Builds the fixed variable set for a pair.
     *
     * @param pair
     *            the token pair
     * @return ordered variable map
     */
    Map<String, String> toVariables(TokenPairType pair) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put(VAR_ACCESS_TOKEN, pair.accessToken());
        variables.put(VAR_REFRESH_TOKEN, pair.refreshToken());
        variables.put(VAR_EXPIRES_AT, pair.expiresAt().toString());
        variables.put(VAR_LAST_REFRESHED, pair.lastRefreshedAt().toString());
        return variables;
    }
}
