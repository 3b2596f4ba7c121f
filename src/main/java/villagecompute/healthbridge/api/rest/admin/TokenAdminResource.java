/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.rest.admin;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.healthbridge.api.filters.AdminSecured;
import villagecompute.healthbridge.api.types.AdminErrorType;
import villagecompute.healthbridge.api.types.AdminHealthType;
import villagecompute.healthbridge.api.types.AuthorizationUrlType;
import villagecompute.healthbridge.api.types.CodeExchangeRequestType;
import villagecompute.healthbridge.api.types.ConfigStatusType;
import villagecompute.healthbridge.api.types.RefreshResultType;
import villagecompute.healthbridge.api.types.TokenSummaryType;
import villagecompute.healthbridge.config.WithingsConfig;
import villagecompute.healthbridge.exceptions.ConfigurationException;
import villagecompute.healthbridge.exceptions.InvalidCredentialException;
import villagecompute.healthbridge.exceptions.TransientVendorException;
import villagecompute.healthbridge.integration.railway.RailwayClient;
import villagecompute.healthbridge.integration.withings.WithingsOAuthClient;
import villagecompute.healthbridge.jobs.TokenRefreshScheduler;
import villagecompute.healthbridge.observability.LoggingConfig;
import villagecompute.healthbridge.services.TokenRefreshCoordinator;

/**
 * Operator endpoints for the Withings token lifecycle.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /admin/health} - liveness, no authentication</li>
 * <li>{@code GET /admin/token/status} - derived token status</li>
 * <li>{@code POST /admin/token/refresh} - force a refresh now</li>
 * <li>{@code GET /admin/oauth/authorize-url} - consent URL for (re-)authorization</li>
 * <li>{@code POST /admin/oauth/exchange} - exchange an authorization code</li>
 * <li>{@code GET /admin/scheduler/status} - background refresh status</li>
 * <li>{@code GET /admin/config} - which settings are present</li>
 * </ul>
 *
 * <p>
 * Everything except health requires the {@code X-Admin-Token} header (see {@link AdminSecured}). Vendor errors map to
 * HTTP status as follows: invalid credential 409, transient 503, configuration 500.
 */
@Path("/admin")
@Tag(
        name = "Admin - Tokens",
        description = "Withings OAuth token management (requires X-Admin-Token)")
@SecurityRequirement(
        name = "adminToken")
@Produces(MediaType.APPLICATION_JSON)
public class TokenAdminResource {

    private static final Logger LOG = Logger.getLogger(TokenAdminResource.class);

    @Inject
    TokenRefreshCoordinator coordinator;

    @Inject
    TokenRefreshScheduler scheduler;

    @Inject
    WithingsOAuthClient oauthClient;

    @Inject
    WithingsConfig withingsConfig;

    @Inject
    RailwayClient railwayClient;

    @ConfigProperty(
            name = "healthbridge.admin.api-token")
    Optional<String> adminToken;

    @GET
    @Path("/health")
    @Operation(
            summary = "Admin liveness check")
    public Response health() {
        boolean secured = adminToken.filter(t -> !t.isBlank()).isPresent();
        return Response.ok(new AdminHealthType("ok", "admin", Instant.now(), secured)).build();
    }

    @GET
    @Path("/token/status")
    @AdminSecured
    @Operation(
            summary = "Current token status",
            description = "Expiry, hours remaining, whether a refresh is due and the coordinator state")
    public Response tokenStatus() {
        try {
            return Response.ok(coordinator.status()).build();
        } catch (ConfigurationException e) {
            LOG.errorf("Token status unavailable: %s", e.getMessage());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(AdminErrorType.of("configuration", e.getMessage())).build();
        }
    }

    /**
     * Forces a token refresh.
     *
     * @param propagate
     *            mirror the new pair to Railway (default true)
     * @param redeploy
     *            redeploy the Railway service afterwards (default false)
     * @return new expiry and sync outcome, or the error taxonomy member
     */
    @POST
    @Path("/token/refresh")
    @AdminSecured
    @Operation(
            summary = "Refresh the token now")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Refreshed"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Refresh token rejected; re-authorization required"),
                    @APIResponse(
                            responseCode = "503",
                            description = "Transient vendor failure; retry later")})
    public Response refresh(@QueryParam("propagate") @DefaultValue("true") boolean propagate,
            @QueryParam("redeploy") @DefaultValue("false") boolean redeploy) {
        LoggingConfig.setRequestOrigin("/admin/token/refresh");
        try {
            RefreshResultType result = coordinator.refresh(TokenRefreshCoordinator.Trigger.ADMIN, propagate,
                    redeploy);
            return Response.ok(result).build();
        } catch (InvalidCredentialException e) {
            return invalidCredential(e);
        } catch (TransientVendorException e) {
            return transientFailure(e);
        } catch (ConfigurationException e) {
            return configurationFailure(e);
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @GET
    @Path("/oauth/authorize-url")
    @AdminSecured
    @Operation(
            summary = "Withings consent URL")
    public Response authorizeUrl() {
        String state = newState();
        String url = oauthClient.buildAuthorizationUrl(withingsConfig.getClientId(), withingsConfig.getRedirectUri(),
                state);
        return Response.ok(new AuthorizationUrlType(url, state)).build();
    }

    /**
     * Exchanges an authorization code and stores the resulting pair.
     *
     * @param request
     *            body with the authorization code
     * @return masked summary of the new pair
     */
    @POST
    @Path("/oauth/exchange")
    @AdminSecured
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(
            summary = "Exchange an authorization code")
    @APIResponses(
            value = {@APIResponse(
                    responseCode = "200",
                    description = "Token pair stored"),
                    @APIResponse(
                            responseCode = "400",
                            description = "Missing code"),
                    @APIResponse(
                            responseCode = "409",
                            description = "Code rejected by Withings")})
    public Response exchange(@Valid CodeExchangeRequestType request) {
        if (request == null || request.code() == null || request.code().isBlank()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(AdminErrorType.of("bad_request", "Authorization code is required")).build();
        }

        LoggingConfig.setRequestOrigin("/admin/oauth/exchange");
        try {
            TokenSummaryType summary = coordinator.exchangeCode(request.code());
            return Response.ok(summary).build();
        } catch (InvalidCredentialException e) {
            return invalidCredential(e);
        } catch (TransientVendorException e) {
            return transientFailure(e);
        } catch (ConfigurationException e) {
            return configurationFailure(e);
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    @GET
    @Path("/scheduler/status")
    @AdminSecured
    public Response schedulerStatus() {
        return Response.ok(scheduler.status()).build();
    }

    @GET
    @Path("/config")
    @AdminSecured
    @Operation(
            summary = "Which settings are present",
            description = "Reports presence only; secret values are never returned")
    public Response config() {
        boolean clientConfigured = !withingsConfig.getClientId().isBlank()
                && !withingsConfig.getClientSecret().isBlank();
        ConfigStatusType status = new ConfigStatusType(clientConfigured, withingsConfig.getRedirectUri(),
                withingsConfig.getBootstrapRefreshToken().isPresent(), railwayClient.isConfigured(),
                railwayClient.getMissingConfig(), scheduler.isEnabled(), withingsConfig.getRefreshWindow().toHours());
        return Response.ok(status).build();
    }

    private Response invalidCredential(InvalidCredentialException e) {
        LOG.warnf("Admin token operation rejected by Withings: %s", e.getMessage());
        String reauthorizationUrl = oauthClient.buildAuthorizationUrl(withingsConfig.getClientId(),
                withingsConfig.getRedirectUri(), newState());
        return Response.status(Response.Status.CONFLICT)
                .entity(new AdminErrorType("invalid_credential", e.getMessage(), null, reauthorizationUrl)).build();
    }

    private Response transientFailure(TransientVendorException e) {
        LOG.warnf("Admin token operation failed transiently: %s", e.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(new AdminErrorType("transient", e.getMessage(), Boolean.TRUE, null)).build();
    }

    private Response configurationFailure(ConfigurationException e) {
        LOG.errorf("Admin token operation failed on configuration: %s", e.getMessage());
        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(AdminErrorType.of("configuration", e.getMessage())).build();
    }

    private static String newState() {
        return UUID.randomUUID().toString();
    }
}
