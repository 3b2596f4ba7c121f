/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.filters;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.annotation.Priority;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import villagecompute.healthbridge.api.types.AdminErrorType;

/**
 * Shared-secret authentication for {@code @AdminSecured} endpoints.
 *
 * <p>
 * Compares the {@code X-Admin-Token} header against {@code healthbridge.admin.api-token} (ADMIN_API_TOKEN) in
 * constant time.
 *
 * <p>
 * <b>Responses:</b>
 * <ul>
 * <li>503 when no admin token is configured, so an unconfigured deployment never exposes token operations</li>
 * <li>401 when the header is missing or does not match</li>
 * </ul>
 */
@Provider
@AdminSecured
@Priority(Priorities.AUTHENTICATION)
public class AdminTokenFilter implements ContainerRequestFilter {

    private static final Logger LOG = Logger.getLogger(AdminTokenFilter.class);

    public static final String HEADER = "X-Admin-Token";

    @ConfigProperty(
            name = "healthbridge.admin.api-token")
    Optional<String> adminToken;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        Optional<String> expected = adminToken.filter(t -> !t.isBlank());
        if (expected.isEmpty()) {
            LOG.warnf("Rejected admin request to %s: ADMIN_API_TOKEN not configured",
                    requestContext.getUriInfo().getPath());
            requestContext.abortWith(error(Response.Status.SERVICE_UNAVAILABLE, "unavailable",
                    "Admin API is disabled: ADMIN_API_TOKEN not configured"));
            return;
        }

        String provided = requestContext.getHeaderString(HEADER);
        if (provided == null || !MessageDigest.isEqual(provided.getBytes(StandardCharsets.UTF_8),
                expected.get().getBytes(StandardCharsets.UTF_8))) {
            LOG.warnf("Rejected admin request to %s: invalid or missing %s header",
                    requestContext.getUriInfo().getPath(), HEADER);
            requestContext.abortWith(error(Response.Status.UNAUTHORIZED, "unauthorized", "Invalid admin token"));
        }
    }

    private static Response error(Response.Status status, String error, String message) {
        return Response.status(status).type(MediaType.APPLICATION_JSON).entity(AdminErrorType.of(error, message))
                .build();
    }
}
