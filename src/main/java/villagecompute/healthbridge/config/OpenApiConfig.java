/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.config;

import org.eclipse.microprofile.openapi.annotations.Components;
import org.eclipse.microprofile.openapi.annotations.OpenAPIDefinition;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeIn;
import org.eclipse.microprofile.openapi.annotations.enums.SecuritySchemeType;
import org.eclipse.microprofile.openapi.annotations.info.Contact;
import org.eclipse.microprofile.openapi.annotations.info.Info;
import org.eclipse.microprofile.openapi.annotations.info.License;
import org.eclipse.microprofile.openapi.annotations.security.SecurityScheme;
import org.eclipse.microprofile.openapi.annotations.servers.Server;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.ws.rs.core.Application;

/**
 * OpenAPI 3.0 configuration for the HealthBridge admin API.
 *
 * @see <a href="https://github.com/eclipse/microprofile-open-api">MicroProfile OpenAPI</a>
 */
@OpenAPIDefinition(
        info = @Info(
                title = "HealthBridge Admin API",
                version = "1.0.0",
                description = """
                        Keeps a single Withings OAuth credential alive.

                        ## Features
                        - **Token status**: expiry, hours remaining, refresh due flag
                        - **Refresh**: force a refresh, optionally mirrored to Railway
                        - **Authorization**: consent URL and code exchange

                        ## Authentication
                        Every endpoint except `/admin/health` requires the `X-Admin-Token` header.
                        """,
                contact = @Contact(
                        name = "Village Compute",
                        url = "https://villagecompute.com"),
                license = @License(
                        name = "Proprietary")),
        servers = {@Server(
                url = "http://localhost:8080",
                description = "Local Development")},
        tags = {@Tag(
                name = "Admin - Tokens",
                description = "Withings OAuth token management")},
        components = @Components(
                securitySchemes = {@SecurityScheme(
                        securitySchemeName = "adminToken",
                        type = SecuritySchemeType.APIKEY,
                        apiKeyName = "X-Admin-Token",
                        in = SecuritySchemeIn.HEADER,
                        description = "Shared admin secret (ADMIN_API_TOKEN)")}))
public class OpenApiConfig extends Application {
    // Configuration via annotations only
}
