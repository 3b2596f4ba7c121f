/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.filters;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import jakarta.ws.rs.NameBinding;

/**
 * JAX-RS name binding for endpoints that require the shared admin secret.
 *
 * <p>
 * <b>Usage Example:</b>
 *
 * <pre>
 * &#64;POST
 * &#64;Path("/token/refresh")
 * &#64;AdminSecured
 * public Response refresh() {
 *     // Implementation
 * }
 * </pre>
 *
 * @see AdminTokenFilter for enforcement
 */
@NameBinding
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface AdminSecured {
}
