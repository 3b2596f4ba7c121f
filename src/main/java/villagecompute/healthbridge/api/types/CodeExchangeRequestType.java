/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for exchanging an OAuth authorization code.
 *
 * @param code
 *            authorization code from the Withings callback
 */
public record CodeExchangeRequestType(@JsonProperty("code") @NotBlank String code) {
}
