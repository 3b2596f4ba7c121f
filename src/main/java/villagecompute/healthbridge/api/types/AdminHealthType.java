/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Liveness response for the unauthenticated admin health check.
 */
public record AdminHealthType(@JsonProperty("status") String status, @JsonProperty("module") String module,
        @JsonProperty("timestamp") Instant timestamp, @JsonProperty("secured") boolean secured) {
}
