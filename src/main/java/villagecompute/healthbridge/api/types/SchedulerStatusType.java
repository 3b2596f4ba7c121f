/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.api.types;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the background refresh scheduler.
 */
public record SchedulerStatusType(@JsonProperty("enabled") boolean enabled, @JsonProperty("interval") String interval,
        @JsonProperty("tick_count") long tickCount, @JsonProperty("last_tick_at") Instant lastTickAt,
        @JsonProperty("last_outcome") String lastOutcome, @JsonProperty("last_error") String lastError) {
}
