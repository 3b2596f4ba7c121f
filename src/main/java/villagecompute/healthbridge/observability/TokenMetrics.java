/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.observability;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Micrometer metrics for the token lifecycle.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Counter:</b> {@code healthbridge_token_refresh_total{trigger,outcome}} - refresh attempts by result</li>
 * <li><b>Timer:</b> {@code healthbridge_token_refresh_duration} - vendor call, persist and sync</li>
 * <li><b>Gauge:</b> {@code healthbridge_token_expires_in_seconds} - seconds until the stored access token expires
 * (NaN until a pair is known)</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class TokenMetrics {

    private static final Logger LOG = Logger.getLogger(TokenMetrics.class);

    public static final String REFRESH_TOTAL = "healthbridge_token_refresh_total";
    public static final String REFRESH_DURATION = "healthbridge_token_refresh_duration";
    public static final String EXPIRES_IN_SECONDS = "healthbridge_token_expires_in_seconds";

    @Inject
    MeterRegistry registry;

    private final AtomicReference<Instant> knownExpiry = new AtomicReference<>();

    @PostConstruct
    void registerGauges() {
        Gauge.builder(EXPIRES_IN_SECONDS, this, TokenMetrics::secondsUntilExpiry)
                .description("Seconds until the stored Withings access token expires").register(registry);
        LOG.debug("Registered token lifecycle gauges");
    }

    /**
     * @return a started timer sample for one refresh attempt
     */
    public Timer.Sample startRefresh() {
        return Timer.start(registry);
    }

    /**
     * Records the end of a refresh attempt.
     *
     * @param sample
     *            the sample from {@link #startRefresh()}
     * @param trigger
     *            what initiated the refresh
     * @param outcome
     *            success, invalid_credential, transient or error
     */
    public void recordRefresh(Timer.Sample sample, String trigger, String outcome) {
        sample.stop(Timer.builder(REFRESH_DURATION).tag("outcome", outcome).register(registry));
        Counter.builder(REFRESH_TOTAL).tags("trigger", trigger, "outcome", outcome).register(registry).increment();
    }

    /**
     * @param expiresAt
     *            expiry of the pair currently in the store
     */
    public void recordExpiry(Instant expiresAt) {
        knownExpiry.set(expiresAt);
    }

    double secondsUntilExpiry() {
        Instant expiresAt = knownExpiry.get();
        if (expiresAt == null) {
            return Double.NaN;
        }
        return Duration.between(Instant.now(), expiresAt).getSeconds();
    }
}
