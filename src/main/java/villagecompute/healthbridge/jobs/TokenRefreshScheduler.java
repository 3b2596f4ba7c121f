/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.jobs;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.healthbridge.api.types.SchedulerStatusType;
import villagecompute.healthbridge.exceptions.InvalidCredentialException;
import villagecompute.healthbridge.exceptions.TransientVendorException;
import villagecompute.healthbridge.observability.LoggingConfig;
import villagecompute.healthbridge.services.TokenRefreshCoordinator;

/**
 * Periodic due-check for the Withings token.
 *
 * <p>
 * Each tick asks {@link TokenRefreshCoordinator#refreshIfDue} to refresh when the stored pair is inside the look-ahead
 * window. Ticks that find nothing due are no-ops. Every failure is caught and logged so the next tick always runs;
 * transient failures are retried naturally on the next tick.
 *
 * <p>
 * Overlapping ticks are skipped by the scheduler itself. Quarkus stops the scheduler on shutdown.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code healthbridge.scheduler.enabled} - turns ticks into no-ops when false (AUTO_REFRESH_ENABLED)</li>
 * <li>{@code healthbridge.scheduler.interval} - tick interval (default: 1h)</li>
 * <li>{@code healthbridge.scheduler.initial-delay} - delay before the first tick (default: 30s)</li>
 * </ul>
 */
@ApplicationScoped
public class TokenRefreshScheduler {

    private static final Logger LOG = Logger.getLogger(TokenRefreshScheduler.class);

    public enum TickOutcome {
        DISABLED, NOT_DUE, REFRESHED, INVALID_CREDENTIAL, TRANSIENT_FAILURE, ERROR
    }

    @Inject
    TokenRefreshCoordinator coordinator;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "healthbridge.scheduler.enabled",
            defaultValue = "true")
    boolean enabled;

    @ConfigProperty(
            name = "healthbridge.scheduler.interval",
            defaultValue = "1h")
    String interval;

    private final AtomicLong tickCount = new AtomicLong();

    private volatile Instant lastTickAt;

    private volatile TickOutcome lastOutcome;

    private volatile String lastError;

    @Scheduled(
            identity = "token-refresh",
            every = "{healthbridge.scheduler.interval}",
            delayed = "{healthbridge.scheduler.initial-delay}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledTick() {
        tick();
    }

    /**
     * Runs one due-check.
     *
     * @return what the tick did
     */
    public TickOutcome tick() {
        if (!enabled) {
            LOG.debug("Automatic token refresh disabled; skipping tick");
            return record(TickOutcome.DISABLED, null);
        }

        Span span = tracer.spanBuilder("job.token_refresh").setAttribute("job.type", "TOKEN_REFRESH")
                .setAttribute("trigger", TokenRefreshCoordinator.Trigger.SCHEDULER.tag()).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setRequestOrigin("scheduler.token-refresh");

            TickOutcome outcome = coordinator.refreshIfDue(TokenRefreshCoordinator.Trigger.SCHEDULER)
                    .map(result -> TickOutcome.REFRESHED).orElse(TickOutcome.NOT_DUE);
            span.setAttribute("outcome", outcome.name());
            return record(outcome, null);

        } catch (InvalidCredentialException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            LOG.errorf("Scheduled token refresh halted, re-authorization required: %s", e.getMessage());
            return record(TickOutcome.INVALID_CREDENTIAL, e.getMessage());
        } catch (TransientVendorException e) {
            LOG.warnf("Scheduled token refresh failed transiently, will retry next tick: %s", e.getMessage());
            return record(TickOutcome.TRANSIENT_FAILURE, e.getMessage());
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            LOG.errorf(e, "Scheduled token refresh failed unexpectedly");
            return record(TickOutcome.ERROR, e.getMessage());
        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * @return snapshot for the admin scheduler endpoint
     */
    public SchedulerStatusType status() {
        TickOutcome outcome = lastOutcome;
        return new SchedulerStatusType(enabled, interval, tickCount.get(), lastTickAt,
                outcome == null ? null : outcome.name(), lastError);
    }

    public boolean isEnabled() {
        return enabled;
    }

    private TickOutcome record(TickOutcome outcome, String error) {
        tickCount.incrementAndGet();
        lastTickAt = Instant.now();
        lastOutcome = outcome;
        lastError = error;
        return outcome;
    }
}
