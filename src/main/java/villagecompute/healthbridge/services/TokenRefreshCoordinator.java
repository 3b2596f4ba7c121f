/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.services;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.healthbridge.api.types.ConfigSyncResultType;
import villagecompute.healthbridge.api.types.RefreshResultType;
import villagecompute.healthbridge.api.types.TokenPairType;
import villagecompute.healthbridge.api.types.TokenStatusType;
import villagecompute.healthbridge.api.types.TokenSummaryType;
import villagecompute.healthbridge.config.WithingsConfig;
import villagecompute.healthbridge.exceptions.InvalidCredentialException;
import villagecompute.healthbridge.exceptions.TransientVendorException;
import villagecompute.healthbridge.integration.withings.WithingsOAuthClient;
import villagecompute.healthbridge.observability.LoggingConfig;
import villagecompute.healthbridge.observability.TokenMetrics;

/**
 * Owns the lifecycle of the single Withings credential.
 *
 * <p>
 * <b>State machine:</b>
 * <ul>
 * <li>{@code IDLE -> REFRESHING} when a refresh starts and none is in flight</li>
 * <li>{@code REFRESHING -> IDLE} on success, or on a transient failure (surfaced to the caller)</li>
 * <li>{@code REFRESHING -> FAILED} when Withings rejects the refresh token; only a successful code exchange leaves
 * FAILED</li>
 * </ul>
 *
 * <p>
 * <b>Serialization:</b> the sequence vendor call, persist, sync runs under {@code refreshLock}, which code exchange
 * shares. A caller arriving while a refresh is in flight joins that attempt and receives its result or its exception
 * instead of issuing a second vendor call. Joining is bounded by {@code healthbridge.token.refresh-wait-timeout}; a
 * waiter that gives up gets {@link TransientVendorException} and the next due-check re-evaluates persisted state.
 * Due-checks are repeated against the store once the lock is held, so a tick that raced a committed refresh does not
 * rotate the token again. Code exchange reports {@code REFRESHING} while it holds the lock.
 *
 * <p>
 * Config sync runs after the store commit and its failures only show up in {@link ConfigSyncResultType}.
 */
@ApplicationScoped
public class TokenRefreshCoordinator {

    private static final Logger LOG = Logger.getLogger(TokenRefreshCoordinator.class);

    public enum State {
        IDLE, REFRESHING, FAILED
    }

    public enum Trigger {
        SCHEDULER, ADMIN, BOOTSTRAP, CODE_EXCHANGE;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Inject
    TokenStore tokenStore;

    @Inject
    WithingsOAuthClient oauthClient;

    @Inject
    ConfigSyncService configSyncService;

    @Inject
    WithingsConfig withingsConfig;

    @Inject
    TokenMetrics metrics;

    @ConfigProperty(
            name = "healthbridge.token.refresh-wait-timeout",
            defaultValue = "45s")
    Duration waitTimeout;

    private final ReentrantLock refreshLock = new ReentrantLock();

    private final Object stateMonitor = new Object();

    private State state = State.IDLE;

    private String failureReason;

    private CompletableFuture<Optional<RefreshResultType>> inFlight;

    /**
     * Refreshes the token pair now, regardless of expiry.
     *
     * @param trigger
     *            what initiated the refresh
     * @param propagate
     *            mirror the new pair to Railway
     * @param redeploy
     *            redeploy the Railway service after a successful mirror
     * @return the new expiry and sync outcome
     * @throws InvalidCredentialException
     *             if Withings rejects the refresh token, no credential is available, or the coordinator is FAILED
     * @throws TransientVendorException
     *             on timeout or any retryable vendor failure; the store is unchanged
     */
    public RefreshResultType refresh(Trigger trigger, boolean propagate, boolean redeploy) {
        while (true) {
            Optional<RefreshResultType> result = coalesce(trigger, propagate, redeploy, false);
            if (result.isPresent()) {
                return result.get();
            }
            LOG.debugf("Joined due-check found nothing due; refreshing (%s) on its own", trigger.tag());
        }
    }

    /**
     * Refreshes only if the stored pair is inside the look-ahead window.
     *
     * <p>
     * With an empty store, a configured bootstrap refresh token seeds the first pair. Due refreshes always propagate
     * to Railway and never redeploy.
     *
     * @param trigger
     *            what initiated the check
     * @return the refresh result, or empty when nothing was due
     */
    public Optional<RefreshResultType> refreshIfDue(Trigger trigger) {
        synchronized (stateMonitor) {
            if (state == State.FAILED) {
                throw new InvalidCredentialException(
                        "Refresh token was rejected; re-authorization required (" + failureReason + ")");
            }
        }

        Optional<TokenPairType> current = tokenStore.load();
        if (current.isEmpty()) {
            if (withingsConfig.getBootstrapRefreshToken().isPresent()) {
                LOG.info("Token store is empty; seeding it from the bootstrap refresh token");
                return coalesce(Trigger.BOOTSTRAP, true, false, true);
            }
            LOG.warn("No Withings token stored and no bootstrap refresh token configured; authorization required");
            return Optional.empty();
        }

        TokenPairType pair = current.get();
        metrics.recordExpiry(pair.expiresAt());
        if (!pair.isDueForRefresh(Instant.now(), withingsConfig.getRefreshWindow())) {
            LOG.debugf("Token not due for refresh (expires at %s)", pair.expiresAt());
            return Optional.empty();
        }

        LOG.infof("Token expires at %s, inside the %s window; refreshing", pair.expiresAt(),
                withingsConfig.getRefreshWindow());
        return coalesce(trigger, true, false, true);
    }

    /**
     * Exchanges an authorization code for a new pair and stores it.
     *
     * <p>
     * Clears FAILED on success. An invalid code leaves the store and the state untouched.
     *
     * @param code
     *            authorization code from the Withings callback
     * @return masked summary of the new pair
     * @throws InvalidCredentialException
     *             if Withings rejects the code
     * @throws TransientVendorException
     *             on timeout or any retryable vendor failure
     */
    public TokenSummaryType exchangeCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Authorization code is required");
        }

        Timer.Sample sample = metrics.startRefresh();
        String outcome = "error";
        acquireLock();
        State previous;
        synchronized (stateMonitor) {
            previous = state;
            state = State.REFRESHING;
        }
        boolean exchanged = false;
        try {
            LoggingConfig.setRefreshTrigger(Trigger.CODE_EXCHANGE.tag());
            TokenPairType pair;
            try {
                pair = oauthClient.exchangeCode(code, withingsConfig.getClientId(), withingsConfig.getClientSecret(),
                        withingsConfig.getRedirectUri());
            } catch (InvalidCredentialException e) {
                outcome = "invalid_credential";
                throw e;
            } catch (TransientVendorException e) {
                outcome = "transient";
                throw e;
            }

            tokenStore.save(pair);
            metrics.recordExpiry(pair.expiresAt());

            exchanged = true;
            if (previous == State.FAILED) {
                LOG.info("Authorization code exchanged; leaving FAILED state");
            }

            ConfigSyncResultType sync = configSyncService.push(pair, false);
            outcome = "success";
            LOG.infof("Authorization code exchanged for user %s, token expires at %s", pair.vendorUserId(),
                    pair.expiresAt());
            return TokenSummaryType.of(pair, sync);
        } finally {
            synchronized (stateMonitor) {
                if (exchanged) {
                    failureReason = null;
                }
                // a refresh queued behind the lock owns REFRESHING from here on
                if (inFlight == null) {
                    state = exchanged ? State.IDLE : previous;
                } else if (exchanged || previous != State.FAILED) {
                    state = State.REFRESHING;
                } else {
                    state = State.FAILED;
                }
            }
            refreshLock.unlock();
            metrics.recordRefresh(sample, Trigger.CODE_EXCHANGE.tag(), outcome);
        }
    }

    /**
     * Derived view of the stored pair. Reflects persisted state even when stale or expired.
     *
     * @return status snapshot
     */
    public TokenStatusType status() {
        Instant now = Instant.now();
        State currentState;
        String reason;
        synchronized (stateMonitor) {
            currentState = state;
            reason = failureReason;
        }

        Optional<TokenPairType> current = tokenStore.load();
        if (current.isEmpty()) {
            return new TokenStatusType(false, null, null, true, null, false, currentState.name(), reason);
        }

        TokenPairType pair = current.get();
        metrics.recordExpiry(pair.expiresAt());
        long secondsLeft = Duration.between(now, pair.expiresAt()).getSeconds();
        double hoursLeft = Math.round(secondsLeft / 36.0) / 100.0;
        return new TokenStatusType(true, pair.expiresAt(), hoursLeft,
                pair.isDueForRefresh(now, withingsConfig.getRefreshWindow()), pair.lastRefreshedAt(),
                pair.isExpired(now), currentState.name(), reason);
    }

    public State getState() {
        synchronized (stateMonitor) {
            return state;
        }
    }

    private Optional<RefreshResultType> coalesce(Trigger trigger, boolean propagate, boolean redeploy,
            boolean onlyIfDue) {
        CompletableFuture<Optional<RefreshResultType>> attempt;
        boolean owner = false;

        synchronized (stateMonitor) {
            if (state == State.FAILED) {
                throw new InvalidCredentialException(
                        "Refresh token was rejected; re-authorization required (" + failureReason + ")");
            }
            if (inFlight != null) {
                attempt = inFlight;
            } else {
                attempt = new CompletableFuture<>();
                inFlight = attempt;
                state = State.REFRESHING;
                owner = true;
            }
        }

        if (!owner) {
            LOG.infof("Refresh (%s) joined the in-flight attempt", trigger.tag());
            return await(attempt);
        }

        try {
            Optional<RefreshResultType> result = performRefresh(trigger, propagate, redeploy, onlyIfDue);
            attempt.complete(result);
            return result;
        } catch (RuntimeException e) {
            attempt.completeExceptionally(e);
            throw e;
        } finally {
            synchronized (stateMonitor) {
                inFlight = null;
                if (state == State.REFRESHING) {
                    state = State.IDLE;
                }
            }
        }
    }

    private Optional<RefreshResultType> performRefresh(Trigger trigger, boolean propagate, boolean redeploy,
            boolean onlyIfDue) {
        Timer.Sample sample = metrics.startRefresh();
        String outcome = "error";
        acquireLock();
        try {
            LoggingConfig.setRefreshTrigger(trigger.tag());
            Optional<TokenPairType> current = tokenStore.load();
            if (onlyIfDue && current.isPresent()
                    && !current.get().isDueForRefresh(Instant.now(), withingsConfig.getRefreshWindow())) {
                outcome = null;
                LOG.infof("Token was refreshed while %s waited (expires at %s); nothing to do", trigger.tag(),
                        current.get().expiresAt());
                return Optional.empty();
            }
            Optional<String> refreshToken = current.map(TokenPairType::refreshToken)
                    .or(withingsConfig::getBootstrapRefreshToken);
            if (refreshToken.isEmpty()) {
                outcome = "not_authorized";
                throw new InvalidCredentialException(
                        "No Withings token stored and no bootstrap refresh token configured; authorization required");
            }

            TokenPairType refreshed;
            try {
                refreshed = oauthClient.refresh(refreshToken.get(), withingsConfig.getClientId(),
                        withingsConfig.getClientSecret());
            } catch (InvalidCredentialException e) {
                outcome = "invalid_credential";
                markFailed(e.getMessage());
                throw e;
            } catch (TransientVendorException e) {
                outcome = "transient";
                LOG.warnf("Token refresh (%s) failed transiently, store unchanged: %s", trigger.tag(),
                        e.getMessage());
                throw e;
            }

            tokenStore.save(refreshed);
            metrics.recordExpiry(refreshed.expiresAt());

            ConfigSyncResultType sync = propagate ? configSyncService.push(refreshed, redeploy)
                    : ConfigSyncResultType.notRequested();
            outcome = "success";
            LOG.infof("Token refreshed (%s), new expiry %s, sync persisted=%s", trigger.tag(), refreshed.expiresAt(),
                    sync.persisted());
            return Optional.of(RefreshResultType.of(refreshed, sync));
        } finally {
            refreshLock.unlock();
            if (outcome != null) {
                metrics.recordRefresh(sample, trigger.tag(), outcome);
            }
        }
    }

    private void markFailed(String reason) {
        synchronized (stateMonitor) {
            state = State.FAILED;
            failureReason = reason;
        }
        LOG.errorf("Withings rejected the refresh token; automatic refresh halted until re-authorization: %s",
                reason);
    }

    private void acquireLock() {
        try {
            if (!refreshLock.tryLock(waitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransientVendorException("Timed out waiting for another token operation to finish");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientVendorException("Interrupted while waiting for the token refresh lock", e);
        }
    }

    private Optional<RefreshResultType> await(CompletableFuture<Optional<RefreshResultType>> attempt) {
        try {
            return attempt.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransientVendorException("Timed out waiting for the in-flight token refresh", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientVendorException("Interrupted while waiting for the in-flight token refresh", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Token refresh failed", cause);
        }
    }
}
