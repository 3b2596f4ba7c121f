/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.healthbridge.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import villagecompute.healthbridge.api.types.ConfigSyncResultType;
import villagecompute.healthbridge.api.types.RefreshResultType;
import villagecompute.healthbridge.api.types.TokenPairType;
import villagecompute.healthbridge.api.types.TokenStatusType;
import villagecompute.healthbridge.api.types.TokenSummaryType;
import villagecompute.healthbridge.config.WithingsConfig;
import villagecompute.healthbridge.exceptions.InvalidCredentialException;
import villagecompute.healthbridge.exceptions.TransientVendorException;
import villagecompute.healthbridge.integration.withings.WithingsOAuthClient;
import villagecompute.healthbridge.observability.TokenMetrics;
import villagecompute.healthbridge.services.TokenRefreshCoordinator.State;
import villagecompute.healthbridge.services.TokenRefreshCoordinator.Trigger;

/**
 * Unit tests for {@link TokenRefreshCoordinator}.
 */
class TokenRefreshCoordinatorTest {

    private static final long FOURTEEN_DAYS = 1_209_600L;

    @Mock
    WithingsOAuthClient oauthClient;

    @Mock
    ConfigSyncService configSyncService;

    @Mock
    WithingsConfig withingsConfig;

    @Mock
    TokenMetrics metrics;

    private InMemoryTokenStore tokenStore;

    private TokenRefreshCoordinator coordinator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        tokenStore = new InMemoryTokenStore();

        coordinator = new TokenRefreshCoordinator();
        coordinator.tokenStore = tokenStore;
        coordinator.oauthClient = oauthClient;
        coordinator.configSyncService = configSyncService;
        coordinator.withingsConfig = withingsConfig;
        coordinator.metrics = metrics;
        coordinator.waitTimeout = Duration.ofSeconds(5);

        when(withingsConfig.getClientId()).thenReturn("client-id");
        when(withingsConfig.getClientSecret()).thenReturn("client-secret");
        when(withingsConfig.getRedirectUri()).thenReturn("https://example.com/callback");
        when(withingsConfig.getRefreshWindow()).thenReturn(Duration.ofHours(24));
        when(withingsConfig.getBootstrapRefreshToken()).thenReturn(Optional.empty());
        when(configSyncService.push(any(), anyBoolean()))
                .thenReturn(ConfigSyncResultType.persisted(false, "Railway variables updated"));
    }

    @Test
    void testExpiringToken_isRefreshedAndNoLongerDue() {
        Instant now = Instant.now();
        tokenStore.stored = pair("old", now.minus(Duration.ofHours(71)), now.plus(Duration.ofHours(1)));
        assertTrue(coordinator.status().shouldRefresh());

        when(oauthClient.refresh("refresh-old", "client-id", "client-secret"))
                .thenAnswer(invocation -> freshPair("new", FOURTEEN_DAYS));

        Optional<RefreshResultType> result = coordinator.refreshIfDue(Trigger.SCHEDULER);

        assertTrue(result.isPresent());
        assertEquals(FOURTEEN_DAYS, result.get().expiresInSeconds());
        assertEquals(result.get().lastRefreshedAt().plusSeconds(FOURTEEN_DAYS), result.get().expiresAt());
        assertEquals("access-new", tokenStore.stored.accessToken());
        assertEquals("refresh-new", tokenStore.stored.refreshToken());

        TokenStatusType status = coordinator.status();
        assertFalse(status.shouldRefresh());
        assertEquals(State.IDLE.name(), status.state());
        verify(configSyncService).push(tokenStore.stored, false);
    }

    @Test
    void testRefreshIfDue_notDue_noVendorCall() {
        Instant now = Instant.now();
        tokenStore.stored = pair("current", now, now.plus(Duration.ofDays(10)));

        assertTrue(coordinator.refreshIfDue(Trigger.SCHEDULER).isEmpty());
        verify(oauthClient, never()).refresh(anyString(), anyString(), anyString());
    }

    @Test
    void testInvalidRefreshToken_movesToFailedAndKeepsExpiry() {
        Instant now = Instant.now();
        TokenPairType original = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        tokenStore.stored = original;
        when(oauthClient.refresh(anyString(), anyString(), anyString()))
                .thenThrow(new InvalidCredentialException("Withings rejected refresh_token (status 503)", 503));

        assertThrows(InvalidCredentialException.class, () -> coordinator.refresh(Trigger.ADMIN, true, false));

        assertEquals(State.FAILED, coordinator.getState());
        TokenStatusType status = coordinator.status();
        assertEquals(original.expiresAt(), status.expiresAt());
        assertEquals(State.FAILED.name(), status.state());
        assertTrue(status.failureReason().contains("503"));
        assertSame(original, tokenStore.stored);
        verify(configSyncService, never()).push(any(), anyBoolean());
    }

    @Test
    void testFailedState_failsFastWithoutVendorCall() {
        Instant now = Instant.now();
        tokenStore.stored = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        when(oauthClient.refresh(anyString(), anyString(), anyString()))
                .thenThrow(new InvalidCredentialException("rejected", 503));

        assertThrows(InvalidCredentialException.class, () -> coordinator.refresh(Trigger.ADMIN, true, false));
        assertThrows(InvalidCredentialException.class, () -> coordinator.refresh(Trigger.ADMIN, true, false));
        assertThrows(InvalidCredentialException.class, () -> coordinator.refreshIfDue(Trigger.SCHEDULER));

        verify(oauthClient, times(1)).refresh(anyString(), anyString(), anyString());
    }

    @Test
    void testTransientFailure_storeUnchangedAndRetryable() {
        Instant now = Instant.now();
        TokenPairType original = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        tokenStore.stored = original;
        when(oauthClient.refresh(anyString(), anyString(), anyString()))
                .thenThrow(new TransientVendorException("Withings token endpoint timed out"))
                .thenAnswer(invocation -> freshPair("new", 10800));

        assertThrows(TransientVendorException.class, () -> coordinator.refreshIfDue(Trigger.SCHEDULER));
        assertSame(original, tokenStore.stored);
        assertEquals(State.IDLE, coordinator.getState());

        assertTrue(coordinator.refreshIfDue(Trigger.SCHEDULER).isPresent());
        assertEquals("access-new", tokenStore.stored.accessToken());
        verify(oauthClient, times(2)).refresh(eq("refresh-old"), anyString(), anyString());
    }

    @Test
    void testSyncFailure_doesNotAffectRefresh() {
        Instant now = Instant.now();
        tokenStore.stored = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        when(oauthClient.refresh(anyString(), anyString(), anyString()))
                .thenAnswer(invocation -> freshPair("new", 10800));
        when(configSyncService.push(any(), anyBoolean()))
                .thenReturn(ConfigSyncResultType.failed("Railway API error: Not Authorized"));

        RefreshResultType result = coordinator.refresh(Trigger.ADMIN, true, true);

        assertFalse(result.sync().persisted());
        assertEquals("access-new", tokenStore.stored.accessToken());
        assertEquals(State.IDLE, coordinator.getState());
        verify(configSyncService).push(tokenStore.stored, true);
    }

    @Test
    void testRefresh_withoutPropagation_skipsSync() {
        Instant now = Instant.now();
        tokenStore.stored = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        when(oauthClient.refresh(anyString(), anyString(), anyString()))
                .thenAnswer(invocation -> freshPair("new", 10800));

        RefreshResultType result = coordinator.refresh(Trigger.ADMIN, false, false);

        assertFalse(result.sync().attempted());
        verify(configSyncService, never()).push(any(), anyBoolean());
    }

    @Test
    void testConcurrentRefreshes_shareOneVendorCall() throws Exception {
        Instant now = Instant.now();
        tokenStore.stored = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));

        CountDownLatch vendorEntered = new CountDownLatch(1);
        CountDownLatch releaseVendor = new CountDownLatch(1);
        when(oauthClient.refresh(anyString(), anyString(), anyString())).thenAnswer(invocation -> {
            vendorEntered.countDown();
            releaseVendor.await(5, TimeUnit.SECONDS);
            return freshPair("new", 10800);
        });

        List<RefreshResultType> results = new CopyOnWriteArrayList<>();
        List<Throwable> errors = new CopyOnWriteArrayList<>();

        Thread owner = new Thread(() -> collect(results, errors));
        owner.start();
        assertTrue(vendorEntered.await(5, TimeUnit.SECONDS));
        assertEquals(State.REFRESHING, coordinator.getState());

        List<Thread> waiters = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            Thread waiter = new Thread(() -> collect(results, errors));
            waiters.add(waiter);
            waiter.start();
        }
        for (Thread waiter : waiters) {
            awaitState(waiter, Thread.State.TIMED_WAITING);
        }

        releaseVendor.countDown();
        owner.join(5000);
        for (Thread waiter : waiters) {
            waiter.join(5000);
        }

        assertTrue(errors.isEmpty(), "unexpected errors: " + errors);
        assertEquals(5, results.size());
        for (RefreshResultType result : results) {
            assertEquals(results.get(0), result);
        }
        verify(oauthClient, times(1)).refresh(anyString(), anyString(), anyString());
        assertEquals(1, tokenStore.saves);
        assertEquals(State.IDLE, coordinator.getState());
    }

    @Test
    void testRefreshIfDue_tokenRefreshedWhileWaiting_noSecondVendorCall() {
        Instant now = Instant.now();
        TokenPairType due = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        TokenPairType refreshedByAdmin = freshPair("admin", FOURTEEN_DAYS);
        tokenStore.stored = refreshedByAdmin;
        tokenStore.scriptedLoads.add(due);

        Optional<RefreshResultType> result = coordinator.refreshIfDue(Trigger.SCHEDULER);

        assertTrue(result.isEmpty());
        assertSame(refreshedByAdmin, tokenStore.stored);
        assertEquals(0, tokenStore.saves);
        assertEquals(State.IDLE, coordinator.getState());
        verify(oauthClient, never()).refresh(anyString(), anyString(), anyString());
        verify(configSyncService, never()).push(any(), anyBoolean());
    }

    @Test
    void testBootstrap_storeSeededWhileWaiting_noVendorCall() {
        when(withingsConfig.getBootstrapRefreshToken()).thenReturn(Optional.of("bootstrap-token"));
        TokenPairType exchanged = freshPair("exchanged", FOURTEEN_DAYS);
        tokenStore.stored = exchanged;
        tokenStore.scriptedLoads.add(EMPTY);

        assertTrue(coordinator.refreshIfDue(Trigger.SCHEDULER).isEmpty());

        assertSame(exchanged, tokenStore.stored);
        verify(oauthClient, never()).refresh(anyString(), anyString(), anyString());
    }

    @Test
    void testForcedRefresh_notDue_stillCallsVendor() {
        Instant now = Instant.now();
        tokenStore.stored = pair("current", now, now.plus(Duration.ofDays(10)));
        when(oauthClient.refresh("refresh-current", "client-id", "client-secret"))
                .thenAnswer(invocation -> freshPair("new", 10800));

        RefreshResultType result = coordinator.refresh(Trigger.ADMIN, false, false);

        assertEquals(10800, result.expiresInSeconds());
        assertEquals("refresh-new", tokenStore.stored.refreshToken());
    }

    @Test
    void testExchangeCode_reportsRefreshingWhileInProgress() {
        AtomicReference<State> duringExchange = new AtomicReference<>();
        AtomicReference<String> statusDuringExchange = new AtomicReference<>();
        when(oauthClient.exchangeCode(anyString(), anyString(), anyString(), anyString())).thenAnswer(invocation -> {
            duringExchange.set(coordinator.getState());
            statusDuringExchange.set(coordinator.status().state());
            return freshPair("exchanged", 10800);
        });

        coordinator.exchangeCode("auth-code");

        assertEquals(State.REFRESHING, duringExchange.get());
        assertEquals(State.REFRESHING.name(), statusDuringExchange.get());
        assertEquals(State.IDLE, coordinator.getState());
    }

    @Test
    void testExchangeCode_invalidCode_restoresFailedState() {
        Instant now = Instant.now();
        tokenStore.stored = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        when(oauthClient.refresh(anyString(), anyString(), anyString()))
                .thenThrow(new InvalidCredentialException("rejected", 503));
        assertThrows(InvalidCredentialException.class, () -> coordinator.refresh(Trigger.ADMIN, true, false));
        when(oauthClient.exchangeCode(anyString(), anyString(), anyString(), anyString()))
                .thenThrow(new InvalidCredentialException("Withings rejected authorization_code (status 29)", 29));

        assertThrows(InvalidCredentialException.class, () -> coordinator.exchangeCode("bad-code"));

        assertEquals(State.FAILED, coordinator.getState());
        assertTrue(coordinator.status().failureReason().contains("rejected"));
    }

    @Test
    void testExchangeCode_clearsFailedState() {
        Instant now = Instant.now();
        tokenStore.stored = pair("old", now.minus(Duration.ofHours(2)), now.plus(Duration.ofHours(1)));
        when(oauthClient.refresh(anyString(), anyString(), anyString()))
                .thenThrow(new InvalidCredentialException("rejected", 503));
        assertThrows(InvalidCredentialException.class, () -> coordinator.refresh(Trigger.ADMIN, true, false));
        assertEquals(State.FAILED, coordinator.getState());

        TokenPairType exchanged = freshPair("exchanged", 10800);
        when(oauthClient.exchangeCode("auth-code", "client-id", "client-secret", "https://example.com/callback"))
                .thenReturn(exchanged);

        TokenSummaryType summary = coordinator.exchangeCode("auth-code");

        assertEquals(State.IDLE, coordinator.getState());
        assertSame(exchanged, tokenStore.stored);
        assertEquals("****nged", summary.accessToken());
        assertNull(coordinator.status().failureReason());
        verify(configSyncService).push(exchanged, false);
    }

    @Test
    void testExchangeCode_invalidCode_storeUnchanged() {
        Instant now = Instant.now();
        TokenPairType original = pair("old", now, now.plus(Duration.ofDays(3)));
        tokenStore.stored = original;
        when(oauthClient.exchangeCode(eq("bad-code"), anyString(), anyString(), anyString()))
                .thenThrow(new InvalidCredentialException("Withings rejected authorization_code (status 29)", 29));

        assertThrows(InvalidCredentialException.class, () -> coordinator.exchangeCode("bad-code"));

        assertSame(original, tokenStore.stored);
        assertEquals(0, tokenStore.saves);
        assertEquals(State.IDLE, coordinator.getState());
    }

    @Test
    void testExchangeCode_blankCode_rejected() {
        assertThrows(IllegalArgumentException.class, () -> coordinator.exchangeCode(" "));
    }

    @Test
    void testBootstrap_seedsEmptyStore() {
        when(withingsConfig.getBootstrapRefreshToken()).thenReturn(Optional.of("bootstrap-token"));
        when(oauthClient.refresh("bootstrap-token", "client-id", "client-secret"))
                .thenAnswer(invocation -> freshPair("first", 10800));

        Optional<RefreshResultType> result = coordinator.refreshIfDue(Trigger.SCHEDULER);

        assertTrue(result.isPresent());
        assertEquals("refresh-first", tokenStore.stored.refreshToken());
    }

    @Test
    void testEmptyStore_withoutBootstrap() {
        assertTrue(coordinator.refreshIfDue(Trigger.SCHEDULER).isEmpty());
        assertThrows(InvalidCredentialException.class, () -> coordinator.refresh(Trigger.ADMIN, true, false));

        assertEquals(State.IDLE, coordinator.getState());
        verify(oauthClient, never()).refresh(anyString(), anyString(), anyString());
    }

    @Test
    void testStatus_emptyStore() {
        TokenStatusType status = coordinator.status();

        assertFalse(status.configured());
        assertTrue(status.shouldRefresh());
        assertNull(status.expiresAt());
    }

    @Test
    void testStatus_expiredToken_reportsNegativeHours() {
        Instant now = Instant.now();
        tokenStore.stored = pair("stale", now.minus(Duration.ofDays(2)), now.minus(Duration.ofHours(3)));

        TokenStatusType status = coordinator.status();

        assertTrue(status.configured());
        assertTrue(status.expired());
        assertTrue(status.shouldRefresh());
        assertEquals(-3.0, status.expiresInHours(), 0.01);
    }

    private void collect(List<RefreshResultType> results, List<Throwable> errors) {
        try {
            results.add(coordinator.refresh(Trigger.ADMIN, true, false));
        } catch (Throwable t) {
            errors.add(t);
        }
    }

    private static void awaitState(Thread thread, Thread.State state) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != state && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(state, thread.getState());
    }

    private static TokenPairType pair(String suffix, Instant refreshedAt, Instant expiresAt) {
        return new TokenPairType("access-" + suffix, "refresh-" + suffix, expiresAt, refreshedAt, "363",
                "user.metrics");
    }

    private static TokenPairType freshPair(String suffix, long expiresIn) {
        Instant completedAt = Instant.now();
        return pair(suffix, completedAt, completedAt.plusSeconds(expiresIn));
    }

    private static final TokenPairType EMPTY = new TokenPairType(null, null, null, null, null, null);

    /**
     * Store double that keeps the pair in memory. Scripted loads are served first, to model a pair that another
     * caller replaced between two reads; {@link #EMPTY} stands for an empty store.
     */
    static class InMemoryTokenStore extends TokenStore {

        volatile TokenPairType stored;

        volatile int saves;

        final Deque<TokenPairType> scriptedLoads = new ArrayDeque<>();

        @Override
        public synchronized Optional<TokenPairType> load() {
            TokenPairType scripted = scriptedLoads.poll();
            if (scripted != null) {
                return scripted == EMPTY ? Optional.empty() : Optional.of(scripted);
            }
            return Optional.ofNullable(stored);
        }

        @Override
        public void save(TokenPairType pair) {
            stored = pair;
            saves++;
        }
    }
}
