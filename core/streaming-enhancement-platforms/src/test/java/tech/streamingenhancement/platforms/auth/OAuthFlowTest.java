package tech.streamingenhancement.platforms.auth;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.streamingenhancement.platforms.exception.RefreshFailedException;
import tech.streamingenhancement.platforms.exception.RequestFailedException;
import tech.streamingenhancement.platforms.exception.TokenNotFoundException;
import tech.streamingenhancement.platforms.store.InMemorySecretStore;
import tech.streamingenhancement.platforms.store.SecretStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class OAuthFlowTest {

    private static final Instant START = Instant.parse("2026-01-15T12:00:00Z");

    private InMemorySecretStore store;
    private MutableClock clock;
    private StubOAuthFlow flow;

    @BeforeEach
    void setUp() {
        store = new InMemorySecretStore();
        clock = new MutableClock(START);
        flow = new StubOAuthFlow(store, clock, List.of("user:read:email", "chat:read"));
    }

    @Test
    void shouldBuildAuthorizationUrlWithParametersInOrder() {
        // When
        AuthorizationRequest request = flow.generateAuthorizationUrl("abc");

        // Then
        assertEquals("https://id.twitch.tv/oauth2/authorize?client_id=client-123"
                + "&redirect_uri=http%3A%2F%2Flocalhost%3A3000%2Fcallback"
                + "&response_type=code&state=abc&scope=user%3Aread%3Aemail+chat%3Aread",
            request.url());
        assertEquals("abc", request.state());
    }

    @Test
    void shouldOmitScopeParameterWhenNoScopesConfigured() {
        // Given
        StubOAuthFlow unscoped = new StubOAuthFlow(store, clock, List.of());

        // When
        AuthorizationRequest request = unscoped.generateAuthorizationUrl();

        // Then
        assertFalse(request.url().contains("scope="), "Empty scope list should omit the parameter");
        assertThat(request.url()).contains("state=" + request.state());
    }

    @Test
    void shouldGenerateDistinctStates() {
        Set<String> states = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            states.add(flow.generateAuthorizationUrl().state());
        }

        assertEquals(100, states.size());
    }

    @Test
    void shouldStoreAndReadBackTokenSet() {
        // When
        TokenSet stored = flow.processAccessToken("alice", TokenResponse.of("a1", "r1", 3600L, List.of("chat:read")));

        // Then
        TokenSet read = flow.findTokenSet("alice").orElseThrow();
        assertEquals(stored, read);
        assertEquals(read.expiresAt().minus(Duration.ofMinutes(5)), read.refreshAt());
        String json = store.get(SecretStore.NAMESPACE, "oauth:twitch:alice").orElseThrow();
        assertThat(json)
            .contains("\"access_token\":\"a1\"")
            .contains("\"expires_at\":\"2026-01-15T13:00:00Z\"")
            .contains("\"refresh_at\":\"2026-01-15T12:55:00Z\"");
    }

    @Test
    void shouldApplyDefaultLifetimeWhenProviderOmitsExpiry() {
        // When
        flow.processAccessToken("dana", TokenResponse.of("a1", "r1", null, List.of()));

        // Then
        TokenSet read = flow.findTokenSet("dana").orElseThrow();
        assertEquals(START.plus(Duration.ofHours(24)), read.expiresAt());
    }

    @Test
    void shouldReturnStoredTokenWhenNotDue() {
        // Given
        flow.processAccessToken("carol", TokenResponse.of("a1", "r1", 3600L, List.of()));
        clock.advance(Duration.ofMinutes(30));

        // When
        TokenSet token = flow.getAccessToken("carol");

        // Then
        assertEquals("a1", token.accessToken());
        assertEquals(0, flow.refreshCalls.get());
    }

    @Test
    void shouldRefreshDueTokenAndKeepRefreshTokenWhenProviderOmitsIt() {
        // Given
        flow.processAccessToken("erin", TokenResponse.of("a1", "r1", 3600L, List.of()));
        clock.advance(Duration.ofMinutes(56));

        // When
        TokenSet token = flow.getAccessToken("erin");

        // Then
        assertEquals("refreshed", token.accessToken());
        assertEquals("r1", token.refreshToken(), "Previous refresh token should be preserved");
        assertEquals(1, flow.refreshCalls.get());
        assertEquals(token, flow.findTokenSet("erin").orElseThrow());
    }

    @Test
    void shouldReplaceRefreshTokenWhenProviderRotatesIt() {
        // Given
        flow.processAccessToken("frank", TokenResponse.of("a1", "r1", 3600L, List.of()));
        flow.onRefresh = refreshToken -> TokenResponse.of("a2", "r2", 3600L, List.of());

        // When
        TokenSet token = flow.refreshToken("frank");

        // Then
        assertEquals("a2", token.accessToken());
        assertEquals("r2", token.refreshToken());
    }

    @Test
    void shouldForceRefreshEvenWhenNotDue() {
        // Given
        flow.processAccessToken("gina", TokenResponse.of("a1", "r1", 3600L, List.of()));

        // When
        flow.refreshToken("gina");

        // Then
        assertEquals(1, flow.refreshCalls.get());
    }

    @Test
    void shouldNameUserWhenNoTokenStored() {
        TokenNotFoundException error = assertThrows(TokenNotFoundException.class, () -> flow.getAccessToken("nobody"));

        assertThat(error.getMessage()).contains("nobody");
        assertEquals("nobody", error.getUsername());
        assertThrows(TokenNotFoundException.class, () -> flow.refreshToken("nobody"));
    }

    @Test
    void shouldFailRefreshWithoutRefreshToken() {
        // Given
        flow.processAccessToken("henry", TokenResponse.of("a1", null, 3600L, List.of()));
        clock.advance(Duration.ofHours(2));

        // When
        RefreshFailedException error = assertThrows(RefreshFailedException.class, () -> flow.getAccessToken("henry"));

        // Then
        assertThat(error.getMessage()).contains("No refresh token available");
        assertEquals(0, flow.refreshCalls.get());
    }

    @Test
    void shouldLeaveStoredTokenUntouchedWhenRefreshFails() {
        // Given
        flow.processAccessToken("iris", TokenResponse.of("a1", "r1", 3600L, List.of()));
        String before = store.get(SecretStore.NAMESPACE, "oauth:twitch:iris").orElseThrow();
        RequestFailedException providerError = new RequestFailedException(400, "Invalid refresh token", "invalid_grant");
        flow.onRefresh = refreshToken -> {
            throw providerError;
        };
        clock.advance(Duration.ofMinutes(58));

        // When
        RefreshFailedException error = assertThrows(RefreshFailedException.class, () -> flow.getAccessToken("iris"));

        // Then
        assertSame(providerError, error.getCause());
        assertEquals(before, store.get(SecretStore.NAMESPACE, "oauth:twitch:iris").orElseThrow());
    }

    @Test
    void shouldTreatCorruptRecordAsAbsent() {
        // Given
        store.set(SecretStore.NAMESPACE, "oauth:twitch:jack", "{not json");

        // Then
        assertTrue(flow.findTokenSet("jack").isEmpty());
        assertFalse(flow.hasToken("jack"));
        assertThrows(TokenNotFoundException.class, () -> flow.getAccessToken("jack"));
    }

    @Test
    void shouldTreatStoreReadFailureAsAbsent() {
        // Given
        SecretStore failing = mock(SecretStore.class);
        when(failing.get(anyString(), anyString())).thenThrow(new IllegalStateException("keystore locked"));
        StubOAuthFlow failingFlow = new StubOAuthFlow(failing, clock, List.of());

        // Then
        assertTrue(failingFlow.findTokenSet("kim").isEmpty());
    }

    @Test
    void shouldExchangeCodeOnCallback() {
        // When
        TokenSet token = flow.handleOAuthCallback("code-1", "state-1", "liam");

        // Then
        assertEquals("access-code-1", token.accessToken());
        assertEquals(1, flow.exchangeCalls.get());
        assertTrue(flow.hasToken("liam"));
    }

    @Test
    void shouldDeleteTokens() {
        // Given
        flow.processAccessToken("mia", TokenResponse.of("a1", "r1", 3600L, List.of()));

        // Then
        assertTrue(flow.deleteTokens("mia"));
        assertFalse(flow.hasToken("mia"));
        assertFalse(flow.deleteTokens("mia"));
    }

    @Test
    void shouldRefreshOnceForConcurrentCallers() throws Exception {
        // Given - a due token and a provider that blocks until released
        flow.processAccessToken("nina", TokenResponse.of("a1", "r1", 3600L, List.of()));
        clock.advance(Duration.ofMinutes(56));
        CountDownLatch release = new CountDownLatch(1);
        flow.onRefresh = refreshToken -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TokenResponse.of("a2", "r2", 3600L, List.of());
        };
        ExecutorService executor = Executors.newFixedThreadPool(8);

        try {
            // When
            List<Future<TokenSet>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(executor.submit(() -> flow.getAccessToken("nina")));
            }
            await().atMost(5, TimeUnit.SECONDS).until(() -> flow.refreshCalls.get() == 1);
            await().pollDelay(100, TimeUnit.MILLISECONDS).until(() -> true);
            release.countDown();

            // Then
            for (Future<TokenSet> result : results) {
                assertEquals("a2", result.get(5, TimeUnit.SECONDS).accessToken());
            }
            assertEquals(1, flow.refreshCalls.get(), "Provider should be called once");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRefreshDifferentUsersInParallel() throws Exception {
        // Given
        flow.processAccessToken("olga", TokenResponse.of("a1", "r1", 3600L, List.of()));
        flow.processAccessToken("pete", TokenResponse.of("a1", "r1", 3600L, List.of()));
        CountDownLatch bothInFlight = new CountDownLatch(2);
        flow.onRefresh = refreshToken -> {
            bothInFlight.countDown();
            try {
                if (!bothInFlight.await(5, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("refreshes were serialized");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TokenResponse.of("a2", null, 3600L, List.of());
        };
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            // When
            Future<TokenSet> olga = executor.submit(() -> flow.refreshToken("olga"));
            Future<TokenSet> pete = executor.submit(() -> flow.refreshToken("pete"));

            // Then
            assertEquals("a2", olga.get(10, TimeUnit.SECONDS).accessToken());
            assertEquals("a2", pete.get(10, TimeUnit.SECONDS).accessToken());
            assertEquals(2, flow.refreshCalls.get());
        } finally {
            executor.shutdownNow();
        }
    }
}
