package warden.core.service.token;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.adapter.out.storage.memory.InMemoryStorage;
import warden.core.exception.RefreshTokenRejectedException;
import warden.core.model.identity.Identity;
import warden.core.model.identity.Scopes;
import warden.core.model.storage.Claims;
import warden.core.model.storage.OfflineSessions;
import warden.core.model.storage.RefreshToken;
import warden.core.port.out.Metrics;
import warden.core.service.connector.ConnectorRegistry;
import warden.spi.Connector;

@DisplayName("RefreshTokenService")
@ExtendWith(MockitoExtension.class)
class RefreshTokenServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private ConnectorRegistry registry;

    @Mock
    private Connector connector;

    @Mock
    private Metrics metrics;

    private InMemoryStorage storage;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
    }

    private RefreshTokenService serviceAt(Instant now, RefreshTokenPolicy policy) {
        return new RefreshTokenService(storage, registry, policy, metrics, Clock.fixed(now, ZoneOffset.UTC));
    }

    private RefreshTokenService serviceAt(Instant now) {
        return serviceAt(
                now, new RefreshTokenPolicy(true, Duration.ofSeconds(3), Optional.empty(), Optional.empty()));
    }

    private static Claims claims() {
        return new Claims("user-1", "Jane", "jane", "jane@example.com", true, List.of("devs"));
    }

    private void store(byte[] connectorData) {
        storage.createRefreshToken(new RefreshToken(
                        "rt-1",
                        "token-1",
                        "",
                        T0,
                        T0,
                        "client-1",
                        "gitlab",
                        connectorData,
                        claims(),
                        List.of("openid", "offline_access", "groups"),
                        null))
                .await()
                .atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("redeem()")
    class Redeem {

        @Test
        @DisplayName("presenting the current token should rotate it")
        void rotates() {
            store(null);
            var t1 = T0.plusSeconds(60);

            var redeemed = serviceAt(t1).redeem("rt-1", "token-1").await().atMost(TIMEOUT);

            assertNotEquals("token-1", redeemed.token());
            assertEquals("token-1", redeemed.obsoleteToken());
            assertEquals(t1, redeemed.lastUsed());
            verify(metrics).recordRefresh(RefreshTokenService.OUTCOME_ROTATED);
        }

        @Test
        @DisplayName("the previous token should be honoured within the reuse interval")
        void reuseWithinInterval() {
            store(null);
            var t1 = T0.plusSeconds(60);
            var rotated = serviceAt(t1).redeem("rt-1", "token-1").await().atMost(TIMEOUT);

            var reused = serviceAt(t1.plusSeconds(2)).redeem("rt-1", "token-1").await().atMost(TIMEOUT);

            assertEquals(rotated.token(), reused.token());
            assertEquals(t1, reused.lastUsed());
            verify(metrics).recordRefresh(RefreshTokenService.OUTCOME_REUSED);
        }

        @Test
        @DisplayName("the previous token should be rejected after the reuse interval")
        void reuseAfterInterval() {
            store(null);
            var t1 = T0.plusSeconds(60);
            serviceAt(t1).redeem("rt-1", "token-1").await().atMost(TIMEOUT);

            assertThrows(
                    RefreshTokenRejectedException.class,
                    () -> serviceAt(t1.plusSeconds(4)).redeem("rt-1", "token-1").await().atMost(TIMEOUT));
            verify(metrics).recordRefresh(RefreshTokenService.OUTCOME_REJECTED);
        }

        @Test
        @DisplayName("an unknown bearer value should be rejected")
        void wrongToken() {
            store(null);

            assertThrows(
                    RefreshTokenRejectedException.class,
                    () -> serviceAt(T0).redeem("rt-1", "guess").await().atMost(TIMEOUT));
            assertEquals(
                    "token-1", storage.getRefreshToken("rt-1").await().atMost(TIMEOUT).token());
        }

        @Test
        @DisplayName("an unknown id should be rejected")
        void unknownId() {
            assertThrows(
                    RefreshTokenRejectedException.class,
                    () -> serviceAt(T0).redeem("missing", "token-1").await().atMost(TIMEOUT));
            verify(metrics).recordRefresh(RefreshTokenService.OUTCOME_REJECTED);
        }

        @Test
        @DisplayName("an idle token should be rejected before rotation")
        void idleExpired() {
            store(null);
            var policy = new RefreshTokenPolicy(
                    true, Duration.ofSeconds(3), Optional.empty(), Optional.of(Duration.ofDays(1)));

            assertThrows(
                    RefreshTokenRejectedException.class,
                    () -> serviceAt(T0.plus(Duration.ofDays(2)), policy)
                            .redeem("rt-1", "token-1")
                            .await()
                            .atMost(TIMEOUT));
            assertEquals(
                    "token-1", storage.getRefreshToken("rt-1").await().atMost(TIMEOUT).token());
        }

        @Test
        @DisplayName("with rotation disabled only the last use should change")
        void rotationDisabled() {
            store(null);
            var policy = new RefreshTokenPolicy(false, Duration.ZERO, Optional.empty(), Optional.empty());
            var t1 = T0.plusSeconds(60);

            var redeemed = serviceAt(t1, policy).redeem("rt-1", "token-1").await().atMost(TIMEOUT);

            assertEquals("token-1", redeemed.token());
            assertEquals("", redeemed.obsoleteToken());
            assertEquals(t1, redeemed.lastUsed());
        }
    }

    @Nested
    @DisplayName("refreshIdentity()")
    class RefreshIdentity {

        private final byte[] tokenData = "token-data".getBytes(StandardCharsets.UTF_8);
        private final byte[] sessionData = "session-data".getBytes(StandardCharsets.UTF_8);
        private final byte[] newData = "new-data".getBytes(StandardCharsets.UTF_8);

        private Identity refreshed() {
            return new Identity("user-1", "Jane D", "jane", "jane@example.com", true, List.of("ops"), newData);
        }

        @Test
        @DisplayName("should use and replace the token's own connector data")
        void tokenData() {
            store(tokenData);
            var token = storage.getRefreshToken("rt-1").await().atMost(TIMEOUT);
            when(connector.refresh(any(), argThat(id -> id != null
                            && Arrays.equals(tokenData, id.connectorData()))))
                    .thenReturn(Uni.createFrom().item(refreshed()));

            var updated = serviceAt(T0)
                    .refreshIdentity(connector, new Scopes(true, true), token)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("Jane D", updated.claims().username());
            assertEquals(List.of("ops"), updated.claims().groups());
            assertArrayEquals(newData, storage.getRefreshToken("rt-1").await().atMost(TIMEOUT).connectorData());
        }

        @Test
        @DisplayName("should fall back to the offline session's connector data")
        void sessionData() {
            store(null);
            storage.createOfflineSessions(new OfflineSessions("user-1", "gitlab", Map.of(), sessionData))
                    .await()
                    .atMost(TIMEOUT);
            var token = storage.getRefreshToken("rt-1").await().atMost(TIMEOUT);
            when(connector.refresh(any(), argThat(id -> id != null
                            && Arrays.equals(sessionData, id.connectorData()))))
                    .thenReturn(Uni.createFrom().item(refreshed()));

            serviceAt(T0).refreshIdentity(connector, Scopes.NONE, token).await().atMost(TIMEOUT);

            var sessions = storage.getOfflineSessions("user-1", "gitlab").await().atMost(TIMEOUT);
            assertArrayEquals(newData, sessions.connectorData());
            assertEquals("rt-1", sessions.refresh().get("client-1").id());
            assertNull(storage.getRefreshToken("rt-1").await().atMost(TIMEOUT).connectorData());
        }

        @Test
        @DisplayName("should leave the token untouched when the connector fails")
        void connectorFailure() {
            store(tokenData);
            var token = storage.getRefreshToken("rt-1").await().atMost(TIMEOUT);
            when(connector.refresh(any(), any()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("upstream down")));

            assertThrows(
                    IllegalStateException.class,
                    () -> serviceAt(T0)
                            .refreshIdentity(connector, Scopes.NONE, token)
                            .await()
                            .atMost(TIMEOUT));
            assertEquals(claims(), storage.getRefreshToken("rt-1").await().atMost(TIMEOUT).claims());
        }
    }

    @Test
    @DisplayName("refresh() should redeem, open the connector and refresh the identity")
    void refresh() {
        store("data".getBytes(StandardCharsets.UTF_8));
        when(registry.get("gitlab")).thenReturn(Uni.createFrom().item(connector));
        when(connector.refresh(eq(new Scopes(true, true)), any()))
                .thenReturn(Uni.createFrom().item(new Identity(
                        "user-1", "Jane", "jane", "jane@example.com", true, List.of("devs"), null)));

        var result = serviceAt(T0.plusSeconds(60)).refresh("rt-1", "token-1").await().atMost(TIMEOUT);

        assertEquals("token-1", result.obsoleteToken());
        verify(metrics).recordRefresh(RefreshTokenService.OUTCOME_ROTATED);
    }

    @Test
    @DisplayName("refresh() should not contact the connector for a rejected token")
    void refreshRejected() {
        store(null);

        assertThrows(
                RefreshTokenRejectedException.class,
                () -> serviceAt(T0).refresh("rt-1", "guess").await().atMost(TIMEOUT));
        verify(registry, never()).get(any());
    }
}
