package cids.core.service.a2a;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import cids.adapter.out.storage.memory.InMemoryA2APermissionRepository;
import cids.adapter.out.storage.memory.InMemoryActivityLogRepository;
import cids.core.config.ActivityLogConfig;
import cids.core.config.TokenConfig;
import cids.core.model.a2a.A2AErrorType;
import cids.core.model.a2a.A2AException;
import cids.core.model.a2a.A2APermission;
import cids.core.model.app.ApiKey;
import cids.core.model.app.Application;
import cids.core.model.common.EntityConflictException;
import cids.core.model.token.IssuedToken;
import cids.core.model.token.TokenType;
import cids.core.port.in.ApiKeyManagement;
import cids.core.port.in.ApplicationManagement;
import cids.core.port.out.Metrics;
import cids.core.service.activity.ActivityLogService;
import cids.core.service.token.TokenMinter;

@DisplayName("A2AService")
@ExtendWith(MockitoExtension.class)
class A2AServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final String KEY = "cids_ak_source-key";

    @Mock
    private ApiKeyManagement apiKeys;

    @Mock
    private ApplicationManagement applications;

    @Mock
    private TokenMinter minter;

    @Mock
    private Metrics metrics;

    @Mock
    private TokenConfig tokenConfig;

    private InMemoryA2APermissionRepository repository;
    private A2AService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryA2APermissionRepository();

        lenient().when(tokenConfig.serviceTtl()).thenReturn(Duration.ofMinutes(5));
        lenient().when(tokenConfig.serviceMaxTtl()).thenReturn(Duration.ofMinutes(10));

        final var activityLog =
                new ActivityLogService(new InMemoryActivityLogRepository(100), mock(ActivityLogConfig.class));

        service = new A2AService(apiKeys, applications, repository, minter, activityLog, tokenConfig, metrics);

        application("orders");
        application("inventory");
        lenient().when(apiKeys.validate(anyString())).thenReturn(Uni.createFrom().item(Optional.empty()));
        lenient().when(apiKeys.validate(KEY)).thenReturn(Uni.createFrom().item(Optional.of(new ApiKey(
                "k1", "orders", "hash", "cids_ak_", "svc", "admin", Instant.now(), null, false, null))));
        lenient().when(minter.mint(eq(TokenType.SERVICE), anyString(), anyString(), any(Duration.class), any()))
                .thenAnswer(invocation -> {
                    final Duration ttl = invocation.getArgument(3);
                    final var now = Instant.now();
                    return new IssuedToken(
                            "header.payload.signature",
                            "jti-1",
                            TokenType.SERVICE,
                            invocation.getArgument(1),
                            invocation.getArgument(2),
                            now,
                            now.plus(ttl));
                });
    }

    private void application(String clientId) {
        lenient().when(applications.get(clientId))
                .thenReturn(Uni.createFrom().item(Optional.of(Application.builder(clientId).build())));
    }

    private A2APermission permit(Set<String> scopes, Duration max) {
        final var permission = new A2APermission(
                null, "orders", "inventory", scopes, max, true, "orders reads stock", null, null);
        return service.savePermission(permission).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("requestServiceToken()")
    class RequestServiceToken {

        @Test
        @DisplayName("should issue a token with all allowed scopes when none are requested")
        void shouldGrantAllAllowedScopes() {
            permit(Set.of("stock:read", "stock:reserve"), Duration.ofMinutes(5));

            final var grant = service.requestServiceToken(KEY, "inventory", Set.of(), null)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("orders", grant.sourceClientId());
            assertEquals("inventory", grant.targetClientId());
            assertEquals(Set.of("stock:read", "stock:reserve"), grant.scopes());
            assertEquals(300, grant.token().expiresInSeconds());
        }

        @Test
        @DisplayName("should clamp the lifetime to the permission maximum")
        void shouldClampDuration() {
            permit(Set.of("stock:read"), Duration.ofMinutes(2));

            final var grant = service.requestServiceToken(KEY, "inventory", Set.of("stock:read"), Duration.ofHours(1))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(120, grant.token().expiresInSeconds());
        }

        @Test
        @DisplayName("should deny the whole request when one scope is not allowed")
        void shouldDenyOverBroadRequest() {
            permit(Set.of("stock:read"), Duration.ofMinutes(5));

            final var e = assertThrows(
                    A2AException.class,
                    () -> service.requestServiceToken(KEY, "inventory", Set.of("stock:read", "stock:delete"), null)
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(A2AErrorType.SCOPE_DENIED, e.errorType());
            assertEquals(Set.of("stock:delete"), e.deniedScopes());
            verify(minter, never()).mint(any(), anyString(), anyString(), any(), any());
            verify(metrics).recordA2ADenied("SCOPE_DENIED");
        }

        @Test
        @DisplayName("should deny when the permission is inactive")
        void shouldDenyInactivePermission() {
            final var permission = permit(Set.of("stock:read"), Duration.ofMinutes(5));
            service.setActive(permission.id(), false).await().atMost(TIMEOUT);

            final var e = assertThrows(
                    A2AException.class,
                    () -> service.requestServiceToken(KEY, "inventory", Set.of(), null).await().atMost(TIMEOUT));

            assertEquals(A2AErrorType.NO_PERMISSION, e.errorType());
        }

        @Test
        @DisplayName("should reject unknown API keys")
        void shouldRejectUnknownKey() {
            final var e = assertThrows(
                    A2AException.class,
                    () -> service.requestServiceToken("cids_ak_nope", "inventory", Set.of(), null)
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(A2AErrorType.INVALID_API_KEY, e.errorType());
            assertEquals(401, e.errorType().httpStatus());
        }

        @Test
        @DisplayName("should deny when the target is inactive")
        void shouldDenyInactiveTarget() {
            permit(Set.of("stock:read"), Duration.ofMinutes(5));
            when(applications.get("inventory")).thenReturn(Uni.createFrom()
                    .item(Optional.of(Application.builder("inventory").active(false).build())));

            final var e = assertThrows(
                    A2AException.class,
                    () -> service.requestServiceToken(KEY, "inventory", Set.of(), null).await().atMost(TIMEOUT));

            assertEquals(A2AErrorType.TARGET_INACTIVE, e.errorType());
        }
    }

    @Nested
    @DisplayName("savePermission()")
    class SavePermission {

        @Test
        @DisplayName("should reject a second permission for the same pair")
        void shouldRejectDuplicatePair() {
            permit(Set.of("stock:read"), Duration.ofMinutes(5));

            assertThrows(EntityConflictException.class, () -> permit(Set.of("stock:write"), Duration.ofMinutes(5)));
        }

        @Test
        @DisplayName("should reject a self-referencing permission")
        void shouldRejectSelfReference() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new A2APermission(
                            null, "orders", "orders", Set.of(), Duration.ofMinutes(1), true, null, null, null));
        }
    }
}
