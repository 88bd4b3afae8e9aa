package cids.core.service.token;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import cids.adapter.out.storage.memory.InMemoryActivityLogRepository;
import cids.adapter.out.storage.memory.InMemoryTokenRevocationRepository;
import cids.core.config.ActivityLogConfig;
import cids.core.config.TokenConfig;
import cids.core.config.TokenRevocationConfig;
import cids.core.service.activity.ActivityLogService;

@DisplayName("TokenRevocationService")
class TokenRevocationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    private InMemoryTokenRevocationRepository repository;
    private TokenRevocationService service;

    @BeforeEach
    void setUp() {
        final var config = mock(TokenRevocationConfig.class);
        when(config.enabled()).thenReturn(true);
        when(config.defaultTtl()).thenReturn(Duration.ofHours(24));
        final var tokenConfig = mock(TokenConfig.class);
        when(tokenConfig.clockSkew()).thenReturn(Duration.ofSeconds(30));

        repository = new InMemoryTokenRevocationRepository();
        service = new TokenRevocationService(
                config,
                tokenConfig,
                repository,
                new ActivityLogService(new InMemoryActivityLogRepository(100), mock(ActivityLogConfig.class)));
    }

    private boolean revoked(String jti) {
        return service.isRevoked(jti).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("revokeJti()")
    class RevokeJti {

        @Test
        @DisplayName("should be idempotent")
        void shouldBeIdempotent() {
            final var expiresAt = Instant.now().plusSeconds(600);

            assertTrue(service.revokeJti("jti-1", expiresAt).await().atMost(TIMEOUT));
            assertFalse(service.revokeJti("jti-1", expiresAt).await().atMost(TIMEOUT));

            assertTrue(revoked("jti-1"));
            assertEquals(1, repository.size().await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should not report unknown token IDs as revoked")
        void shouldNotReportUnknown() {
            assertFalse(revoked("never-revoked"));
        }
    }

    @Nested
    @DisplayName("sweepExpired()")
    class SweepExpired {

        @Test
        @DisplayName("should keep an entry while its token is still inside the clock skew")
        void shouldKeepEntryWithinSkew() {
            service.revokeJti("recent", Instant.now().minusSeconds(5)).await().atMost(TIMEOUT);

            assertEquals(0, service.sweepExpired().await().atMost(TIMEOUT));

            assertTrue(revoked("recent"));
        }

        @Test
        @DisplayName("should drop an entry once its token can no longer validate")
        void shouldDropEntryPastSkew() {
            service.revokeJti("old", Instant.now().minusSeconds(60)).await().atMost(TIMEOUT);
            service.revokeJti("live", Instant.now().plusSeconds(600)).await().atMost(TIMEOUT);

            assertEquals(1, service.sweepExpired().await().atMost(TIMEOUT));

            assertFalse(revoked("old"));
            assertTrue(revoked("live"));
        }
    }
}
