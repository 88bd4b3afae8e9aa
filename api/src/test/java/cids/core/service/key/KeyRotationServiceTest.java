package cids.core.service.key;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import cids.adapter.out.auth.ConfigSigningKeyRepository;
import cids.core.config.KeyRotationConfig;
import cids.core.model.key.KeyStatus;
import cids.core.model.token.TokenIssuanceException;

@DisplayName("KeyRotationService")
class KeyRotationServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private KeyRotationConfig config;
    private ConfigSigningKeyRepository repository;
    private SigningKeyRegistry registry;
    private KeyRotationService service;

    @BeforeEach
    void setUp() {
        config = mock(KeyRotationConfig.class);
        when(config.enabled()).thenReturn(true);
        when(config.keySize()).thenReturn(2048);
        when(config.staticKey()).thenReturn(Optional.empty());
        when(config.staticKeyId()).thenReturn("static");
        when(config.gracePeriod()).thenReturn(Duration.ZERO);
        when(config.deprecationPeriod()).thenReturn(Duration.ofHours(2));
        when(config.retentionPeriod()).thenReturn(Duration.ofDays(7));

        repository = new ConfigSigningKeyRepository(config);
        registry = new SigningKeyRegistry(repository, config);
        service = new KeyRotationService(registry, repository, config);
    }

    @Test
    @DisplayName("should refuse to sign before a key is active")
    void shouldFailWithoutActiveKey() {
        assertFalse(registry.isReady());
        assertThrows(TokenIssuanceException.class, registry::getCurrentSigningKey);
    }

    @Test
    @DisplayName("should generate an active key when none exists")
    void shouldGenerateInitialKey() {
        registry.ensureActiveKey().await().atMost(TIMEOUT);

        assertTrue(registry.isReady());
        assertEquals(KeyStatus.ACTIVE, registry.getCurrentSigningKey().status());
        assertEquals(1, registry.getVerificationKeys().size());
    }

    @Nested
    @DisplayName("triggerRotation()")
    class TriggerRotation {

        @Test
        @DisplayName("should activate a new key and keep the old one for verification")
        void shouldRotate() {
            registry.ensureActiveKey().await().atMost(TIMEOUT);
            final var original = registry.getCurrentSigningKey().keyId();

            final var rotated = service.triggerRotation("test").await().atMost(TIMEOUT);

            assertNotEquals(original, rotated.keyId());
            assertEquals(rotated.keyId(), registry.getCurrentSigningKey().keyId());
            assertEquals(KeyStatus.DEPRECATED, service.getKey(original).await().atMost(TIMEOUT).status());
            assertTrue(registry.getVerificationKey(original).isPresent());
            assertEquals(rotated.keyId(), registry.getVerificationKeys().get(0).keyId());
        }

        @Test
        @DisplayName("should never expose private keys through listings")
        void shouldStripPrivateKeys() {
            registry.ensureActiveKey().await().atMost(TIMEOUT);
            service.triggerRotation(null).await().atMost(TIMEOUT);

            service.listAllKeys().await().atMost(TIMEOUT).forEach(k -> assertNull(k.privateKey()));
        }
    }

    @Nested
    @DisplayName("forceRetire()")
    class ForceRetire {

        @Test
        @DisplayName("should refuse to retire the active key")
        void shouldRefuseActiveKey() {
            registry.ensureActiveKey().await().atMost(TIMEOUT);
            final var active = registry.getCurrentSigningKey().keyId();

            assertThrows(
                    IllegalStateException.class, () -> service.forceRetire(active).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should drop a retired key from the verification set")
        void shouldRetireDeprecatedKey() {
            registry.ensureActiveKey().await().atMost(TIMEOUT);
            final var original = registry.getCurrentSigningKey().keyId();
            service.triggerRotation("compromised").await().atMost(TIMEOUT);

            service.forceRetire(original).await().atMost(TIMEOUT);

            assertTrue(registry.getVerificationKey(original).isEmpty());
        }

        @Test
        @DisplayName("should report unknown keys")
        void shouldReportUnknownKey() {
            assertThrows(
                    KeyRotationService.KeyNotFoundException.class,
                    () -> service.forceRetire("missing").await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("processKeyLifecycle()")
    class Lifecycle {

        @Test
        @DisplayName("should retire keys deprecated longer than the grace window")
        void shouldRetireExpiredDeprecations() {
            when(config.deprecationPeriod()).thenReturn(Duration.ZERO);
            registry.ensureActiveKey().await().atMost(TIMEOUT);
            final var original = registry.getCurrentSigningKey().keyId();
            service.triggerRotation("scheduled").await().atMost(TIMEOUT);

            service.processKeyLifecycle().await().atMost(TIMEOUT);

            final var retired = service.getKey(original).await().atMost(TIMEOUT);
            assertEquals(KeyStatus.RETIRED, retired.status());
            assertTrue(retired.retiredAt().isBefore(Instant.now().plusSeconds(1)));
        }

        @Test
        @DisplayName("should do nothing on schedule when rotation is disabled")
        void shouldSkipWhenDisabled() {
            when(config.enabled()).thenReturn(false);

            service.scheduledLifecycle().await().atMost(TIMEOUT);
            service.rotateKeys().await().atMost(TIMEOUT);

            assertTrue(service.listAllKeys().await().atMost(TIMEOUT).isEmpty());
        }
    }
}
