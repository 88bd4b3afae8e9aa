package cids.core.service.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import cids.core.model.discovery.DiscoveryErrorType;
import cids.core.model.discovery.DiscoveryException;

@DisplayName("RetryPolicy")
class RetryPolicyTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private static RetryPolicy policy(int attempts, double jitter) {
        return new RetryPolicy(
                attempts,
                Duration.ofMillis(10),
                2.0,
                Duration.ofMillis(50),
                jitter,
                e -> e instanceof DiscoveryException de && de.isRetryable());
    }

    private record Failure(int attempt, Throwable failure, Duration nextDelay) {}

    @Nested
    @DisplayName("delayFor()")
    class DelayFor {

        @Test
        @DisplayName("should grow exponentially up to the maximum")
        void shouldGrowExponentially() {
            final var policy = policy(5, 0.0);

            assertEquals(Duration.ofMillis(10), policy.delayFor(1));
            assertEquals(Duration.ofMillis(20), policy.delayFor(2));
            assertEquals(Duration.ofMillis(40), policy.delayFor(3));
            assertEquals(Duration.ofMillis(50), policy.delayFor(4));
        }

        @Test
        @DisplayName("should never decrease with jitter")
        void shouldBeMonotonicWithJitter() {
            final var policy = policy(10, 0.5);

            for (int run = 0; run < 50; run++) {
                var previous = Duration.ZERO;
                for (int retry = 1; retry < 8; retry++) {
                    final var delay = policy.delayFor(retry);
                    assertTrue(delay.compareTo(previous) >= 0, "delay decreased at retry " + retry);
                    assertTrue(delay.compareTo(Duration.ofMillis(50)) <= 0);
                    previous = delay;
                }
            }
        }

        @Test
        @DisplayName("should reject a multiplier that jitter could invert")
        void shouldRejectSmallMultiplier() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new RetryPolicy(3, Duration.ofMillis(10), 1.05, Duration.ofMillis(50), 0.1, e -> true));
        }
    }

    @Nested
    @DisplayName("execute()")
    class Execute {

        @Test
        @DisplayName("should retry transient failures until success")
        void shouldRetryUntilSuccess() {
            final var calls = new AtomicInteger();
            final var failures = new ArrayList<Failure>();

            final var result = policy(3, 0.0)
                    .execute(
                            attempt -> calls.incrementAndGet() < 3
                                    ? Uni.createFrom()
                                            .<String>failure(new DiscoveryException(DiscoveryErrorType.SERVER_ERROR, "503"))
                                    : Uni.createFrom().item("ok-" + attempt),
                            (n, f, d) -> failures.add(new Failure(n, f, d)))
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("ok-3", result);
            assertEquals(2, failures.size());
            assertEquals(List.of(1, 2), failures.stream().map(Failure::attempt).toList());
            assertEquals(Duration.ofMillis(10), failures.get(0).nextDelay());
        }

        @Test
        @DisplayName("should stop immediately on a non-retryable failure")
        void shouldNotRetryValidation() {
            final var calls = new AtomicInteger();
            final var failures = new ArrayList<Failure>();
            final var error = DiscoveryException.validation("bad document");

            final var thrown = assertThrows(DiscoveryException.class, () -> policy(3, 0.0)
                    .execute(
                            attempt -> {
                                calls.incrementAndGet();
                                return Uni.createFrom().<String>failure(error);
                            },
                            (n, f, d) -> failures.add(new Failure(n, f, d)))
                    .await()
                    .atMost(TIMEOUT));

            assertSame(error, thrown);
            assertEquals(1, calls.get());
            assertNull(failures.get(0).nextDelay());
        }

        @Test
        @DisplayName("should give up after the last attempt")
        void shouldGiveUp() {
            final var calls = new AtomicInteger();
            final var policy = policy(2, 0.0);

            assertThrows(DiscoveryException.class, () -> policy.execute(
                            attempt -> {
                                calls.incrementAndGet();
                                return Uni.createFrom()
                                        .<String>failure(
                                                new DiscoveryException(DiscoveryErrorType.TIMEOUT_ERROR, "slow"));
                            },
                            (n, f, d) -> {})
                    .await()
                    .atMost(TIMEOUT));

            assertEquals(2, calls.get());
            assertFalse(policy.shouldRetry(new DiscoveryException(DiscoveryErrorType.NETWORK_ERROR, "x"), 2));
        }
    }
}
