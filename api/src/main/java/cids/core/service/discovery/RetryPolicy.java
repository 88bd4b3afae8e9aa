package cids.core.service.discovery;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntFunction;
import java.util.function.Predicate;

import io.smallrye.mutiny.Uni;

import cids.core.config.DiscoveryConfig;

/**
 * Exponential backoff with additive jitter.
 *
 * <p>The delay before retry {@code n} is {@code min(maxDelay, baseDelay * multiplier^(n-1))}
 * plus up to {@code jitterFactor} of itself, capped again at {@code maxDelay}. With
 * {@code multiplier >= 1 + jitterFactor} successive delays never decrease.
 */
public final class RetryPolicy {

    private final int maxAttempts;
    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final Predicate<Throwable> retryable;

    public RetryPolicy(
            int maxAttempts,
            Duration baseDelay,
            double multiplier,
            Duration maxDelay,
            double jitterFactor,
            Predicate<Throwable> retryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Delays must satisfy 0 <= baseDelay <= maxDelay");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be between 0 and 1");
        }
        if (multiplier < 1.0 + jitterFactor) {
            throw new IllegalArgumentException("multiplier must be at least 1 + jitterFactor");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay;
        this.jitterFactor = jitterFactor;
        this.retryable = retryable;
    }

    public static RetryPolicy from(DiscoveryConfig.RetryConfig config, Predicate<Throwable> retryable) {
        return new RetryPolicy(
                config.maxAttempts(),
                config.baseDelay(),
                config.multiplier(),
                config.maxDelay(),
                config.jitterFactor(),
                retryable);
    }

    /**
     * Total attempts, the first one included.
     */
    public int maxAttempts() {
        return maxAttempts;
    }

    public int maxRetries() {
        return maxAttempts - 1;
    }

    /**
     * Whether another attempt should follow a failed one.
     *
     * @param failure       what the attempt failed with
     * @param attemptNumber 1-based number of the failed attempt
     */
    public boolean shouldRetry(Throwable failure, int attemptNumber) {
        return attemptNumber < maxAttempts && retryable.test(failure);
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry
     */
    public Duration delayFor(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        final double base = Math.min(
                maxDelay.toMillis(), baseDelay.toMillis() * Math.pow(multiplier, retry - 1));
        final double jitter = jitterFactor > 0 && base > 0
                ? ThreadLocalRandom.current().nextDouble(0, jitterFactor * base)
                : 0;
        return Duration.ofMillis((long) Math.min(maxDelay.toMillis(), base + jitter));
    }

    /**
     * Run an operation until it succeeds, fails with a non-retryable error, or the
     * attempts are used up.
     *
     * @param attempt  produces the work for a 1-based attempt number
     * @param listener told about every failed attempt
     */
    public <T> Uni<T> execute(IntFunction<Uni<T>> attempt, RetryListener listener) {
        return run(attempt, listener, 1);
    }

    private <T> Uni<T> run(IntFunction<Uni<T>> attempt, RetryListener listener, int number) {
        return Uni.createFrom()
                .deferred(() -> attempt.apply(number))
                .onFailure()
                .recoverWithUni(failure -> {
                    final var retry = shouldRetry(failure, number);
                    final var delay = retry ? delayFor(number) : null;
                    listener.onFailure(number, failure, delay);
                    if (!retry) {
                        return Uni.createFrom().failure(failure);
                    }
                    if (delay.isZero()) {
                        return run(attempt, listener, number + 1);
                    }
                    return Uni.createFrom()
                            .voidItem()
                            .onItem()
                            .delayIt()
                            .by(delay)
                            .flatMap(v -> run(attempt, listener, number + 1));
                });
    }

    /**
     * Observer of failed attempts.
     */
    @FunctionalInterface
    public interface RetryListener {

        /**
         * @param attemptNumber 1-based number of the failed attempt
         * @param failure       the failure
         * @param nextDelay     delay before the next attempt, null when none follows
         */
        void onFailure(int attemptNumber, Throwable failure, Duration nextDelay);
    }
}
