package cids.core.cache;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

/**
 * Caffeine cache whose entry lifetimes are spread by a jitter factor, so entries
 * written together do not all expire together.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class CaffeineLocalCache<K, V> implements LocalCache<K, V> {

    private static final double DEFAULT_JITTER_FACTOR = 0.1;

    private final Cache<K, V> cache;

    public CaffeineLocalCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, DEFAULT_JITTER_FACTOR);
    }

    /**
     * @param jitterFactor 0.0 to 0.5, where 0.1 spreads lifetimes by ±10%
     */
    public CaffeineLocalCache(Duration ttl, long maxSize, double jitterFactor) {
        if (jitterFactor < 0.0 || jitterFactor > 0.5) {
            throw new IllegalArgumentException("Jitter factor must be between 0.0 and 0.5, got: " + jitterFactor);
        }
        final var builder = Caffeine.newBuilder().maximumSize(maxSize);
        this.cache = jitterFactor == 0.0
                ? builder.expireAfterWrite(ttl).build()
                : builder.expireAfter(new JitteredExpiry<K, V>(ttl.toNanos(), jitterFactor)).build();
    }

    private record JitteredExpiry<K, V>(long baseNanos, double jitterFactor) implements Expiry<K, V> {

        @Override
        public long expireAfterCreate(K key, V value, long currentTime) {
            return jittered();
        }

        @Override
        public long expireAfterUpdate(K key, V value, long currentTime, long currentDuration) {
            return jittered();
        }

        @Override
        public long expireAfterRead(K key, V value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long jittered() {
            final var spread = (ThreadLocalRandom.current().nextDouble() * 2 - 1) * jitterFactor;
            return (long) (baseNanos * (1.0 + spread));
        }
    }

    @Override
    public Optional<V> get(K key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }
}
