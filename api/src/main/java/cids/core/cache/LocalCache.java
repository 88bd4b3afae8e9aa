package cids.core.cache;

import java.util.Optional;

/**
 * Process-local cache with time-based expiry.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface LocalCache<K, V> {

    Optional<V> get(K key);

    void put(K key, V value);

    void invalidate(K key);

    void invalidateAll();

    long estimatedSize();
}
