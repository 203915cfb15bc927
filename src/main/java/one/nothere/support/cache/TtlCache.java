package one.nothere.support.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Key/value cache whose entries expire a fixed time after they were written.
 *
 * <p>Loaders that throw leave nothing behind, so a failed lookup is retried on the
 * next read instead of being remembered.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface TtlCache<K, V> {

    Optional<V> getIfPresent(K key);

    /**
     * Returns the cached value or computes, stores and returns it.
     */
    V get(K key, Function<? super K, ? extends V> loader);

    void put(K key, V value);

    void invalidateAll();

    long size();
}
