package one.nothere.support.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Pass-through cache: every read goes to the loader.
 */
public class NoOpTtlCache<K, V> implements TtlCache<K, V> {

    @Override
    public Optional<V> getIfPresent(K key) {
        return Optional.empty();
    }

    @Override
    public V get(K key, Function<? super K, ? extends V> loader) {
        return loader.apply(key);
    }

    @Override
    public void put(K key, V value) {
        // nothing retained
    }

    @Override
    public void invalidateAll() {
        // nothing retained
    }

    @Override
    public long size() {
        return 0;
    }
}
