package one.nothere.support.cache;

import com.github.benmanes.caffeine.cache.Cache;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link TtlCache} backed by a Caffeine cache built with {@code expireAfterWrite}.
 */
public class CaffeineTtlCache<K, V> implements TtlCache<K, V> {

    private final String name;
    private final Cache<K, V> delegate;

    public CaffeineTtlCache(String name, Cache<K, V> delegate) {
        this.name = name;
        this.delegate = delegate;
    }

    @Override
    public Optional<V> getIfPresent(K key) {
        return Optional.ofNullable(delegate.getIfPresent(key));
    }

    @Override
    public V get(K key, Function<? super K, ? extends V> loader) {
        return delegate.get(key, loader);
    }

    @Override
    public void put(K key, V value) {
        delegate.put(key, value);
    }

    @Override
    public void invalidateAll() {
        delegate.invalidateAll();
    }

    @Override
    public long size() {
        return delegate.estimatedSize();
    }

    public String name() {
        return name;
    }

    Cache<K, V> delegate() {
        return delegate;
    }
}
