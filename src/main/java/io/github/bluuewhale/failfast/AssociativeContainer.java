package io.github.bluuewhale.failfast;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A {@link Map} that rejects {@code null} values and reports absence explicitly.
 *
 * <p>Because no stored value is ever {@code null}, the {@link Map} forms ({@code get}, {@code put},
 * {@code remove}) return {@code null} only for "no mapping", and the option forms below carry the same
 * information as an {@link Optional}. A remapping function that returns {@code null} always means
 * "no value": the key is removed, which is a structural change.
 *
 * <p>The views are live and iterate the backing storage without copying; their iterators are
 * {@link FailFastIterator}s bound to {@link #generation()}.
 */
public interface AssociativeContainer<K, V> extends Map<K, V>, Generational {

	/** Binds {@code value} to {@code key}; returns the previous value if the key was present. */
	Optional<V> upsert(K key, V value);

	/** The value bound to {@code key}. Never mutates the container. */
	Optional<V> lookup(Object key);

	/** Removes the mapping for {@code key}; returns the removed value. Absent keys are a no-op. */
	Optional<V> erase(Object key);

	/** Alias of {@link #keySet()}. */
	default Set<K> keys() {
		return keySet();
	}

	/** Alias of {@link #entrySet()}. */
	default Set<Map.Entry<K, V>> entries() {
		return entrySet();
	}
}
