package io.github.bluuewhale.failfast;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Separate-chaining hash map (one {@code null} key allowed, {@code null} values NOT allowed).
 * Doubling resize on load factor, fail-fast live views.
 *
 * <p>Every operation runs on the caller's thread and none blocks. This class is not thread-safe: using one
 * instance from several threads without external synchronization is undefined behavior, not merely a
 * {@link ConcurrentStructuralModificationException}. Fail-fast iteration detects foreign structural
 * changes made by the owning thread on a best-effort basis; it never prevents them.
 *
 * <p>Composite operations ({@link #computeIfAbsent}, {@link #compute}, {@link #merge}, ...) evaluate their
 * function at most once. If the function structurally modifies this map the operation fails with
 * {@link ConcurrentStructuralModificationException} instead of writing into a table that has moved.
 */
public class ChainedHashMap<K, V> extends AbstractMap<K, V> implements AssociativeContainer<K, V> {

	private final HashTable<K, V> table;

	public ChainedHashMap() {
		this(HashTable.DEFAULT_INITIAL_CAPACITY, HashTable.DEFAULT_LOAD_FACTOR);
	}

	public ChainedHashMap(int initialCapacity) {
		this(initialCapacity, HashTable.DEFAULT_LOAD_FACTOR);
	}

	public ChainedHashMap(int initialCapacity, double loadFactor) {
		this.table = new HashTable<>(initialCapacity, loadFactor);
	}

	public ChainedHashMap(Map<? extends K, ? extends V> m) {
		this(capacityFor(m.size(), HashTable.DEFAULT_LOAD_FACTOR), HashTable.DEFAULT_LOAD_FACTOR);
		putAll(m);
	}

	static int capacityFor(int expectedSize, double loadFactor) {
		return (int) Math.min(Hashing.MAX_TABLE_SIZE, (long) Math.ceil(expectedSize / loadFactor));
	}

	/* ------------ diagnostics ------------ */

	@Override
	public long generation() {
		return table.generation();
	}

	/** Current bucket count (always a power of two). */
	public int capacity() {
		return table.capacity();
	}

	public double loadFactor() {
		return table.loadFactor();
	}

	/* ------------ option forms ------------ */

	@Override
	public Optional<V> upsert(K key, V value) {
		Objects.requireNonNull(value, "value");
		return Optional.ofNullable(table.upsert(key, value));
	}

	@Override
	public Optional<V> lookup(Object key) {
		return Optional.ofNullable(table.lookup(key));
	}

	@Override
	public Optional<V> erase(Object key) {
		return Optional.ofNullable(table.erase(key));
	}

	/* ------------ Map API ------------ */

	@Override
	public int size() {
		return table.size();
	}

	@Override
	public boolean isEmpty() {
		return table.size() == 0;
	}

	@Override
	public boolean containsKey(Object key) {
		return table.lookupNode(key) != null;
	}

	@Override
	public boolean containsValue(Object value) {
		return table.containsValue(value);
	}

	@Override
	public V get(Object key) {
		return table.lookup(key);
	}

	@Override
	public V put(K key, V value) {
		Objects.requireNonNull(value, "value");
		return table.upsert(key, value);
	}

	@Override
	public V remove(Object key) {
		return table.erase(key);
	}

	@Override
	public void clear() {
		table.clear();
	}

	@Override
	public V getOrDefault(Object key, V defaultValue) {
		HashTable.Node<K, V> n = table.lookupNode(key);
		return (n == null) ? defaultValue : n.value;
	}

	@Override
	public V putIfAbsent(K key, V value) {
		Objects.requireNonNull(value, "value");
		HashTable.Node<K, V> n = table.lookupNode(key);
		if (n != null) return n.value;
		table.insertAbsent(key, value);
		return null;
	}

	@Override
	public boolean remove(Object key, Object value) {
		HashTable.Node<K, V> n = table.lookupNode(key);
		if (n == null || value == null || !value.equals(n.value)) return false;
		table.eraseExact(n);
		return true;
	}

	@Override
	public boolean replace(K key, V oldValue, V newValue) {
		Objects.requireNonNull(newValue, "newValue");
		HashTable.Node<K, V> n = table.lookupNode(key);
		if (n == null || !Objects.equals(n.value, oldValue)) return false;
		n.value = newValue;
		return true;
	}

	@Override
	public V replace(K key, V value) {
		Objects.requireNonNull(value, "value");
		HashTable.Node<K, V> n = table.lookupNode(key);
		if (n == null) return null;
		V old = n.value;
		n.value = value;
		return old;
	}

	@Override
	public V computeIfAbsent(K key, Function<? super K, ? extends V> mappingFunction) {
		Objects.requireNonNull(mappingFunction, "mappingFunction");
		HashTable.Node<K, V> n = table.lookupNode(key);
		if (n != null) return n.value;
		long gen = table.generation();
		V created = mappingFunction.apply(key);
		checkUnmodified(gen);
		if (created == null) return null;
		table.insertAbsent(key, created);
		return created;
	}

	@Override
	public V computeIfPresent(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
		Objects.requireNonNull(remappingFunction, "remappingFunction");
		HashTable.Node<K, V> n = table.lookupNode(key);
		if (n == null) return null;
		long gen = table.generation();
		V next = remappingFunction.apply(key, n.value);
		checkUnmodified(gen);
		if (next == null) {
			table.eraseExact(n);
			return null;
		}
		n.value = next;
		return next;
	}

	@Override
	public V compute(K key, BiFunction<? super K, ? super V, ? extends V> remappingFunction) {
		Objects.requireNonNull(remappingFunction, "remappingFunction");
		HashTable.Node<K, V> n = table.lookupNode(key);
		long gen = table.generation();
		V next = remappingFunction.apply(key, (n == null) ? null : n.value);
		checkUnmodified(gen);
		if (next == null) {
			if (n != null) table.eraseExact(n);
			return null;
		}
		if (n != null) n.value = next;
		else table.insertAbsent(key, next);
		return next;
	}

	@Override
	public V merge(K key, V value, BiFunction<? super V, ? super V, ? extends V> remappingFunction) {
		Objects.requireNonNull(value, "value");
		Objects.requireNonNull(remappingFunction, "remappingFunction");
		HashTable.Node<K, V> n = table.lookupNode(key);
		if (n == null) {
			table.insertAbsent(key, value);
			return value;
		}
		long gen = table.generation();
		V next = remappingFunction.apply(n.value, value);
		checkUnmodified(gen);
		if (next == null) {
			table.eraseExact(n);
			return null;
		}
		n.value = next;
		return next;
	}

	@Override
	public void forEach(BiConsumer<? super K, ? super V> action) {
		Objects.requireNonNull(action, "action");
		long gen = table.generation();
		for (HashTable.Node<K, V> n = table.firstNode(); n != null; n = table.successor(n)) {
			action.accept(n.key, n.value);
			checkUnmodified(gen);
		}
	}

	@Override
	public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
		Objects.requireNonNull(function, "function");
		long gen = table.generation();
		for (HashTable.Node<K, V> n = table.firstNode(); n != null; n = table.successor(n)) {
			V next = function.apply(n.key, n.value);
			checkUnmodified(gen);
			if (next == null) throw new NullPointerException("replaceAll function returned null");
			n.value = next;
		}
	}

	private void checkUnmodified(long expectedGeneration) {
		long actual = table.generation();
		if (actual != expectedGeneration) {
			throw new ConcurrentStructuralModificationException(expectedGeneration, actual);
		}
	}

	/* ------------ views ------------ */

	@Override
	public Set<K> keySet() {
		return new KeySet();
	}

	@Override
	public Collection<V> values() {
		return new Values();
	}

	@Override
	public Set<Map.Entry<K, V>> entrySet() {
		return new EntrySet();
	}

	private final class KeySet extends AbstractSet<K> {
		@Override
		public int size() {
			return table.size();
		}

		@Override
		public boolean contains(Object o) {
			return table.lookupNode(o) != null;
		}

		@Override
		public boolean remove(Object o) {
			return table.eraseNode(o) != null;
		}

		@Override
		public void clear() {
			table.clear();
		}

		@Override
		public Iterator<K> iterator() {
			return new KeyIterator();
		}
	}

	private final class Values extends AbstractCollection<V> {
		@Override
		public int size() {
			return table.size();
		}

		@Override
		public boolean contains(Object o) {
			return table.containsValue(o);
		}

		@Override
		public void clear() {
			table.clear();
		}

		@Override
		public Iterator<V> iterator() {
			return new ValueIterator();
		}
	}

	private final class EntrySet extends AbstractSet<Map.Entry<K, V>> {
		@Override
		public int size() {
			return table.size();
		}

		@Override
		public boolean contains(Object o) {
			if (!(o instanceof Map.Entry<?, ?> e)) return false;
			HashTable.Node<K, V> n = table.lookupNode(e.getKey());
			return n != null && n.value.equals(e.getValue());
		}

		@Override
		public boolean remove(Object o) {
			if (!(o instanceof Map.Entry<?, ?> e)) return false;
			return ChainedHashMap.this.remove(e.getKey(), e.getValue());
		}

		@Override
		public void clear() {
			table.clear();
		}

		@Override
		public Iterator<Map.Entry<K, V>> iterator() {
			return new EntryIterator();
		}
	}

	/* ------------ iterators ------------ */

	private abstract class NodeIterator<E> extends FailFastIterator<E> {
		private HashTable.Node<K, V> next;
		private HashTable.Node<K, V> lastReturned;

		NodeIterator() {
			super(table);
			this.next = table.firstNode();
		}

		abstract E extract(HashTable.Node<K, V> node);

		@Override
		protected boolean hasRemaining() {
			return next != null;
		}

		@Override
		protected E advance() {
			HashTable.Node<K, V> current = next;
			next = table.successor(current);
			lastReturned = current;
			return extract(current);
		}

		@Override
		protected void removeLastReturned() {
			table.eraseExact(lastReturned);
			lastReturned = null;
		}
	}

	private final class KeyIterator extends NodeIterator<K> {
		@Override
		K extract(HashTable.Node<K, V> node) {
			return node.key;
		}
	}

	private final class ValueIterator extends NodeIterator<V> {
		@Override
		V extract(HashTable.Node<K, V> node) {
			return node.value;
		}
	}

	private final class EntryIterator extends NodeIterator<Map.Entry<K, V>> {
		@Override
		Map.Entry<K, V> extract(HashTable.Node<K, V> node) {
			return new EntryView<>(node);
		}
	}

	/**
	 * Live entry: reads and writes the node's value directly. {@link #setValue} is value-only and leaves
	 * the generation untouched.
	 */
	private static final class EntryView<K, V> implements Map.Entry<K, V> {
		private final HashTable.Node<K, V> node;

		EntryView(HashTable.Node<K, V> node) {
			this.node = node;
		}

		@Override
		public K getKey() {
			return node.key;
		}

		@Override
		public V getValue() {
			return node.value;
		}

		@Override
		public V setValue(V value) {
			Objects.requireNonNull(value, "value");
			V old = node.value;
			node.value = value;
			return old;
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(node.key) ^ node.value.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof Map.Entry<?, ?> e)) return false;
			return Objects.equals(node.key, e.getKey()) && Objects.equals(node.value, e.getValue());
		}

		@Override
		public String toString() {
			return node.key + "=" + node.value;
		}
	}
}
