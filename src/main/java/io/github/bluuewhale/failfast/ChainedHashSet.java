package io.github.bluuewhale.failfast;

import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;

/**
 * Hash set composed over a {@link ChainedHashMap} whose values are a fixed marker. Membership is key
 * presence; the set keeps no state of its own. One {@code null} element is allowed.
 *
 * <p>Not thread-safe; see {@link ChainedHashMap} for the iteration and threading contract.
 */
public class ChainedHashSet<E> extends AbstractSet<E> implements Generational {

	private static final Object PRESENT = Boolean.TRUE;

	private final ChainedHashMap<E, Object> map;

	public ChainedHashSet() {
		this.map = new ChainedHashMap<>();
	}

	public ChainedHashSet(int initialCapacity) {
		this.map = new ChainedHashMap<>(initialCapacity);
	}

	public ChainedHashSet(int initialCapacity, double loadFactor) {
		this.map = new ChainedHashMap<>(initialCapacity, loadFactor);
	}

	public ChainedHashSet(Collection<? extends E> c) {
		this.map = new ChainedHashMap<>(
			ChainedHashMap.capacityFor(c.size(), HashTable.DEFAULT_LOAD_FACTOR), HashTable.DEFAULT_LOAD_FACTOR);
		addAll(c);
	}

	@Override
	public long generation() {
		return map.generation();
	}

	public int capacity() {
		return map.capacity();
	}

	@Override
	public int size() {
		return map.size();
	}

	@Override
	public boolean isEmpty() {
		return map.isEmpty();
	}

	@Override
	public boolean contains(Object o) {
		return map.containsKey(o);
	}

	/** Returns {@code true} if {@code e} was newly added. */
	@Override
	public boolean add(E e) {
		return map.putIfAbsent(e, PRESENT) == null;
	}

	@Override
	public boolean remove(Object o) {
		return map.remove(o) != null;
	}

	@Override
	public void clear() {
		map.clear();
	}

	/** Live, fail-fast iterator over the backing map's keys. */
	@Override
	public Iterator<E> iterator() {
		return map.keySet().iterator();
	}
}
