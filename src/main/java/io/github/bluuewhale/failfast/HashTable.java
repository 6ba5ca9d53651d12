package io.github.bluuewhale.failfast;

import java.util.Arrays;
import java.util.Objects;

/**
 * Separate-chaining hash table backing {@link ChainedHashMap} (and through it {@link ChainedHashSet}).
 * Power-of-two bucket array, murmur-smeared hashes, synchronous doubling resize, and a dedicated slot
 * for the {@code null} key that bypasses hashing.
 *
 * <p>Not thread-safe. {@link #generation} is bumped once for each insert of a new key, each removal, each
 * resize, and each {@link #clear()} that removed something, so an insert that triggers resizing advances it
 * by more than one. Value-only replacement never bumps it.
 */
final class HashTable<K, V> implements Generational {

	/* Defaults */
	static final int DEFAULT_INITIAL_CAPACITY = 16;
	static final double DEFAULT_LOAD_FACTOR = 0.75d;

	/**
	 * Chain link. Owned by exactly one bucket (or the null-key slot) of one table.
	 */
	static final class Node<K, V> {
		final int hash;
		final K key;
		V value;
		Node<K, V> next;

		Node(int hash, K key, V value, Node<K, V> next) {
			this.hash = hash;
			this.key = key;
			this.value = value;
			this.next = next;
		}
	}

	/* Storage */
	private Node<K, V>[] buckets;
	private Node<K, V> nullKeyNode;
	private int size;
	private long generation;
	private final double loadFactor;

	HashTable(int initialCapacity, double loadFactor) {
		Hashing.validateCapacity(initialCapacity);
		this.loadFactor = Hashing.validateLoadFactor(loadFactor);
		this.buckets = newBuckets(Hashing.tableSizeFor(initialCapacity));
	}

	@SuppressWarnings("unchecked")
	private static <K, V> Node<K, V>[] newBuckets(int capacity) {
		return (Node<K, V>[]) new Node[capacity];
	}

	int size() {
		return size;
	}

	int capacity() {
		return buckets.length;
	}

	double loadFactor() {
		return loadFactor;
	}

	@Override
	public long generation() {
		return generation;
	}

	/* ------------ lookup ------------ */

	Node<K, V> lookupNode(Object key) {
		if (key == null) return nullKeyNode;
		int h = Hashing.spread(key);
		for (Node<K, V> n = buckets[Hashing.indexFor(h, buckets.length)]; n != null; n = n.next) {
			if (n.hash == h && (n.key == key || key.equals(n.key))) return n;
		}
		return null;
	}

	V lookup(Object key) {
		Node<K, V> n = lookupNode(key);
		return (n == null) ? null : n.value;
	}

	/* ------------ upsert ------------ */

	/**
	 * Binds {@code value} to {@code key}. Returns the replaced value, or {@code null} when the key was new
	 * (values stored here are never null).
	 */
	V upsert(K key, V value) {
		Node<K, V> existing = lookupNode(key);
		if (existing != null) {
			V old = existing.value;
			existing.value = value;
			return old;
		}
		insertAbsent(key, value);
		return null;
	}

	/**
	 * Inserts a key known to be absent and resizes if the load factor is now exceeded.
	 * Appends to the chain tail so each chain keeps insertion order.
	 */
	Node<K, V> insertAbsent(K key, V value) {
		Node<K, V> node;
		if (key == null) {
			node = new Node<>(0, null, value, null);
			nullKeyNode = node;
		} else {
			int h = Hashing.spread(key);
			node = new Node<>(h, key, value, null);
			int idx = Hashing.indexFor(h, buckets.length);
			Node<K, V> n = buckets[idx];
			if (n == null) {
				buckets[idx] = node;
			} else {
				while (n.next != null) n = n.next;
				n.next = node;
			}
		}
		size++;
		generation++;
		while (Hashing.needsResizing(size, buckets.length, loadFactor)) {
			resize();
		}
		return node;
	}

	/* ------------ erase ------------ */

	/**
	 * Removes the mapping for {@code key}. Returns the removed value, or {@code null} if absent (no-op).
	 */
	V erase(Object key) {
		Node<K, V> n = eraseNode(key);
		return (n == null) ? null : n.value;
	}

	Node<K, V> eraseNode(Object key) {
		if (key == null) {
			Node<K, V> n = nullKeyNode;
			if (n == null) return null;
			nullKeyNode = null;
			size--;
			generation++;
			return n;
		}
		int h = Hashing.spread(key);
		int idx = Hashing.indexFor(h, buckets.length);
		Node<K, V> prev = null;
		for (Node<K, V> n = buckets[idx]; n != null; prev = n, n = n.next) {
			if (n.hash == h && (n.key == key || key.equals(n.key))) {
				unlink(idx, prev, n);
				return n;
			}
		}
		return null;
	}

	/**
	 * Removes exactly {@code target} (identity), used by iterators that already hold the node.
	 */
	void eraseExact(Node<K, V> target) {
		if (target == nullKeyNode) {
			eraseNode(null);
			return;
		}
		int idx = Hashing.indexFor(target.hash, buckets.length);
		Node<K, V> prev = null;
		for (Node<K, V> n = buckets[idx]; n != null; prev = n, n = n.next) {
			if (n == target) {
				unlink(idx, prev, n);
				return;
			}
		}
		throw new IllegalStateException("node is not owned by this table");
	}

	private void unlink(int idx, Node<K, V> prev, Node<K, V> n) {
		if (prev == null) buckets[idx] = n.next;
		else prev.next = n.next;
		size--;
		generation++;
	}

	void clear() {
		if (size == 0) return;
		Arrays.fill(buckets, null);
		nullKeyNode = null;
		size = 0;
		generation++;
	}

	/* ------------ resize ------------ */

	/**
	 * Doubles the bucket array and redistributes every node. Nodes are relinked, not copied, so each one
	 * appears exactly once afterwards and {@code size} is unchanged. Each chain splits into a "low" and a
	 * "high" chain (index and index + oldCapacity) preserving relative order.
	 */
	void resize() {
		Node<K, V>[] old = buckets;
		int oldCap = old.length;
		if (oldCap >= Hashing.MAX_TABLE_SIZE) return;
		int newCap = oldCap << 1;
		Node<K, V>[] fresh = newBuckets(newCap);

		for (int i = 0; i < oldCap; i++) {
			Node<K, V> loHead = null, loTail = null;
			Node<K, V> hiHead = null, hiTail = null;
			Node<K, V> n = old[i];
			while (n != null) {
				Node<K, V> next = n.next;
				n.next = null;
				if ((n.hash & oldCap) == 0) {
					if (loTail == null) loHead = n;
					else loTail.next = n;
					loTail = n;
				} else {
					if (hiTail == null) hiHead = n;
					else hiTail.next = n;
					hiTail = n;
				}
				n = next;
			}
			fresh[i] = loHead;
			fresh[i + oldCap] = hiHead;
		}
		buckets = fresh;
		generation++;
	}

	/* ------------ traversal ------------ */

	/* Order: null-key slot first, then buckets in index order, chains head to tail. */

	/** First node in bucket {@code fromIndex} or later, or {@code null}. */
	Node<K, V> firstNodeFrom(int fromIndex) {
		Node<K, V>[] b = buckets;
		for (int i = fromIndex; i < b.length; i++) {
			if (b[i] != null) return b[i];
		}
		return null;
	}

	/** Node following {@code n} in traversal order, or {@code null} at the end. */
	Node<K, V> successor(Node<K, V> n) {
		if (n.next != null) return n.next;
		if (n == nullKeyNode) return firstNodeFrom(0);
		return firstNodeFrom(Hashing.indexFor(n.hash, buckets.length) + 1);
	}

	Node<K, V> firstNode() {
		return (nullKeyNode != null) ? nullKeyNode : firstNodeFrom(0);
	}

	boolean containsValue(Object value) {
		if (value == null) return false;
		for (Node<K, V> n = firstNode(); n != null; n = successor(n)) {
			if (Objects.equals(value, n.value)) return true;
		}
		return false;
	}
}
