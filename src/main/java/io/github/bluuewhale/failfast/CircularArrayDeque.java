package io.github.bluuewhale.failfast;

import java.util.AbstractCollection;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Optional;

/**
 * Double-ended queue over a circular array.
 *
 * <p>Vacant slots hold a private marker object, never {@code null}, and callers cannot reach it.
 * {@code null} elements are rejected with {@link InvalidElementException} before any state change.
 *
 * <p>The {@link GrowthPolicy} is fixed at construction. A {@link GrowthPolicy#GROWABLE} deque doubles its
 * storage when a push finds it full and therefore never reports full. A {@link GrowthPolicy#BOUNDED} deque
 * rejects pushes once it holds {@link #capacity()} elements.
 *
 * <p>Every push and pop bumps {@link #generation()} once; peeks never do. Iterators are fail-fast and do not
 * support removal, so the inherited {@code remove(Object)}, {@code removeAll}, {@code retainAll} and
 * {@code removeIf} throw {@link UnsupportedOperationException} once they reach an element to drop; elements
 * leave only through the pop operations or {@link #clear()}. Not thread-safe: cross-thread use without
 * external synchronization is undefined behavior.
 */
public class CircularArrayDeque<E> extends AbstractCollection<E> implements DoubleEndedSequence<E> {

	public enum GrowthPolicy {
		GROWABLE,
		BOUNDED
	}

	static final int DEFAULT_CAPACITY = 16;

	/* Upper bound for a doubling growth step. */
	private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

	/* Marker stored in vacant slots. */
	private static final Object VACANT = new Object();

	/* Storage */
	private Object[] storage;
	private int head;  // index of the front element (or of the next front slot when empty)
	private int tail;  // index one past the back element
	private int count;
	private long generation;
	private final GrowthPolicy policy;

	public CircularArrayDeque() {
		this(GrowthPolicy.GROWABLE, DEFAULT_CAPACITY);
	}

	public CircularArrayDeque(GrowthPolicy policy, int capacity) {
		if (policy == null) throw new NullPointerException("policy");
		if (capacity < 1) {
			throw new IllegalArgumentException("capacity must be >= 1: " + capacity);
		}
		this.policy = policy;
		this.storage = new Object[capacity];
		Arrays.fill(storage, VACANT);
	}

	public static <E> CircularArrayDeque<E> growable() {
		return new CircularArrayDeque<>();
	}

	public static <E> CircularArrayDeque<E> growable(int initialCapacity) {
		return new CircularArrayDeque<>(GrowthPolicy.GROWABLE, initialCapacity);
	}

	public static <E> CircularArrayDeque<E> bounded(int capacity) {
		return new CircularArrayDeque<>(GrowthPolicy.BOUNDED, capacity);
	}

	public GrowthPolicy policy() {
		return policy;
	}

	@Override
	public long generation() {
		return generation;
	}

	@Override
	public int capacity() {
		return storage.length;
	}

	@Override
	public int size() {
		return count;
	}

	@Override
	public boolean isEmpty() {
		return count == 0;
	}

	@Override
	public boolean isFull() {
		return policy == GrowthPolicy.BOUNDED && count == storage.length;
	}

	/* ------------ push ------------ */

	@Override
	public void pushFront(E e) {
		if (!tryPushFront(e)) throw new FullContainerException("pushFront", storage.length);
	}

	@Override
	public void pushBack(E e) {
		if (!tryPushBack(e)) throw new FullContainerException("pushBack", storage.length);
	}

	@Override
	public boolean tryPushFront(E e) {
		checkElement(e);
		if (!ensureRoom()) return false;
		head = dec(head, storage.length);
		storage[head] = e;
		count++;
		generation++;
		return true;
	}

	@Override
	public boolean tryPushBack(E e) {
		checkElement(e);
		if (!ensureRoom()) return false;
		storage[tail] = e;
		tail = inc(tail, storage.length);
		count++;
		generation++;
		return true;
	}

	/** Same as {@link #pushBack}. */
	@Override
	public boolean add(E e) {
		pushBack(e);
		return true;
	}

	private static void checkElement(Object e) {
		if (e == null) throw new InvalidElementException("null elements are not allowed");
	}

	private boolean ensureRoom() {
		if (count < storage.length) return true;
		if (policy == GrowthPolicy.BOUNDED) return false;
		grow();
		return true;
	}

	/* Copies the elements front to back into a doubled array starting at index 0. */
	private void grow() {
		int oldCap = storage.length;
		if (oldCap == MAX_CAPACITY) throw new OutOfMemoryError("deque capacity exhausted");
		int newCap = (int) Math.min(MAX_CAPACITY, (long) oldCap << 1);
		Object[] fresh = new Object[newCap];
		for (int i = 0, j = head; i < count; i++, j = inc(j, oldCap)) {
			fresh[i] = storage[j];
		}
		Arrays.fill(fresh, count, newCap, VACANT);
		storage = fresh;
		head = 0;
		tail = count;
	}

	/* ------------ pop ------------ */

	@Override
	public E popFront() {
		if (count == 0) throw new EmptyContainerException("popFront");
		return removeFront();
	}

	@Override
	public E popBack() {
		if (count == 0) throw new EmptyContainerException("popBack");
		return removeBack();
	}

	@Override
	public Optional<E> tryPopFront() {
		return (count == 0) ? Optional.empty() : Optional.of(removeFront());
	}

	@Override
	public Optional<E> tryPopBack() {
		return (count == 0) ? Optional.empty() : Optional.of(removeBack());
	}

	private E removeFront() {
		E e = elementAt(head);
		storage[head] = VACANT;
		head = inc(head, storage.length);
		count--;
		generation++;
		return e;
	}

	private E removeBack() {
		tail = dec(tail, storage.length);
		E e = elementAt(tail);
		storage[tail] = VACANT;
		count--;
		generation++;
		return e;
	}

	/* ------------ peek ------------ */

	@Override
	public E peekFront() {
		if (count == 0) throw new EmptyContainerException("peekFront");
		return elementAt(head);
	}

	@Override
	public E peekBack() {
		if (count == 0) throw new EmptyContainerException("peekBack");
		return elementAt(dec(tail, storage.length));
	}

	@Override
	public Optional<E> tryPeekFront() {
		return (count == 0) ? Optional.empty() : Optional.of(elementAt(head));
	}

	@Override
	public Optional<E> tryPeekBack() {
		return (count == 0) ? Optional.empty() : Optional.of(elementAt(dec(tail, storage.length)));
	}

	/* ------------ bulk ------------ */

	@Override
	public boolean contains(Object o) {
		if (o == null) return false;
		for (int i = 0, j = head; i < count; i++, j = inc(j, storage.length)) {
			if (o.equals(storage[j])) return true;
		}
		return false;
	}

	@Override
	public void clear() {
		if (count == 0) return;
		Arrays.fill(storage, VACANT);
		head = 0;
		tail = 0;
		count = 0;
		generation++;
	}

	@Override
	public Iterator<E> iterator() {
		return new AscendingIterator();
	}

	@Override
	public Iterator<E> descendingIterator() {
		return new DescendingIterator();
	}

	/* ------------ index helpers ------------ */

	private static int inc(int i, int modulus) {
		return (++i >= modulus) ? 0 : i;
	}

	private static int dec(int i, int modulus) {
		return (--i < 0) ? modulus - 1 : i;
	}

	@SuppressWarnings("unchecked")
	private E elementAt(int idx) {
		return (E) storage[idx];
	}

	/* ------------ iterators ------------ */

	/*
	 * Any push or pop changes the generation, so head/tail/storage read here are stable while the
	 * iterator is still ACTIVE.
	 */
	private final class AscendingIterator extends FailFastIterator<E> {
		private int cursor = head;
		private int remaining = count;

		AscendingIterator() {
			super(CircularArrayDeque.this);
		}

		@Override
		protected boolean hasRemaining() {
			return remaining > 0;
		}

		@Override
		protected E advance() {
			E e = elementAt(cursor);
			cursor = inc(cursor, storage.length);
			remaining--;
			return e;
		}
	}

	private final class DescendingIterator extends FailFastIterator<E> {
		private int cursor = dec(tail, storage.length);
		private int remaining = count;

		DescendingIterator() {
			super(CircularArrayDeque.this);
		}

		@Override
		protected boolean hasRemaining() {
			return remaining > 0;
		}

		@Override
		protected E advance() {
			E e = elementAt(cursor);
			cursor = dec(cursor, storage.length);
			remaining--;
			return e;
		}
	}
}
