package io.github.bluuewhale.failfast;

import java.util.Collection;
import java.util.Iterator;
import java.util.Optional;

/**
 * Sequence with insertion and removal at both ends.
 *
 * <p>Each end operation comes in two forms. The asserting form treats an empty or full container as a
 * caller error and throws {@link EmptyContainerException} or {@link FullContainerException}. The
 * {@code try} form treats it as an ordinary outcome and reports it through the return value.
 * {@code null} is never a storable element: every push rejects it with {@link InvalidElementException}
 * before touching the container, so an empty {@link Optional} from a {@code try} form always means
 * "container empty".
 *
 * <p>The sequence imposes no ordering policy: {@code pushFront}+{@code popFront} is a stack,
 * {@code pushBack}+{@code popFront} is a queue.
 */
public interface DoubleEndedSequence<E> extends Collection<E>, Generational {

	void pushFront(E e);

	void pushBack(E e);

	/** Returns {@code false} instead of throwing when a bounded sequence is full. */
	boolean tryPushFront(E e);

	/** Returns {@code false} instead of throwing when a bounded sequence is full. */
	boolean tryPushBack(E e);

	E popFront();

	E popBack();

	Optional<E> tryPopFront();

	Optional<E> tryPopBack();

	E peekFront();

	E peekBack();

	Optional<E> tryPeekFront();

	Optional<E> tryPeekBack();

	/** Current storage capacity. Fixed for bounded sequences, grows for growable ones. */
	int capacity();

	/** {@code true} only for a bounded sequence holding {@link #capacity()} elements. */
	boolean isFull();

	/** Fail-fast iterator from back to front. */
	Iterator<E> descendingIterator();
}
