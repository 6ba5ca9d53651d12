package io.github.bluuewhale.failfast;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator bound to a {@link Generational} container.
 *
 * <p>The container's generation is snapshotted at construction. While {@link IteratorState#ACTIVE},
 * every {@link #next()} and {@link #remove()} first compares it with the live value; on mismatch the
 * iterator moves to {@link IteratorState#INVALIDATED} and throws
 * {@link ConcurrentStructuralModificationException}, now and on every later call. The iterator's own
 * {@link #remove()} re-snapshots after the removal, so it never invalidates itself.
 *
 * <p>Once nothing remains the iterator is {@link IteratorState#EXHAUSTED}, and it stays so whatever the
 * container does afterwards: {@code hasNext} answers {@code false} and {@code next} throws
 * {@link java.util.NoSuchElementException}. Removing the last element is still possible until the
 * container changes; after that {@code remove} throws without leaving the EXHAUSTED state.
 *
 * <p>This is detection, not prevention: a mutation from another thread may race with the check.
 *
 * @param <E> element type
 */
public abstract class FailFastIterator<E> implements Iterator<E> {

	private final Generational target;
	private long expectedGeneration;
	private IteratorState state = IteratorState.ACTIVE;
	private boolean canRemove;

	protected FailFastIterator(Generational target) {
		this.target = target;
		this.expectedGeneration = target.generation();
	}

	/** Whether the cursor still has an element to yield. Must not mutate the container. */
	protected abstract boolean hasRemaining();

	/** Yields the element under the cursor and moves past it. Called only when {@link #hasRemaining()}. */
	protected abstract E advance();

	/** Structurally removes the element last returned by {@link #advance()}. */
	protected void removeLastReturned() {
		throw new UnsupportedOperationException("remove");
	}

	public final IteratorState state() {
		settleIfDrained();
		return state;
	}

	@Override
	public final boolean hasNext() {
		if (state == IteratorState.INVALIDATED) {
			throw new ConcurrentStructuralModificationException(expectedGeneration, target.generation());
		}
		settleIfDrained();
		return state == IteratorState.ACTIVE;
	}

	@Override
	public final E next() {
		if (state == IteratorState.EXHAUSTED) throw new NoSuchElementException();
		checkGeneration();
		if (!hasRemaining()) {
			state = IteratorState.EXHAUSTED;
			throw new NoSuchElementException();
		}
		E e = advance();
		canRemove = true;
		if (!hasRemaining()) state = IteratorState.EXHAUSTED;
		return e;
	}

	@Override
	public final void remove() {
		checkGeneration();
		if (!canRemove) throw new IllegalStateException();
		canRemove = false;
		removeLastReturned();
		expectedGeneration = target.generation();
	}

	/* Subclass cursors are initialized after this constructor runs, so the empty case is settled lazily. */
	private void settleIfDrained() {
		if (state == IteratorState.ACTIVE && !hasRemaining()) state = IteratorState.EXHAUSTED;
	}

	private void checkGeneration() {
		long actual = target.generation();
		if (state == IteratorState.INVALIDATED || actual != expectedGeneration) {
			if (state != IteratorState.EXHAUSTED) state = IteratorState.INVALIDATED;
			throw new ConcurrentStructuralModificationException(expectedGeneration, actual);
		}
	}
}
