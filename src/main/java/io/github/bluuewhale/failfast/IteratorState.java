package io.github.bluuewhale.failfast;

/**
 * Lifecycle of a {@link FailFastIterator}. {@link #EXHAUSTED} and {@link #INVALIDATED} are terminal.
 */
public enum IteratorState {
	/** Bound to a live container whose generation still matches the snapshot. */
	ACTIVE,
	/** Every element has been yielded. */
	EXHAUSTED,
	/** A foreign structural change was observed; the iterator must be discarded. */
	INVALIDATED
}
