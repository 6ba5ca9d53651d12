package io.github.bluuewhale.failfast;

/**
 * A mutable container that counts its structural changes.
 *
 * <p>The generation starts at zero and increases by one on every structural change:
 * an element or key entering or leaving the container, or the backing storage being
 * reorganized (a hash table resize). Replacing the value bound to an existing key is
 * not structural. Iterators snapshot the generation when created and fail as soon as
 * they observe a different one; see {@link FailFastIterator}.
 *
 * <p>The counter is a plain field. Reading it from a thread other than the owner gives
 * no visibility guarantee, so fail-fast detection is best-effort and only meaningful
 * for operations issued by the owning thread.
 */
public interface Generational {

	/** Number of structural changes since construction. */
	long generation();
}
