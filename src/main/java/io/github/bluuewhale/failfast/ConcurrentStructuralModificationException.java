package io.github.bluuewhale.failfast;

import java.util.ConcurrentModificationException;

/**
 * Thrown by an iterator, or by a composite map operation, that observes a structural change it did
 * not make itself. Only the failing iterator (or call) is affected; the container stays usable.
 */
public class ConcurrentStructuralModificationException extends ConcurrentModificationException {

	private static final long serialVersionUID = 1L;

	private final long expectedGeneration;
	private final long actualGeneration;

	public ConcurrentStructuralModificationException(long expectedGeneration, long actualGeneration) {
		super("container generation changed from " + expectedGeneration + " to " + actualGeneration);
		this.expectedGeneration = expectedGeneration;
		this.actualGeneration = actualGeneration;
	}

	public long expectedGeneration() {
		return expectedGeneration;
	}

	public long actualGeneration() {
		return actualGeneration;
	}
}
