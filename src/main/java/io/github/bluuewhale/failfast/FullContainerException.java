package io.github.bluuewhale.failfast;

/**
 * Thrown by the asserting push operations of a bounded deque that already holds {@code capacity} elements.
 */
public class FullContainerException extends IllegalStateException {

	private static final long serialVersionUID = 1L;

	private final int capacity;

	public FullContainerException(String operation, int capacity) {
		super(operation + " on full container (capacity " + capacity + ")");
		this.capacity = capacity;
	}

	public int capacity() {
		return capacity;
	}
}
