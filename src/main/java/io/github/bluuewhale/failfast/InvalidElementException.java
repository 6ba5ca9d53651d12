package io.github.bluuewhale.failfast;

/**
 * Thrown when a caller tries to store an element the container reserves for itself. For
 * {@link CircularArrayDeque} that is {@code null}, which the {@code try*} forms use to mean "no element".
 * Thrown before any state change.
 */
public class InvalidElementException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	public InvalidElementException(String message) {
		super(message);
	}
}
