package io.github.bluuewhale.failfast;

import java.util.NoSuchElementException;

/**
 * Thrown by the asserting deque operations ({@code popFront}, {@code peekBack}, ...) when the deque is empty.
 */
public class EmptyContainerException extends NoSuchElementException {

	private static final long serialVersionUID = 1L;

	public EmptyContainerException(String operation) {
		super(operation + " on empty container");
	}
}
