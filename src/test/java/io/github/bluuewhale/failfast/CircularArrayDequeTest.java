package io.github.bluuewhale.failfast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CircularArrayDequeTest {

	private static <E> List<E> toList(Iterator<E> it) {
		var out = new ArrayList<E>();
		it.forEachRemaining(out::add);
		return out;
	}

	@Test
	void pushBackPopFrontIsFifo() {
		var d = CircularArrayDeque.<Integer>growable();
		d.pushBack(1);
		d.pushBack(2);
		d.pushBack(3);
		assertEquals(1, d.popFront());
		assertEquals(2, d.popFront());
		assertEquals(3, d.popFront());
		assertTrue(d.isEmpty());
	}

	@Test
	void pushFrontPopFrontIsLifo() {
		var d = CircularArrayDeque.<Integer>growable();
		d.pushFront(1);
		d.pushFront(2);
		d.pushFront(3);
		assertEquals(3, d.popFront());
		assertEquals(2, d.popFront());
		assertEquals(1, d.popFront());
	}

	@Test
	void popBackTakesNewestBackElement() {
		var d = CircularArrayDeque.<String>growable();
		d.pushBack("a");
		d.pushBack("b");
		d.pushFront("z");
		assertEquals("b", d.popBack());
		assertEquals("a", d.popBack());
		assertEquals("z", d.popBack());
	}

	@Test
	void boundedDequeSaturates() {
		var d = CircularArrayDeque.<Integer>bounded(2);
		assertTrue(d.tryPushBack(1));
		assertTrue(d.tryPushBack(2));
		assertTrue(d.isFull());
		assertFalse(d.tryPushBack(3));
		assertFalse(d.tryPushFront(3));
		assertEquals(2, d.capacity());
		assertEquals(1, d.popFront());
		assertEquals(2, d.popFront());
		assertFalse(d.isFull());
	}

	@Test
	void assertingPushOnFullBoundedDequeLeavesItUntouched() {
		var d = CircularArrayDeque.<Integer>bounded(1);
		d.pushBack(1);
		long gen = d.generation();
		var ex = assertThrows(FullContainerException.class, () -> d.pushBack(2));
		assertEquals(1, ex.capacity());
		assertThrows(FullContainerException.class, () -> d.pushFront(2));
		assertThrows(IllegalStateException.class, () -> d.add(2));
		assertEquals(gen, d.generation());
		assertEquals(List.of(1), toList(d.iterator()));
	}

	@Test
	void assertingFormsFailOnEmpty() {
		var d = CircularArrayDeque.<Integer>growable();
		assertThrows(EmptyContainerException.class, d::popFront);
		assertThrows(EmptyContainerException.class, d::popBack);
		assertThrows(EmptyContainerException.class, d::peekFront);
		assertThrows(EmptyContainerException.class, d::peekBack);
		assertEquals(0, d.generation());
	}

	@Test
	void tryFormsReportEmptyAsAbsence() {
		var d = CircularArrayDeque.<Integer>growable();
		assertEquals(Optional.empty(), d.tryPopFront());
		assertEquals(Optional.empty(), d.tryPopBack());
		assertEquals(Optional.empty(), d.tryPeekFront());
		assertEquals(Optional.empty(), d.tryPeekBack());

		d.pushBack(7);
		assertEquals(Optional.of(7), d.tryPeekFront());
		assertEquals(Optional.of(7), d.tryPeekBack());
		assertEquals(Optional.of(7), d.tryPopBack());
		assertEquals(0, d.size());
	}

	@Test
	void nullIsRejectedBeforeAnyMutation() {
		var d = CircularArrayDeque.<Integer>bounded(1);
		assertThrows(InvalidElementException.class, () -> d.pushBack(null));
		assertThrows(InvalidElementException.class, () -> d.pushFront(null));
		assertThrows(InvalidElementException.class, () -> d.tryPushBack(null));
		assertThrows(InvalidElementException.class, () -> d.tryPushFront(null));
		assertEquals(0, d.size());
		assertEquals(0, d.generation());

		d.pushBack(1);
		// invalid element wins over full
		assertThrows(InvalidElementException.class, () -> d.pushBack(null));
		assertFalse(d.contains(null));
	}

	@Test
	void generationBumpsOncePerPushOrPop() {
		var d = CircularArrayDeque.<Integer>growable(1);
		d.pushBack(1);
		d.pushBack(2); // grows
		d.pushFront(0); // grows
		assertEquals(3, d.generation());
		d.peekFront();
		d.peekBack();
		assertEquals(3, d.generation());
		d.popFront();
		d.tryPopBack();
		assertEquals(5, d.generation());
		d.tryPopBack();
		d.tryPopBack(); // empty: no-op
		assertEquals(6, d.generation());
	}

	@Test
	void growthPreservesOrderAcrossWraparound() {
		var d = CircularArrayDeque.<Integer>growable(4);
		d.pushBack(1);
		d.pushBack(2);
		d.pushBack(3);
		assertEquals(1, d.popFront());
		d.pushBack(4);
		d.pushBack(5); // wraps to slot 0
		assertEquals(4, d.capacity());
		d.pushBack(6); // grows
		assertEquals(8, d.capacity());
		assertEquals(List.of(2, 3, 4, 5, 6), toList(d.iterator()));
		assertEquals(List.of(6, 5, 4, 3, 2), toList(d.descendingIterator()));
	}

	@Test
	void pushFrontGrowthPreservesOrder() {
		var d = CircularArrayDeque.<Integer>growable(2);
		d.pushFront(1);
		d.pushFront(2);
		d.pushFront(3);
		assertEquals(4, d.capacity());
		assertEquals(List.of(3, 2, 1), toList(d.iterator()));
		assertEquals(1, d.popBack());
		assertEquals(3, d.peekFront());
		assertEquals(2, d.peekBack());
	}

	@Test
	void growableDequeIsNeverFull() {
		var d = CircularArrayDeque.<Integer>growable(1);
		for (int i = 0; i < 10_000; i++) {
			assertFalse(d.isFull());
			assertTrue(d.tryPushFront(i));
		}
		assertEquals(10_000, d.size());
		assertEquals(16_384, d.capacity());
	}

	@Test
	void mixedStackAndQueueUsage() {
		var d = CircularArrayDeque.<String>bounded(3);
		d.pushBack("q1");
		d.pushFront("s1");
		d.pushBack("q2");
		assertEquals("s1", d.popFront());
		assertEquals("q1", d.popFront());
		assertEquals("q2", d.popFront());
	}

	@Test
	void containsClearAndToString() {
		var d = CircularArrayDeque.<Integer>growable();
		d.addAll(List.of(1, 2, 3));
		assertEquals("[1, 2, 3]", d.toString());
		assertTrue(d.contains(2));
		assertFalse(d.contains(4));
		long gen = d.generation();
		d.clear();
		assertEquals(gen + 1, d.generation());
		assertTrue(d.isEmpty());
		assertEquals("[]", d.toString());
		d.clear();
		assertEquals(gen + 1, d.generation());
		d.pushBack(9);
		assertEquals(9, d.peekFront());
	}

	@Test
	void inheritedRemovalsAreUnsupported() {
		var d = CircularArrayDeque.<Integer>growable();
		d.pushBack(1);
		d.pushBack(2);
		d.pushBack(3);

		assertFalse(d.remove(Integer.valueOf(9)), "nothing to drop, nothing to throw");
		assertThrows(UnsupportedOperationException.class, () -> d.remove(Integer.valueOf(2)));
		assertThrows(UnsupportedOperationException.class, () -> d.removeAll(List.of(3)));
		assertThrows(UnsupportedOperationException.class, () -> d.retainAll(List.of(1)));
		assertThrows(UnsupportedOperationException.class, () -> d.removeIf(e -> e > 1));

		assertEquals(List.of(1, 2, 3), toList(d.iterator()));
		assertEquals(1, d.popFront());
	}

	@Test
	void policyIsFixedAtConstruction() {
		assertEquals(CircularArrayDeque.GrowthPolicy.GROWABLE, CircularArrayDeque.growable().policy());
		assertEquals(CircularArrayDeque.GrowthPolicy.BOUNDED, CircularArrayDeque.bounded(4).policy());
		assertEquals(CircularArrayDeque.DEFAULT_CAPACITY, new CircularArrayDeque<String>().capacity());
	}

	@ParameterizedTest(name = "capacity={0} is rejected")
	@ValueSource(ints = { 0, -1, Integer.MIN_VALUE })
	void invalidCapacityIsRejected(int capacity) {
		assertThrows(IllegalArgumentException.class, () -> CircularArrayDeque.bounded(capacity));
		assertThrows(IllegalArgumentException.class, () -> CircularArrayDeque.growable(capacity));
	}
}
