package io.github.bluuewhale.failfast;

/**
 * Static helpers based on the hash utilities authored by Guava contributors.
 * Original code by Kevin Bourrillion, Jesse Wilson, and Austin Appleby,
 * derived from the MurmurHash3 intermediate step (public domain).
 */
final class Hashing {

	private Hashing() {}

	/*
	 * Use longs to preserve precision (mirrors the Guava implementation).
	 */
	private static final long C1 = 0xcc9e2d51L;
	private static final long C2 = 0x1b873593L;

	/*
	 * Upper bound to keep table size as a power of two.
	 * Matches Guava's Ints.MAX_POWER_OF_TWO (1 << 30).
	 */
	static final int MAX_TABLE_SIZE = 1 << 30;

	/* Smallest bucket array a table ever allocates. */
	static final int MIN_TABLE_SIZE = 2;

	/*
	 * This method was rewritten in Java from an intermediate step of the Murmur hash function in
	 * http://code.google.com/p/smhasher/source/browse/trunk/MurmurHash3.cpp, which contained the
	 * following header:
	 *
	 * MurmurHash3 was written by Austin Appleby, and is placed in the public domain. The author
	 * hereby disclaims copyright to this source code.
	 */
	static int smear(int hashCode) {
		return (int) (C2 * Integer.rotateLeft((int) (hashCode * C1), 15));
	}

	/**
	 * Spread hash of a non-null key. Equal keys always spread to the same value;
	 * keys whose {@code hashCode} differs only in high bits still land in different buckets.
	 */
	static int spread(Object key) {
		return smear(key.hashCode());
	}

	static int indexFor(int spreadHash, int tableSize) {
		return spreadHash & (tableSize - 1);
	}

	/**
	 * Rounds a requested bucket count up to a power of two within
	 * [{@link #MIN_TABLE_SIZE}, {@link #MAX_TABLE_SIZE}].
	 */
	static int tableSizeFor(int requested) {
		if (requested <= MIN_TABLE_SIZE) return MIN_TABLE_SIZE;
		if (requested >= MAX_TABLE_SIZE) return MAX_TABLE_SIZE;
		return Integer.highestOneBit(requested - 1) << 1;
	}

	static boolean needsResizing(int size, int tableSize, double loadFactor) {
		return size > loadFactor * tableSize && tableSize < MAX_TABLE_SIZE;
	}

	static double validateLoadFactor(double loadFactor) {
		if (!(loadFactor > 0.0d) || Double.isInfinite(loadFactor)) {
			throw new IllegalArgumentException("loadFactor must be finite and > 0: " + loadFactor);
		}
		return loadFactor;
	}

	static int validateCapacity(int initialCapacity) {
		if (initialCapacity < 0) {
			throw new IllegalArgumentException("initialCapacity must be >= 0: " + initialCapacity);
		}
		return initialCapacity;
	}
}
