package io.github.bluuewhale.failfast;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;

/**
 * Cost of walking the map through its generation-checked views, next to {@link HashMap}'s modCount-checked ones.
 */
@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
public class ViewIterationBenchmark {

	@State(Scope.Benchmark)
	public static class Populated {
		@Param({ "1000", "100000" })
		int size;

		@Param({ "0.75", "4.0" })
		double loadFactor;

		ChainedHashMap<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;

		@Setup(Level.Trial)
		public void populate() {
			var rnd = new Random(7);
			chained = new ChainedHashMap<>(16, loadFactor);
			jdk = new HashMap<>(16, (float) loadFactor);
			while (chained.size() < size) {
				int k = rnd.nextInt();
				chained.put(k, k & 0xff);
				jdk.put(k, k & 0xff);
			}
			chained.put(null, 0);
			jdk.put(null, 0);
		}
	}

	// Rebuilt before every call: each invocation removes half of the entries.
	@State(Scope.Thread)
	public static class Draining {
		@Param({ "1000", "100000" })
		int size;

		ChainedHashMap<Integer, Integer> chained;
		HashMap<Integer, Integer> jdk;

		@Setup(Level.Invocation)
		public void refill() {
			chained = new ChainedHashMap<>(ChainedHashMap.capacityFor(size, 0.75d));
			jdk = new HashMap<>(size * 2);
			for (int i = 0; i < size; i++) {
				chained.put(i, i);
				jdk.put(i, i);
			}
		}
	}

	// ------- read-only walks -------
	@Benchmark
	public long chainedKeys(Populated s) {
		long sum = 0;
		for (Integer k : s.chained.keySet()) if (k != null) sum += k;
		return sum;
	}

	@Benchmark
	public long jdkKeys(Populated s) {
		long sum = 0;
		for (Integer k : s.jdk.keySet()) if (k != null) sum += k;
		return sum;
	}

	@Benchmark
	public long chainedValues(Populated s) {
		long sum = 0;
		for (int v : s.chained.values()) sum += v;
		return sum;
	}

	@Benchmark
	public long jdkValues(Populated s) {
		long sum = 0;
		for (int v : s.jdk.values()) sum += v;
		return sum;
	}

	// ------- value-only writes while iterating (never invalidates) -------
	@Benchmark
	public long chainedEntrySetValue(Populated s) {
		long sum = 0;
		for (Map.Entry<Integer, Integer> e : s.chained.entrySet()) {
			sum += e.setValue((e.getValue() + 1) & 0xff);
		}
		return sum;
	}

	@Benchmark
	public long jdkEntrySetValue(Populated s) {
		long sum = 0;
		for (Map.Entry<Integer, Integer> e : s.jdk.entrySet()) {
			sum += e.setValue((e.getValue() + 1) & 0xff);
		}
		return sum;
	}

	// ------- removal through the iterator (re-snapshots the generation) -------
	@Benchmark
	public int chainedIteratorRemoveHalf(Draining s) {
		Iterator<Integer> it = s.chained.keySet().iterator();
		while (it.hasNext()) {
			if ((it.next() & 1) == 0) it.remove();
		}
		return s.chained.size();
	}

	@Benchmark
	public int jdkIteratorRemoveHalf(Draining s) {
		Iterator<Integer> it = s.jdk.keySet().iterator();
		while (it.hasNext()) {
			if ((it.next() & 1) == 0) it.remove();
		}
		return s.jdk.size();
	}
}
