package io.github.bluuewhale.failfast;

import java.util.ArrayDeque;
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

@Warmup(iterations = 3)
@Measurement(iterations = 5)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
public class DequeBenchmark {

	@State(Scope.Thread)
	public static class QueueState {
		@Param({ "16", "1024" })
		int depth;

		CircularArrayDeque<Integer> circular;
		ArrayDeque<Integer> jdk;
		int next;

		@Setup(Level.Iteration)
		public void fill() {
			circular = CircularArrayDeque.growable();
			jdk = new ArrayDeque<>();
			for (int i = 0; i < depth; i++) {
				circular.pushBack(i);
				jdk.addLast(i);
			}
			next = depth;
		}
	}

	// Steady-state queue: one in at the back, one out at the front.
	@Benchmark
	public int circularQueueCycle(QueueState s) {
		s.circular.pushBack(s.next++);
		return s.circular.popFront();
	}

	@Benchmark
	public int jdkQueueCycle(QueueState s) {
		s.jdk.addLast(s.next++);
		return s.jdk.pollFirst();
	}

	// Steady-state stack at the front.
	@Benchmark
	public int circularStackCycle(QueueState s) {
		s.circular.pushFront(s.next++);
		return s.circular.popFront();
	}

	@Benchmark
	public int jdkStackCycle(QueueState s) {
		s.jdk.addFirst(s.next++);
		return s.jdk.pollFirst();
	}

	@Benchmark
	public long circularIterate(QueueState s) {
		long sum = 0;
		for (int v : s.circular) sum += v;
		return sum;
	}

	@Benchmark
	public long jdkIterate(QueueState s) {
		long sum = 0;
		for (int v : s.jdk) sum += v;
		return sum;
	}
}
