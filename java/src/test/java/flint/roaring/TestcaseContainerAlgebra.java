package flint.roaring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.PrimitiveIterator;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class TestcaseContainerAlgebra {

	private static final byte[] TYPES = { Container.ARRAY, Container.BITMAP, Container.RUN };

	private static Stream<Arguments> pairs() {
		List<Arguments> out = new ArrayList<>();
		for (byte a : TYPES) for (byte b : TYPES) out.add(Arguments.of(a, b));
		return out.stream();
	}

	/** lows in runs so every form can hold them; dense when the form is a bitmap */
	private static TreeSet<Integer> lows(Random rnd, byte type) {
		TreeSet<Integer> s = new TreeSet<>();
		int runs = type == Container.BITMAP ? 40 : 12;
		int maxLen = type == Container.BITMAP ? 2000 : 150;
		for (int r = 0; r < runs; r++) {
			int start = rnd.nextInt(Container.CHUNK_SIZE);
			int len = 1 + rnd.nextInt(maxLen);
			for (int v = start; v < Math.min(start + len, Container.CHUNK_SIZE); v++) s.add(v);
		}
		// some values above 32767 to exercise unsigned compares
		s.add(65535);
		s.add(32768);
		return s;
	}

	static Container build(TreeSet<Integer> lows, byte type) {
		ArrayContainer ac = new ArrayContainer(lows.size());
		for (int v : lows) ac.values[ac.size++] = (short) v;
		switch (type) {
			case Container.ARRAY:
				return ac;
			case Container.BITMAP:
				return ac.toBitmap();
			default:
				return ac.toRun();
		}
	}

	static TreeSet<Integer> members(Container c) {
		TreeSet<Integer> s = new TreeSet<>();
		for (PrimitiveIterator.OfInt it = c.intIterator(0); it.hasNext();) s.add(it.nextInt());
		return s;
	}

	private static void assertPolicy(Container c) {
		int card = c.cardinality();
		switch (c.type()) {
			case Container.ARRAY:
				assertTrue(card <= Container.MAX_ARRAY_SIZE, "array above threshold: " + card);
				break;
			case Container.BITMAP:
				assertTrue(card > Container.MAX_ARRAY_SIZE, "bitmap at or below threshold: " + card);
				break;
			default:
				int alternative = card <= Container.MAX_ARRAY_SIZE ? 2 * card : Container.BITMAP_BYTES;
				assertTrue(4 * c.numberOfRuns() < alternative, "run not smaller than its alternative");
				break;
		}
	}

	@ParameterizedTest(name = "{0} x {1}")
	@MethodSource("pairs")
	void binaryOpsMatchModel(byte ta, byte tb) {
		Random rnd = new Random(31L * ta + tb);
		for (int round = 0; round < 5; round++) {
			TreeSet<Integer> x = lows(rnd, ta), y = lows(rnd, tb);
			Container a = build(x, ta), b = build(y, tb);

			TreeSet<Integer> and = new TreeSet<>(x);
			and.retainAll(y);
			TreeSet<Integer> or = new TreeSet<>(x);
			or.addAll(y);
			TreeSet<Integer> andNot = new TreeSet<>(x);
			andNot.removeAll(y);
			TreeSet<Integer> xor = new TreeSet<>(or);
			xor.removeAll(and);

			Container r = ContainerAlgebra.and(a, b);
			assertEquals(and, members(r));
			assertPolicy(r);
			r = ContainerAlgebra.or(a, b);
			assertEquals(or, members(r));
			assertPolicy(r);
			r = ContainerAlgebra.xor(a, b);
			assertEquals(xor, members(r));
			assertPolicy(r);
			r = ContainerAlgebra.andNot(a, b);
			assertEquals(andNot, members(r));
			assertPolicy(r);

			assertEquals(and.size(), ContainerAlgebra.andCardinality(a, b));
			assertEquals(!and.isEmpty(), ContainerAlgebra.intersects(a, b));

			// operands untouched
			assertEquals(x, members(a));
			assertEquals(y, members(b));
		}
	}

	@ParameterizedTest(name = "{0} x {1}")
	@MethodSource("pairs")
	void sameMembershipIgnoresForm(byte ta, byte tb) {
		TreeSet<Integer> x = lows(new Random(7), Container.RUN);
		assertTrue(ContainerAlgebra.sameMembership(build(x, ta), build(x, tb)));
		// same cardinality, one member swapped
		TreeSet<Integer> y = new TreeSet<>(x);
		y.remove(65535);
		int absent = 0;
		while (x.contains(absent)) absent++;
		y.add(absent);
		assertFalse(ContainerAlgebra.sameMembership(build(x, ta), build(y, tb)));
	}

	@Test
	void disjointAndIsEmpty() {
		Container a = ArrayContainer.ofRange(0, 100);
		Container b = RunContainer.ofRange(200, 300);
		assertTrue(ContainerAlgebra.and(a, b).isEmpty());
		assertFalse(ContainerAlgebra.intersects(a, b));
		assertEquals(0, ContainerAlgebra.andCardinality(a, b));
	}

	@Test
	void unionOfRunsStaysRun() {
		Container a = RunContainer.ofRange(0, 10_000);
		Container b = RunContainer.ofRange(10_000, 20_000);
		Container r = ContainerAlgebra.or(a, b);
		assertEquals(Container.RUN, r.type());
		assertEquals(1, r.numberOfRuns());
		assertEquals(20_000, r.cardinality());
	}

	@Test
	void arrayUnionCrossesThreshold() {
		ArrayContainer a = new ArrayContainer(), b = new ArrayContainer();
		for (int v = 0; v < 4000; v++) a.add((short) (2 * v));
		for (int v = 0; v < 200; v++) b.add((short) (2 * v + 1));
		Container r = ContainerAlgebra.or(a, b);
		assertEquals(Container.BITMAP, r.type());
		assertEquals(4200, r.cardinality());
		r = ContainerAlgebra.xor(a, b);
		assertEquals(Container.BITMAP, r.type());
		assertEquals(4200, r.cardinality());
	}

	@Test
	void normalizePolicy() {
		BitmapContainer small = new BitmapContainer();
		small.setRange(0, 4096);
		assertEquals(Container.ARRAY, ContainerAlgebra.normalize(small).type());
		BitmapContainer big = new BitmapContainer();
		big.setRange(0, 4097);
		assertSame(big, ContainerAlgebra.normalize(big));
		// 1 run of 4 bytes vs 2 bytes of array: array wins
		assertEquals(Container.ARRAY, ContainerAlgebra.normalize(RunContainer.ofRange(7, 8)).type());
		assertEquals(Container.RUN, ContainerAlgebra.normalize(RunContainer.ofRange(7, 10)).type());
	}

	@Test
	void runsOnlyWhenSmaller() {
		ArrayContainer pair = ArrayContainer.ofRange(0, 2); // 4 bytes as array, 4 bytes as run
		assertNull(ContainerAlgebra.toRunsIfSmaller(pair));
		assertNotNull(ContainerAlgebra.toRunsIfSmaller(ArrayContainer.ofRange(0, 3)));
		BitmapContainer alternating = new BitmapContainer();
		for (int v = 0; v < Container.CHUNK_SIZE; v += 2) alternating.add((short) v);
		assertNull(ContainerAlgebra.toRunsIfSmaller(alternating));
		assertNull(ContainerAlgebra.toRunsIfSmaller(RunContainer.ofRange(0, 100)));
		// an inefficient run falls back on optimize
		RunContainer sparse = new RunContainer();
		for (int v = 0; v < 100; v += 2) sparse.add((short) v);
		assertEquals(Container.ARRAY, ContainerAlgebra.optimize(sparse).type());
		// a bitmap down to 2000 isolated values: array beats both bitmap and runs
		BitmapContainer shrunk = new BitmapContainer();
		for (int v = 0; v < 4000; v += 2) shrunk.add((short) v);
		Container settled = ContainerAlgebra.optimize(shrunk);
		assertEquals(Container.ARRAY, settled.type());
		assertSame(settled, ContainerAlgebra.optimize(settled));
		// a shrunk bitmap holding one range goes to runs
		BitmapContainer range = new BitmapContainer();
		range.setRange(100, 1100);
		assertEquals(Container.RUN, ContainerAlgebra.optimize(range).type());
	}

	@Test
	void removeRunPicksArrayOrBitmap() {
		assertEquals(Container.ARRAY, ContainerAlgebra.removeRun(RunContainer.ofRange(0, 4096)).type());
		assertEquals(Container.BITMAP, ContainerAlgebra.removeRun(RunContainer.ofRange(0, 4097)).type());
		Container ac = ArrayContainer.ofRange(0, 3);
		assertSame(ac, ContainerAlgebra.removeRun(ac));
	}

	@Test
	void flipInsideChunk() {
		Container c = ContainerAlgebra.flip(ArrayContainer.ofRange(10, 20), 15, 30);
		assertEquals(Container.ARRAY, c.type());
		TreeSet<Integer> expected = new TreeSet<>();
		for (int v = 10; v < 15; v++) expected.add(v);
		for (int v = 20; v < 30; v++) expected.add(v);
		assertEquals(expected, members(c));
		assertTrue(ContainerAlgebra.flip(RunContainer.ofRange(0, Container.CHUNK_SIZE), 0, Container.CHUNK_SIZE).isEmpty());
	}

	@Test
	void lazyOrMatchesPairwise() {
		Random rnd = new Random(99);
		Container[] group = new Container[6];
		TreeSet<Integer> expected = new TreeSet<>();
		for (int i = 0; i < group.length; i++) {
			byte t = TYPES[i % 3];
			TreeSet<Integer> x = lows(rnd, t);
			expected.addAll(x);
			group[i] = build(x, t);
		}
		Container r = ContainerAlgebra.lazyOr(group, group.length);
		assertEquals(expected, members(r));
		assertPolicy(r);

		Container[] arrays = { ArrayContainer.ofRange(0, 10), ArrayContainer.ofRange(5, 20), ArrayContainer.ofRange(100, 101) };
		r = ContainerAlgebra.lazyOr(arrays, 3);
		assertEquals(Container.ARRAY, r.type());
		assertEquals(21, r.cardinality());
	}
}
