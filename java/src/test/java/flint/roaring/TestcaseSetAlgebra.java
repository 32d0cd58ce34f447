package flint.roaring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class TestcaseSetAlgebra {

	private static Stream<Long> seeds() {
		return LongStream.range(0, 8).boxed();
	}

	private static RoaringBitmap shaped(TreeSet<Long> s, Random rnd) {
		RoaringBitmap rb = Sets.bitmap(s);
		if (rnd.nextBoolean()) rb.runOptimize();
		return rb;
	}

	@ParameterizedTest(name = "seed {0}")
	@MethodSource("seeds")
	void staticOpsMatchModel(long seed) {
		Random rnd = new Random(seed);
		TreeSet<Long> x = Sets.random(rnd), y = Sets.random(rnd);
		RoaringBitmap a = shaped(x, rnd), b = shaped(y, rnd);
		RoaringBitmap a0 = a.clone(), b0 = b.clone();

		TreeSet<Long> and = new TreeSet<>(x);
		and.retainAll(y);
		TreeSet<Long> or = new TreeSet<>(x);
		or.addAll(y);
		TreeSet<Long> andNot = new TreeSet<>(x);
		andNot.removeAll(y);
		TreeSet<Long> xor = new TreeSet<>(or);
		xor.removeAll(and);

		Sets.assertMembers(and, RoaringBitmap.and(a, b));
		Sets.assertMembers(or, RoaringBitmap.or(a, b));
		Sets.assertMembers(xor, RoaringBitmap.xor(a, b));
		Sets.assertMembers(andNot, RoaringBitmap.andNot(a, b));
		assertEquals(!and.isEmpty(), a.intersects(b));
		double expectedJaccard = or.isEmpty() ? 0.0 : (double) and.size() / or.size();
		assertEquals(expectedJaccard, a.jaccardIndex(b), 1e-12);

		// inputs are read only
		assertEquals(a0, a);
		assertEquals(b0, b);
	}

	@ParameterizedTest(name = "seed {0}")
	@MethodSource("seeds")
	void inPlaceOpsMatchStatic(long seed) {
		Random rnd = new Random(seed + 100);
		RoaringBitmap a = shaped(Sets.random(rnd), rnd), b = shaped(Sets.random(rnd), rnd);

		RoaringBitmap r = a.clone();
		r.and(b);
		assertEquals(RoaringBitmap.and(a, b), r);
		r = a.clone();
		r.or(b);
		assertEquals(RoaringBitmap.or(a, b), r);
		r = a.clone();
		r.xor(b);
		assertEquals(RoaringBitmap.xor(a, b), r);
		r = a.clone();
		r.andNot(b);
		assertEquals(RoaringBitmap.andNot(a, b), r);
	}

	@Test
	void resultsShareNothingWithInputs() {
		RoaringBitmap a = RoaringBitmap.of(1, 2, 3, 1 << 20);
		RoaringBitmap b = RoaringBitmap.of(5, 2 << 20);
		RoaringBitmap u = RoaringBitmap.or(a, b);
		u.add(4);
		u.add((1 << 20) + 1);
		u.add((2 << 20) + 1);
		assertArrayEquals(new int[] { 1, 2, 3, 1 << 20 }, a.toArray());
		assertArrayEquals(new int[] { 5, 2 << 20 }, b.toArray());

		RoaringBitmap f = RoaringBitmap.fastOr(a, b, RoaringBitmap.of(9));
		f.add((1 << 20) + 7);
		assertFalse(a.contains((1 << 20) + 7));
	}

	@Test
	void selfOperations() {
		RoaringBitmap a = RoaringBitmap.of(1, 2, 3, 100_000);
		RoaringBitmap copy = a.clone();
		a.or(a);
		assertEquals(copy, a);
		a.and(a);
		assertEquals(copy, a);
		a.xor(a);
		assertTrue(a.isEmpty());
		RoaringBitmap c = copy.clone();
		c.andNot(c);
		assertTrue(c.isEmpty());
	}

	@Test
	void emptyOperands() {
		RoaringBitmap a = RoaringBitmap.of(1, 70_000);
		RoaringBitmap e = new RoaringBitmap();
		assertEquals(a, RoaringBitmap.or(a, e));
		assertTrue(RoaringBitmap.and(a, e).isEmpty());
		assertEquals(a, RoaringBitmap.andNot(a, e));
		assertTrue(RoaringBitmap.andNot(e, a).isEmpty());
		assertEquals(a, RoaringBitmap.xor(e, a));
		assertFalse(a.intersects(e));
		assertEquals(0.0, a.jaccardIndex(e));
	}

	@Test
	void fastOrMatchesPairwise() {
		Random rnd = new Random(77);
		List<RoaringBitmap> inputs = new ArrayList<>();
		TreeSet<Long> model = new TreeSet<>();
		for (int i = 0; i < 9; i++) {
			TreeSet<Long> s = Sets.random(rnd);
			model.addAll(s);
			inputs.add(shaped(s, rnd));
		}
		inputs.add(new RoaringBitmap());
		RoaringBitmap[] arr = inputs.toArray(new RoaringBitmap[0]);
		List<RoaringBitmap> before = new ArrayList<>();
		for (RoaringBitmap rb : arr) before.add(rb.clone());

		RoaringBitmap fast = RoaringBitmap.fastOr(arr);
		Sets.assertMembers(model, fast);
		for (int i = 0; i < arr.length; i++) assertEquals(before.get(i), arr[i]);
	}

	@Test
	void fastOrSmallCounts() {
		assertTrue(RoaringBitmap.fastOr().isEmpty());
		RoaringBitmap a = RoaringBitmap.of(1, 2);
		RoaringBitmap one = RoaringBitmap.fastOr(a);
		assertEquals(a, one);
		one.add(3);
		assertFalse(a.contains(3));
		assertArrayEquals(new int[] { 1, 2, 5 }, RoaringBitmap.fastOr(a, RoaringBitmap.of(5)).toArray());
	}

	@Test
	void fastOrFullRunGroup() {
		RoaringBitmap full = new RoaringBitmap();
		full.addRange(0, 1 << 16);
		full.runOptimize();
		RoaringBitmap u = RoaringBitmap.fastOr(RoaringBitmap.of(1), full, RoaringBitmap.of(2, 1 << 16));
		assertEquals((1 << 16) + 1, u.cardinality());
		assertTrue(u.contains(1 << 16));
	}
}
