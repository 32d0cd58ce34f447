package flint.roaring;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Random;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;

class TestcaseRange {

	private static void addAll(TreeSet<Long> s, long lo, long hi) {
		for (long v = lo; v < hi; v++) s.add(v);
	}

	private static void removeAll(TreeSet<Long> s, long lo, long hi) {
		s.subSet(lo, hi).clear();
	}

	private static void flipAll(TreeSet<Long> s, long lo, long hi) {
		for (long v = lo; v < hi; v++) if (!s.remove(v)) s.add(v);
	}

	@Test
	void addRangeAcrossChunkBorders() {
		RoaringBitmap rb = new RoaringBitmap();
		rb.addRange(65_000, 200_000);
		assertEquals(135_000, rb.cardinality());
		assertEquals(65_000, rb.minimum());
		assertEquals(199_999, rb.maximum());
		assertEquals(4, rb.stats().getContainers());
		// 65000..65535 is 536 values, the inner chunks are full, 196608..199999 is 3392
		assertEquals(2, rb.stats().getArrayContainers());
		assertEquals(2, rb.stats().getBitmapContainers());
	}

	@Test
	void rangesMatchModel() {
		Random rnd = new Random(11);
		RoaringBitmap rb = new RoaringBitmap();
		TreeSet<Long> model = new TreeSet<>();
		for (int round = 0; round < 60; round++) {
			long lo = rnd.nextInt(400_000);
			long hi = lo + rnd.nextInt(round % 3 == 0 ? 150_000 : 6_000);
			switch (rnd.nextInt(3)) {
				case 0:
					rb.addRange(lo, hi);
					addAll(model, lo, hi);
					break;
				case 1:
					rb.removeRange(lo, hi);
					removeAll(model, lo, hi);
					break;
				default:
					rb.flip(lo, hi);
					flipAll(model, lo, hi);
					break;
			}
			if (round % 10 == 9) rb.runOptimize();
		}
		Sets.assertMembers(model, rb);
		for (int i = 0; i < rb.stats().getContainers(); i++) assertFalse(rb.index.containerAt(i).isEmpty());
	}

	@Test
	void rangesOnRunContainers() {
		RoaringBitmap rb = new RoaringBitmap();
		rb.addRange(0, 50_000);
		rb.runOptimize();
		rb.removeRange(1_000, 2_000);
		rb.addRange(60_000, 61_000);
		rb.remove(30_000);
		assertEquals(1, rb.stats().getRunContainers());
		assertEquals(50_000 - 1_000 + 1_000 - 1, rb.cardinality());
		rb.removeRange(0, 1L << 16);
		assertTrue(rb.isEmpty());
	}

	@Test
	void lastChunksFull() {
		RoaringBitmap rb = new RoaringBitmap();
		rb.add(3);
		rb.addRange(0xFFFE_0000L, RoaringBitmap.MAX_RANGE);
		assertEquals(1 + (1L << 17), rb.cardinality());
		assertEquals(0xFFFF_FFFFL, rb.maximum());
		assertEquals(2, rb.stats().getBitmapContainers());
		assertTrue(rb.contains(-1));
		assertEquals(1 + (1L << 17), rb.rank(-1));
		assertEquals(0xFFFF_FFFEL, rb.select(rb.cardinality() - 2));
		rb.flip(0xFFFE_0000L, RoaringBitmap.MAX_RANGE);
		assertArrayEquals(new int[] { 3 }, rb.toArray());
	}

	@Test
	void topOfRange() {
		RoaringBitmap rb = new RoaringBitmap();
		rb.addRange(0xFFFF_FFF0L, RoaringBitmap.MAX_RANGE);
		assertEquals(16, rb.cardinality());
		assertTrue(rb.contains(-1));
		rb.removeRange(0xFFFF_FFFFL, RoaringBitmap.MAX_RANGE);
		assertFalse(rb.contains(-1));
		assertEquals(0xFFFF_FFFEL, rb.maximum());
	}

	@Test
	void emptyRangesDoNothing() {
		RoaringBitmap rb = RoaringBitmap.of(5);
		rb.addRange(10, 10);
		rb.addRange(10, 3);
		rb.removeRange(6, 5);
		rb.flip(100, 100);
		assertArrayEquals(new int[] { 5 }, rb.toArray());
	}

	@Test
	void invalidRangesRejected() {
		RoaringBitmap rb = new RoaringBitmap();
		IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> rb.addRange(-1, 5));
		assertTrue(ex.getMessage().startsWith(ErrorCode.INVALID_RANGE.getMessage()));
		assertThrows(IllegalArgumentException.class, () -> rb.removeRange(0, RoaringBitmap.MAX_RANGE + 1));
		assertThrows(IllegalArgumentException.class, () -> rb.flip(0, -2));
		assertThrows(IllegalArgumentException.class, () -> RoaringBitmap.flip(rb, RoaringBitmap.MAX_RANGE + 1, 0));
	}

	@Test
	void staticFlipLeavesInputAlone() {
		RoaringBitmap rb = RoaringBitmap.of(1, 2, 3);
		RoaringBitmap flipped = RoaringBitmap.flip(rb, 0, 5);
		assertArrayEquals(new int[] { 0, 4 }, flipped.toArray());
		assertArrayEquals(new int[] { 1, 2, 3 }, rb.toArray());
	}

	@Test
	void flipCreatesChunks() {
		RoaringBitmap rb = new RoaringBitmap();
		rb.flip(70_000, 70_010);
		assertEquals(10, rb.cardinality());
		rb.flip(70_000, 70_005);
		assertArrayEquals(new int[] { 70_005, 70_006, 70_007, 70_008, 70_009 }, rb.toArray());
	}
}
