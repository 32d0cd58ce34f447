/**
 * ContainerAlgebra.java
 */
package flint.roaring;

import static flint.roaring.Container.ARRAY;
import static flint.roaring.Container.BITMAP;
import static flint.roaring.Container.BITMAP_BYTES;
import static flint.roaring.Container.BITMAP_WORDS;
import static flint.roaring.Container.MAX_ARRAY_SIZE;
import static flint.roaring.Container.RUN;

/**
 * Pairwise container operations and the representation policy.
 *
 * <pre>
 * normalize: array  above 4096 values  -> bitmap
 *            bitmap at or below 4096   -> array
 *            run    kept only while 4 * runs is below the array/bitmap payload
 * </pre>
 *
 * Operands are never modified and results never share storage with them. Frozen operands are
 * copied to the heap first. Pairs involving a run are decomposed into word-range operations
 * on a bitmap, except run/run and array/run unions and intersections which merge intervals.
 */
final class ContainerAlgebra {

	// tag pairs, (left << 2) | right
	private static final int BB = (BITMAP << 2) | BITMAP;
	private static final int BA = (BITMAP << 2) | ARRAY;
	private static final int BR = (BITMAP << 2) | RUN;
	private static final int AB = (ARRAY << 2) | BITMAP;
	private static final int AA = (ARRAY << 2) | ARRAY;
	private static final int AR = (ARRAY << 2) | RUN;
	private static final int RB = (RUN << 2) | BITMAP;
	private static final int RA = (RUN << 2) | ARRAY;
	private static final int RR = (RUN << 2) | RUN;

	private ContainerAlgebra() {
	}

	private static int pair(Container a, Container b) {
		return (a.type() << 2) | b.type();
	}

	// ----- Representation policy -----
	static boolean runIsSmaller(int nruns, int currentBytes) {
		return 4 * nruns < currentBytes;
	}

	static Container normalize(Container c) {
		switch (c.type()) {
			case ARRAY: {
				ArrayContainer ac = (ArrayContainer) c;
				return ac.size > MAX_ARRAY_SIZE ? ac.toBitmap() : ac;
			}
			case BITMAP: {
				BitmapContainer bc = (BitmapContainer) c;
				return bc.cardinality <= MAX_ARRAY_SIZE ? bc.toArray() : bc;
			}
			default: {
				RunContainer rc = (RunContainer) c;
				int card = rc.cardinality();
				int alternative = card <= MAX_ARRAY_SIZE ? 2 * card : BITMAP_BYTES;
				if (runIsSmaller(rc.nruns, alternative)) return rc;
				return card <= MAX_ARRAY_SIZE ? rc.toArray() : rc.toBitmap();
			}
		}
	}

	/** run form if strictly smaller than the current payload, otherwise null */
	static RunContainer toRunsIfSmaller(Container c) {
		c = c.heap();
		switch (c.type()) {
			case ARRAY: {
				ArrayContainer ac = (ArrayContainer) c;
				return runIsSmaller(ac.numberOfRuns(), ac.sizeInBytes()) ? ac.toRun() : null;
			}
			case BITMAP: {
				BitmapContainer bc = (BitmapContainer) c;
				return runIsSmaller(bc.numberOfRuns(), BITMAP_BYTES) ? bc.toRun() : null;
			}
			default:
				return null;
		}
	}

	/**
	 * smallest form for runOptimize: a bitmap that shrank to 4096 values or fewer becomes an
	 * array first, then the run form is compared against that; inefficient runs fall back
	 */
	static Container optimize(Container c) {
		Container normal = normalize(c.heap());
		if (normal.type() == RUN) return normal;
		RunContainer rc = toRunsIfSmaller(normal);
		return rc != null ? rc : normal;
	}

	static Container removeRun(Container c) {
		if (c.type() != RUN) return c;
		RunContainer rc = (RunContainer) c.heap();
		return rc.cardinality() <= MAX_ARRAY_SIZE ? rc.toArray() : rc.toBitmap();
	}

	/** flips [start, end); a heap bitmap is flipped in place */
	static Container flip(Container c, int start, int end) {
		BitmapContainer bc = (c.type() == BITMAP && !c.isFrozen()) ? (BitmapContainer) c : c.toBitmap();
		bc.flipRange(start, end);
		return normalize(bc);
	}

	// ----- AND -----
	static Container and(Container a, Container b) {
		a = a.heap();
		b = b.heap();
		switch (pair(a, b)) {
			case AA: return andArrays((ArrayContainer) a, (ArrayContainer) b);
			case AB: return filter((ArrayContainer) a, b, true);
			case BA: return filter((ArrayContainer) b, a, true);
			case AR: return filter((ArrayContainer) a, b, true);
			case RA: return filter((ArrayContainer) b, a, true);
			case BB: {
				long[] x = ((BitmapContainer) a).words, y = ((BitmapContainer) b).words;
				long[] out = new long[BITMAP_WORDS];
				int card = 0;
				for (int i = 0; i < BITMAP_WORDS; i++) {
					out[i] = x[i] & y[i];
					card += Long.bitCount(out[i]);
				}
				return normalize(new BitmapContainer(out, card));
			}
			case BR: return andBitmapRun((BitmapContainer) a, (RunContainer) b);
			case RB: return andBitmapRun((BitmapContainer) b, (RunContainer) a);
			case RR: return normalize(intersectRuns((RunContainer) a, (RunContainer) b));
			default: throw new IllegalStateException(ErrorCode.INTERNAL_ERROR.getMessage() + " - container pair " + pair(a, b));
		}
	}

	private static ArrayContainer andArrays(ArrayContainer a, ArrayContainer b) {
		ArrayContainer out = new ArrayContainer(Math.min(a.size, b.size));
		int i = 0, j = 0, k = 0;
		while (i < a.size && j < b.size) {
			int x = a.values[i] & 0xFFFF;
			int y = b.values[j] & 0xFFFF;
			if (x == y) { out.values[k++] = a.values[i]; i++; j++; }
			else if (x < y) i++;
			else j++;
		}
		out.size = k;
		return out;
	}

	/** values of a kept when their membership in other equals keep */
	private static ArrayContainer filter(ArrayContainer a, Container other, boolean keep) {
		ArrayContainer out = new ArrayContainer(a.size);
		int k = 0;
		for (int i = 0; i < a.size; i++) {
			if (other.contains(a.values[i]) == keep) out.values[k++] = a.values[i];
		}
		out.size = k;
		return out;
	}

	private static Container andBitmapRun(BitmapContainer b, RunContainer r) {
		long[] out = new long[BITMAP_WORDS];
		r.orInto(out);
		int card = 0;
		for (int i = 0; i < BITMAP_WORDS; i++) {
			out[i] &= b.words[i];
			card += Long.bitCount(out[i]);
		}
		return normalize(new BitmapContainer(out, card));
	}

	static RunContainer intersectRuns(RunContainer a, RunContainer b) {
		short[] out = new short[2 * (a.nruns + b.nruns)];
		int n = 0, i = 0, j = 0;
		while (i < a.nruns && j < b.nruns) {
			int s = Math.max(a.start(i), b.start(j));
			int e = Math.min(a.end(i), b.end(j));
			if (s <= e) {
				out[2 * n] = (short) s;
				out[2 * n + 1] = (short) (e - s);
				n++;
			}
			if (a.end(i) < b.end(j)) i++;
			else j++;
		}
		return new RunContainer(out, n);
	}

	// ----- OR -----
	static Container or(Container a, Container b) {
		a = a.heap();
		b = b.heap();
		switch (pair(a, b)) {
			case AA: return orArrays((ArrayContainer) a, (ArrayContainer) b);
			case AB: return orBitmapArray((BitmapContainer) b, (ArrayContainer) a);
			case BA: return orBitmapArray((BitmapContainer) a, (ArrayContainer) b);
			case BB: {
				long[] x = ((BitmapContainer) a).words, y = ((BitmapContainer) b).words;
				long[] out = new long[BITMAP_WORDS];
				int card = 0;
				for (int i = 0; i < BITMAP_WORDS; i++) {
					out[i] = x[i] | y[i];
					card += Long.bitCount(out[i]);
				}
				return normalize(new BitmapContainer(out, card));
			}
			case AR: return normalize(unionRuns(((ArrayContainer) a).toRun(), (RunContainer) b));
			case RA: return normalize(unionRuns((RunContainer) a, ((ArrayContainer) b).toRun()));
			case BR: return orBitmapRun((BitmapContainer) a, (RunContainer) b);
			case RB: return orBitmapRun((BitmapContainer) b, (RunContainer) a);
			case RR: return normalize(unionRuns((RunContainer) a, (RunContainer) b));
			default: throw new IllegalStateException(ErrorCode.INTERNAL_ERROR.getMessage() + " - container pair " + pair(a, b));
		}
	}

	private static Container orArrays(ArrayContainer a, ArrayContainer b) {
		if (a.size + b.size > MAX_ARRAY_SIZE) {
			long[] words = new long[BITMAP_WORDS];
			a.orInto(words);
			b.orInto(words);
			return normalize(new BitmapContainer(words, popcount(words)));
		}
		ArrayContainer out = new ArrayContainer(a.size + b.size);
		int i = 0, j = 0, k = 0;
		while (i < a.size && j < b.size) {
			int x = a.values[i] & 0xFFFF;
			int y = b.values[j] & 0xFFFF;
			if (x == y) { out.values[k++] = a.values[i]; i++; j++; }
			else if (x < y) out.values[k++] = a.values[i++];
			else out.values[k++] = b.values[j++];
		}
		while (i < a.size) out.values[k++] = a.values[i++];
		while (j < b.size) out.values[k++] = b.values[j++];
		out.size = k;
		return out;
	}

	private static Container orBitmapArray(BitmapContainer b, ArrayContainer a) {
		BitmapContainer out = b.copy();
		for (int i = 0; i < a.size; i++) out.add(a.values[i]);
		return normalize(out);
	}

	private static Container orBitmapRun(BitmapContainer b, RunContainer r) {
		if (r.isFull()) return r.copy();
		BitmapContainer out = b.copy();
		for (int i = 0; i < r.nruns; i++) out.setRange(r.start(i), r.end(i) + 1);
		return normalize(out);
	}

	static RunContainer unionRuns(RunContainer a, RunContainer b) {
		short[] out = new short[2 * (a.nruns + b.nruns)];
		int n = 0, i = 0, j = 0;
		int curStart = -1, curEnd = -2;
		while (i < a.nruns || j < b.nruns) {
			int s, e;
			if (j >= b.nruns || (i < a.nruns && a.start(i) <= b.start(j))) {
				s = a.start(i);
				e = a.end(i);
				i++;
			} else {
				s = b.start(j);
				e = b.end(j);
				j++;
			}
			if (s <= curEnd + 1) {
				curEnd = Math.max(curEnd, e);
			} else {
				if (curStart >= 0) {
					out[2 * n] = (short) curStart;
					out[2 * n + 1] = (short) (curEnd - curStart);
					n++;
				}
				curStart = s;
				curEnd = e;
			}
		}
		if (curStart >= 0) {
			out[2 * n] = (short) curStart;
			out[2 * n + 1] = (short) (curEnd - curStart);
			n++;
		}
		return new RunContainer(out, n);
	}

	// ----- XOR -----
	static Container xor(Container a, Container b) {
		a = a.heap();
		b = b.heap();
		switch (pair(a, b)) {
			case AA: return xorArrays((ArrayContainer) a, (ArrayContainer) b);
			case AB: return xorBitmapArray((BitmapContainer) b, (ArrayContainer) a);
			case BA: return xorBitmapArray((BitmapContainer) a, (ArrayContainer) b);
			case BB: {
				long[] x = ((BitmapContainer) a).words, y = ((BitmapContainer) b).words;
				long[] out = new long[BITMAP_WORDS];
				int card = 0;
				for (int i = 0; i < BITMAP_WORDS; i++) {
					out[i] = x[i] ^ y[i];
					card += Long.bitCount(out[i]);
				}
				return normalize(new BitmapContainer(out, card));
			}
			case AR:
			case BR:
			case RR: return xorWithRun(a.toBitmap(), (RunContainer) b);
			case RA:
			case RB: return xorWithRun(b.toBitmap(), (RunContainer) a);
			default: throw new IllegalStateException(ErrorCode.INTERNAL_ERROR.getMessage() + " - container pair " + pair(a, b));
		}
	}

	private static Container xorArrays(ArrayContainer a, ArrayContainer b) {
		if (a.size + b.size > MAX_ARRAY_SIZE) {
			BitmapContainer out = a.toBitmap();
			for (int j = 0; j < b.size; j++) {
				if (!out.add(b.values[j])) out.remove(b.values[j]);
			}
			return normalize(out);
		}
		ArrayContainer out = new ArrayContainer(a.size + b.size);
		int i = 0, j = 0, k = 0;
		while (i < a.size && j < b.size) {
			int x = a.values[i] & 0xFFFF;
			int y = b.values[j] & 0xFFFF;
			if (x == y) { i++; j++; }
			else if (x < y) out.values[k++] = a.values[i++];
			else out.values[k++] = b.values[j++];
		}
		while (i < a.size) out.values[k++] = a.values[i++];
		while (j < b.size) out.values[k++] = b.values[j++];
		out.size = k;
		return out;
	}

	private static Container xorBitmapArray(BitmapContainer b, ArrayContainer a) {
		BitmapContainer out = b.copy();
		for (int i = 0; i < a.size; i++) {
			if (!out.add(a.values[i])) out.remove(a.values[i]);
		}
		return normalize(out);
	}

	/** bitmap is a private copy and gets flipped in place */
	private static Container xorWithRun(BitmapContainer bitmap, RunContainer r) {
		for (int i = 0; i < r.nruns; i++) bitmap.flipRange(r.start(i), r.end(i) + 1);
		return normalize(bitmap);
	}

	// ----- ANDNOT -----
	static Container andNot(Container a, Container b) {
		a = a.heap();
		b = b.heap();
		switch (pair(a, b)) {
			case AA: return andNotArrays((ArrayContainer) a, (ArrayContainer) b);
			case AB:
			case AR: return filter((ArrayContainer) a, b, false);
			case BA:
			case RA: {
				BitmapContainer out = a.toBitmap();
				ArrayContainer ac = (ArrayContainer) b;
				for (int i = 0; i < ac.size; i++) out.remove(ac.values[i]);
				return normalize(out);
			}
			case BB:
			case RB: {
				long[] x = a.type() == BITMAP ? ((BitmapContainer) a).words : a.toBitmap().words;
				long[] y = ((BitmapContainer) b).words;
				long[] out = new long[BITMAP_WORDS];
				int card = 0;
				for (int i = 0; i < BITMAP_WORDS; i++) {
					out[i] = x[i] & ~y[i];
					card += Long.bitCount(out[i]);
				}
				return normalize(new BitmapContainer(out, card));
			}
			case BR:
			case RR: {
				BitmapContainer out = a.toBitmap();
				RunContainer r = (RunContainer) b;
				for (int i = 0; i < r.nruns; i++) out.clearRange(r.start(i), r.end(i) + 1);
				return normalize(out);
			}
			default: throw new IllegalStateException(ErrorCode.INTERNAL_ERROR.getMessage() + " - container pair " + pair(a, b));
		}
	}

	private static ArrayContainer andNotArrays(ArrayContainer a, ArrayContainer b) {
		ArrayContainer out = new ArrayContainer(a.size);
		int i = 0, j = 0, k = 0;
		while (i < a.size && j < b.size) {
			int x = a.values[i] & 0xFFFF;
			int y = b.values[j] & 0xFFFF;
			if (x == y) { i++; j++; }
			else if (x < y) out.values[k++] = a.values[i++];
			else j++;
		}
		while (i < a.size) out.values[k++] = a.values[i++];
		out.size = k;
		return out;
	}

	// ----- Cardinality-only -----
	static int andCardinality(Container a, Container b) {
		a = a.heap();
		b = b.heap();
		switch (pair(a, b)) {
			case AA: {
				ArrayContainer x = (ArrayContainer) a, y = (ArrayContainer) b;
				int i = 0, j = 0, count = 0;
				while (i < x.size && j < y.size) {
					int u = x.values[i] & 0xFFFF;
					int v = y.values[j] & 0xFFFF;
					if (u == v) { count++; i++; j++; }
					else if (u < v) i++;
					else j++;
				}
				return count;
			}
			case AB:
			case AR: return countContained((ArrayContainer) a, b);
			case BA:
			case RA: return countContained((ArrayContainer) b, a);
			case BB: {
				long[] x = ((BitmapContainer) a).words, y = ((BitmapContainer) b).words;
				int count = 0;
				for (int i = 0; i < BITMAP_WORDS; i++) count += Long.bitCount(x[i] & y[i]);
				return count;
			}
			case BR: return countInRuns((BitmapContainer) a, (RunContainer) b);
			case RB: return countInRuns((BitmapContainer) b, (RunContainer) a);
			case RR: return intersectRuns((RunContainer) a, (RunContainer) b).cardinality();
			default: throw new IllegalStateException(ErrorCode.INTERNAL_ERROR.getMessage() + " - container pair " + pair(a, b));
		}
	}

	private static int countContained(ArrayContainer a, Container other) {
		int count = 0;
		for (int i = 0; i < a.size; i++) if (other.contains(a.values[i])) count++;
		return count;
	}

	private static int countInRuns(BitmapContainer b, RunContainer r) {
		int count = 0;
		for (int i = 0; i < r.nruns; i++) count += b.cardinalityInWords(r.start(i), r.end(i) + 1);
		return count;
	}

	static boolean intersects(Container a, Container b) {
		a = a.heap();
		b = b.heap();
		switch (pair(a, b)) {
			case AA: {
				ArrayContainer x = (ArrayContainer) a, y = (ArrayContainer) b;
				int i = 0, j = 0;
				while (i < x.size && j < y.size) {
					int u = x.values[i] & 0xFFFF;
					int v = y.values[j] & 0xFFFF;
					if (u == v) return true;
					if (u < v) i++;
					else j++;
				}
				return false;
			}
			case AB:
			case AR: return anyContained((ArrayContainer) a, b);
			case BA:
			case RA: return anyContained((ArrayContainer) b, a);
			case BB: {
				long[] x = ((BitmapContainer) a).words, y = ((BitmapContainer) b).words;
				for (int i = 0; i < BITMAP_WORDS; i++) if ((x[i] & y[i]) != 0) return true;
				return false;
			}
			default: return andCardinality(a, b) > 0;
		}
	}

	private static boolean anyContained(ArrayContainer a, Container other) {
		for (int i = 0; i < a.size; i++) if (other.contains(a.values[i])) return true;
		return false;
	}

	/** same members, whatever the representation */
	static boolean sameMembership(Container a, Container b) {
		int card = a.cardinality();
		if (card != b.cardinality()) return false;
		return andCardinality(a, b) == card;
	}

	// ----- Many-way union -----
	/** union of containers[0, n) sharing one key; one bitmap accumulator, cardinality counted once */
	static Container lazyOr(Container[] containers, int n) {
		if (n == 1) return containers[0].copy();
		int arrayTotal = 0;
		boolean allArrays = true;
		for (int i = 0; i < n; i++) {
			Container c = containers[i];
			if (c.type() != ARRAY) allArrays = false;
			else arrayTotal += c.cardinality();
			if (c.type() == RUN && c.cardinality() == Container.CHUNK_SIZE) return BitmapContainer.full();
		}
		if (allArrays && arrayTotal <= MAX_ARRAY_SIZE) {
			Container acc = containers[0].copy();
			for (int i = 1; i < n; i++) acc = or(acc, containers[i]);
			return acc;
		}
		long[] words = new long[BITMAP_WORDS];
		for (int i = 0; i < n; i++) containers[i].orInto(words);
		return normalize(new BitmapContainer(words, popcount(words)));
	}

	static int popcount(long[] words) {
		int sum = 0;
		for (long w : words) sum += Long.bitCount(w);
		return sum;
	}
}
