/**
 * FrozenContainer.java
 */
package flint.roaring;

import java.nio.LongBuffer;
import java.nio.ShortBuffer;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Read-only containers whose payload aliases a caller-owned buffer.
 * Queries read the buffer directly; algebra works on {@link #heap()} copies.
 */
abstract class FrozenContainer extends Container {

	@Override final boolean isFrozen() {
		return true;
	}

	@Override final Container heap() {
		return copy();
	}

	@Override final boolean add(short low) {
		throw immutable();
	}

	@Override final boolean remove(short low) {
		throw immutable();
	}

	@Override final Container addRange(int start, int end) {
		throw immutable();
	}

	@Override final Container removeRange(int start, int end) {
		throw immutable();
	}

	@Override final BitmapContainer toBitmap() {
		BitmapContainer bc = new BitmapContainer();
		orInto(bc.words);
		bc.cardinality = cardinality();
		return bc;
	}

	static UnsupportedOperationException immutable() {
		return new UnsupportedOperationException(ErrorCode.IMMUTABLE_VIEW.getMessage());
	}

	/** Sorted u16 values. */
	static final class Array extends FrozenContainer {
		private final ShortBuffer values;
		private final int size;

		Array(ShortBuffer values, int size) {
			this.values = values;
			this.size = size;
		}

		@Override byte type() { return ARRAY; }

		@Override int cardinality() { return size; }

		private int value(int i) {
			return values.get(i) & 0xFFFF;
		}

		private int search(int low) {
			int lo = 0, hi = size - 1;
			while (lo <= hi) {
				int mid = (lo + hi) >>> 1;
				int v = value(mid);
				if (v < low) lo = mid + 1;
				else if (v > low) hi = mid - 1;
				else return mid;
			}
			return -(lo + 1);
		}

		@Override boolean contains(short low) {
			return search(low & 0xFFFF) >= 0;
		}

		@Override int rank(short low) {
			int idx = search(low & 0xFFFF);
			return idx >= 0 ? idx + 1 : -idx - 1;
		}

		@Override short select(int idx) {
			if (idx < 0 || idx >= size) throw new IndexOutOfBoundsException("idx=" + idx);
			return values.get(idx);
		}

		@Override int first() { return value(0); }

		@Override int last() { return value(size - 1); }

		@Override int numberOfRuns() {
			int runs = size == 0 ? 0 : 1;
			for (int i = 1; i < size; i++) if (value(i) != value(i - 1) + 1) runs++;
			return runs;
		}

		@Override void orInto(long[] words) {
			for (int i = 0; i < size; i++) {
				int v = value(i);
				words[v >>> 6] |= 1L << v;
			}
		}

		@Override ArrayContainer copy() {
			short[] out = new short[Math.max(size, 4)];
			values.get(0, out, 0, size);
			return new ArrayContainer(out, size);
		}

		@Override PrimitiveIterator.OfInt intIterator(final int key) {
			return new PrimitiveIterator.OfInt() {
				int idx = 0;
				@Override public boolean hasNext() { return idx < size; }
				@Override public int nextInt() {
					if (!hasNext()) throw new NoSuchElementException();
					return toInt(key, value(idx++));
				}
			};
		}

		@Override int sizeInBytes() { return 2 * size; }

		@Override void writePayload(LittleEndianBuffer out) {
			for (int i = 0; i < size; i++) out.putShort(values.get(i));
		}
	}

	/** 1024 u64 words. */
	static final class Bitmap extends FrozenContainer {
		private final LongBuffer words;
		private final int cardinality;

		Bitmap(LongBuffer words, int cardinality) {
			this.words = words;
			this.cardinality = cardinality;
		}

		@Override byte type() { return BITMAP; }

		@Override int cardinality() { return cardinality; }

		@Override boolean contains(short low) {
			int v = low & 0xFFFF;
			return (words.get(v >>> 6) & (1L << v)) != 0;
		}

		@Override int rank(short low) {
			int v = low & 0xFFFF;
			int wi = v >>> 6;
			int sum = 0;
			for (int i = 0; i < wi; i++) sum += Long.bitCount(words.get(i));
			return sum + Long.bitCount(words.get(wi) & (~0L >>> (63 - (v & 63))));
		}

		@Override short select(int idx) {
			if (idx < 0 || idx >= cardinality) throw new IndexOutOfBoundsException("idx=" + idx);
			int acc = 0;
			for (int word = 0; word < BITMAP_WORDS; word++) {
				long w = words.get(word);
				int pc = Long.bitCount(w);
				if (idx < acc + pc) return (short) ((word << 6) + BitmapContainer.selectInWord(w, idx - acc));
				acc += pc;
			}
			throw new IndexOutOfBoundsException("idx=" + idx);
		}

		@Override int first() {
			for (int i = 0; i < BITMAP_WORDS; i++) {
				long w = words.get(i);
				if (w != 0) return (i << 6) + Long.numberOfTrailingZeros(w);
			}
			throw new NoSuchElementException();
		}

		@Override int last() {
			for (int i = BITMAP_WORDS - 1; i >= 0; i--) {
				long w = words.get(i);
				if (w != 0) return (i << 6) + 63 - Long.numberOfLeadingZeros(w);
			}
			throw new NoSuchElementException();
		}

		@Override int numberOfRuns() {
			long[] tmp = new long[BITMAP_WORDS];
			words.get(0, tmp);
			return BitmapContainer.numberOfRuns(tmp);
		}

		@Override void orInto(long[] target) {
			for (int i = 0; i < BITMAP_WORDS; i++) target[i] |= words.get(i);
		}

		@Override BitmapContainer copy() {
			long[] out = new long[BITMAP_WORDS];
			words.get(0, out);
			return new BitmapContainer(out, cardinality);
		}

		@Override PrimitiveIterator.OfInt intIterator(final int key) {
			return new PrimitiveIterator.OfInt() {
				int word = 0;
				long w = words.get(0);
				@Override public boolean hasNext() {
					while (w == 0L && word < BITMAP_WORDS - 1) w = words.get(++word);
					return w != 0L;
				}
				@Override public int nextInt() {
					if (!hasNext()) throw new NoSuchElementException();
					int bit = Long.numberOfTrailingZeros(w);
					w &= w - 1;
					return toInt(key, (word << 6) + bit);
				}
			};
		}

		@Override int sizeInBytes() { return BITMAP_BYTES; }

		@Override void writePayload(LittleEndianBuffer out) {
			for (int i = 0; i < BITMAP_WORDS; i++) out.putLong(words.get(i));
		}
	}

	/** Interleaved (start, length - 1) u16 pairs. */
	static final class Run extends FrozenContainer {
		private final ShortBuffer runs;
		private final int nruns;

		Run(ShortBuffer runs, int nruns) {
			this.runs = runs;
			this.nruns = nruns;
		}

		private int start(int i) { return runs.get(2 * i) & 0xFFFF; }

		private int end(int i) { return start(i) + (runs.get(2 * i + 1) & 0xFFFF); }

		@Override byte type() { return RUN; }

		@Override int cardinality() {
			int sum = 0;
			for (int i = 0; i < nruns; i++) sum += (runs.get(2 * i + 1) & 0xFFFF) + 1;
			return sum;
		}

		@Override boolean contains(short low) {
			int v = low & 0xFFFF;
			int lo = 0, hi = nruns - 1, idx = -1;
			while (lo <= hi) {
				int mid = (lo + hi) >>> 1;
				if (start(mid) <= v) {
					idx = mid;
					lo = mid + 1;
				} else {
					hi = mid - 1;
				}
			}
			return idx >= 0 && v <= end(idx);
		}

		@Override int rank(short low) {
			int v = low & 0xFFFF;
			int sum = 0;
			for (int i = 0; i < nruns; i++) {
				int s = start(i);
				if (v < s) break;
				int e = end(i);
				if (v <= e) return sum + (v - s) + 1;
				sum += e - s + 1;
			}
			return sum;
		}

		@Override short select(int idx) {
			if (idx < 0) throw new IndexOutOfBoundsException("idx=" + idx);
			int remaining = idx;
			for (int i = 0; i < nruns; i++) {
				int len = end(i) - start(i) + 1;
				if (remaining < len) return (short) (start(i) + remaining);
				remaining -= len;
			}
			throw new IndexOutOfBoundsException("idx=" + idx);
		}

		@Override int first() { return start(0); }

		@Override int last() { return end(nruns - 1); }

		@Override int numberOfRuns() { return nruns; }

		@Override void orInto(long[] words) {
			for (int i = 0; i < nruns; i++) BitmapContainer.applyRange(words, start(i), end(i) + 1, BitmapContainer.Op.SET);
		}

		@Override RunContainer copy() {
			short[] out = new short[Math.max(2 * nruns, 2)];
			runs.get(0, out, 0, 2 * nruns);
			return new RunContainer(out, nruns);
		}

		@Override PrimitiveIterator.OfInt intIterator(final int key) {
			return new PrimitiveIterator.OfInt() {
				int run = 0;
				int next = nruns > 0 ? start(0) : 0;
				@Override public boolean hasNext() { return run < nruns; }
				@Override public int nextInt() {
					if (!hasNext()) throw new NoSuchElementException();
					int v = next;
					if (v == end(run)) {
						run++;
						if (run < nruns) next = start(run);
					} else {
						next++;
					}
					return toInt(key, v);
				}
			};
		}

		@Override int sizeInBytes() { return 2 + 4 * nruns; }

		@Override void writePayload(LittleEndianBuffer out) {
			out.putShort(nruns);
			writeFrozenPayload(out);
		}

		@Override int frozenSizeInBytes() { return 4 * nruns; }

		@Override void writeFrozenPayload(LittleEndianBuffer out) {
			for (int i = 0; i < 2 * nruns; i++) out.putShort(runs.get(i));
		}

		@Override int frozenCount() { return nruns; }
	}
}
