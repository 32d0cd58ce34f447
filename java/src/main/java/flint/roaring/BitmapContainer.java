/**
 * BitmapContainer.java
 */
package flint.roaring;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/** 65,536-bit container used when density is high (dense). */
final class BitmapContainer extends Container {
	// 2^16 bits -> 1024 longs
	long[] words;
	int cardinality;

	BitmapContainer() {
		this.words = new long[BITMAP_WORDS];
	}

	/** takes ownership of words, which must hold exactly cardinality set bits */
	BitmapContainer(long[] words, int cardinality) {
		this.words = words;
		this.cardinality = cardinality;
	}

	static BitmapContainer full() {
		BitmapContainer bc = new BitmapContainer();
		Arrays.fill(bc.words, ~0L);
		bc.cardinality = CHUNK_SIZE;
		return bc;
	}

	@Override byte type() { return BITMAP; }

	@Override int cardinality() { return cardinality; }

	@Override boolean contains(short low) {
		int v = low & 0xFFFF;
		return (words[v >>> 6] & (1L << v)) != 0;
	}

	@Override boolean add(short low) {
		int v = low & 0xFFFF;
		int w = v >>> 6;
		long mask = 1L << v;
		long before = words[w];
		if ((before & mask) != 0) return false;
		words[w] = before | mask;
		cardinality++;
		return true;
	}

	@Override boolean remove(short low) {
		int v = low & 0xFFFF;
		int w = v >>> 6;
		long mask = 1L << v;
		long before = words[w];
		if ((before & mask) == 0) return false;
		words[w] = before & ~mask;
		cardinality--;
		return true;
	}

	@Override Container addRange(int start, int end) {
		setRange(start, end);
		return this;
	}

	@Override Container removeRange(int start, int end) {
		clearRange(start, end);
		return ContainerAlgebra.normalize(this);
	}

	// ----- Word-range operations, [start, end) -----
	void setRange(int start, int end) {
		if (start >= end) return;
		int before = cardinalityInWords(start, end);
		applyRange(words, start, end, Op.SET);
		cardinality += (end - start) - before;
	}

	void clearRange(int start, int end) {
		if (start >= end) return;
		cardinality -= cardinalityInWords(start, end);
		applyRange(words, start, end, Op.CLEAR);
	}

	void flipRange(int start, int end) {
		if (start >= end) return;
		int before = cardinalityInWords(start, end);
		applyRange(words, start, end, Op.FLIP);
		cardinality += (end - start) - 2 * before;
	}

	/** members in [start, end) */
	int cardinalityInWords(int start, int end) {
		if (start >= end) return 0;
		int first = start >>> 6;
		int last = (end - 1) >>> 6;
		long firstMask = ~0L << start;
		long lastMask = ~0L >>> -end;
		if (first == last) return Long.bitCount(words[first] & firstMask & lastMask);
		int sum = Long.bitCount(words[first] & firstMask);
		for (int i = first + 1; i < last; i++) sum += Long.bitCount(words[i]);
		return sum + Long.bitCount(words[last] & lastMask);
	}

	enum Op { SET, CLEAR, FLIP }

	static void applyRange(long[] words, int start, int end, Op op) {
		int first = start >>> 6;
		int last = (end - 1) >>> 6;
		long firstMask = ~0L << start;
		long lastMask = ~0L >>> -end;
		for (int i = first; i <= last; i++) {
			long mask = ~0L;
			if (i == first) mask &= firstMask;
			if (i == last) mask &= lastMask;
			switch (op) {
				case SET: words[i] |= mask; break;
				case CLEAR: words[i] &= ~mask; break;
				default: words[i] ^= mask; break;
			}
		}
	}

	@Override int rank(short low) {
		int v = low & 0xFFFF;
		int wi = v >>> 6;
		int sum = 0;
		for (int i = 0; i < wi; i++) sum += Long.bitCount(words[i]);
		long mask = ~0L >>> (63 - (v & 63)); // include bit position
		return sum + Long.bitCount(words[wi] & mask);
	}

	@Override short select(int idx) {
		if (idx < 0 || idx >= cardinality) throw new IndexOutOfBoundsException("idx=" + idx);
		int acc = 0;
		for (int word = 0; word < BITMAP_WORDS; word++) {
			int pc = Long.bitCount(words[word]);
			if (idx < acc + pc) return (short) ((word << 6) + selectInWord(words[word], idx - acc));
			acc += pc;
		}
		throw new IndexOutOfBoundsException("idx=" + idx);
	}

	/** position of the within-th set bit of w */
	static int selectInWord(long w, int within) {
		for (int count = 0; count < within; count++) w &= w - 1;
		return Long.numberOfTrailingZeros(w);
	}

	@Override int first() {
		for (int i = 0; i < BITMAP_WORDS; i++) {
			if (words[i] != 0) return (i << 6) + Long.numberOfTrailingZeros(words[i]);
		}
		throw new NoSuchElementException();
	}

	@Override int last() {
		for (int i = BITMAP_WORDS - 1; i >= 0; i--) {
			if (words[i] != 0) return (i << 6) + 63 - Long.numberOfLeadingZeros(words[i]);
		}
		throw new NoSuchElementException();
	}

	@Override int numberOfRuns() {
		return numberOfRuns(words);
	}

	static int numberOfRuns(long[] words) {
		int runs = 0;
		long next = words[0];
		for (int i = 0; i < BITMAP_WORDS - 1; i++) {
			long w = next;
			next = words[i + 1];
			// run starts inside w, plus one when w ends a run that does not continue into the next word
			runs += Long.bitCount(~w & (w << 1)) + (int) ((w >>> 63) & ~next);
		}
		runs += Long.bitCount(~next & (next << 1));
		if ((next & 0x8000000000000000L) != 0) runs++;
		return runs;
	}

	@Override void orInto(long[] target) {
		for (int i = 0; i < BITMAP_WORDS; i++) target[i] |= words[i];
	}

	@Override BitmapContainer toBitmap() {
		return copy();
	}

	ArrayContainer toArray() {
		ArrayContainer ac = new ArrayContainer(cardinality);
		int k = 0;
		for (int word = 0; word < BITMAP_WORDS; word++) {
			long w = words[word];
			while (w != 0) {
				ac.values[k++] = (short) ((word << 6) + Long.numberOfTrailingZeros(w));
				w &= w - 1; // clear lowest set bit
			}
		}
		ac.size = k;
		return ac;
	}

	RunContainer toRun() {
		int n = numberOfRuns();
		short[] runs = new short[2 * n];
		int r = 0;
		int word = 0;
		long w = words[0];
		while (r < n) {
			while (w == 0) w = words[++word];
			int start = (word << 6) + Long.numberOfTrailingZeros(w);
			// fill the bits below the run start so the next zero is the run end
			w |= w - 1;
			while (w == ~0L && word < BITMAP_WORDS - 1) w = words[++word];
			int end;
			if (w == ~0L) {
				end = CHUNK_SIZE;
				w = 0;
			} else {
				end = (word << 6) + Long.numberOfTrailingZeros(~w);
				w &= w + 1; // clear the run
			}
			runs[2 * r] = (short) start;
			runs[2 * r + 1] = (short) (end - start - 1);
			r++;
		}
		return new RunContainer(runs, n);
	}

	@Override BitmapContainer copy() {
		return new BitmapContainer(Arrays.copyOf(words, BITMAP_WORDS), cardinality);
	}

	@Override PrimitiveIterator.OfInt intIterator(final int key) {
		return new PrimitiveIterator.OfInt() {
			int word = 0;
			long w = words[0];
			@Override public boolean hasNext() {
				while (w == 0L && word < BITMAP_WORDS - 1) w = words[++word];
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

	@Override int sizeInBytes() {
		return BITMAP_BYTES;
	}

	@Override void writePayload(LittleEndianBuffer out) {
		for (int i = 0; i < BITMAP_WORDS; i++) out.putLong(words[i]);
	}
}
