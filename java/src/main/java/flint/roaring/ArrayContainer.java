/**
 * ArrayContainer.java
 */
package flint.roaring;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/** Sorted short[] container used when density is low (sparse). */
final class ArrayContainer extends Container {
	short[] values;
	int size;

	ArrayContainer() {
		this(4);
	}

	ArrayContainer(int capacity) {
		this.values = new short[Math.max(capacity, 4)];
	}

	/** takes ownership of values[0, size), which must be strictly ascending (unsigned) */
	ArrayContainer(short[] values, int size) {
		this.values = values;
		this.size = size;
	}

	/** [start, end) as an array, end - start must not exceed MAX_ARRAY_SIZE */
	static ArrayContainer ofRange(int start, int end) {
		ArrayContainer ac = new ArrayContainer(end - start);
		for (int v = start; v < end; v++) ac.values[ac.size++] = (short) v;
		return ac;
	}

	@Override byte type() { return ARRAY; }

	@Override int cardinality() { return size; }

	@Override boolean contains(short low) {
		return unsignedSearch(values, size, low & 0xFFFF) >= 0;
	}

	@Override boolean add(short low) {
		int idx = unsignedSearch(values, size, low & 0xFFFF);
		if (idx >= 0) return false;
		idx = -idx - 1;
		ensureCapacity(size + 1);
		// shift
		if (idx < size) System.arraycopy(values, idx, values, idx + 1, size - idx);
		values[idx] = low;
		size++;
		return true;
	}

	@Override boolean remove(short low) {
		int idx = unsignedSearch(values, size, low & 0xFFFF);
		if (idx < 0) return false;
		if (idx < size - 1) System.arraycopy(values, idx + 1, values, idx, size - idx - 1);
		size--;
		return true;
	}

	@Override Container repairAfterAdd() {
		return (size > MAX_ARRAY_SIZE) ? toBitmap() : this;
	}

	@Override Container addRange(int start, int end) {
		if (start >= end) return this;
		int i = lowerBound(values, size, start);
		int j = lowerBound(values, size, end);
		int newSize = size - (j - i) + (end - start);
		if (newSize > MAX_ARRAY_SIZE) {
			BitmapContainer bc = toBitmap();
			bc.setRange(start, end);
			return bc;
		}
		short[] out = (newSize <= values.length) ? values : new short[Math.max(newSize, values.length * 2)];
		// tail first, it may overlap the range slots when working in place
		System.arraycopy(values, j, out, i + (end - start), size - j);
		if (out != values) System.arraycopy(values, 0, out, 0, i);
		for (int v = start, k = i; v < end; v++, k++) out[k] = (short) v;
		values = out;
		size = newSize;
		return this;
	}

	@Override Container removeRange(int start, int end) {
		if (start >= end) return this;
		int i = lowerBound(values, size, start);
		int j = lowerBound(values, size, end);
		if (i == j) return this;
		System.arraycopy(values, j, values, i, size - j);
		size -= (j - i);
		return this;
	}

	@Override int rank(short low) {
		int idx = unsignedSearch(values, size, low & 0xFFFF);
		if (idx >= 0) return idx + 1; // count <= low
		return -idx - 1; // first position greater than low
	}

	@Override short select(int idx) {
		if (idx < 0 || idx >= size) throw new IndexOutOfBoundsException("idx=" + idx);
		return values[idx];
	}

	@Override int first() {
		if (size == 0) throw new NoSuchElementException();
		return values[0] & 0xFFFF;
	}

	@Override int last() {
		if (size == 0) throw new NoSuchElementException();
		return values[size - 1] & 0xFFFF;
	}

	@Override int numberOfRuns() {
		if (size == 0) return 0;
		int runs = 1;
		int prev = values[0] & 0xFFFF;
		for (int i = 1; i < size; i++) {
			int v = values[i] & 0xFFFF;
			if (v != prev + 1) runs++;
			prev = v;
		}
		return runs;
	}

	@Override void orInto(long[] words) {
		for (int i = 0; i < size; i++) {
			int v = values[i] & 0xFFFF;
			words[v >>> 6] |= 1L << v;
		}
	}

	@Override BitmapContainer toBitmap() {
		BitmapContainer bc = new BitmapContainer();
		orInto(bc.words);
		bc.cardinality = size;
		return bc;
	}

	/** run form of this container, exact size */
	RunContainer toRun() {
		int n = numberOfRuns();
		short[] runs = new short[2 * n];
		int r = 0;
		int i = 0;
		while (i < size) {
			int start = values[i] & 0xFFFF;
			int end = start;
			while (i + 1 < size && (values[i + 1] & 0xFFFF) == end + 1) {
				end++;
				i++;
			}
			runs[2 * r] = (short) start;
			runs[2 * r + 1] = (short) (end - start);
			r++;
			i++;
		}
		return new RunContainer(runs, n);
	}

	private void ensureCapacity(int cap) {
		if (cap <= values.length) return;
		int n = Math.max(cap, values.length * 2);
		values = Arrays.copyOf(values, n);
	}

	@Override ArrayContainer copy() {
		return new ArrayContainer(Arrays.copyOf(values, Math.max(size, 4)), size);
	}

	@Override PrimitiveIterator.OfInt intIterator(final int key) {
		return new PrimitiveIterator.OfInt() {
			int idx = 0;
			@Override public boolean hasNext() { return idx < size; }
			@Override public int nextInt() {
				if (!hasNext()) throw new NoSuchElementException();
				return toInt(key, values[idx++] & 0xFFFF);
			}
		};
	}

	@Override int sizeInBytes() {
		return 2 * size;
	}

	@Override void writePayload(LittleEndianBuffer out) {
		for (int i = 0; i < size; i++) out.putShort(values[i]);
	}
}
