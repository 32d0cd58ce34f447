/**
 * RunContainer.java
 */
package flint.roaring;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Run-length container: sorted, non-overlapping (start, length - 1) pairs.
 * <pre>
 * runs[2i]     = start of run i
 * runs[2i + 1] = number of values in run i, minus one
 * </pre>
 * Only produced by runOptimize or by algebra on run operands.
 */
final class RunContainer extends Container {
	short[] runs;
	int nruns;

	RunContainer() {
		this(new short[8], 0);
	}

	/** takes ownership of runs[0, 2 * nruns) */
	RunContainer(short[] runs, int nruns) {
		this.runs = runs;
		this.nruns = nruns;
	}

	/** single run covering [start, end), end - start in [1, 65536] */
	static RunContainer ofRange(int start, int end) {
		return new RunContainer(new short[] { (short) start, (short) (end - start - 1) }, 1);
	}

	int start(int i) { return runs[2 * i] & 0xFFFF; }

	int length(int i) { return runs[2 * i + 1] & 0xFFFF; }

	/** inclusive end of run i */
	int end(int i) { return start(i) + length(i); }

	@Override byte type() { return RUN; }

	@Override int cardinality() {
		int sum = 0;
		for (int i = 0; i < nruns; i++) sum += length(i) + 1;
		return sum;
	}

	/** index of the last run starting at or before low, -1 if none */
	private int floorRun(int low) {
		int lo = 0, hi = nruns - 1, ans = -1;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			if (start(mid) <= low) {
				ans = mid;
				lo = mid + 1;
			} else {
				hi = mid - 1;
			}
		}
		return ans;
	}

	@Override boolean contains(short low) {
		int v = low & 0xFFFF;
		int i = floorRun(v);
		return i >= 0 && v <= end(i);
	}

	@Override boolean add(short low) {
		int v = low & 0xFFFF;
		int i = floorRun(v);
		if (i >= 0 && v <= end(i)) return false;
		boolean joinsPrev = i >= 0 && end(i) + 1 == v;
		boolean joinsNext = i + 1 < nruns && start(i + 1) == v + 1;
		if (joinsPrev && joinsNext) {
			runs[2 * i + 1] = (short) (end(i + 1) - start(i));
			removeRunAt(i + 1);
		} else if (joinsPrev) {
			runs[2 * i + 1]++;
		} else if (joinsNext) {
			runs[2 * (i + 1)] = (short) v;
			runs[2 * (i + 1) + 1]++;
		} else {
			insertRunAt(i + 1, v, 0);
		}
		return true;
	}

	@Override boolean remove(short low) {
		int v = low & 0xFFFF;
		int i = floorRun(v);
		if (i < 0 || v > end(i)) return false;
		int s = start(i), e = end(i);
		if (s == e) {
			removeRunAt(i);
		} else if (v == s) {
			runs[2 * i] = (short) (s + 1);
			runs[2 * i + 1]--;
		} else if (v == e) {
			runs[2 * i + 1]--;
		} else {
			runs[2 * i + 1] = (short) (v - 1 - s);
			insertRunAt(i + 1, v + 1, e - v - 1);
		}
		return true;
	}

	@Override Container addRange(int start, int end) {
		if (start >= end) return this;
		// runs strictly before the range and not adjacent, then the merged run, then the rest
		int first = 0;
		while (first < nruns && end(first) + 1 < start) first++;
		int last = first;
		int s = start, e = end - 1;
		while (last < nruns && start(last) <= e + 1) {
			s = Math.min(s, start(last));
			e = Math.max(e, end(last));
			last++;
		}
		short[] out = new short[2 * (nruns - (last - first) + 1)];
		System.arraycopy(runs, 0, out, 0, 2 * first);
		out[2 * first] = (short) s;
		out[2 * first + 1] = (short) (e - s);
		System.arraycopy(runs, 2 * last, out, 2 * first + 2, 2 * (nruns - last));
		runs = out;
		nruns = out.length / 2;
		return this;
	}

	@Override Container removeRange(int start, int end) {
		if (start >= end) return this;
		short[] out = new short[2 * (nruns + 1)];
		int n = 0;
		for (int i = 0; i < nruns; i++) {
			int s = start(i), e = end(i);
			if (e < start || s >= end) {
				out[2 * n] = (short) s;
				out[2 * n + 1] = (short) (e - s);
				n++;
				continue;
			}
			if (s < start) {
				out[2 * n] = (short) s;
				out[2 * n + 1] = (short) (start - 1 - s);
				n++;
			}
			if (e >= end) {
				out[2 * n] = (short) end;
				out[2 * n + 1] = (short) (e - end);
				n++;
			}
		}
		runs = out;
		nruns = n;
		return this;
	}

	private void insertRunAt(int i, int start, int lengthMinusOne) {
		if (2 * (nruns + 1) > runs.length) runs = Arrays.copyOf(runs, Math.max(8, runs.length * 2));
		System.arraycopy(runs, 2 * i, runs, 2 * i + 2, 2 * (nruns - i));
		runs[2 * i] = (short) start;
		runs[2 * i + 1] = (short) lengthMinusOne;
		nruns++;
	}

	private void removeRunAt(int i) {
		System.arraycopy(runs, 2 * i + 2, runs, 2 * i, 2 * (nruns - i - 1));
		nruns--;
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
			int len = length(i) + 1;
			if (remaining < len) return (short) (start(i) + remaining);
			remaining -= len;
		}
		throw new IndexOutOfBoundsException("idx=" + idx);
	}

	@Override int first() {
		if (nruns == 0) throw new NoSuchElementException();
		return start(0);
	}

	@Override int last() {
		if (nruns == 0) throw new NoSuchElementException();
		return end(nruns - 1);
	}

	@Override int numberOfRuns() {
		return nruns;
	}

	boolean isFull() {
		return nruns == 1 && start(0) == 0 && length(0) == LOW_MASK;
	}

	@Override void orInto(long[] words) {
		for (int i = 0; i < nruns; i++) BitmapContainer.applyRange(words, start(i), end(i) + 1, BitmapContainer.Op.SET);
	}

	@Override BitmapContainer toBitmap() {
		BitmapContainer bc = new BitmapContainer();
		orInto(bc.words);
		bc.cardinality = cardinality();
		return bc;
	}

	ArrayContainer toArray() {
		ArrayContainer ac = new ArrayContainer(cardinality());
		int k = 0;
		for (int i = 0; i < nruns; i++) {
			for (int v = start(i), e = end(i); v <= e; v++) ac.values[k++] = (short) v;
		}
		ac.size = k;
		return ac;
	}

	@Override RunContainer copy() {
		return new RunContainer(Arrays.copyOf(runs, Math.max(2 * nruns, 2)), nruns);
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

	@Override int sizeInBytes() {
		return 2 + 4 * nruns;
	}

	@Override void writePayload(LittleEndianBuffer out) {
		out.putShort(nruns);
		writeFrozenPayload(out);
	}

	@Override int frozenSizeInBytes() {
		return 4 * nruns;
	}

	@Override void writeFrozenPayload(LittleEndianBuffer out) {
		for (int i = 0; i < 2 * nruns; i++) out.putShort(runs[i]);
	}

	@Override int frozenCount() {
		return nruns;
	}
}
