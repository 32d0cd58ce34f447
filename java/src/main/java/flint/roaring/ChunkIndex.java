/**
 * ChunkIndex.java
 */
package flint.roaring;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Ordered mapping from 16-bit high key to its container.
 * <pre>
 * keys[i] < keys[i + 1]            strictly ascending
 * containers[i].cardinality() > 0  after every public operation
 * </pre>
 */
final class ChunkIndex implements Iterable<ChunkIndex.Chunk> {
	private static final int INITIAL_CAPACITY = 4;

	char[] keys;
	Container[] containers;
	int size;

	ChunkIndex() {
		this(INITIAL_CAPACITY);
	}

	ChunkIndex(int capacity) {
		int n = Math.max(capacity, INITIAL_CAPACITY);
		this.keys = new char[n];
		this.containers = new Container[n];
	}

	/** one (key, container) pair, key as an unsigned int */
	static final class Chunk {
		final int key;
		final Container container;

		Chunk(int key, Container container) {
			this.key = key;
			this.container = container;
		}

		int key() {
			return key;
		}

		Container container() {
			return container;
		}
	}

	int size() {
		return size;
	}

	boolean isEmpty() {
		return size == 0;
	}

	int keyAt(int i) {
		return keys[i];
	}

	Container containerAt(int i) {
		return containers[i];
	}

	/** index of key, or -(insertion point) - 1 */
	int indexOf(int key) {
		int lo = 0, hi = size - 1;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			int k = keys[mid];
			if (k < key) lo = mid + 1;
			else if (k > key) hi = mid - 1;
			else return mid;
		}
		return -(lo + 1);
	}

	Container get(int key) {
		int i = indexOf(key);
		return i >= 0 ? containers[i] : null;
	}

	/** container for key, inserting an empty array container when absent */
	Container insertOrGet(int key) {
		int i = indexOf(key);
		if (i >= 0) return containers[i];
		Container c = new ArrayContainer();
		insertAt(-i - 1, key, c);
		return c;
	}

	void set(int i, Container c) {
		containers[i] = c;
	}

	void insertAt(int i, int key, Container c) {
		ensureCapacity(size + 1);
		if (i < size) {
			System.arraycopy(keys, i, keys, i + 1, size - i);
			System.arraycopy(containers, i, containers, i + 1, size - i);
		}
		keys[i] = (char) key;
		containers[i] = c;
		size++;
	}

	void removeAt(int i) {
		if (i < size - 1) {
			System.arraycopy(keys, i + 1, keys, i, size - i - 1);
			System.arraycopy(containers, i + 1, containers, i, size - i - 1);
		}
		size--;
		containers[size] = null;
	}

	/** drops the container of key when it holds no value, returns true if dropped */
	boolean removeIfEmpty(int key) {
		int i = indexOf(key);
		if (i < 0 || !containers[i].isEmpty()) return false;
		removeAt(i);
		return true;
	}

	/** stores c at slot i, or drops the slot when c is empty */
	void setOrRemove(int i, Container c) {
		if (c.isEmpty()) removeAt(i);
		else containers[i] = c;
	}

	/** appends after the last key, used by merge builders; empty containers are skipped */
	void append(int key, Container c) {
		if (c.isEmpty()) return;
		if (size > 0 && keys[size - 1] >= key) throw new IllegalStateException("append out of order: " + key + " after " + (int) keys[size - 1]);
		ensureCapacity(size + 1);
		keys[size] = (char) key;
		containers[size] = c;
		size++;
	}

	private void ensureCapacity(int cap) {
		if (cap <= keys.length) return;
		int n = Math.max(cap, keys.length * 2);
		keys = Arrays.copyOf(keys, n);
		containers = Arrays.copyOf(containers, n);
	}

	/** deep copy, frozen containers come back as heap containers */
	ChunkIndex copy() {
		ChunkIndex out = new ChunkIndex(size);
		for (int i = 0; i < size; i++) {
			out.keys[i] = keys[i];
			out.containers[i] = containers[i].copy();
		}
		out.size = size;
		return out;
	}

	void clear() {
		Arrays.fill(containers, 0, size, null);
		size = 0;
	}

	long cardinality() {
		long sum = 0;
		for (int i = 0; i < size; i++) sum += containers[i].cardinality();
		return sum;
	}

	@Override
	public Iterator<Chunk> iterator() {
		return new Iterator<Chunk>() {
			int i = 0;

			@Override
			public boolean hasNext() {
				return i < size;
			}

			@Override
			public Chunk next() {
				if (i >= size) throw new NoSuchElementException();
				Chunk chunk = new Chunk(keys[i], containers[i]);
				i++;
				return chunk;
			}
		};
	}
}
