/**
 * Container.java
 */
package flint.roaring;

import java.util.PrimitiveIterator;

/**
 * Container represents all 16-bit values for a specific high key.
 *
 * Notes
 * - Three heap variants (array, bitmap, run) plus read-only frozen views over a caller buffer.
 * - The variant is a type tag; pairwise algorithms switch on the tag pair in
 *   {@link ContainerAlgebra} instead of dispatching through virtual calls.
 * - Low values are carried as {@code short} and compared unsigned.
 */
abstract class Container {
	// type tags, same numbering as the frozen layout's type codes
	static final byte BITMAP = 1;
	static final byte ARRAY = 2;
	static final byte RUN = 3;

	static final int KEY_BITS = 16;
	static final int LOW_MASK = (1 << KEY_BITS) - 1;
	static final int CHUNK_SIZE = 1 << KEY_BITS;
	/** largest array container; one more value converts to a bitmap */
	static final int MAX_ARRAY_SIZE = 4096;
	static final int BITMAP_WORDS = CHUNK_SIZE / 64;
	static final int BITMAP_BYTES = BITMAP_WORDS * 8;

	abstract byte type();

	abstract int cardinality();

	boolean isEmpty() {
		return cardinality() == 0;
	}

	abstract boolean contains(short low);

	/** number of elements in this container less than or equal to low */
	abstract int rank(short low);

	/** returns the value (low 16 bits) at given 0-based index inside this container */
	abstract short select(int idx);

	/** smallest low value, unsigned */
	abstract int first();

	/** largest low value, unsigned */
	abstract int last();

	abstract int numberOfRuns();

	abstract PrimitiveIterator.OfInt intIterator(int key);

	/** sets the bits of every member in a 1024-word bitmap, used by lazy unions */
	abstract void orInto(long[] words);

	/** a new heap bitmap container with the same members */
	abstract BitmapContainer toBitmap();

	/** deep, mutable heap copy */
	abstract Container copy();

	/** this container if it lives on the heap, otherwise a heap copy */
	Container heap() {
		return this;
	}

	boolean isFrozen() {
		return false;
	}

	// ----- Mutation (heap variants only) -----
	abstract boolean add(short low); // returns true if newly added

	abstract boolean remove(short low); // returns true if removed

	/** representation to keep after single-value adds; array grows into bitmap past MAX_ARRAY_SIZE */
	Container repairAfterAdd() {
		return this;
	}

	/** adds [start, end) (unsigned lows, end up to 65536), returns the container to keep */
	abstract Container addRange(int start, int end);

	/** removes [start, end), returns the container to keep (possibly empty) */
	abstract Container removeRange(int start, int end);

	// ----- Serialization -----
	/** portable payload size in bytes */
	abstract int sizeInBytes();

	/** writes the portable payload */
	abstract void writePayload(LittleEndianBuffer out);

	/** frozen payload size in bytes */
	int frozenSizeInBytes() {
		return sizeInBytes();
	}

	/** writes the frozen payload */
	void writeFrozenPayload(LittleEndianBuffer out) {
		writePayload(out);
	}

	/** value stored in the frozen count table */
	int frozenCount() {
		return cardinality() - 1;
	}

	String typeName() {
		switch (type()) {
			case BITMAP:
				return "bitmap";
			case ARRAY:
				return "array";
			default:
				return "run";
		}
	}

	@Override
	public String toString() {
		return typeName() + "(cardinality=" + cardinality() + ")";
	}

	// ----- Value helpers -----
	/** Upper 16 bits (key) of a 32-bit integer. */
	static int high(int x) {
		return x >>> KEY_BITS;
	}

	/** Lower 16 bits (value) of a 32-bit integer. */
	static short low(int x) {
		return (short) (x & LOW_MASK);
	}

	static int toInt(int key, int low) {
		return (key << KEY_BITS) | (low & LOW_MASK);
	}

	static int lowerBound(short[] values, int size, int low) {
		int lo = 0, hi = size;
		while (lo < hi) {
			int mid = (lo + hi) >>> 1;
			if ((values[mid] & 0xFFFF) < low) lo = mid + 1;
			else hi = mid;
		}
		return lo;
	}

	/** unsigned binary search over values[0, size), same contract as Arrays.binarySearch */
	static int unsignedSearch(short[] values, int size, int low) {
		int lo = 0, hi = size - 1;
		while (lo <= hi) {
			int mid = (lo + hi) >>> 1;
			int v = values[mid] & 0xFFFF;
			if (v < low) lo = mid + 1;
			else if (v > low) hi = mid - 1;
			else return mid;
		}
		return -(lo + 1);
	}
}
