/**
 * RoaringBitmap.java
 */
package flint.roaring;

import java.nio.ByteBuffer;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.PriorityQueue;
import java.util.function.IntConsumer;

/**
 * Compressed set of unsigned 32-bit integers (Roaring bitmap).
 *
 * <pre>
 * value = key(high 16 bits) | low(16 bits)
 * one container per key:
 *   array  : sorted lows, up to 4096
 *   bitmap : 65536 bits
 *   run    : (start, length - 1) pairs, only after runOptimize
 * </pre>
 *
 * Values are passed and iterated as {@code int} bit patterns; values and counts reported by
 * queries ({@link #minimum()}, {@link #select(long)}, {@link #rank(int)}) are non-negative
 * {@code long}s. Ranges are half-open {@code [lo, hi)} with {@code 0 <= lo, hi <= 2^32}.
 *
 * Not thread-safe for mutation. Read-only calls on a bitmap nobody mutates may run concurrently.
 */
public class RoaringBitmap implements Iterable<Integer>, Cloneable {
	private static final Logger LOG = Logger.of(RoaringBitmap.class.getName());

	/** exclusive upper bound of ranges */
	public static final long MAX_RANGE = 1L << 32;
	/** returned by select when the rank is out of range */
	public static final long NOT_FOUND = ErrorCode.NOT_FOUND.getCode();

	ChunkIndex index;
	// caller-owned backing bytes of a frozen view, never released here
	private ByteBuffer frozenBuffer;

	public RoaringBitmap() {
		this.index = new ChunkIndex();
	}

	RoaringBitmap(ChunkIndex index) {
		this.index = index;
	}

	public static RoaringBitmap of(final int... values) {
		final RoaringBitmap rb = new RoaringBitmap();
		rb.addMany(values);
		return rb;
	}

	// ----- Mutation -----
	private void checkMutable() {
		if (frozenBuffer != null) throw FrozenContainer.immutable();
	}

	private static void checkRange(long lo, long hi) {
		if (lo < 0 || lo > MAX_RANGE || hi < 0 || hi > MAX_RANGE)
			throw new IllegalArgumentException(ErrorCode.INVALID_RANGE.getMessage() + " [" + lo + ", " + hi + ")");
	}

	/**
	 * Adds x (unsigned).
	 *
	 * @return true if x was not present
	 */
	public boolean add(final int x) {
		checkMutable();
		final int key = Container.high(x);
		final Container c = index.insertOrGet(key);
		if (!c.add(Container.low(x))) return false;
		final Container repaired = c.repairAfterAdd();
		if (repaired != c) index.set(index.indexOf(key), repaired);
		return true;
	}

	public void addMany(final int... values) {
		checkMutable();
		int lastKey = -1;
		int slot = -1;
		for (int x : values) {
			final int key = Container.high(x);
			if (key != lastKey) {
				slot = index.indexOf(key);
				if (slot < 0) {
					slot = -slot - 1;
					index.insertAt(slot, key, new ArrayContainer());
				}
				lastKey = key;
			}
			final Container c = index.containerAt(slot);
			if (c.add(Container.low(x))) index.set(slot, c.repairAfterAdd());
		}
	}

	/**
	 * Removes x (unsigned).
	 *
	 * @return true if x was present
	 */
	public boolean remove(final int x) {
		checkMutable();
		final int key = Container.high(x);
		final Container c = index.get(key);
		if (c == null || !c.remove(Container.low(x))) return false;
		index.removeIfEmpty(key);
		return true;
	}

	/** container holding exactly [start, end) of one chunk */
	private static Container rangeContainer(int start, int end) {
		if (end - start == Container.CHUNK_SIZE) return BitmapContainer.full();
		if (end - start > Container.MAX_ARRAY_SIZE) {
			final BitmapContainer bc = new BitmapContainer();
			bc.setRange(start, end);
			return bc;
		}
		return ArrayContainer.ofRange(start, end);
	}

	/**
	 * Adds every value in [lo, hi).
	 */
	public void addRange(final long lo, final long hi) {
		checkRange(lo, hi);
		checkMutable();
		if (hi <= lo) return;
		final int firstKey = (int) (lo >>> Container.KEY_BITS);
		final int lastKey = (int) ((hi - 1) >>> Container.KEY_BITS);
		for (int key = firstKey; key <= lastKey; key++) {
			final int start = key == firstKey ? (int) (lo & Container.LOW_MASK) : 0;
			final int end = key == lastKey ? (int) ((hi - 1) & Container.LOW_MASK) + 1 : Container.CHUNK_SIZE;
			final int i = index.indexOf(key);
			if (i >= 0) index.set(i, index.containerAt(i).addRange(start, end));
			else index.insertAt(-i - 1, key, rangeContainer(start, end));
		}
	}

	/**
	 * Removes every value in [lo, hi).
	 */
	public void removeRange(final long lo, final long hi) {
		checkRange(lo, hi);
		checkMutable();
		if (hi <= lo) return;
		final int firstKey = (int) (lo >>> Container.KEY_BITS);
		final int lastKey = (int) ((hi - 1) >>> Container.KEY_BITS);
		int i = index.indexOf(firstKey);
		if (i < 0) i = -i - 1;
		while (i < index.size() && index.keyAt(i) <= lastKey) {
			final int key = index.keyAt(i);
			final int start = key == firstKey ? (int) (lo & Container.LOW_MASK) : 0;
			final int end = key == lastKey ? (int) ((hi - 1) & Container.LOW_MASK) + 1 : Container.CHUNK_SIZE;
			if (start == 0 && end == Container.CHUNK_SIZE) {
				index.removeAt(i);
				continue;
			}
			final Container c = index.containerAt(i).removeRange(start, end);
			if (c.isEmpty()) {
				index.removeAt(i);
			} else {
				index.set(i, c);
				i++;
			}
		}
	}

	/**
	 * Complements membership of every value in [lo, hi), in place.
	 */
	public void flip(final long lo, final long hi) {
		checkRange(lo, hi);
		checkMutable();
		if (hi <= lo) return;
		final int firstKey = (int) (lo >>> Container.KEY_BITS);
		final int lastKey = (int) ((hi - 1) >>> Container.KEY_BITS);
		for (int key = firstKey; key <= lastKey; key++) {
			final int start = key == firstKey ? (int) (lo & Container.LOW_MASK) : 0;
			final int end = key == lastKey ? (int) ((hi - 1) & Container.LOW_MASK) + 1 : Container.CHUNK_SIZE;
			final int i = index.indexOf(key);
			if (i >= 0) index.setOrRemove(i, ContainerAlgebra.flip(index.containerAt(i), start, end));
			else index.insertAt(-i - 1, key, rangeContainer(start, end));
		}
	}

	/**
	 * @return a new bitmap holding bitmap with [lo, hi) complemented
	 */
	public static RoaringBitmap flip(final RoaringBitmap bitmap, final long lo, final long hi) {
		checkRange(lo, hi);
		final RoaringBitmap out = bitmap.clone();
		out.flip(lo, hi);
		return out;
	}

	public void clear() {
		checkMutable();
		index.clear();
	}

	/**
	 * Converts containers to run form where that is strictly smaller, and run containers that
	 * no longer pay off back to array or bitmap.
	 *
	 * @return true if any container changed form
	 */
	public boolean runOptimize() {
		checkMutable();
		boolean changed = false;
		for (int i = 0; i < index.size(); i++) {
			final Container c = index.containerAt(i);
			final Container o = ContainerAlgebra.optimize(c);
			if (o != c) {
				index.set(i, o);
				changed = true;
			}
		}
		return changed;
	}

	/**
	 * @return true if any run container was converted
	 */
	public boolean removeRunCompression() {
		checkMutable();
		boolean changed = false;
		for (int i = 0; i < index.size(); i++) {
			final Container c = index.containerAt(i);
			final Container o = ContainerAlgebra.removeRun(c);
			if (o != c) {
				index.set(i, o);
				changed = true;
			}
		}
		return changed;
	}

	/** Replaces the contents of this bitmap by a deep copy of other. */
	public void assign(final RoaringBitmap other) {
		checkMutable();
		if (other == this) return;
		index = other.index.copy();
	}

	// ----- Queries -----
	public boolean contains(final int x) {
		final Container c = index.get(Container.high(x));
		return c != null && c.contains(Container.low(x));
	}

	public boolean isEmpty() {
		return index.isEmpty();
	}

	public long cardinality() {
		return index.cardinality();
	}

	/** smallest value, unsigned */
	public long minimum() {
		if (index.isEmpty()) throw new NoSuchElementException(ErrorCode.EMPTY_SET.getMessage());
		return Integer.toUnsignedLong(Container.toInt(index.keyAt(0), index.containerAt(0).first()));
	}

	/** largest value, unsigned */
	public long maximum() {
		if (index.isEmpty()) throw new NoSuchElementException(ErrorCode.EMPTY_SET.getMessage());
		final int last = index.size() - 1;
		return Integer.toUnsignedLong(Container.toInt(index.keyAt(last), index.containerAt(last).last()));
	}

	/** number of members less than or equal to x */
	public long rank(final int x) {
		final int key = Container.high(x);
		long sum = 0;
		for (int i = 0; i < index.size(); i++) {
			final int k = index.keyAt(i);
			if (k > key) break;
			final Container c = index.containerAt(i);
			if (k < key) sum += c.cardinality();
			else sum += c.rank(Container.low(x));
		}
		return sum;
	}

	/**
	 * @param i 0-based rank
	 * @return the member with rank i + 1, or -1 if i is outside [0, cardinality)
	 */
	public long select(final long i) {
		if (i < 0) return NOT_FOUND;
		long remaining = i;
		for (int c = 0; c < index.size(); c++) {
			final Container container = index.containerAt(c);
			final int card = container.cardinality();
			if (remaining < card) return Integer.toUnsignedLong(Container.toInt(index.keyAt(c), container.select((int) remaining)));
			remaining -= card;
		}
		return NOT_FOUND;
	}

	public boolean intersects(final RoaringBitmap other) {
		final ChunkIndex x = index, y = other.index;
		int i = 0, j = 0;
		while (i < x.size() && j < y.size()) {
			final int kx = x.keyAt(i), ky = y.keyAt(j);
			if (kx == ky) {
				if (ContainerAlgebra.intersects(x.containerAt(i), y.containerAt(j))) return true;
				i++;
				j++;
			} else if (kx < ky) {
				i++;
			} else {
				j++;
			}
		}
		return false;
	}

	public long andCardinality(final RoaringBitmap other) {
		final ChunkIndex x = index, y = other.index;
		long sum = 0;
		int i = 0, j = 0;
		while (i < x.size() && j < y.size()) {
			final int kx = x.keyAt(i), ky = y.keyAt(j);
			if (kx == ky) {
				sum += ContainerAlgebra.andCardinality(x.containerAt(i), y.containerAt(j));
				i++;
				j++;
			} else if (kx < ky) {
				i++;
			} else {
				j++;
			}
		}
		return sum;
	}

	public long orCardinality(final RoaringBitmap other) {
		return cardinality() + other.cardinality() - andCardinality(other);
	}

	public long xorCardinality(final RoaringBitmap other) {
		return cardinality() + other.cardinality() - 2 * andCardinality(other);
	}

	public long andNotCardinality(final RoaringBitmap other) {
		return cardinality() - andCardinality(other);
	}

	/**
	 * |A and B| / |A or B|, 0 when both are empty
	 */
	public double jaccardIndex(final RoaringBitmap other) {
		final long and = andCardinality(other);
		final long or = cardinality() + other.cardinality() - and;
		return or == 0 ? 0.0 : (double) and / or;
	}

	/** members in ascending unsigned order */
	public int[] toArray() {
		final long card = cardinality();
		if (card > Integer.MAX_VALUE - 8) throw new IllegalStateException("too many values for an array: " + card);
		final int[] out = new int[(int) card];
		int k = 0;
		for (PrimitiveIterator.OfInt it = iterator(); it.hasNext();) out[k++] = it.nextInt();
		return out;
	}

	@Override
	public PrimitiveIterator.OfInt iterator() {
		return new RoaringIterator(index);
	}

	/** calls action with every member in ascending unsigned order */
	public void forEachInt(final IntConsumer action) {
		for (int i = 0; i < index.size(); i++) {
			for (PrimitiveIterator.OfInt it = index.containerAt(i).intIterator(index.keyAt(i)); it.hasNext();)
				action.accept(it.nextInt());
		}
	}

	public Statistics stats() {
		return Statistics.of(index);
	}

	// ----- Set algebra -----
	private enum SetOp {
		AND, OR, XOR, ANDNOT
	}

	private static Container apply(final SetOp op, final Container a, final Container b) {
		switch (op) {
			case AND:
				return ContainerAlgebra.and(a, b);
			case OR:
				return ContainerAlgebra.or(a, b);
			case XOR:
				return ContainerAlgebra.xor(a, b);
			default:
				return ContainerAlgebra.andNot(a, b);
		}
	}

	/** the container itself when it may be moved into a result, otherwise a heap copy */
	private static Container take(final Container c, final boolean move) {
		return move && !c.isFrozen() ? c : c.copy();
	}

	/**
	 * Merges two ascending key sequences. Keys only on the left survive OR, XOR and ANDNOT;
	 * keys only on the right survive OR and XOR.
	 *
	 * @param moveLeft left containers belong to the caller's result and need no copy
	 */
	private static ChunkIndex merge(final ChunkIndex x, final ChunkIndex y, final SetOp op, final boolean moveLeft) {
		final boolean keepLeft = op != SetOp.AND;
		final boolean keepRight = op == SetOp.OR || op == SetOp.XOR;
		final ChunkIndex out = new ChunkIndex(op == SetOp.AND ? Math.min(x.size(), y.size()) : x.size() + (keepRight ? y.size() : 0));
		int i = 0, j = 0;
		while (i < x.size() && j < y.size()) {
			final int kx = x.keyAt(i), ky = y.keyAt(j);
			if (kx == ky) {
				out.append(kx, apply(op, x.containerAt(i), y.containerAt(j)));
				i++;
				j++;
			} else if (kx < ky) {
				if (keepLeft) out.append(kx, take(x.containerAt(i), moveLeft));
				i++;
			} else {
				if (keepRight) out.append(ky, y.containerAt(j).copy());
				j++;
			}
		}
		if (keepLeft) for (; i < x.size(); i++) out.append(x.keyAt(i), take(x.containerAt(i), moveLeft));
		if (keepRight) for (; j < y.size(); j++) out.append(y.keyAt(j), y.containerAt(j).copy());
		return out;
	}

	/** this = this AND other */
	public void and(final RoaringBitmap other) {
		checkMutable();
		index = merge(index, other.index, SetOp.AND, other != this);
	}

	/** this = this OR other */
	public void or(final RoaringBitmap other) {
		checkMutable();
		index = merge(index, other.index, SetOp.OR, other != this);
	}

	/** this = this XOR other */
	public void xor(final RoaringBitmap other) {
		checkMutable();
		index = merge(index, other.index, SetOp.XOR, other != this);
	}

	/** this = this AND NOT other */
	public void andNot(final RoaringBitmap other) {
		checkMutable();
		index = merge(index, other.index, SetOp.ANDNOT, other != this);
	}

	public static RoaringBitmap and(final RoaringBitmap a, final RoaringBitmap b) {
		return new RoaringBitmap(merge(a.index, b.index, SetOp.AND, false));
	}

	public static RoaringBitmap or(final RoaringBitmap a, final RoaringBitmap b) {
		return new RoaringBitmap(merge(a.index, b.index, SetOp.OR, false));
	}

	public static RoaringBitmap xor(final RoaringBitmap a, final RoaringBitmap b) {
		return new RoaringBitmap(merge(a.index, b.index, SetOp.XOR, false));
	}

	public static RoaringBitmap andNot(final RoaringBitmap a, final RoaringBitmap b) {
		return new RoaringBitmap(merge(a.index, b.index, SetOp.ANDNOT, false));
	}

	/** position inside one input of fastOr */
	private static final class Cursor {
		final ChunkIndex index;
		int pos;

		Cursor(ChunkIndex index) {
			this.index = index;
		}

		int key() {
			return index.keyAt(pos);
		}
	}

	/**
	 * Union of many bitmaps. Containers are grouped by key across all inputs and each group
	 * is unioned once into a single accumulator.
	 */
	public static RoaringBitmap fastOr(final RoaringBitmap... bitmaps) {
		if (bitmaps.length == 0) return new RoaringBitmap();
		if (bitmaps.length == 1) return bitmaps[0].clone();
		if (bitmaps.length == 2) return or(bitmaps[0], bitmaps[1]);

		final PriorityQueue<Cursor> heap = new PriorityQueue<>(bitmaps.length, (p, q) -> Integer.compare(p.key(), q.key()));
		for (RoaringBitmap rb : bitmaps) {
			if (!rb.index.isEmpty()) heap.add(new Cursor(rb.index));
		}
		final ChunkIndex out = new ChunkIndex();
		final Container[] group = new Container[bitmaps.length];
		int widest = 0;
		while (!heap.isEmpty()) {
			final int key = heap.peek().key();
			int n = 0;
			while (!heap.isEmpty() && heap.peek().key() == key) {
				final Cursor cur = heap.poll();
				group[n++] = cur.index.containerAt(cur.pos);
				if (++cur.pos < cur.index.size()) heap.add(cur);
			}
			out.append(key, ContainerAlgebra.lazyOr(group, n));
			widest = Math.max(widest, n);
		}
		LOG.log("fastOr: %d inputs, %d keys, widest group %d", bitmaps.length, out.size(), widest);
		return new RoaringBitmap(out);
	}

	// ----- Serialization -----
	/** exact size of the portable encoding */
	public int serializedSizeInBytes() {
		return PortableCodec.sizeInBytes(index);
	}

	/**
	 * Writes the portable encoding at the position of dst and advances it.
	 *
	 * @return bytes written
	 * @throws RoaringException INSUFFICIENT_BUFFER, before anything is written
	 */
	public int serialize(final ByteBuffer dst) throws RoaringException {
		return PortableCodec.serialize(index, dst);
	}

	public int write(final byte[] dst) throws RoaringException {
		return serialize(ByteBuffer.wrap(dst));
	}

	public byte[] toByteArray() {
		final byte[] out = new byte[serializedSizeInBytes()];
		PortableCodec.write(index, LittleEndianBuffer.wrap(ByteBuffer.wrap(out)));
		return out;
	}

	/**
	 * Reads one portable bitmap at the position of src, bounds-checked, and advances src past it.
	 */
	public static RoaringBitmap deserialize(final ByteBuffer src) throws RoaringException {
		return new RoaringBitmap(PortableCodec.deserialize(src, src.remaining(), false));
	}

	public static RoaringBitmap read(final byte[] src) throws RoaringException {
		return deserialize(ByteBuffer.wrap(src));
	}

	/**
	 * Reads at most length bytes and validates the whole encoding before building anything.
	 */
	public static RoaringBitmap deserializeSafe(final ByteBuffer src, final int length) throws RoaringException {
		return new RoaringBitmap(PortableCodec.deserialize(src, length, true));
	}

	public static RoaringBitmap readSafe(final byte[] src, final int length) throws RoaringException {
		return deserializeSafe(ByteBuffer.wrap(src), length);
	}

	/** exact size of the frozen encoding */
	public int frozenSizeInBytes() {
		return FrozenCodec.sizeInBytes(index);
	}

	public int writeFrozen(final ByteBuffer dst) throws RoaringException {
		return FrozenCodec.write(index, dst);
	}

	public int writeFrozen(final byte[] dst) throws RoaringException {
		return writeFrozen(ByteBuffer.wrap(dst));
	}

	/**
	 * Immutable bitmap over the frozen bytes between position and limit of src. No payload is
	 * copied; src must stay untouched for as long as the view is used. Mutators throw
	 * UnsupportedOperationException, {@link #clone()} gives a mutable copy.
	 */
	public static RoaringBitmap readFrozenView(final ByteBuffer src) throws RoaringException {
		final ByteBuffer backing = src.duplicate();
		final RoaringBitmap rb = new RoaringBitmap(FrozenCodec.view(src));
		rb.frozenBuffer = backing;
		return rb;
	}

	public boolean isFrozen() {
		return frozenBuffer != null;
	}

	// ----- Object -----
	/** deep, mutable copy; a frozen view comes back as an ordinary bitmap */
	@Override
	public RoaringBitmap clone() {
		return new RoaringBitmap(index.copy());
	}

	@Override
	public boolean equals(final Object o) {
		if (this == o) return true;
		if (!(o instanceof RoaringBitmap)) return false;
		final ChunkIndex x = index, y = ((RoaringBitmap) o).index;
		if (x.size() != y.size()) return false;
		for (int i = 0; i < x.size(); i++) {
			if (x.keyAt(i) != y.keyAt(i)) return false;
			if (!ContainerAlgebra.sameMembership(x.containerAt(i), y.containerAt(i))) return false;
		}
		return true;
	}

	@Override
	public int hashCode() {
		int h = 1;
		for (PrimitiveIterator.OfInt it = iterator(); it.hasNext();) h = 31 * h + it.nextInt();
		return h;
	}

	@Override
	public String toString() {
		final StringBuilder s = new StringBuilder("{");
		int n = 0;
		for (PrimitiveIterator.OfInt it = iterator(); it.hasNext();) {
			if (Config.TOSTRING_LIMIT > 0 && n == Config.TOSTRING_LIMIT) {
				s.append(",...");
				break;
			}
			if (n++ > 0) s.append(',');
			s.append(Integer.toUnsignedString(it.nextInt()));
		}
		return s.append('}').toString();
	}

	/** one line per container: key, form and cardinality */
	public String describe() {
		final StringBuilder s = new StringBuilder();
		s.append(String.format("RoaringBitmap(containers=%d, cardinality=%d%s)", index.size(), cardinality(), isFrozen() ? ", frozen" : ""));
		for (ChunkIndex.Chunk chunk : index) {
			s.append('\n').append(String.format("  key %5d  %s", chunk.key(), chunk.container()));
		}
		return s.toString();
	}
}
