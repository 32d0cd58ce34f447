/**
 * PortableCodec.java
 */
package flint.roaring;

import java.nio.ByteBuffer;
import java.nio.ShortBuffer;

/**
 * Portable roaring format, interchangeable with the other roaring implementations.
 *
 * <pre>
 * no run container:   u32 cookie 12346, u32 count
 * with run container: u32 12347 | (count - 1) << 16, run flags ((count + 7) / 8 bytes)
 * descriptive header: count x (u16 key, u16 cardinality - 1)
 * offset header:      count x u32, omitted with the run cookie and fewer than 4 containers
 * payloads:           bitmap 1024 x u64 | array card x u16 | run u16 nruns, nruns x (u16 start, u16 length - 1)
 * </pre>
 *
 * All fields are little-endian. The trusted decoder checks every read against the input
 * length; the safe decoder additionally checks offsets and the content of every payload.
 */
final class PortableCodec {
	static final int SERIAL_COOKIE_NO_RUNCONTAINER = 12346;
	static final int SERIAL_COOKIE = 12347;
	static final int NO_OFFSET_THRESHOLD = 4;
	static final int MAX_CONTAINERS = 1 << 16;

	private static final Logger LOG = Logger.of(PortableCodec.class.getName());

	private PortableCodec() {
	}

	private static boolean hasRun(ChunkIndex index) {
		for (int i = 0; i < index.size(); i++) {
			if (index.containerAt(i).type() == Container.RUN) return true;
		}
		return false;
	}

	private static int headerSize(int n, boolean runs) {
		if (runs) return 4 + (n + 7) / 8 + 4 * n + (n >= NO_OFFSET_THRESHOLD ? 4 * n : 0);
		return 8 + 8 * n;
	}

	static int sizeInBytes(ChunkIndex index) {
		int size = headerSize(index.size(), hasRun(index));
		for (int i = 0; i < index.size(); i++) size += index.containerAt(i).sizeInBytes();
		return size;
	}

	/**
	 * Writes index at the position of dst and advances it.
	 *
	 * @throws RoaringException INSUFFICIENT_BUFFER when dst cannot take the whole encoding; nothing is written then
	 */
	static int serialize(ChunkIndex index, ByteBuffer dst) throws RoaringException {
		final int size = sizeInBytes(index);
		if (dst.remaining() < size)
			throw new RoaringException(ErrorCode.INSUFFICIENT_BUFFER, "need " + size + " bytes, " + dst.remaining() + " available");
		write(index, LittleEndianBuffer.wrap(dst));
		dst.position(dst.position() + size);
		return size;
	}

	/** unchecked write, out must have room for sizeInBytes(index) */
	static void write(ChunkIndex index, LittleEndianBuffer out) {
		final int n = index.size();
		final boolean runs = hasRun(index);
		if (runs) {
			out.putInt(SERIAL_COOKIE | ((n - 1) << 16));
			byte[] flags = new byte[(n + 7) / 8];
			for (int i = 0; i < n; i++) {
				if (index.containerAt(i).type() == Container.RUN) flags[i / 8] |= (byte) (1 << (i % 8));
			}
			out.put(flags);
		} else {
			out.putInt(SERIAL_COOKIE_NO_RUNCONTAINER);
			out.putInt(n);
		}
		for (int i = 0; i < n; i++) {
			out.putShort(index.keyAt(i));
			out.putShort(index.containerAt(i).cardinality() - 1);
		}
		if (!runs || n >= NO_OFFSET_THRESHOLD) {
			int offset = headerSize(n, runs);
			for (int i = 0; i < n; i++) {
				out.putInt(offset);
				offset += index.containerAt(i).sizeInBytes();
			}
		}
		for (int i = 0; i < n; i++) index.containerAt(i).writePayload(out);
	}

	/**
	 * Decodes one bitmap from at most length bytes at the position of src, advancing it past
	 * the bytes consumed.
	 *
	 * @param safe also validate offsets and payload content
	 */
	static ChunkIndex deserialize(ByteBuffer src, int length, boolean safe) throws RoaringException {
		if (length < 0) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "negative length " + length);
		final LittleEndianBuffer in = LittleEndianBuffer.wrap(src, length);
		try {
			final ChunkIndex index = decode(in, safe);
			src.position(src.position() + in.position());
			LOG.log("portable decode: %d containers, %d bytes%s", index.size(), in.position(), safe ? " (validated)" : "");
			return index;
		} catch (RoaringException ex) {
			LOG.error("portable decode rejected at byte %d: %s", in.position(), ex.getMessage());
			throw ex;
		}
	}

	private static ChunkIndex decode(LittleEndianBuffer in, boolean safe) throws RoaringException {
		in.require(4, "cookie");
		final int cookie = in.getInt();
		final int n;
		byte[] runFlags = null;
		if ((cookie & 0xFFFF) == SERIAL_COOKIE) {
			n = (cookie >>> 16) + 1;
			runFlags = new byte[(n + 7) / 8];
			in.require(runFlags.length, "run flags");
			in.get(runFlags);
		} else if (cookie == SERIAL_COOKIE_NO_RUNCONTAINER) {
			in.require(4, "container count");
			n = in.getInt();
			if (n < 0 || n > MAX_CONTAINERS) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "container count " + Integer.toUnsignedString(n));
		} else {
			throw new RoaringException(ErrorCode.UNKNOWN_COOKIE, "cookie " + Integer.toUnsignedString(cookie));
		}

		in.require(4L * n, "descriptive header");
		final int[] keys = new int[n];
		final int[] cards = new int[n];
		for (int i = 0; i < n; i++) {
			keys[i] = in.getChar();
			cards[i] = in.getChar() + 1;
			if (i > 0 && keys[i] <= keys[i - 1]) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "keys not ascending at container " + i);
		}

		int[] offsets = null;
		if (runFlags == null || n >= NO_OFFSET_THRESHOLD) {
			in.require(4L * n, "offset header");
			offsets = new int[n];
			for (int i = 0; i < n; i++) offsets[i] = in.getInt();
		}

		final ChunkIndex index = new ChunkIndex(n);
		for (int i = 0; i < n; i++) {
			if (safe && offsets != null && offsets[i] != in.position())
				throw new RoaringException(ErrorCode.MALFORMED_INPUT, "container " + i + " offset " + Integer.toUnsignedString(offsets[i]) + ", payload at " + in.position());
			final boolean isRun = runFlags != null && (runFlags[i / 8] & (1 << (i % 8))) != 0;
			final Container c;
			if (isRun) c = readRun(in, cards[i], safe);
			else if (cards[i] > Container.MAX_ARRAY_SIZE) c = readBitmap(in, cards[i], safe);
			else c = readArray(in, cards[i], safe);
			index.append(keys[i], c);
		}
		return index;
	}

	private static RunContainer readRun(LittleEndianBuffer in, int card, boolean safe) throws RoaringException {
		in.require(2, "run count");
		final int nruns = in.getChar();
		if (nruns == 0) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "run container without runs");
		in.require(4L * nruns, "run payload");
		final short[] runs = new short[2 * nruns];
		for (int r = 0; r < 2 * nruns; r++) runs[r] = in.getShort();
		if (safe) validateRuns(runs, nruns, card);
		return new RunContainer(runs, nruns);
	}

	private static void validateRuns(short[] runs, int nruns, int card) throws RoaringException {
		long total = 0;
		int prevEnd = -1;
		for (int r = 0; r < nruns; r++) {
			int start = runs[2 * r] & 0xFFFF;
			int end = start + (runs[2 * r + 1] & 0xFFFF);
			if (end > Container.LOW_MASK) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "run " + r + " leaves the chunk");
			if (start <= prevEnd) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "run " + r + " overlaps or is out of order");
			total += end - start + 1;
			prevEnd = end;
		}
		if (total != card) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "runs hold " + total + " values, header says " + card);
	}

	private static BitmapContainer readBitmap(LittleEndianBuffer in, int card, boolean safe) throws RoaringException {
		in.require(Container.BITMAP_BYTES, "bitmap payload");
		final long[] words = new long[Container.BITMAP_WORDS];
		for (int w = 0; w < words.length; w++) words[w] = in.getLong();
		if (safe) {
			int pc = ContainerAlgebra.popcount(words);
			if (pc != card) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "bitmap holds " + pc + " values, header says " + card);
		}
		return new BitmapContainer(words, card);
	}

	private static ArrayContainer readArray(LittleEndianBuffer in, int card, boolean safe) throws RoaringException {
		in.require(2L * card, "array payload");
		final ShortBuffer view = in.shortView(in.position(), card);
		final short[] values = new short[Math.max(card, 4)];
		view.get(values, 0, card);
		in.position(in.position() + 2 * card);
		if (safe) {
			for (int v = 1; v < card; v++) {
				if ((values[v] & 0xFFFF) <= (values[v - 1] & 0xFFFF)) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "array values not ascending at " + v);
			}
		}
		return new ArrayContainer(values, card);
	}
}
