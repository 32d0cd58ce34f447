/**
 * FrozenCodec.java
 */
package flint.roaring;

import java.nio.ByteBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;

/**
 * Frozen layout, readable in place without copying payloads.
 *
 * <pre>
 * bitmap zone   8192 bytes per bitmap container
 * run zone      nruns x (u16 start, u16 length - 1) per run container
 * array zone    card x u16 per array container
 * keys          n x u16
 * counts        n x u16   (bitmap/array: card - 1, run: nruns)
 * type codes    n x u8    (1 bitmap, 2 array, 3 run)
 * header        u32       n << 15 | 13766
 * </pre>
 *
 * Containers inside one zone follow key order. Everything is little-endian.
 */
final class FrozenCodec {
	static final int FROZEN_COOKIE = 13766;
	static final int FROZEN_COOKIE_BITS = 15;

	private static final Logger LOG = Logger.of(FrozenCodec.class.getName());

	private FrozenCodec() {
	}

	static int sizeInBytes(ChunkIndex index) {
		int size = 4 + 5 * index.size();
		for (int i = 0; i < index.size(); i++) size += index.containerAt(i).frozenSizeInBytes();
		return size;
	}

	static int write(ChunkIndex index, ByteBuffer dst) throws RoaringException {
		final int size = sizeInBytes(index);
		if (dst.remaining() < size)
			throw new RoaringException(ErrorCode.INSUFFICIENT_BUFFER, "need " + size + " bytes, " + dst.remaining() + " available");
		final LittleEndianBuffer out = LittleEndianBuffer.wrap(dst);
		final int n = index.size();
		for (byte zone : new byte[] { Container.BITMAP, Container.RUN, Container.ARRAY }) {
			for (int i = 0; i < n; i++) {
				Container c = index.containerAt(i);
				if (c.type() == zone) c.writeFrozenPayload(out);
			}
		}
		for (int i = 0; i < n; i++) out.putShort(index.keyAt(i));
		for (int i = 0; i < n; i++) out.putShort(index.containerAt(i).frozenCount());
		for (int i = 0; i < n; i++) out.put(index.containerAt(i).type());
		out.putInt((n << FROZEN_COOKIE_BITS) | FROZEN_COOKIE);
		dst.position(dst.position() + size);
		return size;
	}

	/**
	 * Builds a read-only index whose containers alias the bytes between position and limit of src.
	 * The whole remaining range must be exactly one frozen bitmap; src is advanced to its limit.
	 */
	static ChunkIndex view(ByteBuffer src) throws RoaringException {
		final ByteBuffer bytes = src.slice().asReadOnlyBuffer();
		final LittleEndianBuffer in = LittleEndianBuffer.wrap(bytes);
		try {
			final ChunkIndex index = decode(in, bytes.remaining());
			src.position(src.limit());
			LOG.log("frozen view: %d containers over %d bytes", index.size(), in.limit());
			return index;
		} catch (RoaringException ex) {
			LOG.error("frozen view rejected: %s", ex.getMessage());
			throw ex;
		}
	}

	private static ChunkIndex decode(LittleEndianBuffer in, int length) throws RoaringException {
		if (length < 4) throw new RoaringException(ErrorCode.TRUNCATED_INPUT, "frozen header needs 4 bytes, " + length + " given");
		final int header = in.getInt(length - 4);
		if ((header & ((1 << FROZEN_COOKIE_BITS) - 1)) != FROZEN_COOKIE)
			throw new RoaringException(ErrorCode.UNKNOWN_COOKIE, "frozen cookie " + (header & ((1 << FROZEN_COOKIE_BITS) - 1)));
		final int n = header >>> FROZEN_COOKIE_BITS;
		if (n > PortableCodec.MAX_CONTAINERS) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "container count " + n);
		final long metaBytes = 5L * n + 4;
		if (metaBytes > length) throw new RoaringException(ErrorCode.TRUNCATED_INPUT, "frozen tables need " + metaBytes + " bytes, " + length + " given");

		final int typesAt = length - 4 - n;
		final int countsAt = typesAt - 2 * n;
		final int keysAt = countsAt - 2 * n;

		long bitmapZone = 0, runZone = 0, arrayZone = 0;
		int prevKey = -1;
		for (int i = 0; i < n; i++) {
			int key = in.getChar(keysAt + 2 * i);
			if (key <= prevKey) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "keys not ascending at container " + i);
			prevKey = key;
			int count = in.getChar(countsAt + 2 * i);
			switch (in.get(typesAt + i)) {
				case Container.BITMAP:
					bitmapZone += Container.BITMAP_BYTES;
					break;
				case Container.ARRAY:
					arrayZone += 2L * (count + 1);
					break;
				case Container.RUN:
					if (count == 0) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "run container " + i + " without runs");
					runZone += 4L * count;
					break;
				default:
					throw new RoaringException(ErrorCode.MALFORMED_INPUT, "type code " + in.get(typesAt + i) + " at container " + i);
			}
		}
		if (bitmapZone + runZone + arrayZone != keysAt)
			throw new RoaringException(ErrorCode.MALFORMED_INPUT, "payload zones take " + (bitmapZone + runZone + arrayZone) + " bytes, layout leaves " + keysAt);

		int bitmapAt = 0;
		int runAt = (int) bitmapZone;
		int arrayAt = (int) (bitmapZone + runZone);
		final ChunkIndex index = new ChunkIndex(n);
		for (int i = 0; i < n; i++) {
			int key = in.getChar(keysAt + 2 * i);
			int count = in.getChar(countsAt + 2 * i);
			Container c;
			switch (in.get(typesAt + i)) {
				case Container.BITMAP: {
					LongBuffer words = in.longView(bitmapAt, Container.BITMAP_WORDS);
					checkBitmap(words, count + 1, i);
					c = new FrozenContainer.Bitmap(words, count + 1);
					bitmapAt += Container.BITMAP_BYTES;
					break;
				}
				case Container.RUN: {
					ShortBuffer runs = in.shortView(runAt, 2 * count);
					checkRuns(runs, count, i);
					c = new FrozenContainer.Run(runs, count);
					runAt += 4 * count;
					break;
				}
				default: {
					ShortBuffer values = in.shortView(arrayAt, count + 1);
					checkArray(values, count + 1, i);
					c = new FrozenContainer.Array(values, count + 1);
					arrayAt += 2 * (count + 1);
					break;
				}
			}
			index.append(key, c);
		}
		return index;
	}

	// payload checks read the aliased bytes once and copy nothing

	private static void checkBitmap(LongBuffer words, int card, int i) throws RoaringException {
		int pc = 0;
		for (int w = 0; w < Container.BITMAP_WORDS; w++) pc += Long.bitCount(words.get(w));
		if (pc != card) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "bitmap container " + i + " holds " + pc + " values, count says " + card);
	}

	private static void checkArray(ShortBuffer values, int size, int i) throws RoaringException {
		int prev = -1;
		for (int v = 0; v < size; v++) {
			int x = values.get(v) & 0xFFFF;
			if (x <= prev) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "array container " + i + " not ascending at " + v);
			prev = x;
		}
	}

	private static void checkRuns(ShortBuffer runs, int nruns, int i) throws RoaringException {
		int prevEnd = -1;
		for (int r = 0; r < nruns; r++) {
			int start = runs.get(2 * r) & 0xFFFF;
			int end = start + (runs.get(2 * r + 1) & 0xFFFF);
			if (end > Container.LOW_MASK) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "run container " + i + ", run " + r + " leaves the chunk");
			if (start <= prevEnd) throw new RoaringException(ErrorCode.MALFORMED_INPUT, "run container " + i + ", run " + r + " overlaps or is out of order");
			prevEnd = end;
		}
	}
}
