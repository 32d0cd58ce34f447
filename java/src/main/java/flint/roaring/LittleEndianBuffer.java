package flint.roaring;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;

/**
 * A wrapper around ByteBuffer that enforces LITTLE_ENDIAN byte order.
 * Both interchange formats are little-endian; the wrapper works on a private duplicate so the
 * caller's buffer keeps its own order, and every read is checked against the remaining bytes.
 */
final class LittleEndianBuffer {
    private final ByteBuffer buffer;

    private LittleEndianBuffer(ByteBuffer buffer) {
        this.buffer = buffer.order(ByteOrder.LITTLE_ENDIAN);
    }

    /** Wraps the bytes between position and limit of {@code buffer}; position 0 is the caller's position. */
    public static LittleEndianBuffer wrap(ByteBuffer buffer) {
        return new LittleEndianBuffer(buffer.slice());
    }

    /** Wraps at most {@code length} bytes from the caller's position. */
    public static LittleEndianBuffer wrap(ByteBuffer buffer, int length) {
        int n = Math.min(length, buffer.remaining());
        return new LittleEndianBuffer(buffer.slice(buffer.position(), n));
    }

    public int position() {
        return buffer.position();
    }

    public LittleEndianBuffer position(int newPosition) {
        buffer.position(newPosition);
        return this;
    }

    public int limit() {
        return buffer.limit();
    }

    /** Throws TRUNCATED_INPUT unless {@code bytes} more bytes can be read. */
    public LittleEndianBuffer require(long bytes, String what) throws RoaringException {
        if (bytes < 0 || bytes > buffer.remaining())
            throw new RoaringException(ErrorCode.TRUNCATED_INPUT, what + " needs " + bytes + " bytes, " + buffer.remaining() + " left");
        return this;
    }

    // Get operations (automatically LITTLE_ENDIAN)
    public byte get(int index) {
        return buffer.get(index);
    }

    public short getShort() {
        return buffer.getShort();
    }

    /** Unsigned 16-bit read. */
    public int getChar() {
        return buffer.getShort() & 0xFFFF;
    }

    public int getChar(int index) {
        return buffer.getShort(index) & 0xFFFF;
    }

    public int getInt() {
        return buffer.getInt();
    }

    public int getInt(int index) {
        return buffer.getInt(index);
    }

    public long getLong() {
        return buffer.getLong();
    }

    public LittleEndianBuffer get(byte[] dst) {
        buffer.get(dst);
        return this;
    }

    // Put operations (automatically LITTLE_ENDIAN)
    public LittleEndianBuffer put(byte b) {
        buffer.put(b);
        return this;
    }

    public LittleEndianBuffer putShort(short value) {
        buffer.putShort(value);
        return this;
    }

    public LittleEndianBuffer putShort(int value) {
        buffer.putShort((short) value);
        return this;
    }

    public LittleEndianBuffer putInt(int value) {
        buffer.putInt(value);
        return this;
    }

    public LittleEndianBuffer putLong(long value) {
        buffer.putLong(value);
        return this;
    }

    public LittleEndianBuffer put(byte[] src) {
        buffer.put(src);
        return this;
    }

    // Views aliasing the underlying bytes, used by frozen containers
    public ShortBuffer shortView(int index, int count) {
        return buffer.slice(index, count * 2).order(ByteOrder.LITTLE_ENDIAN).asShortBuffer();
    }

    public LongBuffer longView(int index, int count) {
        return buffer.slice(index, count * 8).order(ByteOrder.LITTLE_ENDIAN).asLongBuffer();
    }

    @Override
    public String toString() {
        return "LittleEndianBuffer[pos=" + buffer.position() +
               " lim=" + buffer.limit() +
               " cap=" + buffer.capacity() + "]";
    }
}
