package im.arun.rptsearch.binary;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Read-only little-endian view over a whole archive file held in memory.
 * Only absolute reads are used, so one instance can be shared by concurrent queries.
 */
public final class ArchiveBuffer {
    private final ByteBuffer buffer;
    private final String source;

    public ArchiveBuffer(byte[] data, String source) {
        this.buffer = ByteBuffer.wrap(data).asReadOnlyBuffer().order(ByteOrder.LITTLE_ENDIAN);
        this.source = source;
    }

    /**
     * Encode an ASCII label the way the archive headers store it (one UTF-16LE code unit per char).
     */
    public static byte[] doubleByte(String label) {
        return label.getBytes(StandardCharsets.UTF_16LE);
    }

    public String source() {
        return source;
    }

    public int length() {
        return buffer.limit();
    }

    public boolean fits(int offset, int length) {
        return offset >= 0 && length >= 0 && (long) offset + length <= buffer.limit();
    }

    public int u8(int offset) {
        return buffer.get(offset) & 0xFF;
    }

    public int u16(int offset) {
        return buffer.getShort(offset) & 0xFFFF;
    }

    public long u32(int offset) {
        return Integer.toUnsignedLong(buffer.getInt(offset));
    }

    public byte[] bytes(int offset, int length) {
        byte[] out = new byte[length];
        buffer.get(offset, out);
        return out;
    }

    public String text(int offset, int length, Charset charset) {
        return new String(bytes(offset, length), charset);
    }

    /**
     * Decode a fixed-width double-byte string field, dropping NUL padding.
     */
    public String doubleByteText(int offset, int length) {
        if (!fits(offset, length)) {
            return "";
        }
        String raw = text(offset, length, StandardCharsets.UTF_16LE);
        int end = raw.indexOf('\0');
        return (end >= 0 ? raw.substring(0, end) : raw).trim();
    }

    public boolean regionMatches(int offset, byte[] expected) {
        if (!fits(offset, expected.length)) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (buffer.get(offset + i) != expected[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return offset of the next occurrence of {@code pattern} at or after {@code from}, or -1
     */
    public int indexOf(byte[] pattern, int from) {
        int last = buffer.limit() - pattern.length;
        outer:
        for (int i = Math.max(0, from); i <= last; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (buffer.get(i + j) != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    public ArchiveFormatException formatError(long offset, String message) {
        return new ArchiveFormatException(source, offset, message);
    }
}
