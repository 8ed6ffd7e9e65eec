// file: core/src/main/java/io/typedkv/core/codec/ScalarCodecs.java
package io.typedkv.core.codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

/**
 * Built-in codecs for scalar types.
 * <p>
 * Layouts (little-endian):
 *  - int:     4 bytes
 *  - long:    8 bytes
 *  - boolean: 1 byte, 0 or 1
 *  - double:  8 bytes, IEEE-754 bits
 *  - String:  UTF-8 bytes, no length prefix
 *  - byte[]:  raw bytes, no length prefix
 * <p>
 * The numeric and boolean codecs are fixed-width; String and byte[] are not.
 */
public final class ScalarCodecs {

    public static final FixedWidthCodec<Integer> INT = new IntCodec();
    public static final FixedWidthCodec<Long> LONG = new LongCodec();
    public static final FixedWidthCodec<Boolean> BOOLEAN = new BooleanCodec();
    public static final FixedWidthCodec<Double> DOUBLE = new DoubleCodec();
    public static final Codec<String> STRING = new StringCodec();
    public static final Codec<byte[]> BYTES = new BytesCodec();

    private ScalarCodecs() {
        // constants only
    }

    private static final class IntCodec implements FixedWidthCodec<Integer> {
        @Override public int fixedSize() { return Integer.BYTES; }
        @Override public void write(Integer value, ByteBuffer target) { target.putInt(value); }
        @Override public Integer read(ByteBuffer source) { return source.getInt(); }
    }

    private static final class LongCodec implements FixedWidthCodec<Long> {
        @Override public int fixedSize() { return Long.BYTES; }
        @Override public void write(Long value, ByteBuffer target) { target.putLong(value); }
        @Override public Long read(ByteBuffer source) { return source.getLong(); }
    }

    private static final class BooleanCodec implements FixedWidthCodec<Boolean> {
        @Override public int fixedSize() { return 1; }
        @Override public void write(Boolean value, ByteBuffer target) { target.put((byte) (value ? 1 : 0)); }
        @Override public Boolean read(ByteBuffer source) { return source.get() != 0; }
    }

    private static final class DoubleCodec implements FixedWidthCodec<Double> {
        @Override public int fixedSize() { return Double.BYTES; }
        @Override public void write(Double value, ByteBuffer target) { target.putDouble(value); }
        @Override public Double read(ByteBuffer source) { return source.getDouble(); }
    }

    /**
     * UTF-8 without an intermediate byte[]: size is counted from the chars and
     * the bytes are encoded straight into the target. Unpaired surrogates
     * become '?', matching {@link String#getBytes(java.nio.charset.Charset)}.
     */
    private static final class StringCodec implements Codec<String> {
        @Override
        public OptionalInt trySize(String value) {
            return OptionalInt.of(utf8Length(value));
        }

        @Override
        public void write(String value, ByteBuffer target) {
            int n = value.length();
            for (int i = 0; i < n; i++) {
                char c = value.charAt(i);
                if (c < 0x80) {
                    target.put((byte) c);
                } else if (c < 0x800) {
                    target.put((byte) (0xC0 | (c >> 6)));
                    target.put((byte) (0x80 | (c & 0x3F)));
                } else if (Character.isHighSurrogate(c) && i + 1 < n && Character.isLowSurrogate(value.charAt(i + 1))) {
                    int cp = Character.toCodePoint(c, value.charAt(++i));
                    target.put((byte) (0xF0 | (cp >> 18)));
                    target.put((byte) (0x80 | ((cp >> 12) & 0x3F)));
                    target.put((byte) (0x80 | ((cp >> 6) & 0x3F)));
                    target.put((byte) (0x80 | (cp & 0x3F)));
                } else if (Character.isSurrogate(c)) {
                    target.put((byte) '?');
                } else {
                    target.put((byte) (0xE0 | (c >> 12)));
                    target.put((byte) (0x80 | ((c >> 6) & 0x3F)));
                    target.put((byte) (0x80 | (c & 0x3F)));
                }
            }
        }

        @Override
        public String read(ByteBuffer source) {
            int length = source.remaining();
            String s;
            if (source.hasArray()) {
                s = new String(source.array(), source.arrayOffset() + source.position(), length, StandardCharsets.UTF_8);
                source.position(source.limit());
            } else {
                byte[] tmp = new byte[length];
                source.get(tmp);
                s = new String(tmp, StandardCharsets.UTF_8);
            }
            return s;
        }

        static int utf8Length(String value) {
            int n = value.length();
            int bytes = 0;
            for (int i = 0; i < n; i++) {
                char c = value.charAt(i);
                if (c < 0x80) {
                    bytes += 1;
                } else if (c < 0x800) {
                    bytes += 2;
                } else if (Character.isHighSurrogate(c) && i + 1 < n && Character.isLowSurrogate(value.charAt(i + 1))) {
                    bytes += 4;
                    i++;
                } else if (Character.isSurrogate(c)) {
                    bytes += 1;
                } else {
                    bytes += 3;
                }
            }
            return bytes;
        }
    }

    private static final class BytesCodec implements Codec<byte[]> {
        @Override public OptionalInt trySize(byte[] value) { return OptionalInt.of(value.length); }
        @Override public void write(byte[] value, ByteBuffer target) { target.put(value); }

        @Override
        public byte[] read(ByteBuffer source) {
            byte[] out = new byte[source.remaining()];
            source.get(out);
            return out;
        }
    }
}
