package io.typedkv.core.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

/** Encode/decode helpers shared by codec tests. */
public final class CodecTestSupport {

    private CodecTestSupport() {
    }

    /** Encode through the exact-size path and check the codec filled the buffer. */
    public static <T> byte[] encodeExact(Codec<T> codec, T value) {
        OptionalInt size = codec.trySize(value);
        assertTrue(size.isPresent(), "codec should know the size");
        byte[] out = new byte[size.getAsInt()];
        ByteBuffer target = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        codec.write(value, target);
        assertEquals(0, target.remaining(), "codec must write exactly trySize() bytes");
        return out;
    }

    public static <T> byte[] encodeStreaming(Codec<T> codec, T value) {
        try (GrowableBuffer sink = new GrowableBuffer()) {
            codec.write(value, sink);
            return sink.toByteArray();
        }
    }

    public static <T> T decode(Codec<T> codec, byte[] bytes) {
        return codec.read(ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN));
    }

    /** UTF-8 string codec that refuses to size its output, forcing the streaming path. */
    public static final class UnsizedStringCodec implements Codec<String> {
        @Override
        public OptionalInt trySize(String value) {
            return OptionalInt.empty();
        }

        @Override
        public void write(String value, ByteBuffer target) {
            target.put(value.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void write(String value, GrowableBuffer sink) {
            sink.put(value.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public String read(ByteBuffer source) {
            return ScalarCodecs.STRING.read(source);
        }
    }
}
