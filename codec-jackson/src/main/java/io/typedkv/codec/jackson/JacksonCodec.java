// file: codec-jackson/src/main/java/io/typedkv/codec/jackson/JacksonCodec.java
package io.typedkv.codec.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.GrowableBuffer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * JSON codec backed by a Jackson {@link ObjectMapper}.
 * <p>
 * JSON length is only known after writing, so trySize() is always empty and
 * values go through the streaming path straight into the sink.
 */
public final class JacksonCodec<T> implements Codec<T> {
    private final ObjectMapper mapper;
    private final JavaType type;

    public JacksonCodec(ObjectMapper mapper, Class<T> type) {
        this(mapper, mapper.constructType(type));
    }

    private JacksonCodec(ObjectMapper mapper, JavaType type) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.type = Objects.requireNonNull(type, "type");
    }

    /** Codec for a generic type, e.g. {@code new TypeReference<Map<String, Integer>>() {}}. */
    public static <T> JacksonCodec<T> of(ObjectMapper mapper, TypeReference<T> type) {
        return new JacksonCodec<>(mapper, mapper.constructType(type));
    }

    @Override
    public OptionalInt trySize(T value) {
        return OptionalInt.empty();
    }

    @Override
    public void write(T value, ByteBuffer target) {
        try {
            target.put(mapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + type + " as JSON", e);
        }
    }

    @Override
    public void write(T value, GrowableBuffer sink) {
        try {
            mapper.writeValue(sink.asOutputStream(), value);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + type + " as JSON", e);
        }
    }

    @Override
    public T read(ByteBuffer source) {
        int length = source.remaining();
        try {
            T value;
            if (source.hasArray()) {
                value = mapper.readValue(source.array(), source.arrayOffset() + source.position(), length, type);
            } else {
                byte[] copy = new byte[length];
                source.duplicate().get(copy);
                value = mapper.readValue(copy, type);
            }
            source.position(source.limit());
            return value;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + type + " from " + length + " bytes of JSON", e);
        }
    }
}
