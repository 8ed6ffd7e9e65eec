package io.typedkv.codec.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.CodecFactory;

import java.util.Objects;

/**
 * Encodes any type as JSON. Accepts every class, so register it after the more
 * specific factories: the first factory that accepts a type wins.
 */
public final class JacksonCodecFactory implements CodecFactory {
    private final ObjectMapper mapper;

    public JacksonCodecFactory() {
        this(new ObjectMapper());
    }

    public JacksonCodecFactory(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public boolean canCreate(Class<?> type) {
        return !type.isPrimitive();
    }

    @Override
    public <T> Codec<T> create(Class<T> type) {
        return new JacksonCodec<>(mapper, type);
    }
}
