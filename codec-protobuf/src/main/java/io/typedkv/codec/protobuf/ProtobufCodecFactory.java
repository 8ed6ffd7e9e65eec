package io.typedkv.codec.protobuf;

import com.google.protobuf.Message;
import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.CodecFactory;

/** Creates {@link ProtobufCodec}s for generated message classes. */
public final class ProtobufCodecFactory implements CodecFactory {

    @Override
    public boolean canCreate(Class<?> type) {
        return Message.class.isAssignableFrom(type);
    }

    @Override
    public <T> Codec<T> create(Class<T> type) {
        return new ProtobufCodec<>(type);
    }
}
