// file: codec-protobuf/src/main/java/io/typedkv/codec/protobuf/ProtobufCodec.java
package io.typedkv.codec.protobuf;

import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.Internal;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import io.typedkv.core.codec.Codec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Codec for generated protobuf messages. The serialized size is known up
 * front, so values are written straight into the exact-size buffer.
 * <p>
 * The parser comes from the message class's default instance; parsed messages
 * are checked against {@code type} before they are handed out.
 */
public final class ProtobufCodec<T> implements Codec<T> {
    private final Class<T> type;
    private final Parser<? extends Message> parser;

    public ProtobufCodec(Class<T> type) {
        this.type = Objects.requireNonNull(type, "type");
        if (!Message.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException(type.getName() + " is not a protobuf message");
        }
        Message defaultInstance = Internal.getDefaultInstance(type.asSubclass(Message.class));
        this.parser = defaultInstance.getParserForType();
    }

    @Override
    public OptionalInt trySize(T value) {
        return OptionalInt.of(message(value).getSerializedSize());
    }

    @Override
    public void write(T value, ByteBuffer target) {
        Message message = message(value);
        int size = target.remaining();
        try {
            if (target.hasArray()) {
                CodedOutputStream out = CodedOutputStream.newInstance(
                        target.array(), target.arrayOffset() + target.position(), size);
                message.writeTo(out);
                out.checkNoSpaceLeft();
                target.position(target.limit());
            } else {
                target.put(message.toByteArray());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + message.getDescriptorForType().getFullName(), e);
        }
    }

    @Override
    public T read(ByteBuffer source) {
        try {
            Message message = parser.parseFrom(source);
            source.position(source.limit());
            return type.cast(message);
        } catch (InvalidProtocolBufferException e) {
            throw new UncheckedIOException("Failed to parse protobuf message", e);
        }
    }

    private Message message(T value) {
        return (Message) value;
    }
}
