package io.typedkv.codec.protobuf;

import com.google.protobuf.Int64Value;
import com.google.protobuf.StringValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Timestamp;
import com.google.protobuf.Value;
import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.CodecRegistry;
import io.typedkv.core.codec.CollectionCodecs;
import io.typedkv.core.codec.GrowableBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProtobufCodecTest {

    private final CodecRegistry registry = new CodecRegistry(List.of(new ProtobufCodecFactory()));

    private static <T> byte[] encodeExact(Codec<T> codec, T value) {
        byte[] out = new byte[codec.trySize(value).getAsInt()];
        ByteBuffer target = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);
        codec.write(value, target);
        assertFalse(target.hasRemaining());
        return out;
    }

    @Test
    void size_is_the_serialized_size_and_bytes_are_standard_wire_format() {
        Codec<Timestamp> codec = registry.codecFor(Timestamp.class);
        var ts = Timestamp.newBuilder().setSeconds(1_700_000_000L).setNanos(42).build();

        byte[] bytes = encodeExact(codec, ts);
        assertEquals(ts.getSerializedSize(), bytes.length);
        assertArrayEquals(ts.toByteArray(), bytes);
        assertEquals(ts, codec.read(ByteBuffer.wrap(bytes)));
    }

    @Test
    void default_message_encodes_to_zero_bytes() {
        Codec<Int64Value> codec = registry.codecFor(Int64Value.class);
        byte[] bytes = encodeExact(codec, Int64Value.getDefaultInstance());
        assertEquals(0, bytes.length);
        assertEquals(Int64Value.getDefaultInstance(), codec.read(ByteBuffer.wrap(bytes)));
    }

    @Test
    void messages_inside_collections_write_at_slice_offsets() {
        var list = CollectionCodecs.listOf(registry.codecFor(StringValue.class));
        List<StringValue> value = List.of(StringValue.of("first"), StringValue.of(""), StringValue.of("third"));

        byte[] exact = encodeExact(list, value);
        try (var sink = new GrowableBuffer()) {
            list.write(value, sink);
            assertArrayEquals(exact, sink.toByteArray());
        }
        assertEquals(value, list.read(ByteBuffer.wrap(exact).order(ByteOrder.LITTLE_ENDIAN)));
    }

    @Test
    void nested_messages_round_trip() {
        Codec<Struct> codec = registry.codecFor(Struct.class);
        var struct = Struct.newBuilder()
                .putFields("name", Value.newBuilder().setStringValue("typedkv").build())
                .putFields("size", Value.newBuilder().setNumberValue(3).build())
                .build();

        assertEquals(struct, codec.read(ByteBuffer.wrap(encodeExact(codec, struct))));
    }

    @Test
    void factory_accepts_only_messages() {
        var factory = new ProtobufCodecFactory();
        assertTrue(factory.canCreate(Timestamp.class));
        assertFalse(factory.canCreate(String.class));
        assertThrows(IllegalArgumentException.class, () -> factory.create(String.class));
    }
}
