package io.typedkv.core.codec;

import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.OptionalInt;

import static io.typedkv.core.codec.CodecTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

class CodecRegistryTest {

    record Point(int x, int y) {}

    static final class PointCodec implements FixedWidthCodec<Point> {
        @Override public int fixedSize() { return 8; }
        @Override public void write(Point value, ByteBuffer target) { target.putInt(value.x()).putInt(value.y()); }
        @Override public Point read(ByteBuffer source) { return new Point(source.getInt(), source.getInt()); }
    }

    static final class PointFactory implements CodecFactory {
        @Override public boolean canCreate(Class<?> type) { return type == Point.class; }

        @Override
        @SuppressWarnings("unchecked")
        public <T> Codec<T> create(Class<T> type) {
            return (Codec<T>) new PointCodec();
        }
    }

    @Test
    void scalars_resolve_for_boxed_and_primitive_types() {
        var registry = CodecRegistry.scalarOnly();
        assertSame(ScalarCodecs.INT, registry.codecFor(Integer.class));
        assertSame(ScalarCodecs.LONG, registry.codecFor(long.class));
        assertSame(ScalarCodecs.STRING, registry.codecFor(String.class));
        assertSame(ScalarCodecs.BYTES, registry.codecFor(byte[].class));
    }

    @Test
    void unknown_type_fails_with_codec_not_found() {
        var registry = CodecRegistry.scalarOnly();
        var e = assertThrows(CodecNotFoundException.class, () -> registry.codecFor(Point.class));
        assertTrue(e.getMessage().contains("Point"));
    }

    @Test
    void extra_factory_codecs_work_inside_collections() {
        var registry = new CodecRegistry(List.of(new PointFactory()));
        var points = registry.listOf(Point.class);
        List<Point> value = List.of(new Point(1, 2), new Point(3, 4));

        assertInstanceOf(FixedWidthCollectionCodec.class, points);
        assertEquals(OptionalInt.of(4 + 16), points.trySize(value));
        assertEquals(value, decode(points, encodeExact(points, value)));
    }

    @Test
    void scalar_factory_wins_over_later_factories() {
        CodecFactory greedy = new CodecFactory() {
            @Override public boolean canCreate(Class<?> type) { return true; }
            @Override public <T> Codec<T> create(Class<T> type) { throw new AssertionError("should not be asked"); }
        };
        var registry = new CodecRegistry(List.of(greedy));
        assertSame(ScalarCodecs.STRING, registry.codecFor(String.class));
    }
}
