// file: core/src/main/java/io/typedkv/core/codec/VariableWidthCollectionCodec.java
package io.typedkv.core.codec;

import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Collection layout for elements whose encoded length varies.
 * <p>
 * Layout (little-endian):
 * <pre>
 *   [count:int32]
 *   repeated count times:
 *     [elementSize:int32][elementSize bytes]
 * </pre>
 * If any element cannot be sized, the whole collection cannot be sized and
 * is written through the streaming path instead: each length slot is written
 * as a placeholder and patched once the element has been appended.
 */
public abstract class VariableWidthCollectionCodec<C extends Collection<E>, E> extends CollectionCodec<C, E> {
    private static final int SIZE_BYTES = Integer.BYTES;

    private final Codec<E> elementCodec;

    protected VariableWidthCollectionCodec(Codec<E> elementCodec) {
        this.elementCodec = Objects.requireNonNull(elementCodec, "elementCodec");
    }

    @Override
    public Codec<E> elementCodec() {
        return elementCodec;
    }

    @Override
    public OptionalInt trySize(C value) {
        int size = COUNT_BYTES;
        for (E element : value) {
            OptionalInt elementSize = elementCodec.trySize(element);
            if (elementSize.isEmpty()) {
                return OptionalInt.empty();
            }
            size += SIZE_BYTES + elementSize.getAsInt();
        }
        return OptionalInt.of(size);
    }

    @Override
    public void write(C value, ByteBuffer target) {
        target.putInt(value.size());
        for (E element : value) {
            int elementSize = elementCodec.trySize(element).orElseThrow(() ->
                    new IllegalStateException("element size changed between trySize and write"));
            target.putInt(elementSize);
            elementCodec.write(element, Buffers.window(target, elementSize));
        }
    }

    @Override
    public void write(C value, GrowableBuffer sink) {
        sink.putInt(value.size());
        for (E element : value) {
            int slot = sink.size();
            sink.putInt(0);
            elementCodec.write(element, sink);
            sink.putIntAt(slot, sink.size() - slot - SIZE_BYTES);
        }
    }

    @Override
    public C read(ByteBuffer source) {
        int count = source.getInt();
        C collection = create(count);
        for (int i = 0; i < count; i++) {
            int elementSize = source.getInt();
            addElement(collection, elementCodec.read(Buffers.window(source, elementSize)));
        }
        return collection;
    }
}
