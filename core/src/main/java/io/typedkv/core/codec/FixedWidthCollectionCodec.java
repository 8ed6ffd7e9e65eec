// file: core/src/main/java/io/typedkv/core/codec/FixedWidthCollectionCodec.java
package io.typedkv.core.codec;

import java.nio.ByteBuffer;
import java.util.Collection;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Collection layout for elements that all encode to the same length.
 * <p>
 * Layout (little-endian):
 * <pre>
 *   [count:int32][element 0][element 1]...[element count-1]
 * </pre>
 * An empty collection is just the 4-byte zero count.
 * <p>
 * The element length is taken from the first element and the remaining
 * payload is split evenly by count on write and on read. The element codec
 * must be a {@link FixedWidthCodec}, which is what makes the even split valid.
 */
public abstract class FixedWidthCollectionCodec<C extends Collection<E>, E> extends CollectionCodec<C, E> {
    private final FixedWidthCodec<E> elementCodec;

    protected FixedWidthCollectionCodec(FixedWidthCodec<E> elementCodec) {
        this.elementCodec = Objects.requireNonNull(elementCodec, "elementCodec");
    }

    @Override
    public FixedWidthCodec<E> elementCodec() {
        return elementCodec;
    }

    @Override
    public OptionalInt trySize(C value) {
        int count = value.size();
        if (count == 0) {
            return OptionalInt.of(COUNT_BYTES);
        }
        OptionalInt elementSize = elementCodec.trySize(value.iterator().next());
        if (elementSize.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(COUNT_BYTES + count * elementSize.getAsInt());
    }

    @Override
    public void write(C value, ByteBuffer target) {
        int count = value.size();
        target.putInt(count);
        if (count == 0) {
            return;
        }
        int elementSize = target.remaining() / count;
        for (E element : value) {
            elementCodec.write(element, Buffers.window(target, elementSize));
        }
    }

    @Override
    public void write(C value, GrowableBuffer sink) {
        sink.putInt(value.size());
        for (E element : value) {
            elementCodec.write(element, sink);
        }
    }

    @Override
    public C read(ByteBuffer source) {
        int count = source.getInt();
        C collection = create(count);
        if (count == 0) {
            return collection;
        }
        int elementSize = source.remaining() / count;
        for (int i = 0; i < count; i++) {
            addElement(collection, elementCodec.read(Buffers.window(source, elementSize)));
        }
        return collection;
    }
}
