// file: core/src/main/java/io/typedkv/core/merge/CollectionOperationCodec.java
package io.typedkv.core.merge;

import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.CollectionCodec;
import io.typedkv.core.codec.CollectionCodecs;
import io.typedkv.core.codec.GrowableBuffer;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.OptionalInt;

/**
 * Codec for {@link CollectionOperation}.
 * <p>
 * Layout:
 * <pre>
 *   [tag:1]            0 = ADD, 1 = REMOVE
 *   [list payload]     fixed- or variable-width, chosen from the item codec
 * </pre>
 * If the list cannot be sized, neither can the operand, and the whole operand
 * (tag included) goes through the streaming path.
 */
public final class CollectionOperationCodec<T> implements Codec<CollectionOperation<T>> {
    private static final int TAG_BYTES = 1;

    private final CollectionCodec<List<T>, T> listCodec;

    public CollectionOperationCodec(Codec<T> itemCodec) {
        this.listCodec = CollectionCodecs.listOf(itemCodec);
    }

    @Override
    public OptionalInt trySize(CollectionOperation<T> value) {
        OptionalInt listSize = listCodec.trySize(value.items());
        return listSize.isPresent() ? OptionalInt.of(TAG_BYTES + listSize.getAsInt()) : OptionalInt.empty();
    }

    @Override
    public void write(CollectionOperation<T> value, ByteBuffer target) {
        target.put(value.type().tag());
        listCodec.write(value.items(), target);
    }

    @Override
    public void write(CollectionOperation<T> value, GrowableBuffer sink) {
        sink.put(value.type().tag());
        listCodec.write(value.items(), sink);
    }

    @Override
    public CollectionOperation<T> read(ByteBuffer source) {
        OperationType type = OperationType.fromTag(source.get());
        return new CollectionOperation<>(type, listCodec.read(source));
    }
}
