// file: core/src/main/java/io/typedkv/core/codec/Codec.java
package io.typedkv.core.codec;

import java.nio.ByteBuffer;
import java.util.OptionalInt;

/**
 * Size / write / read contract for one type.
 * <p>
 * Buffer rules:
 *  - All buffers are little-endian.
 *  - write(value, target): target.remaining() equals trySize(value). The codec
 *    writes exactly that many bytes and leaves target.position() at the limit.
 *  - read(source): the codec consumes every remaining byte of source. The length
 *    is supplied from outside; nothing in the encoding says which type it is.
 * <p>
 * Reading bytes that were not produced by the same codec is undefined.
 *
 * @param <T> the encoded type
 */
public interface Codec<T> {

    /**
     * Exact encoded length of {@code value}, or empty when the codec can only
     * stream its output. Must not have side effects.
     */
    OptionalInt trySize(T value);

    /** Write into a buffer sized exactly as reported by {@link #trySize}. */
    void write(T value, ByteBuffer target);

    /**
     * Append to a growable sink. Used when trySize() is empty, or by a parent
     * codec that is itself streaming.
     */
    default void write(T value, GrowableBuffer sink) {
        int size = trySize(value).orElseThrow(() ->
                new IllegalStateException(getClass().getSimpleName() + " cannot size value but has no streaming write"));
        write(value, sink.reserve(size));
    }

    T read(ByteBuffer source);
}
