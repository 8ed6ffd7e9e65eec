package io.typedkv.core.codec;

import java.util.Collection;

/**
 * Shared shape of the collection codecs: an element codec plus the two hooks
 * that decide which concrete collection is rebuilt on read.
 *
 * @param <C> collection type produced on read
 * @param <E> element type
 */
public abstract class CollectionCodec<C extends Collection<E>, E> implements Codec<C> {

    /** Bytes used by the leading element count. */
    protected static final int COUNT_BYTES = Integer.BYTES;

    /** Create an empty collection able to hold {@code capacity} elements. */
    protected abstract C create(int capacity);

    protected abstract void addElement(C collection, E element);

    public abstract Codec<E> elementCodec();
}
