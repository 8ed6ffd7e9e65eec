package io.typedkv.core.codec;

/**
 * Produces codecs for the types it understands.
 * <p>
 * Factories are consulted once per type, when a store is registered. They are
 * never on the per-call path.
 */
public interface CodecFactory {

    boolean canCreate(Class<?> type);

    /** Only called after {@link #canCreate} returned true for {@code type}. */
    <T> Codec<T> create(Class<T> type);
}
