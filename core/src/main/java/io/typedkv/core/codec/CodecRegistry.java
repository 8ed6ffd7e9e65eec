// file: core/src/main/java/io/typedkv/core/codec/CodecRegistry.java
package io.typedkv.core.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered set of codec factories, resolved at store registration time.
 * <p>
 * Resolution rules:
 *  - factories are asked in registration order; the scalar factory is always first;
 *  - the first factory whose canCreate() answers true wins;
 *  - no factory at all -> {@link CodecNotFoundException}, so a store that
 *    cannot be encoded fails while it is being wired, not on first use.
 */
public final class CodecRegistry {
    private final List<CodecFactory> factories;

    public CodecRegistry(List<CodecFactory> extraFactories) {
        var all = new ArrayList<CodecFactory>(extraFactories.size() + 1);
        all.add(new ScalarCodecFactory());
        all.addAll(extraFactories);
        this.factories = List.copyOf(all);
    }

    public static CodecRegistry scalarOnly() {
        return new CodecRegistry(List.of());
    }

    public <T> Codec<T> codecFor(Class<T> type) {
        Objects.requireNonNull(type, "type");
        for (CodecFactory factory : factories) {
            if (factory.canCreate(type)) {
                return factory.create(type);
            }
        }
        throw new CodecNotFoundException(type);
    }

    public <E> CollectionCodec<List<E>, E> listOf(Class<E> elementType) {
        return CollectionCodecs.listOf(codecFor(elementType));
    }

    public <E> CollectionCodec<Set<E>, E> setOf(Class<E> elementType) {
        return CollectionCodecs.setOf(codecFor(elementType));
    }
}
