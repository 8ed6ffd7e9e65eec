// file: core/src/main/java/io/typedkv/core/codec/CollectionCodecs.java
package io.typedkv.core.codec;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point for list and set codecs.
 * <p>
 * The layout is picked once, here, from the element codec:
 *  - {@link FixedWidthCodec} elements  -> fixed-width layout
 *  - anything else                     -> variable-width layout
 * <p>
 * The two layouts are not interchangeable; bytes written with one must be read
 * with the same one.
 */
public final class CollectionCodecs {

    private CollectionCodecs() {
        // factory
    }

    public static <E> CollectionCodec<List<E>, E> listOf(Codec<E> elementCodec) {
        if (elementCodec instanceof FixedWidthCodec<E> fixed) {
            return new FixedWidthList<>(fixed);
        }
        return new VariableWidthList<>(elementCodec);
    }

    public static <E> CollectionCodec<Set<E>, E> setOf(Codec<E> elementCodec) {
        if (elementCodec instanceof FixedWidthCodec<E> fixed) {
            return new FixedWidthSet<>(fixed);
        }
        return new VariableWidthSet<>(elementCodec);
    }

    /** Variable-width list regardless of the element codec. */
    public static <E> CollectionCodec<List<E>, E> variableWidthListOf(Codec<E> elementCodec) {
        return new VariableWidthList<>(elementCodec);
    }

    static final class FixedWidthList<E> extends FixedWidthCollectionCodec<List<E>, E> {
        FixedWidthList(FixedWidthCodec<E> elementCodec) { super(elementCodec); }
        @Override protected List<E> create(int capacity) { return new ArrayList<>(capacity); }
        @Override protected void addElement(List<E> collection, E element) { collection.add(element); }
    }

    static final class FixedWidthSet<E> extends FixedWidthCollectionCodec<Set<E>, E> {
        FixedWidthSet(FixedWidthCodec<E> elementCodec) { super(elementCodec); }
        @Override protected Set<E> create(int capacity) { return new LinkedHashSet<>(capacity); }
        @Override protected void addElement(Set<E> collection, E element) { collection.add(element); }
    }

    static final class VariableWidthList<E> extends VariableWidthCollectionCodec<List<E>, E> {
        VariableWidthList(Codec<E> elementCodec) { super(elementCodec); }
        @Override protected List<E> create(int capacity) { return new ArrayList<>(capacity); }
        @Override protected void addElement(List<E> collection, E element) { collection.add(element); }
    }

    static final class VariableWidthSet<E> extends VariableWidthCollectionCodec<Set<E>, E> {
        VariableWidthSet(Codec<E> elementCodec) { super(elementCodec); }
        @Override protected Set<E> create(int capacity) { return new LinkedHashSet<>(capacity); }
        @Override protected void addElement(Set<E> collection, E element) { collection.add(element); }
    }
}
