// file: storage/src/main/java/io/typedkv/storage/KeyValueAccessor.java
package io.typedkv.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Typed operations on one column family.
 * <p>
 * Semantics:
 *  - put() overwrites; get() returns null for an absent key.
 *  - putRange() writes every pair in one atomic engine batch.
 *  - getAllKeys() / getAllValues() / count() walk the family in unsigned byte
 *    order of the encoded keys.
 *  - clear() drops and re-creates the family; codecs and merge operator stay bound.
 */
public interface KeyValueAccessor<K, V> {

    void put(K key, V value);

    V get(K key);

    boolean hasKey(K key);

    void remove(K key);

    /** @throws IllegalArgumentException if the lists differ in size */
    void putRange(List<K> keys, List<V> values);

    void putRange(Collection<V> values, Function<V, K> keySelector);

    void putRange(Collection<Map.Entry<K, V>> entries);

    List<K> getAllKeys();

    List<V> getAllValues();

    int count();

    void clear();
}
