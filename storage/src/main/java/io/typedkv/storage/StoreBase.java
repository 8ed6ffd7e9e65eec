// file: storage/src/main/java/io/typedkv/storage/StoreBase.java
package io.typedkv.storage;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Base for application stores. Subclasses add domain methods on top of the
 * delegated key-value operations.
 * <pre>
 *   public final class UsersStore extends TypedStore&lt;String, User&gt; {
 *       public UsersStore(KeyValueAccessor&lt;String, User&gt; accessor) { super(accessor); }
 *   }
 * </pre>
 */
public abstract class StoreBase<K, V> {
    private final KeyValueAccessor<K, V> accessor;

    protected StoreBase(KeyValueAccessor<K, V> accessor) {
        this.accessor = Objects.requireNonNull(accessor, "accessor");
    }

    public void put(K key, V value) {
        accessor.put(key, value);
    }

    /** Value for {@code key}, or null if absent. */
    public V get(K key) {
        return accessor.get(key);
    }

    public boolean hasKey(K key) {
        return accessor.hasKey(key);
    }

    public void remove(K key) {
        accessor.remove(key);
    }

    public void putRange(List<K> keys, List<V> values) {
        accessor.putRange(keys, values);
    }

    public void putRange(Collection<V> values, Function<V, K> keySelector) {
        accessor.putRange(values, keySelector);
    }

    public void putRange(Collection<Map.Entry<K, V>> entries) {
        accessor.putRange(entries);
    }

    public List<K> getAllKeys() {
        return accessor.getAllKeys();
    }

    public List<V> getAllValues() {
        return accessor.getAllValues();
    }

    public int count() {
        return accessor.count();
    }

    /** Remove every entry by dropping and re-creating the column family. */
    public void clear() {
        accessor.clear();
    }
}
