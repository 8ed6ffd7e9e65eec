// file: storage/src/main/java/io/typedkv/storage/MergeableStore.java
package io.typedkv.storage;

/**
 * Store whose column family has a merge operator.
 * <pre>
 *   public final class CounterStore extends MergeableStore&lt;String, Long, Long&gt; {
 *       public CounterStore(MergeAccessor&lt;String, Long, Long&gt; accessor) { super(accessor); }
 *       public void increment(String key) { merge(key, 1L); }
 *   }
 * </pre>
 */
public abstract class MergeableStore<K, V, O> extends StoreBase<K, V> {
    private final MergeAccessor<K, V, O> mergeAccessor;

    protected MergeableStore(MergeAccessor<K, V, O> accessor) {
        super(accessor);
        this.mergeAccessor = accessor;
    }

    public void merge(K key, O operand) {
        mergeAccessor.merge(key, operand);
    }
}
