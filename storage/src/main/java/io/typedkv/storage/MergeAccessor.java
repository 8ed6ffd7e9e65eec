package io.typedkv.storage;

/** {@link KeyValueAccessor} for a column family with a merge operator. */
public interface MergeAccessor<K, V, O> extends KeyValueAccessor<K, V> {

    /**
     * Queue {@code operand} for {@code key}. The operator folds it into the
     * stored value; operands for one key apply in submission order.
     */
    void merge(K key, O operand);
}
