package io.typedkv.storage;

/** Plain key-value store; extend it to give a column family a domain API. */
public abstract class TypedStore<K, V> extends StoreBase<K, V> {

    protected TypedStore(KeyValueAccessor<K, V> accessor) {
        super(accessor);
    }
}
