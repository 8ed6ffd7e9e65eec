// file: storage/src/main/java/io/typedkv/storage/StoreContext.java
package io.typedkv.storage;

import io.typedkv.storage.engine.StorageEngine;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * An open engine plus the stores registered on it. Closing the context closes
 * the engine; stores must not be used afterwards.
 */
public final class StoreContext implements AutoCloseable {
    private final StorageEngine engine;
    private final Map<String, Object> stores;

    StoreContext(StorageEngine engine, Map<String, Object> storesByColumnFamily) {
        this.engine = engine;
        this.stores = new LinkedHashMap<>();
        storesByColumnFamily.forEach((cf, store) -> stores.put(cf.toLowerCase(Locale.ROOT), store));
    }

    /** First registered store of the given type. */
    public <S> S getStore(Class<S> type) {
        for (Object store : stores.values()) {
            if (type.isInstance(store)) {
                return type.cast(store);
            }
        }
        throw new IllegalStateException("no store of type " + type.getName() + " is registered");
    }

    /** Store registered on {@code columnFamily}; for several stores of one type. */
    public <S> S getStore(Class<S> type, String columnFamily) {
        Object store = stores.get(columnFamily.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalStateException("no store is registered on column family " + columnFamily);
        }
        if (!type.isInstance(store)) {
            throw new IllegalStateException("store on column family " + columnFamily + " is a "
                    + store.getClass().getName() + ", not a " + type.getName());
        }
        return type.cast(store);
    }

    public StorageEngine engine() {
        return engine;
    }

    public void flush() {
        engine.flush();
    }

    public void compact() {
        engine.compact();
    }

    @Override
    public void close() {
        engine.close();
    }
}
