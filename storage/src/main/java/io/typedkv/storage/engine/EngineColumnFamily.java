package io.typedkv.storage.engine;

/**
 * Engine-owned handle to a live column family. Becomes unusable once dropped;
 * callers that need a stable reference go through a swappable holder instead.
 */
public interface EngineColumnFamily {

    ColumnFamilyDescriptor descriptor();

    default String name() {
        return descriptor().name();
    }
}
