package io.typedkv.storage.config;

/** Which storage engine a {@link StoreOptions} opens. */
public enum EngineKind {
    ROCKSDB,
    MEMORY
}
