package io.typedkv.storage.engine;

/** Puts collected by the caller and applied by {@link StorageEngine#write}. Bytes are copied on add. */
public interface EngineWriteBatch extends AutoCloseable {

    void put(EngineColumnFamily cf, byte[] key, int keyLength, byte[] value, int valueLength);

    int size();

    @Override
    void close();
}
