// file: storage/src/main/java/io/typedkv/storage/engine/StorageEngine.java
package io.typedkv.storage.engine;

/**
 * Byte-level contract of the embedded key-value engine.
 * <p>
 * Semantics:
 *  - Keys and values are passed as (array, length) with offset 0. The engine copies
 *    what it keeps; callers may reuse their arrays as soon as a call returns.
 *  - get() returns null for an absent key, and for a key whose pending merge
 *    operands failed to full-merge.
 *  - merge() records an operand for the column family's merge operator; operands
 *    for one key are applied in submission order.
 *  - All methods are safe to call concurrently against a live handle. Using a
 *    handle after dropColumnFamily() fails with IllegalStateException.
 */
public interface StorageEngine extends AutoCloseable {

    /** Handle for a column family that was opened with the engine, or null. */
    EngineColumnFamily columnFamily(String name);

    EngineColumnFamily createColumnFamily(ColumnFamilyDescriptor descriptor);

    void dropColumnFamily(EngineColumnFamily cf);

    void put(EngineColumnFamily cf, byte[] key, int keyLength, byte[] value, int valueLength);

    byte[] get(EngineColumnFamily cf, byte[] key, int keyLength);

    boolean hasKey(EngineColumnFamily cf, byte[] key, int keyLength);

    void remove(EngineColumnFamily cf, byte[] key, int keyLength);

    void merge(EngineColumnFamily cf, byte[] key, int keyLength, byte[] operand, int operandLength);

    EngineWriteBatch newBatch();

    void write(EngineWriteBatch batch);

    EngineCursor cursor(EngineColumnFamily cf);

    /** Push buffered writes of every column family to durable storage. */
    void flush();

    /** Run a compaction pass; merge operands may be combined or resolved. */
    void compact();

    @Override
    void close();
}
