// file: storage/src/main/java/io/typedkv/storage/engine/RocksDbEngine.java
package io.typedkv.storage.engine;

import io.typedkv.storage.config.StoreOptions;
import org.rocksdb.BlockBasedTableConfig;
import org.rocksdb.BloomFilter;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.ColumnFamilyOptions;
import org.rocksdb.CompactionStyle;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.FlushOptions;
import org.rocksdb.InfoLogLevel;
import org.rocksdb.LRUCache;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Engine backed by RocksDB through rocksdbjni.
 * <p>
 * Tuning (same for every column family):
 *  - 50 MiB LRU block cache shared by all families, 4 KiB blocks, bloom filter;
 *  - 16 MiB write buffer, at most 3 write buffers;
 *  - no compression, universal compaction;
 *  - background parallelism max(cpus, 2).
 * <p>
 * Merge handling:
 * RocksJava cannot call back into Java from a merge operator, so merges into a
 * family with a merge operator are resolved on the write path: read the current
 * value, full-merge it with the single new operand, write the result. The
 * read-merge-write runs under the family's write lock, which puts, removes and
 * batches into that family also take, so no write slips in between. Batches
 * spanning several merge families lock them in name order.
 * <p>
 * Values in merge families are stored as {@link MergeRecord}s. When a full merge
 * fails the operands are kept in an unresolved record and the key reads as
 * absent until a put or remove replaces it, as on {@link MemoryEngine}.
 */
public final class RocksDbEngine implements StorageEngine {
    private static final Logger log = Logger.getLogger(RocksDbEngine.class.getName());

    private static final long BLOCK_CACHE_BYTES = 50L * 1024 * 1024;
    private static final long BLOCK_SIZE_BYTES = 4 * 1024;
    private static final double BLOOM_BITS_PER_KEY = 10;
    private static final long WRITE_BUFFER_BYTES = 16L * 1024 * 1024;
    private static final int MAX_WRITE_BUFFERS = 3;
    private static final String DEFAULT_FAMILY = new String(RocksDB.DEFAULT_COLUMN_FAMILY, StandardCharsets.UTF_8);

    static {
        RocksDB.loadLibrary();
    }

    private final Path path;
    private final RocksDB db;
    private final DBOptions dbOptions;
    private final LRUCache blockCache;
    private final BloomFilter bloomFilter;
    private final WriteOptions writeOptions;
    private final FlushOptions flushOptions;
    private final Map<String, Family> families = new ConcurrentHashMap<>();
    private final List<Family> unmanaged = new ArrayList<>();

    private static final class Family implements EngineColumnFamily {
        private final ColumnFamilyDescriptor descriptor;
        private final ColumnFamilyHandle handle;
        private final ColumnFamilyOptions options;
        private final ReentrantLock writeLock = new ReentrantLock();
        private volatile boolean dropped;

        Family(ColumnFamilyDescriptor descriptor, ColumnFamilyHandle handle, ColumnFamilyOptions options) {
            this.descriptor = descriptor;
            this.handle = handle;
            this.options = options;
        }

        @Override
        public ColumnFamilyDescriptor descriptor() {
            return descriptor;
        }

        boolean merging() {
            return descriptor.hasMergeOperator();
        }
    }

    private static final class RocksBatch implements EngineWriteBatch {
        private final WriteBatch batch = new WriteBatch();
        // sorted by name: the order their write locks are taken in
        private final Map<String, Family> mergeFamilies = new TreeMap<>();
        private int size;

        @Override
        public void put(EngineColumnFamily cf, byte[] key, int keyLength, byte[] value, int valueLength) {
            Family family = (Family) cf;
            try {
                batch.put(family.handle, exact(key, keyLength), stored(family, value, valueLength));
            } catch (RocksDBException e) {
                throw new StorageException("batch put failed on column family " + family.descriptor.name(), e);
            }
            if (family.merging()) {
                mergeFamilies.put(family.descriptor.name(), family);
            }
            size++;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public void close() {
            batch.close();
        }
    }

    private RocksDbEngine(StoreOptions options, List<ColumnFamilyDescriptor> descriptors) throws RocksDBException {
        this.path = options.path();
        this.blockCache = new LRUCache(BLOCK_CACHE_BYTES);
        this.bloomFilter = new BloomFilter(BLOOM_BITS_PER_KEY);
        this.dbOptions = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true)
                .setIncreaseParallelism(Math.max(Runtime.getRuntime().availableProcessors(), 2))
                .setUseDirectReads(options.useDirectReads())
                .setUseDirectIoForFlushAndCompaction(options.useDirectIoForFlushAndCompaction())
                .setInfoLogLevel(InfoLogLevel.WARN_LEVEL);
        this.writeOptions = new WriteOptions().setDisableWAL(options.disableWal());
        this.flushOptions = new FlushOptions().setWaitForFlush(options.waitForFlush());

        // Default family first, then registered families, then whatever else is on disk.
        Map<String, ColumnFamilyDescriptor> wanted = new LinkedHashMap<>();
        wanted.put(DEFAULT_FAMILY, ColumnFamilyDescriptor.plain(DEFAULT_FAMILY));
        for (ColumnFamilyDescriptor d : descriptors) {
            wanted.put(d.name(), d);
        }
        for (String existing : existingFamilies(path)) {
            wanted.putIfAbsent(existing, ColumnFamilyDescriptor.plain(existing));
        }

        List<org.rocksdb.ColumnFamilyDescriptor> nativeDescriptors = new ArrayList<>();
        List<ColumnFamilyOptions> familyOptions = new ArrayList<>();
        for (ColumnFamilyDescriptor d : wanted.values()) {
            ColumnFamilyOptions cfOptions = newFamilyOptions();
            familyOptions.add(cfOptions);
            nativeDescriptors.add(new org.rocksdb.ColumnFamilyDescriptor(d.name().getBytes(StandardCharsets.UTF_8), cfOptions));
        }

        List<ColumnFamilyHandle> handles = new ArrayList<>();
        this.db = RocksDB.open(dbOptions, path.toString(), nativeDescriptors, handles);

        int i = 0;
        for (ColumnFamilyDescriptor d : wanted.values()) {
            var family = new Family(d, handles.get(i), familyOptions.get(i));
            i++;
            if (d.name().equals(DEFAULT_FAMILY) && !descriptors.contains(d)) {
                unmanaged.add(family);
            } else {
                families.put(d.name(), family);
            }
        }
        log.log(Level.INFO, "Opened RocksDB at " + path + " with column families " + families.keySet());
    }

    /**
     * Open (creating if needed) the database under {@code options.path()}.
     * Column families in {@code descriptors} are created when missing.
     */
    public static RocksDbEngine open(StoreOptions options, List<ColumnFamilyDescriptor> descriptors) {
        try {
            Files.createDirectories(options.path());
            if (options.deleteExistingDatabaseOnStartup()) {
                destroy(options.path());
            }
            return new RocksDbEngine(options, descriptors);
        } catch (IOException e) {
            throw new StorageException("Failed to create database directory " + options.path(), e);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to open RocksDB at " + options.path(), e);
        }
    }

    @Override
    public EngineColumnFamily columnFamily(String name) {
        return families.get(name);
    }

    @Override
    public EngineColumnFamily createColumnFamily(ColumnFamilyDescriptor descriptor) {
        if (families.containsKey(descriptor.name())) {
            throw new IllegalStateException("column family " + descriptor.name() + " already exists");
        }
        ColumnFamilyOptions cfOptions = newFamilyOptions();
        try {
            ColumnFamilyHandle handle = db.createColumnFamily(
                    new org.rocksdb.ColumnFamilyDescriptor(descriptor.name().getBytes(StandardCharsets.UTF_8), cfOptions));
            var family = new Family(descriptor, handle, cfOptions);
            families.put(descriptor.name(), family);
            return family;
        } catch (RocksDBException e) {
            cfOptions.close();
            throw new StorageException("create failed for column family " + descriptor.name(), e);
        }
    }

    @Override
    public void dropColumnFamily(EngineColumnFamily cf) {
        Family family = live(cf);
        try {
            db.dropColumnFamily(family.handle);
        } catch (RocksDBException e) {
            throw new StorageException("drop failed for column family " + family.descriptor.name(), e);
        }
        family.dropped = true;
        families.remove(family.descriptor.name(), family);
        family.handle.close();
        family.options.close();
    }

    @Override
    public void put(EngineColumnFamily cf, byte[] key, int keyLength, byte[] value, int valueLength) {
        Family family = live(cf);
        byte[] k = exact(key, keyLength);
        byte[] v = stored(family, value, valueLength);
        lockIfMerging(family);
        try {
            db.put(family.handle, writeOptions, k, v);
        } catch (RocksDBException e) {
            throw new StorageException("put failed on column family " + family.descriptor.name(), e);
        } finally {
            unlockIfMerging(family);
        }
    }

    @Override
    public byte[] get(EngineColumnFamily cf, byte[] key, int keyLength) {
        Family family = live(cf);
        try {
            byte[] stored = db.get(family.handle, exact(key, keyLength));
            if (stored == null || !family.merging()) {
                return stored;
            }
            MergeRecord record = MergeRecord.decode(stored);
            return record.resolved() ? record.base() : null;
        } catch (RocksDBException e) {
            throw new StorageException("get failed on column family " + family.descriptor.name(), e);
        }
    }

    @Override
    public boolean hasKey(EngineColumnFamily cf, byte[] key, int keyLength) {
        return get(cf, key, keyLength) != null;
    }

    @Override
    public void remove(EngineColumnFamily cf, byte[] key, int keyLength) {
        Family family = live(cf);
        byte[] k = exact(key, keyLength);
        lockIfMerging(family);
        try {
            db.delete(family.handle, writeOptions, k);
        } catch (RocksDBException e) {
            throw new StorageException("remove failed on column family " + family.descriptor.name(), e);
        } finally {
            unlockIfMerging(family);
        }
    }

    @Override
    public void merge(EngineColumnFamily cf, byte[] key, int keyLength, byte[] operand, int operandLength) {
        Family family = live(cf);
        MergeOperatorConfig op = family.descriptor.mergeOperator();
        if (op == null) {
            throw new IllegalStateException("column family " + family.descriptor.name() + " has no merge operator");
        }
        byte[] k = exact(key, keyLength);
        byte[] o = exact(operand, operandLength);

        family.writeLock.lock();
        try {
            MergeRecord pending = MergeRecord.decode(db.get(family.handle, k)).withOperand(o);
            MergeOutcome outcome = op.fullMerge().fullMerge(k, pending.base(), pending.operands());
            if (outcome instanceof MergeOutcome.Merged merged) {
                db.put(family.handle, writeOptions, k, MergeRecord.resolved(merged.value()));
            } else {
                db.put(family.handle, writeOptions, k, pending.encodeUnresolved());
                log.log(Level.WARNING, "Merge with operator " + op.name() + " failed on column family "
                        + family.descriptor.name() + "; key reads as absent with "
                        + pending.operands().size() + " operands kept");
            }
        } catch (RocksDBException e) {
            throw new StorageException("merge failed on column family " + family.descriptor.name(), e);
        } finally {
            family.writeLock.unlock();
        }
    }

    @Override
    public EngineWriteBatch newBatch() {
        return new RocksBatch();
    }

    @Override
    public void write(EngineWriteBatch batch) {
        var rocksBatch = (RocksBatch) batch;
        List<Family> locked = new ArrayList<>(rocksBatch.mergeFamilies.size());
        try {
            for (Family family : rocksBatch.mergeFamilies.values()) {
                family.writeLock.lock();
                locked.add(family);
            }
            db.write(writeOptions, rocksBatch.batch);
        } catch (RocksDBException e) {
            throw new StorageException("batch write of " + rocksBatch.size + " entries failed", e);
        } finally {
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).writeLock.unlock();
            }
        }
    }

    @Override
    public EngineCursor cursor(EngineColumnFamily cf) {
        Family family = live(cf);
        RocksIterator it = db.newIterator(family.handle);
        it.seekToFirst();
        return new EngineCursor() {
            private boolean started;
            private byte[] key;
            private byte[] value;

            @Override
            public boolean next() {
                while (true) {
                    if (started) {
                        it.next();
                    }
                    started = true;
                    if (!it.isValid()) {
                        key = null;
                        value = null;
                        checkStatus();
                        return false;
                    }
                    byte[] stored = it.value();
                    if (family.merging()) {
                        MergeRecord record = MergeRecord.decode(stored);
                        if (!record.resolved()) continue;
                        stored = record.base();
                    }
                    key = it.key();
                    value = stored;
                    return true;
                }
            }

            private void checkStatus() {
                try {
                    it.status();
                } catch (RocksDBException e) {
                    throw new StorageException("iteration failed on column family " + family.descriptor.name(), e);
                }
            }

            @Override
            public byte[] key() {
                return key;
            }

            @Override
            public byte[] value() {
                return value;
            }

            @Override
            public void close() {
                it.close();
            }
        };
    }

    @Override
    public void flush() {
        for (Family family : families.values()) {
            try {
                db.flush(flushOptions, family.handle);
            } catch (RocksDBException e) {
                throw new StorageException("flush failed on column family " + family.descriptor.name(), e);
            }
        }
    }

    @Override
    public void compact() {
        for (Family family : families.values()) {
            try {
                db.compactRange(family.handle);
            } catch (RocksDBException e) {
                throw new StorageException("compaction failed on column family " + family.descriptor.name(), e);
            }
        }
    }

    @Override
    public void close() {
        List<Family> all = new ArrayList<>(families.values());
        all.addAll(unmanaged);
        families.clear();
        for (Family f : all) {
            f.dropped = true;
            f.handle.close();
        }
        db.close();
        for (Family f : all) {
            f.options.close();
        }
        writeOptions.close();
        flushOptions.close();
        dbOptions.close();
        bloomFilter.close();
        blockCache.close();
        log.log(Level.INFO, "Closed RocksDB at " + path);
    }

    // ----------------- helpers -----------------

    private ColumnFamilyOptions newFamilyOptions() {
        BlockBasedTableConfig table = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setBlockSize(BLOCK_SIZE_BYTES)
                .setFilterPolicy(bloomFilter);
        return new ColumnFamilyOptions()
                .setTableFormatConfig(table)
                .setWriteBufferSize(WRITE_BUFFER_BYTES)
                .setMaxWriteBufferNumber(MAX_WRITE_BUFFERS)
                .setCompressionType(CompressionType.NO_COMPRESSION)
                .setCompactionStyle(CompactionStyle.UNIVERSAL);
    }

    private Family live(EngineColumnFamily cf) {
        Family family = (Family) cf;
        if (family.dropped) {
            throw new IllegalStateException("column family " + family.descriptor.name() + " was dropped");
        }
        return family;
    }

    private static void lockIfMerging(Family family) {
        if (family.merging()) family.writeLock.lock();
    }

    private static void unlockIfMerging(Family family) {
        if (family.merging()) family.writeLock.unlock();
    }

    /** Bytes to store for a put: merge families wrap the value in a resolved record. */
    private static byte[] stored(Family family, byte[] value, int valueLength) {
        if (family.merging()) {
            return MergeRecord.resolved(Arrays.copyOf(value, valueLength));
        }
        return exact(value, valueLength);
    }

    private static byte[] exact(byte[] array, int length) {
        return array.length == length ? array : Arrays.copyOf(array, length);
    }

    private static List<String> existingFamilies(Path path) throws RocksDBException {
        if (!Files.exists(path.resolve("CURRENT"))) {
            return List.of();
        }
        try (Options options = new Options()) {
            return RocksDB.listColumnFamilies(options, path.toString()).stream()
                    .map(name -> new String(name, StandardCharsets.UTF_8))
                    .toList();
        }
    }

    private static void destroy(Path path) throws RocksDBException {
        if (!Files.exists(path.resolve("CURRENT"))) {
            return;
        }
        try (Options options = new Options()) {
            RocksDB.destroyDB(path.toString(), options);
        }
        log.log(Level.INFO, "Deleted existing database at " + path);
    }
}
