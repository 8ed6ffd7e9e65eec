// file: storage/src/main/java/io/typedkv/storage/engine/MemoryEngine.java
package io.typedkv.storage.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process engine that follows the merge callback protocol the way an LSM
 * engine does, without any of the on-disk machinery.
 * <p>
 * Per key state:
 *  - Value:   a base value and no operands;
 *  - Pending: an optional base value plus merge operands, oldest first.
 * <p>
 * Resolution:
 *  - get() and cursors full-merge pending operands on the fly and do not store
 *    the result; a failed full merge makes the key read as absent.
 *  - compact() full-merges keys that have a base value and partial-merges
 *    operand-only keys. Failed outcomes leave the key untouched.
 * <p>
 * Nothing is persisted; the path in the store options is ignored.
 */
public final class MemoryEngine implements StorageEngine {
    private static final Logger log = Logger.getLogger(MemoryEngine.class.getName());
    private static final Comparator<byte[]> KEY_ORDER = Arrays::compareUnsigned;

    private final Map<String, Family> families = new ConcurrentHashMap<>();

    public MemoryEngine(List<ColumnFamilyDescriptor> descriptors) {
        for (ColumnFamilyDescriptor d : descriptors) {
            createColumnFamily(d);
        }
        log.log(Level.INFO, "Opened in-memory engine with column families " + families.keySet());
    }

    /** A stored key. base is null when the key has only operands. */
    private record Slot(byte[] base, List<byte[]> operands) {
        static Slot value(byte[] value) {
            return new Slot(value, List.of());
        }

        boolean pending() {
            return !operands.isEmpty();
        }

        Slot withOperand(byte[] operand) {
            var next = new ArrayList<byte[]>(operands.size() + 1);
            next.addAll(operands);
            next.add(operand);
            return new Slot(base, List.copyOf(next));
        }
    }

    private static final class Family implements EngineColumnFamily {
        private final ColumnFamilyDescriptor descriptor;
        private final ConcurrentSkipListMap<byte[], Slot> entries = new ConcurrentSkipListMap<>(KEY_ORDER);
        private volatile boolean dropped;

        Family(ColumnFamilyDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        @Override
        public ColumnFamilyDescriptor descriptor() {
            return descriptor;
        }
    }

    private static final class MemoryBatch implements EngineWriteBatch {
        private record Put(Family family, byte[] key, byte[] value) {}

        private final List<Put> puts = new ArrayList<>();

        @Override
        public void put(EngineColumnFamily cf, byte[] key, int keyLength, byte[] value, int valueLength) {
            puts.add(new Put((Family) cf, Arrays.copyOf(key, keyLength), Arrays.copyOf(value, valueLength)));
        }

        @Override
        public int size() {
            return puts.size();
        }

        @Override
        public void close() {
            puts.clear();
        }
    }

    @Override
    public EngineColumnFamily columnFamily(String name) {
        return families.get(name);
    }

    @Override
    public EngineColumnFamily createColumnFamily(ColumnFamilyDescriptor descriptor) {
        var family = new Family(descriptor);
        if (families.putIfAbsent(descriptor.name(), family) != null) {
            throw new IllegalStateException("column family " + descriptor.name() + " already exists");
        }
        return family;
    }

    @Override
    public void dropColumnFamily(EngineColumnFamily cf) {
        Family family = live(cf);
        family.dropped = true;
        families.remove(family.descriptor.name(), family);
        family.entries.clear();
    }

    @Override
    public void put(EngineColumnFamily cf, byte[] key, int keyLength, byte[] value, int valueLength) {
        live(cf).entries.put(Arrays.copyOf(key, keyLength), Slot.value(Arrays.copyOf(value, valueLength)));
    }

    @Override
    public byte[] get(EngineColumnFamily cf, byte[] key, int keyLength) {
        Family family = live(cf);
        byte[] k = Arrays.copyOf(key, keyLength);
        Slot slot = family.entries.get(k);
        return slot == null ? null : resolve(family, k, slot);
    }

    @Override
    public boolean hasKey(EngineColumnFamily cf, byte[] key, int keyLength) {
        return get(cf, key, keyLength) != null;
    }

    @Override
    public void remove(EngineColumnFamily cf, byte[] key, int keyLength) {
        live(cf).entries.remove(Arrays.copyOf(key, keyLength));
    }

    @Override
    public void merge(EngineColumnFamily cf, byte[] key, int keyLength, byte[] operand, int operandLength) {
        Family family = live(cf);
        if (!family.descriptor.hasMergeOperator()) {
            throw new IllegalStateException("column family " + family.descriptor.name() + " has no merge operator");
        }
        byte[] op = Arrays.copyOf(operand, operandLength);
        family.entries.compute(Arrays.copyOf(key, keyLength),
                (k, slot) -> slot == null ? new Slot(null, List.of(op)) : slot.withOperand(op));
    }

    @Override
    public EngineWriteBatch newBatch() {
        return new MemoryBatch();
    }

    /** Applies puts in order. Readers may observe a partially applied batch. */
    @Override
    public void write(EngineWriteBatch batch) {
        var memoryBatch = (MemoryBatch) batch;
        for (MemoryBatch.Put put : memoryBatch.puts) {
            live(put.family()).entries.put(put.key(), Slot.value(put.value()));
        }
    }

    @Override
    public EngineCursor cursor(EngineColumnFamily cf) {
        Family family = live(cf);
        Iterator<Map.Entry<byte[], Slot>> it = family.entries.entrySet().iterator();
        return new EngineCursor() {
            private byte[] key;
            private byte[] value;

            @Override
            public boolean next() {
                while (it.hasNext()) {
                    Map.Entry<byte[], Slot> e = it.next();
                    byte[] resolved = resolve(family, e.getKey(), e.getValue());
                    if (resolved != null) {
                        key = Arrays.copyOf(e.getKey(), e.getKey().length);
                        value = resolved;
                        return true;
                    }
                }
                key = null;
                value = null;
                return false;
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
                key = null;
                value = null;
            }
        };
    }

    @Override
    public void flush() {
        // nothing is buffered
    }

    @Override
    public void compact() {
        for (Family family : families.values()) {
            MergeOperatorConfig op = family.descriptor.mergeOperator();
            if (op == null) continue;

            for (Map.Entry<byte[], Slot> e : family.entries.entrySet()) {
                Slot slot = e.getValue();
                if (!slot.pending()) continue;

                Slot compacted = slot.base() != null
                        ? fullMergeForCompaction(op, e.getKey(), slot)
                        : partialMergeForCompaction(op, e.getKey(), slot);
                if (compacted != null) {
                    // A concurrent merge() replaced the slot: keep the newer one.
                    family.entries.replace(e.getKey(), slot, compacted);
                }
            }
        }
    }

    /** Number of merge operands still waiting for a key; for diagnostics and tests. */
    public int pendingOperands(EngineColumnFamily cf, byte[] key) {
        Slot slot = live(cf).entries.get(key);
        return slot == null ? 0 : slot.operands().size();
    }

    @Override
    public void close() {
        for (Family f : families.values()) {
            f.dropped = true;
        }
        families.clear();
        log.log(Level.INFO, "Closed in-memory engine");
    }

    // ----------------- helpers -----------------

    private Family live(EngineColumnFamily cf) {
        Family family = (Family) cf;
        if (family.dropped) {
            throw new IllegalStateException("column family " + family.descriptor.name() + " was dropped");
        }
        return family;
    }

    private static byte[] resolve(Family family, byte[] key, Slot slot) {
        if (!slot.pending()) {
            return Arrays.copyOf(slot.base(), slot.base().length);
        }
        MergeOutcome outcome = family.descriptor.mergeOperator().fullMerge().fullMerge(key, slot.base(), slot.operands());
        if (outcome instanceof MergeOutcome.Merged merged) {
            return merged.value();
        }
        return null;
    }

    private static Slot fullMergeForCompaction(MergeOperatorConfig op, byte[] key, Slot slot) {
        MergeOutcome outcome = op.fullMerge().fullMerge(key, slot.base(), slot.operands());
        if (outcome instanceof MergeOutcome.Merged merged) {
            return Slot.value(merged.value());
        }
        log.log(Level.WARNING, "Full merge failed during compaction with operator " + op.name()
                + "; keeping " + slot.operands().size() + " operands");
        return null;
    }

    private static Slot partialMergeForCompaction(MergeOperatorConfig op, byte[] key, Slot slot) {
        if (slot.operands().size() < 2) return null;
        MergeOutcome outcome = op.partialMerge().partialMerge(key, slot.operands());
        if (outcome instanceof MergeOutcome.Merged merged) {
            return new Slot(null, List.of(merged.value()));
        }
        return null;
    }
}
