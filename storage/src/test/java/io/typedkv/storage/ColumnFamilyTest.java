package io.typedkv.storage;

import io.typedkv.storage.engine.ColumnFamilyDescriptor;
import io.typedkv.storage.engine.EngineColumnFamily;
import io.typedkv.storage.engine.EngineCursor;
import io.typedkv.storage.engine.EngineWriteBatch;
import io.typedkv.storage.engine.MemoryEngine;
import io.typedkv.storage.engine.StorageEngine;
import io.typedkv.storage.engine.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ColumnFamilyTest {

    private static final byte[] KEY = {'k'};
    private static final byte[] VALUE = {1};

    /** Memory engine whose next createColumnFamily() calls fail. */
    static final class FailingCreateEngine implements StorageEngine {
        private final MemoryEngine delegate;
        int failuresLeft;
        int drops;

        FailingCreateEngine(List<ColumnFamilyDescriptor> descriptors) {
            this.delegate = new MemoryEngine(descriptors);
        }

        @Override public EngineColumnFamily columnFamily(String name) { return delegate.columnFamily(name); }

        @Override
        public EngineColumnFamily createColumnFamily(ColumnFamilyDescriptor descriptor) {
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new StorageException("create failed for column family " + descriptor.name(), new RuntimeException("disk full"));
            }
            return delegate.createColumnFamily(descriptor);
        }

        @Override
        public void dropColumnFamily(EngineColumnFamily cf) {
            drops++;
            delegate.dropColumnFamily(cf);
        }

        @Override public void put(EngineColumnFamily cf, byte[] k, int kl, byte[] v, int vl) { delegate.put(cf, k, kl, v, vl); }
        @Override public byte[] get(EngineColumnFamily cf, byte[] k, int kl) { return delegate.get(cf, k, kl); }
        @Override public boolean hasKey(EngineColumnFamily cf, byte[] k, int kl) { return delegate.hasKey(cf, k, kl); }
        @Override public void remove(EngineColumnFamily cf, byte[] k, int kl) { delegate.remove(cf, k, kl); }
        @Override public void merge(EngineColumnFamily cf, byte[] k, int kl, byte[] o, int ol) { delegate.merge(cf, k, kl, o, ol); }
        @Override public EngineWriteBatch newBatch() { return delegate.newBatch(); }
        @Override public void write(EngineWriteBatch batch) { delegate.write(batch); }
        @Override public EngineCursor cursor(EngineColumnFamily cf) { return delegate.cursor(cf); }
        @Override public void flush() { delegate.flush(); }
        @Override public void compact() { delegate.compact(); }
        @Override public void close() { delegate.close(); }
    }

    private final ColumnFamilyDescriptor descriptor = ColumnFamilyDescriptor.plain("cf");
    private final FailingCreateEngine engine = new FailingCreateEngine(List.of(descriptor));
    private final ColumnFamily family = new ColumnFamily(engine, descriptor, engine.columnFamily("cf"));

    @AfterEach
    void close() {
        engine.close();
    }

    private byte[] read() {
        return family.withHandle(cf -> engine.get(cf, KEY, KEY.length));
    }

    private void write() {
        family.withHandle(cf -> {
            engine.put(cf, KEY, KEY.length, VALUE, VALUE.length);
            return null;
        });
    }

    @Test
    void recreate_empties_the_family() {
        write();
        family.recreate();
        assertNull(read());
        assertEquals(1, engine.drops);
    }

    @Test
    void retried_recreate_after_a_failed_create_does_not_drop_again() {
        write();
        engine.failuresLeft = 1;

        assertThrows(StorageException.class, family::recreate);
        family.recreate();

        assertEquals(1, engine.drops);
        assertNull(read());
        write();
        assertArrayEquals(VALUE, read());
    }

    @Test
    void data_operations_restore_the_family_after_a_failed_create() {
        write();
        engine.failuresLeft = 1;
        assertThrows(StorageException.class, family::recreate);

        assertNull(read());
        write();
        assertArrayEquals(VALUE, read());
        assertEquals(1, engine.drops);
    }

    @Test
    void operations_keep_failing_while_the_engine_cannot_create() {
        engine.failuresLeft = 3;
        assertThrows(StorageException.class, family::recreate);
        assertThrows(StorageException.class, this::read);
        assertThrows(StorageException.class, family::recreate);

        assertNull(read());
        assertEquals(1, engine.drops);
    }
}
