// file: storage/src/main/java/io/typedkv/storage/ColumnFamily.java
package io.typedkv.storage;

import io.typedkv.storage.engine.ColumnFamilyDescriptor;
import io.typedkv.storage.engine.EngineColumnFamily;
import io.typedkv.storage.engine.StorageEngine;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A named column family plus the engine handle currently backing it.
 * <p>
 * Concurrency:
 *  - Data operations run under the read lock and see one handle for their
 *    whole duration, so any number of them proceed in parallel.
 *  - {@link #recreate()} takes the write lock, drops the family and creates it
 *    again from the same descriptor, then swaps the handle. Callers see either
 *    the old family or the new one, never a dropped handle.
 *  - If the create step fails after the drop succeeded, the family is left
 *    without a handle. The next recreate() or data operation creates it again
 *    without dropping twice.
 *  - The lock is per column family; clearing one does not block the others.
 */
public final class ColumnFamily {
    private static final Logger log = Logger.getLogger(ColumnFamily.class.getName());

    private final StorageEngine engine;
    private final ColumnFamilyDescriptor descriptor;
    private final AtomicReference<EngineColumnFamily> handle;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean handleMissing;

    public ColumnFamily(StorageEngine engine, ColumnFamilyDescriptor descriptor, EngineColumnFamily handle) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.handle = new AtomicReference<>(Objects.requireNonNull(handle, "handle"));
    }

    public String name() {
        return descriptor.name();
    }

    public ColumnFamilyDescriptor descriptor() {
        return descriptor;
    }

    /** Run {@code op} against the live handle while holding the read lock. */
    public <R> R withHandle(Function<EngineColumnFamily, R> op) {
        if (handleMissing) {
            restore();
        }
        lock.readLock().lock();
        try {
            return op.apply(handle.get());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Drop and re-create the column family; every key in it is gone afterwards. */
    public void recreate() {
        lock.writeLock().lock();
        try {
            if (!handleMissing) {
                engine.dropColumnFamily(handle.get());
                handleMissing = true;
            }
            create();
            log.log(Level.INFO, "Recreated column family " + descriptor.name());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void restore() {
        lock.writeLock().lock();
        try {
            if (handleMissing) {
                create();
                log.log(Level.INFO, "Restored column family " + descriptor.name() + " after a failed recreate");
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private void create() {
        handle.set(engine.createColumnFamily(descriptor));
        handleMissing = false;
    }

    StorageEngine engine() {
        return engine;
    }
}
