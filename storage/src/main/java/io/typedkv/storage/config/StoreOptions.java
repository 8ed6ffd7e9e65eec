// file: storage/src/main/java/io/typedkv/storage/config/StoreOptions.java
package io.typedkv.storage.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Options for opening a store.
 *
 * @param path                             database directory (ignored by the memory engine)
 * @param engine                           engine implementation to open
 * @param deleteExistingDatabaseOnStartup  wipe the directory before opening
 * @param useDirectReads                   bypass the OS page cache for reads
 * @param useDirectIoForFlushAndCompaction bypass the OS page cache for background IO
 * @param waitForFlush                     flush() blocks until memtables are on disk
 * @param disableWal                       skip the write-ahead log; unflushed writes are lost on crash
 */
public record StoreOptions(
        Path path,
        EngineKind engine,
        boolean deleteExistingDatabaseOnStartup,
        boolean useDirectReads,
        boolean useDirectIoForFlushAndCompaction,
        boolean waitForFlush,
        boolean disableWal
) {
    public StoreOptions {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(engine, "engine");
    }

    public static StoreOptions defaults(Path path) {
        return new StoreOptions(path, EngineKind.ROCKSDB, false, false, false, true, false);
    }

    public static StoreOptions inMemory() {
        return new StoreOptions(Path.of("memory"), EngineKind.MEMORY, false, false, false, true, false);
    }

    public static StoreOptions fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonStoreOptions cfg = mapper.readValue(path.toFile(), JsonStoreOptions.class);
            if (cfg.path == null || cfg.path.isBlank()) {
                throw new IllegalArgumentException("path must be set in " + path);
            }
            return new StoreOptions(
                    Path.of(cfg.path),
                    engineKind(cfg.engine, path),
                    cfg.deleteExistingDatabaseOnStartup,
                    cfg.useDirectReads,
                    cfg.useDirectIoForFlushAndCompaction,
                    cfg.waitForFlush,
                    cfg.disableWal
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load StoreOptions from " + path, e);
        }
    }

    private static EngineKind engineKind(String name, Path file) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("engine must be set in " + file);
        }
        try {
            return EngineKind.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown engine '" + name + "' in " + file
                    + "; expected one of " + Arrays.toString(EngineKind.values()), e);
        }
    }

    public StoreOptions withEngine(EngineKind engine) {
        return new StoreOptions(path, engine, deleteExistingDatabaseOnStartup, useDirectReads,
                useDirectIoForFlushAndCompaction, waitForFlush, disableWal);
    }

    public StoreOptions withDeleteExistingDatabaseOnStartup(boolean value) {
        return new StoreOptions(path, engine, value, useDirectReads,
                useDirectIoForFlushAndCompaction, waitForFlush, disableWal);
    }

    public StoreOptions withDirectIo(boolean reads, boolean flushAndCompaction) {
        return new StoreOptions(path, engine, deleteExistingDatabaseOnStartup, reads,
                flushAndCompaction, waitForFlush, disableWal);
    }

    public StoreOptions withWaitForFlush(boolean value) {
        return new StoreOptions(path, engine, deleteExistingDatabaseOnStartup, useDirectReads,
                useDirectIoForFlushAndCompaction, value, disableWal);
    }

    public StoreOptions withDisableWal(boolean value) {
        return new StoreOptions(path, engine, deleteExistingDatabaseOnStartup, useDirectReads,
                useDirectIoForFlushAndCompaction, waitForFlush, value);
    }
}
