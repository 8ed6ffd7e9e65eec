package io.typedkv.storage.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoreOptionsTest {

    @TempDir Path dir;

    @Test
    void json_file_overrides_defaults_and_keeps_the_rest() throws URISyntaxException {
        Path file = Path.of(getClass().getResource("/store-options.json").toURI());

        StoreOptions options = StoreOptions.fromJsonFile(file);

        assertEquals(Path.of("/var/lib/typedkv"), options.path());
        assertEquals(EngineKind.MEMORY, options.engine());
        assertTrue(options.deleteExistingDatabaseOnStartup());
        assertTrue(options.useDirectReads());
        assertFalse(options.useDirectIoForFlushAndCompaction());
        assertTrue(options.waitForFlush());
        assertTrue(options.disableWal());
    }

    @Test
    void minimal_json_uses_rocksdb_defaults() throws IOException {
        Path file = dir.resolve("minimal.json");
        Files.writeString(file, "{\"path\": \"" + dir.resolve("db").toString().replace("\\", "\\\\") + "\"}");

        assertEquals(StoreOptions.defaults(dir.resolve("db")), StoreOptions.fromJsonFile(file));
    }

    @Test
    void missing_file_names_the_path() {
        Path missing = dir.resolve("nope.json");
        var e = assertThrows(RuntimeException.class, () -> StoreOptions.fromJsonFile(missing));
        assertTrue(e.getMessage().contains(missing.toString()));
    }

    @Test
    void json_without_path_is_rejected() throws IOException {
        Path file = dir.resolve("nopath.json");
        Files.writeString(file, "{\"engine\": \"ROCKSDB\"}");
        assertThrows(IllegalArgumentException.class, () -> StoreOptions.fromJsonFile(file));
    }

    @Test
    void null_engine_is_rejected_naming_the_file() throws IOException {
        Path file = dir.resolve("nullengine.json");
        Files.writeString(file, "{\"path\": \"db\", \"engine\": null}");

        var e = assertThrows(IllegalArgumentException.class, () -> StoreOptions.fromJsonFile(file));
        assertTrue(e.getMessage().contains("engine"));
        assertTrue(e.getMessage().contains(file.toString()));
    }

    @Test
    void unknown_engine_is_rejected_naming_the_file() throws IOException {
        Path file = dir.resolve("badengine.json");
        Files.writeString(file, "{\"path\": \"db\", \"engine\": \"leveldb\"}");

        var e = assertThrows(IllegalArgumentException.class, () -> StoreOptions.fromJsonFile(file));
        assertTrue(e.getMessage().contains("leveldb"));
        assertTrue(e.getMessage().contains(file.toString()));
    }

    @Test
    void engine_name_is_case_insensitive() throws IOException {
        Path file = dir.resolve("lower.json");
        Files.writeString(file, "{\"path\": \"db\", \"engine\": \" memory \"}");

        assertEquals(EngineKind.MEMORY, StoreOptions.fromJsonFile(file).engine());
    }

    @Test
    void with_methods_copy_one_field() {
        StoreOptions base = StoreOptions.defaults(dir);
        StoreOptions changed = base.withDisableWal(true).withWaitForFlush(false).withDirectIo(true, true);

        assertFalse(base.disableWal());
        assertTrue(changed.disableWal());
        assertFalse(changed.waitForFlush());
        assertTrue(changed.useDirectReads());
        assertTrue(changed.useDirectIoForFlushAndCompaction());
        assertEquals(base.path(), changed.path());
    }

    @Test
    void path_is_required() {
        assertThrows(NullPointerException.class, () -> StoreOptions.defaults(null));
    }
}
