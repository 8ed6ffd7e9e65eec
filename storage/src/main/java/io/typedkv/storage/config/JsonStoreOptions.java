package io.typedkv.storage.config;

/**
 * On-disk shape of the store options file. Missing fields keep their defaults.
 * <pre>
 * {
 *   "path": "/var/lib/typedkv",
 *   "engine": "ROCKSDB",
 *   "deleteExistingDatabaseOnStartup": false,
 *   "useDirectReads": false,
 *   "useDirectIoForFlushAndCompaction": false,
 *   "waitForFlush": true,
 *   "disableWal": false
 * }
 * </pre>
 */
public class JsonStoreOptions {
    public String path;
    public String engine = "ROCKSDB";
    public boolean deleteExistingDatabaseOnStartup;
    public boolean useDirectReads;
    public boolean useDirectIoForFlushAndCompaction;
    public boolean waitForFlush = true;
    public boolean disableWal;
}
