package io.typedkv.storage.engine;

/** Unchecked wrapper for failures reported by the underlying engine. */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
