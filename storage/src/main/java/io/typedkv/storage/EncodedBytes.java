package io.typedkv.storage;

/**
 * Encoded key, value or operand held in a borrowed array.
 * Bytes [0, length()) of array() are the payload. close() hands the array
 * back to where it came from; it runs once however often it is called.
 */
final class EncodedBytes implements AutoCloseable {

    /** Where the backing array came from. */
    enum Source { SCRATCH, POOLED, GROWN }

    private final byte[] array;
    private final int length;
    private final Source source;
    private Runnable release;

    EncodedBytes(byte[] array, int length, Source source, Runnable release) {
        this.array = array;
        this.length = length;
        this.source = source;
        this.release = release;
    }

    byte[] array() {
        return array;
    }

    int length() {
        return length;
    }

    Source source() {
        return source;
    }

    @Override
    public void close() {
        Runnable r = release;
        if (r == null) return;
        release = null;
        r.run();
    }
}
