// file: core/src/main/java/io/typedkv/core/codec/GrowableBuffer.java
package io.typedkv.core.codec;

import io.typedkv.core.buffer.BufferPool;

import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Append-only byte sink for codecs that cannot size their output up front.
 * <p>
 * Backing arrays are rented from a {@link BufferPool} and handed back on
 * growth and on {@link #close()}. Bytes [0, size()) of {@link #array()} are
 * the written payload; anything past size() is garbage.
 * <p>
 * Not thread-safe. One owner at a time.
 */
public final class GrowableBuffer implements AutoCloseable {
    private static final int DEFAULT_INITIAL_CAPACITY = 512;

    private final BufferPool pool;
    private byte[] array;
    private int size;
    private boolean closed;

    public GrowableBuffer() {
        this(BufferPool.shared(), DEFAULT_INITIAL_CAPACITY);
    }

    public GrowableBuffer(BufferPool pool, int initialCapacity) {
        this.pool = pool;
        this.array = pool.rent(Math.max(initialCapacity, 16));
    }

    public int size() {
        return size;
    }

    /** Backing array; only the first size() bytes are meaningful. */
    public byte[] array() {
        ensureOpen();
        return array;
    }

    public byte[] toByteArray() {
        ensureOpen();
        return Arrays.copyOf(array, size);
    }

    public void put(byte b) {
        ensureCapacity(1);
        array[size++] = b;
    }

    public void put(byte[] src) {
        put(src, 0, src.length);
    }

    public void put(byte[] src, int offset, int length) {
        ensureCapacity(length);
        System.arraycopy(src, offset, array, size, length);
        size += length;
    }

    public void putInt(int value) {
        ensureCapacity(Integer.BYTES);
        putIntAt(size, value);
        size += Integer.BYTES;
    }

    /** Write a little-endian int at {@code position} without moving size(). Used to back-patch length slots. */
    public void putIntAt(int position, int value) {
        ensureOpen();
        if (position < 0 || position + Integer.BYTES > array.length) {
            throw new IndexOutOfBoundsException("position " + position + " outside buffer");
        }
        array[position] = (byte) value;
        array[position + 1] = (byte) (value >>> 8);
        array[position + 2] = (byte) (value >>> 16);
        array[position + 3] = (byte) (value >>> 24);
    }

    /**
     * Reserve {@code length} bytes at the end and return a little-endian window
     * over exactly them. The bytes count as written immediately.
     */
    public ByteBuffer reserve(int length) {
        ensureCapacity(length);
        ByteBuffer window = ByteBuffer.wrap(array, size, length).slice().order(ByteOrder.LITTLE_ENDIAN);
        size += length;
        return window;
    }

    /** Stream view for libraries that write to an {@link OutputStream}. */
    public OutputStream asOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) {
                put((byte) b);
            }

            @Override
            public void write(byte[] b, int off, int len) {
                put(b, off, len);
            }
        };
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        pool.release(array);
        array = null;
    }

    private void ensureCapacity(int extra) {
        ensureOpen();
        int required = size + extra;
        if (required < 0) throw new IllegalStateException("buffer too large");
        if (required <= array.length) return;

        int newCapacity = Math.max(required, array.length << 1);
        byte[] grown = pool.rent(newCapacity);
        System.arraycopy(array, 0, grown, 0, size);
        pool.release(array);
        array = grown;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("buffer already closed");
    }
}
