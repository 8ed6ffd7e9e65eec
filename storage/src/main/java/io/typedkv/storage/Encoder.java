// file: storage/src/main/java/io/typedkv/storage/Encoder.java
package io.typedkv.storage;

import io.typedkv.core.buffer.BufferPool;
import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.GrowableBuffer;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.OptionalInt;

/**
 * Picks the buffer a value is encoded into.
 * <p>
 * Decision:
 *  - size known and below {@link #SCRATCH_LIMIT}: the calling thread's scratch array
 *    for that slot (key, value or operand); if the slot is already in use on this
 *    thread, fall through to the pool;
 *  - size known: an array rented from {@link BufferPool#shared()};
 *  - size unknown: a {@link GrowableBuffer}.
 * <p>
 * The bytes written are the same on every path. The returned {@link EncodedBytes}
 * must be closed before the call that asked for it returns.
 */
final class Encoder {
    static final int SCRATCH_LIMIT = 256;

    enum Slot { KEY, VALUE, OPERAND }

    private static final ThreadLocal<Scratch> SCRATCH = ThreadLocal.withInitial(Scratch::new);

    private static final class Scratch {
        private final byte[][] arrays = new byte[Slot.values().length][SCRATCH_LIMIT];
        private final boolean[] leased = new boolean[Slot.values().length];
    }

    private Encoder() {
        // utility
    }

    static <T> EncodedBytes encode(Codec<T> codec, T value, Slot slot) {
        OptionalInt knownSize = codec.trySize(value);
        if (knownSize.isEmpty()) {
            return grow(codec, value);
        }

        int size = knownSize.getAsInt();
        if (size < SCRATCH_LIMIT) {
            Scratch scratch = SCRATCH.get();
            int i = slot.ordinal();
            if (!scratch.leased[i]) {
                scratch.leased[i] = true;
                Runnable release = () -> scratch.leased[i] = false;
                try {
                    codec.write(value, window(scratch.arrays[i], size));
                } catch (RuntimeException e) {
                    release.run();
                    throw e;
                }
                return new EncodedBytes(scratch.arrays[i], size, EncodedBytes.Source.SCRATCH, release);
            }
        }

        BufferPool pool = BufferPool.shared();
        byte[] rented = pool.rent(size);
        try {
            codec.write(value, window(rented, size));
        } catch (RuntimeException e) {
            pool.release(rented);
            throw e;
        }
        return new EncodedBytes(rented, size, EncodedBytes.Source.POOLED, () -> pool.release(rented));
    }

    static <T> T decode(Codec<T> codec, byte[] bytes) {
        return codec.read(ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN));
    }

    private static <T> EncodedBytes grow(Codec<T> codec, T value) {
        GrowableBuffer sink = new GrowableBuffer();
        try {
            codec.write(value, sink);
        } catch (RuntimeException e) {
            sink.close();
            throw e;
        }
        return new EncodedBytes(sink.array(), sink.size(), EncodedBytes.Source.GROWN, sink::close);
    }

    private static ByteBuffer window(byte[] array, int size) {
        return ByteBuffer.wrap(array, 0, size).order(ByteOrder.LITTLE_ENDIAN);
    }
}
