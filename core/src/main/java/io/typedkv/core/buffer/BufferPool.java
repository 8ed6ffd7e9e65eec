// file: core/src/main/java/io/typedkv/core/buffer/BufferPool.java
package io.typedkv.core.buffer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Shared pool of byte arrays, bucketed by power-of-two length.
 * <p>
 * Semantics:
 *  - rent(min) returns an array with length >= min. The caller owns it until
 *    it calls release(array), exactly once.
 *  - Requests above the largest bucket are allocated and never pooled.
 *  - An empty bucket is not an error: rent() simply allocates.
 *  - A full bucket silently drops the released array.
 */
public final class BufferPool {
    private static final int MIN_BUCKET_SHIFT = 9;   // 512 B
    private static final int MAX_BUCKET_SHIFT = 20;  // 1 MiB
    private static final int DEFAULT_ARRAYS_PER_BUCKET = 32;

    private static final BufferPool SHARED = new BufferPool(DEFAULT_ARRAYS_PER_BUCKET);

    private final List<ArrayBlockingQueue<byte[]>> buckets;

    public BufferPool(int arraysPerBucket) {
        if (arraysPerBucket <= 0) throw new IllegalArgumentException("arraysPerBucket must be > 0");
        var all = new ArrayList<ArrayBlockingQueue<byte[]>>(MAX_BUCKET_SHIFT - MIN_BUCKET_SHIFT + 1);
        for (int shift = MIN_BUCKET_SHIFT; shift <= MAX_BUCKET_SHIFT; shift++) {
            all.add(new ArrayBlockingQueue<>(arraysPerBucket));
        }
        this.buckets = List.copyOf(all);
    }

    /** Process-wide pool used by codec sinks and accessors. */
    public static BufferPool shared() {
        return SHARED;
    }

    public byte[] rent(int minLength) {
        if (minLength < 0) throw new IllegalArgumentException("minLength must be >= 0");
        int bucket = bucketFor(minLength);
        if (bucket < 0) {
            return new byte[minLength];
        }
        byte[] pooled = buckets.get(bucket).poll();
        return pooled != null ? pooled : new byte[1 << (bucket + MIN_BUCKET_SHIFT)];
    }

    public void release(byte[] array) {
        if (array == null) return;
        int len = array.length;
        // Only exact bucket sizes were handed out by rent().
        if (Integer.bitCount(len) != 1) return;
        int shift = Integer.numberOfTrailingZeros(len);
        if (shift < MIN_BUCKET_SHIFT || shift > MAX_BUCKET_SHIFT) return;
        buckets.get(shift - MIN_BUCKET_SHIFT).offer(array);
    }

    /** Number of idle arrays currently pooled, across all buckets. */
    public int idleCount() {
        int total = 0;
        for (ArrayBlockingQueue<byte[]> b : buckets) {
            total += b.size();
        }
        return total;
    }

    private static int bucketFor(int minLength) {
        if (minLength > (1 << MAX_BUCKET_SHIFT)) return -1;
        if (minLength <= (1 << MIN_BUCKET_SHIFT)) return 0;
        int shift = 32 - Integer.numberOfLeadingZeros(minLength - 1);
        return shift - MIN_BUCKET_SHIFT;
    }
}
