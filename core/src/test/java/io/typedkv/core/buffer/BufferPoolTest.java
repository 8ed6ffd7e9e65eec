package io.typedkv.core.buffer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BufferPoolTest {

    @Test
    void rent_rounds_up_to_a_power_of_two_bucket() {
        var pool = new BufferPool(2);
        assertEquals(512, pool.rent(1).length);
        assertEquals(512, pool.rent(512).length);
        assertEquals(1024, pool.rent(513).length);
    }

    @Test
    void released_arrays_are_reused() {
        var pool = new BufferPool(2);
        byte[] first = pool.rent(700);
        pool.release(first);
        assertEquals(1, pool.idleCount());
        assertSame(first, pool.rent(600));
        assertEquals(0, pool.idleCount());
    }

    @Test
    void oversize_and_foreign_arrays_are_not_pooled() {
        var pool = new BufferPool(2);
        byte[] huge = pool.rent((1 << 20) + 1);
        assertEquals((1 << 20) + 1, huge.length);
        pool.release(huge);
        pool.release(new byte[100]);
        assertEquals(0, pool.idleCount());
    }

    @Test
    void full_bucket_drops_extra_arrays() {
        var pool = new BufferPool(1);
        pool.release(new byte[512]);
        pool.release(new byte[512]);
        assertEquals(1, pool.idleCount());
    }
}
