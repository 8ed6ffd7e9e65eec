package io.typedkv.core.codec;

import io.typedkv.core.buffer.BufferPool;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import static org.junit.jupiter.api.Assertions.*;

class GrowableBufferTest {

    @Test
    void grows_past_initial_capacity_and_keeps_bytes() {
        var pool = new BufferPool(4);
        try (var sink = new GrowableBuffer(pool, 16)) {
            for (int i = 0; i < 2000; i++) {
                sink.put((byte) i);
            }
            assertEquals(2000, sink.size());
            byte[] out = sink.toByteArray();
            assertEquals((byte) 1999, out[1999]);
            assertEquals((byte) 7, out[7]);
        }
        assertTrue(pool.idleCount() > 0, "backing arrays go back to the pool");
    }

    @Test
    void put_int_at_back_patches_a_slot() {
        try (var sink = new GrowableBuffer()) {
            sink.putInt(0);
            sink.put(new byte[]{9, 9, 9});
            sink.putIntAt(0, 3);
            assertArrayEquals(new byte[]{3, 0, 0, 0, 9, 9, 9}, sink.toByteArray());
        }
    }

    @Test
    void reserve_returns_little_endian_window_counted_as_written() {
        try (var sink = new GrowableBuffer()) {
            sink.put((byte) 1);
            ByteBuffer window = sink.reserve(4);
            assertEquals(4, window.remaining());
            window.putInt(0x0A0B0C0D);
            assertEquals(5, sink.size());
            assertArrayEquals(new byte[]{1, 0x0D, 0x0C, 0x0B, 0x0A}, sink.toByteArray());
        }
    }

    @Test
    void output_stream_view_appends() throws IOException {
        try (var sink = new GrowableBuffer()) {
            OutputStream out = sink.asOutputStream();
            out.write(new byte[]{1, 2, 3});
            out.write(4);
            assertArrayEquals(new byte[]{1, 2, 3, 4}, sink.toByteArray());
        }
    }

    @Test
    void closed_buffer_rejects_use_and_closes_once() {
        var sink = new GrowableBuffer();
        sink.close();
        sink.close();
        assertThrows(IllegalStateException.class, () -> sink.put((byte) 1));
    }
}
