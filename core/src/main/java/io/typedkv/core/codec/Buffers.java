package io.typedkv.core.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Small helpers shared by the composite codecs. */
final class Buffers {

    private Buffers() {
        // utility
    }

    /**
     * Carve the next {@code length} bytes of {@code buf} into an independent
     * little-endian view and advance buf past them.
     */
    static ByteBuffer window(ByteBuffer buf, int length) {
        ByteBuffer view = buf.slice(buf.position(), length).order(ByteOrder.LITTLE_ENDIAN);
        buf.position(buf.position() + length);
        return view;
    }
}
