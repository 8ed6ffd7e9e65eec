package io.typedkv.storage.engine;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored form of a value in a RocksDB column family that has a merge operator.
 * <p>
 * Layout (little-endian):
 * <pre>
 *   resolved:   [tag=0][value bytes]
 *   unresolved: [tag=1][hasBase:1][baseLen:int][base][count:int]{[len:int][operand]}*
 * </pre>
 * An unresolved record holds operands whose full merge failed. The key reads
 * as absent until a put or remove replaces it; later merges append to it and
 * retry the full merge over every operand.
 */
record MergeRecord(byte[] base, List<byte[]> operands) {
    private static final byte RESOLVED = 0;
    private static final byte UNRESOLVED = 1;

    static final MergeRecord ABSENT = new MergeRecord(null, List.of());

    boolean resolved() {
        return operands.isEmpty();
    }

    MergeRecord withOperand(byte[] operand) {
        var next = new ArrayList<byte[]>(operands.size() + 1);
        next.addAll(operands);
        next.add(operand);
        return new MergeRecord(base, List.copyOf(next));
    }

    static byte[] resolved(byte[] value) {
        byte[] out = new byte[1 + value.length];
        out[0] = RESOLVED;
        System.arraycopy(value, 0, out, 1, value.length);
        return out;
    }

    byte[] encodeUnresolved() {
        int size = 1 + 1 + 4 + (base == null ? 0 : base.length) + 4;
        for (byte[] op : operands) {
            size += 4 + op.length;
        }
        ByteBuffer buf = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        buf.put(UNRESOLVED);
        buf.put((byte) (base == null ? 0 : 1));
        buf.putInt(base == null ? 0 : base.length);
        if (base != null) buf.put(base);
        buf.putInt(operands.size());
        for (byte[] op : operands) {
            buf.putInt(op.length);
            buf.put(op);
        }
        return buf.array();
    }

    /** Decode a stored record; null means the key is not stored at all. */
    static MergeRecord decode(byte[] stored) {
        if (stored == null) {
            return ABSENT;
        }
        ByteBuffer buf = ByteBuffer.wrap(stored).order(ByteOrder.LITTLE_ENDIAN);
        byte tag = buf.get();
        if (tag == RESOLVED) {
            byte[] value = new byte[buf.remaining()];
            buf.get(value);
            return new MergeRecord(value, List.of());
        }
        if (tag != UNRESOLVED) {
            throw new IllegalStateException("unknown merge record tag " + tag);
        }
        boolean hasBase = buf.get() != 0;
        byte[] base = new byte[buf.getInt()];
        buf.get(base);
        int count = buf.getInt();
        var operands = new ArrayList<byte[]>(count);
        for (int i = 0; i < count; i++) {
            byte[] op = new byte[buf.getInt()];
            buf.get(op);
            operands.add(op);
        }
        return new MergeRecord(hasBase ? base : null, List.copyOf(operands));
    }
}
