package io.typedkv.storage;

import io.typedkv.core.codec.Codec;

import java.util.Objects;

/** {@link MergeAccessor} over a column family created with a merge operator. */
public class ColumnFamilyMergeAccessor<K, V, O> extends ColumnFamilyAccessor<K, V> implements MergeAccessor<K, V, O> {
    private final Codec<O> operandCodec;

    public ColumnFamilyMergeAccessor(ColumnFamily columnFamily, Codec<K> keyCodec, Codec<V> valueCodec, Codec<O> operandCodec) {
        super(columnFamily, keyCodec, valueCodec);
        if (!columnFamily.descriptor().hasMergeOperator()) {
            throw new IllegalArgumentException("column family " + columnFamily.name() + " has no merge operator");
        }
        this.operandCodec = Objects.requireNonNull(operandCodec, "operandCodec");
    }

    @Override
    public void merge(K key, O operand) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operand, "operand");
        try (EncodedBytes k = Encoder.encode(keyCodec, key, Encoder.Slot.KEY);
             EncodedBytes o = Encoder.encode(operandCodec, operand, Encoder.Slot.OPERAND)) {
            columnFamily.withHandle(cf -> {
                engine.merge(cf, k.array(), k.length(), o.array(), o.length());
                return null;
            });
        }
    }
}
