// file: storage/src/main/java/io/typedkv/storage/ColumnFamilyAccessor.java
package io.typedkv.storage;

import io.typedkv.core.codec.Codec;
import io.typedkv.storage.engine.EngineCursor;
import io.typedkv.storage.engine.EngineWriteBatch;
import io.typedkv.storage.engine.StorageEngine;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * {@link KeyValueAccessor} over a {@link ColumnFamily}.
 * <p>
 * Each call encodes through {@link Encoder}, runs the engine call under the
 * column family's read lock and releases the encoded buffers before returning,
 * on failure too.
 */
public class ColumnFamilyAccessor<K, V> implements KeyValueAccessor<K, V> {
    protected final ColumnFamily columnFamily;
    protected final StorageEngine engine;
    protected final Codec<K> keyCodec;
    protected final Codec<V> valueCodec;

    public ColumnFamilyAccessor(ColumnFamily columnFamily, Codec<K> keyCodec, Codec<V> valueCodec) {
        this.columnFamily = Objects.requireNonNull(columnFamily, "columnFamily");
        this.engine = columnFamily.engine();
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
    }

    @Override
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        try (EncodedBytes k = Encoder.encode(keyCodec, key, Encoder.Slot.KEY);
             EncodedBytes v = Encoder.encode(valueCodec, value, Encoder.Slot.VALUE)) {
            columnFamily.withHandle(cf -> {
                engine.put(cf, k.array(), k.length(), v.array(), v.length());
                return null;
            });
        }
    }

    @Override
    public V get(K key) {
        Objects.requireNonNull(key, "key");
        byte[] raw;
        try (EncodedBytes k = Encoder.encode(keyCodec, key, Encoder.Slot.KEY)) {
            raw = columnFamily.withHandle(cf -> engine.get(cf, k.array(), k.length()));
        }
        return raw == null ? null : Encoder.decode(valueCodec, raw);
    }

    @Override
    public boolean hasKey(K key) {
        Objects.requireNonNull(key, "key");
        try (EncodedBytes k = Encoder.encode(keyCodec, key, Encoder.Slot.KEY)) {
            return columnFamily.withHandle(cf -> engine.hasKey(cf, k.array(), k.length()));
        }
    }

    @Override
    public void remove(K key) {
        Objects.requireNonNull(key, "key");
        try (EncodedBytes k = Encoder.encode(keyCodec, key, Encoder.Slot.KEY)) {
            columnFamily.withHandle(cf -> {
                engine.remove(cf, k.array(), k.length());
                return null;
            });
        }
    }

    @Override
    public void putRange(List<K> keys, List<V> values) {
        if (keys.size() != values.size()) {
            throw new IllegalArgumentException(
                    "keys and values must have the same size (" + keys.size() + " vs " + values.size() + ")");
        }
        columnFamily.withHandle(cf -> {
            try (EngineWriteBatch batch = engine.newBatch()) {
                for (int i = 0; i < keys.size(); i++) {
                    K key = Objects.requireNonNull(keys.get(i), "key");
                    V value = Objects.requireNonNull(values.get(i), "value");
                    try (EncodedBytes k = Encoder.encode(keyCodec, key, Encoder.Slot.KEY);
                         EncodedBytes v = Encoder.encode(valueCodec, value, Encoder.Slot.VALUE)) {
                        batch.put(cf, k.array(), k.length(), v.array(), v.length());
                    }
                }
                engine.write(batch);
            }
            return null;
        });
    }

    @Override
    public void putRange(Collection<V> values, Function<V, K> keySelector) {
        var entries = new ArrayList<Map.Entry<K, V>>(values.size());
        for (V value : values) {
            entries.add(new AbstractMap.SimpleImmutableEntry<>(keySelector.apply(value), value));
        }
        putRange(entries);
    }

    @Override
    public void putRange(Collection<Map.Entry<K, V>> entries) {
        var keys = new ArrayList<K>(entries.size());
        var values = new ArrayList<V>(entries.size());
        for (Map.Entry<K, V> e : entries) {
            keys.add(e.getKey());
            values.add(e.getValue());
        }
        putRange(keys, values);
    }

    @Override
    public List<K> getAllKeys() {
        var keys = new ArrayList<K>();
        scan((key, value) -> keys.add(Encoder.decode(keyCodec, key)));
        return keys;
    }

    @Override
    public List<V> getAllValues() {
        var values = new ArrayList<V>();
        scan((key, value) -> values.add(Encoder.decode(valueCodec, value)));
        return values;
    }

    @Override
    public int count() {
        int[] n = {0};
        scan((key, value) -> n[0]++);
        return n[0];
    }

    @Override
    public void clear() {
        columnFamily.recreate();
    }

    /** Visit every raw entry, holding the read lock for the whole walk. */
    protected void scan(BiConsumer<byte[], byte[]> visitor) {
        columnFamily.withHandle(cf -> {
            try (EngineCursor cursor = engine.cursor(cf)) {
                while (cursor.next()) {
                    visitor.accept(cursor.key(), cursor.value());
                }
            }
            return null;
        });
    }
}
