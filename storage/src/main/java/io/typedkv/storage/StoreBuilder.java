// file: storage/src/main/java/io/typedkv/storage/StoreBuilder.java
package io.typedkv.storage;

import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.CodecFactory;
import io.typedkv.core.codec.CodecRegistry;
import io.typedkv.core.merge.CollectionOperation;
import io.typedkv.core.merge.CollectionOperationCodec;
import io.typedkv.core.merge.ListMergeOperator;
import io.typedkv.core.merge.MergeOperator;
import io.typedkv.storage.config.StoreOptions;
import io.typedkv.storage.engine.ColumnFamilyDescriptor;
import io.typedkv.storage.engine.EngineColumnFamily;
import io.typedkv.storage.engine.MemoryEngine;
import io.typedkv.storage.engine.RocksDbEngine;
import io.typedkv.storage.engine.StorageEngine;
import io.typedkv.storage.merge.MergeCallbackBridge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Registers stores against column families and opens the engine.
 * <pre>
 *   try (StoreContext ctx = new StoreBuilder(StoreOptions.defaults(dir))
 *           .withCodecFactory(new JacksonCodecFactory())
 *           .addStore("users", String.class, User.class, UsersStore::new)
 *           .addMergeableStore("counters", String.class, Long.class, Long.class,
 *                   new Int64AddMergeOperator(), CounterStore::new)
 *           .open()) {
 *       ctx.getStore(UsersStore.class).put("u1", user);
 *   }
 * </pre>
 * Rules:
 *  - one store per column family; names compare case-insensitively;
 *  - codecs are resolved while registering, so a type nobody can encode fails
 *    here with {@link io.typedkv.core.codec.CodecNotFoundException};
 *  - codec factories must be added before the stores that need them.
 */
public final class StoreBuilder {
    private final StoreOptions options;
    private final List<CodecFactory> factories = new ArrayList<>();
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private CodecRegistry codecs = CodecRegistry.scalarOnly();

    private record Registration(ColumnFamilyDescriptor descriptor, Function<ColumnFamily, Object> storeFactory) {}

    public StoreBuilder(StoreOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public StoreBuilder withCodecFactory(CodecFactory factory) {
        factories.add(Objects.requireNonNull(factory, "factory"));
        codecs = new CodecRegistry(factories);
        return this;
    }

    /** Codecs resolved from the scalar factory plus every factory added so far. */
    public CodecRegistry codecs() {
        return codecs;
    }

    public <K, V, S extends StoreBase<K, V>> StoreBuilder addStore(
            String columnFamily,
            Class<K> keyType,
            Class<V> valueType,
            Function<KeyValueAccessor<K, V>, S> factory
    ) {
        return addStore(columnFamily, codecs.codecFor(keyType), codecs.codecFor(valueType), factory);
    }

    public <K, V, S extends StoreBase<K, V>> StoreBuilder addStore(
            String columnFamily,
            Codec<K> keyCodec,
            Codec<V> valueCodec,
            Function<KeyValueAccessor<K, V>, S> factory
    ) {
        Objects.requireNonNull(keyCodec, "keyCodec");
        Objects.requireNonNull(valueCodec, "valueCodec");
        Objects.requireNonNull(factory, "factory");
        register(ColumnFamilyDescriptor.plain(columnFamily),
                cf -> factory.apply(new ColumnFamilyAccessor<>(cf, keyCodec, valueCodec)));
        return this;
    }

    public <K, V, O, S extends MergeableStore<K, V, O>> StoreBuilder addMergeableStore(
            String columnFamily,
            Class<K> keyType,
            Class<V> valueType,
            Class<O> operandType,
            MergeOperator<V, O> operator,
            Function<MergeAccessor<K, V, O>, S> factory
    ) {
        return addMergeableStore(columnFamily, codecs.codecFor(keyType), codecs.codecFor(valueType),
                codecs.codecFor(operandType), operator, factory);
    }

    public <K, V, O, S extends MergeableStore<K, V, O>> StoreBuilder addMergeableStore(
            String columnFamily,
            Codec<K> keyCodec,
            Codec<V> valueCodec,
            Codec<O> operandCodec,
            MergeOperator<V, O> operator,
            Function<MergeAccessor<K, V, O>, S> factory
    ) {
        Objects.requireNonNull(keyCodec, "keyCodec");
        Objects.requireNonNull(valueCodec, "valueCodec");
        Objects.requireNonNull(operandCodec, "operandCodec");
        Objects.requireNonNull(factory, "factory");
        var bridge = new MergeCallbackBridge<>(operator, valueCodec, operandCodec);
        register(new ColumnFamilyDescriptor(columnFamily, bridge.toConfig()),
                cf -> factory.apply(new ColumnFamilyMergeAccessor<>(cf, keyCodec, valueCodec, operandCodec)));
        return this;
    }

    /**
     * List-valued store merged with {@link CollectionOperation}s: add and remove
     * items without reading the list first.
     */
    public <K, T, S extends MergeableStore<K, List<T>, CollectionOperation<T>>> StoreBuilder addListStore(
            String columnFamily,
            Class<K> keyType,
            Class<T> itemType,
            Function<MergeAccessor<K, List<T>, CollectionOperation<T>>, S> factory
    ) {
        return addMergeableStore(columnFamily, codecs.codecFor(keyType), codecs.listOf(itemType),
                new CollectionOperationCodec<>(codecs.codecFor(itemType)), new ListMergeOperator<>(itemType), factory);
    }

    public StoreContext open() {
        List<ColumnFamilyDescriptor> descriptors = registrations.values().stream()
                .map(Registration::descriptor)
                .toList();
        StorageEngine engine = switch (options.engine()) {
            case ROCKSDB -> RocksDbEngine.open(options, descriptors);
            case MEMORY -> new MemoryEngine(descriptors);
        };

        try {
            Map<String, Object> stores = new LinkedHashMap<>();
            for (Registration r : registrations.values()) {
                EngineColumnFamily handle = engine.columnFamily(r.descriptor().name());
                var columnFamily = new ColumnFamily(engine, r.descriptor(), handle);
                stores.put(r.descriptor().name(), r.storeFactory().apply(columnFamily));
            }
            return new StoreContext(engine, stores);
        } catch (RuntimeException e) {
            engine.close();
            throw e;
        }
    }

    private void register(ColumnFamilyDescriptor descriptor, Function<ColumnFamily, Object> storeFactory) {
        String key = descriptor.name().toLowerCase(Locale.ROOT);
        if (registrations.containsKey(key)) {
            throw new IllegalStateException("column family " + descriptor.name() + " is already registered");
        }
        registrations.put(key, new Registration(descriptor, storeFactory));
    }
}
