package io.typedkv.storage;

import io.typedkv.core.codec.CollectionCodecs;
import io.typedkv.core.codec.ScalarCodecs;
import io.typedkv.core.merge.Int64AddMergeOperator;
import io.typedkv.storage.TestStores.CounterStore;
import io.typedkv.storage.TestStores.GuardedCounterStore;
import io.typedkv.storage.TestStores.NonNegativeAddOperator;
import io.typedkv.storage.TestStores.ScoresStore;
import io.typedkv.storage.TestStores.StringStore;
import io.typedkv.storage.TestStores.TagsStore;
import io.typedkv.storage.config.StoreOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/** Behaviour every engine must show through the typed store API. */
abstract class StoreContractTest {

    @TempDir Path dir;

    protected StoreContext ctx;

    protected abstract StoreOptions options(Path dir);

    @BeforeEach
    void open() {
        ctx = new StoreBuilder(options(dir))
                .addStore("strings", String.class, String.class, StringStore::new)
                .addStore("scores", ScalarCodecs.INT, CollectionCodecs.listOf(ScalarCodecs.INT), ScoresStore::new)
                .addMergeableStore("counters", String.class, Long.class, Long.class,
                        new Int64AddMergeOperator(), CounterStore::new)
                .addListStore("tags", String.class, String.class, TagsStore::new)
                .addMergeableStore("guarded", String.class, Long.class, Long.class,
                        new NonNegativeAddOperator(), GuardedCounterStore::new)
                .open();
    }

    @AfterEach
    void close() {
        ctx.close();
    }

    @Test
    void put_get_has_key_and_remove() {
        var store = ctx.getStore(StringStore.class);
        assertNull(store.get("missing"));
        assertFalse(store.hasKey("k"));

        store.put("k", "v1");
        store.put("k", "v2");
        assertEquals("v2", store.get("k"));
        assertTrue(store.hasKey("k"));

        store.remove("k");
        assertNull(store.get("k"));
        assertFalse(store.hasKey("k"));
    }

    @Test
    void large_values_round_trip() {
        var store = ctx.getStore(StringStore.class);
        String big = "x".repeat(10_000) + "é";
        store.put("big", big);
        assertEquals(big, store.get("big"));
    }

    @Test
    void list_values_round_trip_including_empty() {
        var store = ctx.getStore(ScoresStore.class);
        store.put(1, List.of(10, 20, 30));
        store.put(2, List.of());

        assertEquals(List.of(10, 20, 30), store.get(1));
        assertEquals(List.of(), store.get(2));
    }

    @Test
    void put_range_with_parallel_lists() {
        var store = ctx.getStore(StringStore.class);
        store.putRange(List.of("a", "b", "c"), List.of("1", "2", "3"));

        assertEquals(List.of("a", "b", "c"), store.getAllKeys());
        assertEquals(List.of("1", "2", "3"), store.getAllValues());
        assertEquals(3, store.count());
    }

    @Test
    void put_range_rejects_mismatched_lists() {
        var store = ctx.getStore(StringStore.class);
        assertThrows(IllegalArgumentException.class, () -> store.putRange(List.of("a", "b"), List.of("1")));
        assertEquals(0, store.count());
    }

    @Test
    void put_range_with_key_selector_and_entries() {
        var store = ctx.getStore(StringStore.class);
        store.putRange(List.of("apple", "kiwi"), v -> v.substring(0, 1));
        store.putRange(List.<Map.Entry<String, String>>of(new AbstractMap.SimpleEntry<>("z", "zebra")));

        assertEquals("apple", store.get("a"));
        assertEquals("kiwi", store.get("k"));
        assertEquals("zebra", store.get("z"));
    }

    @Test
    void counter_merges_accumulate() {
        var counters = ctx.getStore(CounterStore.class);
        counters.add("hits", 5);
        counters.add("hits", -2);
        counters.add("hits", 10);

        assertEquals(13L, counters.get("hits"));
        ctx.compact();
        assertEquals(13L, counters.get("hits"));
    }

    @Test
    void merge_on_top_of_put_value() {
        var counters = ctx.getStore(CounterStore.class);
        counters.put("c", 100L);
        counters.add("c", 1);
        assertEquals(101L, counters.get("c"));
    }

    @Test
    void list_operations_apply_in_submission_order() {
        var tags = ctx.getStore(TagsStore.class);
        tags.tag("post", "a", "b");
        tags.untag("post", "a");
        tags.tag("post", "c");
        tags.untag("post", "missing");

        assertEquals(List.of("b", "c"), tags.get("post"));
        ctx.compact();
        assertEquals(List.of("b", "c"), tags.get("post"));
    }

    @Test
    void clear_empties_the_family_and_keeps_codecs_and_operator() {
        var counters = ctx.getStore(CounterStore.class);
        var strings = ctx.getStore(StringStore.class);
        counters.add("a", 1);
        counters.add("b", 2);
        strings.put("s", "kept");

        counters.clear();
        assertEquals(0, counters.count());
        assertNull(counters.get("a"));

        counters.add("a", 7);
        counters.add("a", 3);
        assertEquals(10L, counters.get("a"));
        assertEquals("kept", strings.get("s"), "other families are untouched");
    }

    @Test
    void keys_come_back_in_encoded_byte_order() {
        var store = ctx.getStore(StringStore.class);
        store.put("b", "2");
        store.put("a", "1");
        store.put("ab", "3");

        assertEquals(List.of("a", "ab", "b"), store.getAllKeys());
    }

    @Test
    void failed_merge_makes_the_key_absent_until_it_is_overwritten() {
        var guarded = ctx.getStore(GuardedCounterStore.class);
        guarded.put("k", 5L);
        guarded.add("k", -1);
        assertNull(guarded.get("k"));

        guarded.add("k", 1);
        assertNull(guarded.get("k"), "later operands do not bring the key back");
        assertFalse(guarded.hasKey("k"));
        assertEquals(0, guarded.count());
        assertEquals(List.of(), guarded.getAllKeys());

        ctx.compact();
        assertNull(guarded.get("k"));

        guarded.put("k", 2L);
        guarded.add("k", 3);
        assertEquals(5L, guarded.get("k"));
    }

    @Test
    void failed_merge_on_a_missing_key_leaves_it_missing() {
        var guarded = ctx.getStore(GuardedCounterStore.class);
        guarded.add("fresh", -4);
        assertNull(guarded.get("fresh"));

        guarded.remove("fresh");
        guarded.add("fresh", 4);
        assertEquals(4L, guarded.get("fresh"));
    }

    @Test
    void operations_racing_clear_never_see_a_dropped_family() throws Exception {
        var counters = ctx.getStore(CounterStore.class);
        var strings = ctx.getStore(StringStore.class);
        strings.put("stable", "yes");

        int workers = 4;
        var errors = new ConcurrentLinkedQueue<Throwable>();
        var done = new AtomicBoolean();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                String key = "w" + w;
                futures.add(pool.submit(() -> {
                    while (!done.get()) {
                        try {
                            counters.add(key, 1);
                            counters.get(key);
                            counters.put(key + "-put", 9L);
                            counters.count();
                            if (!"yes".equals(strings.get("stable"))) {
                                errors.add(new AssertionError("strings family lost its value"));
                            }
                        } catch (RuntimeException e) {
                            errors.add(e);
                            return;
                        }
                    }
                }));
            }
            for (int i = 0; i < 25; i++) {
                counters.clear();
            }
            done.set(true);
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            done.set(true);
            pool.shutdownNow();
        }

        assertTrue(errors.isEmpty(), () -> "operations failed during clear: " + errors);
        counters.clear();
        counters.add("after", 2);
        assertEquals(2L, counters.get("after"));
        assertEquals("yes", strings.get("stable"));
    }
}
