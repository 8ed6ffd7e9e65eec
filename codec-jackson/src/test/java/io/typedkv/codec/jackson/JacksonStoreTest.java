package io.typedkv.codec.jackson;

import io.typedkv.core.merge.CollectionOperation;
import io.typedkv.storage.KeyValueAccessor;
import io.typedkv.storage.MergeAccessor;
import io.typedkv.storage.MergeableStore;
import io.typedkv.storage.StoreBuilder;
import io.typedkv.storage.StoreContext;
import io.typedkv.storage.TypedStore;
import io.typedkv.storage.config.StoreOptions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JacksonStoreTest {

    record Item(String sku, double price) {}

    static final class ItemStore extends TypedStore<String, Item> {
        ItemStore(KeyValueAccessor<String, Item> accessor) {
            super(accessor);
        }
    }

    static final class ItemListStore extends TypedStore<String, List<Item>> {
        ItemListStore(KeyValueAccessor<String, List<Item>> accessor) {
            super(accessor);
        }
    }

    static final class ItemSetStore extends TypedStore<String, Set<Item>> {
        ItemSetStore(KeyValueAccessor<String, Set<Item>> accessor) {
            super(accessor);
        }
    }

    static final class CartStore extends MergeableStore<String, List<Item>, CollectionOperation<Item>> {
        CartStore(MergeAccessor<String, List<Item>, CollectionOperation<Item>> accessor) {
            super(accessor);
        }
    }

    @Test
    void json_values_lists_and_sets_round_trip() {
        var builder = new StoreBuilder(StoreOptions.inMemory()).withCodecFactory(new JacksonCodecFactory());
        try (StoreContext ctx = builder
                .addStore("items", String.class, Item.class, ItemStore::new)
                .addStore("item-lists", builder.codecs().codecFor(String.class), builder.codecs().listOf(Item.class), ItemListStore::new)
                .addStore("item-sets", builder.codecs().codecFor(String.class), builder.codecs().setOf(Item.class), ItemSetStore::new)
                .open()) {
            var pen = new Item("pen", 1.5);
            var ink = new Item("ink", 4.0);

            ctx.getStore(ItemStore.class).put("p", pen);
            ctx.getStore(ItemListStore.class).put("l", List.of(pen, ink, pen));
            ctx.getStore(ItemListStore.class).put("empty", List.of());
            ctx.getStore(ItemSetStore.class).put("s", new LinkedHashSet<>(List.of(ink, pen)));

            assertEquals(pen, ctx.getStore(ItemStore.class).get("p"));
            assertEquals(List.of(pen, ink, pen), ctx.getStore(ItemListStore.class).get("l"));
            assertEquals(List.of(), ctx.getStore(ItemListStore.class).get("empty"));
            assertEquals(List.of(ink, pen), List.copyOf(ctx.getStore(ItemSetStore.class).get("s")));
        }
    }

    @Test
    void list_merge_with_json_items() {
        try (StoreContext ctx = new StoreBuilder(StoreOptions.inMemory())
                .withCodecFactory(new JacksonCodecFactory())
                .addListStore("carts", String.class, Item.class, CartStore::new)
                .open()) {
            var cart = ctx.getStore(CartStore.class);
            var pen = new Item("pen", 1.5);
            var ink = new Item("ink", 4.0);

            cart.merge("c1", CollectionOperation.add(pen, ink));
            cart.merge("c1", CollectionOperation.remove(pen));
            ctx.compact();

            assertEquals(List.of(ink), cart.get("c1"));
        }
    }
}
