package io.typedkv.core.merge;

import java.util.List;
import java.util.Objects;

/**
 * A merge operand that adds items to, or removes items from, a stored list.
 * <p>
 * Operands only live long enough to be encoded for a merge call, or decoded
 * inside a merge callback. Only the merged list is ever persisted.
 */
public record CollectionOperation<T>(OperationType type, List<T> items) {

    public CollectionOperation {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(items, "items");
    }

    @SafeVarargs
    public static <T> CollectionOperation<T> add(T... items) {
        return new CollectionOperation<>(OperationType.ADD, List.of(items));
    }

    public static <T> CollectionOperation<T> add(List<T> items) {
        return new CollectionOperation<>(OperationType.ADD, items);
    }

    @SafeVarargs
    public static <T> CollectionOperation<T> remove(T... items) {
        return new CollectionOperation<>(OperationType.REMOVE, List.of(items));
    }

    public static <T> CollectionOperation<T> remove(List<T> items) {
        return new CollectionOperation<>(OperationType.REMOVE, items);
    }
}
