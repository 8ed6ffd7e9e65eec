package io.typedkv.storage.engine;

import java.util.Objects;

/**
 * Everything an engine needs to (re)create a column family.
 *
 * @param name          column family name
 * @param mergeOperator merge operator bound at creation, or null for plain families
 */
public record ColumnFamilyDescriptor(String name, MergeOperatorConfig mergeOperator) {

    public ColumnFamilyDescriptor {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) throw new IllegalArgumentException("column family name must not be blank");
    }

    public static ColumnFamilyDescriptor plain(String name) {
        return new ColumnFamilyDescriptor(name, null);
    }

    public boolean hasMergeOperator() {
        return mergeOperator != null;
    }
}
