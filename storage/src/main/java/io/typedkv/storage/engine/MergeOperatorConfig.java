package io.typedkv.storage.engine;

import java.util.Objects;

/**
 * Merge operator as the engine sees it: a stable name plus two byte-level callbacks.
 * Built once when a store is registered and bound to its column family for life.
 */
public record MergeOperatorConfig(
        String name,
        FullMergeFunction fullMerge,
        PartialMergeFunction partialMerge
) {
    public MergeOperatorConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fullMerge, "fullMerge");
        Objects.requireNonNull(partialMerge, "partialMerge");
        if (name.isBlank()) throw new IllegalArgumentException("merge operator name must not be blank");
    }
}
