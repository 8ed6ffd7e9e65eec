package io.typedkv.storage.engine;

import java.util.List;

/** Engine-side full merge callback: existing value (may be null) plus operands, oldest first. */
@FunctionalInterface
public interface FullMergeFunction {
    MergeOutcome fullMerge(byte[] key, byte[] existing, List<byte[]> operands);
}
