package io.typedkv.storage.engine;

import java.util.List;

/** Engine-side partial merge callback: operands only, oldest first. */
@FunctionalInterface
public interface PartialMergeFunction {
    MergeOutcome partialMerge(byte[] key, List<byte[]> operands);
}
