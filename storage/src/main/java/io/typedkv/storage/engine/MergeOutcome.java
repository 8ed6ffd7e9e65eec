package io.typedkv.storage.engine;

/**
 * What a merge callback hands back to the engine:
 *  - Merged: the resulting bytes, owned by the engine from now on;
 *  - Failed: the merge could not be done. After a full merge the key reads as
 *    absent; after a partial merge the engine keeps the operands as they were.
 */
public sealed interface MergeOutcome permits MergeOutcome.Merged, MergeOutcome.Failed {

    record Merged(byte[] value) implements MergeOutcome {}

    enum Failed implements MergeOutcome { INSTANCE }

    static MergeOutcome merged(byte[] value) {
        return new Merged(value);
    }

    static MergeOutcome failed() {
        return Failed.INSTANCE;
    }
}
