// file: core/src/main/java/io/typedkv/core/merge/MergeOperator.java
package io.typedkv.core.merge;

import java.util.List;

/**
 * Typed merge logic for one column family.
 * <p>
 * V is the stored value type, O the operand type. They may be the same
 * (counters: Long/Long) or differ (lists: List&lt;T&gt; / CollectionOperation&lt;T&gt;).
 * <p>
 * Contract:
 *  - fullMerge applies operands in the order given, starting from the existing
 *    value or from the empty/zero value when there is none.
 *  - partialMerge may only combine a batch when the result is the same no matter
 *    what the existing value is and no matter which operands come before or after
 *    the batch. Otherwise it answers Keep.
 *  - Either method may throw; the caller turns that into a failed merge.
 */
public interface MergeOperator<V, O> {

    /**
     * Operator name. The engine keys stored operands by it, so it must not change
     * between runs against the same data.
     */
    String name();

    /**
     * @param existing current value, or null if the key has none
     * @param operands pending operands, oldest first, never empty
     */
    V fullMerge(V existing, List<O> operands);

    PartialMergeResult<O> partialMerge(List<O> operands);
}
