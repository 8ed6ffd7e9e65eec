package io.typedkv.core.merge;

import java.util.List;

/**
 * Counter operator: value and operands are longs and merging is addition.
 * Addition is associative and commutative, so partial merge always combines.
 */
public final class Int64AddMergeOperator implements MergeOperator<Long, Long> {

    @Override
    public String name() {
        return "Int64AddMergeOperator";
    }

    @Override
    public Long fullMerge(Long existing, List<Long> operands) {
        long result = existing == null ? 0L : existing;
        for (Long delta : operands) {
            result += delta;
        }
        return result;
    }

    @Override
    public PartialMergeResult<Long> partialMerge(List<Long> operands) {
        long sum = 0L;
        for (Long delta : operands) {
            sum += delta;
        }
        return PartialMergeResult.combined(sum);
    }
}
