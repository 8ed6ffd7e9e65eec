package io.typedkv.core.merge;

/**
 * Outcome of {@link MergeOperator#partialMerge}:
 *  - Combined: the batch folds into a single equivalent operand;
 *  - Keep: the batch must stay as separate operands until a full merge.
 */
public sealed interface PartialMergeResult<O> permits PartialMergeResult.Combined, PartialMergeResult.Keep {

    record Combined<O>(O operand) implements PartialMergeResult<O> {}

    record Keep<O>() implements PartialMergeResult<O> {}

    static <O> PartialMergeResult<O> combined(O operand) {
        return new Combined<>(operand);
    }

    static <O> PartialMergeResult<O> keep() {
        return new Keep<>();
    }
}
