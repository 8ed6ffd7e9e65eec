package io.typedkv.core.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only list operator: each operand is a list of items appended in order.
 * Cheaper than {@link ListMergeOperator} when removes are never needed.
 */
public final class ListAppendMergeOperator<T> implements MergeOperator<List<T>, List<T>> {
    private final String name;

    public ListAppendMergeOperator(Class<T> elementType) {
        this.name = "ListAppendMergeOperator<" + elementType.getSimpleName() + ">";
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<T> fullMerge(List<T> existing, List<List<T>> operands) {
        List<T> result = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        for (List<T> operand : operands) {
            result.addAll(operand);
        }
        return result;
    }

    @Override
    public PartialMergeResult<List<T>> partialMerge(List<List<T>> operands) {
        List<T> combined = new ArrayList<>();
        for (List<T> operand : operands) {
            combined.addAll(operand);
        }
        return PartialMergeResult.combined(combined);
    }
}
