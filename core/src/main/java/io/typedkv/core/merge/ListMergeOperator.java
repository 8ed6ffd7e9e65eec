// file: core/src/main/java/io/typedkv/core/merge/ListMergeOperator.java
package io.typedkv.core.merge;

import java.util.ArrayList;
import java.util.List;

/**
 * List operator with add and remove.
 * <p>
 * Full merge, per operand in order:
 *  - ADD:    append every item;
 *  - REMOVE: remove the first occurrence of every item, ignoring items that
 *            are not present (list semantics, not set semantics).
 * <p>
 * Partial merge:
 *  - ADD-only batch -> one ADD with all items in batch order;
 *  - any REMOVE     -> Keep. A REMOVE's effect depends on what is in the list
 *    when it runs, which a compaction-time batch cannot know.
 */
public final class ListMergeOperator<T> implements MergeOperator<List<T>, CollectionOperation<T>> {
    private final String name;

    public ListMergeOperator(Class<T> elementType) {
        this.name = "ListMergeOperator<" + elementType.getSimpleName() + ">";
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<T> fullMerge(List<T> existing, List<CollectionOperation<T>> operands) {
        List<T> result = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
        for (CollectionOperation<T> operand : operands) {
            apply(result, operand);
        }
        return result;
    }

    @Override
    public PartialMergeResult<CollectionOperation<T>> partialMerge(List<CollectionOperation<T>> operands) {
        List<T> allAdds = new ArrayList<>();
        for (CollectionOperation<T> operand : operands) {
            if (operand.type() == OperationType.REMOVE) {
                return PartialMergeResult.keep();
            }
            allAdds.addAll(operand.items());
        }
        return PartialMergeResult.combined(CollectionOperation.add(allAdds));
    }

    private static <T> void apply(List<T> result, CollectionOperation<T> operation) {
        switch (operation.type()) {
            case ADD -> result.addAll(operation.items());
            case REMOVE -> {
                for (T item : operation.items()) {
                    result.remove(item);
                }
            }
        }
    }
}
