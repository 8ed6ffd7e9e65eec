// file: storage/src/main/java/io/typedkv/storage/merge/MergeCallbackBridge.java
package io.typedkv.storage.merge;

import io.typedkv.core.codec.Codec;
import io.typedkv.core.codec.GrowableBuffer;
import io.typedkv.core.merge.MergeOperator;
import io.typedkv.core.merge.PartialMergeResult;
import io.typedkv.storage.engine.MergeOperatorConfig;
import io.typedkv.storage.engine.MergeOutcome;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Adapts a typed {@link MergeOperator} to the engine's byte-level merge callbacks.
 * <p>
 * For each callback:
 *  1) decode the existing value (if any) and every operand;
 *  2) invoke the typed operator;
 *  3) encode the result into a new array of exactly the encoded length; the
 *     engine owns that array from then on.
 * <p>
 * Anything the operator or a codec throws becomes {@link MergeOutcome#failed()}
 * and is logged; an exception never crosses back into the engine.
 * A partial merge that answers Keep is reported as failed too, which tells the
 * engine to keep the operands as they are.
 */
public final class MergeCallbackBridge<V, O> {
    private static final Logger log = Logger.getLogger(MergeCallbackBridge.class.getName());

    private final MergeOperator<V, O> operator;
    private final Codec<V> valueCodec;
    private final Codec<O> operandCodec;

    public MergeCallbackBridge(MergeOperator<V, O> operator, Codec<V> valueCodec, Codec<O> operandCodec) {
        this.operator = Objects.requireNonNull(operator, "operator");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
        this.operandCodec = Objects.requireNonNull(operandCodec, "operandCodec");
    }

    public MergeOperatorConfig toConfig() {
        return new MergeOperatorConfig(operator.name(), this::fullMerge, this::partialMerge);
    }

    public MergeOutcome fullMerge(byte[] key, byte[] existing, List<byte[]> operands) {
        try {
            V current = existing == null ? null : valueCodec.read(wrap(existing));
            V merged = operator.fullMerge(current, decodeOperands(operands));
            return MergeOutcome.merged(encode(valueCodec, merged));
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Full merge failed in " + operator.name() + " over " + operands.size() + " operands", e);
            return MergeOutcome.failed();
        }
    }

    public MergeOutcome partialMerge(byte[] key, List<byte[]> operands) {
        try {
            PartialMergeResult<O> result = operator.partialMerge(decodeOperands(operands));
            if (result instanceof PartialMergeResult.Combined<O> combined) {
                return MergeOutcome.merged(encode(operandCodec, combined.operand()));
            }
            return MergeOutcome.failed();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Partial merge failed in " + operator.name() + " over " + operands.size() + " operands", e);
            return MergeOutcome.failed();
        }
    }

    private List<O> decodeOperands(List<byte[]> operands) {
        var decoded = new ArrayList<O>(operands.size());
        for (byte[] operand : operands) {
            decoded.add(operandCodec.read(wrap(operand)));
        }
        return decoded;
    }

    private static ByteBuffer wrap(byte[] bytes) {
        return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    }

    static <T> byte[] encode(Codec<T> codec, T value) {
        OptionalInt size = codec.trySize(value);
        if (size.isPresent()) {
            byte[] out = new byte[size.getAsInt()];
            codec.write(value, wrap(out));
            return out;
        }
        try (GrowableBuffer sink = new GrowableBuffer()) {
            codec.write(value, sink);
            return sink.toByteArray();
        }
    }
}
