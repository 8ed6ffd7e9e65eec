package io.typedkv.core.codec;

import java.util.OptionalInt;

/**
 * A codec whose every value encodes to the same number of bytes.
 * <p>
 * Fixed-width collections accept only these as element codecs, so the
 * "every element has the first element's size" assumption is carried by the type.
 */
public interface FixedWidthCodec<T> extends Codec<T> {

    int fixedSize();

    @Override
    default OptionalInt trySize(T value) {
        return OptionalInt.of(fixedSize());
    }
}
