package io.typedkv.core.codec;

/** Raised at registration time when no factory can produce a codec for a type. */
public class CodecNotFoundException extends RuntimeException {

    public CodecNotFoundException(Class<?> type) {
        super("Type " + type.getName() + " cannot be used as a key, value or operand. "
                + "Register a CodecFactory that supports it.");
    }
}
