package io.typedkv.core.codec;

import java.util.Map;

/** Factory for the built-in scalar codecs in {@link ScalarCodecs}. */
public final class ScalarCodecFactory implements CodecFactory {

    private static final Map<Class<?>, Codec<?>> CODECS = Map.of(
            Integer.class, ScalarCodecs.INT,
            int.class, ScalarCodecs.INT,
            Long.class, ScalarCodecs.LONG,
            long.class, ScalarCodecs.LONG,
            Boolean.class, ScalarCodecs.BOOLEAN,
            boolean.class, ScalarCodecs.BOOLEAN,
            Double.class, ScalarCodecs.DOUBLE,
            double.class, ScalarCodecs.DOUBLE,
            String.class, ScalarCodecs.STRING,
            byte[].class, ScalarCodecs.BYTES
    );

    @Override
    public boolean canCreate(Class<?> type) {
        return CODECS.containsKey(type);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> Codec<T> create(Class<T> type) {
        Codec<?> codec = CODECS.get(type);
        if (codec == null) {
            throw new CodecNotFoundException(type);
        }
        return (Codec<T>) codec;
    }
}
