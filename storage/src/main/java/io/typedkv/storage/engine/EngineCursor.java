package io.typedkv.storage.engine;

/**
 * Forward cursor over one column family, in unsigned lexicographic key order.
 * <pre>
 *   try (EngineCursor c = engine.cursor(cf)) {
 *       while (c.next()) { use(c.key(), c.value()); }
 *   }
 * </pre>
 * key() and value() return arrays owned by the caller.
 */
public interface EngineCursor extends AutoCloseable {

    /** Advance to the next entry; false once exhausted. */
    boolean next();

    byte[] key();

    byte[] value();

    @Override
    void close();
}
