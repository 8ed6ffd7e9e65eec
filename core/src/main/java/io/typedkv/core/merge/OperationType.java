package io.typedkv.core.merge;

/** What a {@link CollectionOperation} does to the stored collection. Tags are part of the on-disk format. */
public enum OperationType {
    /** Append the items. */
    ADD((byte) 0),
    /** Remove the first occurrence of each item; absent items are ignored. */
    REMOVE((byte) 1);

    private final byte tag;

    OperationType(byte tag) {
        this.tag = tag;
    }

    public byte tag() {
        return tag;
    }

    public static OperationType fromTag(byte tag) {
        return switch (tag) {
            case 0 -> ADD;
            case 1 -> REMOVE;
            default -> throw new IllegalArgumentException("unknown operation tag: " + tag);
        };
    }
}
