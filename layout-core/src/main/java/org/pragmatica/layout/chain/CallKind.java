package org.pragmatica.layout.chain;

/**
 * What kind of "call" a dotted step in a chain is.
 */
public enum CallKind {
    /**
     * A property access, like {@code .foo}.
     */
    PROPERTY,

    /**
     * A call with an empty argument list that cannot split, like {@code .toList()}.
     */
    UNSPLITTABLE_CALL,

    /**
     * A call with a non-empty argument list that can split but not block format.
     */
    SPLITTABLE_CALL,

    /**
     * A call with a non-empty argument list that can be block formatted.
     */
    BLOCK_FORMAT_CALL;

    public boolean canSplit() {
        return this == SPLITTABLE_CALL || this == BLOCK_FORMAT_CALL;
    }
}
