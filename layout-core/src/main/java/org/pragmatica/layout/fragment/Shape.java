package org.pragmatica.layout.fragment;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The spatial classification of a rendered fragment.
 *
 * Parents use shapes to restrict what their children may look like in a given state. For example, a chain that stays
 * on one line tolerates a block-shaped target but not one that splits in an arbitrary way.
 */
public enum Shape {
    /**
     * Fits entirely on one line.
     */
    INLINE,

    /**
     * A delimited, indented, multi-line body such as an argument list or braced block.
     */
    BLOCK,

    /**
     * One leading line followed by further lines:
     *
     * <pre>
     * target.header
     *         .method()
     *         .chain()
     * </pre>
     */
    HEADLINE,

    /**
     * Multi-line without any more specific shape.
     */
    OTHER;

    public static final Set<Shape> ALL = Collections.unmodifiableSet(EnumSet.allOf(Shape.class));
    public static final Set<Shape> ONLY_INLINE = Collections.unmodifiableSet(EnumSet.of(INLINE));
    public static final Set<Shape> ONLY_BLOCK = Collections.unmodifiableSet(EnumSet.of(BLOCK));
    public static final Set<Shape> INLINE_OR_BLOCK = Collections.unmodifiableSet(EnumSet.of(INLINE, BLOCK));

    /**
     * All shapes if {@code condition} holds, otherwise only {@link #INLINE}.
     */
    public static Set<Shape> anyIf(boolean condition) {
        return condition ? ALL : ONLY_INLINE;
    }

    /**
     * Shape of a parent whose content has this shape and {@code other}.
     *
     * {@link #INLINE} is the identity; any two non-inline shapes give {@link #OTHER}.
     */
    public Shape merge(Shape other) {
        if (this == INLINE) {
            return other;
        }
        if (other == INLINE) {
            return this;
        }
        return OTHER;
    }
}
