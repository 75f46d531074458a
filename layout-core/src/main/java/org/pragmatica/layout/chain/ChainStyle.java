package org.pragmatica.layout.chain;

/**
 * Which convention decides whether the target of an unsplit chain may contain newlines.
 */
public enum ChainStyle {
    /**
     * The target may block split while the chain stays unsplit, but never split in another shape:
     *
     * <pre>
     * List.of(
     *     element
     * ).stream();
     * </pre>
     */
    CURRENT,

    /**
     * The target may split in any way when the chain allows splitting in its target, otherwise not at all.
     */
    LEGACY
}
