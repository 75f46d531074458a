package org.pragmatica.layout.fragment;

/**
 * How the writer classifies the fragment currently being written once it contains a newline.
 */
public enum ShapeMode {
    /**
     * Shape is the merge of the children's shapes. A newline written by the fragment itself makes it
     * {@link Shape#OTHER}.
     */
    MERGE,

    /**
     * Any newline makes the fragment {@link Shape#BLOCK}.
     */
    BLOCK,

    /**
     * Content written from now on belongs to the headline.
     */
    BEFORE_HEADLINE,

    /**
     * Content written from now on follows the headline. If the headline stayed on one line, the fragment is
     * {@link Shape#HEADLINE}, otherwise {@link Shape#OTHER}.
     */
    AFTER_HEADLINE,

    /**
     * Any newline makes the fragment {@link Shape#OTHER}.
     */
    OTHER
}
