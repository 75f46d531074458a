package org.pragmatica.layout.fragment;

/**
 * Kinds of indentation a fragment can push. Widths are in units of the configured indent size.
 */
public enum Indent {
    NONE(0),
    BLOCK(1),
    EXPRESSION(2),
    CASCADE(1);

    private final int units;

    Indent(int units) {
        this.units = units;
    }

    public int width(int indentSize) {
        return units * indentSize;
    }
}
