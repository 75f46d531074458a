package org.pragmatica.layout.fragment;

/**
 * Output contract a fragment uses while rendering itself.
 *
 * Indentation pushes and pops must be paired on every exit path; {@link #indented(Indent, Runnable)} does that for
 * the caller.
 */
public interface FragmentWriter {
    /**
     * Write literal text at the current position. A {@code '\n'} in the text ends the line.
     */
    void write(String text);

    default void space() {
        write(" ");
    }

    /**
     * End the current line. The next line starts at the current indentation.
     */
    void newline();

    void pushIndent(Indent indent);

    void popIndent();

    /**
     * Run {@code body} with {@code indent} pushed, popping it even if {@code body} fails.
     */
    default void indented(Indent indent, Runnable body) {
        pushIndent(indent);
        try {
            body.run();
        } finally {
            popIndent();
        }
    }

    /**
     * Change how the content written from now on affects the shape of the fragment being rendered.
     */
    void setShapeMode(ShapeMode mode);

    default void render(Fragment child) {
        render(child, false);
    }

    /**
     * Render a child fragment in its resolved state.
     *
     * @param separate the child owns its lines exclusively: nothing from a sibling follows on its last line
     */
    void render(Fragment child, boolean separate);
}
