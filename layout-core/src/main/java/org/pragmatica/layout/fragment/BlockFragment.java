package org.pragmatica.layout.fragment;

import java.util.List;

/**
 * A braced body of statements.
 *
 * An empty body is written as {@code {}}. A non-empty body always puts each statement on its own indented line.
 */
public final class BlockFragment extends Fragment {
    private final List<Fragment> statements;

    BlockFragment(FragmentCounter counter, List<Fragment> statements) {
        super(counter);
        this.statements = List.copyOf(statements);
    }

    @Override
    public void render(FragmentWriter writer, State state) {
        if (statements.isEmpty()) {
            writer.write("{}");
            return;
        }

        writer.write("{");
        writer.setShapeMode(ShapeMode.BLOCK);
        writer.indented(Indent.BLOCK, () -> {
            for (var statement : statements) {
                writer.newline();
                writer.render(statement, true);
            }
        });
        writer.newline();
        writer.write("}");
    }

    @Override
    public List<Fragment> children() {
        return statements;
    }

    @Override
    protected int ownCharacters() {
        return 2;
    }

    @Override
    protected boolean hasOwnHardNewline() {
        return !statements.isEmpty();
    }
}
