package org.pragmatica.layout.fragment;

import java.util.List;

/**
 * A literal run of source text. A newline inside the text is mandatory, for example after a line comment.
 */
public final class TextFragment extends Fragment {
    private final String text;

    TextFragment(FragmentCounter counter, String text) {
        super(counter);
        this.text = text;
    }

    public String text() {
        return text;
    }

    @Override
    public void render(FragmentWriter writer, State state) {
        writer.write(text);
    }

    @Override
    public List<Fragment> children() {
        return List.of();
    }

    @Override
    protected int ownCharacters() {
        return text.length() - (int) text.chars()
                                         .filter(ch -> ch == '\n')
                                         .count();
    }

    @Override
    protected boolean hasOwnHardNewline() {
        return text.indexOf('\n') >= 0;
    }

    @Override
    public String toString() {
        return "`" + text + "`";
    }
}
